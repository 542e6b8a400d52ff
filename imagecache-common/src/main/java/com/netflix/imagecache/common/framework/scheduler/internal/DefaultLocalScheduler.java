/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.imagecache.common.framework.scheduler.internal;

import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import com.netflix.imagecache.common.framework.scheduler.ExecutionContext;
import com.netflix.imagecache.common.framework.scheduler.LocalScheduler;
import com.netflix.imagecache.common.framework.scheduler.LocalSchedulerException;
import com.netflix.imagecache.common.framework.scheduler.ScheduleReference;
import com.netflix.imagecache.common.framework.scheduler.model.ScheduleDescriptor;
import com.netflix.spectator.api.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class DefaultLocalScheduler implements LocalScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultLocalScheduler.class);

    private final Scheduler scheduler;
    private final Scheduler.Worker worker;
    private final Registry registry;

    private final ConcurrentMap<String, ScheduleHolder> activeHoldersById = new ConcurrentHashMap<>();

    /**
     * @param scheduler scheduler used for the schedule timers and the action timeouts
     */
    public DefaultLocalScheduler(Scheduler scheduler, Registry registry) {
        this.scheduler = scheduler;
        this.worker = scheduler.createWorker();
        this.registry = registry;
    }

    public void shutdown() {
        new ArrayList<>(activeHoldersById.values()).forEach(ScheduleHolder::cancel);
        worker.dispose();
    }

    @Override
    public ScheduleReference schedule(ScheduleDescriptor descriptor, Consumer<ExecutionContext> action, ExecutorService executorService) {
        String scheduleId = UUID.randomUUID().toString();
        ScheduleHolder holder = new ScheduleHolder(scheduleId, descriptor, action, Schedulers.fromExecutorService(executorService));
        activeHoldersById.put(scheduleId, holder);
        holder.start();

        logger.info("New schedule added: name={}, id={}, interval={}ms", descriptor.getName(), scheduleId, descriptor.getInterval().toMillis());
        return holder.getReference();
    }

    private class ScheduleHolder {

        private final String id;
        private final ScheduleDescriptor descriptor;
        private final Consumer<ExecutionContext> action;
        private final Scheduler actionScheduler;
        private final ScheduleMetrics metrics;
        private final ScheduleReference reference;

        private final AtomicLong completedIterations = new AtomicLong();

        private volatile Disposable pending;
        private volatile Throwable lastError;
        private volatile boolean closed;

        private ScheduleHolder(String id,
                               ScheduleDescriptor descriptor,
                               Consumer<ExecutionContext> action,
                               Scheduler actionScheduler) {
            this.id = id;
            this.descriptor = descriptor;
            this.action = action;
            this.actionScheduler = actionScheduler;
            this.metrics = new ScheduleMetrics(descriptor, registry);
            this.reference = new ScheduleReference() {
                @Override
                public String getId() {
                    return id;
                }

                @Override
                public long getCompletedIterations() {
                    return completedIterations.get();
                }

                @Override
                public Optional<Throwable> getLastError() {
                    return Optional.ofNullable(lastError);
                }

                @Override
                public boolean isClosed() {
                    return closed;
                }

                @Override
                public void close() {
                    cancel();
                }
            };
        }

        private ScheduleReference getReference() {
            return reference;
        }

        private void start() {
            pending = worker.schedule(this::runAction, descriptor.getInitialDelay().toMillis(), TimeUnit.MILLISECONDS);
        }

        private void runAction() {
            if (closed) {
                return;
            }
            ExecutionContext context = ExecutionContext.newBuilder()
                    .withIteration(completedIterations.get() + 1)
                    .withPreviousError(lastError)
                    .build();

            metrics.onStart();
            pending = Mono.<Void>fromRunnable(() -> action.accept(context))
                    .subscribeOn(actionScheduler)
                    .timeout(descriptor.getTimeout(), scheduler)
                    .onErrorMap(TimeoutException.class, e -> LocalSchedulerException.timeout(descriptor.getName(), descriptor.getTimeout().toMillis()))
                    .subscribe(
                            next -> {
                            },
                            error -> onCompleted(context, error),
                            () -> onCompleted(context, null)
                    );
        }

        private void onCompleted(ExecutionContext context, Throwable error) {
            this.lastError = error;
            metrics.onCompleted(error == null);
            try {
                if (error != null) {
                    logger.warn("Scheduled action failed: name={}, iteration={}, error={}", descriptor.getName(), context.getIteration(), error.getMessage());
                    logger.debug("Scheduled action error details", error);
                    descriptor.getOnErrorHandler().accept(context, error);
                }
            } catch (Exception e) {
                logger.warn("Schedule completion handler failed: name={}", descriptor.getName(), e);
            }
            completedIterations.incrementAndGet();
            if (!closed) {
                pending = worker.schedule(this::runAction, descriptor.getInterval().toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        private void cancel() {
            if (closed) {
                return;
            }
            closed = true;
            Disposable current = pending;
            if (current != null) {
                current.dispose();
            }
            activeHoldersById.remove(id);
            metrics.onScheduleRemoved();
            logger.info("Schedule removed: name={}, id={}", descriptor.getName(), id);
        }
    }
}
