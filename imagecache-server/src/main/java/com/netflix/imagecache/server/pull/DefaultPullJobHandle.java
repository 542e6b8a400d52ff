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

package com.netflix.imagecache.server.pull;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import com.netflix.imagecache.api.pull.model.PullJob;
import com.netflix.imagecache.api.pull.service.PullJobHandle;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Pull job state shared by all cache policies attached to the job. A policy detaching from the job releases it
 * once no other policy remains, after which no policy can attach to it anymore.
 */
class DefaultPullJobHandle implements PullJobHandle {

    private final AtomicReference<PullJob> jobRef;
    private final Sinks.One<PullJob> completionSink = Sinks.one();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicReference<Disposable> lifecycleRef = new AtomicReference<>();

    private final Set<String> policies = new HashSet<>();
    private boolean released;

    DefaultPullJobHandle(PullJob job) {
        this.jobRef = new AtomicReference<>(job);
        this.policies.add(job.getPolicyName());
    }

    @Override
    public String getId() {
        return jobRef.get().getId();
    }

    @Override
    public PullJob getJob() {
        return jobRef.get();
    }

    @Override
    public Mono<PullJob> completion() {
        return completionSink.asMono();
    }

    boolean isFinished() {
        return finished.get();
    }

    /**
     * @return false if the job is finished or released, and cannot be shared anymore
     */
    synchronized boolean attach(String policyName) {
        if (released || finished.get()) {
            return false;
        }
        policies.add(policyName);
        return true;
    }

    /**
     * @return true if no policy is attached anymore, and the job should be abandoned by the caller
     */
    synchronized boolean detach(String policyName) {
        policies.remove(policyName);
        if (policies.isEmpty()) {
            released = true;
        }
        return released;
    }

    synchronized boolean isAttached(String policyName) {
        return policies.contains(policyName);
    }

    /**
     * Changes the job unless it is already in its terminal state.
     */
    PullJob update(UnaryOperator<PullJob> change) {
        return jobRef.updateAndGet(job -> finished.get() ? job : change.apply(job));
    }

    /**
     * The lifecycle of a job finished before it was set is disposed right away.
     */
    void setLifecycle(Disposable lifecycle) {
        lifecycleRef.set(lifecycle);
        if (finished.get()) {
            lifecycle.dispose();
        }
    }

    void cancelLifecycle() {
        Disposable lifecycle = lifecycleRef.get();
        if (lifecycle != null) {
            lifecycle.dispose();
        }
    }

    /**
     * Moves the job to its terminal state. Only the first call has an effect.
     *
     * @return false if the job was already finished
     */
    boolean finish(UnaryOperator<PullJob> terminalChange) {
        if (!finished.compareAndSet(false, true)) {
            return false;
        }
        PullJob terminal = jobRef.updateAndGet(terminalChange);
        completionSink.tryEmitValue(terminal);
        return true;
    }
}
