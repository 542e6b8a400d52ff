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

package com.netflix.imagecache.server.controller;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.netflix.imagecache.api.node.service.NodeInventory;
import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.CachePolicyStatus;
import com.netflix.imagecache.api.policy.model.DesiredImage;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.service.ImageSourceStrategy;
import com.netflix.imagecache.api.pull.model.PullJob;
import com.netflix.imagecache.api.pull.model.PullJobState;
import com.netflix.imagecache.api.pull.service.PullJobHandle;
import com.netflix.imagecache.api.pull.service.PullOrchestrator;
import com.netflix.imagecache.common.framework.scheduler.ExecutionContext;
import com.netflix.imagecache.common.framework.scheduler.ScheduleReference;
import com.netflix.imagecache.common.framework.scheduler.model.ScheduleDescriptor;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.util.Evaluators;
import com.netflix.imagecache.common.util.ExceptionExt;
import com.netflix.imagecache.common.util.ExecutorsExt;
import com.netflix.imagecache.server.MetricConstants;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Gauge;
import com.netflix.spectator.api.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically reconciles the images present on the nodes selected by a cache policy with the images its
 * strategies ask for. Missing images are pulled one at a time. Images no longer desired are left alone.
 */
public class CachePolicyController {

    private static final Logger logger = LoggerFactory.getLogger(CachePolicyController.class);

    private final CachePolicy policy;
    private final List<ImageSourceStrategy> strategies;
    private final NodeInventory nodeInventory;
    private final PullOrchestrator pullOrchestrator;
    private final CachePolicyControllerConfiguration configuration;
    private final ImageCacheRuntime runtime;

    private final String name;
    private final String metricRoot;

    private final AtomicReference<CachePolicyStatus> statusRef;
    private final Map<String, PullJob> lastFailedPulls = new ConcurrentHashMap<>();

    private final Gauge desiredGauge;
    private final Gauge availableGauge;
    private final Gauge pullingGauge;
    private final Gauge targetNodesGauge;
    private final Counter sourceErrorCounter;
    private final Counter failedPullCounter;
    private final Counter reconcileErrorCounter;

    private volatile boolean shutdown;
    private ExecutorService executorService;
    private ScheduleReference scheduleRef;

    public CachePolicyController(CachePolicy policy,
                                 List<ImageSourceStrategy> strategies,
                                 NodeInventory nodeInventory,
                                 PullOrchestrator pullOrchestrator,
                                 CachePolicyControllerConfiguration configuration,
                                 ImageCacheRuntime runtime) {
        this.policy = policy;
        this.strategies = strategies;
        this.nodeInventory = nodeInventory;
        this.pullOrchestrator = pullOrchestrator;
        this.configuration = configuration;
        this.runtime = runtime;

        this.name = "cachePolicy-" + policy.getName();
        this.metricRoot = MetricConstants.METRIC_CONTROLLER + "images";
        this.statusRef = new AtomicReference<>(CachePolicyStatus.initial(policy.getName(), policy.getLabelSelector()));

        Registry registry = runtime.getRegistry();
        this.desiredGauge = registry.gauge(metricRoot, "policy", policy.getName(), "type", "desired");
        this.availableGauge = registry.gauge(metricRoot, "policy", policy.getName(), "type", "available");
        this.pullingGauge = registry.gauge(metricRoot, "policy", policy.getName(), "type", "pulling");
        this.targetNodesGauge = registry.gauge(MetricConstants.METRIC_CONTROLLER + "targetNodes", "policy", policy.getName());
        this.sourceErrorCounter = registry.counter(MetricConstants.METRIC_CONTROLLER + "sourceErrors", "policy", policy.getName());
        this.failedPullCounter = registry.counter(MetricConstants.METRIC_CONTROLLER + "failedPulls", "policy", policy.getName());
        this.reconcileErrorCounter = registry.counter(MetricConstants.METRIC_CONTROLLER + "reconcileErrors", "policy", policy.getName());
    }

    public void start() {
        ScheduleDescriptor descriptor = ScheduleDescriptor.newBuilder()
                .withName(name)
                .withDescription("Image cache reconciliation of policy " + policy.getName())
                .withInitialDelay(Duration.ofMillis(configuration.getControllerInitialDelayMs()))
                .withInterval(Duration.ofMillis(configuration.getControllerIntervalMs()))
                .withTimeout(Duration.ofMillis(configuration.getControllerTimeoutMs()))
                .withOnErrorHandler((context, error) -> {
                    reconcileErrorCounter.increment();
                    logger.error("[{}] Reconciliation iteration {} failed", policy.getName(), context.getIteration(), error);
                })
                .build();

        executorService = ExecutorsExt.namedSingleThreadExecutor(name);
        scheduleRef = runtime.getLocalScheduler().schedule(descriptor, this::doReconcile, executorService);
        logger.info("Started controller for cache policy {}: scheduleId={}", policy.getName(), scheduleRef.getId());
    }

    /**
     * Stops the reconciliation loop and abandons the in-flight pulls of this policy.
     */
    public void shutdown() {
        shutdown = true;
        Evaluators.acceptNotNull(scheduleRef, ScheduleReference::close);
        Evaluators.acceptNotNull(executorService, ExecutorService::shutdown);
        ExceptionExt.doCatchAndLog(() -> pullOrchestrator.abandon(policy.getName()), logger, "Cannot abandon pulls of policy %s", policy.getName());
        resetGauges();
        logger.info("Stopped controller for cache policy {}", policy.getName());
    }

    public CachePolicy getPolicy() {
        return policy;
    }

    /**
     * The last published status, with the pulls read live from the orchestrator, so the progress of a pull
     * in flight is visible.
     */
    public CachePolicyStatus getStatus() {
        return statusRef.get().toBuilder().withPulling(currentPulls()).build();
    }

    private void doReconcile(ExecutionContext context) {
        if (!configuration.isControllerEnabled()) {
            logger.info("Skipping reconciliation iteration {} of cache policy {}: controllers disabled", context.getIteration(), policy.getName());
            return;
        }
        context.getPreviousError().ifPresent(error ->
                logger.info("[{}] Reconciling again after the failure of the previous iteration: {}", policy.getName(), ExceptionExt.toMessage(error))
        );
        reconcile();
    }

    @VisibleForTesting
    void reconcile() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        LabelSelector labelSelector = policy.getLabelSelector();

        Map<String, String> sourceErrors = new LinkedHashMap<>();
        List<DesiredImage> desired = resolveDesired(sourceErrors);
        lastFailedPulls.keySet().retainAll(desired.stream().map(DesiredImage::getImageReference).collect(Collectors.toSet()));

        ExceptionExt.doCatchAndLog(nodeInventory::refresh, logger, "[%s] Node inventory refresh failed; using the previous snapshot", policy.getName());
        publish(desired, sourceErrors, false);

        int pulls = 0;
        for (DesiredImage image : desired) {
            if (shutdown) {
                return;
            }
            Set<String> common = nodeInventory.imagesAvailableFor(labelSelector);
            if (isAvailable(image, common)) {
                continue;
            }
            int targetNodeCount = nodeInventory.getTargetNodes(labelSelector).size();
            if (targetNodeCount == 0) {
                logger.debug("[{}] No nodes match the policy selector; not pulling {}", policy.getName(), image.getImageReference());
                continue;
            }

            PullJobHandle handle = pullOrchestrator.ensurePulled(policy.getName(), image.getImageReference(), labelSelector, targetNodeCount);
            lastFailedPulls.remove(image.getImageReference());
            publish(desired, sourceErrors, false);
            pulls++;

            PullJob result;
            try {
                result = handle.completion().block();
            } catch (RuntimeException e) {
                logger.warn("[{}] Interrupted while waiting for pull of {}: {}", policy.getName(), image.getImageReference(), ExceptionExt.toMessage(e));
                return;
            }
            if (result != null && result.getState() == PullJobState.Failed) {
                failedPullCounter.increment();
                lastFailedPulls.put(image.getImageReference(), result);
            }
            publish(desired, sourceErrors, false);
        }

        CachePolicyStatus status = publish(desired, sourceErrors, true);
        logger.info("[{}] Reconciliation finished in {}ms: desired={}, available={}, pulled={}, failedPulls={}, sourceErrors={}",
                policy.getName(), stopwatch.elapsed().toMillis(), status.getDesired().size(), status.getAvailable().size(),
                pulls, lastFailedPulls.size(), sourceErrors.keySet());
    }

    private List<DesiredImage> resolveDesired(Map<String, String> sourceErrors) {
        Map<String, DesiredImage> byReference = new LinkedHashMap<>();
        for (ImageSourceStrategy strategy : strategies) {
            try {
                for (DesiredImage image : strategy.resolve()) {
                    byReference.putIfAbsent(image.getImageReference(), image);
                }
            } catch (RuntimeException e) {
                sourceErrorCounter.increment();
                sourceErrors.put(strategy.getName(), e.getMessage());
                logger.warn("[{}] Image source {} skipped in this iteration: {}", policy.getName(), strategy.getName(), ExceptionExt.toMessageChain(e));
            }
        }
        return new ArrayList<>(byReference.values());
    }

    private CachePolicyStatus publish(List<DesiredImage> desired, Map<String, String> sourceErrors, boolean reconciled) {
        LabelSelector labelSelector = policy.getLabelSelector();
        Set<String> common = nodeInventory.imagesAvailableFor(labelSelector);
        int targetNodeCount = nodeInventory.getTargetNodes(labelSelector).size();

        List<DesiredImage> available = desired.stream().filter(image -> isAvailable(image, common)).collect(Collectors.toList());

        List<PullJob> pulling = currentPulls();

        CachePolicyStatus previous = statusRef.get();
        CachePolicyStatus status = CachePolicyStatus.newBuilder()
                .withPolicyName(policy.getName())
                .withLabelSelector(labelSelector)
                .withDesired(desired)
                .withPulling(pulling)
                .withAvailable(available)
                .withCommonImages(common)
                .withTargetNodeCount(targetNodeCount)
                .withSourceErrors(sourceErrors)
                .withLastReconciledTimestamp(reconciled ? runtime.getClock().wallTime() : previous.getLastReconciledTimestamp())
                .build();
        statusRef.set(status);

        desiredGauge.set(desired.size());
        availableGauge.set(available.size());
        pullingGauge.set(pulling.stream().filter(job -> job.getState() != PullJobState.Failed).count());
        targetNodesGauge.set(targetNodeCount);
        return status;
    }

    /**
     * Active pulls of the policy, followed by the failed pulls not retried yet.
     */
    private List<PullJob> currentPulls() {
        List<PullJob> pulling = new ArrayList<>(pullOrchestrator.getActivePulls(policy.getName()));
        Set<String> activeImages = pulling.stream().map(PullJob::getImageReference).collect(Collectors.toSet());
        lastFailedPulls.values().stream()
                .filter(job -> !activeImages.contains(job.getImageReference()))
                .forEach(pulling::add);
        return pulling;
    }

    /**
     * An image is available if every targeted node has it, and if its digest is known, has that exact content.
     */
    @VisibleForTesting
    static boolean isAvailable(DesiredImage image, Set<String> commonImages) {
        if (!commonImages.contains(image.getImageReference())) {
            return false;
        }
        return image.getDigestReference().map(commonImages::contains).orElse(true);
    }

    private void resetGauges() {
        desiredGauge.set(0);
        availableGauge.set(0);
        pullingGauge.set(0);
        targetNodesGauge.set(0);
    }
}
