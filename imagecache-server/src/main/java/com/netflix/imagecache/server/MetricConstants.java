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

package com.netflix.imagecache.server;

/**
 * Set of metric related constants that establish consistent naming convention.
 */
public class MetricConstants {

    public static final String METRIC_ROOT = "imagecache.";

    public static final String METRIC_CONTROLLER = METRIC_ROOT + "controller.";

    public static final String METRIC_PULL = METRIC_ROOT + "pull.";

    public static final String METRIC_INVENTORY = METRIC_ROOT + "inventory.";

    public static final String METRIC_SOURCE = METRIC_ROOT + "source.";

    public static final String METRIC_KUBERNETES = METRIC_ROOT + "kubernetes.";
}
