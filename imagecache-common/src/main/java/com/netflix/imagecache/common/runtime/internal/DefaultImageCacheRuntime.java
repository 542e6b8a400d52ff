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

package com.netflix.imagecache.common.runtime.internal;

import javax.inject.Singleton;

import com.netflix.imagecache.common.framework.scheduler.LocalScheduler;
import com.netflix.imagecache.common.framework.scheduler.internal.DefaultLocalScheduler;
import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.util.time.Clock;
import com.netflix.imagecache.common.util.time.Clocks;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import reactor.core.scheduler.Schedulers;

@Singleton
public class DefaultImageCacheRuntime implements ImageCacheRuntime {

    private final Registry registry;
    private final Clock clock;
    private final DefaultLocalScheduler localScheduler;

    public DefaultImageCacheRuntime(Registry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        this.localScheduler = new DefaultLocalScheduler(Schedulers.boundedElastic(), registry);
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public LocalScheduler getLocalScheduler() {
        return localScheduler;
    }

    public void shutdown() {
        localScheduler.shutdown();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private Registry registry;
        private Clock clock;

        private Builder() {
        }

        public Builder withRegistry(Registry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DefaultImageCacheRuntime build() {
            if (registry == null) {
                registry = new DefaultRegistry();
            }
            if (clock == null) {
                clock = Clocks.system();
            }
            return new DefaultImageCacheRuntime(registry, clock);
        }
    }
}
