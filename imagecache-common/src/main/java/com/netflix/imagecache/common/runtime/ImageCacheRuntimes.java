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

package com.netflix.imagecache.common.runtime;

import com.netflix.imagecache.common.runtime.internal.DefaultImageCacheRuntime;
import com.netflix.imagecache.common.util.time.Clocks;
import com.netflix.imagecache.common.util.time.TestClock;
import com.netflix.spectator.api.Registry;

public final class ImageCacheRuntimes {

    private ImageCacheRuntimes() {
    }

    public static ImageCacheRuntime internal() {
        return DefaultImageCacheRuntime.newBuilder().build();
    }

    public static ImageCacheRuntime internal(Registry registry) {
        return DefaultImageCacheRuntime.newBuilder().withRegistry(registry).build();
    }

    public static ImageCacheRuntime test() {
        return DefaultImageCacheRuntime.newBuilder()
                .withClock(Clocks.test())
                .build();
    }

    public static ImageCacheRuntime test(TestClock clock) {
        return DefaultImageCacheRuntime.newBuilder()
                .withClock(clock)
                .build();
    }
}
