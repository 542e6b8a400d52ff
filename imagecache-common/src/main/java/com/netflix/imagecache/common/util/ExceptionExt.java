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

package com.netflix.imagecache.common.util;

import java.util.Optional;

import org.slf4j.Logger;

public final class ExceptionExt {

    private ExceptionExt() {
    }

    @FunctionalInterface
    public interface RunnableWithExceptions {
        void run() throws Exception;
    }

    /**
     * Runs the action, logging a failure at warn level instead of propagating it. Returns the error if there was one.
     */
    public static Optional<Throwable> doCatchAndLog(RunnableWithExceptions action, Logger logger, String message, Object... args) {
        try {
            action.run();
            return Optional.empty();
        } catch (Exception e) {
            if (logger.isWarnEnabled()) {
                logger.warn("{}: {}", String.format(message, args), toMessage(e));
            }
            logger.debug("Error details", e);
            return Optional.of(e);
        }
    }

    /**
     * Returns the error message, followed by the messages of its causes.
     */
    public static String toMessageChain(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            if (sb.length() > 0) {
                sb.append(" -(cause)-> ");
            }
            sb.append(toMessage(current));
            current = current.getCause() == current ? null : current.getCause();
        }
        return sb.toString();
    }

    public static String toMessage(Throwable error) {
        return error.getClass().getSimpleName() + ": " + (error.getMessage() == null ? "<no message>" : error.getMessage());
    }
}
