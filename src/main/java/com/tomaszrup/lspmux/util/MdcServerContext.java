////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmux.util;

import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Map;

/**
 * Manages the SLF4J MDC key {@code "server"} so that log lines emitted on
 * behalf of a language server carry a short {@code <serverId>@<root>} label.
 *
 * <pre>{@code
 * MdcServerContext.setServer("gopls", root);
 * try {
 *     // ... log calls include [gopls@my-module]
 * } finally {
 *     MdcServerContext.clear();
 * }
 * }</pre>
 *
 * <p>Use {@link #wrap(Runnable)} to carry the caller's MDC into another thread.</p>
 */
public final class MdcServerContext {

    /** MDC key used in the logback pattern via {@code %X{server}}. */
    public static final String MDC_KEY = "server";

    private MdcServerContext() {
        // utility class
    }

    /**
     * Sets the MDC key to {@code serverId@label}, where the label is the last
     * segment of {@code root}.
     */
    public static void setServer(String serverId, Path root) {
        MDC.put(MDC_KEY, label(serverId, root));
    }

    public static String label(String serverId, Path root) {
        if (root == null) {
            return serverId;
        }
        Path fileName = root.getFileName();
        return serverId + "@" + (fileName != null ? fileName.toString() : root.toString());
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the current thread's MDC context is
     * captured and restored in the executing thread. The executing thread's
     * own MDC is put back afterwards.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }
}
