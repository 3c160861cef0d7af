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
package com.tomaszrup.lspmux.server;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Starts child processes. The default implementation uses {@link ProcessBuilder};
 * tests substitute in-memory processes.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * @param command full command line, binary first
     * @param cwd     working directory
     * @param env     complete environment of the child
     */
    Process start(List<String> command, Path cwd, Map<String, String> env) throws IOException;

    static ProcessLauncher system() {
        return (command, cwd, env) -> {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(cwd.toFile());
            builder.environment().clear();
            builder.environment().putAll(env);
            return builder.start();
        };
    }
}
