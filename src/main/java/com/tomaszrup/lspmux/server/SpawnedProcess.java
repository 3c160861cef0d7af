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

import java.util.Collections;
import java.util.List;

/** A started server process and the command that launched it. */
public final class SpawnedProcess {

    private final Process process;
    private final List<String> command;

    public SpawnedProcess(Process process, List<String> command) {
        this.process = process;
        this.command = Collections.unmodifiableList(command);
    }

    public Process getProcess() {
        return process;
    }

    public List<String> getCommand() {
        return command;
    }
}
