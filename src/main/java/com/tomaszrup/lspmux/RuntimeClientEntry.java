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
package com.tomaszrup.lspmux;

import com.tomaszrup.lspmux.client.LspClient;
import com.tomaszrup.lspmux.server.ServerDefinition;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * A live, initialized client owned by the runtime.
 */
public final class RuntimeClientEntry {

    private final String key;
    private final ServerDefinition server;
    private final Path root;
    private final LspClient client;
    private final List<String> command;
    private volatile long lastSeenAt;

    RuntimeClientEntry(String key, ServerDefinition server, Path root, LspClient client,
                       List<String> command, long lastSeenAt) {
        this.key = key;
        this.server = server;
        this.root = root;
        this.client = client;
        this.command = Collections.unmodifiableList(command);
        this.lastSeenAt = lastSeenAt;
    }

    public String getKey() {
        return key;
    }

    public String getServerId() {
        return server.getId();
    }

    public ServerDefinition getServer() {
        return server;
    }

    public Path getRoot() {
        return root;
    }

    public LspClient getClient() {
        return client;
    }

    /** The command actually launched (after binary resolution). */
    public List<String> getCommand() {
        return command;
    }

    public long getLastSeenAt() {
        return lastSeenAt;
    }

    void touch(long nowMs) {
        this.lastSeenAt = nowMs;
    }
}
