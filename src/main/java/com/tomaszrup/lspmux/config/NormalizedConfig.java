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
package com.tomaszrup.lspmux.config;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully defaulted configuration produced by {@link LspConfigLoader}.
 * When {@link #isLspDisabled()} is {@code true} the server map is empty and
 * the registry must not expose any server.
 */
public final class NormalizedConfig {

    private final boolean lspDisabled;
    private final Map<String, ServerConfig> servers;
    private final SecurityConfig security;
    private final TimingConfig timing;
    private final JsonObject tree;

    public NormalizedConfig(boolean lspDisabled, Map<String, ServerConfig> servers,
                            SecurityConfig security, TimingConfig timing, JsonObject tree) {
        this.lspDisabled = lspDisabled;
        this.servers = Collections.unmodifiableMap(new LinkedHashMap<>(servers));
        this.security = security;
        this.timing = timing;
        this.tree = tree;
    }

    public static NormalizedConfig defaults() {
        JsonObject tree = new JsonObject();
        tree.add("lsp", new JsonObject());
        return new NormalizedConfig(false, Collections.emptyMap(), SecurityConfig.defaults(),
                TimingConfig.defaults(), tree);
    }

    /** {@code true} when either configuration file declared {@code "lsp": false}. */
    public boolean isLspDisabled() {
        return lspDisabled;
    }

    public Map<String, ServerConfig> getServers() {
        return servers;
    }

    public SecurityConfig getSecurity() {
        return security;
    }

    public TimingConfig getTiming() {
        return timing;
    }

    /** The normalized JSON tree this instance was mapped from (a copy). */
    public JsonObject toJson() {
        return tree.deepCopy();
    }
}
