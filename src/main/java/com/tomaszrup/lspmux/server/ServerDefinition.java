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

import com.google.gson.JsonObject;
import com.tomaszrup.lspmux.config.RootMode;
import com.tomaszrup.lspmux.config.ServerSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Effective definition of one language server after merging the builtin
 * catalog with configuration. Immutable; rebuilt on every configuration change.
 */
public final class ServerDefinition {

    private final String id;
    private final boolean disabled;
    private final ServerSource provenance;
    private final List<String> command;
    private final List<String> extensions;
    private final Map<String, String> env;
    private final JsonObject initOptions;
    private final List<String> roots;
    private final List<String> excludeRoots;
    private final RootMode rootMode;

    public ServerDefinition(String id, boolean disabled, ServerSource provenance, List<String> command,
                            List<String> extensions, Map<String, String> env, JsonObject initOptions,
                            List<String> roots, List<String> excludeRoots, RootMode rootMode) {
        this.id = id;
        this.disabled = disabled;
        this.provenance = provenance;
        this.command = Collections.unmodifiableList(command);
        this.extensions = Collections.unmodifiableList(extensions);
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(env));
        this.initOptions = initOptions;
        this.roots = Collections.unmodifiableList(roots);
        this.excludeRoots = Collections.unmodifiableList(excludeRoots);
        this.rootMode = rootMode;
    }

    public String getId() {
        return id;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public ServerSource getProvenance() {
        return provenance;
    }

    /** Launch command; empty when none is configured. */
    public List<String> getCommand() {
        return command;
    }

    /** Lower-case extensions with a leading dot. */
    public List<String> getExtensions() {
        return extensions;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    /** {@code initializationOptions} sent to the server (a copy). */
    public JsonObject getInitOptions() {
        return initOptions.deepCopy();
    }

    public List<String> getRoots() {
        return roots;
    }

    public List<String> getExcludeRoots() {
        return excludeRoots;
    }

    public RootMode getRootMode() {
        return rootMode;
    }

    @Override
    public String toString() {
        return "ServerDefinition{" + id + ", " + provenance + (disabled ? ", disabled" : "") + "}";
    }
}
