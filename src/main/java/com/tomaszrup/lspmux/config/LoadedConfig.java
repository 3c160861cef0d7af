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

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of one {@link LspConfigLoader#load(Path)} call.
 */
public final class LoadedConfig {

    private final NormalizedConfig config;
    private final JsonObject globalConfig;
    private final JsonObject projectConfig;
    private final Path globalPath;
    private final Path projectPath;
    private final Path projectRoot;
    private final Path workspaceRoot;
    private final List<LoadWarning> warnings;
    private final boolean trustedProject;
    private final Map<String, ServerSource> serverSource;
    private final String signature;

    LoadedConfig(NormalizedConfig config, JsonObject globalConfig, JsonObject projectConfig,
                 Path globalPath, Path projectPath, Path projectRoot, Path workspaceRoot,
                 List<LoadWarning> warnings, boolean trustedProject,
                 Map<String, ServerSource> serverSource, String signature) {
        this.config = config;
        this.globalConfig = globalConfig;
        this.projectConfig = projectConfig;
        this.globalPath = globalPath;
        this.projectPath = projectPath;
        this.projectRoot = projectRoot;
        this.workspaceRoot = workspaceRoot;
        this.warnings = Collections.unmodifiableList(warnings);
        this.trustedProject = trustedProject;
        this.serverSource = Collections.unmodifiableMap(serverSource);
        this.signature = signature;
    }

    public NormalizedConfig getConfig() {
        return config;
    }

    /** Validated global file contents (empty object when absent or invalid). */
    public JsonObject getGlobalConfig() {
        return globalConfig.deepCopy();
    }

    /** Project file contents after sanitization. */
    public JsonObject getProjectConfig() {
        return projectConfig.deepCopy();
    }

    public Path getGlobalPath() {
        return globalPath;
    }

    /** Nearest project config file, or {@code null} when there is none. */
    public Path getProjectPath() {
        return projectPath;
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public List<LoadWarning> getWarnings() {
        return warnings;
    }

    public boolean isTrustedProject() {
        return trustedProject;
    }

    /** Which file(s) configured each server id. Builtin-only ids are absent. */
    public Map<String, ServerSource> getServerSource() {
        return serverSource;
    }

    /** Hex SHA-256 over the normalized config, project path and warnings. */
    public String getSignature() {
        return signature;
    }
}
