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

import java.util.List;
import java.util.Map;

/**
 * One {@code lsp.<serverId>} entry as written in a configuration file.
 * Every field is optional; {@code null} means "not specified by this layer".
 * Instances are populated by Gson from an already validated tree.
 */
public class ServerConfig {

    Boolean disabled;
    List<String> command;
    List<String> extensions;
    Map<String, String> env;
    JsonObject initialization;
    List<String> roots;
    List<String> excludeRoots;
    RootMode rootMode;

    public Boolean getDisabled() {
        return disabled;
    }

    public List<String> getCommand() {
        return command;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public JsonObject getInitialization() {
        return initialization;
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
}
