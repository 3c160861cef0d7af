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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmux.config.JsonMerge;
import com.tomaszrup.lspmux.config.LoadedConfig;
import com.tomaszrup.lspmux.config.RootMode;
import com.tomaszrup.lspmux.config.ServerConfig;
import com.tomaszrup.lspmux.config.ServerSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Server definitions keyed by id, built from the builtin catalog and a
 * {@link LoadedConfig}.
 */
public final class ServerRegistry {

    private static final Gson GSON = new Gson();

    private final Map<String, ServerDefinition> servers;

    private ServerRegistry(Map<String, ServerDefinition> servers) {
        this.servers = Collections.unmodifiableMap(servers);
    }

    public static ServerRegistry empty() {
        return new ServerRegistry(new LinkedHashMap<>());
    }

    /**
     * Builtin entries are deep-merged with the configured entry of the same
     * id (objects merge key by key, arrays and scalars replace). An empty
     * registry is returned when configuration disables LSP entirely.
     */
    public static ServerRegistry build(LoadedConfig loaded, BuiltinServerCatalog catalog) {
        Map<String, ServerDefinition> servers = new LinkedHashMap<>();
        if (loaded.getConfig().isLspDisabled()) {
            return new ServerRegistry(servers);
        }

        JsonObject mergedServers = loaded.getConfig().toJson().getAsJsonObject("lsp");
        Set<String> globalIds = serverIds(loaded.getGlobalConfig());
        Set<String> projectIds = serverIds(loaded.getProjectConfig());

        Set<String> allIds = new LinkedHashSet<>(catalog.ids());
        allIds.addAll(mergedServers.keySet());

        for (String serverId : allIds) {
            JsonObject builtin = catalog.get(serverId);
            JsonObject configured = mergedServers.has(serverId)
                    ? mergedServers.getAsJsonObject(serverId) : null;
            JsonObject merged = JsonMerge.deepMerge(builtin, configured);
            ServerConfig server = GSON.fromJson(merged, ServerConfig.class);

            List<String> extensions = normalizeExtensions(server.getExtensions());
            boolean customWithoutExtensions = builtin == null && extensions.isEmpty();

            ServerSource provenance = deriveProvenance(serverId, builtin != null, globalIds, projectIds,
                    loaded.getServerSource().get(serverId));

            servers.put(serverId, new ServerDefinition(
                    serverId,
                    Boolean.TRUE.equals(server.getDisabled()) || customWithoutExtensions,
                    provenance,
                    copy(server.getCommand()),
                    extensions,
                    server.getEnv() != null ? server.getEnv() : Collections.emptyMap(),
                    server.getInitialization() != null ? server.getInitialization() : new JsonObject(),
                    copy(server.getRoots()),
                    copy(server.getExcludeRoots()),
                    server.getRootMode() != null ? server.getRootMode() : RootMode.WORKSPACE_OR_MARKER));
        }
        return new ServerRegistry(servers);
    }

    private static ServerSource deriveProvenance(String serverId, boolean hasBuiltin, Set<String> globalIds,
                                                 Set<String> projectIds, ServerSource configuredSource) {
        boolean hasGlobal = globalIds.contains(serverId);
        boolean hasProject = projectIds.contains(serverId);

        if (hasBuiltin) {
            return hasGlobal || hasProject ? ServerSource.MERGED : ServerSource.BUILTIN;
        }
        if (configuredSource != null) {
            return configuredSource;
        }
        if (hasGlobal && hasProject) {
            return ServerSource.MERGED;
        }
        return hasProject ? ServerSource.PROJECT : ServerSource.GLOBAL;
    }

    private static Set<String> serverIds(JsonObject config) {
        JsonElement lsp = config.get("lsp");
        if (lsp == null || !lsp.isJsonObject()) {
            return Collections.emptySet();
        }
        return lsp.getAsJsonObject().keySet();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    /** Trimmed, lower-case, with a leading dot; blank input yields {@code ""}. */
    public static String normalizeExtension(String extension) {
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    static List<String> normalizeExtensions(List<String> extensions) {
        List<String> normalized = new ArrayList<>();
        if (extensions == null) {
            return normalized;
        }
        for (String extension : extensions) {
            String value = normalizeExtension(extension);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return normalized;
    }

    /** Extension of the file name including the dot, or {@code ""}. */
    public static String extensionOf(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return normalizeExtension(name.substring(dot));
    }

    /**
     * Enabled servers whose extension list contains the file's extension.
     */
    public List<ServerDefinition> candidatesFor(Path file) {
        String extension = extensionOf(file);
        List<ServerDefinition> matches = new ArrayList<>();
        if (extension.isEmpty()) {
            return matches;
        }
        for (ServerDefinition server : servers.values()) {
            if (!server.isDisabled() && server.getExtensions().contains(extension)) {
                matches.add(server);
            }
        }
        return matches;
    }

    public ServerDefinition get(String serverId) {
        return servers.get(serverId);
    }

    public boolean contains(String serverId) {
        return servers.containsKey(serverId);
    }

    public Collection<ServerDefinition> all() {
        return servers.values();
    }

    public Map<String, ServerDefinition> asMap() {
        return servers;
    }

    public boolean isEmpty() {
        return servers.isEmpty();
    }
}
