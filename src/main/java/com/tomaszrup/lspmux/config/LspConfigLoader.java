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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads the global and nearest project {@code lsp.json}, applies the trust
 * policy and produces a {@link LoadedConfig}.
 *
 * <p>Files involved:</p>
 * <ul>
 *   <li>global: {@code <home>/.lspmux/lsp.json}</li>
 *   <li>project: nearest {@code <dir>/.lspmux/lsp.json} walking up from the
 *       working directory</li>
 * </ul>
 *
 * <p>Loading never throws. A missing file contributes nothing; an unreadable
 * or invalid file contributes nothing and adds a {@code config-parse}
 * warning.</p>
 */
public class LspConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(LspConfigLoader.class);

    public static final String CONFIG_DIR = ".lspmux";
    public static final String CONFIG_FILE = "lsp.json";

    private static final Gson GSON = new Gson();

    private final Path homeDir;
    private final TrustedRootMatcher trustedRootMatcher;

    public LspConfigLoader() {
        this(Paths.get(System.getProperty("user.home")));
    }

    public LspConfigLoader(Path homeDir) {
        this.homeDir = homeDir;
        this.trustedRootMatcher = new TrustedRootMatcher(homeDir);
    }

    public Path getHomeDir() {
        return homeDir;
    }

    public Path getGlobalConfigPath() {
        return homeDir.resolve(CONFIG_DIR).resolve(CONFIG_FILE);
    }

    public LoadedConfig load(Path cwd) {
        Path workspaceRoot = resolveWorkspaceRoot(cwd);
        Path projectPath = findNearestProjectConfig(cwd);
        Path projectRoot = projectPath != null
                ? realPathSafe(projectPath.getParent().getParent())
                : workspaceRoot;

        Path globalPath = getGlobalConfigPath();
        FileContribution global = readAndValidate(globalPath);
        FileContribution project = projectPath != null ? readAndValidate(projectPath) : FileContribution.empty();

        List<LoadWarning> warnings = new ArrayList<>();
        warnings.addAll(global.warnings);
        warnings.addAll(project.warnings);

        JsonObject globalSecurityOnly = new JsonObject();
        if (global.config.has("security")) {
            globalSecurityOnly.add("security", global.config.get("security"));
        }
        SecurityConfig globalSecurity = normalize(globalSecurityOnly).getSecurity();
        ProjectConfigPolicy policy = globalSecurity.getProjectConfigPolicy();

        boolean trustedProject;
        if (policy == ProjectConfigPolicy.ALWAYS) {
            trustedProject = true;
        } else if (policy == ProjectConfigPolicy.NEVER) {
            trustedProject = false;
        } else {
            TrustedRootMatcher.Result match = trustedRootMatcher.match(projectRoot,
                    globalSecurity.getTrustedProjectRoots());
            trustedProject = match.isTrusted();
            warnings.addAll(match.getWarnings());
            if (!trustedProject) {
                warnings.add(new LoadWarning(LoadWarning.Type.PROJECT_CONFIG_UNTRUSTED,
                        "Project config overrides are not trusted for " + projectRoot,
                        projectPath != null ? projectPath.toString() : null, null, null));
            }
        }
        boolean unsafeAllowed = policy == ProjectConfigPolicy.ALWAYS
                || (policy == ProjectConfigPolicy.TRUSTED_ONLY && trustedProject);

        JsonObject sanitizedProject = sanitizeSecurity(project.config, warnings);
        sanitizedProject = sanitizeServers(sanitizedProject, policy, unsafeAllowed, warnings);

        boolean hardDisabled = isLspFalse(global.config) || isLspFalse(project.config);

        JsonObject mergedInput = JsonMerge.deepMerge(global.config, sanitizedProject);
        if (hardDisabled) {
            JsonObject disable = new JsonObject();
            disable.addProperty("lsp", false);
            mergedInput = JsonMerge.deepMerge(mergedInput, disable);
        }

        // security settings always come from the global file
        JsonObject authoritative = new JsonObject();
        JsonObject authoritativeSecurity = new JsonObject();
        authoritativeSecurity.addProperty("projectConfigPolicy", policy.getValue());
        authoritativeSecurity.addProperty("allowExternalPaths", globalSecurity.isAllowExternalPaths());
        JsonArray roots = new JsonArray();
        globalSecurity.getTrustedProjectRoots().forEach(roots::add);
        authoritativeSecurity.add("trustedProjectRoots", roots);
        authoritative.add("security", authoritativeSecurity);
        mergedInput = JsonMerge.deepMerge(mergedInput, authoritative);

        NormalizedConfig merged = normalize(mergedInput);
        Map<String, ServerSource> serverSource = deriveServerSource(global.config, sanitizedProject);
        String signature = signature(merged, projectPath, warnings);

        if (!warnings.isEmpty()) {
            logger.debug("Loaded LSP config for {} with {} warning(s)", cwd, warnings.size());
        }
        return new LoadedConfig(merged, global.config, sanitizedProject, globalPath, projectPath,
                projectRoot, workspaceRoot, warnings, trustedProject, serverSource, signature);
    }

    // ---- discovery ----

    /**
     * Nearest ancestor of {@code cwd} (real path) holding a {@code .git} or
     * {@code .jj} entry; {@code cwd} itself when there is none.
     */
    public static Path resolveWorkspaceRoot(Path cwd) {
        Path start = realPathSafe(cwd);
        for (Path current = start; current != null; current = current.getParent()) {
            if (Files.exists(current.resolve(".git")) || Files.exists(current.resolve(".jj"))) {
                return current;
            }
        }
        return start;
    }

    public static Path findNearestProjectConfig(Path cwd) {
        for (Path current = realPathSafe(cwd); current != null; current = current.getParent()) {
            Path candidate = current.resolve(CONFIG_DIR).resolve(CONFIG_FILE);
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    static Path realPathSafe(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    // ---- reading ----

    private static final class FileContribution {
        final JsonObject config;
        final List<LoadWarning> warnings;

        FileContribution(JsonObject config, List<LoadWarning> warnings) {
            this.config = config;
            this.warnings = warnings;
        }

        static FileContribution empty() {
            return new FileContribution(new JsonObject(), Collections.emptyList());
        }
    }

    private FileContribution readAndValidate(Path path) {
        if (!Files.exists(path)) {
            return FileContribution.empty();
        }
        try {
            String raw = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            JsonElement parsed = JsonParser.parseString(raw);
            List<LspConfigValidator.Failure> failures = LspConfigValidator.validate(parsed);
            if (!failures.isEmpty()) {
                String messages = failures.stream()
                        .map(LspConfigValidator.Failure::toString)
                        .collect(Collectors.joining("; "));
                logger.warn("Invalid LSP config schema in {}: {}", path, messages);
                return new FileContribution(new JsonObject(), Collections.singletonList(
                        new LoadWarning(LoadWarning.Type.CONFIG_PARSE,
                                "Invalid LSP config schema in " + path + ": " + messages,
                                path.toString(), null, null)));
            }
            return new FileContribution(parsed.getAsJsonObject(), Collections.emptyList());
        } catch (IOException | JsonParseException e) {
            logger.warn("Failed to parse LSP config at {}: {}", path, e.getMessage());
            return new FileContribution(new JsonObject(), Collections.singletonList(
                    new LoadWarning(LoadWarning.Type.CONFIG_PARSE,
                            "Failed to parse LSP config at " + path + ": " + e.getMessage(),
                            path.toString(), null, null)));
        }
    }

    // ---- sanitization ----

    private static JsonObject sanitizeSecurity(JsonObject projectConfig, List<LoadWarning> warnings) {
        JsonObject copy = projectConfig.deepCopy();
        if (!copy.has("security")) {
            return copy;
        }
        JsonObject security = copy.getAsJsonObject("security");

        if (security.has("projectConfigPolicy")) {
            security.remove("projectConfigPolicy");
            warnings.add(new LoadWarning(LoadWarning.Type.PROJECT_SECURITY_OVERRIDE_BLOCKED,
                    "Blocked project security.projectConfigPolicy override; global policy is authoritative.",
                    null, null, "projectConfigPolicy"));
        }
        if (security.has("trustedProjectRoots")) {
            security.remove("trustedProjectRoots");
            warnings.add(new LoadWarning(LoadWarning.Type.PROJECT_SECURITY_OVERRIDE_BLOCKED,
                    "Blocked project security.trustedProjectRoots override; global trust roots are authoritative.",
                    null, null, "trustedProjectRoots"));
        }
        if (security.has("allowExternalPaths")) {
            security.remove("allowExternalPaths");
            warnings.add(new LoadWarning(LoadWarning.Type.PROJECT_SECURITY_OVERRIDE_BLOCKED,
                    "Blocked project security.allowExternalPaths override; global setting is authoritative.",
                    null, null, "allowExternalPaths"));
        }
        copy.remove("security");
        return copy;
    }

    private static JsonObject sanitizeServers(JsonObject projectConfig, ProjectConfigPolicy policy,
                                              boolean unsafeAllowed, List<LoadWarning> warnings) {
        JsonObject copy = projectConfig.deepCopy();
        if (unsafeAllowed || !copy.has("lsp") || !copy.get("lsp").isJsonObject()) {
            return copy;
        }
        for (Map.Entry<String, JsonElement> entry : copy.getAsJsonObject("lsp").entrySet()) {
            String serverId = entry.getKey();
            JsonObject server = entry.getValue().getAsJsonObject();
            for (String field : new String[] {"command", "env"}) {
                if (server.has(field)) {
                    server.remove(field);
                    warnings.add(new LoadWarning(LoadWarning.Type.PROJECT_OVERRIDE_BLOCKED,
                            "Blocked project " + field + " override for server '" + serverId
                                    + "' by policy '" + policy + "'.",
                            null, serverId, field));
                }
            }
        }
        return copy;
    }

    private static boolean isLspFalse(JsonObject config) {
        JsonElement lsp = config.get("lsp");
        return lsp != null && lsp.isJsonPrimitive() && lsp.getAsJsonPrimitive().isBoolean()
                && !lsp.getAsBoolean();
    }

    // ---- normalization ----

    private static JsonObject defaultsTree() {
        JsonObject defaults = new JsonObject();
        defaults.add("lsp", new JsonObject());

        JsonObject security = new JsonObject();
        security.addProperty("projectConfigPolicy", ProjectConfigPolicy.TRUSTED_ONLY.getValue());
        security.add("trustedProjectRoots", new JsonArray());
        security.addProperty("allowExternalPaths", false);
        defaults.add("security", security);

        JsonObject timing = new JsonObject();
        timing.addProperty("requestTimeoutMs", TimingConfig.DEFAULT_REQUEST_TIMEOUT_MS);
        timing.addProperty("diagnosticsWaitTimeoutMs", TimingConfig.DEFAULT_DIAGNOSTICS_WAIT_TIMEOUT_MS);
        timing.addProperty("initializeTimeoutMs", TimingConfig.DEFAULT_INITIALIZE_TIMEOUT_MS);
        defaults.add("timing", timing);
        return defaults;
    }

    /** Apply defaults to a validated (possibly merged) configuration tree. */
    static NormalizedConfig normalize(JsonObject config) {
        JsonObject tree = JsonMerge.deepMerge(defaultsTree(), config);

        boolean disabled = isLspFalse(tree);
        Map<String, ServerConfig> servers = new LinkedHashMap<>();
        if (!disabled) {
            for (Map.Entry<String, JsonElement> entry : tree.getAsJsonObject("lsp").entrySet()) {
                servers.put(entry.getKey(), GSON.fromJson(entry.getValue(), ServerConfig.class));
            }
        }

        JsonObject security = tree.getAsJsonObject("security");
        List<String> trustedRoots = new ArrayList<>();
        for (JsonElement root : security.getAsJsonArray("trustedProjectRoots")) {
            trustedRoots.add(root.getAsString());
        }
        SecurityConfig securityConfig = new SecurityConfig(
                ProjectConfigPolicy.fromValue(security.get("projectConfigPolicy").getAsString()),
                trustedRoots,
                security.get("allowExternalPaths").getAsBoolean());

        JsonObject timing = tree.getAsJsonObject("timing");
        TimingConfig timingConfig = new TimingConfig(
                timing.get("requestTimeoutMs").getAsLong(),
                timing.get("diagnosticsWaitTimeoutMs").getAsLong(),
                timing.get("initializeTimeoutMs").getAsLong());

        return new NormalizedConfig(disabled, servers, securityConfig, timingConfig, tree);
    }

    private static Map<String, ServerSource> deriveServerSource(JsonObject globalConfig, JsonObject projectConfig) {
        Map<String, ServerSource> sources = new LinkedHashMap<>();
        for (String serverId : serverIds(globalConfig)) {
            sources.put(serverId, ServerSource.GLOBAL);
        }
        for (String serverId : serverIds(projectConfig)) {
            sources.put(serverId, sources.containsKey(serverId) ? ServerSource.MERGED : ServerSource.PROJECT);
        }
        return sources;
    }

    private static List<String> serverIds(JsonObject config) {
        JsonElement lsp = config.get("lsp");
        if (lsp == null || !lsp.isJsonObject()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(lsp.getAsJsonObject().keySet());
    }

    // ---- signature ----

    static String signature(NormalizedConfig config, Path projectPath, List<LoadWarning> warnings) {
        JsonObject payload = new JsonObject();
        payload.add("config", config.toJson());
        payload.add("projectPath", projectPath != null
                ? new JsonPrimitive(projectPath.toString()) : null);
        JsonArray messages = new JsonArray();
        for (LoadWarning warning : warnings) {
            messages.add(warning.getMessage());
        }
        payload.add("warnings", messages);
        return sha256Hex(GSON.toJson(payload).getBytes(StandardCharsets.UTF_8));
    }

    static String sha256Hex(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(data);
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b & 0xff));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", e);
        }
    }
}
