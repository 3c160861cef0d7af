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

import com.tomaszrup.lspmux.LspErrorCode;
import com.tomaszrup.lspmux.LspException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Resolves a server's binary (installing it when allowed) and launches it.
 * Every failure is reported as an {@link LspErrorCode#ESPAWN} {@link LspException}.
 */
public class ServerProcessSpawner {

    private static final Logger logger = LoggerFactory.getLogger(ServerProcessSpawner.class);

    private final BuiltinServerCatalog catalog;
    private final BinaryResolver binaryResolver;
    private final AutoInstaller autoInstaller;
    private final ProcessLauncher launcher;
    private final Executor executor;

    public ServerProcessSpawner(BuiltinServerCatalog catalog, BinaryResolver binaryResolver,
                                AutoInstaller autoInstaller, ProcessLauncher launcher, Executor executor) {
        this.catalog = catalog;
        this.binaryResolver = binaryResolver;
        this.autoInstaller = autoInstaller;
        this.launcher = launcher;
        this.executor = executor;
    }

    public AutoInstaller getAutoInstaller() {
        return autoInstaller;
    }

    /** Base environment overlaid by the server's {@code env}. */
    public static Map<String, String> buildSpawnEnv(ServerDefinition server, Map<String, String> baseEnv) {
        Map<String, String> env = new LinkedHashMap<>(baseEnv);
        env.putAll(server.getEnv());
        return env;
    }

    public CompletableFuture<SpawnedProcess> spawn(ServerDefinition server, Path root, Map<String, String> baseEnv) {
        Map<String, String> env = buildSpawnEnv(server, baseEnv);
        String rootText = root.toString();

        if (server.getCommand().isEmpty()) {
            return CompletableFuture.failedFuture(new LspException(LspErrorCode.ESPAWN,
                    "No command configured for LSP server '" + server.getId() + "'.",
                    server.getId(), rootText, null, null, null, null));
        }

        return resolveCommand(server, rootText, env)
                .thenApplyAsync(command -> launch(server, root, command, env), executor);
    }

    CompletableFuture<List<String>> resolveCommand(ServerDefinition server, String root, Map<String, String> env) {
        List<String> command = new ArrayList<>(server.getCommand());
        String binary = command.get(0);
        if (binaryResolver.resolve(binary, env) != null) {
            return CompletableFuture.completedFuture(command);
        }

        boolean autoInstallOff = AutoInstaller.isDisabled(env);
        boolean attemptInstall = catalog.isDefaultCommand(server.getId(), command) && !autoInstallOff
                && autoInstaller.hasStrategy(server.getId());
        if (!attemptInstall) {
            return CompletableFuture.failedFuture(
                    missingBinary(server.getId(), root, command, false, autoInstallOff));
        }

        return autoInstaller.ensureInstalled(server.getId(), env).thenApply(installed -> {
            if (installed != null) {
                List<String> resolved = new ArrayList<>(command);
                resolved.set(0, installed.toString());
                return resolved;
            }
            if (binaryResolver.resolve(binary, env) != null) {
                return command;
            }
            throw missingBinary(server.getId(), root, command, true, false);
        });
    }

    private SpawnedProcess launch(ServerDefinition server, Path root, List<String> command, Map<String, String> env) {
        try {
            Process process = launcher.start(command, root, env);
            logger.info("Started LSP server '{}' for {}: {}", server.getId(), root, command);
            return new SpawnedProcess(process, command);
        } catch (IOException | RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("name", e.getClass().getName());
            throw new CompletionException(new LspException(LspErrorCode.ESPAWN,
                    "Failed to spawn " + server.getId() + ": " + e.getMessage(),
                    server.getId(), root.toString(), command, details, null, e));
        }
    }

    private static LspException missingBinary(String serverId, String root, List<String> command,
                                              boolean autoInstallAttempted, boolean autoInstallDisabled) {
        String binary = command.isEmpty() ? "<unknown>" : command.get(0);
        String hint;
        if (autoInstallDisabled) {
            hint = "Auto-install is disabled (" + String.join(" or ", AutoInstaller.DISABLE_ENV_VARS) + ").";
        } else if (autoInstallAttempted) {
            hint = "Attempted auto-install but binary is still unavailable.";
        } else {
            hint = "No auto-install strategy is available for this server.";
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("binary", binary);
        details.put("command", command);
        details.put("autoInstallAttempted", autoInstallAttempted);
        details.put("autoInstallDisabled", autoInstallDisabled);
        return new LspException(LspErrorCode.ESPAWN,
                "Missing LSP binary '" + binary + "' for server '" + serverId + "'. " + hint,
                serverId, root, command, details, null, null);
    }
}
