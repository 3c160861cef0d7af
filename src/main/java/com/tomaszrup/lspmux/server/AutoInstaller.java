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

import com.tomaszrup.lspmux.util.StreamGobbler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Installs npm-backed builtin servers into the managed binary directory.
 * Concurrent requests for the same server id share one install.
 */
public class AutoInstaller {

    private static final Logger logger = LoggerFactory.getLogger(AutoInstaller.class);

    public static final List<String> DISABLE_ENV_VARS =
            Arrays.asList("LSPMUX_DISABLE_AUTO_INSTALL", "LSP_DISABLE_AUTO_INSTALL");

    static final long INSTALL_TIMEOUT_MINUTES = 5;
    private static final int STDERR_TAIL_CHARS = 4000;

    private final BuiltinServerCatalog catalog;
    private final BinaryResolver binaryResolver;
    private final ProcessLauncher launcher;
    private final Executor executor;
    private final Map<String, CompletableFuture<Path>> inFlight = new ConcurrentHashMap<>();

    public AutoInstaller(BuiltinServerCatalog catalog, BinaryResolver binaryResolver,
                         ProcessLauncher launcher, Executor executor) {
        this.catalog = catalog;
        this.binaryResolver = binaryResolver;
        this.launcher = launcher;
        this.executor = executor;
    }

    public static boolean isDisabled(Map<String, String> env) {
        for (String key : DISABLE_ENV_VARS) {
            if (isTruthy(env.get(key))) {
                return true;
            }
        }
        return false;
    }

    static boolean isTruthy(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("1") || normalized.equals("true")
                || normalized.equals("yes") || normalized.equals("on");
    }

    public boolean hasStrategy(String serverId) {
        return catalog.getNpmInstallSpec(serverId) != null;
    }

    /**
     * Install the server's packages unless already present.
     *
     * @return future of the installed binary, completing with {@code null}
     *         when installation is impossible or failed; never exceptional
     */
    public CompletableFuture<Path> ensureInstalled(String serverId, Map<String, String> env) {
        if (!hasStrategy(serverId)) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Path> created = new CompletableFuture<>();
        CompletableFuture<Path> existing = inFlight.putIfAbsent(serverId, created);
        if (existing != null) {
            return existing;
        }

        CompletableFuture.supplyAsync(() -> install(serverId, env), executor)
                .whenComplete((binary, error) -> {
                    inFlight.remove(serverId, created);
                    if (error != null) {
                        logger.warn("Auto-install of '{}' failed: {}", serverId, error.getMessage());
                        created.complete(null);
                    } else {
                        created.complete(binary);
                    }
                });
        return created;
    }

    /** Forget in-flight installs so the next request starts afresh. */
    public void clear() {
        inFlight.clear();
    }

    private Path install(String serverId, Map<String, String> env) {
        BuiltinServerCatalog.NpmInstallSpec spec = catalog.getNpmInstallSpec(serverId);
        Path cachedBinary = binaryResolver.managedNodeBin(spec.getBinary());
        if (binaryResolver.isExecutableFile(cachedBinary)) {
            return cachedBinary;
        }

        Path npm = binaryResolver.resolve("npm", env);
        if (npm == null) {
            logger.info("npm not found; cannot auto-install '{}'", serverId);
            return null;
        }

        Path binDir = binaryResolver.getManagedBinDir();
        List<String> command = new ArrayList<>(Arrays.asList(
                npm.toString(), "install", "--prefix", binDir.toString(), "--no-audit", "--no-fund"));
        command.addAll(spec.getPackages());

        logger.info("Auto-installing {} into {}", spec.getPackages(), binDir);
        try {
            Files.createDirectories(binDir);
            runCommand(command, binDir, env);
        } catch (IOException e) {
            throw new IllegalStateException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while installing " + serverId, e);
        }
        return binaryResolver.isExecutableFile(cachedBinary) ? cachedBinary : null;
    }

    private void runCommand(List<String> command, Path cwd, Map<String, String> env)
            throws IOException, InterruptedException {
        Process process = launcher.start(command, cwd, env);
        process.getOutputStream().close();
        StreamGobbler stdout = new StreamGobbler(process.getInputStream(), "lspmux-install-out", 0);
        StreamGobbler stderr = new StreamGobbler(process.getErrorStream(), "lspmux-install-err", STDERR_TAIL_CHARS);
        stdout.start();
        stderr.start();

        if (!process.waitFor(INSTALL_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
            process.destroyForcibly();
            throw new IOException("Command timed out after " + INSTALL_TIMEOUT_MINUTES + " minutes: "
                    + String.join(" ", command));
        }
        stderr.join(1000);
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String tail = stderr.getOutput().trim();
            throw new IOException("Command failed (" + exitCode + "): " + String.join(" ", command)
                    + (tail.isEmpty() ? "" : "\n" + tail));
        }
    }
}
