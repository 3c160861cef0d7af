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

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.tomaszrup.lspmux.client.AbortSignal;
import com.tomaszrup.lspmux.client.LspClient;
import com.tomaszrup.lspmux.client.TouchFileResult;
import com.tomaszrup.lspmux.config.LoadWarning;
import com.tomaszrup.lspmux.config.LoadedConfig;
import com.tomaszrup.lspmux.config.LspConfigLoader;
import com.tomaszrup.lspmux.config.TimingConfig;
import com.tomaszrup.lspmux.server.AutoInstaller;
import com.tomaszrup.lspmux.server.BinaryResolver;
import com.tomaszrup.lspmux.server.BuiltinServerCatalog;
import com.tomaszrup.lspmux.server.ProcessLauncher;
import com.tomaszrup.lspmux.server.RootResolver;
import com.tomaszrup.lspmux.server.ServerDefinition;
import com.tomaszrup.lspmux.server.ServerProcessSpawner;
import com.tomaszrup.lspmux.server.ServerRegistry;
import com.tomaszrup.lspmux.server.SpawnedProcess;
import com.tomaszrup.lspmux.util.MdcServerContext;

/**
 * Owns every live language server client, keyed by {@code serverId::root}.
 *
 * <p>Callers hand in a file and an operation; the runtime resolves which
 * servers and roots apply, spawns and initializes missing clients (one spawn
 * per key at a time), fans the request out and returns every per-server
 * outcome. Broken keys back off exponentially. Configuration is re-read on
 * every access and live clients that no longer fit it are shut down.</p>
 *
 * <p>Nothing but {@link LspPathException} (for bad caller paths) escapes the
 * public API: failures are reported as {@link LspError}s inside the
 * returned summaries.</p>
 */
public class LspRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LspRuntime.class);

    static final String MANAGED_BIN_DIR = ".local/share/lspmux/lsp-bin";
    static final long SHUTDOWN_TIMEOUT_PER_CLIENT_MS = 6_000;

    /**
     * One operation against one client.
     *
     * @param <T> value type
     */
    @FunctionalInterface
    public interface ClientCall<T> {
        CompletableFuture<T> apply(LspClient client, RuntimeClientEntry entry);
    }

    private final LspConfigLoader configLoader;
    private final BuiltinServerCatalog catalog;
    private final ExecutorPools pools;
    private final ServerProcessSpawner spawner;
    private final Map<String, String> baseEnv;
    private final LongSupplier clock;
    private final BackoffPolicy backoff;

    private final Object configLock = new Object();
    private volatile Path cwd;
    private volatile LoadedConfig loadedConfig;
    private volatile ServerRegistry registry = ServerRegistry.empty();

    private final Map<String, RuntimeClientEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<RuntimeClientEntry>> spawning = new ConcurrentHashMap<>();
    private final Map<String, BrokenServerState> broken = new ConcurrentHashMap<>();
    private final Map<String, LspError> spawnFailures = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public LspRuntime(Path cwd) {
        this(builder(cwd));
    }

    private LspRuntime(Builder builder) {
        this.configLoader = new LspConfigLoader(builder.homeDir);
        this.catalog = builder.catalog != null ? builder.catalog : new BuiltinServerCatalog();
        this.pools = new ExecutorPools();
        this.baseEnv = Collections.unmodifiableMap(new LinkedHashMap<>(builder.baseEnv));
        this.clock = builder.clock;
        this.backoff = builder.backoff;

        BinaryResolver binaryResolver = new BinaryResolver(builder.homeDir.resolve(MANAGED_BIN_DIR));
        AutoInstaller autoInstaller = new AutoInstaller(catalog, binaryResolver, builder.launcher,
                pools.getSpawnPool());
        this.spawner = new ServerProcessSpawner(catalog, binaryResolver, autoInstaller, builder.launcher,
                pools.getSpawnPool());

        this.cwd = builder.cwd;
        reloadConfig();
    }

    public static Builder builder(Path cwd) {
        return new Builder(cwd);
    }

    // ---- configuration ----

    /** Switch the working directory; configuration is reloaded when it changes. */
    public void setCwd(Path cwd) {
        if (!cwd.equals(this.cwd)) {
            this.cwd = cwd;
            reloadConfig();
        }
    }

    public Path getCwd() {
        return cwd;
    }

    /** Re-read configuration now. */
    public void reloadConfig() {
        ensureConfig();
    }

    /**
     * Load configuration and, when its signature changed, rebuild the
     * registry, reset retry state and prune clients that no longer fit.
     */
    LoadedConfig ensureConfig() {
        LoadedConfig loaded = configLoader.load(cwd);
        synchronized (configLock) {
            LoadedConfig previous = loadedConfig;
            if (previous != null && previous.getSignature().equals(loaded.getSignature())) {
                return previous;
            }
            if (previous != null) {
                logger.info("LSP configuration changed; rebuilding server registry");
            }
            loadedConfig = loaded;
            registry = ServerRegistry.build(loaded, catalog);
            broken.clear();
            spawnFailures.clear();
            spawner.getAutoInstaller().clear();
            pruneEntries(loaded.getWorkspaceRoot());
            return loaded;
        }
    }

    private void pruneEntries(Path workspaceRoot) {
        for (RuntimeClientEntry entry : new ArrayList<>(entries.values())) {
            if (isActive(entry, workspaceRoot)) {
                continue;
            }
            if (entries.remove(entry.getKey(), entry)) {
                logger.info("Shutting down LSP server {} for {}: no longer configured",
                        entry.getServerId(), entry.getRoot());
                broken.remove(entry.getKey());
                spawnFailures.remove(entry.getKey());
                entry.getClient().shutdown().whenComplete((ignored, error) -> {
                    if (error != null) {
                        logger.debug("Shutdown of stale client {} failed: {}", entry.getKey(), error.getMessage());
                    }
                });
            }
        }
        broken.keySet().removeIf(key -> !keyFits(key, workspaceRoot));
        spawnFailures.keySet().removeIf(key -> !keyFits(key, workspaceRoot));
    }

    private boolean keyFits(String key, Path workspaceRoot) {
        return registry.contains(ClientKey.serverId(key)) && isWithinRoot(ClientKey.root(key), workspaceRoot);
    }

    private boolean isActive(RuntimeClientEntry entry, Path workspaceRoot) {
        ServerDefinition server = registry.get(entry.getServerId());
        if (server == null || server.isDisabled()) {
            return false;
        }
        return isWithinRoot(entry.getRoot(), workspaceRoot);
    }

    static boolean isWithinRoot(Path path, Path root) {
        return realPathSafe(path).startsWith(realPathSafe(root));
    }

    private static Path realPathSafe(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    public List<LoadWarning> getWarnings() {
        LoadedConfig current = loadedConfig;
        return current != null ? current.getWarnings() : Collections.emptyList();
    }

    public boolean getAllowExternalPaths() {
        return ensureConfig().getConfig().getSecurity().isAllowExternalPaths();
    }

    public Path getWorkspaceRoot() {
        return ensureConfig().getWorkspaceRoot();
    }

    /** Workspace root, plus the project root when it lies inside the workspace. */
    public List<Path> getBoundaryRoots() {
        LoadedConfig config = ensureConfig();
        Set<Path> roots = new LinkedHashSet<>();
        roots.add(config.getWorkspaceRoot());
        if (isWithinRoot(config.getProjectRoot(), config.getWorkspaceRoot())) {
            roots.add(config.getProjectRoot());
        }
        return new ArrayList<>(roots);
    }

    public Map<String, ServerDefinition> getConfiguredServers() {
        ensureConfig();
        return registry.asMap();
    }

    /**
     * Resolve a caller path against the current directory and check it
     * against the workspace boundary.
     *
     * @throws LspPathException on a boundary violation
     */
    public Path resolvePath(String rawPath) {
        return PathBoundary.normalize(rawPath, cwd, getBoundaryRoots(), getAllowExternalPaths());
    }

    // ---- client selection ----

    /** True when at least one server would be tried for {@code file} right now. */
    public boolean hasAvailableClientForFile(Path file) {
        LoadedConfig config = ensureConfig();
        long now = clock.getAsLong();
        for (ServerDefinition server : registry.candidatesFor(file)) {
            Path root = RootResolver.resolve(file, server, config.getWorkspaceRoot());
            if (root == null) {
                continue;
            }
            BrokenServerState state = broken.get(ClientKey.of(server.getId(), root));
            if (state != null && state.isBackingOff(now)) {
                continue;
            }
            return true;
        }
        return false;
    }

    /** Live clients for {@code file}, spawning the missing ones. */
    public CompletableFuture<List<RuntimeClientEntry>> getClientsForFile(Path file) {
        return selectClients(file).thenApply(selection -> selection.clients);
    }

    private static final class Selection {
        final List<String> requestedKeys = new ArrayList<>();
        final Map<String, LspError> errors = new LinkedHashMap<>();
        final List<RuntimeClientEntry> clients = new ArrayList<>();
    }

    private CompletableFuture<Selection> selectClients(Path file) {
        LoadedConfig config = ensureConfig();
        Selection selection = new Selection();
        List<CompletableFuture<RuntimeClientEntry>> pending = new ArrayList<>();
        long now = clock.getAsLong();

        for (ServerDefinition server : registry.candidatesFor(file)) {
            Path root = RootResolver.resolve(file, server, config.getWorkspaceRoot());
            if (root == null) {
                continue;
            }
            String key = ClientKey.of(server.getId(), root);
            selection.requestedKeys.add(key);

            BrokenServerState state = broken.get(key);
            if (state != null && state.isBackingOff(now)) {
                selection.errors.put(key, new LspError(server.getId(), LspErrorCode.EBROKEN.name(),
                        "Server " + server.getId() + " is backing off until "
                                + Instant.ofEpochMilli(state.getRetryAt()) + ": " + state.getLastError()));
                continue;
            }
            if (entries.containsKey(key)) {
                continue;
            }
            pending.add(spawnClient(key, server, root, config.getConfig().getTiming()));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    for (String key : selection.requestedKeys) {
                        RuntimeClientEntry entry = entries.get(key);
                        if (entry != null) {
                            selection.clients.add(entry);
                        } else if (!selection.errors.containsKey(key)) {
                            LspError failure = spawnFailures.get(key);
                            if (failure != null) {
                                selection.errors.put(key, failure);
                            }
                        }
                    }
                    return selection;
                });
    }

    /**
     * Spawn and initialize one client. Concurrent callers for the same key
     * share the same future. The future never fails: a failed spawn is
     * recorded as broken and completes with {@code null}. A key that became
     * live after the caller's check gets the live entry, not a second process.
     */
    CompletableFuture<RuntimeClientEntry> spawnClient(String key, ServerDefinition server, Path root,
                                                      TimingConfig timing) {
        CompletableFuture<RuntimeClientEntry> result = new CompletableFuture<>();
        CompletableFuture<RuntimeClientEntry> existing = spawning.putIfAbsent(key, result);
        if (existing != null) {
            return existing;
        }
        // register() publishes the entry before the spawning claim is released
        RuntimeClientEntry live = entries.get(key);
        if (live != null) {
            spawning.remove(key, result);
            result.complete(live);
            return result;
        }

        logger.info("Starting LSP server {} for {}", server.getId(), root);
        CompletableFuture<RuntimeClientEntry> started;
        try {
            started = spawner.spawn(server, root, baseEnv)
                    .thenCompose(spawned -> startClient(key, server, root, spawned, timing));
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }

        started.whenComplete((entry, error) -> {
            try {
                if (error == null) {
                    register(entry);
                } else {
                    LspError failure = spawnError(server.getId(), error);
                    recordBroken(key, failure.getMessage());
                    spawnFailures.put(key, failure);
                    MdcServerContext.setServer(server.getId(), root);
                    try {
                        logger.warn("[lsp] {}", failure.getMessage());
                    } finally {
                        MdcServerContext.clear();
                    }
                }
            } finally {
                spawning.remove(key, result);
                result.complete(error == null && entries.get(key) == entry ? entry : null);
            }
        });
        return result;
    }

    private CompletableFuture<RuntimeClientEntry> startClient(String key, ServerDefinition server, Path root,
                                                              SpawnedProcess spawned, TimingConfig timing) {
        LspClient client = new LspClient(server.getId(), root, spawned.getProcess(), timing,
                pools.getSchedulingPool());
        client.start();
        return client.initialize(server.getInitOptions())
                .handle((capabilities, error) -> {
                    if (error != null) {
                        client.shutdown();
                        throw error instanceof CompletionException
                                ? (CompletionException) error : new CompletionException(error);
                    }
                    return new RuntimeClientEntry(key, server, root, client, spawned.getCommand(),
                            clock.getAsLong());
                });
    }

    private void register(RuntimeClientEntry entry) {
        if (closed) {
            logger.debug("Runtime closed while {} was starting; shutting it down", entry.getKey());
            entry.getClient().shutdown();
            return;
        }
        entries.put(entry.getKey(), entry);
        broken.remove(entry.getKey());
        spawnFailures.remove(entry.getKey());
        entry.getClient().whenClosed().thenRun(() -> {
            if (entries.remove(entry.getKey(), entry)) {
                logger.info("LSP server {} for {} exited", entry.getServerId(), entry.getRoot());
            }
        });
    }

    static LspError spawnError(String serverId, Throwable error) {
        Throwable cause = OutcomeErrors.unwrap(error);
        if (cause instanceof LspException) {
            return OutcomeErrors.toError(serverId, cause);
        }
        if (OutcomeErrors.isFatal(cause)) {
            OutcomeErrors.throwAsUnchecked(cause);
        }
        return new LspError(serverId, LspErrorCode.ESPAWN.name(),
                "Failed to start LSP server '" + serverId + "': " + OutcomeErrors.summarize(cause));
    }

    private void recordBroken(String key, String message) {
        BrokenServerState state = broken.compute(key, (k, previous) -> {
            int attempts = (previous != null ? previous.getAttempts() : 0) + 1;
            return new BrokenServerState(attempts, clock.getAsLong() + backoff.delayMs(attempts), message);
        });
        logger.debug("{} marked broken (attempt {}), retry at {}", key, state.getAttempts(),
                Instant.ofEpochMilli(state.getRetryAt()));
    }

    /** Backoff state for {@code key}, or {@code null}. */
    public BrokenServerState getBrokenState(String key) {
        return broken.get(key);
    }

    // ---- fan-out ----

    /**
     * Run {@code call} on every client resolved for {@code file}. The summary
     * holds one outcome per requested key, including skipped broken keys and
     * failed spawns.
     */
    public <T> CompletableFuture<RunSummary<T>> run(Path file, ClientCall<T> call) {
        return selectClients(file).thenCompose(selection -> {
            List<RequestOutcome<T>> skipped = new ArrayList<>();
            for (Map.Entry<String, LspError> failure : selection.errors.entrySet()) {
                skipped.add(RequestOutcome.failure(failure.getValue().getServerId(), failure.getKey(),
                        failure.getValue()));
            }
            return fanOut(selection.clients, call).thenApply(outcomes -> {
                List<RequestOutcome<T>> all = new ArrayList<>(skipped);
                all.addAll(outcomes);
                return new RunSummary<>(selection.requestedKeys.size(), all, getWarnings());
            });
        });
    }

    /** Run {@code call} on every active client. */
    public <T> CompletableFuture<RunSummary<T>> runAll(ClientCall<T> call) {
        LoadedConfig config = ensureConfig();
        List<RuntimeClientEntry> active = new ArrayList<>();
        for (RuntimeClientEntry entry : entries.values()) {
            if (isActive(entry, config.getWorkspaceRoot())) {
                active.add(entry);
            }
        }
        return fanOut(active, call)
                .thenApply(outcomes -> new RunSummary<>(active.size(), outcomes, getWarnings()));
    }

    /**
     * Run an operation at an editor position (1-based line and character)
     * in {@code rawPath}. The file is synced first, waiting for diagnostics;
     * sync failures do not fail the operation.
     *
     * @throws LspPathException when the path is outside the workspace or missing
     */
    public CompletableFuture<RunSummary<JsonElement>> run(String rawPath, LspOperation operation,
                                                          int line, int character, AbortSignal signal) {
        Path file = resolvePath(rawPath);
        if (!Files.isRegularFile(file)) {
            throw new LspPathException("File not found: " + file);
        }
        Position position = LspOperation.toProtocolPosition(line, character);
        ClientCall<JsonElement> call = (client, entry) -> operation.execute(client, file, position, signal);

        if (!hasAvailableClientForFile(file)) {
            return operation.isWorkspaceWide()
                    ? runAll(call)
                    : CompletableFuture.completedFuture(new RunSummary<>(0, Collections.emptyList(), getWarnings()));
        }
        return touchFile(file, true, signal)
                .handle((touch, error) -> {
                    if (error != null) {
                        logger.debug("Sync of {} before {} failed: {}", file, operation, error.getMessage());
                    } else if (touch.isTimedOut()) {
                        logger.debug("No diagnostics for {} before {} within timeout", file, operation);
                    }
                    return null;
                })
                .thenCompose(ignored -> operation.isWorkspaceWide() ? runAll(call) : run(file, call));
    }

    private <T> CompletableFuture<List<RequestOutcome<T>>> fanOut(List<RuntimeClientEntry> targets,
                                                                  ClientCall<T> call) {
        List<CompletableFuture<RequestOutcome<T>>> futures = new ArrayList<>();
        for (RuntimeClientEntry entry : targets) {
            futures.add(invoke(entry, call));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<RequestOutcome<T>> outcomes = new ArrayList<>();
                    for (CompletableFuture<RequestOutcome<T>> future : futures) {
                        outcomes.add(future.join());
                    }
                    return outcomes;
                });
    }

    private <T> CompletableFuture<RequestOutcome<T>> invoke(RuntimeClientEntry entry, ClientCall<T> call) {
        CompletableFuture<T> future;
        try {
            future = call.apply(entry.getClient(), entry);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((value, error) -> {
            if (error == null) {
                entry.touch(clock.getAsLong());
                broken.remove(entry.getKey());
                return RequestOutcome.success(entry.getServerId(), entry.getKey(), value);
            }
            LspError failure = OutcomeErrors.toError(entry.getServerId(), error);
            if (LspErrorCode.EPIPE.name().equals(failure.getCode())) {
                recordBroken(entry.getKey(), failure.getMessage());
            }
            return RequestOutcome.failure(entry.getServerId(), entry.getKey(), failure);
        });
    }

    // ---- documents and diagnostics ----

    /**
     * Open or update {@code file} on every resolved client.
     */
    public CompletableFuture<TouchResult> touchFile(Path file, boolean waitForDiagnostics, AbortSignal signal) {
        return selectClients(file).thenCompose(selection -> {
            List<LspError> errors = Collections.synchronizedList(new ArrayList<>(selection.errors.values()));
            if (selection.clients.isEmpty()) {
                return CompletableFuture.completedFuture(new TouchResult(false, false, false, errors));
            }

            List<CompletableFuture<TouchFileResult>> touches = new ArrayList<>();
            for (RuntimeClientEntry entry : selection.clients) {
                CompletableFuture<TouchFileResult> touch;
                try {
                    touch = entry.getClient().touchFile(file, waitForDiagnostics, signal);
                } catch (RuntimeException e) {
                    touch = CompletableFuture.failedFuture(e);
                }
                touches.add(touch.handle((result, error) -> {
                    if (error != null) {
                        errors.add(OutcomeErrors.toError(entry.getServerId(), error));
                        return null;
                    }
                    entry.touch(clock.getAsLong());
                    return result;
                }));
            }
            return CompletableFuture.allOf(touches.toArray(new CompletableFuture<?>[0]))
                    .thenApply(ignored -> {
                        boolean timedOut = false;
                        boolean aborted = false;
                        for (CompletableFuture<TouchFileResult> touch : touches) {
                            TouchFileResult result = touch.join();
                            if (result != null) {
                                timedOut |= result.isTimedOut();
                                aborted |= result.isAborted();
                            }
                        }
                        return new TouchResult(true, timedOut, aborted, new ArrayList<>(errors));
                    });
        });
    }

    /** Latest diagnostics of every active client, merged per file path. */
    public Map<Path, List<Diagnostic>> diagnostics() {
        LoadedConfig config = ensureConfig();
        Map<Path, List<Diagnostic>> aggregated = new LinkedHashMap<>();
        for (RuntimeClientEntry entry : entries.values()) {
            if (!isActive(entry, config.getWorkspaceRoot())) {
                continue;
            }
            for (Map.Entry<String, List<Diagnostic>> published : entry.getClient().getDiagnostics().entrySet()) {
                Path file;
                try {
                    file = Paths.get(URI.create(published.getKey()));
                } catch (IllegalArgumentException | FileSystemNotFoundException e) {
                    logger.debug("Ignoring diagnostics for non-file URI {}", published.getKey());
                    continue;
                }
                aggregated.computeIfAbsent(file, k -> new ArrayList<>()).addAll(published.getValue());
            }
        }
        return aggregated;
    }

    // ---- observability ----

    public RuntimeSnapshot getSnapshot() {
        LoadedConfig config = ensureConfig();
        Path workspaceRoot = config.getWorkspaceRoot();
        List<RuntimeSnapshot.Row> rows = new ArrayList<>();

        for (ServerDefinition server : registry.all()) {
            List<String> connectedRoots = new ArrayList<>();
            List<String> spawningRoots = new ArrayList<>();
            List<Diagnostic> diagnostics = new ArrayList<>();
            Long lastSeenAt = null;
            BrokenServerState worst = null;

            for (RuntimeClientEntry entry : entries.values()) {
                if (!entry.getServerId().equals(server.getId()) || !isActive(entry, workspaceRoot)) {
                    continue;
                }
                connectedRoots.add(entry.getRoot().toString());
                for (List<Diagnostic> published : entry.getClient().getDiagnostics().values()) {
                    diagnostics.addAll(published);
                }
                if (lastSeenAt == null || entry.getLastSeenAt() > lastSeenAt) {
                    lastSeenAt = entry.getLastSeenAt();
                }
            }
            for (String key : spawning.keySet()) {
                if (ClientKey.serverId(key).equals(server.getId())
                        && isWithinRoot(ClientKey.root(key), workspaceRoot)) {
                    spawningRoots.add(ClientKey.root(key).toString());
                }
            }
            for (Map.Entry<String, BrokenServerState> state : broken.entrySet()) {
                String key = state.getKey();
                if (!ClientKey.serverId(key).equals(server.getId())
                        || !isWithinRoot(ClientKey.root(key), workspaceRoot)) {
                    continue;
                }
                if (worst == null || state.getValue().getAttempts() > worst.getAttempts()) {
                    worst = state.getValue();
                }
            }

            rows.add(new RuntimeSnapshot.Row(server.getId(), server.getProvenance(), server.isDisabled(),
                    server.getExtensions(), server.getRoots(), connectedRoots, spawningRoots, worst,
                    diagnostics.isEmpty() ? null : DiagnosticCounts.of(diagnostics), lastSeenAt));
        }
        return new RuntimeSnapshot(clock.getAsLong(), rows);
    }

    // ---- shutdown ----

    /**
     * Shut every client down, one after another, each bounded in time.
     * The runtime stays usable afterwards.
     */
    public void shutdownAll() {
        List<RuntimeClientEntry> toStop = new ArrayList<>(entries.values());
        for (RuntimeClientEntry entry : toStop) {
            try {
                entry.getClient().shutdown().get(SHUTDOWN_TIMEOUT_PER_CLIENT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while shutting down {}", entry.getKey());
                break;
            } catch (ExecutionException | TimeoutException e) {
                logger.warn("Shutdown of {} did not complete cleanly: {}", entry.getKey(), e.toString());
            }
        }
        entries.clear();
        spawning.clear();
        broken.clear();
        spawnFailures.clear();
    }

    /** Shut every client down and release the runtime's threads. */
    @Override
    public void close() {
        closed = true;
        try {
            shutdownAll();
        } finally {
            pools.shutdownAll();
        }
    }

    /**
     * Construction options. Everything except the working directory has a
     * production default.
     */
    public static final class Builder {

        private final Path cwd;
        private Path homeDir = Paths.get(System.getProperty("user.home"));
        private ProcessLauncher launcher = ProcessLauncher.system();
        private Map<String, String> baseEnv = System.getenv();
        private LongSupplier clock = System::currentTimeMillis;
        private BackoffPolicy backoff = new BackoffPolicy();
        private BuiltinServerCatalog catalog;

        private Builder(Path cwd) {
            this.cwd = cwd;
        }

        public Builder homeDir(Path homeDir) {
            this.homeDir = homeDir;
            return this;
        }

        public Builder launcher(ProcessLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder baseEnv(Map<String, String> baseEnv) {
            this.baseEnv = baseEnv;
            return this;
        }

        public Builder clock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder catalog(BuiltinServerCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public LspRuntime build() {
            return new LspRuntime(this);
        }
    }
}
