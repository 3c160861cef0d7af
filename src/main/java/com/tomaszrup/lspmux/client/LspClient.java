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
package com.tomaszrup.lspmux.client;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tomaszrup.lspmux.LspErrorCode;
import com.tomaszrup.lspmux.LspException;
import com.tomaszrup.lspmux.config.TimingConfig;
import com.tomaszrup.lspmux.util.MdcServerContext;
import com.tomaszrup.lspmux.util.StreamGobbler;
import org.eclipse.lsp4j.ClientCapabilities;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesCapabilities;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.FileChangeType;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.PublishDiagnosticsCapabilities;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.SynchronizationCapabilities;
import org.eclipse.lsp4j.TextDocumentClientCapabilities;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.eclipse.lsp4j.WindowClientCapabilities;
import org.eclipse.lsp4j.WorkspaceClientCapabilities;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * JSON-RPC connection to one language server process over stdio.
 *
 * <p>A dedicated reader thread parses {@code Content-Length} framed messages
 * and dispatches them; responses are matched to requests by id. Timers
 * (request timeouts, diagnostics debounce) run on the shared scheduler.
 * When the process exits or its output closes, every pending request and
 * diagnostics wait fails with {@link LspErrorCode#EPIPE}.</p>
 *
 * <p>Call {@link #start()} before {@link #initialize(JsonObject)}.</p>
 */
public class LspClient {

    private static final Logger logger = LoggerFactory.getLogger(LspClient.class);

    /** Quiet period after the last matching publish before a diagnostics wait resolves. */
    static final long DIAGNOSTICS_DEBOUNCE_MS = 150;

    static final long SHUTDOWN_REQUEST_TIMEOUT_MS = 1_500;
    static final long EXIT_GRACE_MS = 500;
    static final long TERMINATE_WAIT_MS = 2_000;
    static final long KILL_WAIT_MS = 1_000;

    private static final int STDERR_TAIL_CHARS = 4000;

    /** Gson configured with lsp4j's protocol type adapters. */
    static final Gson LSP_GSON = new MessageJsonHandler(Collections.emptyMap()).getGson();

    private final String serverId;
    private final Path root;
    private final Process process;
    private final TimingConfig timing;
    private final ScheduledExecutorService scheduler;

    private final AtomicReference<ClientState> state = new AtomicReference<>(ClientState.SPAWNED);
    private final AtomicInteger nextRequestId = new AtomicInteger(1);
    private final Map<Integer, InFlightRequest> inflight = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final ContentLengthFramer framer = new ContentLengthFramer();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    private final Object diagnosticsLock = new Object();
    private final Map<String, List<Diagnostic>> diagnostics = new ConcurrentHashMap<>();
    private final Map<String, Long> diagnosticsSequence = new HashMap<>();
    private final Set<DiagnosticsWaiter> diagnosticsWaiters = new LinkedHashSet<>();

    private final Map<String, Integer> versions = new ConcurrentHashMap<>();
    private final Set<String> openedUris = ConcurrentHashMap.newKeySet();

    private volatile JsonObject settings = new JsonObject();
    private volatile JsonObject capabilities = new JsonObject();
    private volatile long lastActivityAt = System.currentTimeMillis();
    private StreamGobbler stderrGobbler;

    public LspClient(String serverId, Path root, Process process, TimingConfig timing,
                     ScheduledExecutorService scheduler) {
        this.serverId = serverId;
        this.root = root;
        this.process = process;
        this.timing = timing;
        this.scheduler = scheduler;
    }

    /** Start the reader and stderr threads and watch for process exit. */
    public void start() {
        MdcServerContext.setServer(serverId, root);
        try {
            stderrGobbler = new StreamGobbler(process.getErrorStream(), "lspmux-stderr-" + serverId,
                    STDERR_TAIL_CHARS);
            stderrGobbler.start();
        } finally {
            MdcServerContext.clear();
        }

        Thread reader = new Thread(this::readLoop, "lspmux-reader-" + serverId);
        reader.setDaemon(true);
        reader.start();

        process.onExit().thenRun(() -> markClosed(serverId + " exited"));
    }

    // ---- accessors ----

    public String getServerId() {
        return serverId;
    }

    public Path getRoot() {
        return root;
    }

    public Process getProcess() {
        return process;
    }

    public ClientState getState() {
        return state.get();
    }

    /** {@code true} while the client is initialized and its process alive. */
    public boolean isUsable() {
        return state.get() == ClientState.READY && process.isAlive();
    }

    /** Completes once the client reaches {@link ClientState#CLOSED}. */
    public CompletableFuture<Void> whenClosed() {
        return closed.thenApply(v -> v);
    }

    /** Server capabilities from the {@code initialize} result. */
    public JsonObject getCapabilities() {
        return capabilities.deepCopy();
    }

    /** Latest diagnostics per document URI. */
    public Map<String, List<Diagnostic>> getDiagnostics() {
        return new LinkedHashMap<>(diagnostics);
    }

    public Map<String, Integer> getVersions() {
        return new LinkedHashMap<>(versions);
    }

    public long getDiagnosticsSequence(String uri) {
        synchronized (diagnosticsLock) {
            return diagnosticsSequence.getOrDefault(uri, 0L);
        }
    }

    public long getLastActivityAt() {
        return lastActivityAt;
    }

    /** Tail of the server's stderr output. */
    public String getStderrTail() {
        return stderrGobbler != null ? stderrGobbler.getOutput() : "";
    }

    // ---- state machine ----

    private boolean transition(ClientState from, ClientState to) {
        if (!from.canTransitionTo(to)) {
            return false;
        }
        return state.compareAndSet(from, to);
    }

    private void markClosed(String reason) {
        ClientState previous = state.getAndSet(ClientState.CLOSED);
        if (previous == ClientState.CLOSED) {
            return;
        }
        logger.debug("Client {} closed ({}), previous state {}", serverId, reason, previous);

        LspException error = new LspException(LspErrorCode.EPIPE, reason, serverId, root.toString(),
                null, null, null, null);
        for (Integer id : new ArrayList<>(inflight.keySet())) {
            InFlightRequest entry = inflight.remove(id);
            if (entry != null) {
                entry.release();
                entry.getFuture().completeExceptionally(error);
            }
        }

        List<DiagnosticsWaiter> waiters;
        synchronized (diagnosticsLock) {
            waiters = new ArrayList<>(diagnosticsWaiters);
            diagnosticsWaiters.clear();
            waiters.forEach(DiagnosticsWaiter::release);
        }
        for (DiagnosticsWaiter waiter : waiters) {
            waiter.future.completeExceptionally(error);
        }
        closed.complete(null);
    }

    // ---- reading ----

    private void readLoop() {
        MdcServerContext.setServer(serverId, root);
        byte[] chunk = new byte[8192];
        try (InputStream in = process.getInputStream()) {
            int read;
            while ((read = in.read(chunk)) != -1) {
                for (String body : framer.append(chunk, 0, read)) {
                    dispatch(body);
                }
            }
            markClosed(serverId + " exited");
        } catch (IOException e) {
            markClosed(serverId + " process error: " + e.getMessage());
        } finally {
            MdcServerContext.clear();
        }
    }

    private void dispatch(String body) {
        JsonObject message;
        try {
            JsonElement parsed = JsonParser.parseString(body);
            if (!parsed.isJsonObject()) {
                return;
            }
            message = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            logger.debug("Skipping malformed message from {}: {}", serverId, e.getMessage());
            return;
        }
        lastActivityAt = System.currentTimeMillis();

        try {
            boolean hasMethod = message.has("method");
            boolean hasId = message.has("id") && !message.get("id").isJsonNull();
            if (!hasMethod && hasId && (message.has("result") || message.has("error"))) {
                handleResponse(message);
            } else if (hasMethod && hasId) {
                handleServerRequest(message);
            } else if (hasMethod) {
                handleNotification(message);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to handle message from {}: {}", serverId, e.getMessage());
            logger.debug("Message handling failure details", e);
        }
    }

    private void handleResponse(JsonObject response) {
        JsonElement idElement = response.get("id");
        int id;
        try {
            id = idElement.getAsInt();
        } catch (RuntimeException e) {
            logger.debug("Ignoring response with foreign id {}", idElement);
            return;
        }
        InFlightRequest entry = inflight.remove(id);
        if (entry == null) {
            return;
        }
        entry.release();

        JsonElement error = response.get("error");
        if (error != null && error.isJsonObject()) {
            JsonObject errorObject = error.getAsJsonObject();
            String code = errorObject.has("code") ? errorObject.get("code").getAsString() : "unknown";
            String message = errorObject.has("message") ? errorObject.get("message").getAsString()
                    : "Request failed: " + entry.getMethod();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("method", entry.getMethod());
            if (errorObject.has("data")) {
                details.put("data", errorObject.get("data"));
            }
            entry.getFuture().completeExceptionally(new LspException(LspErrorCode.ERESPONSE, message,
                    serverId, root.toString(), null, details, "LSP_" + code, null));
            return;
        }

        JsonElement result = response.get("result");
        entry.getFuture().complete(result != null ? result : JsonNull.INSTANCE);
    }

    private void handleServerRequest(JsonObject request) {
        JsonElement id = request.get("id");
        String method = request.get("method").getAsString();
        JsonElement params = request.get("params");

        switch (method) {
            case "workspace/configuration":
                respond(id, answerConfiguration(params), null);
                break;
            case "client/registerCapability":
            case "client/unregisterCapability":
            case "window/workDoneProgress/create":
                respond(id, JsonNull.INSTANCE, null);
                break;
            default:
                JsonObject error = new JsonObject();
                error.addProperty("code", ResponseErrorCode.MethodNotFound.getValue());
                error.addProperty("message", "Unhandled method " + method);
                respond(id, null, error);
                break;
        }
    }

    JsonArray answerConfiguration(JsonElement params) {
        JsonArray answers = new JsonArray();
        if (params == null || !params.isJsonObject() || !params.getAsJsonObject().has("items")) {
            return answers;
        }
        JsonObject current = settings;
        for (JsonElement item : params.getAsJsonObject().getAsJsonArray("items")) {
            JsonElement section = item.isJsonObject() ? item.getAsJsonObject().get("section") : null;
            if (section == null || section.isJsonNull() || section.getAsString().isEmpty()) {
                answers.add(current.deepCopy());
            } else {
                answers.add(lookupSection(current, section.getAsString()));
            }
        }
        return answers;
    }

    private static JsonElement lookupSection(JsonObject source, String section) {
        if (source.has(section)) {
            return source.get(section).deepCopy();
        }
        JsonElement cursor = source;
        for (String part : section.split("\\.")) {
            if (cursor == null || !cursor.isJsonObject() || !cursor.getAsJsonObject().has(part)) {
                return JsonNull.INSTANCE;
            }
            cursor = cursor.getAsJsonObject().get(part);
        }
        return cursor.deepCopy();
    }

    private void respond(JsonElement id, JsonElement result, JsonObject error) {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id);
        if (error != null) {
            response.add("error", error);
        } else {
            response.add("result", result);
        }
        try {
            sendMessage(response);
        } catch (LspException e) {
            logger.debug("Could not answer server request {}: {}", id, e.getMessage());
        }
    }

    private void handleNotification(JsonObject notification) {
        String method = notification.get("method").getAsString();
        JsonElement params = notification.get("params");
        switch (method) {
            case "textDocument/publishDiagnostics":
                handlePublishDiagnostics(LSP_GSON.fromJson(params, PublishDiagnosticsParams.class));
                break;
            case "window/logMessage":
            case "window/showMessage":
                MessageParams message = LSP_GSON.fromJson(params, MessageParams.class);
                if (message != null) {
                    logger.debug("[{}] {}: {}", serverId, message.getType(), message.getMessage());
                }
                break;
            default:
                logger.trace("Ignoring notification {} from {}", method, serverId);
                break;
        }
    }

    private void handlePublishDiagnostics(PublishDiagnosticsParams params) {
        if (params == null || params.getUri() == null) {
            return;
        }
        String uri = params.getUri();
        List<Diagnostic> published = params.getDiagnostics() != null
                ? Collections.unmodifiableList(new ArrayList<>(params.getDiagnostics()))
                : Collections.emptyList();

        synchronized (diagnosticsLock) {
            diagnostics.put(uri, published);
            long sequence = diagnosticsSequence.merge(uri, 1L, Long::sum);
            for (DiagnosticsWaiter waiter : diagnosticsWaiters) {
                if (waiter.uri.equals(uri) && sequence >= waiter.minSequence) {
                    scheduleDebounce(waiter);
                }
            }
        }
    }

    // must hold diagnosticsLock
    private void scheduleDebounce(DiagnosticsWaiter waiter) {
        if (waiter.debounceHandle != null) {
            waiter.debounceHandle.cancel(false);
        }
        waiter.debounceHandle = scheduler.schedule(() -> resolveWaiter(waiter),
                DIAGNOSTICS_DEBOUNCE_MS, TimeUnit.MILLISECONDS);
    }

    private void resolveWaiter(DiagnosticsWaiter waiter) {
        boolean removed;
        synchronized (diagnosticsLock) {
            removed = diagnosticsWaiters.remove(waiter);
            if (removed) {
                waiter.release();
            }
        }
        if (removed) {
            waiter.future.complete(null);
        }
    }

    private void failWaiter(DiagnosticsWaiter waiter, LspException error) {
        boolean removed;
        synchronized (diagnosticsLock) {
            removed = diagnosticsWaiters.remove(waiter);
            if (removed) {
                waiter.release();
            }
        }
        if (removed) {
            waiter.future.completeExceptionally(error);
        }
    }

    // ---- writing ----

    private void sendMessage(JsonObject message) {
        if (state.get() == ClientState.CLOSED) {
            throw new LspException(LspErrorCode.EPIPE, serverId + " stdin is closed");
        }
        byte[] framed = ContentLengthFramer.frame(message.toString());
        try {
            synchronized (writeLock) {
                OutputStream out = process.getOutputStream();
                out.write(framed);
                out.flush();
            }
        } catch (IOException e) {
            markClosed(serverId + " stdin is closed: " + e.getMessage());
            throw new LspException(LspErrorCode.EPIPE, serverId + " stdin is closed", e);
        }
    }

    private static JsonElement toJson(Object params) {
        if (params == null) {
            return null;
        }
        if (params instanceof JsonElement) {
            return (JsonElement) params;
        }
        return LSP_GSON.toJsonTree(params);
    }

    /**
     * Send a notification.
     *
     * @param params an lsp4j params object, a {@link JsonElement}, or {@code null}
     * @throws LspException with {@link LspErrorCode#EPIPE} when the client is closed
     */
    public void notify(String method, Object params) {
        JsonObject message = new JsonObject();
        message.addProperty("jsonrpc", "2.0");
        message.addProperty("method", method);
        JsonElement json = toJson(params);
        if (json != null) {
            message.add("params", json);
        }
        sendMessage(message);
    }

    private void sendCancelQuietly(int id) {
        JsonObject params = new JsonObject();
        params.addProperty("id", id);
        try {
            notify("$/cancelRequest", params);
        } catch (LspException e) {
            logger.debug("Could not send $/cancelRequest for {}: {}", id, e.getMessage());
        }
    }

    /**
     * Send a request. The returned future completes with the raw JSON result
     * (JSON null when the server returned none), or fails with an
     * {@link LspException}: ETIMEDOUT, EABORTED, EPIPE or ERESPONSE.
     * Cancelling the future cancels the request on the server.
     */
    public CompletableFuture<JsonElement> request(String method, Object params, RequestOptions options) {
        RequestOptions opts = options != null ? options : RequestOptions.defaults();
        long timeoutMs = opts.getTimeoutMs() != null ? opts.getTimeoutMs() : timing.getRequestTimeoutMs();

        if (state.get() == ClientState.CLOSED) {
            return CompletableFuture.failedFuture(new LspException(LspErrorCode.EPIPE, serverId + " is closed"));
        }

        int id = nextRequestId.getAndIncrement();
        CompletableFuture<JsonElement> future = new CompletableFuture<>();
        InFlightRequest entry = new InFlightRequest(id, method, future);
        inflight.put(id, entry);
        lastActivityAt = System.currentTimeMillis();

        entry.setTimeoutHandle(scheduler.schedule(() -> {
            if (inflight.remove(id, entry)) {
                entry.release();
                sendCancelQuietly(id);
                future.completeExceptionally(new LspException(LspErrorCode.ETIMEDOUT,
                        "Request timed out: " + method));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS));

        AbortSignal signal = opts.getSignal();
        if (signal != null) {
            entry.setAbortCleanup(signal.onAbort(() -> abortRequest(entry)));
        }
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                abortRequest(entry);
            }
        });

        if (!inflight.containsKey(id)) {
            return future;
        }

        JsonObject message = new JsonObject();
        message.addProperty("jsonrpc", "2.0");
        message.addProperty("id", id);
        message.addProperty("method", method);
        JsonElement json = toJson(params);
        if (json != null) {
            message.add("params", json);
        }
        try {
            sendMessage(message);
        } catch (LspException e) {
            if (inflight.remove(id, entry)) {
                entry.release();
                future.completeExceptionally(e);
            }
        }
        return future;
    }

    public CompletableFuture<JsonElement> request(String method, Object params) {
        return request(method, params, RequestOptions.defaults());
    }

    private void abortRequest(InFlightRequest entry) {
        if (inflight.remove(entry.getId(), entry)) {
            entry.release();
            sendCancelQuietly(entry.getId());
            entry.getFuture().completeExceptionally(new LspException(LspErrorCode.EABORTED,
                    "Request aborted: " + entry.getMethod()));
        }
    }

    // ---- lifecycle ----

    /**
     * Perform the {@code initialize} handshake, then send {@code initialized}
     * and, when options are present, {@code workspace/didChangeConfiguration}.
     * Any failure is reported as {@link LspErrorCode#EINIT}.
     *
     * @return future of the server capabilities
     */
    public CompletableFuture<JsonObject> initialize(JsonObject initializationOptions) {
        if (!transition(ClientState.SPAWNED, ClientState.INITIALIZING)) {
            return CompletableFuture.failedFuture(new LspException(LspErrorCode.EINIT,
                    "Cannot initialize " + serverId + " in state " + state.get()));
        }
        settings = initializationOptions != null ? initializationOptions.deepCopy() : new JsonObject();

        String rootUri = DocumentUris.of(root);
        Path rootName = root.getFileName();

        InitializeParams params = new InitializeParams();
        params.setProcessId((int) ProcessHandle.current().pid());
        params.setRootUri(rootUri);
        params.setRootPath(root.toString());
        params.setCapabilities(clientCapabilities());
        params.setInitializationOptions(settings);
        params.setWorkspaceFolders(Collections.singletonList(
                new WorkspaceFolder(rootUri, rootName != null ? rootName.toString() : "workspace")));

        return request("initialize", params, RequestOptions.withTimeout(timing.getInitializeTimeoutMs()))
                .handle((result, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        throw new CompletionException(new LspException(LspErrorCode.EINIT,
                                "Failed to initialize " + serverId + ": " + cause.getMessage(),
                                serverId, root.toString(), null, null, null, cause));
                    }
                    if (result.isJsonObject() && result.getAsJsonObject().has("capabilities")
                            && result.getAsJsonObject().get("capabilities").isJsonObject()) {
                        capabilities = result.getAsJsonObject().getAsJsonObject("capabilities");
                    }
                    try {
                        notify("initialized", new InitializedParams());
                        if (settings.size() > 0) {
                            notify("workspace/didChangeConfiguration", new DidChangeConfigurationParams(settings));
                        }
                    } catch (LspException e) {
                        throw new CompletionException(new LspException(LspErrorCode.EINIT,
                                "Failed to initialize " + serverId + ": " + e.getMessage(),
                                serverId, root.toString(), null, null, null, e));
                    }
                    if (!transition(ClientState.INITIALIZING, ClientState.READY)) {
                        throw new CompletionException(new LspException(LspErrorCode.EINIT,
                                "Failed to initialize " + serverId + ": client is " + state.get()));
                    }
                    logger.info("Initialized LSP server '{}' for {}", serverId, root);
                    return getCapabilities();
                });
    }

    static ClientCapabilities clientCapabilities() {
        WindowClientCapabilities window = new WindowClientCapabilities();
        window.setWorkDoneProgress(true);

        WorkspaceClientCapabilities workspace = new WorkspaceClientCapabilities();
        workspace.setConfiguration(true);
        workspace.setDidChangeWatchedFiles(new DidChangeWatchedFilesCapabilities(true));

        SynchronizationCapabilities synchronization = new SynchronizationCapabilities();
        synchronization.setDidSave(false);
        PublishDiagnosticsCapabilities publishDiagnostics = new PublishDiagnosticsCapabilities();
        publishDiagnostics.setVersionSupport(true);
        TextDocumentClientCapabilities textDocument = new TextDocumentClientCapabilities();
        textDocument.setSynchronization(synchronization);
        textDocument.setPublishDiagnostics(publishDiagnostics);

        ClientCapabilities capabilities = new ClientCapabilities();
        capabilities.setWindow(window);
        capabilities.setWorkspace(workspace);
        capabilities.setTextDocument(textDocument);
        return capabilities;
    }

    /**
     * Open the file on first touch (version 1) and send its full text as a
     * change afterwards. With {@code waitForDiagnostics} the future completes
     * once the server has published diagnostics for this version (debounced),
     * or with a timed-out / aborted result.
     */
    public CompletableFuture<TouchFileResult> touchFile(Path file, boolean waitForDiagnostics, AbortSignal signal) {
        String uri = DocumentUris.of(file);
        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new LspException(LspErrorCode.EINTERNAL,
                    "Cannot read " + file + ": " + e.getMessage(), e));
        }

        int version = versions.merge(uri, 1, Integer::sum);
        CompletableFuture<Void> wait = null;
        if (waitForDiagnostics) {
            wait = waitForDiagnostics(uri, getDiagnosticsSequence(uri) + 1,
                    timing.getDiagnosticsWaitTimeoutMs(), signal);
        }

        try {
            if (openedUris.add(uri)) {
                notify("workspace/didChangeWatchedFiles", new DidChangeWatchedFilesParams(
                        Collections.singletonList(new FileEvent(uri, FileChangeType.Created))));
                notify("textDocument/didOpen", new DidOpenTextDocumentParams(
                        new TextDocumentItem(uri, LanguageIds.infer(file), version, content)));
            } else {
                notify("workspace/didChangeWatchedFiles", new DidChangeWatchedFilesParams(
                        Collections.singletonList(new FileEvent(uri, FileChangeType.Changed))));
                notify("textDocument/didChange", new DidChangeTextDocumentParams(
                        new VersionedTextDocumentIdentifier(uri, version),
                        Collections.singletonList(new TextDocumentContentChangeEvent(content))));
            }
        } catch (LspException e) {
            return CompletableFuture.failedFuture(e);
        }

        if (wait == null) {
            return CompletableFuture.completedFuture(TouchFileResult.ok());
        }
        return wait.handle((ignored, error) -> {
            if (error == null) {
                return TouchFileResult.ok();
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof LspException) {
                LspErrorCode code = ((LspException) cause).getCode();
                if (code == LspErrorCode.ETIMEDOUT) {
                    return TouchFileResult.timedOut();
                }
                if (code == LspErrorCode.EABORTED) {
                    return TouchFileResult.aborted();
                }
            }
            throw new CompletionException(cause);
        });
    }

    /**
     * Wait until the diagnostics sequence of {@code uri} reaches
     * {@code minSequence}, then for a quiet debounce window. Never completes
     * normally below {@code minSequence}.
     */
    public CompletableFuture<Void> waitForDiagnostics(String uri, long minSequence, long timeoutMs,
                                                      AbortSignal signal) {
        DiagnosticsWaiter waiter = new DiagnosticsWaiter(uri, minSequence);
        synchronized (diagnosticsLock) {
            if (state.get() == ClientState.CLOSED) {
                return CompletableFuture.failedFuture(new LspException(LspErrorCode.EPIPE, serverId + " is closed"));
            }
            diagnosticsWaiters.add(waiter);
            waiter.timeoutHandle = scheduler.schedule(() -> failWaiter(waiter,
                    new LspException(LspErrorCode.ETIMEDOUT, "Timed out waiting for diagnostics: " + uri)),
                    timeoutMs, TimeUnit.MILLISECONDS);
            if (diagnosticsSequence.getOrDefault(uri, 0L) >= minSequence) {
                scheduleDebounce(waiter);
            }
        }

        if (signal != null) {
            Runnable cleanup = signal.onAbort(() -> failWaiter(waiter,
                    new LspException(LspErrorCode.EABORTED, "Diagnostics wait aborted: " + uri)));
            synchronized (diagnosticsLock) {
                if (diagnosticsWaiters.contains(waiter)) {
                    waiter.abortCleanup = cleanup;
                    return waiter.future;
                }
            }
            cleanup.run();
        }
        return waiter.future;
    }

    /**
     * Polite shutdown with escalation: {@code shutdown} request, {@code exit}
     * notification, a grace period, then terminate and finally kill the
     * process. Never fails and never hangs.
     */
    public CompletableFuture<Void> shutdown() {
        ClientState current = state.get();
        if (current == ClientState.CLOSED) {
            return terminateProcess();
        }
        transition(current, ClientState.SHUTTING_DOWN);

        return request("shutdown", null, RequestOptions.withTimeout(SHUTDOWN_REQUEST_TIMEOUT_MS))
                .handle((result, error) -> {
                    if (error != null) {
                        logger.debug("shutdown request to {} failed: {}", serverId, error.getMessage());
                    }
                    try {
                        notify("exit", null);
                    } catch (LspException e) {
                        logger.debug("exit notification to {} failed: {}", serverId, e.getMessage());
                    }
                    closeStdin();
                    return null;
                })
                .thenCompose(ignored -> terminateProcess())
                .whenComplete((ignored, error) -> markClosed(serverId + " shut down"));
    }

    private void closeStdin() {
        try {
            synchronized (writeLock) {
                process.getOutputStream().close();
            }
        } catch (IOException e) {
            logger.debug("Closing stdin of {} failed: {}", serverId, e.getMessage());
        }
    }

    private CompletableFuture<Void> terminateProcess() {
        return exitWithin(EXIT_GRACE_MS)
                .thenCompose(exited -> {
                    if (exited) {
                        return CompletableFuture.completedFuture(true);
                    }
                    logger.debug("{} did not exit after shutdown; terminating", serverId);
                    process.destroy();
                    return exitWithin(TERMINATE_WAIT_MS);
                })
                .thenCompose(exited -> {
                    if (exited) {
                        return CompletableFuture.completedFuture(true);
                    }
                    logger.debug("{} ignored termination; killing", serverId);
                    process.destroyForcibly();
                    return exitWithin(KILL_WAIT_MS);
                })
                .thenAccept(exited -> {
                    if (!exited) {
                        logger.warn("LSP server {} still running after kill", serverId);
                    }
                });
    }

    private CompletableFuture<Boolean> exitWithin(long millis) {
        if (!process.isAlive()) {
            return CompletableFuture.completedFuture(true);
        }
        return process.onExit()
                .thenApply(p -> true)
                .completeOnTimeout(false, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "LspClient{" + serverId + "::" + root + ", " + state.get() + "}";
    }
}
