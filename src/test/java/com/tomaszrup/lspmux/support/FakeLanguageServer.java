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
package com.tomaszrup.lspmux.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.eclipse.lsp4j.CallHierarchyIncomingCall;
import org.eclipse.lsp4j.CallHierarchyIncomingCallsParams;
import org.eclipse.lsp4j.CallHierarchyItem;
import org.eclipse.lsp4j.CallHierarchyOutgoingCall;
import org.eclipse.lsp4j.CallHierarchyOutgoingCallsParams;
import org.eclipse.lsp4j.CallHierarchyPrepareParams;
import org.eclipse.lsp4j.ConfigurationItem;
import org.eclipse.lsp4j.ConfigurationParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.WorkspaceSymbolParams;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;

/**
 * Minimal lsp4j language server running against an {@link InMemoryProcess}.
 * Every answer carries the server's name so tests can tell servers apart.
 */
public class FakeLanguageServer implements LanguageServer, LanguageClientAware, TextDocumentService, WorkspaceService {

	private static final ExecutorService LISTENERS = Executors.newCachedThreadPool(r -> {
		Thread t = new Thread(r, "fake-language-server");
		t.setDaemon(true);
		return t;
	});

	private final String name;
	private final InMemoryProcess process;
	private volatile LanguageClient client;
	private volatile boolean publishDiagnostics = true;
	private volatile boolean hangDefinitions;
	private volatile boolean requestConfiguration;
	volatile Throwable listenerError;

	public final List<String> receivedMethods = new CopyOnWriteArrayList<>();
	public final List<Integer> receivedVersions = new CopyOnWriteArrayList<>();
	public final CountDownLatch definitionReceived = new CountDownLatch(1);
	public final CompletableFuture<InitializeParams> initializeParams = new CompletableFuture<>();
	public final CompletableFuture<List<Object>> configurationAnswer = new CompletableFuture<>();
	public final CompletableFuture<Object> didChangeConfiguration = new CompletableFuture<>();

	public FakeLanguageServer(String name, InMemoryProcess process) {
		this.name = name;
		this.process = process;
	}

	/** Create a server, attach it to {@code process} and start listening. */
	public static FakeLanguageServer start(String name, InMemoryProcess process) {
		return attach(new FakeLanguageServer(name, process));
	}

	/** Start listening on the server's process pipes. */
	public static FakeLanguageServer attach(FakeLanguageServer server) {
		InMemoryProcess process = server.process;
		Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, process.serverInput(),
				process.serverOutput(), LISTENERS, null);
		server.connect(launcher.getRemoteProxy());
		CompletableFuture.runAsync(() -> {
			try {
				launcher.startListening().get();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			} catch (ExecutionException e) {
				server.listenerError = e.getCause();
			}
			process.exit(0);
		}, LISTENERS);
		return server;
	}

	public String getName() {
		return name;
	}

	public InMemoryProcess getProcess() {
		return process;
	}

	public void setPublishDiagnostics(boolean publishDiagnostics) {
		this.publishDiagnostics = publishDiagnostics;
	}

	/** Never answer {@code textDocument/definition}. */
	public void setHangDefinitions(boolean hangDefinitions) {
		this.hangDefinitions = hangDefinitions;
	}

	/** Ask the client for {@code workspace/configuration} after {@code initialized}. */
	public void setRequestConfiguration(boolean requestConfiguration) {
		this.requestConfiguration = requestConfiguration;
	}

	@Override
	public void connect(LanguageClient client) {
		this.client = client;
	}

	// ---- lifecycle ----

	@Override
	public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
		receivedMethods.add("initialize");
		initializeParams.complete(params);
		ServerCapabilities capabilities = new ServerCapabilities();
		capabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
		capabilities.setHoverProvider(true);
		capabilities.setDefinitionProvider(true);
		return CompletableFuture.completedFuture(new InitializeResult(capabilities));
	}

	@Override
	public void initialized(InitializedParams params) {
		receivedMethods.add("initialized");
		if (requestConfiguration) {
			ConfigurationItem item = new ConfigurationItem();
			item.setSection("fake");
			client.configuration(new ConfigurationParams(Collections.singletonList(item)))
					.whenComplete((answer, error) -> {
						if (error != null) {
							configurationAnswer.completeExceptionally(error);
						} else {
							configurationAnswer.complete(answer);
						}
					});
		}
	}

	@Override
	public CompletableFuture<Object> shutdown() {
		receivedMethods.add("shutdown");
		return CompletableFuture.completedFuture(null);
	}

	@Override
	public void exit() {
		receivedMethods.add("exit");
		process.exit(0);
	}

	@Override
	public TextDocumentService getTextDocumentService() {
		return this;
	}

	@Override
	public WorkspaceService getWorkspaceService() {
		return this;
	}

	// ---- documents ----

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		receivedMethods.add("textDocument/didOpen");
		receivedVersions.add(params.getTextDocument().getVersion());
		publish(params.getTextDocument().getUri(), params.getTextDocument().getVersion());
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		receivedMethods.add("textDocument/didChange");
		receivedVersions.add(params.getTextDocument().getVersion());
		publish(params.getTextDocument().getUri(), params.getTextDocument().getVersion());
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		receivedMethods.add("textDocument/didClose");
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		receivedMethods.add("textDocument/didSave");
	}

	private void publish(String uri, int version) {
		if (!publishDiagnostics) {
			return;
		}
		Diagnostic diagnostic = new Diagnostic(range(), name + " diagnostic v" + version,
				DiagnosticSeverity.Error, name);
		client.publishDiagnostics(new PublishDiagnosticsParams(uri, Collections.singletonList(diagnostic), version));
	}

	// ---- queries ----

	@Override
	public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(
			DefinitionParams params) {
		receivedMethods.add("textDocument/definition");
		definitionReceived.countDown();
		if (hangDefinitions) {
			return new CompletableFuture<>();
		}
		return CompletableFuture.completedFuture(Either.forLeft(
				Collections.singletonList(new Location(params.getTextDocument().getUri(), range()))));
	}

	@Override
	public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
		receivedMethods.add("textDocument/references");
		List<Location> locations = new ArrayList<>();
		locations.add(new Location(params.getTextDocument().getUri(), range()));
		if (params.getContext() != null && params.getContext().isIncludeDeclaration()) {
			locations.add(new Location(params.getTextDocument().getUri(), new Range(new Position(1, 0), new Position(1, 1))));
		}
		return CompletableFuture.completedFuture(locations);
	}

	@Override
	public CompletableFuture<Hover> hover(HoverParams params) {
		receivedMethods.add("textDocument/hover");
		Position position = params.getPosition();
		return CompletableFuture.completedFuture(new Hover(new MarkupContent(MarkupKind.PLAINTEXT,
				name + " hover at " + position.getLine() + ":" + position.getCharacter())));
	}

	@Override
	public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> documentSymbol(
			DocumentSymbolParams params) {
		receivedMethods.add("textDocument/documentSymbol");
		DocumentSymbol symbol = new DocumentSymbol(name + "Symbol", SymbolKind.Class, range(), range());
		return CompletableFuture.completedFuture(Collections.singletonList(Either.forRight(symbol)));
	}

	@Override
	public CompletableFuture<Either<List<? extends SymbolInformation>, List<? extends WorkspaceSymbol>>> symbol(
			WorkspaceSymbolParams params) {
		receivedMethods.add("workspace/symbol");
		List<WorkspaceSymbol> symbols = new ArrayList<>();
		for (int i = 0; i < 12; i++) {
			symbols.add(new WorkspaceSymbol(name + "Class" + i, SymbolKind.Class,
					Either.forLeft(new Location("file:///tmp/" + name + ".fake", range()))));
		}
		symbols.add(new WorkspaceSymbol(name + "Var", SymbolKind.Variable,
				Either.forLeft(new Location("file:///tmp/" + name + ".fake", range()))));
		return CompletableFuture.completedFuture(Either.forRight(symbols));
	}

	@Override
	public CompletableFuture<List<CallHierarchyItem>> prepareCallHierarchy(CallHierarchyPrepareParams params) {
		receivedMethods.add("textDocument/prepareCallHierarchy");
		CallHierarchyItem item = new CallHierarchyItem(name + "Fn", SymbolKind.Function,
				params.getTextDocument().getUri(), range(), range());
		return CompletableFuture.completedFuture(Collections.singletonList(item));
	}

	@Override
	public CompletableFuture<List<CallHierarchyIncomingCall>> callHierarchyIncomingCalls(
			CallHierarchyIncomingCallsParams params) {
		receivedMethods.add("callHierarchy/incomingCalls");
		CallHierarchyItem caller = new CallHierarchyItem("callerOf" + params.getItem().getName(), SymbolKind.Function,
				params.getItem().getUri(), range(), range());
		return CompletableFuture.completedFuture(Collections.singletonList(
				new CallHierarchyIncomingCall(caller, Collections.singletonList(range()))));
	}

	@Override
	public CompletableFuture<List<CallHierarchyOutgoingCall>> callHierarchyOutgoingCalls(
			CallHierarchyOutgoingCallsParams params) {
		receivedMethods.add("callHierarchy/outgoingCalls");
		return CompletableFuture.completedFuture(Collections.emptyList());
	}

	// ---- workspace ----

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		receivedMethods.add("workspace/didChangeConfiguration");
		didChangeConfiguration.complete(params.getSettings());
	}

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		receivedMethods.add("workspace/didChangeWatchedFiles");
	}

	private static Range range() {
		return new Range(new Position(0, 0), new Position(0, 3));
	}
}
