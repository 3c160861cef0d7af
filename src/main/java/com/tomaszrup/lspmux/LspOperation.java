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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmux.client.AbortSignal;
import com.tomaszrup.lspmux.client.DocumentUris;
import com.tomaszrup.lspmux.client.LspClient;
import com.tomaszrup.lspmux.client.RequestOptions;
import org.eclipse.lsp4j.CallHierarchyPrepareParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.ImplementationParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.ReferenceContext;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.WorkspaceSymbolParams;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Code-intelligence operations callers can run through {@link LspRuntime}.
 * Each one knows its LSP method, how to build its params and how to flatten
 * the per-server results.
 */
public enum LspOperation {

    GO_TO_DEFINITION("goToDefinition", "textDocument/definition"),
    FIND_REFERENCES("findReferences", "textDocument/references"),
    HOVER("hover", "textDocument/hover"),
    DOCUMENT_SYMBOL("documentSymbol", "textDocument/documentSymbol"),
    WORKSPACE_SYMBOL("workspaceSymbol", "workspace/symbol"),
    GO_TO_IMPLEMENTATION("goToImplementation", "textDocument/implementation"),
    PREPARE_CALL_HIERARCHY("prepareCallHierarchy", "textDocument/prepareCallHierarchy"),
    INCOMING_CALLS("incomingCalls", "callHierarchy/incomingCalls"),
    OUTGOING_CALLS("outgoingCalls", "callHierarchy/outgoingCalls");

    /** Class, function, method, interface, variable, constant, struct, enum. */
    static final Set<Integer> WORKSPACE_SYMBOL_KINDS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList(5, 12, 6, 11, 13, 14, 23, 10)));
    static final int MAX_WORKSPACE_SYMBOLS_PER_SERVER = 10;

    private final String operationName;
    private final String method;

    LspOperation(String operationName, String method) {
        this.operationName = operationName;
        this.method = method;
    }

    public String getOperationName() {
        return operationName;
    }

    public String getMethod() {
        return method;
    }

    /** Runs across every active client instead of the file's servers. */
    public boolean isWorkspaceWide() {
        return this == WORKSPACE_SYMBOL;
    }

    /**
     * @return the operation, or {@code null} for an unknown name
     */
    public static LspOperation fromName(String name) {
        for (LspOperation operation : values()) {
            if (operation.operationName.equals(name)) {
                return operation;
            }
        }
        return null;
    }

    /**
     * Convert an editor position (1-based) into a protocol position
     * (0-based, clamped at zero).
     */
    public static Position toProtocolPosition(int line, int character) {
        return new Position(Math.max(0, line - 1), Math.max(0, character - 1));
    }

    /**
     * Issue this operation on one client.
     */
    public CompletableFuture<JsonElement> execute(LspClient client, Path file, Position position,
                                                  AbortSignal signal) {
        TextDocumentIdentifier document = new TextDocumentIdentifier(DocumentUris.of(file));
        RequestOptions options = RequestOptions.withSignal(signal);
        switch (this) {
            case GO_TO_DEFINITION:
                return client.request(method, new DefinitionParams(document, position), options);
            case FIND_REFERENCES:
                return client.request(method,
                        new ReferenceParams(document, position, new ReferenceContext(true)), options);
            case HOVER:
                return client.request(method, new HoverParams(document, position), options);
            case DOCUMENT_SYMBOL:
                return client.request(method, new DocumentSymbolParams(document), options);
            case WORKSPACE_SYMBOL:
                return client.request(method, new WorkspaceSymbolParams(""), options)
                        .thenApply(LspOperation::filterWorkspaceSymbols);
            case GO_TO_IMPLEMENTATION:
                return client.request(method, new ImplementationParams(document, position), options);
            case PREPARE_CALL_HIERARCHY:
                return client.request(method, new CallHierarchyPrepareParams(document, position), options);
            case INCOMING_CALLS:
            case OUTGOING_CALLS:
                return client.request(PREPARE_CALL_HIERARCHY.method,
                                new CallHierarchyPrepareParams(document, position), options)
                        .thenCompose(prepared -> {
                            if (!prepared.isJsonArray() || prepared.getAsJsonArray().size() == 0) {
                                return CompletableFuture.completedFuture(new JsonArray());
                            }
                            JsonObject params = new JsonObject();
                            params.add("item", prepared.getAsJsonArray().get(0));
                            return client.request(method, params, options);
                        });
            default:
                throw new IllegalStateException("Unhandled operation " + this);
        }
    }

    static JsonElement filterWorkspaceSymbols(JsonElement symbols) {
        JsonArray filtered = new JsonArray();
        if (symbols == null || !symbols.isJsonArray()) {
            return filtered;
        }
        for (JsonElement symbol : symbols.getAsJsonArray()) {
            if (filtered.size() >= MAX_WORKSPACE_SYMBOLS_PER_SERVER) {
                break;
            }
            if (symbol.isJsonObject() && symbol.getAsJsonObject().has("kind")
                    && symbol.getAsJsonObject().get("kind").isJsonPrimitive()
                    && symbol.getAsJsonObject().get("kind").getAsJsonPrimitive().isNumber()
                    && WORKSPACE_SYMBOL_KINDS.contains(symbol.getAsJsonObject().get("kind").getAsInt())) {
                filtered.add(symbol);
            }
        }
        return filtered;
    }

    /**
     * Flatten the successful values of a run into one array: arrays are
     * spliced, single objects appended, nulls dropped.
     */
    public JsonArray collect(RunSummary<JsonElement> summary) {
        JsonArray result = new JsonArray();
        for (RequestOutcome<JsonElement> outcome : summary.getOutcomes()) {
            if (!outcome.isOk() || outcome.getValue() == null || outcome.getValue().isJsonNull()) {
                continue;
            }
            JsonElement value = outcome.getValue();
            if (value.isJsonArray()) {
                for (JsonElement item : value.getAsJsonArray()) {
                    if (!item.isJsonNull()) {
                        result.add(item);
                    }
                }
            } else if (this == GO_TO_DEFINITION || this == FIND_REFERENCES
                    || this == GO_TO_IMPLEMENTATION || this == HOVER) {
                result.add(value);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return operationName;
    }
}
