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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmux;

import java.util.Arrays;
import java.util.Collections;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

class LspOperationTests {

	private static JsonObject symbol(String name, int kind) {
		JsonObject symbol = new JsonObject();
		symbol.addProperty("name", name);
		symbol.addProperty("kind", kind);
		return symbol;
	}

	// ------------------------------------------------------------------
	// Names and positions
	// ------------------------------------------------------------------

	@Test
	void testFromName() {
		Assertions.assertEquals(LspOperation.GO_TO_DEFINITION, LspOperation.fromName("goToDefinition"));
		Assertions.assertEquals(LspOperation.OUTGOING_CALLS, LspOperation.fromName("outgoingCalls"));
		Assertions.assertNull(LspOperation.fromName("GO_TO_DEFINITION"));
		Assertions.assertNull(LspOperation.fromName("rename"));
	}

	@Test
	void testEveryOperationHasDistinctMethod() {
		long distinct = Arrays.stream(LspOperation.values()).map(LspOperation::getMethod).distinct().count();
		Assertions.assertEquals(LspOperation.values().length, distinct);
		Assertions.assertEquals("callHierarchy/incomingCalls", LspOperation.INCOMING_CALLS.getMethod());
	}

	@Test
	void testOnlyWorkspaceSymbolIsWorkspaceWide() {
		for (LspOperation operation : LspOperation.values()) {
			Assertions.assertEquals(operation == LspOperation.WORKSPACE_SYMBOL, operation.isWorkspaceWide(),
					operation.getOperationName());
		}
	}

	@Test
	void testToProtocolPositionIsZeroBased() {
		Assertions.assertEquals(new Position(9, 4), LspOperation.toProtocolPosition(10, 5));
		Assertions.assertEquals(new Position(0, 0), LspOperation.toProtocolPosition(1, 1));
	}

	@Test
	void testToProtocolPositionClampsAtZero() {
		Assertions.assertEquals(new Position(0, 0), LspOperation.toProtocolPosition(0, -3));
	}

	// ------------------------------------------------------------------
	// Workspace symbol filtering
	// ------------------------------------------------------------------

	@Test
	void testFilterWorkspaceSymbolsKeepsInterestingKinds() {
		JsonArray symbols = new JsonArray();
		symbols.add(symbol("File", 1));
		symbols.add(symbol("Widget", 5));
		symbols.add(symbol("count", 13));
		symbols.add(symbol("Key", 20));
		symbols.add(symbol("Color", 10));
		symbols.add(new JsonObject());

		JsonArray filtered = LspOperation.filterWorkspaceSymbols(symbols).getAsJsonArray();

		Assertions.assertEquals(3, filtered.size());
		Assertions.assertEquals("Widget", filtered.get(0).getAsJsonObject().get("name").getAsString());
		Assertions.assertEquals("count", filtered.get(1).getAsJsonObject().get("name").getAsString());
		Assertions.assertEquals("Color", filtered.get(2).getAsJsonObject().get("name").getAsString());
	}

	@Test
	void testFilterWorkspaceSymbolsCapsPerServer() {
		JsonArray symbols = new JsonArray();
		for (int i = 0; i < 25; i++) {
			symbols.add(symbol("Fn" + i, 12));
		}

		JsonArray filtered = LspOperation.filterWorkspaceSymbols(symbols).getAsJsonArray();

		Assertions.assertEquals(LspOperation.MAX_WORKSPACE_SYMBOLS_PER_SERVER, filtered.size());
		Assertions.assertEquals("Fn9", filtered.get(9).getAsJsonObject().get("name").getAsString());
	}

	@Test
	void testFilterWorkspaceSymbolsWithNonArray() {
		Assertions.assertEquals(0, LspOperation.filterWorkspaceSymbols(null).getAsJsonArray().size());
		Assertions.assertEquals(0, LspOperation.filterWorkspaceSymbols(JsonNull.INSTANCE).getAsJsonArray().size());
	}

	// ------------------------------------------------------------------
	// Collecting results
	// ------------------------------------------------------------------

	@Test
	void testCollectSplicesArraysAndDropsFailures() {
		JsonElement first = JsonParser.parseString("[{\"uri\":\"file:///a\"},null,{\"uri\":\"file:///b\"}]");
		JsonElement second = JsonParser.parseString("[{\"uri\":\"file:///c\"}]");
		RunSummary<JsonElement> summary = new RunSummary<>(3, Arrays.asList(
				RequestOutcome.success("one", "one::/w", first),
				RequestOutcome.<JsonElement>failure("two", "two::/w", new LspError("two", "EPIPE", "gone")),
				RequestOutcome.success("three", "three::/w", second)), Collections.emptyList());

		JsonArray collected = LspOperation.FIND_REFERENCES.collect(summary);

		Assertions.assertEquals(3, collected.size());
		Assertions.assertEquals("file:///c", collected.get(2).getAsJsonObject().get("uri").getAsString());
	}

	@Test
	void testCollectKeepsSingleHoverObject() {
		JsonElement hover = JsonParser.parseString("{\"contents\":{\"kind\":\"plaintext\",\"value\":\"int x\"}}");
		RunSummary<JsonElement> summary = new RunSummary<>(2, Arrays.asList(
				RequestOutcome.success("one", "one::/w", hover),
				RequestOutcome.<JsonElement>success("two", "two::/w", JsonNull.INSTANCE)), Collections.emptyList());

		Assertions.assertEquals(1, LspOperation.HOVER.collect(summary).size());
	}

	@Test
	void testCollectIgnoresSingleObjectForListOperations() {
		JsonElement stray = JsonParser.parseString("{\"name\":\"x\"}");
		RunSummary<JsonElement> summary = new RunSummary<>(1, Collections.singletonList(
				RequestOutcome.success("one", "one::/w", stray)), Collections.emptyList());

		Assertions.assertEquals(0, LspOperation.DOCUMENT_SYMBOL.collect(summary).size());
		Assertions.assertEquals(1, LspOperation.GO_TO_DEFINITION.collect(summary).size());
	}
}
