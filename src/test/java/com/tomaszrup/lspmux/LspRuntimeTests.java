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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.tomaszrup.lspmux.config.ServerSource;
import com.tomaszrup.lspmux.config.TimingConfig;
import com.tomaszrup.lspmux.support.FakeLanguageServer;
import com.tomaszrup.lspmux.support.FakeServerLauncher;
import com.tomaszrup.lspmux.support.TempDirs;

/**
 * Tests for {@link LspRuntime} with two fake servers registered for
 * {@code .fake} files.
 */
class LspRuntimeTests {

	private static final long WAIT_SECONDS = 15;

	private Path tempDir;
	private Path home;
	private Path workspace;
	private Path binary;
	private Path file;
	private FakeServerLauncher launcher;
	private AtomicLong now;
	private LspRuntime runtime;

	@BeforeEach
	void setup() throws IOException {
		tempDir = Files.createTempDirectory("lspmux-runtime-test").toRealPath();
		home = Files.createDirectories(tempDir.resolve("home"));
		workspace = Files.createDirectories(tempDir.resolve("workspace"));
		Files.createDirectories(workspace.resolve(".git"));
		binary = TempDirs.write(tempDir.resolve("bin/fake-ls"), "#!/bin/sh\n");
		Assumptions.assumeTrue(binary.toFile().setExecutable(true), "cannot mark files executable");
		file = TempDirs.write(workspace.resolve("src/main.fake"), "alpha beta\n");

		writeConfig("{\"lsp\":{"
				+ "\"fake-a\":{\"command\":[\"" + binary + "\",\"fake-a\"],\"extensions\":[\".fake\"],"
				+ "\"env\":{\"FAKE_MODE\":\"a\"}},"
				+ "\"fake-b\":{\"command\":[\"" + binary + "\",\"fake-b\"],\"extensions\":[\"fake\"]}"
				+ "},\"timing\":{\"diagnosticsWaitTimeoutMs\":2000,\"requestTimeoutMs\":5000}}");

		launcher = new FakeServerLauncher();
		now = new AtomicLong(1_000_000);
		runtime = LspRuntime.builder(workspace)
				.homeDir(home)
				.launcher(launcher)
				.baseEnv(Collections.singletonMap("PATH", tempDir.resolve("bin").toString()))
				.clock(now::get)
				.backoff(new BackoffPolicy(() -> 1.0))
				.build();
	}

	@AfterEach
	void tearDown() {
		runtime.close();
		TempDirs.deleteRecursively(tempDir);
	}

	private void writeConfig(String json) throws IOException {
		TempDirs.write(home.resolve(".lspmux/lsp.json"), json);
	}

	private String key(String serverId) {
		return ClientKey.of(serverId, workspace);
	}

	private static RequestOutcome<JsonElement> outcomeFor(RunSummary<JsonElement> summary, String serverId) {
		for (RequestOutcome<JsonElement> outcome : summary.getOutcomes()) {
			if (outcome.getServerId().equals(serverId)) {
				return outcome;
			}
		}
		return Assertions.fail("no outcome for " + serverId);
	}

	private RunSummary<JsonElement> definition() throws Exception {
		Position position = new Position(0, 1);
		return runtime.<JsonElement>run(file, (client, entry) ->
				LspOperation.GO_TO_DEFINITION.execute(client, file, position, null))
				.get(WAIT_SECONDS, TimeUnit.SECONDS);
	}

	// ------------------------------------------------------------------
	// Fan-out
	// ------------------------------------------------------------------

	@Test
	void testOperationFansOutToEveryServer() throws Exception {
		RunSummary<JsonElement> summary = runtime.run("src/main.fake", LspOperation.HOVER, 1, 1, null)
				.get(WAIT_SECONDS, TimeUnit.SECONDS);

		Assertions.assertEquals(2, summary.getHits());
		Assertions.assertEquals(2, summary.getOutcomes().size());
		Assertions.assertTrue(summary.getOutcomes().stream().allMatch(RequestOutcome::isOk));

		JsonArray hovers = LspOperation.HOVER.collect(summary);
		Assertions.assertEquals(2, hovers.size());
		List<String> texts = new ArrayList<>();
		for (JsonElement hover : hovers) {
			texts.add(hover.getAsJsonObject().getAsJsonObject("contents").get("value").getAsString());
		}
		Assertions.assertTrue(texts.contains("fake-a hover at 0:0"), texts.toString());
		Assertions.assertTrue(texts.contains("fake-b hover at 0:0"), texts.toString());

		FakeLanguageServer serverA = launcher.latest("fake-a");
		Assertions.assertTrue(serverA.receivedMethods.indexOf("textDocument/didOpen")
				< serverA.receivedMethods.indexOf("textDocument/hover"), "file is synced before the query");
	}

	@Test
	void testServerStartsInResolvedRootWithEnvOverlay() throws Exception {
		runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);

		Assertions.assertEquals(Collections.nCopies(2, workspace), launcher.workingDirectories);
		boolean overlaid = launcher.environments.stream()
				.anyMatch(env -> "a".equals(env.get("FAKE_MODE")) && env.containsKey("PATH"));
		Assertions.assertTrue(overlaid, "server env is laid over the base environment");
	}

	@Test
	void testConcurrentCallersShareOneSpawn() throws Exception {
		List<CompletableFuture<List<RuntimeClientEntry>>> calls = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			calls.add(CompletableFuture.supplyAsync(() -> runtime.getClientsForFile(file)).thenCompose(f -> f));
		}
		for (CompletableFuture<List<RuntimeClientEntry>> call : calls) {
			Assertions.assertEquals(2, call.get(WAIT_SECONDS, TimeUnit.SECONDS).size());
		}

		Assertions.assertEquals(1, launcher.launchCount("fake-a"));
		Assertions.assertEquals(1, launcher.launchCount("fake-b"));
	}

	@Test
	void testSpawnAfterStaleCheckReusesLiveClient() throws Exception {
		List<RuntimeClientEntry> first = runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);
		RuntimeClientEntry liveA = first.stream().filter(e -> e.getServerId().equals("fake-a")).findFirst()
				.orElseThrow();

		// a caller that saw no live entry just before the first spawn registered
		RuntimeClientEntry reused = runtime.spawnClient(key("fake-a"),
				runtime.getConfiguredServers().get("fake-a"), workspace, TimingConfig.defaults())
				.get(WAIT_SECONDS, TimeUnit.SECONDS);

		Assertions.assertSame(liveA, reused);
		Assertions.assertEquals(1, launcher.launchCount("fake-a"));
		Assertions.assertTrue(launcher.latest("fake-a").getProcess().isAlive(), "first process is not orphaned");
	}

	@Test
	void testNoServerForExtension() throws Exception {
		Path notes = TempDirs.write(workspace.resolve("notes.unknown"), "text");

		Assertions.assertFalse(runtime.hasAvailableClientForFile(notes));
		RunSummary<JsonElement> summary = runtime.run("notes.unknown", LspOperation.HOVER, 1, 1, null)
				.get(WAIT_SECONDS, TimeUnit.SECONDS);

		Assertions.assertEquals(0, summary.getHits());
		Assertions.assertTrue(summary.getOutcomes().isEmpty());
		Assertions.assertEquals(0, launcher.launchCount("fake-a"));
	}

	@Test
	void testWorkspaceSymbolQueriesActiveClients() throws Exception {
		runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);

		RunSummary<JsonElement> summary = runtime.run("src/main.fake", LspOperation.WORKSPACE_SYMBOL, 1, 1, null)
				.get(WAIT_SECONDS, TimeUnit.SECONDS);

		Assertions.assertEquals(2, summary.getHits());
		Assertions.assertEquals(2 * LspOperation.MAX_WORKSPACE_SYMBOLS_PER_SERVER,
				LspOperation.WORKSPACE_SYMBOL.collect(summary).size());
	}

	@Test
	void testIncomingCallsPreparesFirst() throws Exception {
		RunSummary<JsonElement> summary = runtime.run("src/main.fake", LspOperation.INCOMING_CALLS, 1, 2, null)
				.get(WAIT_SECONDS, TimeUnit.SECONDS);

		JsonArray calls = LspOperation.INCOMING_CALLS.collect(summary);
		Assertions.assertEquals(2, calls.size());
		String caller = calls.get(0).getAsJsonObject().getAsJsonObject("from").get("name").getAsString();
		Assertions.assertTrue(caller.startsWith("callerOffake-"), caller);
	}

	// ------------------------------------------------------------------
	// Failure isolation and backoff
	// ------------------------------------------------------------------

	@Test
	void testCrashMidRequestIsolatesFailure() throws Exception {
		launcher.customize("fake-b", server -> server.setHangDefinitions(true));
		runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);
		FakeLanguageServer serverB = launcher.latest("fake-b");

		Position position = new Position(0, 1);
		CompletableFuture<RunSummary<JsonElement>> pending = runtime.run(file, (client, entry) ->
				LspOperation.GO_TO_DEFINITION.execute(client, file, position, null));
		Assertions.assertTrue(serverB.definitionReceived.await(WAIT_SECONDS, TimeUnit.SECONDS));
		serverB.getProcess().crash();
		RunSummary<JsonElement> summary = pending.get(WAIT_SECONDS, TimeUnit.SECONDS);

		Assertions.assertTrue(outcomeFor(summary, "fake-a").isOk());
		RequestOutcome<JsonElement> failed = outcomeFor(summary, "fake-b");
		Assertions.assertFalse(failed.isOk());
		Assertions.assertEquals("EPIPE", failed.getError().getCode());
		Assertions.assertEquals(1, runtime.getBrokenState(key("fake-b")).getAttempts());

		RunSummary<JsonElement> retry = definition();
		Assertions.assertEquals(2, retry.getHits());
		Assertions.assertTrue(outcomeFor(retry, "fake-a").isOk());
		Assertions.assertEquals("EBROKEN", outcomeFor(retry, "fake-b").getError().getCode());
		Assertions.assertEquals(1, launcher.launchCount("fake-b"), "no respawn while backing off");
	}

	@Test
	void testSpawnFailureBacksOffThenRecovers() throws Exception {
		launcher.failNext("fake-a", 1);

		RunSummary<JsonElement> first = definition();
		RequestOutcome<JsonElement> failed = outcomeFor(first, "fake-a");
		Assertions.assertEquals("ESPAWN", failed.getError().getCode());
		Assertions.assertEquals("Failed to spawn fake-a: launch of fake-a refused", failed.getError().getMessage());
		Assertions.assertTrue(outcomeFor(first, "fake-b").isOk());
		BrokenServerState state = runtime.getBrokenState(key("fake-a"));
		Assertions.assertEquals(1, state.getAttempts());
		Assertions.assertEquals(now.get() + 5_000, state.getRetryAt());

		Assertions.assertTrue(runtime.hasAvailableClientForFile(file), "fake-b is still available");
		RunSummary<JsonElement> backingOff = definition();
		Assertions.assertEquals("EBROKEN", outcomeFor(backingOff, "fake-a").getError().getCode());
		Assertions.assertEquals(1, launcher.launchCount("fake-a"));

		now.addAndGet(5_000);
		RunSummary<JsonElement> recovered = definition();
		Assertions.assertTrue(outcomeFor(recovered, "fake-a").isOk());
		Assertions.assertNull(runtime.getBrokenState(key("fake-a")), "success clears the backoff");
		Assertions.assertEquals(2, launcher.launchCount("fake-a"));
	}

	@Test
	void testRequestTimeoutDoesNotMarkBroken() throws Exception {
		launcher.customize("fake-a", server -> server.setHangDefinitions(true));
		writeConfig(new String(Files.readAllBytes(home.resolve(".lspmux/lsp.json")))
				.replace("\"requestTimeoutMs\":5000", "\"requestTimeoutMs\":300"));
		runtime.reloadConfig();

		RunSummary<JsonElement> summary = definition();

		RequestOutcome<JsonElement> timedOut = outcomeFor(summary, "fake-a");
		Assertions.assertTrue(timedOut.isTimedOut());
		Assertions.assertNull(runtime.getBrokenState(key("fake-a")));
		Assertions.assertTrue(summary.anyOk());
	}

	// ------------------------------------------------------------------
	// Configuration changes
	// ------------------------------------------------------------------

	@Test
	void testLspFalseShutsClientsDown() throws Exception {
		runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);
		FakeLanguageServer serverA = launcher.latest("fake-a");

		writeConfig("{\"lsp\":false}");
		runtime.reloadConfig();

		serverA.getProcess().onExit().get(WAIT_SECONDS, TimeUnit.SECONDS);
		Assertions.assertTrue(runtime.getConfiguredServers().isEmpty());
		RunSummary<JsonElement> summary = definition();
		Assertions.assertEquals(0, summary.getHits());
		Assertions.assertFalse(runtime.hasAvailableClientForFile(file));
	}

	@Test
	void testUnchangedConfigKeepsClients() throws Exception {
		runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);

		runtime.reloadConfig();
		runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);

		Assertions.assertEquals(1, launcher.launchCount("fake-a"));
		Assertions.assertTrue(launcher.latest("fake-a").getProcess().isAlive());
	}

	// ------------------------------------------------------------------
	// Paths
	// ------------------------------------------------------------------

	@Test
	void testPathOutsideWorkspaceIsRejected() throws IOException {
		TempDirs.write(tempDir.resolve("elsewhere.fake"), "x");

		Assertions.assertThrows(LspPathException.class,
				() -> runtime.run("../elsewhere.fake", LspOperation.HOVER, 1, 1, null));
		Assertions.assertEquals(0, launcher.launchCount("fake-a"));
	}

	@Test
	void testMissingFileIsRejected() {
		Assertions.assertThrows(LspPathException.class,
				() -> runtime.run("src/missing.fake", LspOperation.HOVER, 1, 1, null));
	}

	// ------------------------------------------------------------------
	// Diagnostics, snapshot and shutdown
	// ------------------------------------------------------------------

	@Test
	void testDiagnosticsAreMergedPerFile() throws Exception {
		TouchResult touch = runtime.touchFile(file, true, null).get(WAIT_SECONDS, TimeUnit.SECONDS);
		Assertions.assertTrue(touch.isTouched());
		Assertions.assertFalse(touch.isTimedOut());

		Map<Path, List<Diagnostic>> diagnostics = runtime.diagnostics();

		List<Diagnostic> forFile = diagnostics.get(file);
		Assertions.assertNotNull(forFile, diagnostics.keySet().toString());
		Assertions.assertEquals(2, forFile.size());
	}

	@Test
	void testSnapshotReportsConnectedAndBrokenServers() throws Exception {
		launcher.failNext("fake-b", 1);
		definition();

		RuntimeSnapshot snapshot = runtime.getSnapshot();

		RuntimeSnapshot.Row first = snapshot.getRows().get(0);
		Assertions.assertEquals("fake-b", first.getServerId());
		Assertions.assertEquals(RuntimeSnapshot.Bucket.BROKEN, first.getBucket());
		RuntimeSnapshot.Row connected = snapshot.getRows().get(1);
		Assertions.assertEquals("fake-a", connected.getServerId());
		Assertions.assertEquals(ServerSource.GLOBAL, connected.getProvenance());
		Assertions.assertEquals(Collections.singletonList(workspace.toString()), connected.getConnectedRoots());
		Assertions.assertEquals(1, snapshot.getTotals().getBroken());
		Assertions.assertEquals(1, snapshot.getTotals().getConnected());
		Assertions.assertTrue(snapshot.summarize().contains("- fake-b: broken (attempts=1)"), snapshot.summarize());
	}

	@Test
	void testShutdownAllLeavesRuntimeUsable() throws Exception {
		runtime.getClientsForFile(file).get(WAIT_SECONDS, TimeUnit.SECONDS);
		FakeLanguageServer serverA = launcher.latest("fake-a");

		runtime.shutdownAll();

		Assertions.assertFalse(serverA.getProcess().isAlive());
		Assertions.assertTrue(serverA.receivedMethods.contains("shutdown"));
		Assertions.assertTrue(definition().anyOk());
		Assertions.assertEquals(2, launcher.launchCount("fake-a"));
	}
}
