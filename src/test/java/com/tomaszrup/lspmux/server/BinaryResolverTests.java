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
package com.tomaszrup.lspmux.server;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.lspmux.support.TempDirs;

class BinaryResolverTests {

	private Path tempDir;
	private Path pathDir;
	private Path managedDir;
	private BinaryResolver resolver;

	@BeforeEach
	void setup() throws IOException {
		tempDir = Files.createTempDirectory("lspmux-binary-test").toRealPath();
		pathDir = Files.createDirectories(tempDir.resolve("bin"));
		managedDir = Files.createDirectories(tempDir.resolve("managed"));
		resolver = new BinaryResolver(managedDir, false);
	}

	@AfterEach
	void tearDown() {
		TempDirs.deleteRecursively(tempDir);
	}

	private static Path executable(Path file) throws IOException {
		TempDirs.write(file, "#!/bin/sh\n");
		Assumptions.assumeTrue(file.toFile().setExecutable(true), "cannot mark files executable");
		return file;
	}

	private Map<String, String> pathEnv(Path... dirs) {
		Map<String, String> env = new HashMap<>();
		StringBuilder path = new StringBuilder();
		for (Path dir : dirs) {
			if (path.length() > 0) {
				path.append(File.pathSeparator);
			}
			path.append(dir);
		}
		env.put("PATH", path.toString());
		return env;
	}

	@Test
	void testResolvesFromPath() throws IOException {
		Path gopls = executable(pathDir.resolve("gopls"));

		Assertions.assertEquals(gopls, resolver.resolve("gopls", pathEnv(pathDir)));
	}

	@Test
	void testPathKeyIsCaseInsensitive() throws IOException {
		Path gopls = executable(pathDir.resolve("gopls"));
		Map<String, String> env = new HashMap<>();
		env.put("Path", pathDir.toString());

		Assertions.assertEquals(gopls, resolver.resolve("gopls", env));
	}

	@Test
	void testManagedDirectoryIsSearchedLast() throws IOException {
		Path managed = executable(managedDir.resolve("clangd"));

		Assertions.assertEquals(managed, resolver.resolve("clangd", Collections.emptyMap()));

		Path onPath = executable(pathDir.resolve("clangd"));
		Assertions.assertEquals(onPath, resolver.resolve("clangd", pathEnv(pathDir)));
	}

	@Test
	void testNonExecutableIsSkipped() throws IOException {
		TempDirs.write(pathDir.resolve("plain"), "data");

		Assertions.assertNull(resolver.resolve("plain", pathEnv(pathDir)));
	}

	@Test
	void testExplicitPath() throws IOException {
		Path direct = executable(tempDir.resolve("tools/my-ls"));

		Assertions.assertEquals(direct, resolver.resolve(direct.toString(), Collections.emptyMap()));
		Assertions.assertNull(resolver.resolve(tempDir.resolve("tools/missing").toString(), Collections.emptyMap()));
	}

	@Test
	void testMissingBinary() {
		Assertions.assertNull(resolver.resolve("definitely-not-installed-ls", pathEnv(pathDir)));
	}

	@Test
	void testWindowsCandidatesUsePathext() {
		BinaryResolver windows = new BinaryResolver(managedDir, true);
		Map<String, String> env = new HashMap<>();
		env.put("PATHEXT", ".EXE;.CMD");

		Assertions.assertEquals(Arrays.asList("pyright", "pyright.EXE", "pyright.CMD"),
				windows.withWindowsExtensions("pyright", env));
		Assertions.assertEquals(Collections.singletonList("tool.exe"),
				windows.withWindowsExtensions("tool.exe", env), "explicit extension is kept");
		Assertions.assertEquals(5, windows.withWindowsExtensions("pyright", Collections.emptyMap()).size(),
				"default PATHEXT");
	}

	@Test
	void testManagedNodeBin() {
		Assertions.assertEquals(managedDir.resolve("node_modules/.bin/pyright-langserver"),
				resolver.managedNodeBin("pyright-langserver"));
		Assertions.assertEquals(managedDir.resolve("node_modules/.bin/pyright-langserver.cmd"),
				new BinaryResolver(managedDir, true).managedNodeBin("pyright-langserver"));
	}
}
