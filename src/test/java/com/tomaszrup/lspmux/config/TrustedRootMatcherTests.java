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
package com.tomaszrup.lspmux.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TrustedRootMatcher}.
 */
class TrustedRootMatcherTests {

	private final Path home = Paths.get("/home/dev");
	private final TrustedRootMatcher matcher = new TrustedRootMatcher(home);

	@Test
	void testPlainEntryMatchesRootAndDescendants() {
		Assertions.assertTrue(matcher.match(Paths.get("/work/app"), Collections.singletonList("/work")).isTrusted());
		Assertions.assertTrue(matcher.match(Paths.get("/work"), Collections.singletonList("/work/")).isTrusted());
		Assertions.assertFalse(matcher.match(Paths.get("/workshop"), Collections.singletonList("/work")).isTrusted(),
				"prefix of a sibling must not match");
	}

	@Test
	void testTildeIsExpanded() {
		Assertions.assertTrue(matcher.match(Paths.get("/home/dev/src/app"),
				Collections.singletonList("~/src")).isTrusted());
		Assertions.assertTrue(matcher.match(Paths.get("/home/dev/anything"),
				Collections.singletonList("~")).isTrusted());
	}

	@Test
	void testRelativeEntryIsIgnoredWithWarning() {
		TrustedRootMatcher.Result result = matcher.match(Paths.get("/work/app"),
				Arrays.asList("work", "/work"));

		Assertions.assertTrue(result.isTrusted());
		Assertions.assertEquals(1, result.getWarnings().size());
		Assertions.assertEquals(LoadWarning.Type.INVALID_TRUST_ENTRY, result.getWarnings().get(0).getType());
	}

	@Test
	void testGlobEntryMatchesWholePath() {
		Assertions.assertTrue(matcher.match(Paths.get("/work/team-a/app"),
				Collections.singletonList("/work/*/app")).isTrusted());
		Assertions.assertFalse(matcher.match(Paths.get("/work/team-a/lib"),
				Collections.singletonList("/work/*/app")).isTrusted());
		Assertions.assertTrue(matcher.match(Paths.get("/work/.hidden/app"),
				Collections.singletonList("/work/**")).isTrusted(), "dot directories are matched");
	}

	@Test
	void testBrokenGlobYieldsMatcherErrorAndUntrusted() {
		TrustedRootMatcher.Result result = matcher.match(Paths.get("/work/app"),
				Arrays.asList("/work/[a", "/work"));

		Assertions.assertFalse(result.isTrusted());
		Assertions.assertEquals(LoadWarning.Type.TRUST_MATCHER_ERROR,
				result.getWarnings().get(result.getWarnings().size() - 1).getType());
	}

	@Test
	void testNoEntriesMeansUntrusted() {
		TrustedRootMatcher.Result result = matcher.match(Paths.get("/work/app"), Collections.emptyList());
		Assertions.assertFalse(result.isTrusted());
		Assertions.assertTrue(result.getWarnings().isEmpty());
	}

	@Test
	void testStripTrailingSlash() {
		Assertions.assertEquals("/a/b", TrustedRootMatcher.stripTrailingSlash("/a/b///"));
		Assertions.assertEquals("/", TrustedRootMatcher.stripTrailingSlash("/"));
	}
}
