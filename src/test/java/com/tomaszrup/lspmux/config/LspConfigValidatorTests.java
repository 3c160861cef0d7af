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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;

/**
 * Tests for {@link LspConfigValidator}.
 */
class LspConfigValidatorTests {

	private static List<LspConfigValidator.Failure> validate(String text) {
		return LspConfigValidator.validate(JsonParser.parseString(text));
	}

	private static boolean hasFailure(List<LspConfigValidator.Failure> failures, String path) {
		return failures.stream().anyMatch(f -> f.getPath().equals(path));
	}

	@Test
	void testValidDocumentPasses() {
		List<LspConfigValidator.Failure> failures = validate("{"
				+ "\"lsp\":{\"gopls\":{\"command\":[\"gopls\"],\"extensions\":[\".go\"],"
				+ "\"env\":{\"GOFLAGS\":\"-mod=mod\"},\"initialization\":{\"a\":{\"b\":1}},"
				+ "\"roots\":[\"go.mod\"],\"excludeRoots\":[\"vendor/\"],\"rootMode\":\"marker-only\","
				+ "\"disabled\":false}},"
				+ "\"security\":{\"projectConfigPolicy\":\"always\",\"trustedProjectRoots\":[\"~/src\"],"
				+ "\"allowExternalPaths\":true},"
				+ "\"timing\":{\"requestTimeoutMs\":1,\"diagnosticsWaitTimeoutMs\":2,\"initializeTimeoutMs\":3}}");

		Assertions.assertTrue(failures.isEmpty(), "unexpected failures: " + failures);
	}

	@Test
	void testLspFalseIsAccepted() {
		Assertions.assertTrue(validate("{\"lsp\":false}").isEmpty());
	}

	@Test
	void testLspTrueIsRejected() {
		Assertions.assertFalse(validate("{\"lsp\":true}").isEmpty());
	}

	@Test
	void testUnknownPropertiesAreRejectedAtEveryLevel() {
		Assertions.assertFalse(validate("{\"extra\":1}").isEmpty());
		Assertions.assertFalse(validate("{\"lsp\":{\"x\":{\"commands\":[\"a\"]}}}").isEmpty());
		Assertions.assertFalse(validate("{\"security\":{\"trustEverything\":true}}").isEmpty());
		Assertions.assertFalse(validate("{\"timing\":{\"retryMs\":5}}").isEmpty());
	}

	@Test
	void testEmptyCommandIsRejected() {
		List<LspConfigValidator.Failure> failures = validate("{\"lsp\":{\"x\":{\"command\":[]}}}");
		Assertions.assertTrue(hasFailure(failures, "/lsp/x/command"), "failures: " + failures);
	}

	@Test
	void testTimingMustBePositiveIntegers() {
		Assertions.assertFalse(validate("{\"timing\":{\"requestTimeoutMs\":0}}").isEmpty());
		Assertions.assertFalse(validate("{\"timing\":{\"requestTimeoutMs\":1.5}}").isEmpty());
		Assertions.assertFalse(validate("{\"timing\":{\"requestTimeoutMs\":\"100\"}}").isEmpty());
	}

	@Test
	void testInvalidEnumValuesAreRejected() {
		Assertions.assertFalse(validate("{\"lsp\":{\"x\":{\"rootMode\":\"anywhere\"}}}").isEmpty());
		Assertions.assertFalse(validate("{\"security\":{\"projectConfigPolicy\":\"sometimes\"}}").isEmpty());
	}

	@Test
	void testEnvValuesMustBeStrings() {
		Assertions.assertFalse(validate("{\"lsp\":{\"x\":{\"env\":{\"A\":1}}}}").isEmpty());
	}

	@Test
	void testNonObjectDocumentIsRejected() {
		Assertions.assertFalse(validate("[1,2]").isEmpty());
	}

	@Test
	void testFailurePathsEscapeJsonPointerCharacters() {
		List<LspConfigValidator.Failure> failures = validate("{\"lsp\":{\"a/b\":{\"bogus\":1}}}");
		Assertions.assertEquals(1, failures.size(), "failures: " + failures);
		Assertions.assertTrue(failures.get(0).getPath().startsWith("/lsp/a~1b"),
				"path was " + failures.get(0).getPath());
	}
}
