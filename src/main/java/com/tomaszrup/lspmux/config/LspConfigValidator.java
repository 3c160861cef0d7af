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
package com.tomaszrup.lspmux.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strict structural validation of an {@code lsp.json} document. Unknown
 * properties are rejected at every level. Failures are reported as
 * JSON-pointer style paths with a message, all collected in one pass.
 */
public final class LspConfigValidator {

    private static final Set<String> FILE_KEYS = keys("lsp", "security", "timing");
    private static final Set<String> SERVER_KEYS = keys("disabled", "command", "extensions", "env",
            "initialization", "roots", "excludeRoots", "rootMode");
    private static final Set<String> SECURITY_KEYS = keys("projectConfigPolicy", "trustedProjectRoots",
            "allowExternalPaths");
    private static final Set<String> TIMING_KEYS = keys("requestTimeoutMs", "diagnosticsWaitTimeoutMs",
            "initializeTimeoutMs");

    /** One validation problem. */
    public static final class Failure {
        private final String path;
        private final String message;

        Failure(String path, String message) {
            this.path = path;
            this.message = message;
        }

        public String getPath() {
            return path;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return path + " " + message;
        }
    }

    private LspConfigValidator() {
        // utility class
    }

    /**
     * @return all failures; empty when the document is valid
     */
    public static List<Failure> validate(JsonElement document) {
        List<Failure> failures = new ArrayList<>();
        if (document == null || !document.isJsonObject()) {
            failures.add(new Failure("/", "Expected object"));
            return failures;
        }
        JsonObject root = document.getAsJsonObject();
        rejectUnknown(root, FILE_KEYS, "", failures);

        if (root.has("lsp")) {
            validateLsp(root.get("lsp"), failures);
        }
        if (root.has("security")) {
            validateSecurity(root.get("security"), failures);
        }
        if (root.has("timing")) {
            validateTiming(root.get("timing"), failures);
        }
        return failures;
    }

    private static void validateLsp(JsonElement lsp, List<Failure> failures) {
        if (isBoolean(lsp) && !lsp.getAsBoolean()) {
            return;
        }
        if (!lsp.isJsonObject()) {
            failures.add(new Failure("/lsp", "Expected false or object of server entries"));
            return;
        }
        for (Map.Entry<String, JsonElement> entry : lsp.getAsJsonObject().entrySet()) {
            validateServer("/lsp/" + escape(entry.getKey()), entry.getValue(), failures);
        }
    }

    private static void validateServer(String path, JsonElement server, List<Failure> failures) {
        if (!server.isJsonObject()) {
            failures.add(new Failure(path, "Expected object"));
            return;
        }
        JsonObject object = server.getAsJsonObject();
        rejectUnknown(object, SERVER_KEYS, path, failures);

        if (object.has("disabled") && !isBoolean(object.get("disabled"))) {
            failures.add(new Failure(path + "/disabled", "Expected boolean"));
        }
        if (object.has("command")) {
            JsonElement command = object.get("command");
            if (checkStringArray(path + "/command", command, failures) && command.getAsJsonArray().size() < 1) {
                failures.add(new Failure(path + "/command", "Expected array length to be greater or equal to 1"));
            }
        }
        if (object.has("extensions")) {
            checkStringArray(path + "/extensions", object.get("extensions"), failures);
        }
        if (object.has("roots")) {
            checkStringArray(path + "/roots", object.get("roots"), failures);
        }
        if (object.has("excludeRoots")) {
            checkStringArray(path + "/excludeRoots", object.get("excludeRoots"), failures);
        }
        if (object.has("env")) {
            JsonElement env = object.get("env");
            if (!env.isJsonObject()) {
                failures.add(new Failure(path + "/env", "Expected object"));
            } else {
                for (Map.Entry<String, JsonElement> variable : env.getAsJsonObject().entrySet()) {
                    if (!isString(variable.getValue())) {
                        failures.add(new Failure(path + "/env/" + escape(variable.getKey()), "Expected string"));
                    }
                }
            }
        }
        if (object.has("initialization") && !object.get("initialization").isJsonObject()) {
            failures.add(new Failure(path + "/initialization", "Expected object"));
        }
        if (object.has("rootMode")) {
            JsonElement rootMode = object.get("rootMode");
            if (!isString(rootMode) || RootMode.fromValue(rootMode.getAsString()) == null) {
                failures.add(new Failure(path + "/rootMode",
                        "Expected one of 'workspace-or-marker', 'marker-only'"));
            }
        }
    }

    private static void validateSecurity(JsonElement security, List<Failure> failures) {
        if (!security.isJsonObject()) {
            failures.add(new Failure("/security", "Expected object"));
            return;
        }
        JsonObject object = security.getAsJsonObject();
        rejectUnknown(object, SECURITY_KEYS, "/security", failures);

        if (object.has("projectConfigPolicy")) {
            JsonElement policy = object.get("projectConfigPolicy");
            if (!isString(policy) || ProjectConfigPolicy.fromValue(policy.getAsString()) == null) {
                failures.add(new Failure("/security/projectConfigPolicy",
                        "Expected one of 'trusted-only', 'always', 'never'"));
            }
        }
        if (object.has("trustedProjectRoots")) {
            checkStringArray("/security/trustedProjectRoots", object.get("trustedProjectRoots"), failures);
        }
        if (object.has("allowExternalPaths") && !isBoolean(object.get("allowExternalPaths"))) {
            failures.add(new Failure("/security/allowExternalPaths", "Expected boolean"));
        }
    }

    private static void validateTiming(JsonElement timing, List<Failure> failures) {
        if (!timing.isJsonObject()) {
            failures.add(new Failure("/timing", "Expected object"));
            return;
        }
        JsonObject object = timing.getAsJsonObject();
        rejectUnknown(object, TIMING_KEYS, "/timing", failures);

        for (String key : TIMING_KEYS) {
            if (object.has(key) && !isPositiveInteger(object.get(key))) {
                failures.add(new Failure("/timing/" + key, "Expected integer to be greater or equal to 1"));
            }
        }
    }

    private static boolean checkStringArray(String path, JsonElement element, List<Failure> failures) {
        if (!element.isJsonArray()) {
            failures.add(new Failure(path, "Expected array"));
            return false;
        }
        boolean ok = true;
        for (int i = 0; i < element.getAsJsonArray().size(); i++) {
            if (!isString(element.getAsJsonArray().get(i))) {
                failures.add(new Failure(path + "/" + i, "Expected string"));
                ok = false;
            }
        }
        return ok;
    }

    private static void rejectUnknown(JsonObject object, Set<String> allowed, String path, List<Failure> failures) {
        for (String key : object.keySet()) {
            if (!allowed.contains(key)) {
                failures.add(new Failure(path + "/" + escape(key), "Unexpected property"));
            }
        }
    }

    private static boolean isBoolean(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean();
    }

    private static boolean isString(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static boolean isPositiveInteger(JsonElement element) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return false;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        double value = primitive.getAsDouble();
        return value >= 1 && value == Math.rint(value) && !Double.isInfinite(value);
    }

    // JSON pointer escaping (RFC 6901)
    private static String escape(String key) {
        return key.replace("~", "~0").replace("/", "~1");
    }

    private static Set<String> keys(String... names) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(names)));
    }
}
