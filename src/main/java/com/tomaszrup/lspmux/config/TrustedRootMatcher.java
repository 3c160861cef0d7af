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

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a project root is covered by the global
 * {@code security.trustedProjectRoots} list.
 *
 * <p>Entries may start with {@code ~} (home directory). Plain entries trust
 * the directory itself and everything below it. Entries containing glob
 * metacharacters are matched against the whole root path with the platform
 * {@code glob:} syntax.</p>
 */
public class TrustedRootMatcher {

    private static final Pattern GLOB_CHARS = Pattern.compile("[*?{}()\\[\\]!+@]");

    /** Outcome of matching one project root. */
    public static final class Result {
        private final boolean trusted;
        private final List<LoadWarning> warnings;

        Result(boolean trusted, List<LoadWarning> warnings) {
            this.trusted = trusted;
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public boolean isTrusted() {
            return trusted;
        }

        public List<LoadWarning> getWarnings() {
            return warnings;
        }
    }

    private final Path homeDir;

    public TrustedRootMatcher(Path homeDir) {
        this.homeDir = homeDir;
    }

    public Result match(Path projectRoot, List<String> trustedRootEntries) {
        List<LoadWarning> warnings = new ArrayList<>();
        String candidate = stripTrailingSlash(projectRoot.toString());

        for (String rawEntry : trustedRootEntries) {
            String expanded = expand(rawEntry);
            if (!isAbsolute(expanded)) {
                warnings.add(LoadWarning.of(LoadWarning.Type.INVALID_TRUST_ENTRY,
                        "Ignoring non-absolute trustedProjectRoots entry: " + rawEntry));
                continue;
            }

            String entry = stripTrailingSlash(expanded);
            try {
                if (!GLOB_CHARS.matcher(entry).find()) {
                    if (isDescendantOrEqual(candidate, entry)) {
                        return new Result(true, warnings);
                    }
                    continue;
                }
                PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + entry);
                if (matcher.matches(Paths.get(candidate))) {
                    return new Result(true, warnings);
                }
            } catch (RuntimeException e) {
                // PatternSyntaxException, InvalidPathException
                warnings.add(LoadWarning.of(LoadWarning.Type.TRUST_MATCHER_ERROR,
                        "Trust matcher failed for entry '" + rawEntry + "': " + e.getMessage()));
                return new Result(false, warnings);
            }
        }
        return new Result(false, warnings);
    }

    private String expand(String entry) {
        if (entry.equals("~")) {
            return homeDir.toString();
        }
        if (entry.startsWith("~/")) {
            return homeDir.resolve(entry.substring(2)).toString();
        }
        return entry;
    }

    private static boolean isAbsolute(String entry) {
        if (entry.startsWith("/")) {
            return true;
        }
        try {
            return Paths.get(entry).isAbsolute();
        } catch (RuntimeException e) {
            return false;
        }
    }

    static String stripTrailingSlash(String path) {
        String normalized = path.replace('\\', '/');
        int end = normalized.length();
        while (end > 0 && normalized.charAt(end - 1) == '/') {
            end--;
        }
        return end > 0 ? normalized.substring(0, end) : "/";
    }

    private static boolean isDescendantOrEqual(String candidate, String root) {
        if (root.equals("/")) {
            return candidate.startsWith("/");
        }
        return candidate.equals(root) || candidate.startsWith(root + "/");
    }
}
