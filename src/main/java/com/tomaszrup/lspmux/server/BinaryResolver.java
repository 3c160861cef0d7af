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
package com.tomaszrup.lspmux.server;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Locates executables on {@code PATH} and in the managed install directory.
 */
public class BinaryResolver {

    private static final String DEFAULT_PATHEXT = ".EXE;.CMD;.BAT;.COM";

    private final Path managedBinDir;
    private final boolean windows;

    public BinaryResolver(Path managedBinDir) {
        this(managedBinDir, System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    BinaryResolver(Path managedBinDir, boolean windows) {
        this.managedBinDir = managedBinDir;
        this.windows = windows;
    }

    /** Directory auto-installed servers live in. */
    public Path getManagedBinDir() {
        return managedBinDir;
    }

    public boolean isWindows() {
        return windows;
    }

    /**
     * Resolve {@code binary} to an executable path.
     *
     * @param env environment whose {@code PATH} / {@code PATHEXT} are used
     * @return the executable, or {@code null} when not found
     */
    public Path resolve(String binary, Map<String, String> env) {
        if (binary.contains("/") || binary.contains("\\") || isAbsolute(binary)) {
            Path direct = toPath(binary);
            return direct != null && isExecutableFile(direct) ? direct : null;
        }

        List<Path> searchDirs = new ArrayList<>();
        String pathEnv = lookup(env, "PATH");
        if (pathEnv != null) {
            for (String dir : pathEnv.split(File.pathSeparator)) {
                Path path = dir.isEmpty() ? null : toPath(dir);
                if (path != null) {
                    searchDirs.add(path);
                }
            }
        }
        searchDirs.add(managedBinDir);

        List<String> candidates = withWindowsExtensions(binary, env);
        for (Path dir : searchDirs) {
            for (String candidate : candidates) {
                Path fullPath = dir.resolve(candidate);
                if (isExecutableFile(fullPath)) {
                    return fullPath;
                }
            }
        }
        return null;
    }

    /** Binary placed by {@code npm install --prefix} into the managed directory. */
    public Path managedNodeBin(String binary) {
        return managedBinDir.resolve("node_modules").resolve(".bin").resolve(windows ? binary + ".cmd" : binary);
    }

    List<String> withWindowsExtensions(String binary, Map<String, String> env) {
        List<String> candidates = new ArrayList<>();
        candidates.add(binary);
        if (!windows || (binary.contains(".") && !binary.endsWith("."))) {
            return candidates;
        }
        String pathext = lookup(env, "PATHEXT");
        if (pathext == null) {
            pathext = DEFAULT_PATHEXT;
        }
        for (String suffix : pathext.split(";")) {
            if (!suffix.isEmpty()) {
                candidates.add(binary + suffix);
            }
        }
        return candidates;
    }

    boolean isExecutableFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        // Windows does not honour the execute bit
        return windows || Files.isExecutable(path);
    }

    private static String lookup(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null) {
            for (Map.Entry<String, String> entry : env.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(key)) {
                    return entry.getValue();
                }
            }
        }
        return value;
    }

    private static boolean isAbsolute(String value) {
        Path path = toPath(value);
        return path != null && path.isAbsolute();
    }

    private static Path toPath(String value) {
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
