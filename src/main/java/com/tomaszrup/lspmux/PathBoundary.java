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
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves caller-supplied paths and keeps them inside the workspace.
 */
public final class PathBoundary {

    private static final Logger logger = LoggerFactory.getLogger(PathBoundary.class);

    private PathBoundary() {
    }

    /**
     * Resolve {@code rawPath} (optionally prefixed with {@code @}, relative to
     * {@code cwd}) to its real absolute path. A missing file resolves through
     * its parent's real path.
     *
     * @throws LspPathException when the path cannot be resolved or lies
     *         outside every boundary root and external paths are not allowed
     */
    public static Path normalize(String rawPath, Path cwd, List<Path> boundaryRoots, boolean allowExternalPaths) {
        String stripped = rawPath.startsWith("@") ? rawPath.substring(1) : rawPath;
        String input = stripped.trim();
        if (input.isEmpty()) {
            throw new LspPathException("Path is empty");
        }

        Path absolute;
        try {
            absolute = cwd.resolve(input).toAbsolutePath().normalize();
        } catch (RuntimeException e) {
            throw new LspPathException("Unable to resolve path '" + rawPath + "': " + e.getMessage(), e);
        }

        Path real = realPath(rawPath, absolute);
        if (!allowExternalPaths && !isWithinAny(real, boundaryRoots)) {
            throw new LspPathException("Path '" + rawPath + "' is outside workspace boundary.");
        }
        return real;
    }

    private static Path realPath(String rawPath, Path absolute) {
        try {
            return absolute.toRealPath();
        } catch (NoSuchFileException e) {
            Path parent = absolute.getParent();
            if (parent == null) {
                return absolute;
            }
            try {
                return parent.toRealPath().resolve(absolute.getFileName());
            } catch (IOException parentError) {
                return absolute;
            }
        } catch (IOException e) {
            throw new LspPathException("Unable to resolve path '" + rawPath + "': " + e.getMessage(), e);
        }
    }

    static boolean isWithinAny(Path path, List<Path> roots) {
        Set<Path> candidates = new LinkedHashSet<>();
        for (Path root : roots) {
            candidates.add(root.toAbsolutePath().normalize());
            try {
                candidates.add(root.toRealPath());
            } catch (IOException e) {
                logger.debug("Boundary root {} has no real path: {}", root, e.getMessage());
            }
        }
        for (Path root : candidates) {
            if (path.startsWith(root)) {
                return true;
            }
        }
        return false;
    }
}
