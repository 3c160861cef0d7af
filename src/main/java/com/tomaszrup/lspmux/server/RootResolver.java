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

import com.tomaszrup.lspmux.config.RootMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the project root a server instance should be started for.
 *
 * <ol>
 *   <li>If an {@code excludeRoots} marker matches any directory between the
 *       file and the workspace boundary, there is no root.</li>
 *   <li>The nearest directory matching one of the {@code roots} markers wins.</li>
 *   <li>Otherwise {@code marker-only} servers get no root; other servers get
 *       the workspace root, or the file's directory for files outside it.</li>
 * </ol>
 */
public final class RootResolver {

    private static final Logger logger = LoggerFactory.getLogger(RootResolver.class);

    private static final Pattern GLOB_CHARS = Pattern.compile("[*?{}()\\[\\]!+@]");

    private RootResolver() {
    }

    /**
     * @return the root, or {@code null} when the server must not handle this file
     */
    public static Path resolve(Path file, ServerDefinition server, Path workspaceRoot) {
        if (findRootByMarkers(file, server.getExcludeRoots(), workspaceRoot) != null) {
            return null;
        }

        Path markerRoot = findRootByMarkers(file, server.getRoots(), workspaceRoot);
        if (markerRoot != null) {
            return markerRoot;
        }

        if (server.getRootMode() == RootMode.MARKER_ONLY) {
            return null;
        }

        if (file.startsWith(workspaceRoot)) {
            return workspaceRoot;
        }
        return file.getParent();
    }

    /**
     * Walks upward from the file's directory, never leaving {@code boundary}
     * when it is given, and returns the first directory a marker matches.
     */
    public static Path findRootByMarkers(Path file, List<String> markers, Path boundary) {
        if (markers.isEmpty()) {
            return null;
        }
        for (Path current = file.getParent(); current != null; current = current.getParent()) {
            if (boundary != null && !current.startsWith(boundary)) {
                return null;
            }
            for (String marker : markers) {
                if (markerMatchesDirectory(marker, current)) {
                    return current;
                }
            }
        }
        return null;
    }

    static boolean markerMatchesDirectory(String marker, Path directory) {
        if (marker == null || marker.isEmpty()) {
            return false;
        }

        if (!GLOB_CHARS.matcher(marker).find()) {
            boolean directoryOnly = marker.endsWith("/");
            String name = directoryOnly ? marker.substring(0, marker.length() - 1) : marker;
            if (name.isEmpty()) {
                return false;
            }
            Path entry = directory.resolve(name);
            return directoryOnly ? Files.isDirectory(entry) : Files.exists(entry);
        }

        PathMatcher matcher;
        try {
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + marker);
        } catch (RuntimeException e) {
            logger.debug("Ignoring invalid root marker '{}': {}", marker, e.getMessage());
            return false;
        }

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (matcher.matches(entry.getFileName())) {
                    return true;
                }
            }
        } catch (IOException e) {
            logger.debug("Cannot list {} for root marker '{}': {}", directory, marker, e.getMessage());
        }
        return false;
    }
}
