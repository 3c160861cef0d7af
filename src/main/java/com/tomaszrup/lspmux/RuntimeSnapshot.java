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

import com.tomaszrup.lspmux.config.ServerSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Point-in-time view of every configured server, for status output.
 */
public final class RuntimeSnapshot {

    static final int MAX_SUMMARY_ISSUES = 5;

    /** Sort bucket of a row, in display order. */
    public enum Bucket {
        BROKEN,
        SPAWNING,
        CONNECTED,
        IDLE,
        DISABLED
    }

    private static final Comparator<Row> ROW_ORDER =
            Comparator.comparing(Row::getBucket).thenComparing(Row::getServerId);

    private final long generatedAt;
    private final List<Row> rows;
    private final Totals totals;

    RuntimeSnapshot(long generatedAt, List<Row> rows) {
        List<Row> sorted = new ArrayList<>(rows);
        sorted.sort(ROW_ORDER);
        this.generatedAt = generatedAt;
        this.rows = Collections.unmodifiableList(sorted);
        this.totals = Totals.of(sorted);
    }

    public long getGeneratedAt() {
        return generatedAt;
    }

    public List<Row> getRows() {
        return rows;
    }

    public Totals getTotals() {
        return totals;
    }

    /**
     * Plain-text status: counts, then up to five problematic rows.
     */
    public String summarize() {
        List<String> lines = new ArrayList<>();
        lines.add("LSP status");
        lines.add("configured=" + totals.configured
                + ", connected=" + totals.connected
                + ", spawning=" + totals.spawning
                + ", broken=" + totals.broken
                + ", disabled=" + totals.disabled);

        List<Row> problematic = rows.stream()
                .filter(row -> row.brokenState != null || !row.spawningRoots.isEmpty() || row.disabled)
                .limit(MAX_SUMMARY_ISSUES)
                .collect(Collectors.toList());
        if (!problematic.isEmpty()) {
            lines.add("Top issues:");
            for (Row row : problematic) {
                lines.add("- " + row.serverId + ": " + row.statusLabel());
            }
        }
        if (rows.isEmpty()) {
            lines.add("No servers configured.");
        }
        return String.join("\n", lines);
    }

    public static final class Row {

        private final String serverId;
        private final ServerSource provenance;
        private final boolean disabled;
        private final List<String> extensions;
        private final List<String> configuredRoots;
        private final List<String> connectedRoots;
        private final List<String> spawningRoots;
        private final BrokenServerState brokenState;
        private final DiagnosticCounts diagnostics;
        private final Long lastSeenAt;

        Row(String serverId, ServerSource provenance, boolean disabled, List<String> extensions,
            List<String> configuredRoots, List<String> connectedRoots, List<String> spawningRoots,
            BrokenServerState brokenState, DiagnosticCounts diagnostics, Long lastSeenAt) {
            this.serverId = serverId;
            this.provenance = provenance;
            this.disabled = disabled;
            this.extensions = Collections.unmodifiableList(new ArrayList<>(extensions));
            this.configuredRoots = Collections.unmodifiableList(new ArrayList<>(configuredRoots));
            this.connectedRoots = Collections.unmodifiableList(new ArrayList<>(connectedRoots));
            this.spawningRoots = Collections.unmodifiableList(new ArrayList<>(spawningRoots));
            this.brokenState = brokenState;
            this.diagnostics = diagnostics;
            this.lastSeenAt = lastSeenAt;
        }

        public String getServerId() {
            return serverId;
        }

        public ServerSource getProvenance() {
            return provenance;
        }

        public boolean isDisabled() {
            return disabled;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public List<String> getConfiguredRoots() {
            return configuredRoots;
        }

        public List<String> getConnectedRoots() {
            return connectedRoots;
        }

        public List<String> getSpawningRoots() {
            return spawningRoots;
        }

        /** Worst broken state across this server's roots, or {@code null}. */
        public BrokenServerState getBrokenState() {
            return brokenState;
        }

        /** {@code null} when no connected root has diagnostics. */
        public DiagnosticCounts getDiagnostics() {
            return diagnostics;
        }

        public Long getLastSeenAt() {
            return lastSeenAt;
        }

        public Bucket getBucket() {
            if (disabled) {
                return Bucket.DISABLED;
            }
            if (brokenState != null) {
                return Bucket.BROKEN;
            }
            if (!spawningRoots.isEmpty()) {
                return Bucket.SPAWNING;
            }
            if (!connectedRoots.isEmpty()) {
                return Bucket.CONNECTED;
            }
            return Bucket.IDLE;
        }

        String statusLabel() {
            if (disabled) {
                return "disabled";
            }
            if (brokenState != null) {
                return "broken (attempts=" + brokenState.getAttempts() + ")";
            }
            return spawningRoots.isEmpty() ? "ok" : "spawning";
        }
    }

    public static final class Totals {

        private final int configured;
        private final int connected;
        private final int spawning;
        private final int broken;
        private final int disabled;

        private Totals(int configured, int connected, int spawning, int broken, int disabled) {
            this.configured = configured;
            this.connected = connected;
            this.spawning = spawning;
            this.broken = broken;
            this.disabled = disabled;
        }

        static Totals of(List<Row> rows) {
            int connected = 0;
            int spawning = 0;
            int broken = 0;
            int disabled = 0;
            for (Row row : rows) {
                if (!row.connectedRoots.isEmpty()) {
                    connected++;
                }
                if (!row.spawningRoots.isEmpty()) {
                    spawning++;
                }
                if (row.brokenState != null) {
                    broken++;
                }
                if (row.disabled) {
                    disabled++;
                }
            }
            return new Totals(rows.size(), connected, spawning, broken, disabled);
        }

        public int getConfigured() {
            return configured;
        }

        public int getConnected() {
            return connected;
        }

        public int getSpawning() {
            return spawning;
        }

        public int getBroken() {
            return broken;
        }

        public int getDisabled() {
            return disabled;
        }
    }
}
