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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmux.config.RootMode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default server entries shipped with lsp-mux, plus the npm packages that
 * provide the binaries of some of them.
 */
public class BuiltinServerCatalog {

    /** npm packages to install and the binary they provide. */
    public static final class NpmInstallSpec {
        private final List<String> packages;
        private final String binary;

        public NpmInstallSpec(List<String> packages, String binary) {
            this.packages = Collections.unmodifiableList(packages);
            this.binary = binary;
        }

        public List<String> getPackages() {
            return packages;
        }

        public String getBinary() {
            return binary;
        }
    }

    private final Map<String, JsonObject> servers = new LinkedHashMap<>();
    private final Map<String, NpmInstallSpec> npmSpecs = new LinkedHashMap<>();

    public BuiltinServerCatalog() {
        register("typescript",
                Arrays.asList("typescript-language-server", "--stdio"),
                Arrays.asList(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".mts", ".cts"),
                Arrays.asList("package-lock.json", "bun.lockb", "bun.lock", "pnpm-lock.yaml", "yarn.lock",
                        "package.json", "tsconfig.json", "jsconfig.json"));
        register("pyright",
                Arrays.asList("pyright-langserver", "--stdio"),
                Arrays.asList(".py", ".pyi"),
                Arrays.asList("pyproject.toml", "setup.py", "setup.cfg", "requirements.txt", "Pipfile",
                        "pyrightconfig.json"));
        register("gopls",
                Collections.singletonList("gopls"),
                Collections.singletonList(".go"),
                Arrays.asList("go.work", "go.mod", "go.sum"));
        register("rust-analyzer",
                Collections.singletonList("rust-analyzer"),
                Collections.singletonList(".rs"),
                Arrays.asList("Cargo.toml", "rust-project.json"));
        register("clangd",
                Arrays.asList("clangd", "--background-index", "--clang-tidy"),
                Arrays.asList(".c", ".cc", ".cpp", ".cxx", ".h", ".hh", ".hpp", ".hxx", ".m", ".mm"),
                Arrays.asList("compile_commands.json", "compile_flags.txt", ".clangd", "CMakeLists.txt",
                        "Makefile", "configure.ac"));
        register("lua",
                Collections.singletonList("lua-language-server"),
                Collections.singletonList(".lua"),
                Arrays.asList(".luarc.json", ".luarc.jsonc", ".git"));
        register("bash",
                Arrays.asList("bash-language-server", "start"),
                Arrays.asList(".sh", ".bash", ".zsh"),
                Collections.singletonList(".git"));
        register("css",
                Arrays.asList("vscode-css-language-server", "--stdio"),
                Arrays.asList(".css", ".scss", ".less"),
                Arrays.asList("package.json", ".git"));

        npmSpecs.put("typescript", new NpmInstallSpec(
                Arrays.asList("typescript", "typescript-language-server"), "typescript-language-server"));
        npmSpecs.put("pyright", new NpmInstallSpec(
                Collections.singletonList("pyright"), "pyright-langserver"));
        npmSpecs.put("bash", new NpmInstallSpec(
                Collections.singletonList("bash-language-server"), "bash-language-server"));
        npmSpecs.put("css", new NpmInstallSpec(
                Collections.singletonList("vscode-langservers-extracted"), "vscode-css-language-server"));
    }

    private void register(String id, List<String> command, List<String> extensions, List<String> roots) {
        JsonObject entry = new JsonObject();
        entry.add("command", toArray(command));
        entry.add("extensions", toArray(extensions));
        entry.add("roots", toArray(roots));
        entry.addProperty("rootMode", RootMode.WORKSPACE_OR_MARKER.getValue());
        servers.put(id, entry);
    }

    private static JsonArray toArray(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(servers.keySet());
    }

    public boolean contains(String serverId) {
        return servers.containsKey(serverId);
    }

    /** Builtin entry in configuration-file shape, or {@code null}. */
    public JsonObject get(String serverId) {
        JsonObject entry = servers.get(serverId);
        return entry != null ? entry.deepCopy() : null;
    }

    /**
     * @return true when {@code command} is exactly the builtin default for {@code serverId}
     */
    public boolean isDefaultCommand(String serverId, List<String> command) {
        JsonObject entry = servers.get(serverId);
        if (entry == null) {
            return false;
        }
        JsonArray builtin = entry.getAsJsonArray("command");
        if (builtin.size() != command.size()) {
            return false;
        }
        for (int i = 0; i < builtin.size(); i++) {
            if (!builtin.get(i).getAsString().equals(command.get(i))) {
                return false;
            }
        }
        return true;
    }

    /** npm install strategy for {@code serverId}, or {@code null}. */
    public NpmInstallSpec getNpmInstallSpec(String serverId) {
        return npmSpecs.get(serverId);
    }
}
