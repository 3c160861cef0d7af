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

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmux.config.LoadWarning;

/**
 * Command-line entry point.
 *
 * <pre>
 * lsp-mux [--cwd DIR] [--log-level LEVEL] status
 * lsp-mux [--cwd DIR] [--log-level LEVEL] &lt;operation&gt; &lt;file&gt; &lt;line&gt; &lt;character&gt;
 * </pre>
 *
 * Output goes to stdout as JSON; logging goes to stderr.
 * Exit codes: 0 when at least one server answered, 1 when no server was
 * available, 2 on usage errors or when every server failed.
 */
public class LspMuxLauncher {

    private static final Logger logger = LoggerFactory.getLogger(LspMuxLauncher.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_SERVER = 1;
    static final int EXIT_FAILED = 2;

    static final String USAGE = "usage: lsp-mux [--cwd DIR] [--log-level LEVEL] status\n"
            + "       lsp-mux [--cwd DIR] [--log-level LEVEL] <operation> <file> <line> <character>\n"
            + "operations: goToDefinition, findReferences, hover, documentSymbol, workspaceSymbol,\n"
            + "            goToImplementation, prepareCallHierarchy, incomingCalls, outgoingCalls";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}", thread.getName(), throwable.getMessage(),
                        throwable));
        System.exit(new LspMuxLauncher().run(args, System.out, System.err));
    }

    /** Parsed command line. */
    static final class Arguments {
        Path cwd = Paths.get("").toAbsolutePath();
        String logLevel;
        final List<String> positional = new ArrayList<>();

        static Arguments parse(String[] args) {
            Arguments parsed = new Arguments();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--cwd".equals(arg) || "--log-level".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for " + arg);
                    }
                    String value = args[++i];
                    if ("--cwd".equals(arg)) {
                        parsed.cwd = Paths.get(value).toAbsolutePath().normalize();
                    } else {
                        parsed.logLevel = value;
                    }
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option " + arg);
                } else {
                    parsed.positional.add(arg);
                }
            }
            return parsed;
        }
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_FAILED;
        }
        if (arguments.logLevel != null && !LogLevels.apply(arguments.logLevel)) {
            err.println("Unknown log level " + arguments.logLevel);
            return EXIT_FAILED;
        }

        List<String> positional = arguments.positional;
        if (positional.size() == 1 && "status".equals(positional.get(0))) {
            try (LspRuntime runtime = createRuntime(arguments.cwd)) {
                RuntimeSnapshot snapshot = runtime.getSnapshot();
                out.println(snapshot.summarize());
                out.println(GSON.toJson(snapshot));
                return EXIT_OK;
            }
        }
        if (positional.size() != 4) {
            err.println(USAGE);
            return EXIT_FAILED;
        }

        LspOperation operation = LspOperation.fromName(positional.get(0));
        if (operation == null) {
            err.println("Unknown operation " + positional.get(0));
            err.println(USAGE);
            return EXIT_FAILED;
        }
        int line;
        int character;
        try {
            line = Integer.parseInt(positional.get(2));
            character = Integer.parseInt(positional.get(3));
        } catch (NumberFormatException e) {
            err.println("line and character must be integers: " + e.getMessage());
            return EXIT_FAILED;
        }
        if (line < 1 || character < 1) {
            err.println("line and character are 1-based");
            return EXIT_FAILED;
        }

        try (LspRuntime runtime = createRuntime(arguments.cwd)) {
            RunSummary<JsonElement> summary = runtime
                    .run(positional.get(1), operation, line, character, null)
                    .get();
            out.println(GSON.toJson(render(operation, summary)));
            if (summary.getHits() == 0) {
                err.println("No LSP server available for this file type.");
                return EXIT_NO_SERVER;
            }
            return summary.anyOk() ? EXIT_OK : EXIT_FAILED;
        } catch (LspPathException e) {
            err.println(e.getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILED;
        } catch (ExecutionException | CompletionException e) {
            logger.error("{} failed", operation, e);
            err.println(OutcomeErrors.summarize(OutcomeErrors.unwrap(e)));
            return EXIT_FAILED;
        }
    }

    LspRuntime createRuntime(Path cwd) {
        return new LspRuntime(cwd);
    }

    static JsonObject render(LspOperation operation, RunSummary<JsonElement> summary) {
        JsonArray result = operation.collect(summary);
        JsonArray errors = new JsonArray();
        boolean timedOut = false;
        for (RequestOutcome<JsonElement> outcome : summary.getOutcomes()) {
            if (!outcome.isOk()) {
                errors.add(GSON.toJsonTree(outcome.getError()));
                timedOut |= outcome.isTimedOut();
            }
        }
        JsonArray warnings = new JsonArray();
        for (LoadWarning warning : summary.getWarnings()) {
            warnings.add(warning.getMessage());
        }

        JsonObject rendered = new JsonObject();
        rendered.addProperty("operation", operation.getOperationName());
        rendered.addProperty("hits", summary.getHits());
        rendered.add("result", result);
        rendered.add("errors", errors);
        rendered.addProperty("timedOut", timedOut);
        rendered.addProperty("partial", errors.size() > 0 && result.size() > 0);
        rendered.add("warnings", warnings);
        return rendered;
    }
}
