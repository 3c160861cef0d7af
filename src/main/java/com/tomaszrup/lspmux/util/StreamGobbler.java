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
package com.tomaszrup.lspmux.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Daemon thread draining a child process stream line by line. Lines are
 * logged at DEBUG and the most recent output is kept up to a character limit.
 */
public class StreamGobbler extends Thread {

    private static final Logger logger = LoggerFactory.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final int maxChars;
    private final Map<String, String> mdcContext;
    private final StringBuilder output = new StringBuilder();

    public StreamGobbler(InputStream inputStream, String name, int maxChars) {
        super(name);
        this.inputStream = inputStream;
        this.maxChars = maxChars;
        this.mdcContext = MdcServerContext.snapshot();
        setDaemon(true);
    }

    @Override
    public void run() {
        MdcServerContext.restore(mdcContext);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.debug("{}", line);
                append(line);
            }
        } catch (IOException e) {
            logger.debug("Stream {} closed: {}", getName(), e.getMessage());
        }
    }

    private synchronized void append(String line) {
        output.append(line).append(System.lineSeparator());
        if (output.length() > maxChars) {
            output.delete(0, output.length() - maxChars);
        }
    }

    /** The retained tail of the stream. */
    public synchronized String getOutput() {
        return output.toString();
    }
}
