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
package com.tomaszrup.lspmux.client;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a byte stream into LSP message bodies framed as
 * {@code Content-Length: N\r\n\r\n<N bytes>}. Chunks may be cut anywhere;
 * incomplete data is kept until the next {@link #append}. Not thread-safe:
 * one reader thread owns an instance.
 */
public class ContentLengthFramer {

    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};
    private static final Pattern CONTENT_LENGTH = Pattern.compile("Content-Length:\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE);

    private byte[] buffer = new byte[8192];
    private int length;

    /**
     * Add a chunk and return every body completed by it, in order.
     */
    public List<String> append(byte[] chunk, int offset, int count) {
        List<String> bodies = new ArrayList<>();
        if (count <= 0) {
            return bodies;
        }
        ensureCapacity(length + count);
        System.arraycopy(chunk, offset, buffer, length, count);
        length += count;

        while (true) {
            int headerEnd = indexOf(HEADER_END);
            if (headerEnd < 0) {
                return bodies;
            }

            String header = new String(buffer, 0, headerEnd, StandardCharsets.US_ASCII);
            Matcher matcher = CONTENT_LENGTH.matcher(header);
            if (!matcher.find()) {
                length = 0;
                return bodies;
            }

            long contentLength = Long.parseLong(matcher.group(1));
            long packetLength = headerEnd + HEADER_END.length + contentLength;
            if (packetLength > Integer.MAX_VALUE) {
                length = 0;
                return bodies;
            }
            if (length < packetLength) {
                return bodies;
            }

            int bodyStart = headerEnd + HEADER_END.length;
            bodies.add(new String(buffer, bodyStart, (int) contentLength, StandardCharsets.UTF_8));
            int remaining = length - (int) packetLength;
            System.arraycopy(buffer, (int) packetLength, buffer, 0, remaining);
            length = remaining;
        }
    }

    /** Bytes currently buffered. */
    public int buffered() {
        return length;
    }

    /** Frame a JSON payload for writing. */
    public static byte[] frame(String json) {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        byte[] header = ("Content-Length: " + body.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] framed = Arrays.copyOf(header, header.length + body.length);
        System.arraycopy(body, 0, framed, header.length, body.length);
        return framed;
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }

    private int indexOf(byte[] pattern) {
        outer:
        for (int i = 0; i <= length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (buffer[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
