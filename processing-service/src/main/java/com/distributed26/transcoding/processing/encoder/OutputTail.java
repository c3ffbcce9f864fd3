package com.distributed26.transcoding.processing.encoder;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The last {@code maxLines} lines written by a process. Bytes are fed in as they are read; a
 * trailing line without a newline still counts.
 */
final class OutputTail {
    private final int maxLines;
    private final Deque<String> lines = new ArrayDeque<>();
    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

    OutputTail(int maxLines) {
        if (maxLines <= 0) throw new IllegalArgumentException("maxLines must be > 0");
        this.maxLines = maxLines;
    }

    synchronized void write(byte[] buffer, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            write(buffer[i]);
        }
    }

    synchronized void write(int b) {
        if (b == '\n' || b == '\r') {
            // FFmpeg redraws its status line with bare carriage returns.
            flushLine();
        } else {
            partial.write(b);
        }
    }

    synchronized List<String> lines() {
        List<String> result = new ArrayList<>(lines);
        if (partial.size() > 0) {
            result.add(partial.toString(StandardCharsets.UTF_8));
            if (result.size() > maxLines) {
                result.remove(0);
            }
        }
        return result;
    }

    private void flushLine() {
        if (partial.size() == 0) {
            return;
        }
        String line = partial.toString(StandardCharsets.UTF_8).strip();
        partial.reset();
        if (line.isEmpty()) {
            return;
        }
        if (lines.size() == maxLines) {
            lines.removeFirst();
        }
        lines.addLast(line);
    }
}
