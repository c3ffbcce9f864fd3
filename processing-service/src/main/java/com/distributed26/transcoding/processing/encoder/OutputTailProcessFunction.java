package com.distributed26.transcoding.processing.encoder;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.TimeUnit;
import net.bramp.ffmpeg.ProcessFunction;
import net.bramp.ffmpeg.RunProcessFunction;

/**
 * {@link ProcessFunction} that remembers the last lines each FFmpeg process printed.
 *
 * <p>{@link RunProcessFunction} merges stderr into stdout and the wrapper drains that stream on
 * the thread that started the process, then fails with a generic "non-zero exit status" message.
 * The tail of the real output is kept per thread so concurrent encodes sharing one
 * {@code FFmpeg} each see their own.
 */
final class OutputTailProcessFunction implements ProcessFunction {
    static final int DEFAULT_MAX_LINES = 15;

    private final ProcessFunction delegate;
    private final int maxLines;
    private final ThreadLocal<OutputTail> lastTail = new ThreadLocal<>();

    OutputTailProcessFunction() {
        this(new RunProcessFunction(), DEFAULT_MAX_LINES);
    }

    OutputTailProcessFunction(ProcessFunction delegate, int maxLines) {
        this.delegate = delegate;
        this.maxLines = maxLines;
    }

    @Override
    public Process run(List<String> args) throws IOException {
        Process process = delegate.run(args);
        OutputTail tail = new OutputTail(maxLines);
        lastTail.set(tail);
        return new TailingProcess(process, tail);
    }

    /** Output of the most recent process started on this thread, oldest line first. */
    List<String> lastOutput() {
        OutputTail tail = lastTail.get();
        return tail == null ? List.of() : tail.lines();
    }

    void reset() {
        lastTail.remove();
    }

    private static final class TailingProcess extends Process {
        private final Process process;
        private final InputStream output;

        TailingProcess(Process process, OutputTail tail) {
            this.process = process;
            this.output = new FilterInputStream(process.getInputStream()) {
                @Override
                public int read() throws IOException {
                    int b = super.read();
                    if (b >= 0) {
                        tail.write(b);
                    }
                    return b;
                }

                @Override
                public int read(byte[] buffer, int offset, int length) throws IOException {
                    int n = super.read(buffer, offset, length);
                    if (n > 0) {
                        tail.write(buffer, offset, n);
                    }
                    return n;
                }
            };
        }

        @Override
        public OutputStream getOutputStream() {
            return process.getOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return output;
        }

        @Override
        public InputStream getErrorStream() {
            return process.getErrorStream();
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return process.waitFor(timeout, unit);
        }

        @Override
        public int exitValue() {
            return process.exitValue();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void destroy() {
            process.destroy();
        }

        @Override
        public Process destroyForcibly() {
            return process.destroyForcibly();
        }
    }
}
