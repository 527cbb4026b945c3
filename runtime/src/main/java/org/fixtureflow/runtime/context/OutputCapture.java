package org.fixtureflow.runtime.context;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.function.BiConsumer;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes {@code System.out} and {@code System.err} to the {@link LogBuffer} bound to the
 * current thread. Threads without a bound buffer write to the original streams.
 */
@Slf4j
public final class OutputCapture {

    private static final ThreadLocal<LogBuffer> CURRENT = new ThreadLocal<>();

    private static volatile boolean installed = false;

    private OutputCapture() {
        //prevent creating instances
    }

    public static synchronized void install() {
        if (installed) {
            return;
        }
        System.setOut(route(System.out, LogBuffer::appendOut));
        System.setErr(route(System.err, LogBuffer::appendErr));
        installed = true;
        log.debug("install: console output is now captured per test");
    }

    /**
     * Binds {@code buffer} to the calling thread until the returned scope is closed.
     */
    public static Scope bind(@Nullable LogBuffer buffer) {
        LogBuffer previous = CURRENT.get();
        CURRENT.set(buffer);
        return () -> {
            // bytes still pending on this thread belong to the buffer being unbound
            System.out.flush();
            System.err.flush();
            CURRENT.set(previous);
        };
    }

    @Nullable
    public static LogBuffer current() {
        return CURRENT.get();
    }

    private static PrintStream route(PrintStream original, BiConsumer<LogBuffer, String> sink) {
        return new PrintStream(new RoutingStream(original, sink), true, StandardCharsets.UTF_8);
    }

    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    private static class RoutingStream extends OutputStream {

        private final PrintStream original;

        private final BiConsumer<LogBuffer, String> sink;

        private final ThreadLocal<ByteArrayOutputStream> pending =
                ThreadLocal.withInitial(ByteArrayOutputStream::new);

        RoutingStream(PrintStream original, BiConsumer<LogBuffer, String> sink) {
            this.original = original;
            this.sink = sink;
        }

        @Override
        public void write(int b) {
            LogBuffer buffer = CURRENT.get();
            if (buffer == null) {
                original.write(b);
            } else {
                pending.get().write(b);
            }
        }

        @Override
        public void write(byte[] bytes, int off, int len) {
            LogBuffer buffer = CURRENT.get();
            if (buffer == null) {
                original.write(bytes, off, len);
            } else {
                pending.get().write(bytes, off, len);
            }
        }

        @Override
        public void flush() {
            LogBuffer buffer = CURRENT.get();
            ByteArrayOutputStream bytes = pending.get();
            if (buffer != null && bytes.size() > 0) {
                sink.accept(buffer, new String(bytes.toByteArray(), StandardCharsets.UTF_8));
                bytes.reset();
            }
            original.flush();
        }
    }
}
