package jfmt;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;
import jfmt.JfmtException.Operation;

/**
 * Destination for formatted bytes.
 *
 * <p> A sink runs a {@link ByteProducer} against the stream it manages and takes care of finishing the
 * destination afterwards: flushing a plain stream, or committing an atomic file replacement.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface OutputSink {

    /**
     * Run {@code producer} and deliver everything it writes.
     *
     * @param producer writes the content, not {@code null}
     * @throws JfmtException if producing or delivering the content fails
     */
    void accept(ByteProducer producer);

    /**
     * Sink writing to a caller-owned stream such as {@code System.out}. The stream is flushed, not closed.
     * Bytes written before a failure stay written.
     *
     * @param out target stream, not {@code null}
     * @return sink
     */
    static OutputSink of(OutputStream out) {
        Objects.requireNonNull(out, "out");
        return producer -> {
            try {
                producer.writeTo(out);
                out.flush();
            } catch (IOException e) {
                throw new JfmtException.IoException(Operation.WRITE, null, e);
            }
        };
    }

    /**
     * Sink replacing {@code target} atomically, see {@link AtomicFileWriter}.
     *
     * @param target file to create or replace, not {@code null}
     * @return sink
     */
    static OutputSink atomicFile(Path target) {
        Objects.requireNonNull(target, "target");
        return producer -> AtomicFileWriter.write(target, producer);
    }

    /**
     * Streams content into an output stream. Implementations must not close the stream.
     */
    @FunctionalInterface
    interface ByteProducer {
        void writeTo(OutputStream out) throws IOException;
    }
}
