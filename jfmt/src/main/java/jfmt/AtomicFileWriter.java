package jfmt;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import jfmt.JfmtException.Operation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Replaces a file only once its new content is complete.
 *
 * <p> Content goes to a temporary file in the target's directory, so the final rename stays on one file
 * system. {@link #commit()} syncs the temporary file and renames it over the target; closing the writer
 * without a successful commit deletes the temporary file and leaves the target as it was.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * try (var writer = AtomicFileWriter.open(path)) {
 *     writer.stream().write(bytes);
 *     writer.commit();
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
@Slf4j
public final class AtomicFileWriter implements Closeable {

    private static final int MAX_TEMP_ATTEMPTS = 16;

    @Getter
    private final Path target;

    @Getter
    private final Path temp;

    private final FileChannel channel;
    private final OutputStream out;
    private boolean channelClosed;
    private boolean committed;

    private AtomicFileWriter(Path target, Path temp, FileChannel channel) {
        this.target = target;
        this.temp = temp;
        this.channel = channel;
        this.out = new BufferedOutputStream(Channels.newOutputStream(channel));
    }

    /**
     * Write {@code target} from {@code producer}, replacing it only if the producer completes.
     *
     * @param target   file to create or replace, not {@code null}
     * @param producer writes the new content, not {@code null}
     */
    public static void write(Path target, OutputSink.ByteProducer producer) {
        Objects.requireNonNull(producer, "producer");
        try (var writer = open(target)) {
            try {
                producer.writeTo(writer.stream());
            } catch (IOException e) {
                throw new JfmtException.IoException(Operation.WRITE, writer.temp, e);
            }
            writer.commit();
        }
    }

    /**
     * Create the temporary file for {@code target}. It is created like any new file, so a new target gets the
     * default permissions of its directory; permissions of an existing target are carried over where the file
     * system supports POSIX attributes.
     *
     * @param target file to create or replace, not {@code null}
     * @return an open writer, to be used in try-with-resources
     */
    public static AtomicFileWriter open(Path target) {
        Objects.requireNonNull(target, "target");
        var absolute = target.toAbsolutePath();
        var dir = absolute.getParent();
        if (dir == null) throw new IllegalArgumentException("Not a file path: " + target);
        for (int attempt = 1; ; attempt++) {
            var temp = dir.resolve("." + absolute.getFileName() + "."
                    + Long.toUnsignedString(ThreadLocalRandom.current().nextLong(), 36) + ".tmp");
            FileChannel channel;
            try {
                channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                if (attempt < MAX_TEMP_ATTEMPTS) continue;
                throw new JfmtException.IoException(Operation.CREATE_TEMP, dir, e);
            } catch (IOException e) {
                throw new JfmtException.IoException(Operation.CREATE_TEMP, dir, e);
            }
            try {
                copyPermissions(absolute, temp);
            } catch (IOException e) {
                var failure = new JfmtException.IoException(Operation.CREATE_TEMP, temp, e);
                try {
                    channel.close();
                    Files.deleteIfExists(temp);
                } catch (IOException suppressed) {
                    failure.addSuppressed(suppressed);
                }
                throw failure;
            }
            log.debug("Writing {} through temporary file {}", absolute, temp);
            return new AtomicFileWriter(absolute, temp, channel);
        }
    }

    /**
     * Stream into the temporary file. Closing it only flushes; the writer owns the file.
     *
     * @return output stream
     */
    public OutputStream stream() {
        return new FilterOutputStream(out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }

    /**
     * Flush and sync the temporary file, then rename it over the target.
     *
     * @throws JfmtException.IoException if any step fails; the target is then unchanged
     */
    public void commit() {
        if (committed) throw new IllegalStateException("Already committed: " + target);
        if (channelClosed) throw new IllegalStateException("Writer is closed: " + target);
        try {
            out.flush();
        } catch (IOException e) {
            throw new JfmtException.IoException(Operation.WRITE, temp, e);
        }
        try {
            channel.force(true);
        } catch (IOException e) {
            throw new JfmtException.IoException(Operation.SYNC, temp, e);
        }
        closeChannel();
        try {
            move(temp, target);
        } catch (IOException e) {
            throw new JfmtException.IoException(Operation.RENAME, target, e);
        }
        committed = true;
        log.debug("Replaced {}", target);
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * Discard the temporary file unless {@link #commit()} succeeded.
     */
    @Override
    public void close() {
        if (committed) return;
        if (!channelClosed) {
            try {
                closeChannel();
            } catch (JfmtException.IoException e) {
                log.warn("Failed to close temporary file {} before discarding it", temp, e);
            }
        }
        try {
            if (Files.deleteIfExists(temp)) log.debug("Discarded temporary file {}", temp);
        } catch (IOException e) {
            throw new JfmtException.IoException(Operation.DELETE_TEMP, temp, e);
        }
    }

    private void closeChannel() {
        channelClosed = true;
        try {
            channel.close();
        } catch (IOException e) {
            throw new JfmtException.IoException(Operation.WRITE, temp, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to a replacing move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void copyPermissions(Path target, Path temp) throws IOException {
        if (!Files.exists(target)) return;
        try {
            Files.setPosixFilePermissions(temp, Files.getPosixFilePermissions(target));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}, keeping defaults", target);
        }
    }
}
