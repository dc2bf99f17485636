package jfmt;

import java.io.IOException;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a document cannot be read, parsed or written.
 * This is the base exception for all jfmt errors.
 *
 * @since 0.1.0
 */
public class JfmtException extends RuntimeException {

    /**
     * Constructs a new JfmtException with the specified detail message.
     *
     * @param message the detail message
     */
    public JfmtException(String message) {
        super(message);
    }

    /**
     * Constructs a new JfmtException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JfmtException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Exception thrown when the input is not a well-formed JSON document.
     */
    public static class SyntaxException extends JfmtException {
        private final Kind kind;
        private final long offset;
        private final int line;
        private final int column;

        public SyntaxException(Kind kind, String message, long offset, int line, int column) {
            super(String.format("%s at line %d, column %d (offset %d)", message, line, column, offset));
            this.kind = kind;
            this.offset = offset;
            this.line = line;
            this.column = column;
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * @return zero-based byte offset of the offending token or character
         */
        public long getOffset() {
            return offset;
        }

        public int getLine() {
            return line;
        }

        /**
         * @return one-based column, counted in bytes
         */
        public int getColumn() {
            return column;
        }
    }

    /**
     * What went wrong in a {@link SyntaxException}.
     */
    public enum Kind {
        UNTERMINATED_STRING(true),
        INVALID_NUMBER(true),
        UNEXPECTED_CHARACTER(true),
        UNEXPECTED_TOKEN(false),
        EXPECTED_KEY(false),
        EXPECTED_COLON(false),
        EXPECTED_COMMA_OR_END(false),
        TRAILING_COMMA(false),
        TRAILING_CONTENT(false),
        EMPTY_DOCUMENT(false),
        NESTING_TOO_DEEP(false);

        private final boolean lexical;

        Kind(boolean lexical) {
            this.lexical = lexical;
        }

        /**
         * @return {@code true} if raised by the lexer, {@code false} if raised by the parser
         */
        public boolean isLexical() {
            return lexical;
        }
    }

    /**
     * Exception thrown when reading the input or writing the output fails.
     *
     * <p> The underlying {@link IOException} is always available as the cause.
     */
    public static class IoException extends JfmtException {
        private final Operation operation;
        private final @Nullable Path path;

        public IoException(Operation operation, @Nullable Path path, IOException cause) {
            super(describe(operation, path, cause), cause);
            this.operation = operation;
            this.path = path;
        }

        public Operation getOperation() {
            return operation;
        }

        public @Nullable Path getPath() {
            return path;
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }

        private static String describe(Operation operation, @Nullable Path path, IOException cause) {
            var target = path == null ? "stream" : "'" + path + "'";
            return String.format("%s failed for %s: %s", operation.description, target, cause);
        }
    }

    /**
     * The I/O step an {@link IoException} was raised from.
     */
    public enum Operation {
        READ("Read"),
        WRITE("Write"),
        CREATE_TEMP("Temporary file creation"),
        SYNC("Sync"),
        RENAME("Rename"),
        DELETE_TEMP("Temporary file deletion");

        private final String description;

        Operation(String description) {
            this.description = description;
        }
    }
}
