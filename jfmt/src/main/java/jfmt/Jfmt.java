package jfmt;

import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import jfmt.JfmtException.Kind;
import jfmt.JfmtException.Operation;
import jfmt.JfmtException.SyntaxException;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Whitespace-only JSON re-formatter.
 *
 * <p> The document is re-emitted with the same values, the same member order and the exact source text of
 * every string and number; only the whitespace between tokens changes.
 *
 * @since 0.1.0
 */
@Slf4j
public final class Jfmt {

    private static final Formatter defaultFormatter = Formatter.builder().build();

    private Jfmt() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Format a document read from {@code input} and hand the result to {@code sink}.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Jfmt.format(System.in, FormatPolicy.tabs(), OutputSink.of(System.out));
     * }</pre>
     *
     * <p> The input stream is read to the end but not closed.
     *
     * @param input  UTF-8 JSON text, not {@code null}
     * @param policy whitespace policy, not {@code null}
     * @param sink   destination, not {@code null}
     * @throws JfmtException.SyntaxException if the input is not well-formed
     * @throws JfmtException.IoException     if reading or writing fails
     */
    public static void format(InputStream input, FormatPolicy policy, OutputSink sink) {
        formatter(policy).format(input, sink);
    }

    /**
     * Format JSON text held in memory.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Jfmt.format("{ \"a\" : [1, 2] }", FormatPolicy.compact());
     * // -> {"a":[1,2]}
     * }</pre>
     *
     * @param json   JSON text, not {@code null}
     * @param policy whitespace policy, not {@code null}
     * @return formatted JSON text
     */
    public static String format(String json, FormatPolicy policy) {
        return formatter(policy).format(json);
    }

    public static byte[] format(byte[] json, FormatPolicy policy) {
        return formatter(policy).format(json);
    }

    /**
     * Rewrite a file in place. The file is replaced only after the whole document has been formatted;
     * on any failure it is left untouched.
     *
     * @param file   file to rewrite, not {@code null}
     * @param policy whitespace policy, not {@code null}
     */
    public static void formatFile(Path file, FormatPolicy policy) {
        formatter(policy).formatFile(file);
    }

    public static void formatFile(Path source, FormatPolicy policy, OutputSink sink) {
        formatter(policy).formatFile(source, sink);
    }

    /**
     * Parse JSON text into a value tree.
     *
     * @param json JSON text, not {@code null}
     * @return the root value
     */
    public static JsonValue parse(String json) {
        return defaultFormatter.parse(json);
    }

    public static JsonValue parse(byte[] json) {
        return defaultFormatter.parse(json);
    }

    public static JsonValue parse(InputStream input) {
        return defaultFormatter.parse(input);
    }

    /**
     * Check that the input is a single well-formed JSON document without producing any output.
     *
     * @param input UTF-8 JSON text, not {@code null}
     * @throws JfmtException.SyntaxException if it is not
     */
    public static void validate(InputStream input) {
        defaultFormatter.validate(input);
    }

    /**
     * Render a value tree.
     *
     * @param value  root value, not {@code null}
     * @param policy whitespace policy, not {@code null}
     * @return formatted JSON text
     */
    public static String write(JsonValue value, FormatPolicy policy) {
        return formatter(policy).write(value);
    }

    private static Formatter formatter(FormatPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (policy.equals(defaultFormatter.getPolicy())) return defaultFormatter;
        return defaultFormatter.toBuilder().policy(policy).build();
    }

    // ============================================================
    // Formatter
    // ============================================================

    /**
     * How a document travels from the parser to the output.
     */
    public enum Mode {
        /**
         * Tokens are written as they are parsed. Memory grows with nesting depth only.
         */
        TRANSCODE,
        /**
         * The whole document is parsed into a {@link JsonValue} tree first, then written.
         */
        TREE
    }

    /**
     * A configured formatter. Instances are immutable and can be shared.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var formatter = Jfmt.Formatter.builder()
     *         .policy(FormatPolicy.spaces(2))
     *         .trailingNewline(true)
     *         .build();
     * formatter.formatFile(Path.of("package.json"));
     * }</pre>
     */
    @Getter
    @Builder(toBuilder = true)
    public static final class Formatter {

        public static final int DEFAULT_MAX_DEPTH = 10_000;
        public static final int DEFAULT_BUFFER_SIZE = 8192;

        @Builder.Default
        private final FormatPolicy policy = FormatPolicy.spaces(4);

        @Builder.Default
        private final Mode mode = Mode.TRANSCODE;

        /**
         * Deepest container nesting accepted before failing with {@link Kind#NESTING_TOO_DEEP}.
         */
        @Builder.Default
        private final int maxDepth = DEFAULT_MAX_DEPTH;

        /**
         * Whether a single {@code '\n'} is written after the root value.
         */
        @Builder.Default
        private final boolean trailingNewline = false;

        @Builder.Default
        private final int bufferSize = DEFAULT_BUFFER_SIZE;

        public void format(InputStream input, OutputSink sink) {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(sink, "sink");
            sink.accept(out -> formatTo(input, null, out));
        }

        public String format(String json) {
            Objects.requireNonNull(json, "json");
            return new String(format(json.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
        }

        public byte[] format(byte[] json) {
            Objects.requireNonNull(json, "json");
            var out = new ByteArrayOutputStream(json.length + (json.length >> 2));
            format(new ByteArrayInputStream(json), OutputSink.of(out));
            return out.toByteArray();
        }

        public void formatFile(Path file) {
            Objects.requireNonNull(file, "file");
            formatFile(file, OutputSink.atomicFile(file));
        }

        public void formatFile(Path source, OutputSink sink) {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(sink, "sink");
            try (var in = Files.newInputStream(source)) {
                sink.accept(out -> formatTo(in, source, out));
            } catch (IOException e) {
                throw new JfmtException.IoException(Operation.READ, source, e);
            }
        }

        public JsonValue parse(String json) {
            Objects.requireNonNull(json, "json");
            return parse(json.getBytes(StandardCharsets.UTF_8));
        }

        public JsonValue parse(byte[] json) {
            Objects.requireNonNull(json, "json");
            return parse(new ByteArrayInputStream(json));
        }

        public JsonValue parse(InputStream input) {
            Objects.requireNonNull(input, "input");
            var builder = new TreeBuilder();
            new Parser(new Lexer(input, null, bufferSize), maxDepth).parse(builder);
            return builder.result();
        }

        public void validate(InputStream input) {
            Objects.requireNonNull(input, "input");
            new Parser(new Lexer(input, null, bufferSize), maxDepth).parse(new Validator());
        }

        public String write(JsonValue value) {
            Objects.requireNonNull(value, "value");
            var out = new ByteArrayOutputStream();
            write(value, OutputSink.of(out));
            return out.toString(StandardCharsets.UTF_8);
        }

        public void write(JsonValue value, OutputSink sink) {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(sink, "sink");
            sink.accept(out -> {
                var buffered = new BufferedOutputStream(out, bufferSize);
                var emitter = new Emitter(buffered, policy);
                walk(value, emitter);
                emitter.finish(trailingNewline);
                buffered.flush();
            });
        }

        void formatTo(InputStream input, @Nullable Path source, OutputStream sink) throws IOException {
            var out = new BufferedOutputStream(sink, bufferSize);
            var emitter = new Emitter(out, policy);
            var parser = new Parser(new Lexer(input, source, bufferSize), maxDepth);
            if (mode == Mode.TREE) {
                var builder = new TreeBuilder();
                parser.parse(builder);
                walk(builder.result(), emitter);
            } else {
                parser.parse(emitter);
            }
            emitter.finish(trailingNewline);
            out.flush();
            log.debug("Formatted {} with policy {} in {} mode", source == null ? "stream" : source, policy, mode);
        }
    }

    // ============================================================
    // Lexer
    // ============================================================

    enum Token {
        BEGIN_OBJECT,
        END_OBJECT,
        BEGIN_ARRAY,
        END_ARRAY,
        COLON,
        COMMA,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NULL,
        EOF
    }

    /**
     * Single-pass pull cursor over UTF-8 input. {@link #current()} is the token under the cursor;
     * {@link #advance()} moves to the next one.
     *
     * <p> String and number lexemes are kept as raw source bytes, string lexemes with their quotes.
     * Columns count bytes.
     */
    static final class Lexer {
        private static final byte[] TRUE = {'t', 'r', 'u', 'e'};
        private static final byte[] FALSE = {'f', 'a', 'l', 's', 'e'};
        private static final byte[] NULL = {'n', 'u', 'l', 'l'};

        private final InputStream in;
        private final @Nullable Path source;
        private final byte[] buf;
        private int pos, limit;
        private boolean eof;

        private long offset;
        private int line = 1, col = 1;

        private Token current;
        private long tokenOffset;
        private int tokenLine, tokenCol;
        private byte[] lexeme = new byte[64];
        private int lexemeLength;

        Lexer(InputStream in, @Nullable Path source, int bufferSize) {
            if (bufferSize < 1) throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
            this.in = Objects.requireNonNull(in);
            this.source = source;
            this.buf = new byte[bufferSize];
            advance();
        }

        Token current() {
            return current;
        }

        long offset() {
            return tokenOffset;
        }

        int line() {
            return tokenLine;
        }

        int col() {
            return tokenCol;
        }

        /**
         * @return backing array of the current lexeme, valid up to {@link #lexemeLength()} until the next advance
         */
        byte[] lexeme() {
            return lexeme;
        }

        int lexemeLength() {
            return lexemeLength;
        }

        String lexemeText() {
            return new String(lexeme, 0, lexemeLength, StandardCharsets.UTF_8);
        }

        void advance() {
            skipWs();
            tokenOffset = offset;
            tokenLine = line;
            tokenCol = col;
            lexemeLength = 0;
            int c = peek();
            if (c < 0) {
                current = Token.EOF;
                return;
            }
            switch (c) {
                case '{' -> punctuation(Token.BEGIN_OBJECT);
                case '}' -> punctuation(Token.END_OBJECT);
                case '[' -> punctuation(Token.BEGIN_ARRAY);
                case ']' -> punctuation(Token.END_ARRAY);
                case ':' -> punctuation(Token.COLON);
                case ',' -> punctuation(Token.COMMA);
                case '"' -> {
                    readString();
                    current = Token.STRING;
                }
                default -> {
                    if (c == '-' || isDigit(c)) {
                        readNumber();
                        current = Token.NUMBER;
                    } else if (isLetter(c)) {
                        current = readKeyword();
                    } else throw error(Kind.UNEXPECTED_CHARACTER, "Unexpected character: " + describe(c));
                }
            }
        }

        private void punctuation(Token token) {
            consume();
            current = token;
        }

        private void skipWs() {
            while (true) {
                int c = peek();
                if (c == ' ' || c == '\t' || c == '\n' || c == '\r') consume();
                else return;
            }
        }

        private void readString() {
            append(consume()); // opening "
            while (true) {
                int c = peek();
                if (c < 0) throw error(Kind.UNTERMINATED_STRING, "Unterminated string literal");
                append(consume());
                if (c == '"') return;
                if (c == '\\') {
                    if (peek() < 0) throw error(Kind.UNTERMINATED_STRING, "Unterminated string literal");
                    append(consume());
                }
            }
        }

        private void readNumber() {
            if (peek() == '-') append(consume());
            int c = peek();
            if (c == '0') {
                append(consume());
                if (isDigit(peek())) throw error(Kind.INVALID_NUMBER, "Invalid number format (leading zero)");
            } else if (isDigit(c)) {
                readDigits();
            } else throw error(Kind.INVALID_NUMBER, "Invalid number format (integer part)");
            if (peek() == '.') {
                append(consume());
                if (!isDigit(peek())) throw error(Kind.INVALID_NUMBER, "Invalid number format (fractional part)");
                readDigits();
            }
            c = peek();
            if (c == 'e' || c == 'E') {
                append(consume());
                c = peek();
                if (c == '+' || c == '-') append(consume());
                if (!isDigit(peek())) throw error(Kind.INVALID_NUMBER, "Invalid number format (exponent part)");
                readDigits();
            }
        }

        private void readDigits() {
            while (isDigit(peek())) append(consume());
        }

        private Token readKeyword() {
            while (isLetter(peek()) || isDigit(peek()) || peek() == '_') append(consume());
            if (lexemeIs(TRUE)) return Token.TRUE;
            if (lexemeIs(FALSE)) return Token.FALSE;
            if (lexemeIs(NULL)) return Token.NULL;
            var text = lexemeText();
            if (text.length() > 32) text = text.substring(0, 32) + "...";
            throw error(Kind.UNEXPECTED_TOKEN, "Unexpected token: '" + text + "'");
        }

        private boolean lexemeIs(byte[] keyword) {
            return Arrays.equals(lexeme, 0, lexemeLength, keyword, 0, keyword.length);
        }

        private void append(int c) {
            if (lexemeLength == lexeme.length) lexeme = Arrays.copyOf(lexeme, lexeme.length << 1);
            lexeme[lexemeLength++] = (byte) c;
        }

        private int peek() {
            if (pos == limit && !fill()) return -1;
            return buf[pos] & 0xFF;
        }

        // only after peek() returned a byte
        private int consume() {
            int c = buf[pos++] & 0xFF;
            offset++;
            if (c == '\n') {
                line++;
                col = 1;
            } else col++;
            return c;
        }

        private boolean fill() {
            if (eof) return false;
            try {
                int n;
                do {
                    n = in.read(buf, 0, buf.length);
                } while (n == 0);
                if (n < 0) {
                    eof = true;
                    return false;
                }
                pos = 0;
                limit = n;
                return true;
            } catch (IOException e) {
                throw new JfmtException.IoException(Operation.READ, source, e);
            }
        }

        private static boolean isDigit(int c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isLetter(int c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
        }

        private static String describe(int c) {
            if (c >= 0x20 && c < 0x7F) return "'" + (char) c + "'";
            return String.format("byte 0x%02X", c);
        }

        SyntaxException error(Kind kind, String msg) {
            return new SyntaxException(kind, msg, tokenOffset, tokenLine, tokenCol);
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * Receives the structure of a document as the {@link Parser} validates it.
     * Lexeme arrays are only valid for the duration of the call.
     */
    interface Handler<X extends Exception> {
        void beginObject() throws X;

        void endObject() throws X;

        void beginArray() throws X;

        void endArray() throws X;

        void key(byte[] lexeme, int length) throws X;

        void scalar(Token token, byte[] lexeme, int length) throws X;
    }

    /**
     * JSON grammar driver. Nesting is tracked on an explicit stack, so depth is limited by
     * {@code maxDepth} rather than by the call stack.
     */
    static final class Parser {
        private final Lexer lexer;
        private final int maxDepth;
        private boolean[] inObject = new boolean[32];
        private int depth;

        Parser(Lexer lexer, int maxDepth) {
            if (maxDepth < 1) throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
            this.lexer = Objects.requireNonNull(lexer);
            this.maxDepth = maxDepth;
        }

        <X extends Exception> void parse(Handler<X> handler) throws X {
            if (lexer.current() == Token.EOF) throw error(Kind.EMPTY_DOCUMENT, "Empty document");
            readValue(handler);
            while (depth > 0) {
                boolean object = inObject[depth - 1];
                Token end = object ? Token.END_OBJECT : Token.END_ARRAY;
                Token t = lexer.current();
                if (t == Token.COMMA) {
                    lexer.advance();
                    if (lexer.current() == end)
                        throw error(Kind.TRAILING_COMMA, "Trailing comma in " + (object ? "object" : "array"));
                    if (object) readKey(handler);
                    readValue(handler);
                } else if (t == end) {
                    close(handler);
                } else if (object) {
                    throw error(Kind.EXPECTED_COMMA_OR_END, "Expected ',' or '}' in object");
                } else {
                    throw error(Kind.EXPECTED_COMMA_OR_END, "Expected ',' or ']' in array");
                }
            }
            if (lexer.current() != Token.EOF)
                throw error(Kind.TRAILING_CONTENT, "Trailing characters after top-level value");
        }

        // Reads a scalar, an empty container, or opens a container and continues with its first value.
        private <X extends Exception> void readValue(Handler<X> handler) throws X {
            while (true) {
                switch (lexer.current()) {
                    case BEGIN_OBJECT -> {
                        open(handler, true);
                        if (lexer.current() == Token.END_OBJECT) {
                            close(handler);
                            return;
                        }
                        readKey(handler);
                    }
                    case BEGIN_ARRAY -> {
                        open(handler, false);
                        if (lexer.current() == Token.END_ARRAY) {
                            close(handler);
                            return;
                        }
                    }
                    case STRING, NUMBER, TRUE, FALSE, NULL -> {
                        handler.scalar(lexer.current(), lexer.lexeme(), lexer.lexemeLength());
                        advanceAfterValue();
                        return;
                    }
                    case EOF -> throw error(Kind.UNEXPECTED_TOKEN, "Unexpected end of input while expecting a value");
                    default -> throw error(Kind.UNEXPECTED_TOKEN, "Expected a value");
                }
            }
        }

        private <X extends Exception> void readKey(Handler<X> handler) throws X {
            if (lexer.current() != Token.STRING) throw error(Kind.EXPECTED_KEY, "Expected string key in object");
            handler.key(lexer.lexeme(), lexer.lexemeLength());
            lexer.advance();
            if (lexer.current() != Token.COLON) throw error(Kind.EXPECTED_COLON, "Expected ':' after object key");
            lexer.advance();
        }

        private <X extends Exception> void open(Handler<X> handler, boolean object) throws X {
            if (depth == maxDepth) throw error(Kind.NESTING_TOO_DEEP, "Nesting depth exceeds " + maxDepth);
            if (depth == inObject.length) inObject = Arrays.copyOf(inObject, depth << 1);
            inObject[depth++] = object;
            if (object) handler.beginObject();
            else handler.beginArray();
            lexer.advance();
        }

        private <X extends Exception> void close(Handler<X> handler) throws X {
            if (inObject[--depth]) handler.endObject();
            else handler.endArray();
            advanceAfterValue();
        }

        // Past the root value anything but whitespace is trailing content, even if it is not a valid token.
        private void advanceAfterValue() {
            if (depth > 0) {
                lexer.advance();
                return;
            }
            try {
                lexer.advance();
            } catch (SyntaxException e) {
                throw new SyntaxException(
                        Kind.TRAILING_CONTENT,
                        "Trailing characters after top-level value",
                        e.getOffset(),
                        e.getLine(),
                        e.getColumn());
            }
        }

        private SyntaxException error(Kind kind, String msg) {
            return lexer.error(kind, msg + " (token: " + lexer.current() + ")");
        }
    }

    /**
     * Materializes the parsed document as a {@link JsonValue} tree.
     */
    static final class TreeBuilder implements Handler<RuntimeException> {

        private static final class Frame {
            final boolean object;
            final List<JsonValue> values = new ArrayList<>();
            final List<JsonObject.Member> members = new ArrayList<>();
            @Nullable String pendingKey;

            Frame(boolean object) {
                this.object = object;
            }
        }

        private final Deque<Frame> stack = new ArrayDeque<>();
        private @Nullable JsonValue result;

        JsonValue result() {
            if (result == null) throw new IllegalStateException("Document not complete");
            return result;
        }

        @Override
        public void beginObject() {
            stack.push(new Frame(true));
        }

        @Override
        public void endObject() {
            add(new JsonObject(stack.pop().members));
        }

        @Override
        public void beginArray() {
            stack.push(new Frame(false));
        }

        @Override
        public void endArray() {
            add(new JsonArray(stack.pop().values));
        }

        @Override
        public void key(byte[] lexeme, int length) {
            stack.element().pendingKey = new String(lexeme, 0, length, StandardCharsets.UTF_8);
        }

        @Override
        public void scalar(Token token, byte[] lexeme, int length) {
            add(switch (token) {
                case STRING -> new JsonString(new String(lexeme, 0, length, StandardCharsets.UTF_8));
                case NUMBER -> new JsonNumber(new String(lexeme, 0, length, StandardCharsets.US_ASCII));
                case TRUE -> new JsonBoolean(true);
                case FALSE -> new JsonBoolean(false);
                case NULL -> new JsonNull();
                default -> throw new IllegalArgumentException("Not a scalar token: " + token);
            });
        }

        private void add(JsonValue value) {
            var frame = stack.peek();
            if (frame == null) {
                result = value;
            } else if (frame.object) {
                frame.members.add(new JsonObject.Member(Objects.requireNonNull(frame.pendingKey), value));
                frame.pendingKey = null;
            } else {
                frame.values.add(value);
            }
        }
    }

    static final class Validator implements Handler<RuntimeException> {
        @Override
        public void beginObject() {}

        @Override
        public void endObject() {}

        @Override
        public void beginArray() {}

        @Override
        public void endArray() {}

        @Override
        public void key(byte[] lexeme, int length) {}

        @Override
        public void scalar(Token token, byte[] lexeme, int length) {}
    }

    // ============================================================
    // Writer
    // ============================================================

    /**
     * Writes formatted output for the structure it receives. Lexemes are copied verbatim; line breaks and
     * indentation are inserted only at structural boundaries, and empty containers stay on one line.
     */
    static final class Emitter implements Handler<IOException> {
        private final OutputStream out;
        private final boolean pretty;
        private final byte[] unit;
        // '\n' followed by indentation, grown on demand
        private byte[] indent;
        private boolean[] inObject = new boolean[32];
        private boolean[] hasChildren = new boolean[32];
        private int depth;

        Emitter(OutputStream out, FormatPolicy policy) {
            this.out = Objects.requireNonNull(out);
            this.pretty = policy.isPretty();
            this.unit = policy.indentUnit();
            this.indent = new byte[1 + 8 * unit.length];
            fillIndent();
        }

        @Override
        public void beginObject() throws IOException {
            open('{', true);
        }

        @Override
        public void endObject() throws IOException {
            close('}');
        }

        @Override
        public void beginArray() throws IOException {
            open('[', false);
        }

        @Override
        public void endArray() throws IOException {
            close(']');
        }

        @Override
        public void key(byte[] lexeme, int length) throws IOException {
            nextChild();
            out.write(lexeme, 0, length);
            out.write(':');
            if (pretty) out.write(' ');
        }

        @Override
        public void scalar(Token token, byte[] lexeme, int length) throws IOException {
            beforeValue();
            out.write(lexeme, 0, length);
        }

        void finish(boolean trailingNewline) throws IOException {
            if (depth != 0) throw new IllegalStateException("Unclosed containers: " + depth);
            if (trailingNewline) out.write('\n');
        }

        private void open(char c, boolean object) throws IOException {
            beforeValue();
            out.write(c);
            if (depth == inObject.length) {
                inObject = Arrays.copyOf(inObject, depth << 1);
                hasChildren = Arrays.copyOf(hasChildren, depth << 1);
            }
            inObject[depth] = object;
            hasChildren[depth] = false;
            depth++;
        }

        private void close(char c) throws IOException {
            depth--;
            if (hasChildren[depth]) newline(depth);
            out.write(c);
        }

        // keys already placed the separator for object members
        private void beforeValue() throws IOException {
            if (depth > 0 && !inObject[depth - 1]) nextChild();
        }

        private void nextChild() throws IOException {
            int parent = depth - 1;
            if (hasChildren[parent]) out.write(',');
            else hasChildren[parent] = true;
            newline(depth);
        }

        private void newline(int level) throws IOException {
            if (!pretty) return;
            int length = 1 + level * unit.length;
            if (length > indent.length) {
                indent = new byte[Math.max(length, indent.length << 1)];
                fillIndent();
            }
            out.write(indent, 0, length);
        }

        private void fillIndent() {
            indent[0] = '\n';
            for (int i = 1; i < indent.length; i++) {
                indent[i] = unit[(i - 1) % unit.length];
            }
        }
    }

    /**
     * Replays a value tree into a handler, depth-first, without recursion.
     */
    static <X extends Exception> void walk(JsonValue root, Handler<X> handler) throws X {
        Deque<WalkFrame> stack = new ArrayDeque<>();
        visit(root, handler, stack);
        while (!stack.isEmpty()) {
            var frame = stack.element();
            if (!frame.children.hasNext()) {
                stack.pop();
                if (frame.object) handler.endObject();
                else handler.endArray();
                continue;
            }
            var next = frame.children.next();
            if (frame.object) {
                var member = (JsonObject.Member) next;
                var key = member.key().getBytes(StandardCharsets.UTF_8);
                handler.key(key, key.length);
                visit(member.value(), handler, stack);
            } else {
                visit((JsonValue) next, handler, stack);
            }
        }
    }

    private record WalkFrame(boolean object, Iterator<?> children) {}

    private static <X extends Exception> void visit(JsonValue value, Handler<X> handler, Deque<WalkFrame> stack)
            throws X {
        if (value instanceof JsonObject o) {
            handler.beginObject();
            stack.push(new WalkFrame(true, o.members().iterator()));
        } else if (value instanceof JsonArray a) {
            handler.beginArray();
            stack.push(new WalkFrame(false, a.values().iterator()));
        } else if (value instanceof JsonString s) {
            var bytes = s.lexeme().getBytes(StandardCharsets.UTF_8);
            handler.scalar(Token.STRING, bytes, bytes.length);
        } else if (value instanceof JsonNumber n) {
            var bytes = n.lexeme().getBytes(StandardCharsets.US_ASCII);
            handler.scalar(Token.NUMBER, bytes, bytes.length);
        } else if (value instanceof JsonBoolean b) {
            var bytes = b.value() ? Lexer.TRUE : Lexer.FALSE;
            handler.scalar(b.value() ? Token.TRUE : Token.FALSE, bytes, bytes.length);
        } else if (value instanceof JsonNull) {
            handler.scalar(Token.NULL, Lexer.NULL, Lexer.NULL.length);
        } else {
            throw new JfmtException("Unknown JsonValue type: " + value.getClass());
        }
    }
}
