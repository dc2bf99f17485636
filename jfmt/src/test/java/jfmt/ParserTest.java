package jfmt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.IntStream;
import jfmt.JfmtException.Kind;
import jfmt.JfmtException.SyntaxException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParserTest {

    @Nested
    class TreeBuilding {

        @Test
        void parseScalars() {
            // @spotless:off
            var table = new Object[][] {
                    {"null", new JsonNull()},
                    {"true", new JsonBoolean(true)},
                    {" false ", new JsonBoolean(false)},
                    {"2.00", new JsonNumber("2.00")},
                    {"-1e10", new JsonNumber("-1e10")},
                    {"\"caf\\u00e9\"", new JsonString("\"caf\\u00e9\"")},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var input = (String) table[i][0];
                assertThat(Jfmt.parse(input)).as("Case %d: input=%s", i, input).isEqualTo(table[i][1]);
            }));
        }

        @Test
        void parseContainersInSourceOrder() {
            var value = Jfmt.parse("{\"b\": [1, {}, []], \"a\": {\"x\": null}}");

            assertThat(value)
                    .isEqualTo(new JsonObject(List.of(
                            new JsonObject.Member(
                                    "\"b\"",
                                    new JsonArray(List.of(
                                            new JsonNumber("1"),
                                            new JsonObject(List.of()),
                                            new JsonArray(List.of())))),
                            new JsonObject.Member(
                                    "\"a\"",
                                    new JsonObject(List.of(new JsonObject.Member("\"x\"", new JsonNull())))))));
        }

        @Test
        void duplicateKeysPassThrough() {
            var value = (JsonObject) Jfmt.parse("{\"a\":1,\"a\":2}");

            assertThat(value.members()).extracting(JsonObject.Member::key).containsExactly("\"a\"", "\"a\"");
            assertThat(value.get("a")).isEqualTo(new JsonNumber("2"));
            assertThat(Jfmt.format("{\"a\":1,\"a\":2}", FormatPolicy.compact())).isEqualTo("{\"a\":1,\"a\":2}");
        }

        @Test
        void parseFromStream() {
            var value = Jfmt.parse(new ByteArrayInputStream("[\"é\"]".getBytes(StandardCharsets.UTF_8)));

            assertThat(value).isEqualTo(new JsonArray(List.of(new JsonString("\"é\""))));
        }
    }

    @Nested
    class Errors {

        @Test
        void syntaxErrors() {
            // @spotless:off
            var table = new Object[][] {
                    {"", Kind.EMPTY_DOCUMENT, 0L},
                    {" \n\t ", Kind.EMPTY_DOCUMENT, 4L},
                    {"{\"a\":1,}", Kind.TRAILING_COMMA, 7L},
                    {"[1,2,]", Kind.TRAILING_COMMA, 5L},
                    {"[1 2]", Kind.EXPECTED_COMMA_OR_END, 3L},
                    {"{\"a\":1 \"b\":2}", Kind.EXPECTED_COMMA_OR_END, 7L},
                    {"{\"x\":1", Kind.EXPECTED_COMMA_OR_END, 6L},
                    {"[1,2", Kind.EXPECTED_COMMA_OR_END, 4L},
                    {"[1}", Kind.EXPECTED_COMMA_OR_END, 2L},
                    {"{1:2}", Kind.EXPECTED_KEY, 1L},
                    {"{,}", Kind.EXPECTED_KEY, 1L},
                    {"{\"a\":1,2}", Kind.EXPECTED_KEY, 7L},
                    {"{\"a\",1}", Kind.EXPECTED_COLON, 4L},
                    {"{\"a\" 1}", Kind.EXPECTED_COLON, 5L},
                    {"{\"a\"}", Kind.EXPECTED_COLON, 4L},
                    {"{\"a\":}", Kind.UNEXPECTED_TOKEN, 5L},
                    {"[,]", Kind.UNEXPECTED_TOKEN, 1L},
                    {"[1,,2]", Kind.UNEXPECTED_TOKEN, 3L},
                    {"]", Kind.UNEXPECTED_TOKEN, 0L},
                    {"[", Kind.UNEXPECTED_TOKEN, 1L},
                    {"false,", Kind.TRAILING_CONTENT, 5L},
                    {"1 2", Kind.TRAILING_CONTENT, 2L},
                    {"{} {}", Kind.TRAILING_CONTENT, 3L},
                    {"{} x", Kind.TRAILING_CONTENT, 3L},
                    {"[1] @", Kind.TRAILING_CONTENT, 4L},
                    {"{}\"abc", Kind.TRAILING_CONTENT, 2L},
                    {"{\"a\":1} garbage", Kind.TRAILING_CONTENT, 8L},
                    {"0 -", Kind.TRAILING_CONTENT, 2L},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var input = (String) table[i][0];
                for (var mode : Jfmt.Mode.values()) {
                    var formatter = Jfmt.Formatter.builder().mode(mode).build();
                    assertThatCode(() -> formatter.format(input))
                            .as("Case %d (%s): input=%s", i, mode, input)
                            .isInstanceOfSatisfying(SyntaxException.class, e -> {
                                assertThat(e.getKind()).isEqualTo(table[i][1]);
                                assertThat(e.getOffset()).isEqualTo(table[i][2]);
                            });
                }
            }));
        }

        @Test
        void messageNamesTheOffendingToken() {
            assertThatCode(() -> Jfmt.parse("{\"a\":1,}"))
                    .isInstanceOf(SyntaxException.class)
                    .hasMessage("Trailing comma in object (token: END_OBJECT) at line 1, column 8 (offset 7)");
            assertThatCode(() -> Jfmt.parse("[1 2]"))
                    .isInstanceOf(SyntaxException.class)
                    .hasMessageContaining("Expected ',' or ']' in array (token: NUMBER)");
        }

        @Test
        void anythingAfterTheRootIsTrailingContent() {
            assertThatCode(() -> Jfmt.format("[1]\n  nope", FormatPolicy.compact()))
                    .isInstanceOfSatisfying(SyntaxException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(Kind.TRAILING_CONTENT);
                        assertThat(e.getLine()).isEqualTo(2);
                        assertThat(e.getColumn()).isEqualTo(3);
                    })
                    .hasMessage("Trailing characters after top-level value at line 2, column 3 (offset 6)");
        }

        @Test
        void validateReportsWithoutOutput() {
            assertThatCode(() -> Jfmt.validate(new ByteArrayInputStream("{\"a\":[1,{}]}".getBytes(StandardCharsets.UTF_8))))
                    .doesNotThrowAnyException();
            assertThatCode(() -> Jfmt.validate(new ByteArrayInputStream("{\"a\":[1,{}]".getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOfSatisfying(
                            SyntaxException.class, e -> assertThat(e.getKind()).isEqualTo(Kind.EXPECTED_COMMA_OR_END));
        }
    }

    @Nested
    class Nesting {

        @Test
        void hundredThousandOpenBracketsFailWithoutStackOverflow() {
            var input = "[".repeat(100_000);

            assertThatCode(() -> Jfmt.format(input, FormatPolicy.compact()))
                    .isInstanceOfSatisfying(SyntaxException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(Kind.NESTING_TOO_DEEP);
                        assertThat(e.getOffset()).isEqualTo(Jfmt.Formatter.DEFAULT_MAX_DEPTH);
                    });
        }

        @Test
        void depthAtTheBoundIsAccepted() {
            int depth = Jfmt.Formatter.DEFAULT_MAX_DEPTH;
            var input = "[".repeat(depth) + "]".repeat(depth);

            for (var mode : Jfmt.Mode.values()) {
                var formatter = Jfmt.Formatter.builder()
                        .mode(mode)
                        .policy(FormatPolicy.compact())
                        .build();
                assertThat(formatter.format(input)).as("mode %s", mode).isEqualTo(input);
            }
        }

        @Test
        void configurableBound() {
            var formatter = Jfmt.Formatter.builder().maxDepth(2).build();

            assertThatCode(() -> formatter.format("[[1]]")).doesNotThrowAnyException();
            assertThatCode(() -> formatter.format("[{\"a\":[1]}]"))
                    .isInstanceOfSatisfying(
                            SyntaxException.class, e -> assertThat(e.getKind()).isEqualTo(Kind.NESTING_TOO_DEEP));
            assertThatCode(() -> Jfmt.Formatter.builder().maxDepth(0).build().format("1"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void deepTreeRoundTrips() {
            int depth = 5_000;
            var input = "{\"a\":".repeat(depth) + "1" + "}".repeat(depth);

            var tree = Jfmt.parse(input);

            assertThat(tree.stringify()).isEqualTo(input);
        }
    }
}
