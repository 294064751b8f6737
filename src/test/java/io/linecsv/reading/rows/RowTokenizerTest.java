package io.linecsv.reading.rows;

import io.linecsv.CsvSpecs;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

public class RowTokenizerTest {
    private final RowTokenizer tokenizer = RowTokenizer.of(CsvSpecs.csv());

    @ParameterizedTest
    @MethodSource("provideCompleteRows")
    public void completeRows(String chunk, List<String> expected) {
        final TokenizeResult result = tokenizer.tokenize(chunk);
        Assertions.assertThat(result.isComplete()).isTrue();
        Assertions.assertThat(result.fields()).containsExactlyElementsOf(expected);
    }

    private static Stream<Arguments> provideCompleteRows() {
        return Stream.of(
                Arguments.of("a,b,c\n", List.of("a", "b", "c")),
                // Delimiter inside quotes is literal
                Arguments.of("\"a,b\",c\n", List.of("a,b", "c")),
                // Doubled quote inside quotes is one literal quote, and does not end the field
                Arguments.of("\"a\"\"b\"\n", List.of("a\"b")),
                Arguments.of("\"\"\"\"\n", List.of("\"")),
                // Newline inside quotes is literal
                Arguments.of("\"a\nb\"\n", List.of("a\nb")),
                Arguments.of("\"a\r\nb\",c\r\n", List.of("a\r\nb", "c")),
                // Empty line is a single empty field
                Arguments.of("\n", List.of("")),
                Arguments.of("", List.of("")),
                // Trailing and leading delimiters
                Arguments.of("a,\n", List.of("a", "")),
                Arguments.of(",a\n", List.of("", "a")),
                Arguments.of(",,\n", List.of("", "", "")),
                // Empty quoted field
                Arguments.of("\"\",x\n", List.of("", "x")),
                // No line terminator at the end of the chunk
                Arguments.of("a,b", List.of("a", "b")),
                Arguments.of("\"a\",\"b\"", List.of("a", "b")),
                // Carriage return terminators
                Arguments.of("a,b\r", List.of("a", "b")),
                Arguments.of("a,b\r\n", List.of("a", "b")),
                // Spaces are kept, quotes after them still toggle
                Arguments.of(" a , \"b\"\n", List.of(" a ", " b")));
    }

    @ParameterizedTest
    @MethodSource("provideQuotesInsideFields")
    public void quoteInsideFieldToggles(String chunk, List<String> expected) {
        Assertions.assertThat(tokenizer.tokenize(chunk).fields()).containsExactlyElementsOf(expected);
    }

    private static Stream<Arguments> provideQuotesInsideFields() {
        return Stream.of(
                // Text after a closing quote continues the same field
                Arguments.of("\"ab\"cd,e\n", List.of("abcd", "e")),
                // A quote in the middle of unquoted text opens quoted text, which hides the delimiter
                Arguments.of("ab\"c,d\"\n", List.of("abc,d")),
                Arguments.of("x\"a,b\",y\n", List.of("xa,b", "y")),
                // Several quoted sections in one field
                Arguments.of("\"a\"b\"c\",d\n", List.of("abc", "d")),
                // A doubled quote outside quoted text is an empty quoted section
                Arguments.of("ab\"\"cd,e\n", List.of("abcd", "e")));
    }

    @Test
    public void quoteInsideFieldLeavesRowOpen() {
        Assertions.assertThat(tokenizer.tokenize("x\"a\n")).isSameAs(TokenizeResult.INCOMPLETE);
        Assertions.assertThat(tokenizer.tokenize("x\"a\nb\",y\n").fields()).containsExactly("xa\nb", "y");
    }

    @Test
    public void openQuoteIsIncomplete() {
        Assertions.assertThat(tokenizer.tokenize("\"a\n")).isSameAs(TokenizeResult.INCOMPLETE);
        Assertions.assertThat(tokenizer.tokenize("x,\"a\nb\n")).isSameAs(TokenizeResult.INCOMPLETE);
        // The doubled quote is an escaped quote, so the field is still open
        Assertions.assertThat(tokenizer.tokenize("\"a\"\"\n")).isSameAs(TokenizeResult.INCOMPLETE);
    }

    @Test
    public void incompleteHasNoFields() {
        final TokenizeResult result = tokenizer.tokenize("\"abc\n");
        Assertions.assertThat(result.isComplete()).isFalse();
        Assertions.assertThatThrownBy(result::fields).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void tokenizerIsReusableAfterIncomplete() {
        Assertions.assertThat(tokenizer.tokenize("\"a\n").isComplete()).isFalse();
        Assertions.assertThat(tokenizer.tokenize("\"a\nb\"\n").fields()).containsExactly("a\nb");
        Assertions.assertThat(tokenizer.tokenize("c,d\n").fields()).containsExactly("c", "d");
    }

    @Test
    public void resumeScansOnlyAppendedText() {
        final StringBuilder chunk = new StringBuilder("1,\"a\n");
        Assertions.assertThat(tokenizer.tokenize(chunk)).isSameAs(TokenizeResult.INCOMPLETE);
        // Overwrite the text already scanned. A resumed scan does not look at it again.
        chunk.setCharAt(0, '9');
        chunk.append("b\n");
        Assertions.assertThat(tokenizer.resume(chunk)).isSameAs(TokenizeResult.INCOMPLETE);
        chunk.append("c\",d\n");
        Assertions.assertThat(tokenizer.resume(chunk).fields()).containsExactly("1", "a\nb\nc", "d");
    }

    @Test
    public void resumeKeepsEscapedQuotes() {
        final StringBuilder chunk = new StringBuilder("\"a\"\"\n");
        Assertions.assertThat(tokenizer.tokenize(chunk)).isSameAs(TokenizeResult.INCOMPLETE);
        chunk.append("\"\"b\",c\n");
        Assertions.assertThat(tokenizer.resume(chunk).fields()).containsExactly("a\"\n\"b", "c");
    }

    @Test
    public void resumeAfterCompleteStartsOver() {
        Assertions.assertThat(tokenizer.tokenize("a,b\n").fields()).containsExactly("a", "b");
        Assertions.assertThat(tokenizer.resume("c\n").fields()).containsExactly("c");
    }

    @Test
    public void fieldsAreUnmodifiable() {
        final List<String> fields = tokenizer.tokenize("a,b\n").fields();
        Assertions.assertThatThrownBy(() -> fields.add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void fieldsAreNotSharedBetweenRows() {
        final List<String> first = tokenizer.tokenize("a,b\n").fields();
        tokenizer.tokenize("c\n");
        Assertions.assertThat(first).containsExactly("a", "b");
    }

    @Test
    public void textAfterEndOfRow() {
        Assertions.assertThatThrownBy(() -> tokenizer.tokenize("a\nb\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unexpected text after the end of the row (offset 2 of 4)");
    }

    @Test
    public void distinctEscapeChar() {
        final RowTokenizer backslash = new RowTokenizer('"', ',', '\\');
        // Escaped quote inside quotes
        Assertions.assertThat(backslash.tokenize("\"a\\\"b\",c\n").fields()).containsExactly("a\"b", "c");
        // Escaped quote outside quotes
        Assertions.assertThat(backslash.tokenize("a\\\"b,c\n").fields()).containsExactly("a\"b", "c");
        // Only escape-before-quote is recognized; anything else is literal
        Assertions.assertThat(backslash.tokenize("\"a\\nb\"\n").fields()).containsExactly("a\\nb");
        Assertions.assertThat(backslash.tokenize("a\\,b\n").fields()).containsExactly("a\\", "b");
        // An escaped quote at the end of the chunk leaves the field open
        Assertions.assertThat(backslash.tokenize("\"a\\\"\n")).isSameAs(TokenizeResult.INCOMPLETE);
    }

    @Test
    public void doubledQuoteIsNotAnEscapeWhenEscapeDiffers() {
        final RowTokenizer backslash = new RowTokenizer('"', ',', '\\');
        // The quote closes, and the next one opens again
        Assertions.assertThat(backslash.tokenize("\"a\"\"b\"\n").fields()).containsExactly("ab");
    }

    @Test
    public void customQuoteAndDelimiter() {
        final RowTokenizer custom = new RowTokenizer('\'', ';', '\'');
        Assertions.assertThat(custom.tokenize("'a;b';'it''s';\"x\"\n").fields())
                .containsExactly("a;b", "it's", "\"x\"");
    }
}
