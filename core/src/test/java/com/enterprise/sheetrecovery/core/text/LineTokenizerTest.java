package com.enterprise.sheetrecovery.core.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineTokenizerTest {

    private final LineTokenizer tokenizer = new LineTokenizer();

    @Test
    @DisplayName("delimiter inside quotes is literal")
    void quotedDelimiter() {
        assertThat(tokenizer.tokenize("\"Smith, John\",42", ',')).containsExactly("Smith, John", "42");
    }

    @Test
    @DisplayName("doubled quote inside quotes is an escaped quote")
    void escapedQuote() {
        assertThat(tokenizer.tokenize("\"He said \"\"hi\"\"\",x", ',')).containsExactly("He said \"hi\"", "x");
    }

    @Test
    void singleQuotesWork() {
        assertThat(tokenizer.tokenize("'quoted; field';2", ';')).containsExactly("quoted; field", "2");
    }

    @Test
    @DisplayName("a quote opens a quoted section anywhere in a field")
    void quoteInsideField() {
        assertThat(tokenizer.tokenize("a\"b,c\"d,e", ',')).containsExactly("ab,cd", "e");
    }

    @Test
    @DisplayName("an unmatched apostrophe quotes the rest of the line")
    void apostropheInsideField() {
        assertThat(tokenizer.tokenize("it's,fine", ',')).containsExactly("its,fine");
    }

    @Test
    void fieldsAreTrimmedAndEmptyFieldsKept() {
        assertThat(tokenizer.tokenize("  a , ,b,", ',')).containsExactly("a", "", "b", "");
    }

    @Test
    @DisplayName("unterminated quote keeps the rest of the line in one field")
    void unterminatedQuote() {
        assertThat(tokenizer.tokenize("x,\"abc,def", ',')).containsExactly("x", "abc,def");
    }

    @Test
    void emptyLineIsOneEmptyField() {
        assertThat(tokenizer.tokenize("", ',')).containsExactly("");
    }
}
