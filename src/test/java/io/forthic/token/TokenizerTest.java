package io.forthic.token;

import io.forthic.error.TokenizeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {
    @Test
    void tokenizeShouldRecognizeEveryTokenKind() {
        List<Token> tokens = Tokenizer.tokenize("{math : DOUBLE 2 * ; @: ANSWER 42 ; [1 'two'] .key # note\n}");
        assertEquals(List.of(
                TokenType.START_MODULE, TokenType.START_DEF, TokenType.WORD, TokenType.WORD, TokenType.END_DEF,
                TokenType.START_MEMO, TokenType.WORD, TokenType.END_DEF,
                TokenType.START_ARRAY, TokenType.WORD, TokenType.STRING, TokenType.END_ARRAY,
                TokenType.DOT_SYMBOL, TokenType.COMMENT, TokenType.END_MODULE
        ), types(tokens));
        assertEquals("math", tokens.get(0).text());
        assertEquals("DOUBLE", tokens.get(1).text());
        assertEquals("ANSWER", tokens.get(5).text());
        assertEquals("two", tokens.get(10).text());
        assertEquals("key", tokens.get(12).text());
        assertEquals(" note", tokens.get(13).text());
    }

    @Test
    void parenthesesAndCommasShouldBeWhitespace() {
        List<Token> tokens = Tokenizer.tokenize("(1, 2)\t3");
        assertEquals(List.of("1", "2", "3"), texts(tokens));
    }

    @Test
    void bracketsShouldEndBareWords() {
        List<Token> tokens = Tokenizer.tokenize("[A B]");
        assertEquals(List.of("[", "A", "B", "]"), texts(tokens));
    }

    @Test
    void quotedStringsShouldKeepWhitespaceAndOtherDelimiters() {
        List<Token> tokens = Tokenizer.tokenize("\"it's here\" ^say \"hi\"^ 'a b'");
        assertEquals(List.of("it's here", "say \"hi\"", "a b"), texts(tokens));
    }

    @Test
    void tripleQuotedStringShouldSpanLinesAndKeepExtraDelimiters() {
        List<Token> tokens = Tokenizer.tokenize("'''line one\nline 'two''''");
        assertEquals(1, tokens.size());
        assertEquals("line one\nline 'two'", tokens.get(0).text());
    }

    @Test
    void htmlEscapesShouldBeUnescapedBeforeLexing() {
        List<Token> tokens = Tokenizer.tokenize("'&lt;b&gt;' &lt;");
        assertEquals(List.of("<b>", "<"), texts(tokens));
    }

    @Test
    void loneDotShouldBeAWord() {
        Token token = Tokenizer.tokenize(". .x").get(0);
        assertEquals(TokenType.WORD, token.type());
        assertEquals(".", token.text());
    }

    @Test
    void emptyModuleNameShouldBeAllowed() {
        List<Token> tokens = Tokenizer.tokenize("{}");
        assertEquals(List.of(TokenType.START_MODULE, TokenType.END_MODULE), types(tokens));
        assertEquals("", tokens.get(0).text());
    }

    @Test
    void locationsShouldTrackLinesAndColumns() {
        Tokenizer tokenizer = new Tokenizer("A\n  B", CodeLocation.of("script.forthic"));
        Token first = tokenizer.nextToken();
        Token second = tokenizer.nextToken();
        assertEquals("script.forthic:1:1", first.location().describe());
        assertEquals("script.forthic:2:3", second.location().describe());
        assertEquals(4, second.location().startPos());
        assertEquals(5, second.location().endPos());
        assertTrue(tokenizer.nextToken().isEos());
    }

    @Test
    void referenceLocationShouldOffsetPositions() {
        Tokenizer tokenizer = new Tokenizer("X", new CodeLocation("mod", 10, 5, 100, 100));
        Token token = tokenizer.nextToken();
        assertEquals(10, token.location().line());
        assertEquals(5, token.location().column());
        assertEquals(100, token.location().startPos());
    }

    @Test
    void unterminatedStringShouldFail() {
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("'open"));
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("'''open"));
    }

    @Test
    void definitionNamesShouldRejectQuotesAndBrackets() {
        TokenizeException quoted = assertThrows(TokenizeException.class, () -> Tokenizer.tokenize(": 'BAD ;"));
        assertTrue(quoted.getMessage().contains("quotes"));
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize(": BAD[ ;"));
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("@: {X ;"));
    }

    @Test
    void colonAtEndOfInputShouldFail() {
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("1 2 :"));
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("@:   "));
    }

    @Test
    void mismatchedBracketsShouldFail() {
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("1 ]"));
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("}"));
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("[1 2"));
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("{mod A"));
    }

    @Test
    void interleavedBracketsShouldFailAtTheWrongClose() {
        TokenizeException error = assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("[ {m ] }"));
        assertTrue(error.getMessage().contains("'{' is still open"));
        assertEquals(6, error.location().column());
        assertThrows(TokenizeException.class, () -> Tokenizer.tokenize("{m [ } ]"));
        assertEquals(11, Tokenizer.tokenize("[ {m [1] } ] {n [ ] }").size());
    }

    @Test
    void renderedTokensShouldTokenizeToTheSameSequence() {
        String[] sources = {
                "{math : DOUBLE 2 * ; } [1 2 3] .key 'it''s' ^caret^",
                "'''multi\nline''' \"both ' and ^\" @: M 1 ; # trailing comment\nX",
                "'has \"double\" and ^caret^' [[] [.a 1]] {}"
        };
        for (String source : sources) {
            List<Token> first = Tokenizer.tokenize(source);
            List<Token> second = Tokenizer.tokenize(Tokenizer.render(first));
            assertEquals(first.size(), second.size(), source);
            for (int i = 0; i < first.size(); i++) {
                assertTrue(first.get(i).sameAs(second.get(i)), "token " + i + " of " + source);
            }
        }
    }

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> out = new ArrayList<>();
        for (Token token : tokens) {
            out.add(token.type());
        }
        return out;
    }

    private static List<String> texts(List<Token> tokens) {
        List<String> out = new ArrayList<>();
        for (Token token : tokens) {
            out.add(token.text());
        }
        return out;
    }
}
