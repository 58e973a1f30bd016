package io.forthic.token;

import io.forthic.error.TokenizeException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public final class Tokenizer {
    private static final String WHITESPACE = " \t\n\r(),";
    private static final String QUOTES = "\"'^";
    private static final String WORD_TERMINATORS = ";[]{}#";
    private static final String NAME_BRACKETS = "[]{}";

    private final String input;
    private final CodeLocation reference;
    private int pos;
    private int line;
    private int column;
    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;
    private final Deque<Character> openBrackets = new ArrayDeque<>();

    public Tokenizer(String source) {
        this(source, CodeLocation.START);
    }

    public Tokenizer(String source, CodeLocation reference) {
        this.input = unescape(source == null ? "" : source);
        this.reference = reference == null ? CodeLocation.START : reference;
        this.line = this.reference.line();
        this.column = this.reference.column();
    }

    public static List<Token> tokenize(String source) {
        Tokenizer tokenizer = new Tokenizer(source);
        List<Token> tokens = new ArrayList<>();
        Token token = tokenizer.nextToken();
        while (!token.isEos()) {
            tokens.add(token);
            token = tokenizer.nextToken();
        }
        return tokens;
    }

    /**
     * Renders tokens back to source text that tokenizes to the same kinds and texts.
     */
    public static String render(List<Token> tokens) {
        StringBuilder out = new StringBuilder();
        for (Token token : tokens) {
            if (out.length() > 0) {
                out.append(' ');
            }
            switch (token.type()) {
                case STRING -> out.append(quote(token.text()));
                case COMMENT -> out.append('#').append(token.text()).append('\n');
                case START_ARRAY -> out.append('[');
                case END_ARRAY -> out.append(']');
                case START_MODULE -> out.append('{').append(token.text());
                case END_MODULE -> out.append('}');
                case START_DEF -> out.append(": ").append(token.text());
                case START_MEMO -> out.append("@: ").append(token.text());
                case END_DEF -> out.append(';');
                case DOT_SYMBOL -> out.append('.').append(token.text());
                case WORD -> out.append(token.text());
                case EOS -> {
                }
            }
        }
        return out.toString();
    }

    public String input() {
        return input;
    }

    public Token nextToken() {
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            markTokenStart();
            if (isWhitespace(ch)) {
                advance(1);
                continue;
            }
            if (ch == '#') {
                advance(1);
                return gatherComment();
            }
            if (ch == ':') {
                advance(1);
                return gatherDefinitionName(TokenType.START_DEF, "Definition");
            }
            if (ch == '@' && charAt(pos + 1) == ':') {
                advance(2);
                return gatherDefinitionName(TokenType.START_MEMO, "Memo");
            }
            switch (ch) {
                case ';':
                    advance(1);
                    return token(TokenType.END_DEF, ";");
                case '[':
                    advance(1);
                    openBrackets.push('[');
                    return token(TokenType.START_ARRAY, "[");
                case ']':
                    closeBracket('[', ']', "array");
                    advance(1);
                    return token(TokenType.END_ARRAY, "]");
                case '{':
                    advance(1);
                    openBrackets.push('{');
                    return gatherModuleName();
                case '}':
                    closeBracket('{', '}', "module");
                    advance(1);
                    return token(TokenType.END_MODULE, "}");
                default:
                    break;
            }
            if (isTripleQuote(pos)) {
                advance(3);
                return gatherTripleQuoted(ch);
            }
            if (isQuote(ch)) {
                advance(1);
                return gatherQuoted(ch);
            }
            if (ch == '.') {
                return gatherDotSymbol();
            }
            return gatherWord();
        }
        markTokenStart();
        if (!openBrackets.isEmpty()) {
            throw error("Unclosed '" + openBrackets.peek() + "' at end of input");
        }
        return token(TokenType.EOS, "");
    }

    private void closeBracket(char open, char close, String kind) {
        if (openBrackets.isEmpty()) {
            throw error("Unmatched '" + close + "' with no open " + kind);
        }
        char innermost = openBrackets.peek();
        if (innermost != open) {
            throw error("Unexpected '" + close + "' while '" + innermost + "' is still open");
        }
        openBrackets.pop();
    }

    private Token gatherComment() {
        markTokenStart();
        StringBuilder text = new StringBuilder();
        while (pos < input.length() && input.charAt(pos) != '\n') {
            text.append(input.charAt(pos));
            advance(1);
        }
        return token(TokenType.COMMENT, text.toString());
    }

    private Token gatherDefinitionName(TokenType type, String kind) {
        while (pos < input.length() && isWhitespace(input.charAt(pos))) {
            advance(1);
        }
        if (pos >= input.length()) {
            throw error("Got end of input after '" + (type == TokenType.START_MEMO ? "@:" : ":") + "'");
        }
        markTokenStart();
        StringBuilder name = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            advance(1);
            if (isWhitespace(ch)) {
                break;
            }
            if (isQuote(ch)) {
                throw error(kind + " names can't have quotes in them");
            }
            if (NAME_BRACKETS.indexOf(ch) >= 0) {
                throw error(kind + " names can't have '" + ch + "' in them");
            }
            name.append(ch);
        }
        return token(type, name.toString());
    }

    private Token gatherModuleName() {
        markTokenStart();
        StringBuilder name = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            if (ch == '}') {
                break;
            }
            advance(1);
            if (isWhitespace(ch)) {
                break;
            }
            name.append(ch);
        }
        return token(TokenType.START_MODULE, name.toString());
    }

    private Token gatherTripleQuoted(char delimiter) {
        markTokenStart();
        StringBuilder text = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            if (ch == delimiter && isTripleQuote(pos)) {
                // Four or more delimiters in a row: the extras belong to the string.
                if (charAt(pos + 3) == delimiter) {
                    text.append(ch);
                    advance(1);
                    continue;
                }
                advance(3);
                return token(TokenType.STRING, text.toString());
            }
            text.append(ch);
            advance(1);
        }
        throw error("Unterminated string");
    }

    private Token gatherQuoted(char delimiter) {
        markTokenStart();
        StringBuilder text = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            advance(1);
            if (ch == delimiter) {
                return token(TokenType.STRING, text.toString());
            }
            text.append(ch);
        }
        throw error("Unterminated string");
    }

    private Token gatherWord() {
        return token(TokenType.WORD, gatherBareText());
    }

    private Token gatherDotSymbol() {
        String text = gatherBareText();
        if (text.length() < 2) {
            return token(TokenType.WORD, text);
        }
        return token(TokenType.DOT_SYMBOL, text.substring(1));
    }

    private String gatherBareText() {
        StringBuilder text = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            if (WORD_TERMINATORS.indexOf(ch) >= 0) {
                break;
            }
            advance(1);
            if (isWhitespace(ch)) {
                break;
            }
            text.append(ch);
        }
        return text.toString();
    }

    private static String quote(String text) {
        if (text.indexOf('\n') < 0) {
            for (char delimiter : QUOTES.toCharArray()) {
                if (text.indexOf(delimiter) < 0) {
                    return delimiter + text + delimiter;
                }
            }
        }
        for (char delimiter : QUOTES.toCharArray()) {
            String triple = String.valueOf(delimiter).repeat(3);
            if (!text.contains(triple) && !text.endsWith(String.valueOf(delimiter))) {
                return triple + text + triple;
            }
        }
        throw new IllegalArgumentException("String cannot be rendered with any quote style: " + text);
    }

    private static String unescape(String source) {
        return source.replace("&lt;", "<").replace("&gt;", ">");
    }

    private boolean isWhitespace(char ch) {
        return WHITESPACE.indexOf(ch) >= 0;
    }

    private boolean isQuote(char ch) {
        return QUOTES.indexOf(ch) >= 0;
    }

    private boolean isTripleQuote(int index) {
        char ch = charAt(index);
        return isQuote(ch) && charAt(index + 1) == ch && charAt(index + 2) == ch;
    }

    private char charAt(int index) {
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private void advance(int count) {
        for (int i = 0; i < count && pos < input.length(); i++) {
            if (input.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    private void markTokenStart() {
        tokenStart = pos + reference.startPos();
        tokenLine = line;
        tokenColumn = column;
    }

    private Token token(TokenType type, String text) {
        return new Token(type, text, location(text.length()));
    }

    private CodeLocation location(int length) {
        return new CodeLocation(reference.source(), tokenLine, tokenColumn, tokenStart, tokenStart + length);
    }

    private TokenizeException error(String message) {
        return new TokenizeException(message, input, location(0));
    }
}
