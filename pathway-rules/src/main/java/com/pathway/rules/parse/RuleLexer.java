package com.pathway.rules.parse;

import com.pathway.rules.RuleSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a rule expression into tokens.
 * <p>
 * Paths are dotted identifiers with optional bracket segments glued to them ({@code responses['intro'].age},
 * {@code scores[phq9]}); a {@code [} preceded by whitespace or an operator opens a list literal instead.
 * Identifiers may contain {@code -} after the first character so hyphenated stage ids work.
 * Keywords are case-insensitive: {@code and or not in not_in contains true false null none}.
 */
public final class RuleLexer {

    private final String input;
    private int pos;

    public RuleLexer(String input) {
        this.input = input != null ? input : "";
    }

    /**
     * Segments of a text that is exactly one variable path, split the way rule expressions split paths.
     *
     * @throws RuleSyntaxException when the text is empty or is anything other than a single path
     */
    public static List<String> pathSegments(String text) {
        List<Token> tokens = new RuleLexer(text).tokenize();
        if (tokens.size() != 2 || tokens.get(0).getType() != TokenType.PATH) {
            throw new RuleSyntaxException("Not a variable path", text, 0);
        }
        return tokens.get(0).getSegments();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = input.charAt(pos);
        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", null, start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", null, start);
            case '[':
                pos++;
                return new Token(TokenType.LBRACKET, "[", null, start);
            case ']':
                pos++;
                return new Token(TokenType.RBRACKET, "]", null, start);
            case ',':
                pos++;
                return new Token(TokenType.COMMA, ",", null, start);
            case '\'':
            case '"':
                return new Token(TokenType.STRING, readQuoted(c), null, start);
            case '&':
                expectPair('&');
                return new Token(TokenType.AND, "&&", null, start);
            case '|':
                expectPair('|');
                return new Token(TokenType.OR, "||", null, start);
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARATOR, "!=", null, start);
                }
                pos++;
                return new Token(TokenType.NOT, "!", null, start);
            case '=':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARATOR, "==", null, start);
                }
                throw new RuleSyntaxException("Single '=' is not an operator, use '=='", input, start);
            case '<':
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARATOR, c + "=", null, start);
                }
                pos++;
                return new Token(TokenType.COMPARATOR, String.valueOf(c), null, start);
            default:
                break;
        }
        if (Character.isDigit(c) || (c == '-' || c == '.') && Character.isDigit(peek(1))) {
            return new Token(TokenType.NUMBER, readNumber(), null, start);
        }
        if (isIdentStart(c)) {
            return readWordOrPath(start);
        }
        throw new RuleSyntaxException("Unexpected character '" + c + "'", input, start);
    }

    private Token readWordOrPath(int start) {
        List<String> segments = new ArrayList<>();
        segments.add(readIdent());
        TokenType leadingKeyword = keyword(segments.get(0));
        if (leadingKeyword != null) {
            return new Token(leadingKeyword, segments.get(0), null, start);
        }
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '.' && pos + 1 < input.length() && isIdentPart(input.charAt(pos + 1))) {
                pos++;
                segments.add(readIdent());
            } else if (c == '[') {
                pos++;
                skipWhitespace();
                if (pos >= input.length()) throw new RuleSyntaxException("Unclosed '['", input, start);
                char q = input.charAt(pos);
                String segment;
                if (q == '\'' || q == '"') {
                    segment = readQuoted(q);
                } else {
                    int segStart = pos;
                    while (pos < input.length() && input.charAt(pos) != ']') pos++;
                    segment = input.substring(segStart, pos).trim();
                }
                skipWhitespace();
                if (pos >= input.length() || input.charAt(pos) != ']') {
                    throw new RuleSyntaxException("Unclosed '['", input, start);
                }
                pos++;
                if (segment.isEmpty()) throw new RuleSyntaxException("Empty path index", input, start);
                segments.add(segment);
            } else {
                break;
            }
        }
        return new Token(TokenType.PATH, input.substring(start, pos), segments, start);
    }

    private static TokenType keyword(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "and":
                return TokenType.AND;
            case "or":
                return TokenType.OR;
            case "not":
                return TokenType.NOT;
            case "in":
                return TokenType.IN;
            case "not_in":
                return TokenType.NOT_IN;
            case "contains":
                return TokenType.CONTAINS;
            case "true":
                return TokenType.TRUE;
            case "false":
                return TokenType.FALSE;
            case "null":
            case "none":
                return TokenType.NULL;
            default:
                return null;
        }
    }

    private String readIdent() {
        int start = pos;
        if (pos >= input.length() || !isIdentStart(input.charAt(pos))) {
            throw new RuleSyntaxException("Identifier expected", input, pos);
        }
        pos++;
        while (pos < input.length() && isIdentPart(input.charAt(pos))) pos++;
        return input.substring(start, pos);
    }

    private String readNumber() {
        int start = pos;
        if (input.charAt(pos) == '-') pos++;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) pos++;
        String text = input.substring(start, pos);
        if (text.indexOf('.') != text.lastIndexOf('.')) {
            throw new RuleSyntaxException("Malformed number '" + text + "'", input, start);
        }
        return text;
    }

    private String readQuoted(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == '\\' && pos < input.length()) {
                sb.append(input.charAt(pos++));
            } else if (c == quote) {
                return sb.toString();
            } else {
                sb.append(c);
            }
        }
        throw new RuleSyntaxException("Unterminated string", input, start);
    }

    private void expectPair(char c) {
        if (peek(1) != c) {
            throw new RuleSyntaxException("Expected '" + c + c + "'", input, pos);
        }
        pos += 2;
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) pos++;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '$';
    }
}
