package com.pathway.rules.parse;

import java.util.List;

/**
 * Lexical token. {@code text} holds the raw text (unquoted for strings); {@code segments} is set for paths.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final List<String> segments;
    private final int position;

    Token(TokenType type, String text, List<String> segments, int position) {
        this.type = type;
        this.text = text;
        this.segments = segments != null ? List.copyOf(segments) : List.of();
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public List<String> getSegments() {
        return segments;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
