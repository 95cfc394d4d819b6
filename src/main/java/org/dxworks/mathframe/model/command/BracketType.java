package org.dxworks.mathframe.model.command;

import java.util.Optional;

public enum BracketType {
    PARENTHESES("(", ")", "(", ")"),
    SQUARE("[", "]", "[", "]"),
    CURLY("{", "}", "\\{", "\\}"),
    ABSOLUTE("|", "|", "|", "|"),
    NORM("‖", "‖", "\\|", "\\|"),
    ANGLE("⟨", "⟩", "\\langle", "\\rangle");

    private final String open;
    private final String close;
    private final String openLatex;
    private final String closeLatex;

    BracketType(String open, String close, String openLatex, String closeLatex) {
        this.open = open;
        this.close = close;
        this.openLatex = openLatex;
        this.closeLatex = closeLatex;
    }

    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    public String getOpenLatex() {
        return openLatex;
    }

    public String getCloseLatex() {
        return closeLatex;
    }

    public static Optional<BracketType> fromOpenLatex(String delimiter) {
        for (BracketType type : values()) {
            if (type.openLatex.equals(delimiter)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<BracketType> fromCloseLatex(String delimiter) {
        for (BracketType type : values()) {
            if (type.closeLatex.equals(delimiter)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<BracketType> fromOpenChar(char c) {
        switch (c) {
            case '(':
                return Optional.of(PARENTHESES);
            case '[':
                return Optional.of(SQUARE);
            case '{':
                return Optional.of(CURLY);
            case '|':
                return Optional.of(ABSOLUTE);
            default:
                return Optional.empty();
        }
    }
}
