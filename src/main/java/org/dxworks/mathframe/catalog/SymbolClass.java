package org.dxworks.mathframe.catalog;

import java.util.Locale;

public enum SymbolClass {
    ORDINARY,
    OPERATOR,
    RELATION,
    PUNCTUATION,
    SPACE;

    public static SymbolClass fromYaml(String value) {
        if (value == null || value.isBlank() || value.equals("symbol")) {
            return ORDINARY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Classification of a single source character that needs no command.
     */
    public static SymbolClass ofChar(char c) {
        switch (c) {
            case '+':
            case '-':
            case '*':
                return OPERATOR;
            case '=':
            case '<':
            case '>':
                return RELATION;
            case ',':
            case ';':
            case ':':
            case '.':
                return PUNCTUATION;
            default:
                return ORDINARY;
        }
    }
}
