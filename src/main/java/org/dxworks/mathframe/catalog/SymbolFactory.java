package org.dxworks.mathframe.catalog;

import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.symbol.BinaryOperator;
import org.dxworks.mathframe.model.symbol.Digit;
import org.dxworks.mathframe.model.symbol.MathSymbol;
import org.dxworks.mathframe.model.symbol.Punctuation;
import org.dxworks.mathframe.model.symbol.Relation;
import org.dxworks.mathframe.model.symbol.Variable;

/**
 * Creates leaf nodes for characters and symbol commands.
 */
public final class SymbolFactory {

    public static final String MINUS_GLYPH = "−";

    private SymbolFactory() {
    }

    public static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Leaf for a character read from LaTeX source.
     */
    public static MathSymbol forSourceChar(NodeIdGenerator ids, char c) {
        String value = String.valueOf(c);
        if (isDigit(c)) {
            return new Digit(ids, value);
        }
        if (isLetter(c)) {
            return new Variable(ids, value);
        }
        if (c == '-') {
            return new BinaryOperator(ids, MINUS_GLYPH, "-");
        }
        switch (SymbolClass.ofChar(c)) {
            case OPERATOR:
                return new BinaryOperator(ids, value);
            case RELATION:
                return new Relation(ids, value);
            case PUNCTUATION:
                return new Punctuation(ids, value);
            default:
                return new MathSymbol(ids, value);
        }
    }

    /**
     * Leaf for a character typed by the user. Differs from source characters only where
     * the keyboard stands in for a glyph it cannot produce.
     */
    public static MathSymbol forTypedChar(NodeIdGenerator ids, char c) {
        if (c == '*') {
            return new BinaryOperator(ids, "·", "\\cdot");
        }
        return forSourceChar(ids, c);
    }

    /**
     * Literal character inside a raw-text span.
     */
    public static MathSymbol forTextChar(NodeIdGenerator ids, char c) {
        return new MathSymbol(ids, String.valueOf(c));
    }

    public static MathSymbol forDefinition(NodeIdGenerator ids, CommandDefinition definition) {
        if (definition.getKind() != CommandKind.SYMBOL) {
            throw new IllegalArgumentException("Not a symbol command: " + definition);
        }
        return create(ids, definition.getGlyph(), definition.getLatexCommand(),
                definition.getSymbolClass(), definition.getDegradesTo());
    }

    /**
     * Leaf for a classified symbol. Plain single characters go through {@link #forSourceChar}
     * so digits, letters and the minus sign get their dedicated node types.
     */
    public static MathSymbol create(NodeIdGenerator ids, String glyph, String command,
                                    SymbolClass symbolClass, String degradesTo) {
        if (command == null && glyph.length() == 1) {
            return forSourceChar(ids, glyph.charAt(0));
        }
        switch (symbolClass) {
            case OPERATOR:
                return new BinaryOperator(ids, glyph, command);
            case RELATION:
                return new Relation(ids, glyph, command, degradesTo);
            case PUNCTUATION:
                return new Punctuation(ids, glyph, command);
            default:
                return new MathSymbol(ids, glyph, command, degradesTo);
        }
    }

    /**
     * Placeholder for a command the catalog does not know. Displays its name and
     * serializes back to the original command.
     */
    public static MathSymbol forUnknownCommand(NodeIdGenerator ids, String name) {
        return new MathSymbol(ids, name, "\\" + name);
    }
}
