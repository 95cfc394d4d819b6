package org.dxworks.mathframe.parser;

/**
 * LaTeX input that could not be parsed completely. {@code position} is the zero-based
 * offset in the input where parsing stopped.
 */
public class LatexParseException extends Exception {

    private final int position;
    private final String expected;

    public LatexParseException(int position, String expected) {
        super("Expected " + expected + " at position " + position);
        this.position = position;
        this.expected = expected;
    }

    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }
}
