package org.dxworks.mathframe.parser.ast;

public enum LatexNodeType {
    CHAR,
    DIGIT,
    SYMBOL,
    SPACE,
    GROUP,
    SCRIPT_MARKER,
    SCRIPT,
    COMMAND,
    NAMED_OPERATOR,
    UNKNOWN_COMMAND,
    TEXT,
    BRACKET,
    MATRIX
}
