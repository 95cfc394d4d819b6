package org.dxworks.mathframe.model;

public enum NodeKind {
    SYMBOL("symbol", false),
    VARIABLE("variable", false),
    DIGIT("digit", false),
    BINARY_OPERATOR("binary_operator", false),
    RELATION("relation", false),
    PUNCTUATION("punctuation", false),
    OPERATOR_NAME("operator_name", false),
    FRACTION("fraction", true),
    SQUARE_ROOT("square_root", true),
    NTH_ROOT("nth_root", true),
    SUBSCRIPT("subscript", true),
    SUPERSCRIPT("superscript", true),
    SUPSUB("supsub", true),
    BRACKET("bracket", true),
    ACCENT("accent", true),
    TEXT_STYLE("text_style", true),
    LARGE_OPERATOR("large_operator", true),
    LIMIT("limit", true),
    MATRIX("matrix", true),
    BINOMIAL("binomial", true);

    private final String name;
    private final boolean composite;

    NodeKind(String name, boolean composite) {
        this.name = name;
        this.composite = composite;
    }

    public String getName() {
        return name;
    }

    public boolean isComposite() {
        return composite;
    }
}
