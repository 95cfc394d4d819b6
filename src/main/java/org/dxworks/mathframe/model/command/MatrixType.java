package org.dxworks.mathframe.model.command;

import java.util.Optional;

/**
 * Matrix environments and the delimiters drawn around them.
 */
public enum MatrixType {
    MATRIX("matrix", "", ""),
    PMATRIX("pmatrix", "(", ")"),
    BMATRIX("bmatrix", "[", "]"),
    BRACE_MATRIX("Bmatrix", "{", "}"),
    VMATRIX("vmatrix", "|", "|"),
    NORM_MATRIX("Vmatrix", "‖", "‖");

    private final String environment;
    private final String open;
    private final String close;

    MatrixType(String environment, String open, String close) {
        this.environment = environment;
        this.open = open;
        this.close = close;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    public static Optional<MatrixType> fromEnvironment(String environment) {
        for (MatrixType type : values()) {
            if (type.environment.equals(environment)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
