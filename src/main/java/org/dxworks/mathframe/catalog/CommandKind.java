package org.dxworks.mathframe.catalog;

/**
 * What a backslash command produces, and how many arguments the parser reads for it.
 * Optional arguments are bracketed and read before the required ones.
 */
public enum CommandKind {
    SYMBOL(0, 0),
    OPERATOR_NAME(0, 0),
    LARGE_OPERATOR(0, 0),
    LIMIT(0, 0),
    FRACTION(2, 0),
    SQUARE_ROOT(1, 1),
    BINOMIAL(2, 0),
    ACCENT(1, 0),
    TEXT_STYLE(1, 0);

    private final int requiredArgs;
    private final int optionalArgs;

    CommandKind(int requiredArgs, int optionalArgs) {
        this.requiredArgs = requiredArgs;
        this.optionalArgs = optionalArgs;
    }

    public int getRequiredArgs() {
        return requiredArgs;
    }

    public int getOptionalArgs() {
        return optionalArgs;
    }

    /**
     * True for commands that can take limits through {@code _} and {@code ^}.
     */
    public boolean takesLimits() {
        return this == LARGE_OPERATOR || this == LIMIT;
    }
}
