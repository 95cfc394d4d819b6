package org.dxworks.mathframe.catalog;

/**
 * One catalog entry. Fields that do not apply to the entry's kind are null or false.
 */
public class CommandDefinition {

    private final String name;
    private final CommandKind kind;
    private final String glyph;
    private final SymbolClass symbolClass;
    private final String degradesTo;
    private final String mark;
    private final boolean autoExit;
    private final boolean rawText;

    CommandDefinition(String name, CommandKind kind, String glyph, SymbolClass symbolClass,
                      String degradesTo, String mark, boolean autoExit, boolean rawText) {
        this.name = name;
        this.kind = kind;
        this.glyph = glyph;
        this.symbolClass = symbolClass;
        this.degradesTo = degradesTo;
        this.mark = mark;
        this.autoExit = autoExit;
        this.rawText = rawText;
    }

    public String getName() {
        return name;
    }

    public String getLatexCommand() {
        return "\\" + name;
    }

    public CommandKind getKind() {
        return kind;
    }

    public int getRequiredArgs() {
        return kind.getRequiredArgs();
    }

    public int getOptionalArgs() {
        return kind.getOptionalArgs();
    }

    public String getGlyph() {
        return glyph;
    }

    public SymbolClass getSymbolClass() {
        return symbolClass;
    }

    public String getDegradesTo() {
        return degradesTo;
    }

    public String getMark() {
        return mark;
    }

    public boolean isAutoExit() {
        return autoExit;
    }

    public boolean isRawText() {
        return rawText;
    }

    @Override
    public String toString() {
        return kind + ":" + getLatexCommand();
    }
}
