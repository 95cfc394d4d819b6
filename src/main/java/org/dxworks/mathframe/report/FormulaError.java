package org.dxworks.mathframe.report;

public class FormulaError implements FormulaReport {
    public String kind = "error";
    public String filePath;
    public int line;
    public String input;
    public Integer position; // set for parse errors
    public String expected;
    public String error;

    public FormulaError(String filePath, int line, String input, String error) {
        this.filePath = filePath;
        this.line = line;
        this.input = input;
        this.error = error;
    }

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public int getLine() {
        return line;
    }
}
