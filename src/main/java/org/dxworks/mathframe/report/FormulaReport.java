package org.dxworks.mathframe.report;

/**
 * Marker interface for records written to the JSONL output, one per formula line.
 */
public interface FormulaReport {
    String getFilePath();
    int getLine();
}
