package org.dxworks.mathframe.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class FormulaAnalysis implements FormulaReport {
    public String kind = "formula";
    public String filePath;
    public int line;
    public String input;
    public String latex;
    public String text;
    public String speech;
    public int nodeCount;
    public int maxDepth;
    public Map<String, Integer> nodeKinds = new TreeMap<>();
    public List<FormulaNodeInfo> nodes = new ArrayList<>();

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public int getLine() {
        return line;
    }
}
