package org.dxworks.mathframe.report;

import java.util.ArrayList;
import java.util.List;

public class FormulaNodeInfo {
    public int id;
    public String kind;
    public String latex;
    public String glyph; // leaves only
    public List<List<FormulaNodeInfo>> blocks; // composites only, in reading order

    public FormulaNodeInfo(int id, String kind, String latex) {
        this.id = id;
        this.kind = kind;
        this.latex = latex;
    }

    public void addBlock(List<FormulaNodeInfo> content) {
        if (blocks == null) {
            blocks = new ArrayList<>();
        }
        blocks.add(content);
    }
}
