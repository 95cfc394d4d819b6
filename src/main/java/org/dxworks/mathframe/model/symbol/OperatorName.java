package org.dxworks.mathframe.model.symbol;

import org.dxworks.mathframe.model.Leaf;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

/**
 * Upright named function such as {@code \sin} or {@code \log}.
 */
public class OperatorName extends Leaf {

    private final String name;
    private final String display;

    public OperatorName(NodeIdGenerator ids, String name, String display) {
        super(ids);
        this.name = name;
        this.display = display != null ? display : name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OPERATOR_NAME;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOperatorName(this);
    }

    public String getName() {
        return name;
    }

    public String getDisplay() {
        return display;
    }

    public String getLatexCommand() {
        return "\\" + name;
    }
}
