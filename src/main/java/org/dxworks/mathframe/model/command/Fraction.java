package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

public class Fraction extends CompositeNode {

    public static final String DEFAULT_COMMAND = "\\frac";

    private final String command;
    private final Block numerator;
    private final Block denominator;

    public Fraction(NodeIdGenerator ids) {
        this(ids, DEFAULT_COMMAND);
    }

    public Fraction(NodeIdGenerator ids, String command) {
        super(ids);
        this.command = command;
        this.numerator = new Block(ids, this);
        this.denominator = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FRACTION;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFraction(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(numerator, denominator);
    }

    @Override
    public boolean isVerticalStack() {
        return true;
    }

    @Override
    protected Block upperBlock() {
        return numerator;
    }

    @Override
    protected Block lowerBlock() {
        return denominator;
    }

    public String getCommand() {
        return command;
    }

    public Block getNumerator() {
        return numerator;
    }

    public Block getDenominator() {
        return denominator;
    }
}
