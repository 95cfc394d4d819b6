package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * {@code \binom{n}{k}}, laid out like a fraction without a bar inside parentheses.
 */
public class BinomialCoefficient extends CompositeNode {

    private final Block numerator;
    private final Block denominator;

    public BinomialCoefficient(NodeIdGenerator ids) {
        super(ids);
        this.numerator = new Block(ids, this);
        this.denominator = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINOMIAL;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinomial(this);
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

    public Block getNumerator() {
        return numerator;
    }

    public Block getDenominator() {
        return denominator;
    }
}
