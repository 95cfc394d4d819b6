package org.dxworks.mathframe.serializer;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NodeVisitor;
import org.dxworks.mathframe.model.command.Accent;
import org.dxworks.mathframe.model.command.BinomialCoefficient;
import org.dxworks.mathframe.model.command.Bracket;
import org.dxworks.mathframe.model.command.Fraction;
import org.dxworks.mathframe.model.command.LargeOperator;
import org.dxworks.mathframe.model.command.Limit;
import org.dxworks.mathframe.model.command.Matrix;
import org.dxworks.mathframe.model.command.NthRoot;
import org.dxworks.mathframe.model.command.SquareRoot;
import org.dxworks.mathframe.model.command.Subscript;
import org.dxworks.mathframe.model.command.SupSub;
import org.dxworks.mathframe.model.command.Superscript;
import org.dxworks.mathframe.model.command.TextStyleSpan;
import org.dxworks.mathframe.model.symbol.BinaryOperator;
import org.dxworks.mathframe.model.symbol.Digit;
import org.dxworks.mathframe.model.symbol.MathSymbol;
import org.dxworks.mathframe.model.symbol.OperatorName;
import org.dxworks.mathframe.model.symbol.Punctuation;
import org.dxworks.mathframe.model.symbol.Relation;
import org.dxworks.mathframe.model.symbol.Variable;

import java.util.List;

/**
 * Plain-text rendering in the style of calculator input, e.g. {@code (a)/(b)} or {@code sqrt(x)}.
 * Not meant to be parsed back.
 */
public final class TextSerializer implements NodeVisitor<String> {

    private static final TextSerializer INSTANCE = new TextSerializer();

    private TextSerializer() {
    }

    public static String serialize(MathNode node) {
        return node.accept(INSTANCE);
    }

    public static String serializeBlock(Block block) {
        return serializeNodes(block.childList());
    }

    public static String serializeNodes(List<MathNode> nodes) {
        StringBuilder sb = new StringBuilder();
        MathNode previous = null;
        for (MathNode node : nodes) {
            // keep "sin x" from reading as "sinx"
            if (previous instanceof OperatorName && (node instanceof Variable || node instanceof Digit)) {
                sb.append(' ');
            }
            sb.append(node.accept(INSTANCE));
            previous = node;
        }
        return sb.toString();
    }

    private static String script(String marker, Block block) {
        String content = serializeBlock(block);
        return content.length() == 1 ? marker + content : marker + "(" + content + ")";
    }

    @Override
    public String visitSymbol(MathSymbol symbol) {
        return symbol.getGlyph();
    }

    @Override
    public String visitVariable(Variable variable) {
        return variable.getGlyph();
    }

    @Override
    public String visitDigit(Digit digit) {
        return digit.getGlyph();
    }

    @Override
    public String visitBinaryOperator(BinaryOperator operator) {
        return " " + operator.getGlyph() + " ";
    }

    @Override
    public String visitRelation(Relation relation) {
        return " " + relation.getGlyph() + " ";
    }

    @Override
    public String visitPunctuation(Punctuation punctuation) {
        return punctuation.getGlyph() + " ";
    }

    @Override
    public String visitOperatorName(OperatorName operatorName) {
        return operatorName.getDisplay();
    }

    @Override
    public String visitFraction(Fraction fraction) {
        return "(" + serializeBlock(fraction.getNumerator()) + ")/(" + serializeBlock(fraction.getDenominator()) + ")";
    }

    @Override
    public String visitSquareRoot(SquareRoot squareRoot) {
        return "sqrt(" + serializeBlock(squareRoot.getRadicand()) + ")";
    }

    @Override
    public String visitNthRoot(NthRoot nthRoot) {
        return "root(" + serializeBlock(nthRoot.getIndex()) + ")(" + serializeBlock(nthRoot.getRadicand()) + ")";
    }

    @Override
    public String visitSubscript(Subscript subscript) {
        return script("_", subscript.getSub());
    }

    @Override
    public String visitSuperscript(Superscript superscript) {
        return script("^", superscript.getSup());
    }

    @Override
    public String visitSupSub(SupSub supSub) {
        String sub = script("_", supSub.getSub());
        String sup = script("^", supSub.getSup());
        return supSub.isSubscriptFirst() ? sub + sup : sup + sub;
    }

    @Override
    public String visitBracket(Bracket bracket) {
        return bracket.getType().getOpen() + serializeBlock(bracket.getContent()) + bracket.getType().getClose();
    }

    @Override
    public String visitAccent(Accent accent) {
        return serializeBlock(accent.getContent());
    }

    @Override
    public String visitTextStyleSpan(TextStyleSpan span) {
        return serializeBlock(span.getContent());
    }

    @Override
    public String visitLargeOperator(LargeOperator operator) {
        StringBuilder sb = new StringBuilder(operator.getName());
        if (!operator.getLower().isEmpty()) {
            sb.append(script("_", operator.getLower()));
        }
        if (!operator.getUpper().isEmpty()) {
            sb.append(script("^", operator.getUpper()));
        }
        return sb.toString();
    }

    @Override
    public String visitLimit(Limit limit) {
        if (limit.getLower().isEmpty()) {
            return limit.getDisplay();
        }
        return limit.getDisplay() + script("_", limit.getLower());
    }

    @Override
    public String visitMatrix(Matrix matrix) {
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < matrix.getRows(); r++) {
            if (r > 0) {
                sb.append(", ");
            }
            sb.append('[');
            for (int c = 0; c < matrix.getColumns(); c++) {
                if (c > 0) {
                    sb.append(", ");
                }
                sb.append(serializeBlock(matrix.getCell(r, c)));
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }

    @Override
    public String visitBinomial(BinomialCoefficient binomial) {
        return "(" + serializeBlock(binomial.getNumerator()) + " choose " + serializeBlock(binomial.getDenominator()) + ")";
    }
}
