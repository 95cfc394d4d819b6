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

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical LaTeX output. Parsing the result yields the same tree.
 * <ul>
 *     <li>scripts whose content is a single character are written without braces</li>
 *     <li>large operator limits are always braced and omitted when empty</li>
 *     <li>a space separates a control word from a following letter</li>
 * </ul>
 */
public final class LatexSerializer implements NodeVisitor<String> {

    private static final LatexSerializer INSTANCE = new LatexSerializer();

    private LatexSerializer() {
    }

    public static String serialize(MathNode node) {
        return node.accept(INSTANCE);
    }

    public static String serializeBlock(Block block) {
        List<String> chunks = new ArrayList<>();
        for (MathNode child : block.children()) {
            chunks.add(child.accept(INSTANCE));
        }
        return join(chunks);
    }

    public static String serializeNodes(List<MathNode> nodes) {
        List<String> chunks = new ArrayList<>(nodes.size());
        for (MathNode node : nodes) {
            chunks.add(node.accept(INSTANCE));
        }
        return join(chunks);
    }

    /**
     * Concatenates chunks, inserting a space where a control word would otherwise run
     * into a following letter ({@code \leq b}, not {@code \leqb}).
     */
    static String join(List<String> chunks) {
        StringBuilder sb = new StringBuilder();
        for (String chunk : chunks) {
            if (chunk.isEmpty()) {
                continue;
            }
            if (endsWithControlWord(sb) && isAsciiLetter(chunk.charAt(0))) {
                sb.append(' ');
            }
            sb.append(chunk);
        }
        return sb.toString();
    }

    static boolean endsWithControlWord(CharSequence text) {
        int i = text.length() - 1;
        int letters = 0;
        while (i >= 0 && isAsciiLetter(text.charAt(i))) {
            i--;
            letters++;
        }
        if (letters == 0 || i < 0 || text.charAt(i) != '\\') {
            return false;
        }
        // an even run of backslashes is a row separator followed by plain letters
        int backslashes = 0;
        while (i >= 0 && text.charAt(i) == '\\') {
            backslashes++;
            i--;
        }
        return backslashes % 2 == 1;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static String braced(Block block) {
        return "{" + serializeBlock(block) + "}";
    }

    private static String script(char marker, Block block) {
        String content = serializeBlock(block);
        if (content.length() == 1) {
            return marker + content;
        }
        return marker + "{" + content + "}";
    }

    private static String command(String command, Block... arguments) {
        StringBuilder sb = new StringBuilder(command);
        for (Block argument : arguments) {
            sb.append(braced(argument));
        }
        return sb.toString();
    }

    @Override
    public String visitSymbol(MathSymbol symbol) {
        return symbol.getLatexForm();
    }

    @Override
    public String visitVariable(Variable variable) {
        return variable.getLatexForm();
    }

    @Override
    public String visitDigit(Digit digit) {
        return digit.getLatexForm();
    }

    @Override
    public String visitBinaryOperator(BinaryOperator operator) {
        return operator.getLatexForm();
    }

    @Override
    public String visitRelation(Relation relation) {
        return relation.getLatexForm();
    }

    @Override
    public String visitPunctuation(Punctuation punctuation) {
        return punctuation.getLatexForm();
    }

    @Override
    public String visitOperatorName(OperatorName operatorName) {
        return operatorName.getLatexCommand();
    }

    @Override
    public String visitFraction(Fraction fraction) {
        return command(fraction.getCommand(), fraction.getNumerator(), fraction.getDenominator());
    }

    @Override
    public String visitSquareRoot(SquareRoot squareRoot) {
        return command("\\sqrt", squareRoot.getRadicand());
    }

    @Override
    public String visitNthRoot(NthRoot nthRoot) {
        String index = serializeBlock(nthRoot.getIndex());
        if (index.indexOf(']') >= 0) {
            index = "{" + index + "}";
        }
        return "\\sqrt[" + index + "]" + braced(nthRoot.getRadicand());
    }

    @Override
    public String visitSubscript(Subscript subscript) {
        return script('_', subscript.getSub());
    }

    @Override
    public String visitSuperscript(Superscript superscript) {
        return script('^', superscript.getSup());
    }

    @Override
    public String visitSupSub(SupSub supSub) {
        String sub = script('_', supSub.getSub());
        String sup = script('^', supSub.getSup());
        return supSub.isSubscriptFirst() ? sub + sup : sup + sub;
    }

    @Override
    public String visitBracket(Bracket bracket) {
        List<String> chunks = new ArrayList<>();
        chunks.add("\\left" + bracket.getType().getOpenLatex());
        chunks.add(serializeBlock(bracket.getContent()));
        chunks.add("\\right" + bracket.getType().getCloseLatex());
        return join(chunks);
    }

    @Override
    public String visitAccent(Accent accent) {
        return command(accent.getLatexCommand(), accent.getContent());
    }

    @Override
    public String visitTextStyleSpan(TextStyleSpan span) {
        if (!span.isRawText()) {
            return command(span.getLatexCommand(), span.getContent());
        }
        StringBuilder sb = new StringBuilder(span.getLatexCommand()).append('{');
        for (MathNode child : span.getContent().children()) {
            if (child instanceof MathSymbol) {
                sb.append(((MathSymbol) child).getGlyph());
            } else {
                sb.append(serialize(child));
            }
        }
        return sb.append('}').toString();
    }

    @Override
    public String visitLargeOperator(LargeOperator operator) {
        StringBuilder sb = new StringBuilder(operator.getLatexCommand());
        if (!operator.getLower().isEmpty()) {
            sb.append("_").append(braced(operator.getLower()));
        }
        if (!operator.getUpper().isEmpty()) {
            sb.append("^").append(braced(operator.getUpper()));
        }
        return sb.toString();
    }

    @Override
    public String visitLimit(Limit limit) {
        if (limit.getLower().isEmpty()) {
            return limit.getLatexCommand();
        }
        return limit.getLatexCommand() + "_" + braced(limit.getLower());
    }

    @Override
    public String visitMatrix(Matrix matrix) {
        String environment = matrix.getType().getEnvironment();
        StringBuilder sb = new StringBuilder("\\begin{").append(environment).append('}');
        for (int r = 0; r < matrix.getRows(); r++) {
            if (r > 0) {
                sb.append(" \\\\ ");
            }
            for (int c = 0; c < matrix.getColumns(); c++) {
                if (c > 0) {
                    sb.append(" & ");
                }
                sb.append(serializeMatrixCell(matrix, r, c));
            }
        }
        return sb.append("\\end{").append(environment).append('}').toString();
    }

    // A lone blank cell after the last "\\" reads back as a trailing row break, so it is braced.
    private String serializeMatrixCell(Matrix matrix, int row, int column) {
        Block cell = matrix.getCell(row, column);
        if (cell.isEmpty() && row > 0 && row == matrix.getRows() - 1 && matrix.getColumns() == 1) {
            return "{}";
        }
        return serializeBlock(cell);
    }

    @Override
    public String visitBinomial(BinomialCoefficient binomial) {
        return command("\\binom", binomial.getNumerator(), binomial.getDenominator());
    }
}
