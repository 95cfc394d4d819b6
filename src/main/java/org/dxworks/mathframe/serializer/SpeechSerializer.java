package org.dxworks.mathframe.serializer;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NodeVisitor;
import org.dxworks.mathframe.model.command.Accent;
import org.dxworks.mathframe.model.command.BinomialCoefficient;
import org.dxworks.mathframe.model.command.Bracket;
import org.dxworks.mathframe.model.command.BracketType;
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
import java.util.Map;

/**
 * Spoken rendering for screen readers, e.g. "fraction, 1, over, 2, end fraction".
 */
public final class SpeechSerializer implements NodeVisitor<String> {

    private static final SpeechSerializer INSTANCE = new SpeechSerializer();

    private static final String BLANK = "blank";

    private static final Map<String, String> GLYPH_WORDS = Map.ofEntries(
            Map.entry("+", "plus"),
            Map.entry("−", "minus"),
            Map.entry("-", "minus"),
            Map.entry("±", "plus or minus"),
            Map.entry("∓", "minus or plus"),
            Map.entry("×", "times"),
            Map.entry("·", "times"),
            Map.entry("*", "times"),
            Map.entry("÷", "divided by"),
            Map.entry("/", "slash"),
            Map.entry("=", "equals"),
            Map.entry("<", "less than"),
            Map.entry(">", "greater than"),
            Map.entry("≤", "less than or equal to"),
            Map.entry("≥", "greater than or equal to"),
            Map.entry("≠", "not equal to"),
            Map.entry("≈", "approximately equal to"),
            Map.entry("→", "to"),
            Map.entry("∞", "infinity"),
            Map.entry("∈", "element of"),
            Map.entry(",", "comma"),
            Map.entry("!", "factorial"));

    private static final Map<String, String> OPERATOR_WORDS = Map.of(
            "sum", "summation",
            "prod", "product",
            "coprod", "coproduct",
            "int", "integral",
            "iint", "double integral",
            "iiint", "triple integral",
            "oint", "contour integral",
            "bigcup", "union",
            "bigcap", "intersection");

    private SpeechSerializer() {
    }

    public static String serialize(MathNode node) {
        return node.accept(INSTANCE);
    }

    public static String serializeBlock(Block block) {
        List<String> words = new ArrayList<>();
        for (MathNode child : block.children()) {
            String word = child.accept(INSTANCE);
            if (!word.isBlank()) {
                words.add(word);
            }
        }
        return String.join(" ", words);
    }

    private static String spoken(Block block) {
        return block.isEmpty() ? BLANK : serializeBlock(block);
    }

    private static String symbolWord(MathSymbol symbol) {
        String word = GLYPH_WORDS.get(symbol.getGlyph());
        if (word != null) {
            return word;
        }
        String command = symbol.getLatexCommand();
        if (command != null && command.length() > 2 && Character.isLetter(command.charAt(1))) {
            return command.substring(1);
        }
        return symbol.getGlyph();
    }

    private static String bracketName(BracketType type) {
        switch (type) {
            case PARENTHESES:
                return "parenthesis";
            case SQUARE:
                return "bracket";
            case CURLY:
                return "brace";
            case ABSOLUTE:
                return "absolute value";
            case NORM:
                return "norm";
            default:
                return "angle bracket";
        }
    }

    @Override
    public String visitSymbol(MathSymbol symbol) {
        return symbolWord(symbol);
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
        return symbolWord(operator);
    }

    @Override
    public String visitRelation(Relation relation) {
        return symbolWord(relation);
    }

    @Override
    public String visitPunctuation(Punctuation punctuation) {
        return symbolWord(punctuation);
    }

    @Override
    public String visitOperatorName(OperatorName operatorName) {
        return operatorName.getName();
    }

    @Override
    public String visitFraction(Fraction fraction) {
        return "fraction, " + spoken(fraction.getNumerator()) + ", over, " + spoken(fraction.getDenominator()) + ", end fraction";
    }

    @Override
    public String visitSquareRoot(SquareRoot squareRoot) {
        return "square root of, " + spoken(squareRoot.getRadicand()) + ", end square root";
    }

    @Override
    public String visitNthRoot(NthRoot nthRoot) {
        return "root index, " + spoken(nthRoot.getIndex()) + ", of, " + spoken(nthRoot.getRadicand()) + ", end root";
    }

    @Override
    public String visitSubscript(Subscript subscript) {
        return "subscript, " + spoken(subscript.getSub()) + ", end subscript";
    }

    @Override
    public String visitSuperscript(Superscript superscript) {
        return "superscript, " + spoken(superscript.getSup()) + ", end superscript";
    }

    @Override
    public String visitSupSub(SupSub supSub) {
        String sub = "subscript, " + spoken(supSub.getSub()) + ", end subscript";
        String sup = "superscript, " + spoken(supSub.getSup()) + ", end superscript";
        return supSub.isSubscriptFirst() ? sub + ", " + sup : sup + ", " + sub;
    }

    @Override
    public String visitBracket(Bracket bracket) {
        String name = bracketName(bracket.getType());
        return "left " + name + ", " + spoken(bracket.getContent()) + ", right " + name;
    }

    @Override
    public String visitAccent(Accent accent) {
        return accent.getName() + ", " + spoken(accent.getContent());
    }

    @Override
    public String visitTextStyleSpan(TextStyleSpan span) {
        if (span.isRawText()) {
            return TextSerializer.serializeBlock(span.getContent());
        }
        return spoken(span.getContent());
    }

    @Override
    public String visitLargeOperator(LargeOperator operator) {
        StringBuilder sb = new StringBuilder(OPERATOR_WORDS.getOrDefault(operator.getName(), operator.getName()));
        if (!operator.getLower().isEmpty()) {
            sb.append(" from ").append(serializeBlock(operator.getLower()));
        }
        if (!operator.getUpper().isEmpty()) {
            sb.append(" to ").append(serializeBlock(operator.getUpper()));
        }
        return sb.toString();
    }

    @Override
    public String visitLimit(Limit limit) {
        if (limit.getLower().isEmpty()) {
            return "limit";
        }
        return "limit as " + serializeBlock(limit.getLower());
    }

    @Override
    public String visitMatrix(Matrix matrix) {
        StringBuilder sb = new StringBuilder()
                .append(matrix.getRows()).append(" by ").append(matrix.getColumns()).append(" matrix.");
        for (int r = 0; r < matrix.getRows(); r++) {
            sb.append(" Row ").append(r + 1).append(':');
            for (int c = 0; c < matrix.getColumns(); c++) {
                sb.append(c == 0 ? " " : ", ")
                        .append("Entry ").append(c + 1).append(": ")
                        .append(spoken(matrix.getCell(r, c)));
            }
            sb.append('.');
        }
        return sb.toString();
    }

    @Override
    public String visitBinomial(BinomialCoefficient binomial) {
        return "binomial coefficient, " + spoken(binomial.getNumerator()) + ", choose, " + spoken(binomial.getDenominator());
    }
}
