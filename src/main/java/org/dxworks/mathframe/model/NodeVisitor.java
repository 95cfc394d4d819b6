package org.dxworks.mathframe.model;

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

/**
 * One method per concrete node class, so every output format has to handle every kind.
 */
public interface NodeVisitor<R> {

    R visitSymbol(MathSymbol symbol);

    R visitVariable(Variable variable);

    R visitDigit(Digit digit);

    R visitBinaryOperator(BinaryOperator operator);

    R visitRelation(Relation relation);

    R visitPunctuation(Punctuation punctuation);

    R visitOperatorName(OperatorName operatorName);

    R visitFraction(Fraction fraction);

    R visitSquareRoot(SquareRoot squareRoot);

    R visitNthRoot(NthRoot nthRoot);

    R visitSubscript(Subscript subscript);

    R visitSuperscript(Superscript superscript);

    R visitSupSub(SupSub supSub);

    R visitBracket(Bracket bracket);

    R visitAccent(Accent accent);

    R visitTextStyleSpan(TextStyleSpan span);

    R visitLargeOperator(LargeOperator operator);

    R visitLimit(Limit limit);

    R visitMatrix(Matrix matrix);

    R visitBinomial(BinomialCoefficient binomial);
}
