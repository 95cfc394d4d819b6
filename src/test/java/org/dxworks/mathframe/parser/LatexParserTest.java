package org.dxworks.mathframe.parser;

import org.dxworks.mathframe.catalog.CommandKind;
import org.dxworks.mathframe.model.command.BracketType;
import org.dxworks.mathframe.model.command.MatrixType;
import org.dxworks.mathframe.parser.ast.BracketNode;
import org.dxworks.mathframe.parser.ast.CharNode;
import org.dxworks.mathframe.parser.ast.CommandNode;
import org.dxworks.mathframe.parser.ast.LatexNode;
import org.dxworks.mathframe.parser.ast.LatexNodeType;
import org.dxworks.mathframe.parser.ast.MatrixNode;
import org.dxworks.mathframe.parser.ast.NamedOperatorNode;
import org.dxworks.mathframe.parser.ast.ScriptNode;
import org.dxworks.mathframe.parser.ast.SymbolNode;
import org.dxworks.mathframe.parser.ast.TextNode;
import org.dxworks.mathframe.parser.ast.UnknownCommandNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LatexParserTest {

    private final LatexParser parser = new LatexParser();

    private LatexParseException failure(String input) {
        return assertThrows(LatexParseException.class, () -> parser.parse(input));
    }

    @Test
    void emptyInputParsesToNothing() throws LatexParseException {
        assertTrue(parser.parse("").isEmpty());
    }

    @Test
    void plainCharactersAndCommands() throws LatexParseException {
        List<LatexNode> nodes = parser.parse("a\\leq b");

        assertEquals(4, nodes.size());
        assertEquals(new CharNode(0, 'a'), nodes.get(0));
        SymbolNode leq = (SymbolNode) nodes.get(1);
        assertEquals("\\leq", leq.getCommand());
        assertEquals("<", leq.getDegradesTo());
        assertEquals(LatexNodeType.SPACE, nodes.get(2).getType());
        assertEquals(new CharNode(6, 'b'), nodes.get(3));
    }

    @Test
    void fractionArgumentsMayBeSingleTokens() throws LatexParseException {
        CommandNode frac = (CommandNode) parser.parse("\\frac12").get(0);

        assertEquals(CommandKind.FRACTION, frac.getKind());
        assertEquals(1, frac.getRequiredArg(0).size());
        assertEquals(LatexNodeType.DIGIT, frac.getRequiredArg(0).get(0).getType());
        assertEquals(LatexNodeType.DIGIT, frac.getRequiredArg(1).get(0).getType());
    }

    @Test
    void sqrtWithIndexKeepsOptionalArgument() throws LatexParseException {
        CommandNode root = (CommandNode) parser.parse("\\sqrt[3]{x}").get(0);
        CommandNode plain = (CommandNode) parser.parse("\\sqrt{x}").get(0);

        assertTrue(root.hasOptionalArg());
        assertFalse(plain.hasOptionalArg());
    }

    @Test
    void scriptsRecordWrittenOrder() throws LatexParseException {
        ScriptNode subFirst = (ScriptNode) parser.parse("x_1^2").get(0);
        ScriptNode supFirst = (ScriptNode) parser.parse("x^2_1").get(0);

        assertTrue(subFirst.hasSub());
        assertTrue(subFirst.hasSup());
        assertTrue(subFirst.isSubscriptFirst());
        assertFalse(supFirst.isSubscriptFirst());
        assertEquals(List.of(new CharNode(0, 'x')), subFirst.getBase());
    }

    @Test
    void largeOperatorsAreNamedOperators() throws LatexParseException {
        ScriptNode sum = (ScriptNode) parser.parse("\\sum_{i=1}^{n}").get(0);

        NamedOperatorNode base = (NamedOperatorNode) sum.getBase().get(0);
        assertEquals(CommandKind.LARGE_OPERATOR, base.getKind());
        assertTrue(base.takesLimits());
        assertEquals(3, sum.getSub().size());
    }

    @Test
    void unknownCommandsAreKept() throws LatexParseException {
        List<LatexNode> nodes = parser.parse("\\foo+1");

        assertEquals(new UnknownCommandNode(0, "foo"), nodes.get(0));
        assertEquals(3, nodes.size());
    }

    @Test
    void rawTextIsTakenVerbatim() throws LatexParseException {
        TextNode text = (TextNode) parser.parse("\\text{if x^2 {ok}}").get(0);

        assertEquals("text", text.getName());
        assertEquals("if x^2 {ok}", text.getContent());
    }

    @Test
    void leftRightBecomesBracket() throws LatexParseException {
        BracketNode bracket = (BracketNode) parser.parse("\\left[a+b\\right]").get(0);

        assertEquals(BracketType.SQUARE, bracket.getBracketType());
        assertEquals(3, bracket.getContent().size());
    }

    @Test
    void environmentNameMayFollowWhitespace() throws LatexParseException {
        MatrixNode matrix = (MatrixNode) parser.parse("\\begin {pmatrix}a & b\\end{pmatrix}").get(0);

        assertEquals(MatrixType.PMATRIX, matrix.getMatrixType());
        assertEquals(1, matrix.getRowCount());
        assertEquals(2, matrix.getColumnCount());
    }

    @Test
    void bracedBlankLastRowIsKept() throws LatexParseException {
        MatrixNode matrix = (MatrixNode) parser.parse("\\begin{matrix}a \\\\ {}\\end{matrix}").get(0);

        assertEquals(2, matrix.getRowCount());
    }

    @Test
    void matrixDropsTrailingBlankRow() throws LatexParseException {
        MatrixNode matrix = (MatrixNode) parser.parse("\\begin{bmatrix}a & b \\\\ c & d \\\\ \\end{bmatrix}").get(0);

        assertEquals(MatrixType.BMATRIX, matrix.getMatrixType());
        assertEquals(2, matrix.getRowCount());
        assertEquals(2, matrix.getColumnCount());
    }

    @Test
    void raggedMatrixRowsAreAccepted() throws LatexParseException {
        MatrixNode matrix = (MatrixNode) parser.parse("\\begin{matrix}a & b \\\\ c\\end{matrix}").get(0);

        assertEquals(2, matrix.getColumnCount());
        assertEquals(1, matrix.getRows().get(1).size());
    }

    @Test
    void missingFractionArgumentFailsAtEndOfInput() {
        LatexParseException error = failure("\\frac{a}");

        assertEquals(8, error.getPosition());
        assertEquals("an argument for \\frac", error.getExpected());
        assertEquals("Expected an argument for \\frac at position 8", error.getMessage());
    }

    @Test
    void danglingScriptFailsAfterMarker() {
        LatexParseException error = failure("x^");

        assertEquals(2, error.getPosition());
        assertEquals("an argument after '^'", error.getExpected());
    }

    @Test
    void doubledScriptMarkerFails() {
        LatexParseException error = failure("x_^2");

        assertEquals(2, error.getPosition());
        assertEquals("an argument after '_'", error.getExpected());
    }

    @Test
    void unbalancedClosingBraceFails() {
        LatexParseException error = failure("a}");

        assertEquals(1, error.getPosition());
        assertEquals("end of input", error.getExpected());
    }

    @Test
    void unclosedGroupFails() {
        LatexParseException error = failure("{a");

        assertEquals(2, error.getPosition());
        assertEquals("'}'", error.getExpected());
    }

    @Test
    void reservedCharactersFail() {
        LatexParseException error = failure("a#b");

        assertEquals(1, error.getPosition());
        assertEquals("a formula character", error.getExpected());
        assertEquals(0, failure("$x").getPosition());
    }

    @Test
    void leftWithoutRightFails() {
        LatexParseException error = failure("\\left(x");

        assertEquals(7, error.getPosition());
        assertEquals("\\right", error.getExpected());
    }

    @Test
    void mismatchedRightDelimiterFails() {
        LatexParseException error = failure("\\left(x\\right]");

        assertEquals(13, error.getPosition());
        assertEquals("')' after \\right", error.getExpected());
    }

    @Test
    void strayRightFails() {
        LatexParseException error = failure("x\\right)");

        assertEquals(1, error.getPosition());
        assertEquals("\\left before \\right", error.getExpected());
    }

    @Test
    void unknownEnvironmentFails() {
        LatexParseException error = failure("\\begin{foo}x\\end{foo}");

        assertEquals(7, error.getPosition());
        assertEquals("a matrix environment", error.getExpected());
    }

    @Test
    void loneBackslashFails() {
        LatexParseException error = failure("x\\");

        assertEquals(2, error.getPosition());
        assertEquals("a command name after '\\'", error.getExpected());
    }

    @Test
    void rawTextNeedsBraces() {
        LatexParseException error = failure("\\text x");

        assertEquals(6, error.getPosition());
        assertEquals("'{' after \\text", error.getExpected());
    }
}
