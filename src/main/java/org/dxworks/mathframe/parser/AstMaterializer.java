package org.dxworks.mathframe.parser;

import org.dxworks.mathframe.catalog.CommandCatalog;
import org.dxworks.mathframe.catalog.CommandDefinition;
import org.dxworks.mathframe.catalog.CommandKind;
import org.dxworks.mathframe.catalog.SymbolFactory;
import org.dxworks.mathframe.cursor.Cursor;
import org.dxworks.mathframe.cursor.CursorPosition;
import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
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
import org.dxworks.mathframe.model.symbol.OperatorName;
import org.dxworks.mathframe.parser.ast.BracketNode;
import org.dxworks.mathframe.parser.ast.CharNode;
import org.dxworks.mathframe.parser.ast.CommandNode;
import org.dxworks.mathframe.parser.ast.DigitNode;
import org.dxworks.mathframe.parser.ast.LatexAst;
import org.dxworks.mathframe.parser.ast.LatexNode;
import org.dxworks.mathframe.parser.ast.MatrixNode;
import org.dxworks.mathframe.parser.ast.NamedOperatorNode;
import org.dxworks.mathframe.parser.ast.ScriptNode;
import org.dxworks.mathframe.parser.ast.SymbolNode;
import org.dxworks.mathframe.parser.ast.TextNode;
import org.dxworks.mathframe.parser.ast.UnknownCommandNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns parsed nodes into formula tree nodes, inserting them at a cursor.
 * Inner blocks are filled by moving the same cursor into them and back out, so the
 * caller's position is unchanged apart from advancing past what was inserted.
 */
public class AstMaterializer {

    private static final Logger log = LoggerFactory.getLogger(AstMaterializer.class);

    private final CommandCatalog catalog;
    private final NodeIdGenerator ids;
    private final boolean wrapUnknownCommands;

    public AstMaterializer(CommandCatalog catalog, NodeIdGenerator ids) {
        this(catalog, ids, false);
    }

    /**
     * @param wrapUnknownCommands put unknown commands inside a {@code \text} span instead of
     *                            keeping them as bare opaque symbols
     */
    public AstMaterializer(CommandCatalog catalog, NodeIdGenerator ids, boolean wrapUnknownCommands) {
        this.catalog = catalog;
        this.ids = ids;
        this.wrapUnknownCommands = wrapUnknownCommands;
    }

    public void materialize(List<LatexNode> nodes, Cursor cursor) {
        for (LatexNode node : LatexAst.normalize(nodes)) {
            insertNode(node, cursor);
        }
    }

    private void insertNode(LatexNode node, Cursor cursor) {
        switch (node.getType()) {
            case CHAR:
                insert(cursor, SymbolFactory.forSourceChar(ids, ((CharNode) node).getValue()));
                break;
            case DIGIT:
                insert(cursor, SymbolFactory.forSourceChar(ids, ((DigitNode) node).getValue()));
                break;
            case SYMBOL: {
                SymbolNode symbol = (SymbolNode) node;
                insert(cursor, SymbolFactory.create(ids, symbol.getGlyph(), symbol.getCommand(),
                        symbol.getSymbolClass(), symbol.getDegradesTo()));
                break;
            }
            case UNKNOWN_COMMAND: {
                String name = ((UnknownCommandNode) node).getName();
                log.debug("Keeping unknown command {} as an opaque token", "\\" + name);
                if (wrapUnknownCommands) {
                    insertText(new TextNode(node.getPosition(), "text", "\\" + name), cursor);
                } else {
                    insert(cursor, SymbolFactory.forUnknownCommand(ids, name));
                }
                break;
            }
            case NAMED_OPERATOR:
                insert(cursor, createNamedOperator((NamedOperatorNode) node));
                break;
            case SCRIPT:
                insertScript((ScriptNode) node, cursor);
                break;
            case COMMAND:
                insertCommand((CommandNode) node, cursor);
                break;
            case TEXT:
                insertText((TextNode) node, cursor);
                break;
            case BRACKET: {
                BracketNode bracketNode = (BracketNode) node;
                Bracket bracket = new Bracket(ids, bracketNode.getBracketType());
                insert(cursor, bracket);
                fill(bracket.getContent(), bracketNode.getContent(), cursor);
                break;
            }
            case MATRIX:
                insertMatrix((MatrixNode) node, cursor);
                break;
            default:
                // spaces and groups never survive normalization
                throw new IllegalStateException("Unexpected node after normalization: " + node.getType());
        }
    }

    private MathNode createNamedOperator(NamedOperatorNode node) {
        switch (node.getKind()) {
            case LARGE_OPERATOR:
                return new LargeOperator(ids, node.getName(), node.getGlyph());
            case LIMIT:
                return new Limit(ids, node.getName(), node.getGlyph());
            default:
                return new OperatorName(ids, node.getName(), node.getGlyph());
        }
    }

    private void insertScript(ScriptNode script, Cursor cursor) {
        if (!script.getBase().isEmpty()) {
            // normalization only leaves a base on large operators and limits
            NamedOperatorNode base = (NamedOperatorNode) script.getBase().get(0);
            if (base.getKind() == CommandKind.LIMIT) {
                Limit limit = new Limit(ids, base.getName(), base.getGlyph());
                insert(cursor, limit);
                fill(limit.getLower(), script.getSub(), cursor);
            } else {
                LargeOperator operator = new LargeOperator(ids, base.getName(), base.getGlyph());
                insert(cursor, operator);
                fill(operator.getLower(), script.getSub(), cursor);
                fill(operator.getUpper(), script.getSup(), cursor);
            }
            return;
        }
        if (script.hasSub() && script.hasSup()) {
            SupSub supSub = new SupSub(ids, script.isSubscriptFirst());
            insert(cursor, supSub);
            fill(supSub.getSub(), script.getSub(), cursor);
            fill(supSub.getSup(), script.getSup(), cursor);
        } else if (script.hasSub()) {
            Subscript subscript = new Subscript(ids);
            insert(cursor, subscript);
            fill(subscript.getSub(), script.getSub(), cursor);
        } else {
            Superscript superscript = new Superscript(ids);
            insert(cursor, superscript);
            fill(superscript.getSup(), script.getSup(), cursor);
        }
    }

    private void insertCommand(CommandNode command, Cursor cursor) {
        switch (command.getKind()) {
            case FRACTION: {
                Fraction fraction = new Fraction(ids, "\\" + command.getName());
                insert(cursor, fraction);
                fill(fraction.getNumerator(), command.getRequiredArg(0), cursor);
                fill(fraction.getDenominator(), command.getRequiredArg(1), cursor);
                break;
            }
            case BINOMIAL: {
                BinomialCoefficient binomial = new BinomialCoefficient(ids);
                insert(cursor, binomial);
                fill(binomial.getNumerator(), command.getRequiredArg(0), cursor);
                fill(binomial.getDenominator(), command.getRequiredArg(1), cursor);
                break;
            }
            case SQUARE_ROOT:
                if (command.hasOptionalArg()) {
                    NthRoot root = new NthRoot(ids);
                    insert(cursor, root);
                    fill(root.getIndex(), command.getOptionalArgs().get(0), cursor);
                    fill(root.getRadicand(), command.getRequiredArg(0), cursor);
                } else {
                    SquareRoot root = new SquareRoot(ids);
                    insert(cursor, root);
                    fill(root.getRadicand(), command.getRequiredArg(0), cursor);
                }
                break;
            case ACCENT: {
                CommandDefinition definition = definition(command);
                Accent accent = new Accent(ids, command.getName(), definition.getMark());
                insert(cursor, accent);
                fill(accent.getContent(), command.getRequiredArg(0), cursor);
                break;
            }
            case TEXT_STYLE: {
                CommandDefinition definition = definition(command);
                TextStyleSpan span = new TextStyleSpan(ids, command.getName(), definition.isAutoExit(), false);
                insert(cursor, span);
                fill(span.getContent(), command.getRequiredArg(0), cursor);
                break;
            }
            default:
                throw new IllegalStateException("Command \\" + command.getName() + " of kind " + command.getKind() + " takes no arguments");
        }
    }

    private CommandDefinition definition(CommandNode command) {
        return catalog.lookup(command.getName())
                .orElseThrow(() -> new IllegalStateException("Command \\" + command.getName() + " is not in the catalog"));
    }

    private void insertText(TextNode text, Cursor cursor) {
        boolean autoExit = catalog.lookup(text.getName()).map(CommandDefinition::isAutoExit).orElse(false);
        TextStyleSpan span = new TextStyleSpan(ids, text.getName(), autoExit, true);
        insert(cursor, span);
        CursorPosition saved = cursor.getPosition();
        cursor.moveToEndOf(span.getContent());
        String content = text.getContent();
        for (int i = 0; i < content.length(); i++) {
            cursor.insert(SymbolFactory.forTextChar(ids, content.charAt(i)), false);
        }
        cursor.restorePosition(saved);
    }

    private void insertMatrix(MatrixNode node, Cursor cursor) {
        Matrix matrix = new Matrix(ids, node.getMatrixType(), node.getRowCount(), node.getColumnCount());
        insert(cursor, matrix);
        List<List<List<LatexNode>>> rows = node.getRows();
        for (int r = 0; r < rows.size(); r++) {
            List<List<LatexNode>> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                fill(matrix.getCell(r, c), row.get(c), cursor);
            }
        }
    }

    private static void insert(Cursor cursor, MathNode node) {
        cursor.insert(node, false);
    }

    /**
     * Fills {@code block} with {@code content}, then puts the cursor back where it was.
     */
    private void fill(Block block, List<LatexNode> content, Cursor cursor) {
        if (content == null || content.isEmpty()) {
            return;
        }
        CursorPosition saved = cursor.getPosition();
        cursor.moveToEndOf(block);
        for (LatexNode child : content) {
            insertNode(child, cursor);
        }
        cursor.restorePosition(saved);
    }
}
