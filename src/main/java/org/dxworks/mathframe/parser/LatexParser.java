package org.dxworks.mathframe.parser;

import org.dxworks.mathframe.catalog.CommandCatalog;
import org.dxworks.mathframe.catalog.CommandDefinition;
import org.dxworks.mathframe.catalog.CommandKind;
import org.dxworks.mathframe.catalog.SymbolClass;
import org.dxworks.mathframe.model.command.BracketType;
import org.dxworks.mathframe.model.command.MatrixType;
import org.dxworks.mathframe.parser.ast.CharNode;
import org.dxworks.mathframe.parser.ast.CommandNode;
import org.dxworks.mathframe.parser.ast.DigitNode;
import org.dxworks.mathframe.parser.ast.GroupNode;
import org.dxworks.mathframe.parser.ast.LatexNode;
import org.dxworks.mathframe.parser.ast.MatrixNode;
import org.dxworks.mathframe.parser.ast.NamedOperatorNode;
import org.dxworks.mathframe.parser.ast.BracketNode;
import org.dxworks.mathframe.parser.ast.ScriptMarker;
import org.dxworks.mathframe.parser.ast.SpaceNode;
import org.dxworks.mathframe.parser.ast.SymbolNode;
import org.dxworks.mathframe.parser.ast.TextNode;
import org.dxworks.mathframe.parser.ast.UnknownCommandNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive-descent parser from LaTeX source to a {@link LatexNode} list.
 * The whole input must be consumed; anything left over is reported as a
 * {@link LatexParseException} with the offset where parsing stopped.
 * <p>
 * Stateless apart from the catalog, so one instance can serve many documents.
 */
public class LatexParser {

    private static final String RESERVED_CHARS = "#$%&~";

    private final CommandCatalog catalog;

    public LatexParser(CommandCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public LatexParser() {
        this(CommandCatalog.getDefault());
    }

    public List<LatexNode> parse(String input) throws LatexParseException {
        Objects.requireNonNull(input, "input");
        ParseState state = new ParseState(input, 0, input.length());
        List<LatexNode> nodes = parseSequence(state, Stop.END);
        if (!state.atEnd()) {
            throw new LatexParseException(state.pos, "end of input");
        }
        return nodes;
    }

    private enum Stop {
        END,
        BRACE,
        BRACKET,
        RIGHT_DELIMITER
    }

    private static class ParseState {
        final String text;
        final int end;
        int pos;

        ParseState(String text, int start, int end) {
            this.text = text;
            this.pos = start;
            this.end = end;
        }

        boolean atEnd() {
            return pos >= end;
        }

        char peek() {
            return text.charAt(pos);
        }

        boolean startsWithCommand(String name) {
            return !atEnd() && LatexTextUtils.startsWithCommand(text, pos, end, name);
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        void expect(char c, String expected) throws LatexParseException {
            if (atEnd() || peek() != c) {
                throw new LatexParseException(pos, expected);
            }
            pos++;
        }
    }

    private List<LatexNode> parseSequence(ParseState state, Stop stop) throws LatexParseException {
        List<LatexNode> nodes = new ArrayList<>();
        while (!state.atEnd()) {
            char c = state.peek();
            if (c == '}' || (stop == Stop.BRACKET && c == ']')) {
                break;
            }
            if (c == '\\') {
                if (state.startsWithCommand("right")) {
                    if (stop == Stop.RIGHT_DELIMITER) {
                        break;
                    }
                    throw new LatexParseException(state.pos, "\\left before \\right");
                }
                if (state.startsWithCommand("end")) {
                    break;
                }
            }
            nodes.add(parseElement(state));
        }
        return ScriptMerger.merge(nodes);
    }

    private LatexNode parseElement(ParseState state) throws LatexParseException {
        int start = state.pos;
        char c = state.peek();
        if (Character.isWhitespace(c)) {
            state.skipWhitespace();
            return new SpaceNode(start);
        }
        if (c == '{') {
            state.pos++;
            List<LatexNode> content = parseSequence(state, Stop.BRACE);
            state.expect('}', "'}'");
            return new GroupNode(start, content);
        }
        if (c == '_' || c == '^') {
            state.pos++;
            return new ScriptMarker(start, c == '_');
        }
        if (c == '\\') {
            return parseCommand(state);
        }
        return parseCharacter(state);
    }

    private LatexNode parseCharacter(ParseState state) throws LatexParseException {
        int start = state.pos;
        char c = state.peek();
        if (RESERVED_CHARS.indexOf(c) >= 0 || c == '}' || c == '_' || c == '^' || c == '{' || c == '\\') {
            throw new LatexParseException(start, "a formula character");
        }
        state.pos++;
        if (c >= '0' && c <= '9') {
            return new DigitNode(start, c);
        }
        if (LatexTextUtils.isLetter(c)) {
            return new CharNode(start, c);
        }
        return new SymbolNode(start, String.valueOf(c), null, SymbolClass.ofChar(c), null);
    }

    private LatexNode parseCommand(ParseState state) throws LatexParseException {
        int start = state.pos;
        state.pos++;
        if (state.atEnd()) {
            throw new LatexParseException(state.pos, "a command name after '\\'");
        }
        String name = readCommandName(state);

        switch (name) {
            case "left":
                return parseBracket(state, start);
            case "begin":
                return parseEnvironment(state, start);
            case "right":
                throw new LatexParseException(start, "\\left before \\right");
            case "end":
                throw new LatexParseException(start, "\\begin before \\end");
            case "\\":
                throw new LatexParseException(start, "a row separator only inside a matrix");
            default:
                break;
        }

        Optional<CommandDefinition> found = catalog.lookup(name);
        if (found.isEmpty()) {
            return new UnknownCommandNode(start, name);
        }
        CommandDefinition definition = found.get();
        switch (definition.getKind()) {
            case SYMBOL:
                return new SymbolNode(start, definition.getGlyph(), definition.getLatexCommand(),
                        definition.getSymbolClass(), definition.getDegradesTo());
            case OPERATOR_NAME:
            case LARGE_OPERATOR:
            case LIMIT:
                return new NamedOperatorNode(start, name, definition.getKind(), definition.getGlyph());
            case TEXT_STYLE:
                if (definition.isRawText()) {
                    return new TextNode(start, name, readRawText(state, name));
                }
                return parseCommandArguments(state, start, definition);
            default:
                return parseCommandArguments(state, start, definition);
        }
    }

    private static String readCommandName(ParseState state) {
        int nameStart = state.pos;
        if (!LatexTextUtils.isLetter(state.peek())) {
            state.pos++;
            return state.text.substring(nameStart, state.pos);
        }
        while (!state.atEnd() && LatexTextUtils.isLetter(state.peek())) {
            state.pos++;
        }
        return state.text.substring(nameStart, state.pos);
    }

    private CommandNode parseCommandArguments(ParseState state, int start, CommandDefinition definition) throws LatexParseException {
        CommandKind kind = definition.getKind();
        List<List<LatexNode>> optionalArgs = new ArrayList<>();
        for (int i = 0; i < kind.getOptionalArgs(); i++) {
            int before = state.pos;
            state.skipWhitespace();
            if (state.atEnd() || state.peek() != '[') {
                state.pos = before;
                break;
            }
            state.pos++;
            List<LatexNode> content = parseSequence(state, Stop.BRACKET);
            state.expect(']', "']'");
            if (!content.isEmpty()) {
                optionalArgs.add(content);
            }
        }
        List<List<LatexNode>> requiredArgs = new ArrayList<>();
        for (int i = 0; i < kind.getRequiredArgs(); i++) {
            requiredArgs.add(parseRequiredArgument(state, definition));
        }
        return new CommandNode(start, definition.getName(), kind, requiredArgs, optionalArgs);
    }

    /**
     * A braced group, or a single token for forms like {@code \frac12}.
     */
    private List<LatexNode> parseRequiredArgument(ParseState state, CommandDefinition definition) throws LatexParseException {
        state.skipWhitespace();
        String expected = "an argument for " + definition.getLatexCommand();
        if (state.atEnd()) {
            throw new LatexParseException(state.pos, expected);
        }
        char c = state.peek();
        if (c == '{') {
            state.pos++;
            List<LatexNode> content = parseSequence(state, Stop.BRACE);
            state.expect('}', "'}'");
            return content;
        }
        if (c == '\\') {
            if (state.startsWithCommand("right") || state.startsWithCommand("end")) {
                throw new LatexParseException(state.pos, expected);
            }
            return List.of(parseCommand(state));
        }
        if (c == '}' || c == '_' || c == '^' || RESERVED_CHARS.indexOf(c) >= 0) {
            throw new LatexParseException(state.pos, expected);
        }
        return List.of(parseCharacter(state));
    }

    private static String readRawText(ParseState state, String name) throws LatexParseException {
        state.skipWhitespace();
        if (state.atEnd() || state.peek() != '{') {
            throw new LatexParseException(state.pos, "'{' after \\" + name);
        }
        int close = LatexTextUtils.findMatchingBrace(state.text, state.pos, state.end);
        if (close < 0) {
            throw new LatexParseException(state.end, "'}'");
        }
        String content = state.text.substring(state.pos + 1, close);
        state.pos = close + 1;
        return content;
    }

    private LatexNode parseBracket(ParseState state, int start) throws LatexParseException {
        state.skipWhitespace();
        int delimiterStart = state.pos;
        String open = readDelimiter(state);
        Optional<BracketType> type = open == null ? Optional.empty() : BracketType.fromOpenLatex(open);
        if (type.isEmpty()) {
            throw new LatexParseException(delimiterStart, "an opening delimiter after \\left");
        }
        List<LatexNode> content = parseSequence(state, Stop.RIGHT_DELIMITER);
        if (!state.startsWithCommand("right")) {
            throw new LatexParseException(state.pos, "\\right");
        }
        state.pos += "\\right".length();
        state.skipWhitespace();
        int closeStart = state.pos;
        String close = readDelimiter(state);
        if (!type.get().getCloseLatex().equals(close)) {
            throw new LatexParseException(closeStart, "'" + type.get().getCloseLatex() + "' after \\right");
        }
        return new BracketNode(start, type.get(), content);
    }

    private static String readDelimiter(ParseState state) {
        if (state.atEnd()) {
            return null;
        }
        int delimiterStart = state.pos;
        if (state.peek() == '\\') {
            state.pos++;
            if (state.atEnd()) {
                return null;
            }
            readCommandName(state);
            return state.text.substring(delimiterStart, state.pos);
        }
        state.pos++;
        return state.text.substring(delimiterStart, state.pos);
    }

    private LatexNode parseEnvironment(ParseState state, int start) throws LatexParseException {
        state.skipWhitespace();
        state.expect('{', "'{' after \\begin");
        int nameStart = state.pos;
        int nameEnd = state.text.indexOf('}', nameStart);
        if (nameEnd < 0 || nameEnd >= state.end) {
            throw new LatexParseException(state.end, "'}'");
        }
        String environment = state.text.substring(nameStart, nameEnd);
        Optional<MatrixType> matrixType = MatrixType.fromEnvironment(environment);
        if (matrixType.isEmpty()) {
            throw new LatexParseException(nameStart, "a matrix environment");
        }
        int bodyStart = nameEnd + 1;
        String endTag = "\\end{" + environment + "}";
        int bodyEnd = LatexTextUtils.findEnvironmentEnd(state.text, bodyStart, state.end);
        if (bodyEnd < 0) {
            throw new LatexParseException(state.end, endTag);
        }
        if (!state.text.startsWith(endTag, bodyEnd)) {
            throw new LatexParseException(bodyEnd, endTag);
        }

        List<List<int[]>> ranges = LatexTextUtils.splitMatrixBody(state.text, bodyStart, bodyEnd);
        if (ranges.size() > 1) {
            List<int[]> last = ranges.get(ranges.size() - 1);
            if (last.size() == 1 && LatexTextUtils.isBlank(state.text, last.get(0)[0], last.get(0)[1])) {
                ranges.remove(ranges.size() - 1);
            }
        }

        List<List<List<LatexNode>>> rows = new ArrayList<>();
        for (List<int[]> rowRanges : ranges) {
            List<List<LatexNode>> row = new ArrayList<>();
            for (int[] range : rowRanges) {
                row.add(parseCell(state.text, range[0], range[1]));
            }
            rows.add(row);
        }
        state.pos = bodyEnd + endTag.length();
        return new MatrixNode(start, matrixType.get(), rows);
    }

    private List<LatexNode> parseCell(String text, int start, int end) throws LatexParseException {
        ParseState cell = new ParseState(text, start, end);
        List<LatexNode> content = parseSequence(cell, Stop.END);
        if (!cell.atEnd()) {
            throw new LatexParseException(cell.pos, "end of matrix cell");
        }
        return content;
    }
}
