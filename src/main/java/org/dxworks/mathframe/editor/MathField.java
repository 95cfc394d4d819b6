package org.dxworks.mathframe.editor;

import org.dxworks.mathframe.MathframeConfig;
import org.dxworks.mathframe.catalog.CommandCatalog;
import org.dxworks.mathframe.catalog.CommandDefinition;
import org.dxworks.mathframe.catalog.CommandKind;
import org.dxworks.mathframe.catalog.SymbolFactory;
import org.dxworks.mathframe.cursor.Cursor;
import org.dxworks.mathframe.cursor.CursorPosition;
import org.dxworks.mathframe.cursor.Selection;
import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.Direction;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.command.Accent;
import org.dxworks.mathframe.model.command.BinomialCoefficient;
import org.dxworks.mathframe.model.command.Bracket;
import org.dxworks.mathframe.model.command.BracketType;
import org.dxworks.mathframe.model.command.Fraction;
import org.dxworks.mathframe.model.command.LargeOperator;
import org.dxworks.mathframe.model.command.Limit;
import org.dxworks.mathframe.model.command.Matrix;
import org.dxworks.mathframe.model.command.MatrixType;
import org.dxworks.mathframe.model.command.NthRoot;
import org.dxworks.mathframe.model.command.SquareRoot;
import org.dxworks.mathframe.model.command.Subscript;
import org.dxworks.mathframe.model.command.SupSub;
import org.dxworks.mathframe.model.command.Superscript;
import org.dxworks.mathframe.model.command.TextStyleSpan;
import org.dxworks.mathframe.model.symbol.OperatorName;
import org.dxworks.mathframe.parser.AstMaterializer;
import org.dxworks.mathframe.parser.LatexParseException;
import org.dxworks.mathframe.parser.LatexParser;
import org.dxworks.mathframe.parser.ast.LatexNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * One editable formula: a root block, the cursor inside it, and the edit history.
 * <p>
 * Every mutating operation records a LaTeX snapshot and notifies the edit listeners when the
 * content actually changed. Navigation never records anything.
 * <p>
 * Not thread-safe. Each instance owns its own id generator, so ids are unique per field only.
 */
public class MathField {

    private static final Logger log = LoggerFactory.getLogger(MathField.class);

    private static final String UNKNOWN_COMMAND_STYLE = "text";

    private final MathframeConfig config;
    private final CommandCatalog catalog;
    private final NodeIdGenerator ids = new NodeIdGenerator();
    private final LatexParser parser;
    private final AstMaterializer materializer;
    private final EditHistory history;
    private final List<EditListener> listeners = new CopyOnWriteArrayList<>();

    private Block root;
    private Cursor cursor;
    // null outside command input mode
    private StringBuilder pendingCommand;

    public MathField() {
        this(MathframeConfig.defaults());
    }

    public MathField(MathframeConfig config) {
        this(config, CommandCatalog.getDefault());
    }

    public MathField(MathframeConfig config, CommandCatalog catalog) {
        this.config = config;
        this.catalog = catalog;
        this.parser = new LatexParser(catalog);
        this.materializer = new AstMaterializer(catalog, ids, config.isWrapUnknownCommands());
        this.history = new EditHistory(config.getMaxHistory());
        this.root = Block.root(ids);
        this.cursor = new Cursor(root, ids, config.getVerticalEntry());
        history.record(latex());
    }

    // ---- content ----

    public String latex() {
        return root.latex();
    }

    public String text() {
        return root.text();
    }

    public String speech() {
        return root.speech();
    }

    /**
     * Replaces the content with parsed {@code latex}. On a parse error the current content is
     * kept and the error is logged.
     *
     * @return false if the input could not be parsed
     */
    public boolean setLatex(String latex) {
        try {
            setLatexOrThrow(latex);
            return true;
        } catch (LatexParseException e) {
            log.warn("Keeping current content, could not parse '{}': {}", latex, e.getMessage());
            return false;
        }
    }

    /**
     * Replaces the content with parsed {@code latex} and puts the cursor at the end.
     * Parsing happens before anything is touched, so a failure leaves the field unchanged.
     */
    public void setLatexOrThrow(String latex) throws LatexParseException {
        List<LatexNode> nodes = parser.parse(latex);
        pendingCommand = null;
        load(nodes);
        commit();
    }

    /**
     * Inserts parsed {@code latex} at the cursor, replacing the selection if there is one.
     */
    public void write(String latex) throws LatexParseException {
        List<LatexNode> nodes = parser.parse(latex);
        finishCommandInput();
        cursor.deleteSelection();
        materializer.materialize(nodes, cursor);
        commit();
    }

    /**
     * Inserts {@code text} as LaTeX when it parses, otherwise types it character by character.
     */
    public void paste(String text) {
        try {
            write(text);
        } catch (LatexParseException e) {
            log.debug("Pasted text is not valid LaTeX ({}), typing it instead", e.getMessage());
            typedText(text);
            if (finishCommandInput()) {
                commit();
            }
        }
    }

    // ---- typing ----

    /**
     * Types {@code text} one character at a time, the way keystrokes arrive from a keyboard.
     * A backslash starts command input; the command runs on the next space or non-letter.
     */
    public void typedText(String text) {
        for (int i = 0; i < text.length(); i++) {
            typeChar(text.charAt(i));
        }
        commit();
    }

    public boolean isCommandInputActive() {
        return pendingCommand != null;
    }

    /**
     * Name typed so far in command input mode, without the backslash, or null outside it.
     */
    public String getPendingCommand() {
        return pendingCommand == null ? null : pendingCommand.toString();
    }

    private void typeChar(char c) {
        if (pendingCommand != null) {
            if (SymbolFactory.isLetter(c)) {
                pendingCommand.append(c);
                return;
            }
            if (pendingCommand.length() == 0 && catalog.isKnown(String.valueOf(c))) {
                pendingCommand = null;
                runCommand(String.valueOf(c));
                return;
            }
            finishCommandInput();
            if (c == ' ') {
                return;
            }
        }
        if (c == '\\') {
            pendingCommand = new StringBuilder();
            return;
        }
        if (isInRawText()) {
            typeTextChar(c);
            return;
        }
        switch (c) {
            case ' ':
                return;
            case '/':
                placeFraction(Fraction.DEFAULT_COMMAND);
                return;
            case '^':
                placeSuperscript();
                return;
            case '_':
                placeSubscript();
                return;
            case '(':
            case '[':
            case '{':
                placeBrackets(BracketType.fromOpenChar(c).orElseThrow());
                return;
            case '|':
                if (!closeBracket(BracketType.ABSOLUTE)) {
                    placeBrackets(BracketType.ABSOLUTE);
                }
                return;
            case ')':
                closeOrType(BracketType.PARENTHESES, c);
                return;
            case ']':
                closeOrType(BracketType.SQUARE, c);
                return;
            case '}':
                closeOrType(BracketType.CURLY, c);
                return;
            default:
                typeSymbol(c);
        }
    }

    private void typeSymbol(char c) {
        if (isReserved(c)) {
            Optional<CommandDefinition> escaped = catalog.lookup(String.valueOf(c));
            if (escaped.isPresent() && escaped.get().getKind() == CommandKind.SYMBOL) {
                cursor.insert(SymbolFactory.forDefinition(ids, escaped.get()));
            } else {
                log.debug("Ignoring typed character '{}' with no math meaning", c);
            }
            return;
        }
        cursor.insert(SymbolFactory.forTypedChar(ids, c));
    }

    private void typeTextChar(char c) {
        if (isReserved(c) || c == '^' || c == '_') {
            log.debug("Ignoring '{}' inside a text span", c);
            return;
        }
        cursor.insert(SymbolFactory.forTextChar(ids, c));
    }

    private void closeOrType(BracketType type, char c) {
        if (!closeBracket(type)) {
            typeSymbol(c);
        }
    }

    private boolean closeBracket(BracketType type) {
        CompositeNode owner = cursor.getParent().getOwner();
        if (owner instanceof Bracket && ((Bracket) owner).getType() == type) {
            cursor.placeAfter(owner);
            return true;
        }
        return false;
    }

    private boolean isInRawText() {
        CompositeNode owner = cursor.getParent().getOwner();
        return owner instanceof TextStyleSpan && ((TextStyleSpan) owner).isRawText();
    }

    private static boolean isReserved(char c) {
        return "{}#$%&~".indexOf(c) >= 0;
    }

    /**
     * Runs the pending command, if any, and leaves command input mode.
     *
     * @return true if something was inserted
     */
    private boolean finishCommandInput() {
        if (pendingCommand == null) {
            return false;
        }
        String name = pendingCommand.toString();
        pendingCommand = null;
        if (name.isEmpty()) {
            return false;
        }
        runCommand(name);
        return true;
    }

    // ---- commands ----

    /**
     * Inserts the command {@code name} (without backslash) at the cursor. Unknown names are
     * kept visible as a text span containing the command.
     *
     * @return true if the catalog knows the command
     */
    public boolean executeCommand(String name) {
        return edit(() -> runCommand(name));
    }

    private boolean runCommand(String name) {
        Optional<CommandDefinition> definition = catalog.lookup(name);
        if (definition.isEmpty()) {
            log.debug("Unknown command {} typed, inserting it as text", "\\" + name);
            placeUnknownCommand(name);
            return false;
        }
        runDefinition(definition.get());
        return true;
    }

    private MathNode runDefinition(CommandDefinition definition) {
        switch (definition.getKind()) {
            case SYMBOL: {
                MathNode symbol = SymbolFactory.forDefinition(ids, definition);
                cursor.insert(symbol);
                return symbol;
            }
            case OPERATOR_NAME: {
                MathNode operator = new OperatorName(ids, definition.getName(), definition.getGlyph());
                cursor.insert(operator);
                return operator;
            }
            case LARGE_OPERATOR: {
                LargeOperator operator = new LargeOperator(ids, definition.getName(), definition.getGlyph());
                return place(operator, operator.getLower());
            }
            case LIMIT: {
                Limit limit = new Limit(ids, definition.getName(), definition.getGlyph());
                return place(limit, limit.getLower());
            }
            case FRACTION:
                return placeFraction(definition.getLatexCommand());
            case SQUARE_ROOT: {
                SquareRoot root = new SquareRoot(ids);
                return place(root, root.getRadicand());
            }
            case BINOMIAL: {
                BinomialCoefficient binomial = new BinomialCoefficient(ids);
                return place(binomial, binomial.getNumerator());
            }
            case ACCENT: {
                Accent accent = new Accent(ids, definition.getName(), definition.getMark());
                return place(accent, accent.getContent());
            }
            case TEXT_STYLE: {
                TextStyleSpan span = new TextStyleSpan(ids, definition.getName(), definition.isAutoExit(),
                        definition.isRawText());
                return place(span, span.getContent());
            }
            default:
                throw new IllegalStateException("Unhandled command kind " + definition.getKind());
        }
    }

    private void placeUnknownCommand(String name) {
        TextStyleSpan span = new TextStyleSpan(ids, UNKNOWN_COMMAND_STYLE, false, true);
        cursor.insert(span);
        String content = "\\" + name;
        for (int i = 0; i < content.length(); i++) {
            span.getContent().append(SymbolFactory.forTextChar(ids, content.charAt(i)));
        }
    }

    // ---- structure insertion ----

    public Fraction insertFraction() {
        return edit(() -> placeFraction(Fraction.DEFAULT_COMMAND));
    }

    public SquareRoot insertSquareRoot() {
        return edit(() -> {
            SquareRoot root = new SquareRoot(ids);
            return place(root, root.getRadicand());
        });
    }

    /**
     * Inserts an nth root with the cursor in its index.
     */
    public NthRoot insertNthRoot() {
        return edit(() -> {
            NthRoot root = new NthRoot(ids);
            return place(root, root.getRadicand(), root.getIndex());
        });
    }

    public CompositeNode insertSuperscript() {
        return edit(this::placeSuperscript);
    }

    public CompositeNode insertSubscript() {
        return edit(this::placeSubscript);
    }

    public Bracket insertBrackets(BracketType type) {
        return edit(() -> placeBrackets(type));
    }

    public Matrix insertMatrix(MatrixType type, int rows, int columns) {
        return edit(() -> {
            Matrix matrix = new Matrix(ids, type, rows, columns);
            return place(matrix, matrix.getCell(0, 0));
        });
    }

    public BinomialCoefficient insertBinomial() {
        return edit(() -> {
            BinomialCoefficient binomial = new BinomialCoefficient(ids);
            return place(binomial, binomial.getNumerator());
        });
    }

    public Accent insertAccent(String name) {
        CommandDefinition definition = requireDefinition(name, CommandKind.ACCENT);
        return (Accent) edit(() -> runDefinition(definition));
    }

    public TextStyleSpan insertTextStyle(String name) {
        CommandDefinition definition = requireDefinition(name, CommandKind.TEXT_STYLE);
        return (TextStyleSpan) edit(() -> runDefinition(definition));
    }

    public LargeOperator insertLargeOperator(String name) {
        CommandDefinition definition = requireDefinition(name, CommandKind.LARGE_OPERATOR);
        return (LargeOperator) edit(() -> runDefinition(definition));
    }

    public Limit insertLimit(String name) {
        CommandDefinition definition = requireDefinition(name, CommandKind.LIMIT);
        return (Limit) edit(() -> runDefinition(definition));
    }

    public MathNode insertSymbol(String name) {
        CommandDefinition definition = requireDefinition(name, CommandKind.SYMBOL);
        return edit(() -> runDefinition(definition));
    }

    /**
     * Inserts an already built node at the cursor.
     */
    public void insert(MathNode node) {
        edit(() -> {
            cursor.insert(node);
            return node;
        });
    }

    private CommandDefinition requireDefinition(String name, CommandKind kind) {
        CommandDefinition definition = catalog.lookup(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown command \\" + name));
        if (definition.getKind() != kind) {
            throw new IllegalArgumentException("\\" + name + " is a " + definition.getKind() + ", not a " + kind);
        }
        return definition;
    }

    private Fraction placeFraction(String command) {
        Fraction fraction = new Fraction(ids, command);
        return place(fraction, fraction.getNumerator());
    }

    private Bracket placeBrackets(BracketType type) {
        Bracket bracket = new Bracket(ids, type);
        return place(bracket, bracket.getContent());
    }

    /**
     * A superscript typed right after a subscript joins it into one script pair. Typed after an
     * existing superscript, the cursor goes back into it.
     */
    private CompositeNode placeSuperscript() {
        MathNode left = cursor.getLeft();
        if (!cursor.hasSelection()) {
            if (left instanceof Subscript) {
                SupSub pair = new SupSub(ids, true);
                cursor.getParent().insertChild(pair, left);
                ((Subscript) left).getSub().moveChildrenTo(pair.getSub());
                left.remove();
                cursor.moveToEndOf(pair.getSup());
                return pair;
            }
            if (left instanceof Superscript) {
                cursor.moveToEndOf(((Superscript) left).getSup());
                return (CompositeNode) left;
            }
            if (left instanceof SupSub) {
                cursor.moveToEndOf(((SupSub) left).getSup());
                return (CompositeNode) left;
            }
        }
        Superscript superscript = new Superscript(ids);
        return place(superscript, superscript.getSup());
    }

    private CompositeNode placeSubscript() {
        MathNode left = cursor.getLeft();
        if (!cursor.hasSelection()) {
            if (left instanceof Superscript) {
                SupSub pair = new SupSub(ids, false);
                cursor.getParent().insertChild(pair, left);
                ((Superscript) left).getSup().moveChildrenTo(pair.getSup());
                left.remove();
                cursor.moveToEndOf(pair.getSub());
                return pair;
            }
            if (left instanceof Subscript) {
                cursor.moveToEndOf(((Subscript) left).getSub());
                return (CompositeNode) left;
            }
            if (left instanceof SupSub) {
                cursor.moveToEndOf(((SupSub) left).getSub());
                return (CompositeNode) left;
            }
        }
        Subscript subscript = new Subscript(ids);
        return place(subscript, subscript.getSub());
    }

    private <T extends CompositeNode> T place(T node, Block primary) {
        return place(node, primary, primary);
    }

    /**
     * Inserts {@code node} at the cursor. A selected run moves into {@code primary};
     * the cursor lands at the end of {@code focus}.
     */
    private <T extends CompositeNode> T place(T node, Block primary, Block focus) {
        List<MathNode> wrapped = takeSelection();
        cursor.insert(node);
        for (MathNode child : wrapped) {
            primary.append(child);
        }
        cursor.moveToEndOf(wrapped.isEmpty() ? focus : primary);
        return node;
    }

    private List<MathNode> takeSelection() {
        Selection selection = cursor.getSelection();
        if (selection == null) {
            return Collections.emptyList();
        }
        CursorPosition gap = new CursorPosition(selection.getParent(),
                selection.getLeftEnd().getLeft(), selection.getRightEnd().getRight());
        List<MathNode> taken = selection.remove();
        cursor.restorePosition(gap);
        return taken;
    }

    // ---- cursor ----

    public boolean moveLeft() {
        return navigate(() -> cursor.moveLeft());
    }

    public boolean moveRight() {
        return navigate(() -> cursor.moveRight());
    }

    public boolean moveUp() {
        return navigate(() -> cursor.moveUp());
    }

    public boolean moveDown() {
        return navigate(() -> cursor.moveDown());
    }

    public boolean moveToStart() {
        return navigate(() -> cursor.moveToStart());
    }

    public boolean moveToEnd() {
        return navigate(() -> cursor.moveToEnd());
    }

    /**
     * In command input mode removes the last typed letter, or leaves the mode when nothing is typed.
     */
    public boolean backspace() {
        if (pendingCommand != null) {
            if (pendingCommand.length() > 0) {
                pendingCommand.setLength(pendingCommand.length() - 1);
            } else {
                pendingCommand = null;
            }
            return true;
        }
        return mutate(() -> cursor.backspace());
    }

    public boolean deleteForward() {
        return mutate(() -> cursor.deleteForward());
    }

    public boolean select(Direction direction) {
        return navigate(() -> cursor.select(direction));
    }

    public boolean selectAll() {
        return navigate(() -> cursor.selectAll());
    }

    public void clearSelection() {
        cursor.clearSelection();
    }

    public boolean deleteSelection() {
        return mutate(() -> cursor.deleteSelection());
    }

    public boolean hasSelection() {
        return cursor.hasSelection();
    }

    public String selectionLatex() {
        return cursor.selectionLatex();
    }

    public Optional<MathNode> findNodeById(int id) {
        MathNode[] found = new MathNode[1];
        root.preOrder(node -> {
            if (found[0] == null && node.getId() == id) {
                found[0] = node;
            }
        });
        return Optional.ofNullable(found[0]);
    }

    // ---- history ----

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public boolean undo() {
        if (finishCommandInput()) {
            commit();
        }
        return restore(history.undo());
    }

    public boolean redo() {
        if (finishCommandInput()) {
            commit();
        }
        return restore(history.redo());
    }

    private boolean restore(String snapshot) {
        if (snapshot == null) {
            return false;
        }
        try {
            load(parser.parse(snapshot));
        } catch (LatexParseException e) {
            throw new IllegalStateException("History snapshot no longer parses: " + snapshot, e);
        }
        notifyListeners();
        return true;
    }

    // ---- listeners ----

    public void addEditListener(EditListener listener) {
        listeners.add(listener);
    }

    public void removeEditListener(EditListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners() {
        for (EditListener listener : listeners) {
            listener.onEdit(this);
        }
    }

    // ---- plumbing ----

    private void load(List<LatexNode> nodes) {
        root = Block.root(ids);
        cursor = new Cursor(root, ids, config.getVerticalEntry());
        materializer.materialize(nodes, cursor);
        cursor.moveToEndOf(root);
    }

    private <T> T edit(Supplier<T> action) {
        finishCommandInput();
        T result = action.get();
        commit();
        return result;
    }

    private boolean mutate(Supplier<Boolean> action) {
        boolean committed = finishCommandInput();
        boolean changed = action.get();
        if (changed || committed) {
            commit();
        }
        return changed;
    }

    private boolean navigate(Supplier<Boolean> action) {
        if (finishCommandInput()) {
            commit();
        }
        return action.get();
    }

    private void commit() {
        if (history.record(latex())) {
            notifyListeners();
        }
    }

    public Block getRoot() {
        return root;
    }

    public Cursor getCursor() {
        return cursor;
    }

    public NodeIdGenerator getIds() {
        return ids;
    }

    public CommandCatalog getCatalog() {
        return catalog;
    }

    public MathframeConfig getConfig() {
        return config;
    }
}
