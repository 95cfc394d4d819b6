package org.dxworks.mathframe.parser.ast;

import org.dxworks.mathframe.catalog.CommandKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A catalog command with arguments, e.g. {@code \frac{a}{b}} or {@code \sqrt[3]{x}}.
 * Each argument is the content of its group.
 */
public class CommandNode extends LatexNode {

    private final String name;
    private final CommandKind kind;
    private final List<List<LatexNode>> requiredArgs;
    private final List<List<LatexNode>> optionalArgs;

    public CommandNode(int position, String name, CommandKind kind,
                       List<List<LatexNode>> requiredArgs, List<List<LatexNode>> optionalArgs) {
        super(position);
        this.name = name;
        this.kind = kind;
        this.requiredArgs = copy(requiredArgs);
        this.optionalArgs = copy(optionalArgs);
    }

    private static List<List<LatexNode>> copy(List<List<LatexNode>> args) {
        List<List<LatexNode>> result = new ArrayList<>(args.size());
        for (List<LatexNode> arg : args) {
            result.add(List.copyOf(arg));
        }
        return List.copyOf(result);
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.COMMAND;
    }

    public String getName() {
        return name;
    }

    public CommandKind getKind() {
        return kind;
    }

    public List<List<LatexNode>> getRequiredArgs() {
        return requiredArgs;
    }

    public List<List<LatexNode>> getOptionalArgs() {
        return optionalArgs;
    }

    public List<LatexNode> getRequiredArg(int index) {
        return requiredArgs.get(index);
    }

    public boolean hasOptionalArg() {
        return !optionalArgs.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandNode)) return false;
        CommandNode that = (CommandNode) o;
        return name.equals(that.name)
                && requiredArgs.equals(that.requiredArgs)
                && optionalArgs.equals(that.optionalArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, requiredArgs, optionalArgs);
    }

    @Override
    public String toString() {
        return "\\" + name + optionalArgs + requiredArgs;
    }
}
