package io.github.eutro.durawasm.tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * A sequence of instructions, without its terminating {@code end}.
 */
public class ExprNode implements Iterable<AbstractInsnNode> {
    public final List<AbstractInsnNode> instructions;
    public @Nullable SourceLocation location;

    public ExprNode(List<AbstractInsnNode> instructions) {
        this.instructions = instructions;
    }

    public ExprNode() {
        this(new ArrayList<>());
    }

    public int size() {
        return instructions.size();
    }

    public AbstractInsnNode get(int index) {
        return instructions.get(index);
    }

    @NotNull
    @Override
    public Iterator<AbstractInsnNode> iterator() {
        return instructions.iterator();
    }
}
