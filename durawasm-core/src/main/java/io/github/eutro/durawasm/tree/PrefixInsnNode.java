package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;

/**
 * An {@link Opcodes#INSN_PREFIX}-prefixed instruction, with up to two index immediates.
 * <p>
 * For {@code memory.init} and {@code table.init} the first index is the segment and the second the memory or table;
 * for {@code table.copy} they are the destination and source tables.
 */
public class PrefixInsnNode extends AbstractInsnNode {
    public final int intOpcode;
    public final int firstIndex;
    public final int secondIndex;

    public PrefixInsnNode(int intOpcode, int firstIndex, int secondIndex) {
        super(Opcodes.INSN_PREFIX);
        this.intOpcode = intOpcode;
        this.firstIndex = firstIndex;
        this.secondIndex = secondIndex;
    }

    public PrefixInsnNode(int intOpcode) {
        this(intOpcode, 0, 0);
    }
}
