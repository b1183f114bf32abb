package frontend;

import java.util.Objects;

/**
 * One decoded instruction of the input stream
 */
public class Instruction {
    private final String opname;
    private final int offset;
    private final boolean jumpTarget;
    // absolute jump destination for jumps, raw operand otherwise; null when the opcode takes none
    private final Integer argument;

    public Instruction(String opname, int offset, boolean jumpTarget, Integer argument) {
        this.opname = Objects.requireNonNull(opname, "opname");
        this.offset = offset;
        this.jumpTarget = jumpTarget;
        this.argument = argument;
    }

    public Instruction(String opname, int offset) {
        this(opname, offset, false, null);
    }

    public String getOpname() {
        return opname;
    }

    public int getOffset() {
        return offset;
    }

    public boolean isJumpTarget() {
        return jumpTarget;
    }

    public Integer getArgument() {
        return argument;
    }

    public boolean hasArgument() {
        return argument != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Instruction other)) return false;
        return offset == other.offset && jumpTarget == other.jumpTarget
                && opname.equals(other.opname) && Objects.equals(argument, other.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opname, offset, jumpTarget, argument);
    }

    @Override
    public String toString() {
        return (jumpTarget ? ">> " : "") + offset + " " + opname + (argument == null ? "" : " " + argument);
    }
}
