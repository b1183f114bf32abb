package frontend;

/**
 * Control flow effect of an opcode
 */
public enum JumpKind {
    // jumps to its argument or falls through to the next instruction
    CONDITIONAL,
    // always jumps to its argument
    UNCONDITIONAL,
    // leaves the code object
    TERMINATOR,
    OTHER;

    public boolean isJump() {
        return this == CONDITIONAL || this == UNCONDITIONAL;
    }
}
