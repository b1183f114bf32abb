package frontend;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Classification of opcodes by their control flow effect, plus the fixed instruction width of the encoding.
 * Unknown opcodes are {@link JumpKind#OTHER}.
 */
public class OpcodeTable {
    private final Map<String, JumpKind> kinds;
    private final int instructionWidth;

    private OpcodeTable(Map<String, JumpKind> kinds, int instructionWidth) {
        this.kinds = Collections.unmodifiableMap(kinds);
        this.instructionWidth = instructionWidth;
    }

    /**
     * The CPython 3.x wordcode table: two bytes per instruction
     */
    public static OpcodeTable cpython() {
        return builder()
                .conditional("FOR_ITER", "POP_JUMP_IF_FALSE", "POP_JUMP_IF_TRUE")
                .unconditional("JUMP_ABSOLUTE", "JUMP_FORWARD")
                .terminator("RETURN_VALUE")
                .width(2)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public JumpKind classify(String opname) {
        return kinds.getOrDefault(opname, JumpKind.OTHER);
    }

    public int getInstructionWidth() {
        return instructionWidth;
    }

    public Set<String> getKnownOpnames() {
        return kinds.keySet();
    }

    public static class Builder {
        private final Map<String, JumpKind> kinds = new HashMap<>();
        private int width = 2;

        public Builder conditional(String... opnames) {
            return put(JumpKind.CONDITIONAL, opnames);
        }

        public Builder unconditional(String... opnames) {
            return put(JumpKind.UNCONDITIONAL, opnames);
        }

        public Builder terminator(String... opnames) {
            return put(JumpKind.TERMINATOR, opnames);
        }

        public Builder width(int width) {
            if (width <= 0) {
                throw new IllegalArgumentException("instruction width must be positive: " + width);
            }
            this.width = width;
            return this;
        }

        private Builder put(JumpKind kind, String... opnames) {
            for (String opname : opnames) {
                kinds.put(opname, kind);
            }
            return this;
        }

        public OpcodeTable build() {
            return new OpcodeTable(new HashMap<>(kinds), width);
        }
    }
}
