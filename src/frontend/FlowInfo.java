package frontend;

import exception.RestructureException;
import ir.BlockMap;
import ir.block.BasicBlock;
import ir.label.Label;
import ir.label.OffsetLabel;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Block boundaries and jump edges of an instruction stream, collected in a single scan.
 * {@link #buildBasicBlocks()} turns them into the initial block map.
 */
public class FlowInfo {
    private static final Logger log = LoggingManager.getLogger(FlowInfo.class);

    private final TreeSet<Integer> blockOffsets = new TreeSet<>();
    private final TreeSet<Integer> instructionOffsets = new TreeSet<>();
    private final Map<Integer, List<Label>> jumpInstructions = new HashMap<>();
    private int lastOffset;
    private int instructionWidth;

    private FlowInfo() {
    }

    public static FlowInfo fromInstructions(List<Instruction> instructions, OpcodeTable opcodes) {
        if (instructions == null || instructions.isEmpty()) {
            throw RestructureException.precondition("empty instruction stream");
        }
        FlowInfo info = new FlowInfo();
        info.instructionWidth = opcodes.getInstructionWidth();

        for (int i = 0; i < instructions.size(); i++) {
            Instruction inst = instructions.get(i);
            int offset = inst.getOffset();
            info.instructionOffsets.add(offset);
            if (offset == 0 || inst.isJumpTarget()) {
                info.blockOffsets.add(offset);
            }

            JumpKind kind = opcodes.classify(inst.getOpname());
            if (kind.isJump() && !inst.hasArgument()) {
                throw RestructureException.precondition(
                        "jump " + inst.getOpname() + " at offset " + offset + " has no destination");
            }
            switch (kind) {
                case CONDITIONAL -> {
                    int next = i + 1 < instructions.size()
                            ? instructions.get(i + 1).getOffset()
                            : offset + info.instructionWidth;
                    info.addJumpInstruction(offset, inst.getArgument(), next);
                }
                case UNCONDITIONAL -> info.addJumpInstruction(offset, inst.getArgument());
                case TERMINATOR -> info.addJumpInstruction(offset);
                default -> {
                    // straight line
                }
            }
        }
        info.lastOffset = instructions.get(instructions.size() - 1).getOffset();
        log.debug("block offsets {}, {} jump instructions", info.blockOffsets, info.jumpInstructions.size());
        return info;
    }

    private void addJumpInstruction(int offset, int... targets) {
        List<Label> labels = new ArrayList<>();
        for (int target : targets) {
            blockOffsets.add(target);
            labels.add(OffsetLabel.of(target));
        }
        jumpInstructions.put(offset, labels);
    }

    /**
     * Build one basic block per boundary, ending at the offset just past the last instruction
     */
    public BlockMap buildBasicBlocks() {
        return buildBasicBlocks(lastOffset + instructionWidth);
    }

    public BlockMap buildBasicBlocks(int endOffset) {
        List<Integer> offsets = new ArrayList<>(blockOffsets.headSet(endOffset));
        BlockMap blocks = new BlockMap();
        for (int i = 0; i < offsets.size(); i++) {
            int begin = offsets.get(i);
            int end = i + 1 < offsets.size() ? offsets.get(i + 1) : endOffset;

            // the instruction closing the block, if any
            Integer terminator = instructionOffsets.lower(end);
            List<Label> targets;
            boolean fallthrough;
            if (terminator != null && terminator >= begin && jumpInstructions.containsKey(terminator)) {
                targets = jumpInstructions.get(terminator);
                fallthrough = false;
            } else {
                targets = List.of(OffsetLabel.of(end));
                fallthrough = true;
            }
            blocks.addNode(new BasicBlock(OffsetLabel.of(begin), OffsetLabel.of(end), fallthrough, targets));
        }
        return blocks;
    }

    public Set<Integer> getBlockOffsets() {
        return Collections.unmodifiableSet(blockOffsets);
    }

    public Map<Integer, List<Label>> getJumpInstructions() {
        return Collections.unmodifiableMap(jumpInstructions);
    }

    public int getLastOffset() {
        return lastOffset;
    }
}
