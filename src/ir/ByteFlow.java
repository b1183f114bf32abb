package ir;

import frontend.FlowInfo;
import frontend.Instruction;
import frontend.OpcodeTable;
import ir.block.Block;
import ir.label.Label;
import ir.label.LabelGenerator;
import ir.label.OffsetLabel;
import pass.FlowPassType;
import pass.Pass.FlowPass;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An instruction stream together with its (partially) restructured control flow graph.
 * <p>
 * Values are never modified: every step works on a deep copy of the block map and returns a new flow.
 * The next free synthetic label index travels with the flow, so labels minted by successive steps never
 * collide.
 */
public class ByteFlow {
    private static final Logger log = LoggingManager.getLogger(ByteFlow.class);

    private final List<Instruction> instructions;
    private final BlockMap blockMap;
    private final int nextLabelIndex;

    public ByteFlow(List<Instruction> instructions, BlockMap blockMap, int nextLabelIndex) {
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.blockMap = blockMap;
        this.nextLabelIndex = nextLabelIndex;
    }

    public static ByteFlow fromInstructions(List<Instruction> instructions) {
        return fromInstructions(instructions, OpcodeTable.cpython());
    }

    public static ByteFlow fromInstructions(List<Instruction> instructions, OpcodeTable opcodes) {
        log.debug(() -> "instructions\n" + render(instructions));
        FlowInfo flowInfo = FlowInfo.fromInstructions(instructions, opcodes);
        return new ByteFlow(instructions, flowInfo.buildBasicBlocks(), 0);
    }

    private static String render(List<Instruction> instructions) {
        StringBuilder sb = new StringBuilder();
        for (Instruction inst : instructions) {
            sb.append(inst).append('\n');
        }
        return sb.toString();
    }

    public ByteFlow joinReturns() {
        return apply(FlowPassType.JoinReturns);
    }

    public ByteFlow restructureLoop() {
        return apply(FlowPassType.LoopRestructure);
    }

    public ByteFlow restructureBranch() {
        return apply(FlowPassType.BranchRestructure);
    }

    /**
     * Close the graph, extract loops, extract branches and wrap the result into a single root region
     */
    public ByteFlow restructure() {
        return apply(FlowPassType.JoinReturns, FlowPassType.LoopRestructure,
                FlowPassType.BranchRestructure, FlowPassType.RootRegion);
    }

    private ByteFlow apply(FlowPassType... types) {
        BlockMap blocks = blockMap.copy();
        LabelGenerator labels = new LabelGenerator(nextLabelIndex);
        for (FlowPassType type : types) {
            FlowPass pass = type.create();
            blocks = pass.run(blocks, labels);
        }
        return withBlockMap(blocks, labels.peek());
    }

    public ByteFlow withBlockMap(BlockMap blocks, int nextIndex) {
        return new ByteFlow(instructions, blocks, nextIndex);
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    /**
     * Instructions covered by a leaf; empty for synthetic nodes
     */
    public List<Instruction> getInstructions(Block block) {
        List<Instruction> covered = new ArrayList<>();
        Label begin = block.getBegin();
        Label end = block.getEnd();
        if (!(begin instanceof OffsetLabel b) || !(end instanceof OffsetLabel e)) {
            return covered;
        }
        for (Instruction inst : instructions) {
            if (inst.getOffset() >= b.getOffset() && inst.getOffset() < e.getOffset()) {
                covered.add(inst);
            }
        }
        return covered;
    }

    public BlockMap getBlockMap() {
        return blockMap;
    }

    public int getNextLabelIndex() {
        return nextLabelIndex;
    }
}
