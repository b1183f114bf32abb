package ir;

import frontend.Instruction;
import ir.block.BasicBlock;
import ir.block.Block;
import ir.block.BlockVisitor;
import ir.block.RegionBlock;
import ir.block.RegionKind;
import ir.label.Label;
import ir.label.LabelGenerator;
import ir.label.OffsetLabel;

import java.util.ArrayList;
import java.util.List;

/**
 * Instruction streams and small graphs shared by the tests
 */
public final class FlowFixtures {

    private FlowFixtures() {
    }

    /**
     * Nested forward branches:
     * 0 -> (14, 4), 4 -> (12, 8), 8 -> 18, 12 -> 14, 14 -> 18, 18 returns
     */
    public static List<Instruction> scenarioA() {
        return List.of(
                new Instruction("LOAD_FAST", 0),
                new Instruction("POP_JUMP_IF_TRUE", 2, false, 14),
                new Instruction("LOAD_FAST", 4),
                new Instruction("POP_JUMP_IF_TRUE", 6, false, 12),
                new Instruction("LOAD_CONST", 8),
                new Instruction("JUMP_ABSOLUTE", 10, false, 18),
                new Instruction("LOAD_CONST", 12, true, null),
                new Instruction("LOAD_CONST", 14, true, null),
                new Instruction("JUMP_ABSOLUTE", 16, false, 18),
                new Instruction("RETURN_VALUE", 18, true, null));
    }

    /**
     * Scenario A with the jump at 16 sent back to 4: the loop {4, 12, 14} is entered at 4 and at 14
     */
    public static List<Instruction> scenarioB() {
        return List.of(
                new Instruction("LOAD_FAST", 0),
                new Instruction("POP_JUMP_IF_TRUE", 2, false, 14),
                new Instruction("LOAD_FAST", 4, true, null),
                new Instruction("POP_JUMP_IF_TRUE", 6, false, 12),
                new Instruction("LOAD_CONST", 8),
                new Instruction("JUMP_ABSOLUTE", 10, false, 18),
                new Instruction("LOAD_CONST", 12, true, null),
                new Instruction("LOAD_CONST", 14, true, null),
                new Instruction("JUMP_ABSOLUTE", 16, false, 4),
                new Instruction("RETURN_VALUE", 18, true, null));
    }

    /**
     * Scenario B with the first branch skipping the loop, so the loop {4, 12} has the single header 4:
     * 0 -> (18, 4), 4 -> (12, 8), 8 -> 18, 12 -> 4, 18 returns
     */
    public static List<Instruction> scenarioSingleEntryLoop() {
        return List.of(
                new Instruction("LOAD_FAST", 0),
                new Instruction("POP_JUMP_IF_TRUE", 2, false, 18),
                new Instruction("LOAD_FAST", 4, true, null),
                new Instruction("POP_JUMP_IF_TRUE", 6, false, 12),
                new Instruction("LOAD_CONST", 8),
                new Instruction("JUMP_ABSOLUTE", 10, false, 18),
                new Instruction("LOAD_CONST", 12, true, null),
                new Instruction("LOAD_CONST", 14),
                new Instruction("JUMP_ABSOLUTE", 16, false, 4),
                new Instruction("RETURN_VALUE", 18, true, null));
    }

    public static Label l(int offset) {
        return OffsetLabel.of(offset);
    }

    public static Label c(int index) {
        return new LabelGenerator(index).next();
    }

    public static List<Label> labels(int... offsets) {
        List<Label> labels = new ArrayList<>();
        for (int offset : offsets) {
            labels.add(l(offset));
        }
        return labels;
    }

    /**
     * Leaf at {@code begin} jumping to {@code targets}
     */
    public static BasicBlock leaf(int begin, int... targets) {
        return new BasicBlock(l(begin), l(begin + 1), false, labels(targets));
    }

    public static BlockMap map(Block... blocks) {
        return new BlockMap(List.of(blocks));
    }

    /**
     * Begin labels of all leaves of the region tree, headers first within each region
     */
    public static List<Label> leaves(BlockMap blocks) {
        List<Label> leaves = new ArrayList<>();
        BlockVisitor<Void> collector = new BlockVisitor<>() {
            @Override
            public Void visitBasicBlock(BasicBlock block) {
                leaves.add(block.getBegin());
                return null;
            }

            @Override
            public Void visitRegionBlock(RegionBlock region) {
                for (Block block : region.getFullGraph().values()) {
                    block.accept(this);
                }
                return null;
            }
        };
        for (Block block : blocks.getGraph().values()) {
            block.accept(collector);
        }
        return leaves;
    }

    /**
     * All regions of the given kind, at any depth
     */
    public static List<RegionBlock> regions(BlockMap blocks, RegionKind kind) {
        List<RegionBlock> found = new ArrayList<>();
        for (Block block : blocks.getGraph().values()) {
            if (block instanceof RegionBlock region) {
                if (region.getKind() == kind) {
                    found.add(region);
                }
                for (Block header : region.getHeaders().values()) {
                    if (header instanceof RegionBlock) {
                        found.addAll(regions(new BlockMap(List.of(header)), kind));
                    }
                }
                found.addAll(regions(region.getSubregion(), kind));
            }
        }
        return found;
    }

    public static RegionBlock region(BlockMap blocks, Label label) {
        return (RegionBlock) blocks.getNode(label);
    }
}
