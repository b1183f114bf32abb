package ir;

import static com.google.common.truth.Truth.assertThat;
import static ir.FlowFixtures.c;
import static ir.FlowFixtures.l;
import static ir.FlowFixtures.leaves;
import static ir.FlowFixtures.region;
import static org.junit.Assert.assertThrows;

import backend.RegionTreePrinter;
import exception.RestructureException;
import frontend.Instruction;
import ir.block.Block;
import ir.block.BasicBlock;
import ir.block.RegionBlock;
import ir.block.RegionKind;
import ir.label.Label;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pass.FlowPass.VerifyRegionPass;

@RunWith(JUnit4.class)
public final class ByteFlowTest {

    @Test
    public void restructureEndsWithOneRoot() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioA()).restructure();
        BlockMap blocks = flow.getBlockMap();

        assertThat(blocks.getLabels()).containsExactly(l(0));
        RegionBlock root = region(blocks, l(0));
        assertThat(root.getKind()).isEqualTo(RegionKind.HEAD);
        assertThat(root.getJumpTargets()).isEmpty();
        assertThat(root.getHeaders().keySet()).containsExactly(l(0));
        assertThat(root.getSubregion().getLabels()).containsExactly(c(0), c(2), l(4));
        assertThat(leaves(blocks))
                .containsExactly(l(0), l(4), l(8), l(12), l(14), l(18), c(0), c(2), c(4), c(6));
        assertThat(flow.getNextLabelIndex()).isEqualTo(8);
        new VerifyRegionPass().verify(blocks);
    }

    @Test
    public void stepsLeaveTheirInputUntouched() {
        ByteFlow initial = ByteFlow.fromInstructions(FlowFixtures.scenarioA());
        Map<Label, Block> before = Map.copyOf(initial.getBlockMap().getGraph());

        ByteFlow restructured = initial.restructure();

        assertThat(initial.getBlockMap().getGraph()).isEqualTo(before);
        assertThat(initial.getNextLabelIndex()).isEqualTo(0);
        assertThat(restructured).isNotSameInstanceAs(initial);
        assertThat(restructured.getInstructions()).isEqualTo(initial.getInstructions());
    }

    @Test
    public void restructureIsDeterministic() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioA());

        String first = RegionTreePrinter.print(flow.restructure().getBlockMap());
        String second = RegionTreePrinter.print(flow.restructure().getBlockMap());

        assertThat(first).isEqualTo(second);
    }

    @Test
    public void stepwiseEqualsAllAtOnce() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioA());

        ByteFlow stepwise = flow.joinReturns().restructureLoop().restructureBranch();
        ByteFlow atOnce = flow.restructure();

        assertThat(stepwise.getNextLabelIndex()).isEqualTo(atOnce.getNextLabelIndex());
        assertThat(RegionTreePrinter.print(region(atOnce.getBlockMap(), l(0)).getSubregion()))
                .isEqualTo(RegionTreePrinter.print(withoutHead(stepwise.getBlockMap())));
    }

    private static BlockMap withoutHead(BlockMap blocks) {
        BlockMap rest = blocks.copy();
        rest.removeNode(l(0));
        return rest;
    }

    @Test
    public void joinReturnsIsIdempotent() {
        List<Instruction> instructions = List.of(
                new Instruction("POP_JUMP_IF_TRUE", 0, false, 4),
                new Instruction("RETURN_VALUE", 2),
                new Instruction("RETURN_VALUE", 4, true, null));
        ByteFlow once = ByteFlow.fromInstructions(instructions).joinReturns();
        ByteFlow twice = once.joinReturns();

        assertThat(once.getBlockMap().getNode(l(2)).getJumpTargets()).containsExactly(c(0));
        assertThat(once.getBlockMap().getNode(l(4)).getJumpTargets()).containsExactly(c(0));
        assertThat(twice.getBlockMap().getGraph()).isEqualTo(once.getBlockMap().getGraph());
        assertThat(twice.getNextLabelIndex()).isEqualTo(once.getNextLabelIndex());
    }

    @Test
    public void singleEntryLoop() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioSingleEntryLoop()).restructure();
        BlockMap blocks = flow.getBlockMap();

        RegionBlock root = region(blocks, l(0));
        RegionBlock head = (RegionBlock) root.getHeaders().get(l(0));
        assertThat(head.getKind()).isEqualTo(RegionKind.HEAD);
        assertThat(head.getJumpTargets()).containsExactly(c(0), l(4)).inOrder();

        BlockMap top = root.getSubregion();
        assertThat(top.getLabels()).containsExactly(l(18), c(0), l(4));
        assertThat(region(top, l(18)).getKind()).isEqualTo(RegionKind.TAIL);
        RegionBlock arm = region(top, l(4));
        assertThat(arm.getKind()).isEqualTo(RegionKind.BRANCH);
        assertThat(arm.getJumpTargets()).containsExactly(l(18));
        assertThat(arm.getExit()).isEqualTo(l(8));
        assertThat(arm.getSubregion().getLabels()).containsExactly(l(4), l(8));
        assertThat(region(arm.getSubregion(), l(4)).getKind()).isEqualTo(RegionKind.LOOP);

        assertThat(leaves(blocks)).containsExactly(l(0), l(4), l(8), l(12), l(18), c(0));
        assertThat(flow.getNextLabelIndex()).isEqualTo(2);
        new VerifyRegionPass().verify(blocks);
    }

    @Test
    public void ifWithoutElseFollowedByAChain() {
        List<Instruction> instructions = List.of(
                new Instruction("LOAD_FAST", 0),
                new Instruction("POP_JUMP_IF_FALSE", 2, false, 6),
                new Instruction("LOAD_CONST", 4),
                new Instruction("JUMP_FORWARD", 6, true, 8),
                new Instruction("JUMP_FORWARD", 8, true, 10),
                new Instruction("RETURN_VALUE", 10, true, null));

        ByteFlow flow = ByteFlow.fromInstructions(instructions).restructure();
        BlockMap blocks = flow.getBlockMap();

        RegionBlock root = region(blocks, l(0));
        assertThat(root.getSubregion().getLabels()).containsExactly(c(0), l(4), l(6));
        RegionBlock tail = region(root.getSubregion(), l(6));
        assertThat(tail.getKind()).isEqualTo(RegionKind.TAIL);
        assertThat(tail.getSubregion().getLabels()).containsExactly(l(6), l(8), l(10));
        assertThat(region(root.getSubregion(), c(0)).getJumpTargets()).containsExactly(l(6));
        assertThat(leaves(blocks)).containsExactly(l(0), l(4), l(6), l(8), l(10), c(0));
        new VerifyRegionPass().verify(blocks);
    }

    @Test
    public void loopWithTwoEntriesIsUnsupported() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioB());

        RestructureException e = assertThrows(RestructureException.class, flow::restructure);
        assertThat(e.getKind()).isEqualTo(RestructureException.Kind.UNSUPPORTED);
    }

    @Test
    public void instructionsOfALeaf() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioA());

        List<Instruction> covered = flow.getInstructions(flow.getBlockMap().getNode(l(4)));

        assertThat(covered).hasSize(2);
        assertThat(covered.get(0).getOpname()).isEqualTo("LOAD_FAST");
        assertThat(covered.get(1).getOffset()).isEqualTo(6);
        assertThat(flow.getInstructions(new BasicBlock(c(0), c(1), false, List.of()))).isEmpty();
    }
}
