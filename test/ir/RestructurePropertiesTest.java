package ir;

import static com.google.common.truth.Truth.assertWithMessage;

import ir.block.RegionKind;
import ir.label.Label;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pass.FlowPass.VerifyRegionPass;
import pass.FlowPass.analysis.DominanceAnalysis;

@RunWith(JUnit4.class)
public final class RestructurePropertiesTest {
    private static final int PROGRAMS = 300;
    private static final int MAX_DEPTH = 3;

    @Test
    public void restructureCoversEveryBlockOnce() {
        for (long seed = 0; seed < PROGRAMS; seed++) {
            StructuredPrograms.Program program = StructuredPrograms.generate(seed, MAX_DEPTH);
            ByteFlow initial = ByteFlow.fromInstructions(program.getInstructions());

            BlockMap blocks = initial.restructure().getBlockMap();

            assertWithMessage("top level of program %s", seed).that(blocks.size()).isEqualTo(1);
            List<Label> leaves = FlowFixtures.leaves(blocks);
            assertWithMessage("leaves of program %s", seed).that(leaves).containsNoDuplicates();
            List<Label> offsets = new ArrayList<>();
            for (Label leaf : leaves) {
                if (!leaf.isSynthetic()) {
                    offsets.add(leaf);
                }
            }
            assertWithMessage("offset leaves of program %s", seed)
                    .that(offsets).containsExactlyElementsIn(initial.getBlockMap().getLabels());
            assertWithMessage("loops of program %s", seed)
                    .that(FlowFixtures.regions(blocks, RegionKind.LOOP)).hasSize(program.getLoops());
            new VerifyRegionPass().verify(blocks);
        }
    }

    @Test
    public void dominatorsSolveTheirEquations() {
        for (long seed = 0; seed < PROGRAMS; seed++) {
            BlockMap blocks = ByteFlow.fromInstructions(
                    StructuredPrograms.generate(seed, MAX_DEPTH).getInstructions()).getBlockMap();
            DominanceAnalysis dom = new DominanceAnalysis(blocks);

            checkEquation(seed, "dominators", dom.getDominators(), dom.getImmediateDominators(),
                    blocks.predecessors());
            checkEquation(seed, "postdominators", dom.getPostDominators(), dom.getImmediatePostDominators(),
                    blocks.successors());
        }
    }

    /**
     * dom(n) = {n} + the intersection of dom(p) over the predecessors p, and dom(n) - {n} = dom(idom(n))
     */
    private static void checkEquation(long seed, String what, Map<Label, Set<Label>> doms,
                                      Map<Label, Label> idoms, Map<Label, Set<Label>> preds) {
        for (Map.Entry<Label, Set<Label>> entry : preds.entrySet()) {
            Label node = entry.getKey();
            Set<Label> expected = null;
            for (Label pred : entry.getValue()) {
                if (expected == null) {
                    expected = new TreeSet<>(doms.get(pred));
                } else {
                    expected.retainAll(doms.get(pred));
                }
            }
            if (expected == null) {
                expected = new TreeSet<>();
            }
            expected.add(node);
            assertWithMessage("%s of %s in program %s", what, node, seed)
                    .that(doms.get(node)).containsExactlyElementsIn(expected);

            Set<Label> strict = new TreeSet<>(doms.get(node));
            strict.remove(node);
            if (strict.isEmpty()) {
                assertWithMessage("immediate %s of %s in program %s", what, node, seed)
                        .that(idoms).doesNotContainKey(node);
            } else {
                assertWithMessage("immediate %s of %s in program %s", what, node, seed)
                        .that(doms.get(idoms.get(node))).containsExactlyElementsIn(strict);
            }
        }
    }
}
