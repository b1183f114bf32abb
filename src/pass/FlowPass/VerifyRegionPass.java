package pass.FlowPass;

import exception.RestructureException;
import ir.BlockMap;
import ir.block.BasicBlock;
import ir.block.Block;
import ir.block.BlockVisitor;
import ir.block.RegionBlock;
import ir.label.Label;
import ir.label.LabelGenerator;
import pass.FlowPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Check the structural invariants of a (partially) restructured block map:
 * <ul>
 *   <li>every leaf appears exactly once in the region tree</li>
 *   <li>no node jumps to a label it records as a backedge</li>
 *   <li>a jump target is a node of the same level or of an enclosing level, unless no node of the tree
 *       carries that label at all (the jump leaves the code)</li>
 * </ul>
 * Region headers and subregions are kept disjoint by {@link RegionBlock} itself.
 */
public class VerifyRegionPass implements Pass.FlowPass {
    private static final Logger log = LoggingManager.getLogger(VerifyRegionPass.class);

    @Override
    public FlowPassType getType() {
        return FlowPassType.VerifyRegion;
    }

    @Override
    public BlockMap run(BlockMap blocks, LabelGenerator labels) {
        verify(blocks);
        log.debug("verified {} top level nodes", blocks.size());
        return blocks;
    }

    public void verify(BlockMap blocks) {
        Set<Label> allLabels = new HashSet<>();
        List<Label> leaves = new ArrayList<>();
        collect(blocks.getGraph(), allLabels, leaves);

        Set<Label> seen = new HashSet<>();
        for (Label leaf : leaves) {
            if (!seen.add(leaf)) {
                throw RestructureException.invariant("leaf " + leaf + " appears more than once");
            }
        }

        Deque<Map<Label, Block>> scopes = new ArrayDeque<>();
        checkLevel(blocks.getGraph(), scopes, allLabels);
    }

    private void collect(Map<Label, Block> level, Set<Label> allLabels, List<Label> leaves) {
        for (Block node : level.values()) {
            allLabels.add(node.getBegin());
            node.accept(new BlockVisitor<Void>() {
                @Override
                public Void visitBasicBlock(BasicBlock block) {
                    leaves.add(block.getBegin());
                    return null;
                }

                @Override
                public Void visitRegionBlock(RegionBlock region) {
                    collect(region.getFullGraph(), allLabels, leaves);
                    return null;
                }
            });
        }
    }

    private void checkLevel(Map<Label, Block> level, Deque<Map<Label, Block>> scopes, Set<Label> allLabels) {
        scopes.push(level);
        for (Map.Entry<Label, Block> entry : level.entrySet()) {
            Block node = entry.getValue();
            for (Label target : node.getJumpTargets()) {
                if (node.getBackedges().contains(target)) {
                    throw RestructureException.invariant(
                            "node " + entry.getKey() + " jumps to its backedge target " + target);
                }
                if (allLabels.contains(target) && !inScope(target, scopes)) {
                    throw RestructureException.invariant(
                            "node " + entry.getKey() + " jumps to " + target + " which is not visible from its level");
                }
            }
            if (node instanceof RegionBlock region) {
                checkLevel(region.getFullGraph(), scopes, allLabels);
            }
        }
        scopes.pop();
    }

    private static boolean inScope(Label target, Deque<Map<Label, Block>> scopes) {
        for (Map<Label, Block> scope : scopes) {
            if (scope.containsKey(target)) {
                return true;
            }
        }
        return false;
    }
}
