package pass.FlowPass;

import exception.RestructureException;
import ir.BlockMap;
import ir.block.BasicBlock;
import ir.block.Block;
import ir.block.RegionBlock;
import ir.block.RegionKind;
import ir.label.Label;
import ir.label.LabelGenerator;
import pass.FlowPassType;
import pass.Pass;
import pass.FlowPass.analysis.DominanceAnalysis;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Partition an acyclic level into a HEAD region, one BRANCH region per arm and a TAIL region.
 * <p>
 * A branch point is a node with several targets whose immediate postdominator is immediately dominated by
 * it. The head chain up to the branch point becomes the HEAD region, each arm (the nodes dominated by one
 * target and not by the join node) a BRANCH region with a single exit, and whatever is left a TAIL region
 * with a single entry. Arm and tail subregions are restructured afterwards, level by level.
 */
public class BranchRestructurePass implements Pass.FlowPass {
    private static final Logger log = LoggingManager.getLogger(BranchRestructurePass.class);

    @Override
    public FlowPassType getType() {
        return FlowPassType.BranchRestructure;
    }

    @Override
    public BlockMap run(BlockMap blocks, LabelGenerator labels) {
        restructureBranch(blocks, labels);
        return blocks;
    }

    private void restructureBranch(BlockMap blocks, LabelGenerator labels) {
        for (BlockMap subregion : restructureLevel(blocks, labels)) {
            restructureBranch(subregion, labels);
        }
    }

    /**
     * Restructure one level in place.
     *
     * @return the subregions created on this level, still to be restructured
     */
    List<BlockMap> restructureLevel(BlockMap blocks, LabelGenerator labels) {
        List<BlockMap> pending = new ArrayList<>();
        if (blocks.size() < 2) {
            return pending;
        }
        log.debug("restructure branches of {}", blocks.getLabels());

        DominanceAnalysis dom = new DominanceAnalysis(blocks);
        for (BranchPoint point : findBranchPoints(blocks, dom)) {
            // absorbed by a region built for an earlier branch point
            if (blocks.getGraph().get(point.begin) != point.node) {
                continue;
            }
            List<Label> chain = headChain(blocks, point.begin);
            if (chain == null) {
                log.debug("branch point {} not reachable by a straight head chain, skipped", point.begin);
                continue;
            }
            log.debug("branch region: {} -> {}", point.begin, point.end);
            restructureBranchPoint(blocks, labels, point, chain, pending);
        }
        return pending;
    }

    private void restructureBranchPoint(BlockMap blocks, LabelGenerator labels, BranchPoint point,
                                        List<Label> chain, List<BlockMap> pending) {
        Label begin = point.begin;
        Label end = point.end;

        List<Label> armStarts = fillEmptyArms(blocks, labels, begin);

        // head region: the chain down to the branch point
        Label head = chain.get(0);
        Map<Label, Block> headHeaders = new LinkedHashMap<>();
        BlockMap headSubregion = new BlockMap();
        for (Label label : chain) {
            Block node = blocks.removeNode(label);
            if (label.equals(head)) {
                headHeaders.put(label, node);
            } else {
                headSubregion.addNode(node);
            }
        }
        Block branchNode = nodeOf(headHeaders, headSubregion, begin);
        RegionBlock headRegion = new RegionBlock(begin, branchNode.getEnd(), false, branchNode.getJumpTargets(),
                List.of(), RegionKind.HEAD, headHeaders, headSubregion, null);
        blocks.addNode(headRegion);

        DominanceAnalysis dom = new DominanceAnalysis(blocks);

        // arms: the nodes dominated by the arm start but not by the join node
        Map<Label, Set<Label>> arms = new LinkedHashMap<>();
        for (Label armStart : armStarts) {
            Set<Label> armNodes = new TreeSet<>();
            for (Map.Entry<Label, Set<Label>> entry : dom.getDominators().entrySet()) {
                if (entry.getValue().contains(armStart) && !entry.getValue().contains(end)) {
                    armNodes.add(entry.getKey());
                }
            }
            arms.put(armStart, armNodes);
        }

        // tail: everything else
        Set<Label> tail = new TreeSet<>(blocks.getLabels());
        tail.remove(begin);
        for (Set<Label> armNodes : arms.values()) {
            tail.removeAll(armNodes);
        }
        extractTail(blocks, labels, tail, pending);

        for (Map.Entry<Label, Set<Label>> arm : arms.entrySet()) {
            if (!arm.getValue().isEmpty()) {
                extractArm(blocks, labels, arm.getKey(), arm.getValue(), end, pending);
            }
        }
    }

    private static Block nodeOf(Map<Label, Block> headers, BlockMap subregion, Label label) {
        Block node = headers.get(label);
        return node != null ? node : subregion.getNode(label);
    }

    /**
     * Replace every target of {@code begin} that another of its targets reaches by a filler node, so that no
     * arm is empty
     */
    private List<Label> fillEmptyArms(BlockMap blocks, LabelGenerator labels, Label begin) {
        Block branchNode = blocks.getNode(begin);
        List<Label> targets = branchNode.getJumpTargets();
        List<Label> newTargets = new ArrayList<>();
        for (Label b : targets) {
            boolean reached = false;
            for (Label a : targets) {
                if (!a.equals(b) && blocks.containsLabel(a) && blocks.isReachable(a, b)) {
                    reached = true;
                    break;
                }
            }
            if (reached) {
                Label filler = labels.next();
                blocks.addNode(new BasicBlock(filler, labels.next(), true, List.of(b)));
                newTargets.add(filler);
                log.debug("empty arm to {} filled with {}", b, filler);
            } else {
                newTargets.add(b);
            }
        }
        for (int i = 0; i < targets.size(); i++) {
            if (!targets.get(i).equals(newTargets.get(i))) {
                branchNode = branchNode.retarget(Set.of(targets.get(i)), newTargets.get(i));
            }
        }
        blocks.addNode(branchNode);
        return newTargets;
    }

    private void extractTail(BlockMap blocks, LabelGenerator labels, Set<Label> tail, List<BlockMap> pending) {
        BlockMap.HeadersAndEntries headersAndEntries = blocks.findHeadersAndEntries(tail);
        Set<Label> headers = headersAndEntries.getHeaders();
        Label entry;
        if (headers.size() > 1) {
            entry = blocks.joinHeaders(headers, headersAndEntries.getEntries(), labels);
            tail.add(entry);
        } else if (headers.size() == 1) {
            entry = headers.iterator().next();
        } else {
            throw RestructureException.invariant("tail " + tail + " is not entered from its level");
        }

        BlockMap.Exits exits = blocks.findExits(tail);
        if (exits.getPreExits().isEmpty()) {
            throw RestructureException.invariant("tail " + tail + " has no exit");
        }
        BlockMap subregion = takeNodes(blocks, tail);
        RegionBlock region = new RegionBlock(entry, exits.getPreExits().iterator().next(), false,
                new ArrayList<>(exits.getPostExits()), List.of(), RegionKind.TAIL, Map.of(), subregion, null);
        blocks.addNode(region);
        log.debug("extracted {}", region);
        pending.add(subregion);
    }

    private void extractArm(BlockMap blocks, LabelGenerator labels, Label armStart, Set<Label> armNodes,
                            Label end, List<BlockMap> pending) {
        BlockMap.Exits exits = blocks.findExits(armNodes);
        Set<Label> preExits = exits.getPreExits();
        Set<Label> postExits = exits.getPostExits();
        Label preExit;
        Label postExit;
        if (postExits.size() > 1) {
            BlockMap.ExitPair pair = blocks.joinExits(armNodes, postExits, labels);
            preExit = pair.getPreExit();
            postExit = pair.getPostExit();
        } else if (postExits.size() == 1 && preExits.size() > 1) {
            postExit = postExits.iterator().next();
            preExit = blocks.joinPreExits(preExits, postExit, armNodes, labels);
        } else if (postExits.size() == 1 && preExits.size() == 1) {
            preExit = preExits.iterator().next();
            postExit = postExits.iterator().next();
        } else {
            throw RestructureException.invariant("arm " + armStart + " has pre exits " + preExits
                    + " and post exits " + postExits);
        }

        BlockMap subregion = takeNodes(blocks, armNodes);
        RegionBlock region = new RegionBlock(armStart, end, false, List.of(postExit), List.of(),
                RegionKind.BRANCH, Map.of(), subregion, preExit);
        blocks.addNode(region);
        log.debug("extracted {}", region);
        pending.add(subregion);
    }

    /**
     * Move the given nodes into a new map, keeping their order
     */
    private static BlockMap takeNodes(BlockMap blocks, Set<Label> nodes) {
        BlockMap taken = new BlockMap();
        for (Label label : new ArrayList<>(blocks.getLabels())) {
            if (nodes.contains(label)) {
                taken.addNode(blocks.removeNode(label));
            }
        }
        return taken;
    }

    /**
     * @return the single-successor path from the level head to {@code begin}, or null when there is none
     */
    private static List<Label> headChain(BlockMap blocks, Label begin) {
        Set<Label> chain = new LinkedHashSet<>();
        Label current = blocks.findHead();
        while (true) {
            if (!chain.add(current)) {
                return null;
            }
            if (current.equals(begin)) {
                return new ArrayList<>(chain);
            }
            List<Label> targets = blocks.getNode(current).getJumpTargets();
            if (targets.size() != 1 || !blocks.containsLabel(targets.get(0))) {
                return null;
            }
            current = targets.get(0);
        }
    }

    /**
     * Branch points of the level, outermost first
     */
    static List<BranchPoint> findBranchPoints(BlockMap blocks, DominanceAnalysis dom) {
        Map<Label, Label> idoms = dom.getImmediateDominators();
        Map<Label, Label> ipdoms = dom.getImmediatePostDominators();
        List<BranchPoint> points = new ArrayList<>();
        for (Block node : blocks.getGraph().values()) {
            if (node.getJumpTargets().size() < 2) {
                continue;
            }
            Label begin = node.getBegin();
            Label end = ipdoms.get(begin);
            if (end != null && begin.equals(idoms.get(end))) {
                points.add(new BranchPoint(begin, end, node));
            }
        }
        Map<Label, Set<Label>> doms = dom.getDominators();
        points.sort(Comparator.<BranchPoint>comparingInt(p -> doms.get(p.begin).size())
                .thenComparing(p -> p.begin));
        return points;
    }

    static class BranchPoint {
        final Label begin;
        final Label end;
        final Block node;

        BranchPoint(Label begin, Label end, Block node) {
            this.begin = begin;
            this.end = end;
            this.node = node;
        }
    }
}
