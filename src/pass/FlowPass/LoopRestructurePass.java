package pass.FlowPass;

import exception.RestructureException;
import ir.BlockMap;
import ir.block.Block;
import ir.block.RegionBlock;
import ir.block.RegionKind;
import ir.label.Label;
import ir.label.LabelGenerator;
import pass.FlowPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extract every loop (strongly connected component with a cycle) into a LOOP region.
 * <p>
 * A loop must have exactly one header. Its exits are unified into one pre-exit inside the loop and one
 * post-exit after it; jumps back to the header become backedges. Loop bodies are processed recursively,
 * so nested loops end up as nested regions.
 */
public class LoopRestructurePass implements Pass.FlowPass {
    private static final Logger log = LoggingManager.getLogger(LoopRestructurePass.class);

    @Override
    public FlowPassType getType() {
        return FlowPassType.LoopRestructure;
    }

    @Override
    public BlockMap run(BlockMap blocks, LabelGenerator labels) {
        if (blocks.isEmpty()) {
            return blocks;
        }
        // the lowest label is where the code starts
        Label start = Collections.min(blocks.getLabels());
        restructureLoops(blocks, labels, Set.of(start));
        return blocks;
    }

    /**
     * @param levelEntries labels control enters this level through; they are headers of any loop containing them
     */
    public void restructureLoops(BlockMap blocks, LabelGenerator labels, Set<Label> levelEntries) {
        List<Set<Label>> loops = new ArrayList<>();
        for (Set<Label> scc : blocks.computeScc()) {
            if (isLoop(blocks, scc)) {
                loops.add(scc);
            }
        }
        log.debug("found {} loops in {}", loops.size(), blocks.getLabels());

        for (Set<Label> scc : loops) {
            extractLoop(blocks, labels, new TreeSet<>(scc), levelEntries);
        }
    }

    private boolean isLoop(BlockMap blocks, Set<Label> scc) {
        if (scc.size() > 1) {
            return true;
        }
        Label only = scc.iterator().next();
        return blocks.getNode(only).getJumpTargets().contains(only);
    }

    private void extractLoop(BlockMap blocks, LabelGenerator labels, Set<Label> loop, Set<Label> levelEntries) {
        log.debug("loop nodes {}", loop);

        BlockMap.HeadersAndEntries headersAndEntries = blocks.findHeadersAndEntries(loop);
        Set<Label> headers = new TreeSet<>(headersAndEntries.getHeaders());
        for (Label entry : levelEntries) {
            if (loop.contains(entry)) {
                headers.add(entry);
            }
        }
        if (headers.size() != 1) {
            throw RestructureException.unSupported("loop " + loop + " has " + headers.size()
                    + " headers " + headers + ", entered from " + headersAndEntries.getEntries());
        }
        Label loopHead = headers.iterator().next();

        BlockMap.Exits exits = blocks.findExits(loop);
        log.debug("loop header {}, pre exits {}, post exits {}", loopHead, exits.getPreExits(), exits.getPostExits());
        Label preExit;
        Label postExit;
        if (exits.getPostExits().size() != 1) {
            BlockMap.ExitPair pair = blocks.joinExits(loop, exits.getPostExits(), labels);
            preExit = pair.getPreExit();
            postExit = pair.getPostExit();
        } else if (exits.getPreExits().size() != 1) {
            throw RestructureException.invariant("loop " + loop + " leaves to " + exits.getPostExits()
                    + " from several nodes " + exits.getPreExits());
        } else {
            preExit = exits.getPreExits().iterator().next();
            postExit = exits.getPostExits().iterator().next();
        }

        // pull the loop out of the map, keeping map order for the body
        Map<Label, Block> headerNodes = new LinkedHashMap<>();
        BlockMap body = new BlockMap();
        for (Label label : new ArrayList<>(blocks.getLabels())) {
            if (!loop.contains(label)) {
                continue;
            }
            Block node = blocks.removeNode(label).replaceBackedge(loopHead);
            if (label.equals(loopHead)) {
                headerNodes.put(label, node);
            } else {
                body.addNode(node);
            }
        }

        // nested loops are entered through the header's targets
        Set<Label> bodyEntries = new TreeSet<>(headerNodes.get(loopHead).getJumpTargets());
        bodyEntries.retainAll(body.getLabels());
        restructureLoops(body, labels, bodyEntries);

        RegionBlock region = new RegionBlock(loopHead, headerNodes.get(loopHead).getEnd(), false,
                List.of(postExit), List.of(), RegionKind.LOOP, headerNodes, body, preExit);
        blocks.addNode(region);
        log.debug("extracted {}", region);
    }
}
