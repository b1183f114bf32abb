package pass.FlowPass;

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
import java.util.List;
import java.util.Map;

/**
 * Wrap the top level into one HEAD region holding the level head, so that the flow has a single root
 */
public class RootRegionPass implements Pass.FlowPass {
    private static final Logger log = LoggingManager.getLogger(RootRegionPass.class);

    @Override
    public FlowPassType getType() {
        return FlowPassType.RootRegion;
    }

    @Override
    public BlockMap run(BlockMap blocks, LabelGenerator labels) {
        if (blocks.isEmpty()) {
            return blocks;
        }
        if (blocks.size() == 1 && blocks.getNode(blocks.findHead()) instanceof RegionBlock) {
            return blocks;
        }

        Label head = blocks.findHead();
        Block headNode = blocks.getNode(head);
        BlockMap rest = new BlockMap();
        for (Label label : new ArrayList<>(blocks.getLabels())) {
            if (!label.equals(head)) {
                rest.addNode(blocks.removeNode(label));
            }
        }
        blocks.removeNode(head);

        RegionBlock root = new RegionBlock(head, headNode.getEnd(), false, List.of(), List.of(),
                RegionKind.HEAD, Map.of(head, headNode), rest, null);
        blocks.addNode(root);
        log.debug("wrapped top level into {}", root);
        return blocks;
    }
}
