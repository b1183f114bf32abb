package pass.FlowPass;

import ir.BlockMap;
import ir.label.Label;
import ir.label.LabelGenerator;
import pass.FlowPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Close the graph: give it a single terminating node
 */
public class JoinReturnsPass implements Pass.FlowPass {
    private static final Logger log = LoggingManager.getLogger(JoinReturnsPass.class);

    @Override
    public FlowPassType getType() {
        return FlowPassType.JoinReturns;
    }

    @Override
    public BlockMap run(BlockMap blocks, LabelGenerator labels) {
        Label returnLabel = blocks.joinReturns(labels);
        if (returnLabel == null) {
            log.debug("graph already closed");
        }
        return blocks;
    }
}
