package pass;

import java.util.function.Supplier;
import pass.FlowPass.BranchRestructurePass;
import pass.FlowPass.JoinReturnsPass;
import pass.FlowPass.LoopRestructurePass;
import pass.FlowPass.RootRegionPass;
import pass.FlowPass.VerifyRegionPass;
import pass.Pass.FlowPass;

/**
 * FlowPassFactory: create the FlowPass here
 */
public enum FlowPassType implements PassType<FlowPass> {
    JoinReturns(JoinReturnsPass::new),
    LoopRestructure(LoopRestructurePass::new),
    BranchRestructure(BranchRestructurePass::new),
    RootRegion(RootRegionPass::new),

    VerifyRegion(VerifyRegionPass::new);

    private final Supplier<FlowPass> constructor;

    FlowPassType(Supplier<FlowPass> constructor) {
        this.constructor = constructor;
    }

    @Override
    public Supplier<FlowPass> constructor() {
        return constructor;
    }
}
