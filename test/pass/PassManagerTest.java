package pass;

import static com.google.common.truth.Truth.assertThat;
import static ir.FlowFixtures.l;
import static org.junit.Assert.assertThrows;

import driver.Config;
import exception.RestructureException;
import ir.ByteFlow;
import ir.FlowFixtures;
import ir.block.RegionBlock;
import java.util.ArrayList;
import java.util.List;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pass.FlowPass.VerifyRegionPass;
import pass.Pass.FlowPass;

@RunWith(JUnit4.class)
public final class PassManagerTest {

    @After
    public void tearDown() {
        System.clearProperty("scfg.passes");
        System.clearProperty("verify");
        Config.reload();
        PassManager.resetInstance();
    }

    private static List<FlowPassType> pipelineTypes() {
        List<FlowPassType> types = new ArrayList<>();
        for (FlowPass pass : PassManager.getInstance().getPipeline()) {
            types.add(pass.getType());
        }
        return types;
    }

    @Test
    public void defaultPipeline() {
        PassManager.resetInstance();

        assertThat(pipelineTypes()).containsExactly(FlowPassType.JoinReturns, FlowPassType.LoopRestructure,
                FlowPassType.BranchRestructure, FlowPassType.RootRegion).inOrder();
    }

    @Test
    public void passesSelectedByProperty() {
        System.setProperty("scfg.passes", "JoinReturns, looprestructure");
        PassManager.resetInstance();

        assertThat(pipelineTypes()).containsExactly(FlowPassType.JoinReturns, FlowPassType.LoopRestructure)
                .inOrder();
    }

    @Test
    public void runMatchesByteFlowRestructure() {
        System.setProperty("verify", "true");
        Config.reload();
        PassManager.resetInstance();
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioA());

        ByteFlow result = PassManager.getInstance().run(flow);

        assertThat(result.getBlockMap().getLabels()).containsExactly(l(0));
        assertThat(result.getBlockMap().getNode(l(0))).isInstanceOf(RegionBlock.class);
        assertThat(result.getNextLabelIndex()).isEqualTo(flow.restructure().getNextLabelIndex());
        assertThat(flow.getBlockMap().size()).isEqualTo(6);
    }

    @Test
    public void failingPassIsRethrown() {
        PassManager.resetInstance();
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioB());

        RestructureException e = assertThrows(RestructureException.class,
                () -> PassManager.getInstance().run(flow));
        assertThat(e.getKind()).isEqualTo(RestructureException.Kind.UNSUPPORTED);
    }

    @Test
    public void passNames() {
        assertThat(FlowPassType.BranchRestructure.getName()).isEqualTo("branchrestructure");
        assertThat(FlowPassType.VerifyRegion.create()).isInstanceOf(VerifyRegionPass.class);
    }
}
