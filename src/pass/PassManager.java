package pass;

import driver.Config;
import exception.RestructureException;
import ir.BlockMap;
import ir.ByteFlow;
import ir.label.LabelGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import pass.Pass.FlowPass;
import util.LoggingManager;
import util.logging.Logger;

public class PassManager {
    private final List<FlowPass> pipeline = new ArrayList<>();

    private final Set<String> enabled;
    private final boolean verify;

    private Logger log = LoggingManager.getLogger(PassManager.class);

    private static PassManager INSTANCE = null;

    public static PassManager getInstance() {
        if (INSTANCE == null) {
            INSTANCE = new PassManager();
        }
        return INSTANCE;
    }

    private PassManager() {
        // read the system property
        // eg: -Dscfg.passes=joinreturns,looprestructure
        enabled = loadEnabled("scfg.passes");
        verify = Config.getInstance().isVerify;

        setPipeline(
                FlowPassType.JoinReturns,
                FlowPassType.LoopRestructure,
                FlowPassType.BranchRestructure,
                FlowPassType.RootRegion);
    }

    /**
     * Reset the singleton instance (used for testing different configurations)
     */
    public static void resetInstance() {
        INSTANCE = null;
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    public List<FlowPass> getPipeline() {
        return Collections.unmodifiableList(pipeline);
    }

    /**
     * Run the pipeline on a copy of the flow's block map
     *
     * @return a new flow holding the result; {@code flow} is left untouched
     */
    public ByteFlow run(ByteFlow flow) {
        BlockMap blocks = flow.getBlockMap().copy();
        LabelGenerator labels = new LabelGenerator(flow.getNextLabelIndex());
        FlowPass verifier = verify ? FlowPassType.VerifyRegion.create() : null;

        for (FlowPass p : pipeline) {
            String name = p.getType().getName();
            log.debug("[flow] {}", name);
            try {
                blocks = p.run(blocks, labels);
                if (verifier != null) {
                    verifier.run(blocks, labels);
                }
            } catch (RestructureException e) {
                log.error("pass {} failed: {}", name, e.getMessage());
                throw e;
            }
            log.trace("after {}: {}", name, blocks);
        }
        return flow.withBlockMap(blocks, labels.peek());
    }

    /**
     * 按顺序整体设置 pipeline（会清空重建）
     */
    private void setPipeline(FlowPassType... types) {
        pipeline.clear();
        for (FlowPassType type : types) {
            if (enabled.isEmpty() || enabled.contains(type.getName())) {
                pipeline.add(type.create());
            }
        }
    }
}
