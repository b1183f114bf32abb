package pass;

import ir.BlockMap;
import ir.label.LabelGenerator;

public interface Pass {
    // just a mark class for future change

    /**
     * A stage of the restructuring pipeline working on one block map.
     * Passes may rewrite the map in place; the returned map is what the next pass sees.
     */
    public interface FlowPass extends Pass {
        FlowPassType getType();

        BlockMap run(BlockMap blocks, LabelGenerator labels);
    }
}
