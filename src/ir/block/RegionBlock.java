package ir.block;

import exception.RestructureException;
import ir.BlockMap;
import ir.label.Label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Composite node wrapping a nested block map.
 * <p>
 * The header nodes are kept outside of the subregion; {@link #getFullGraph()} merges both for consumers
 * that walk one level without caring about the split.
 */
public final class RegionBlock extends Block {
    private final RegionKind kind;
    private final Map<Label, Block> headers;
    private final BlockMap subregion;
    private final Label exit;

    /**
     * @param exit the node inside the region the outgoing edge is drawn from, may be null
     */
    public RegionBlock(Label begin, Label end, boolean fallthrough, List<Label> jumpTargets, List<Label> backedges,
                       RegionKind kind, Map<Label, Block> headers, BlockMap subregion, Label exit) {
        super(begin, end, fallthrough, jumpTargets, backedges);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.subregion = Objects.requireNonNull(subregion, "subregion");
        this.exit = exit;
        for (Label header : this.headers.keySet()) {
            if (subregion.containsLabel(header)) {
                throw RestructureException.invariant(
                        kind.getName() + " region " + begin + " has header " + header + " inside its subregion");
            }
        }
    }

    public RegionKind getKind() {
        return kind;
    }

    public Map<Label, Block> getHeaders() {
        return headers;
    }

    public BlockMap getSubregion() {
        return subregion;
    }

    /**
     * @return the exit node label, or null when the region has none
     */
    public Label getExit() {
        return exit;
    }

    /**
     * Headers followed by the subregion nodes, as one read-only view
     */
    public Map<Label, Block> getFullGraph() {
        Map<Label, Block> graph = new LinkedHashMap<>(headers);
        graph.putAll(subregion.getGraph());
        return Collections.unmodifiableMap(graph);
    }

    @Override
    public <T> T accept(BlockVisitor<T> visitor) {
        return visitor.visitRegionBlock(this);
    }

    @Override
    public RegionBlock withJumpTargets(List<Label> targets) {
        return new RegionBlock(begin, end, fallthrough, targets, backedges, kind, headers, subregion, exit);
    }

    @Override
    public RegionBlock replaceBackedge(Label header) {
        if (!jumpTargets.contains(header)) {
            return this;
        }
        return new RegionBlock(begin, end, fallthrough, targetsWithout(header), backedgesWith(header),
                kind, headers, subregion, exit);
    }

    /**
     * Retargets the region and, in place, every nested node leaving the region through {@code from}
     */
    @Override
    public RegionBlock retarget(Set<Label> from, Label to) {
        Map<Label, Block> newHeaders = new LinkedHashMap<>();
        for (Map.Entry<Label, Block> entry : headers.entrySet()) {
            newHeaders.put(entry.getKey(), entry.getValue().retarget(from, to));
        }
        for (Block node : new ArrayList<>(subregion.getGraph().values())) {
            subregion.addNode(node.retarget(from, to));
        }
        return new RegionBlock(begin, end, fallthrough, targetsRetargeted(from, to), backedges,
                kind, newHeaders, subregion, exit);
    }

    @Override
    public RegionBlock copy() {
        Map<Label, Block> headerCopies = new LinkedHashMap<>();
        for (Map.Entry<Label, Block> entry : headers.entrySet()) {
            headerCopies.put(entry.getKey(), entry.getValue().copy());
        }
        return new RegionBlock(begin, end, fallthrough, jumpTargets, backedges,
                kind, headerCopies, subregion.copy(), exit);
    }

    @Override
    public String toString() {
        return "RegionBlock{" + kind.getName() + " " + begin
                + ", headers=" + headers.keySet()
                + ", subregion=" + subregion.getLabels()
                + ", targets=" + jumpTargets
                + (exit == null ? "" : ", exit=" + exit) + "}";
    }
}
