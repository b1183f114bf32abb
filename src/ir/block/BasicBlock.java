package ir.block;

import ir.label.Label;

import java.util.List;
import java.util.Set;

/**
 * Leaf node: a straight-line range of instructions [begin, end)
 */
public final class BasicBlock extends Block {

    public BasicBlock(Label begin, Label end, boolean fallthrough, List<Label> jumpTargets, List<Label> backedges) {
        super(begin, end, fallthrough, jumpTargets, backedges);
    }

    public BasicBlock(Label begin, Label end, boolean fallthrough, List<Label> jumpTargets) {
        this(begin, end, fallthrough, jumpTargets, List.of());
    }

    @Override
    public <T> T accept(BlockVisitor<T> visitor) {
        return visitor.visitBasicBlock(this);
    }

    @Override
    public BasicBlock withJumpTargets(List<Label> targets) {
        return new BasicBlock(begin, end, fallthrough, targets, backedges);
    }

    @Override
    public BasicBlock replaceBackedge(Label header) {
        if (!jumpTargets.contains(header)) {
            return this;
        }
        return new BasicBlock(begin, end, fallthrough, targetsWithout(header), backedgesWith(header));
    }

    @Override
    public BasicBlock retarget(Set<Label> from, Label to) {
        return withJumpTargets(targetsRetargeted(from, to));
    }

    @Override
    public BasicBlock copy() {
        // immutable
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BasicBlock other)) return false;
        return begin.equals(other.begin) && end.equals(other.end)
                && fallthrough == other.fallthrough
                && jumpTargets.equals(other.jumpTargets)
                && backedges.equals(other.backedges);
    }

    @Override
    public int hashCode() {
        return begin.hashCode() * 31 + jumpTargets.hashCode();
    }

    @Override
    public String toString() {
        return "BasicBlock{" + begin + ".." + end
                + (fallthrough ? ", fallthrough" : "")
                + ", targets=" + jumpTargets
                + (backedges.isEmpty() ? "" : ", backedges=" + backedges) + "}";
    }
}
