package ir.block;

import ir.label.Label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Node of a block map: either a {@link BasicBlock} or a {@link RegionBlock}.
 * The constructor is package private, so these two are the only cases a {@link BlockVisitor} has to handle.
 */
public abstract class Block {
    protected final Label begin;
    protected final Label end;
    protected final boolean fallthrough;
    protected final List<Label> jumpTargets;
    protected final List<Label> backedges;

    Block(Label begin, Label end, boolean fallthrough, List<Label> jumpTargets, List<Label> backedges) {
        this.begin = Objects.requireNonNull(begin, "begin");
        this.end = Objects.requireNonNull(end, "end");
        this.fallthrough = fallthrough;
        this.jumpTargets = Collections.unmodifiableList(new ArrayList<>(jumpTargets));
        this.backedges = Collections.unmodifiableList(new ArrayList<>(backedges));
    }

    /** inclusive start */
    public Label getBegin() {
        return begin;
    }

    /** exclusive end */
    public Label getEnd() {
        return end;
    }

    public boolean isFallthrough() {
        return fallthrough;
    }

    public List<Label> getJumpTargets() {
        return jumpTargets;
    }

    public List<Label> getBackedges() {
        return backedges;
    }

    /**
     * @return true for a terminating node, i.e. one without jump targets
     */
    public boolean isExiting() {
        return jumpTargets.isEmpty();
    }

    public abstract <T> T accept(BlockVisitor<T> visitor);

    /**
     * @return a copy of this node with the given jump targets
     */
    public abstract Block withJumpTargets(List<Label> targets);

    /**
     * @return a copy of this node whose jump to {@code header} is recorded as a backedge instead
     */
    public abstract Block replaceBackedge(Label header);

    /**
     * @return this node with every jump to one of {@code from} sent to {@code to} instead, duplicates dropped
     */
    public abstract Block retarget(Set<Label> from, Label to);

    /**
     * @return a copy that shares no mutable state with this node
     */
    public abstract Block copy();

    /**
     * Targets after moving {@code header} out of the jump targets
     */
    protected List<Label> targetsWithout(Label header) {
        List<Label> remaining = new ArrayList<>(jumpTargets);
        remaining.remove(header);
        return remaining;
    }

    protected List<Label> targetsRetargeted(Set<Label> from, Label to) {
        Set<Label> result = new LinkedHashSet<>();
        for (Label target : jumpTargets) {
            result.add(from.contains(target) ? to : target);
        }
        return new ArrayList<>(result);
    }

    protected List<Label> backedgesWith(Label header) {
        List<Label> updated = new ArrayList<>(backedges);
        if (!updated.contains(header)) {
            updated.add(header);
        }
        return updated;
    }
}
