package pass.FlowPass.analysis;

import exception.RestructureException;
import ir.BlockMap;
import ir.label.Label;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Dominators and postdominators of one level of a block map.
 * <p>
 * Only edges between nodes of the map count. Dominators are seeded from the nodes without predecessors,
 * postdominators from the nodes without successors.
 */
public class DominanceAnalysis {
    private final Map<Label, Set<Label>> dominators;
    private final Map<Label, Set<Label>> postDominators;
    private final Map<Label, Label> immediateDominators;
    private final Map<Label, Label> immediatePostDominators;

    public DominanceAnalysis(BlockMap blocks) {
        this.dominators = dominators(blocks);
        this.postDominators = postDominators(blocks);
        this.immediateDominators = immediateDominators(dominators);
        this.immediatePostDominators = immediateDominators(postDominators);
    }

    public Map<Label, Set<Label>> getDominators() {
        return Collections.unmodifiableMap(dominators);
    }

    public Map<Label, Set<Label>> getPostDominators() {
        return Collections.unmodifiableMap(postDominators);
    }

    public Map<Label, Label> getImmediateDominators() {
        return Collections.unmodifiableMap(immediateDominators);
    }

    public Map<Label, Label> getImmediatePostDominators() {
        return Collections.unmodifiableMap(immediatePostDominators);
    }

    /**
     * @return true if every path from an entry to {@code b} passes through {@code a}
     */
    public boolean dominates(Label a, Label b) {
        Set<Label> doms = dominators.get(b);
        return doms != null && doms.contains(a);
    }

    public static Map<Label, Set<Label>> dominators(BlockMap blocks) {
        Map<Label, Set<Label>> preds = blocks.predecessors();
        Map<Label, Set<Label>> succs = blocks.successors();
        Set<Label> entries = new TreeSet<>();
        for (Map.Entry<Label, Set<Label>> entry : preds.entrySet()) {
            if (entry.getValue().isEmpty()) {
                entries.add(entry.getKey());
            }
        }
        return findDominators(entries, new ArrayList<>(blocks.getLabels()), preds, succs);
    }

    /**
     * Dominators of the reversed graph
     */
    public static Map<Label, Set<Label>> postDominators(BlockMap blocks) {
        Map<Label, Set<Label>> preds = blocks.predecessors();
        Map<Label, Set<Label>> succs = blocks.successors();
        Set<Label> entries = new TreeSet<>();
        for (Map.Entry<Label, Set<Label>> entry : succs.entrySet()) {
            if (entry.getValue().isEmpty()) {
                entries.add(entry.getKey());
            }
        }
        return findDominators(entries, new ArrayList<>(blocks.getLabels()), succs, preds);
    }

    /**
     * Worklist fixpoint: dom(n) = {n} + intersection of dom(p) over the predecessors p of n
     */
    static Map<Label, Set<Label>> findDominators(Set<Label> entries, List<Label> nodes,
                                                 Map<Label, Set<Label>> preds, Map<Label, Set<Label>> succs) {
        if (entries.isEmpty()) {
            throw RestructureException.precondition("no entry points: dominator algorithm cannot be seeded");
        }

        Map<Label, Set<Label>> doms = new TreeMap<>();
        Deque<Label> todo = new ArrayDeque<>();
        for (Label entry : entries) {
            doms.put(entry, new TreeSet<>(Set.of(entry)));
        }
        for (Label node : nodes) {
            if (!entries.contains(node)) {
                doms.put(node, new TreeSet<>(nodes));
                todo.push(node);
            }
        }

        while (!todo.isEmpty()) {
            Label node = todo.pop();
            if (entries.contains(node)) {
                continue;
            }
            Set<Label> newDoms = null;
            for (Label pred : preds.getOrDefault(node, Set.of())) {
                if (newDoms == null) {
                    newDoms = new TreeSet<>(doms.get(pred));
                } else {
                    newDoms.retainAll(doms.get(pred));
                }
            }
            if (newDoms == null) {
                newDoms = new TreeSet<>();
            }
            newDoms.add(node);

            if (!newDoms.equals(doms.get(node))) {
                doms.put(node, newDoms);
                for (Label succ : succs.getOrDefault(node, Set.of())) {
                    todo.push(succ);
                }
            }
        }
        return doms;
    }

    /**
     * Drop from every strict dominator set the strict dominators of its members; dominators form a chain,
     * so the one remaining candidate is the immediate dominator. Entries have none.
     */
    public static Map<Label, Label> immediateDominators(Map<Label, Set<Label>> doms) {
        Map<Label, Set<Label>> strictDoms = new TreeMap<>();
        for (Map.Entry<Label, Set<Label>> entry : doms.entrySet()) {
            Set<Label> strict = new TreeSet<>(entry.getValue());
            strict.remove(entry.getKey());
            strictDoms.put(entry.getKey(), strict);
        }

        // always subtract the full strict sets, never partially reduced ones
        Map<Label, Set<Label>> candidates = new TreeMap<>();
        for (Map.Entry<Label, Set<Label>> entry : strictDoms.entrySet()) {
            Set<Label> remaining = new TreeSet<>(entry.getValue());
            for (Label dom : entry.getValue()) {
                remaining.removeAll(strictDoms.getOrDefault(dom, Set.of()));
            }
            candidates.put(entry.getKey(), remaining);
        }

        Map<Label, Label> idoms = new TreeMap<>();
        for (Map.Entry<Label, Set<Label>> entry : candidates.entrySet()) {
            Set<Label> remaining = entry.getValue();
            if (remaining.size() > 1) {
                throw RestructureException.invariant(
                        "ambiguous immediate dominator of " + entry.getKey() + ": " + remaining);
            }
            if (!remaining.isEmpty()) {
                idoms.put(entry.getKey(), remaining.iterator().next());
            }
        }
        return idoms;
    }
}
