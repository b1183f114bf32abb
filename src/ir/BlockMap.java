package ir;

import exception.RestructureException;
import ir.block.BasicBlock;
import ir.block.Block;
import ir.label.Label;
import ir.label.LabelGenerator;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Map of labels to nodes: a control flow graph, or one nested level of it.
 * <p>
 * Edges are plain labels. A jump target that is not a key of this map leaves the level and is ignored by
 * every graph query here.
 */
public class BlockMap {
    private static final Logger log = LoggingManager.getLogger(BlockMap.class);

    private final Map<Label, Block> graph;

    public BlockMap() {
        this.graph = new LinkedHashMap<>();
    }

    public BlockMap(Collection<? extends Block> blocks) {
        this();
        for (Block block : blocks) {
            addNode(block);
        }
    }

    /* basic accessors */

    /**
     * Insert or overwrite a node under its begin label
     */
    public void addNode(Block block) {
        graph.put(block.getBegin(), block);
    }

    public Block getNode(Label label) {
        Block block = graph.get(label);
        if (block == null) {
            throw RestructureException.invariant("no node " + label + " in " + graph.keySet());
        }
        return block;
    }

    public Block removeNode(Label label) {
        Block block = graph.remove(label);
        if (block == null) {
            throw RestructureException.invariant("cannot remove missing node " + label);
        }
        return block;
    }

    public boolean containsLabel(Label label) {
        return graph.containsKey(label);
    }

    public Set<Label> getLabels() {
        return Collections.unmodifiableSet(graph.keySet());
    }

    public Map<Label, Block> getGraph() {
        return Collections.unmodifiableMap(graph);
    }

    public int size() {
        return graph.size();
    }

    public boolean isEmpty() {
        return graph.isEmpty();
    }

    /**
     * Deep copy: the result shares no nested block map with this one
     */
    public BlockMap copy() {
        BlockMap copy = new BlockMap();
        for (Block block : graph.values()) {
            copy.addNode(block.copy());
        }
        return copy;
    }

    /* graph queries */

    /**
     * @return the unique node that no node of this map jumps to
     */
    public Label findHead() {
        Set<Label> heads = new TreeSet<>(graph.keySet());
        for (Block block : graph.values()) {
            heads.removeAll(block.getJumpTargets());
        }
        if (heads.size() != 1) {
            throw RestructureException.precondition("expected exactly one head, found " + heads
                    + " in " + graph.keySet());
        }
        return heads.iterator().next();
    }

    /**
     * In-map predecessors of every node
     */
    public Map<Label, Set<Label>> predecessors() {
        Map<Label, Set<Label>> preds = new LinkedHashMap<>();
        for (Label label : graph.keySet()) {
            preds.put(label, new LinkedHashSet<>());
        }
        for (Block block : graph.values()) {
            for (Label target : block.getJumpTargets()) {
                if (graph.containsKey(target)) {
                    preds.get(target).add(block.getBegin());
                }
            }
        }
        return preds;
    }

    /**
     * In-map successors of every node, in jump target order
     */
    public Map<Label, Set<Label>> successors() {
        Map<Label, Set<Label>> succs = new LinkedHashMap<>();
        for (Block block : graph.values()) {
            Set<Label> targets = new LinkedHashSet<>();
            for (Label target : block.getJumpTargets()) {
                if (graph.containsKey(target)) {
                    targets.add(target);
                }
            }
            succs.put(block.getBegin(), targets);
        }
        return succs;
    }

    /**
     * Strongly connected components over the in-map jump target edges (Tarjan).
     * Components are returned in reverse topological order.
     */
    public List<Set<Label>> computeScc() {
        Map<Label, Set<Label>> succs = successors();
        Map<Label, Integer> index = new HashMap<>();
        Map<Label, Integer> lowlink = new HashMap<>();
        Set<Label> onStack = new HashSet<>();
        Deque<Label> stack = new ArrayDeque<>();
        List<Set<Label>> components = new ArrayList<>();
        int[] indexCounter = {0};

        for (Label label : graph.keySet()) {
            if (!index.containsKey(label)) {
                strongConnect(label, succs, index, lowlink, onStack, stack, indexCounter, components);
            }
        }
        return components;
    }

    private void strongConnect(Label node, Map<Label, Set<Label>> succs, Map<Label, Integer> index,
                               Map<Label, Integer> lowlink, Set<Label> onStack, Deque<Label> stack,
                               int[] indexCounter, List<Set<Label>> components) {
        index.put(node, indexCounter[0]);
        lowlink.put(node, indexCounter[0]);
        indexCounter[0]++;
        stack.push(node);
        onStack.add(node);

        for (Label succ : succs.get(node)) {
            if (!index.containsKey(succ)) {
                strongConnect(succ, succs, index, lowlink, onStack, stack, indexCounter, components);
                lowlink.put(node, Math.min(lowlink.get(node), lowlink.get(succ)));
            } else if (onStack.contains(succ)) {
                lowlink.put(node, Math.min(lowlink.get(node), index.get(succ)));
            }
        }

        // root of a component
        if (lowlink.get(node).equals(index.get(node))) {
            Set<Label> scc = new TreeSet<>();
            Label w;
            do {
                w = stack.pop();
                onStack.remove(w);
                scc.add(w);
            } while (!w.equals(node));
            components.add(scc);
        }
    }

    /**
     * Headers are nodes of {@code subset} jumped to from outside of it; entries are the outside nodes jumping in.
     */
    public HeadersAndEntries findHeadersAndEntries(Set<Label> subset) {
        Set<Label> headers = new TreeSet<>();
        Set<Label> entries = new TreeSet<>();
        for (Block block : graph.values()) {
            if (subset.contains(block.getBegin())) {
                continue;
            }
            for (Label target : block.getJumpTargets()) {
                if (subset.contains(target)) {
                    headers.add(target);
                    entries.add(block.getBegin());
                }
            }
        }
        return new HeadersAndEntries(headers, entries);
    }

    /**
     * Pre-exits are nodes of {@code subset} that jump out of it or terminate; post-exits are the outside targets.
     */
    public Exits findExits(Set<Label> subset) {
        Set<Label> preExits = new TreeSet<>();
        Set<Label> postExits = new TreeSet<>();
        for (Label inside : subset) {
            Block block = getNode(inside);
            for (Label target : block.getJumpTargets()) {
                if (!subset.contains(target)) {
                    preExits.add(inside);
                    postExits.add(target);
                }
            }
            if (block.isExiting()) {
                preExits.add(inside);
            }
        }
        return new Exits(preExits, postExits);
    }

    /**
     * Is {@code end} reachable from {@code begin} in one or more steps
     */
    public boolean isReachable(Label begin, Label end) {
        Set<Label> seen = new HashSet<>();
        Deque<Label> toVisit = new ArrayDeque<>(getNode(begin).getJumpTargets());
        while (!toVisit.isEmpty()) {
            Label label = toVisit.pop();
            if (label.equals(end)) {
                return true;
            }
            if (!seen.add(label)) {
                continue;
            }
            Block block = graph.get(label);
            if (block != null) {
                toVisit.addAll(block.getJumpTargets());
            }
        }
        return false;
    }

    /* exit and entry unification */

    /**
     * Close the graph: when several nodes terminate, route all of them to one new terminating node.
     *
     * @return the label of the new return node, or null when the exit was already unique
     */
    public Label joinReturns(LabelGenerator labels) {
        List<Label> returnNodes = new ArrayList<>();
        for (Block block : graph.values()) {
            if (block.isExiting()) {
                returnNodes.add(block.getBegin());
            }
        }
        if (returnNodes.size() <= 1) {
            return null;
        }

        Label returnLabel = labels.next();
        addNode(new BasicBlock(returnLabel, labels.next(), false, List.of()));
        for (Label returnNode : returnNodes) {
            addNode(graph.get(returnNode).withJumpTargets(List.of(returnLabel)));
        }
        log.debug("joined returns {} into {}", returnNodes, returnLabel);
        return returnLabel;
    }

    /**
     * Route every edge from {@code subset} to one of {@code exits} through a new pre-exit node (added to
     * {@code subset}) followed by a new post-exit node fanning out to the original exits.
     */
    public ExitPair joinExits(Set<Label> subset, Set<Label> exits, LabelGenerator labels) {
        Label preExit = labels.next();
        Label postExit = labels.next();

        Label postExitEnd = labels.next();
        Label preExitEnd = labels.next();
        addNode(new BasicBlock(preExit, preExitEnd, false, List.of(postExit)));
        addNode(new BasicBlock(postExit, postExitEnd, false, new ArrayList<>(exits)));

        for (Label inside : new ArrayList<>(subset)) {
            Block block = getNode(inside);
            if (block.getJumpTargets().stream().anyMatch(exits::contains)) {
                addNode(block.retarget(exits, preExit));
            }
        }
        subset.add(preExit);
        log.debug("joined exits {} through {} -> {}", exits, preExit, postExit);
        return new ExitPair(preExit, postExit);
    }

    /**
     * Route the edges of {@code preExits} to {@code postExit} through one new pre-exit node (added to
     * {@code subset}).
     */
    public Label joinPreExits(Set<Label> preExits, Label postExit, Set<Label> subset, LabelGenerator labels) {
        Label preExit = labels.next();
        addNode(new BasicBlock(preExit, labels.next(), false, List.of(postExit)));
        subset.add(preExit);

        for (Label exiting : preExits) {
            Block block = getNode(exiting);
            addNode(block.isExiting()
                    ? block.withJumpTargets(List.of(preExit))
                    : block.retarget(Set.of(postExit), preExit));
        }
        log.debug("joined pre-exits {} into {} -> {}", preExits, preExit, postExit);
        return preExit;
    }

    /**
     * Give a multi-header subset one synthetic entry node that fans out to every header; entries jump to it.
     */
    public Label joinHeaders(Set<Label> headers, Set<Label> entries, LabelGenerator labels) {
        if (headers.size() < 2) {
            throw RestructureException.invariant("nothing to join, headers " + headers);
        }
        Label entry = labels.next();
        addNode(new BasicBlock(entry, labels.next(), false, new ArrayList<>(headers)));

        for (Label source : entries) {
            Block block = getNode(source);
            addNode(block.retarget(headers, entry));
        }
        log.debug("joined headers {} into {}", headers, entry);
        return entry;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BlockMap{");
        boolean first = true;
        for (Block block : graph.values()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(block);
            first = false;
        }
        return sb.append("}").toString();
    }

    /**
     * Result of {@link #findHeadersAndEntries(Set)}
     */
    public static class HeadersAndEntries {
        private final Set<Label> headers;
        private final Set<Label> entries;

        HeadersAndEntries(Set<Label> headers, Set<Label> entries) {
            this.headers = headers;
            this.entries = entries;
        }

        public Set<Label> getHeaders() {
            return headers;
        }

        public Set<Label> getEntries() {
            return entries;
        }
    }

    /**
     * Result of {@link #findExits(Set)}
     */
    public static class Exits {
        private final Set<Label> preExits;
        private final Set<Label> postExits;

        Exits(Set<Label> preExits, Set<Label> postExits) {
            this.preExits = preExits;
            this.postExits = postExits;
        }

        public Set<Label> getPreExits() {
            return preExits;
        }

        public Set<Label> getPostExits() {
            return postExits;
        }
    }

    /**
     * Unified (pre-exit, post-exit) pair of a region
     */
    public static class ExitPair {
        private final Label preExit;
        private final Label postExit;

        public ExitPair(Label preExit, Label postExit) {
            this.preExit = preExit;
            this.postExit = postExit;
        }

        public Label getPreExit() {
            return preExit;
        }

        public Label getPostExit() {
            return postExit;
        }
    }
}
