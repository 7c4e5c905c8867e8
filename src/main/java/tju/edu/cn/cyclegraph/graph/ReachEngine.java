package tju.edu.cn.cyclegraph.graph;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import tju.edu.cn.cyclegraph.CycleCheck;

import java.util.function.Predicate;

/**
 * Breadth-first search over the outgoing edges of {@link CycleNode}s.
 * <p>
 * The visited set and the work queue are scratch buffers owned by the engine and
 * cleared at the start of every query, so an engine must not be shared between
 * two callers running at the same time.
 */
public class ReachEngine {

    private final IntOpenHashSet discovered;
    private final ObjectArrayList<CycleNode> queue;

    public ReachEngine() {
        this(CycleCheck.INITSZ_S);
    }

    public ReachEngine(int expected) {
        discovered = new IntOpenHashSet(expected);
        queue = new ObjectArrayList<>(expected);
    }

    /**
     * @return true if {@code to} is reachable from {@code from}; a node always reaches itself
     */
    public boolean reachable(CycleNode from, CycleNode to) {
        return anyReachable(from, node -> node == to);
    }

    /**
     * Evaluates {@code predicate} on {@code from} and every node reachable from it, in
     * breadth-first order, stopping at the first match.
     */
    public boolean anyReachable(CycleNode from, Predicate<CycleNode> predicate) {
        reset();
        queue.add(from);
        discovered.add(from.index);
        int head = 0;
        while (head < queue.size()) {
            CycleNode node = queue.get(head++);
            if (predicate.test(node)) {
                return true;
            }
            ObjectArrayList<CycleNode> edges = node.edgeList();
            for (int i = 0; i < edges.size(); i++) {
                CycleNode next = edges.get(i);
                if (discovered.add(next.index)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    /**
     * Number of nodes discovered by the last query.
     */
    public int lastVisitedCount() {
        return discovered.size();
    }

    private void reset() {
        discovered.clear();
        queue.clear();
    }
}
