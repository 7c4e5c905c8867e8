package tju.edu.cn.cyclegraph.graph;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import tju.edu.cn.cyclegraph.CycleCheck;
import tju.edu.cn.cyclegraph.trace.ModelAction;
import tju.edu.cn.cyclegraph.trace.Promise;

/**
 * A vertex of the {@link CycleGraph}, wrapping exactly one action or promise.
 * <p>
 * {@code edges} and {@code backEdges} are kept as exact inverses: {@code n} is in
 * {@code a.edges} iff {@code a} is in {@code n.backEdges}. Both lists keep insertion
 * order so the most recent edge can be popped on rollback.
 * <p>
 * Nodes are only mutated by their graph, which logs every change; outside the
 * package they are read-only.
 */
public class CycleNode {

    // handle into the owning graph's node table
    public final int index;

    private final ModelAction action;
    private final Promise promise;

    private final ObjectArrayList<CycleNode> edges = new ObjectArrayList<>(CycleCheck.INITSZ_EDGES);
    private final ObjectArrayList<CycleNode> backEdges = new ObjectArrayList<>(CycleCheck.INITSZ_EDGES);

    private CycleNode rmw;

    CycleNode(int index, ModelAction action) {
        if (action == null) {
            throw new NullPointerException("action");
        }
        this.index = index;
        this.action = action;
        this.promise = null;
    }

    CycleNode(int index, Promise promise) {
        if (promise == null) {
            throw new NullPointerException("promise");
        }
        this.index = index;
        this.action = null;
        this.promise = promise;
    }

    public ModelAction getAction() {
        return action;
    }

    public Promise getPromise() {
        return promise;
    }

    public boolean isAction() {
        return action != null;
    }

    /**
     * Adds an edge to {@code node}.
     *
     * @return false if the edge already existed, in which case nothing changes
     */
    boolean addEdge(CycleNode node) {
        if (edges.contains(node)) {
            return false;
        }
        edges.add(node);
        node.backEdges.add(this);
        return true;
    }

    /**
     * Pops the most recently added outgoing edge and drops the matching back edge.
     *
     * @return the former target, or null if there are no edges
     */
    CycleNode removeLastEdge() {
        if (edges.isEmpty()) {
            return null;
        }
        CycleNode to = edges.remove(edges.size() - 1);
        removeLast(to.backEdges, this);
        return to;
    }

    /**
     * Pops the most recently added incoming edge and drops the matching forward edge.
     *
     * @return the former source, or null if there are no back edges
     */
    CycleNode removeLastBackEdge() {
        if (backEdges.isEmpty()) {
            return null;
        }
        CycleNode from = backEdges.remove(backEdges.size() - 1);
        removeLast(from.edges, this);
        return from;
    }

    private static void removeLast(ObjectArrayList<CycleNode> list, CycleNode node) {
        // under rollback the match is the tail, so this scan is O(1) in practice
        for (int i = list.size() - 1; i >= 0; i--) {
            if (list.get(i) == node) {
                list.remove(i);
                return;
            }
        }
        throw new IllegalStateException("Inverse edge missing for " + node);
    }

    public ObjectList<CycleNode> getEdges() {
        return ObjectLists.unmodifiable(edges);
    }

    ObjectArrayList<CycleNode> edgeList() {
        return edges;
    }

    public ObjectList<CycleNode> getBackEdges() {
        return ObjectLists.unmodifiable(backEdges);
    }

    public int getNumEdges() {
        return edges.size();
    }

    public int getNumBackEdges() {
        return backEdges.size();
    }

    public boolean hasEdgeTo(CycleNode node) {
        return edges.contains(node);
    }

    public CycleNode getRMW() {
        return rmw;
    }

    /**
     * Sets the RMW reader of this node, overwriting any previous one.
     *
     * @return true if a reader was already set
     */
    boolean setRMW(CycleNode node) {
        CycleNode old = rmw;
        rmw = node;
        return old != null;
    }

    void clearRMW() {
        rmw = null;
    }

    @Override
    public String toString() {
        if (action != null) {
            return "N" + index + " [" + action + "]";
        }
        return "N" + index + " [" + promise + "]";
    }
}
