package tju.edu.cn.cyclegraph.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tju.edu.cn.cyclegraph.CycleCheck;
import tju.edu.cn.cyclegraph.trace.ModelAction;
import tju.edu.cn.cyclegraph.trace.Promise;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordering constraints between actions (and promises), with incremental cycle
 * detection and an undo log.
 * <p>
 * An edge {@code from -> to} means {@code from} is ordered before {@code to}. Once an
 * insertion closes a cycle, or a second RMW reads from the same write, {@link #hasCycles()}
 * stays true until {@link #rollback()} restores the value of the last {@link #commit()}.
 * <p>
 * Every edge and RMW link added since the last commit is logged, so rollback costs time
 * proportional to the work done in the discarded transaction.
 * <p>
 * Not thread safe; a graph has a single owner.
 */
public class CycleGraph {

    private static final Logger LOG = LoggerFactory.getLogger(CycleGraph.class);

    private static final int NONE = -1;

    private final Reference2IntOpenHashMap<ModelAction> actionToNode;
    private final Reference2IntOpenHashMap<Promise> promiseToNode;
    private final ObjectArrayList<CycleNode> nodes;

    private final ReachEngine reachEngine;
    private final RmwRollbackPolicy rmwPolicy;

    private boolean hasCycles;
    private boolean committedCycles;

    // handles of nodes whose last edge gets popped on rollback, oldest first
    private final IntArrayList edgeLog = new IntArrayList(CycleCheck.INITSZ_S);

    // handles of nodes whose rmw link was set, paired with the link they had before
    private final IntArrayList rmwLog = new IntArrayList(CycleCheck.INITSZ_S);
    private final IntArrayList rmwPriorLog = new IntArrayList(CycleCheck.INITSZ_S);

    private int edgeCount;
    private long serial;

    public CycleGraph() {
        this(CycleCheck.INITSZ_L, RmwRollbackPolicy.RESTORE);
    }

    public CycleGraph(RmwRollbackPolicy rmwPolicy) {
        this(CycleCheck.INITSZ_L, rmwPolicy);
    }

    public CycleGraph(int expectedNodes, RmwRollbackPolicy rmwPolicy) {
        this.rmwPolicy = Objects.requireNonNull(rmwPolicy, "rmwPolicy");
        actionToNode = new Reference2IntOpenHashMap<>(expectedNodes);
        actionToNode.defaultReturnValue(NONE);
        promiseToNode = new Reference2IntOpenHashMap<>(CycleCheck.INITSZ_S);
        promiseToNode.defaultReturnValue(NONE);
        nodes = new ObjectArrayList<>(expectedNodes);
        reachEngine = new ReachEngine(expectedNodes);
    }

    CycleNode getNode(ModelAction action) {
        Objects.requireNonNull(action, "action");
        int idx = actionToNode.getInt(action);
        if (idx != NONE) {
            return nodes.get(idx);
        }
        CycleNode node = new CycleNode(nodes.size(), action);
        nodes.add(node);
        actionToNode.put(action, node.index);
        return node;
    }

    CycleNode getNode(Promise promise) {
        Objects.requireNonNull(promise, "promise");
        int idx = promiseToNode.getInt(promise);
        if (idx != NONE) {
            return nodes.get(idx);
        }
        CycleNode node = new CycleNode(nodes.size(), promise);
        nodes.add(node);
        promiseToNode.put(promise, node.index);
        return node;
    }

    private CycleNode findNode(ModelAction action) {
        int idx = actionToNode.getInt(action);
        return idx == NONE ? null : nodes.get(idx);
    }

    private CycleNode findNode(Promise promise) {
        int idx = promiseToNode.getInt(promise);
        return idx == NONE ? null : nodes.get(idx);
    }

    /**
     * Orders {@code from} before {@code to}.
     *
     * @return true if the edge {@code from -> to} was not present before
     */
    public boolean addEdge(ModelAction from, ModelAction to) {
        return addNodeEdge(getNode(from), getNode(to));
    }

    public boolean addEdge(ModelAction from, Promise to) {
        return addNodeEdge(getNode(from), getNode(to));
    }

    public boolean addEdge(Promise from, ModelAction to) {
        return addNodeEdge(getNode(from), getNode(to));
    }

    private boolean addNodeEdge(CycleNode fromNode, CycleNode toNode) {
        boolean added = checkAndInsert(fromNode, toNode);

        // an rmw sits right after the write it reads from, so it inherits the ordering
        CycleNode rmwNode = fromNode.getRMW();
        if (rmwNode != null && rmwNode != toNode) {
            checkAndInsert(rmwNode, toNode);
        }
        return added;
    }

    private boolean checkAndInsert(CycleNode fromNode, CycleNode toNode) {
        if (!hasCycles && reachEngine.reachable(toNode, fromNode)) {
            hasCycles = true;
            LOG.debug("edge {} -> {} closes a cycle", fromNode, toNode);
        }
        return insertEdge(fromNode, toNode);
    }

    private boolean insertEdge(CycleNode fromNode, CycleNode toNode) {
        if (!fromNode.addEdge(toNode)) {
            return false;
        }
        edgeLog.add(fromNode.index);
        edgeCount++;
        if (LOG.isTraceEnabled()) {
            LOG.trace("added edge {} -> {}", fromNode, toNode);
        }
        return true;
    }

    /**
     * Records that {@code rmw} reads from {@code from}. The rmw node takes over every
     * edge {@code from} currently has, then {@code from} is ordered before it.
     * <p>
     * The rmw node is expected to have no outgoing edges yet, or {@code from} no incoming
     * ones; edge transfer is not checked for cycles.
     */
    public void addRMWEdge(ModelAction from, ModelAction rmw) {
        CycleNode fromNode = getNode(from);
        CycleNode rmwNode = getNode(rmw);

        CycleNode prior = fromNode.getRMW();
        if (fromNode.setRMW(rmwNode)) {
            // two rmws cannot read from the same write
            hasCycles = true;
            LOG.debug("{} already read by {}, now also by {}", fromNode, prior, rmwNode);
            if (rmwPolicy == RmwRollbackPolicy.RESTORE) {
                logRmw(fromNode, prior.index);
            }
        } else {
            logRmw(fromNode, NONE);
        }

        ObjectArrayList<CycleNode> edges = fromNode.edgeList();
        int n = edges.size();
        for (int i = 0; i < n; i++) {
            CycleNode toNode = edges.get(i);
            if (toNode != rmwNode) {
                insertEdge(rmwNode, toNode);
            }
        }

        addNodeEdge(fromNode, rmwNode);
    }

    private void logRmw(CycleNode node, int prior) {
        rmwLog.add(node.index);
        rmwPriorLog.add(prior);
    }

    /**
     * @return true if {@code to} is ordered after {@code from}; false if either was never added
     */
    public boolean reachableFromAction(ModelAction from, ModelAction to) {
        CycleNode fromNode = findNode(from);
        CycleNode toNode = findNode(to);
        if (fromNode == null || toNode == null) {
            return false;
        }
        return reachEngine.reachable(fromNode, toNode);
    }

    public boolean reachable(ModelAction from, Promise to) {
        CycleNode fromNode = findNode(from);
        CycleNode toNode = findNode(to);
        if (fromNode == null || toNode == null) {
            return false;
        }
        return reachEngine.reachable(fromNode, toNode);
    }

    public boolean reachable(Promise from, ModelAction to) {
        CycleNode fromNode = findNode(from);
        CycleNode toNode = findNode(to);
        if (fromNode == null || toNode == null) {
            return false;
        }
        return reachEngine.reachable(fromNode, toNode);
    }

    /**
     * Checks whether an action ordered after {@code from} (or {@code from} itself) runs on a
     * thread the promise has ruled out. If so the promise cannot be met along this ordering.
     * Promise nodes are traversed but never tested.
     */
    public boolean canEliminate(ModelAction from, Promise promise) {
        Objects.requireNonNull(promise, "promise");
        CycleNode fromNode = findNode(from);
        if (fromNode == null) {
            return false;
        }
        return reachEngine.anyReachable(fromNode,
                node -> node.isAction() && promise.excludesThread(node.getAction().tid));
    }

    public boolean hasCycles() {
        return hasCycles;
    }

    /**
     * @return true if nothing was added since the last commit or rollback
     */
    public boolean isClean() {
        return edgeLog.isEmpty() && rmwLog.isEmpty() && hasCycles == committedCycles;
    }

    /**
     * Marks the start of a transaction. The graph must be clean.
     *
     * @throws IllegalStateException if there are uncommitted changes
     */
    public Checkpoint startTransaction() {
        if (!isClean()) {
            throw new IllegalStateException("Uncommitted changes: " + edgeLog.size() + " edges, "
                    + rmwLog.size() + " rmw links, hasCycles=" + hasCycles + ", committed=" + committedCycles);
        }
        return new Checkpoint(serial, committedCycles);
    }

    /**
     * Keeps every change since the last commit.
     */
    public void commit() {
        LOG.debug("commit {} edges, {} rmw links, hasCycles={}", edgeLog.size(), rmwLog.size(), hasCycles);
        edgeLog.clear();
        rmwLog.clear();
        rmwPriorLog.clear();
        committedCycles = hasCycles;
        serial++;
    }

    /**
     * Undoes every change since the last commit.
     */
    public void rollback() {
        LOG.debug("rollback {} edges, {} rmw links", edgeLog.size(), rmwLog.size());
        for (int i = edgeLog.size() - 1; i >= 0; i--) {
            nodes.get(edgeLog.getInt(i)).removeLastEdge();
            edgeCount--;
        }
        for (int i = rmwLog.size() - 1; i >= 0; i--) {
            CycleNode node = nodes.get(rmwLog.getInt(i));
            int prior = rmwPriorLog.getInt(i);
            if (prior == NONE) {
                node.clearRMW();
            } else {
                node.setRMW(nodes.get(prior));
            }
        }
        hasCycles = committedCycles;
        edgeLog.clear();
        rmwLog.clear();
        rmwPriorLog.clear();
        serial++;
    }

    /**
     * Undoes every change since {@code checkpoint} was taken.
     *
     * @throws IllegalStateException if a commit or rollback happened since
     */
    public void rollback(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint");
        if (checkpoint.serial != serial) {
            throw new IllegalStateException("Stale " + checkpoint + ", current serial " + serial);
        }
        rollback();
    }

    /**
     * @return the rmw currently reading from {@code write}, or null
     */
    public ModelAction getRMW(ModelAction write) {
        CycleNode node = findNode(write);
        if (node == null || node.getRMW() == null) {
            return null;
        }
        return node.getRMW().getAction();
    }

    /**
     * Actions ordered directly after {@code action}, in insertion order.
     */
    public List<ModelAction> successors(ModelAction action) {
        CycleNode node = findNode(action);
        if (node == null) {
            return new ArrayList<>(0);
        }
        List<ModelAction> ls = new ArrayList<>(node.getNumEdges());
        for (CycleNode next : node.getEdges()) {
            if (next.isAction()) {
                ls.add(next.getAction());
            }
        }
        return ls;
    }

    public ObjectList<CycleNode> getNodes() {
        return ObjectLists.unmodifiable(nodes);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public int pendingEdgeCount() {
        return edgeLog.size();
    }

    public int pendingRmwCount() {
        return rmwLog.size();
    }

    public RmwRollbackPolicy getRmwPolicy() {
        return rmwPolicy;
    }
}
