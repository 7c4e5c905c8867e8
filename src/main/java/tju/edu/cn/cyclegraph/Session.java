package tju.edu.cn.cyclegraph;


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tju.edu.cn.cyclegraph.config.Configuration;
import tju.edu.cn.cyclegraph.graph.Checkpoint;
import tju.edu.cn.cyclegraph.graph.CycleGraph;
import tju.edu.cn.cyclegraph.graph.GraphDumper;
import tju.edu.cn.cyclegraph.trace.ActionType;
import tju.edu.cn.cyclegraph.trace.ModelAction;
import tju.edu.cn.cyclegraph.trace.ScriptCommand;
import tju.edu.cn.cyclegraph.trace.ScriptLoader;
import tju.edu.cn.cyclegraph.trace.ThreadPromise;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * Replays an ordering script against a {@link CycleGraph} and checks its expectations.
 */
public class Session {
    protected static final Logger LOG = LoggerFactory.getLogger(Session.class);

    public final Configuration config;
    public final CycleGraph graph;

    private final Map<String, ModelAction> actions = new HashMap<>();
    private final Map<String, ThreadPromise> promises = new HashMap<>();

    private Checkpoint checkpoint;

    protected int executed;
    protected int failures;

    public Session(Configuration c) {
        config = c;
        graph = new CycleGraph(c.init_nodes, c.rmwPolicy);
    }

    public void start() throws IOException {
        if (config.scriptFile == null) {
            throw new IllegalStateException("No script given");
        }
        List<ScriptCommand> commands = ScriptLoader.load(new File(config.scriptFile));
        execute(commands);
        printStats();
        if (config.dotFile != null) {
            GraphDumper.dumpToFile(graph, new File(config.dotFile));
        }
    }

    public void execute(List<ScriptCommand> commands) {
        for (ScriptCommand cmd : commands) {
            execute(cmd);
            executed++;
        }
    }

    private void execute(ScriptCommand cmd) {
        switch (cmd.kind) {
            case ACTION: {
                ActionType type = cmd.args.length > 3 ? ActionType.fromString(cmd.arg(3)) : ActionType.WRITE;
                ModelAction action = new ModelAction(Short.parseShort(cmd.arg(1)), Long.parseLong(cmd.arg(2)), type);
                if (actions.putIfAbsent(cmd.arg(0), action) != null) {
                    throw new IllegalArgumentException(cmd + ": action already defined");
                }
                break;
            }
            case PROMISE: {
                ThreadPromise promise = new ThreadPromise(cmd.arg(0));
                for (int i = 1; i < cmd.args.length; i++) {
                    promise.eliminateThread(Short.parseShort(cmd.arg(i)));
                }
                if (promises.putIfAbsent(cmd.arg(0), promise) != null) {
                    throw new IllegalArgumentException(cmd + ": promise already defined");
                }
                break;
            }
            case EDGE:
                addEdge(cmd);
                break;
            case RMW:
                graph.addRMWEdge(action(cmd, 0), action(cmd, 1));
                break;
            case BEGIN:
                checkpoint = graph.startTransaction();
                break;
            case COMMIT:
                graph.commit();
                checkpoint = null;
                break;
            case ROLLBACK:
                if (checkpoint != null) graph.rollback(checkpoint);
                else graph.rollback();
                checkpoint = null;
                break;
            case EXPECT_CYCLE:
                expect(cmd, Boolean.parseBoolean(cmd.arg(0)), graph.hasCycles());
                break;
            case EXPECT_REACH:
                expect(cmd, Boolean.parseBoolean(cmd.arg(2)), reachable(cmd));
                break;
            case EXPECT_ELIMINATE:
                expect(cmd, Boolean.parseBoolean(cmd.arg(2)), graph.canEliminate(action(cmd, 0), promise(cmd, 1)));
                break;
            default:
                throw new IllegalArgumentException("Unsupported command " + cmd);
        }
    }

    private void addEdge(ScriptCommand cmd) {
        String from = cmd.arg(0);
        String to = cmd.arg(1);
        if (promises.containsKey(from)) {
            graph.addEdge(promise(cmd, 0), action(cmd, 1));
        } else if (promises.containsKey(to)) {
            graph.addEdge(action(cmd, 0), promise(cmd, 1));
        } else {
            graph.addEdge(action(cmd, 0), action(cmd, 1));
        }
    }

    private boolean reachable(ScriptCommand cmd) {
        if (promises.containsKey(cmd.arg(0))) {
            return graph.reachable(promise(cmd, 0), action(cmd, 1));
        }
        if (promises.containsKey(cmd.arg(1))) {
            return graph.reachable(action(cmd, 0), promise(cmd, 1));
        }
        return graph.reachableFromAction(action(cmd, 0), action(cmd, 1));
    }

    private void expect(ScriptCommand cmd, boolean expected, boolean actual) {
        if (expected != actual) {
            failures++;
            LOG.warn("line {}: expected {} but was {} ({})", cmd.line, expected, actual, cmd);
        }
    }

    private ModelAction action(ScriptCommand cmd, int i) {
        ModelAction action = actions.get(cmd.arg(i));
        if (action == null) {
            throw new IllegalArgumentException(cmd + ": unknown action '" + cmd.arg(i) + "'");
        }
        return action;
    }

    private ThreadPromise promise(ScriptCommand cmd, int i) {
        ThreadPromise promise = promises.get(cmd.arg(i));
        if (promise == null) {
            throw new IllegalArgumentException(cmd + ": unknown promise '" + cmd.arg(i) + "'");
        }
        return promise;
    }

    public int getExecuted() {
        return executed;
    }

    public int getFailures() {
        return failures;
    }

    public ModelAction getAction(String name) {
        return actions.get(name);
    }

    public void printStats() {
        System.out.println("Commands: " + executed);
        System.out.println("Failed Expectations: " + failures);
        System.out.println("Nodes: " + graph.nodeCount());
        System.out.println("Edges: " + graph.edgeCount());
        System.out.println("Uncommitted Edges: " + graph.pendingEdgeCount());
        System.out.println("Has Cycles: " + graph.hasCycles());
    }
}
