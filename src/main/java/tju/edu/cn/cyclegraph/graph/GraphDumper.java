package tju.edu.cn.cyclegraph.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tju.edu.cn.cyclegraph.trace.Promise;
import tju.edu.cn.cyclegraph.trace.ThreadPromise;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes a {@link CycleGraph} in Graphviz dot format. Ordering edges are solid,
 * RMW links dashed.
 */
public class GraphDumper {

    private static final Logger LOG = LoggerFactory.getLogger(GraphDumper.class);

    public static void dump(CycleGraph graph, Writer out) {
        PrintWriter pw = new PrintWriter(out);
        pw.println("digraph cyclegraph {");
        for (CycleNode node : graph.getNodes()) {
            pw.println("  N" + node.index + " [label=\"" + label(node) + "\"];");
        }
        for (CycleNode node : graph.getNodes()) {
            for (CycleNode next : node.getEdges()) {
                pw.println("  N" + node.index + " -> N" + next.index + ";");
            }
            CycleNode rmw = node.getRMW();
            if (rmw != null) {
                pw.println("  N" + node.index + " -> N" + rmw.index + " [style=dashed];");
            }
        }
        pw.println("}");
        pw.flush();
    }

    public static void dumpToFile(CycleGraph graph, File file) throws IOException {
        try (FileWriter fw = new FileWriter(file, StandardCharsets.UTF_8)) {
            dump(graph, fw);
        }
        LOG.info("graph with {} nodes written to {}", graph.nodeCount(), file);
    }

    private static String label(CycleNode node) {
        if (node.isAction()) {
            return "T" + node.getAction().tid + " #" + node.getAction().seq;
        }
        Promise promise = node.getPromise();
        if (promise instanceof ThreadPromise) {
            return "P " + escape(((ThreadPromise) promise).name);
        }
        return "P N" + node.index;
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
