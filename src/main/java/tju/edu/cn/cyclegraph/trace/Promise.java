package tju.edu.cn.cyclegraph.trace;

/**
 * A deferred value commitment. The graph only asks whether a thread can no longer
 * satisfy it; implementations must answer without side effects.
 */
public interface Promise {

    boolean excludesThread(short tid);
}
