package tju.edu.cn.cyclegraph.trace;

import it.unimi.dsi.fastutil.shorts.ShortOpenHashSet;

/**
 * Promise that tracks the set of threads already ruled out from satisfying it.
 */
public class ThreadPromise implements Promise {

    public final String name;

    private final ShortOpenHashSet eliminated = new ShortOpenHashSet(8);

    public ThreadPromise(String name) {
        this.name = name;
    }

    /**
     * @return true if the thread was not eliminated before
     */
    public boolean eliminateThread(short tid) {
        return eliminated.add(tid);
    }

    @Override
    public boolean excludesThread(short tid) {
        return eliminated.contains(tid);
    }

    public int eliminatedCount() {
        return eliminated.size();
    }

    @Override
    public String toString() {
        return "ThreadPromise{" +
                "name='" + name + '\'' +
                ", eliminated=" + eliminated +
                '}';
    }
}
