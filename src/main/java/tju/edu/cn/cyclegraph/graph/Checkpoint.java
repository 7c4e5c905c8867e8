package tju.edu.cn.cyclegraph.graph;

/**
 * The committed state a transaction started from, as returned by
 * {@link CycleGraph#startTransaction()}.
 */
public final class Checkpoint {

    final long serial;
    private final boolean committedCycles;

    Checkpoint(long serial, boolean committedCycles) {
        this.serial = serial;
        this.committedCycles = committedCycles;
    }

    /**
     * The cycle flag rollback will restore.
     */
    public boolean committedCycles() {
        return committedCycles;
    }

    @Override
    public String toString() {
        return "Checkpoint{" +
                "serial=" + serial +
                ", committedCycles=" + committedCycles +
                '}';
    }
}
