package tju.edu.cn.cyclegraph.trace;

/**
 * A recorded memory action. Immutable once created.
 * <p>
 * Equality is identity: two actions with the same thread and sequence number are
 * still distinct vertices when they are distinct objects.
 */
public class ModelAction {

    public final short tid;

    // position in the global execution order
    public final long seq;

    public final ActionType type;

    public ModelAction(short tid, long seq, ActionType type) {
        if (type == null) {
            throw new NullPointerException("type");
        }
        this.tid = tid;
        this.seq = seq;
        this.type = type;
    }

    public ModelAction(short tid, long seq) {
        this(tid, seq, ActionType.WRITE);
    }

    public short getTid() {
        return tid;
    }

    public long getSeq() {
        return seq;
    }

    public ActionType getType() {
        return type;
    }

    @Override
    public String toString() {
        return "seq: " + seq + " #" + tid + " " + type;
    }
}
