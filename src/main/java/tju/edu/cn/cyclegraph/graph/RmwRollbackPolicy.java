package tju.edu.cn.cyclegraph.graph;

/**
 * What rollback does with an RMW link that overwrote an earlier reader of the same write.
 */
public enum RmwRollbackPolicy {
    /**
     * The earlier reader is logged and restored, so rollback undoes every mutation.
     */
    RESTORE,
    /**
     * The overwrite is not logged and survives rollback, although the cycle flag it
     * raised is reset with the rest of the transaction.
     */
    LEGACY;

    public static RmwRollbackPolicy fromString(String policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy cannot be null");
        }
        switch (policy.toLowerCase()) {
            case "restore":
                return RESTORE;
            case "legacy":
                return LEGACY;
            default:
                throw new IllegalArgumentException("Unknown rmw policy: " + policy);
        }
    }
}
