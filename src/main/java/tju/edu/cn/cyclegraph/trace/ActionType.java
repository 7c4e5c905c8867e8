package tju.edu.cn.cyclegraph.trace;

public enum ActionType {
    READ,
    WRITE,
    RMW,
    FENCE,
    LOCK,
    UNLOCK,
    THREAD_START,
    THREAD_FINISH;

    public boolean isWrite() {
        return this == WRITE || this == RMW;
    }

    public boolean isRead() {
        return this == READ || this == RMW;
    }

    public static ActionType fromString(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        switch (type.toLowerCase()) {
            case "read":
            case "r":
                return READ;
            case "write":
            case "w":
                return WRITE;
            case "rmw":
                return RMW;
            case "fence":
                return FENCE;
            case "lock":
                return LOCK;
            case "unlock":
                return UNLOCK;
            case "start":
                return THREAD_START;
            case "finish":
                return THREAD_FINISH;
            default:
                throw new IllegalArgumentException("Unknown action type: " + type);
        }
    }
}
