package tju.edu.cn.cyclegraph.trace;

import java.util.Arrays;

/**
 * One line of an ordering script.
 */
public class ScriptCommand {

    public enum Kind {
        ACTION("action", 3, 4),
        PROMISE("promise", 1, Integer.MAX_VALUE),
        EDGE("edge", 2, 2),
        RMW("rmw", 2, 2),
        BEGIN("begin", 0, 0),
        COMMIT("commit", 0, 0),
        ROLLBACK("rollback", 0, 0),
        EXPECT_CYCLE("expect-cycle", 1, 1),
        EXPECT_REACH("expect-reach", 3, 3),
        EXPECT_ELIMINATE("expect-eliminate", 3, 3);

        public final String keyword;
        final int minArgs;
        final int maxArgs;

        Kind(String keyword, int minArgs, int maxArgs) {
            this.keyword = keyword;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }

        public static Kind fromKeyword(String keyword) {
            for (Kind k : values()) {
                if (k.keyword.equals(keyword)) return k;
            }
            return null;
        }
    }

    public final Kind kind;
    public final String[] args;
    public final int line;

    public ScriptCommand(Kind kind, String[] args, int line) {
        this.kind = kind;
        this.args = args;
        this.line = line;
    }

    public String arg(int i) {
        return args[i];
    }

    @Override
    public String toString() {
        return line + ": " + kind.keyword + " " + String.join(" ", Arrays.asList(args));
    }
}
