package tju.edu.cn.cyclegraph;

public class CycleCheck {

    public static final int INITSZ_S = 128;
    public static final int INITSZ_L = 1024;

    // edges per node start small, most actions have one or two successors
    public static final int INITSZ_EDGES = 4;

    public static final String CONFIG_FILE = "cyclegraph.properties";

    private CycleCheck() {
    }
}
