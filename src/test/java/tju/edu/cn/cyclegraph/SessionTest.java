package tju.edu.cn.cyclegraph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import tju.edu.cn.cyclegraph.config.Configuration;
import tju.edu.cn.cyclegraph.graph.RmwRollbackPolicy;
import tju.edu.cn.cyclegraph.trace.ScriptCommand;
import tju.edu.cn.cyclegraph.trace.ScriptLoader;

public class SessionTest {
    private static List<ScriptCommand> script(String text) throws IOException {
        return ScriptLoader.parse(new StringReader(text), "test");
    }

    private static Session session(String... args) {
        return new Session(new Configuration(args));
    }

    @Test
    public void replaysChainAndCycle() throws IOException {
        Session s = session();

        s.execute(script("action x 1 0\naction y 2 1\naction z 3 2\n"
                + "edge x y\nedge y z\n"
                + "expect-reach x z true\nexpect-cycle false\n"
                + "edge z x\nexpect-cycle true\n"));

        assertThat(s.getFailures(), is(0));
        assertThat(s.getExecuted(), is(9));
        assertThat(s.graph.hasCycles(), is(true));
    }

    @Test
    public void countsFailedExpectations() throws IOException {
        Session s = session();

        s.execute(script("action a 1 0\naction b 2 1\nedge a b\n"
                + "expect-reach b a true\nexpect-cycle true\nexpect-reach a b true\n"));

        assertThat(s.getFailures(), is(2));
    }

    @Test
    public void replaysTransactionsAndRmw() throws IOException {
        Session s = session();

        s.execute(script("action w 1 0 write\naction v 2 1 read\naction r 3 2 rmw\n"
                + "edge w v\ncommit\n"
                + "begin\nrmw w r\nexpect-reach r v true\nrollback\n"
                + "expect-reach r v false\nexpect-reach w v true\n"
                + "begin\nedge w r\nexpect-reach w r true\nrollback\nexpect-reach w r false\n"));

        assertThat(s.getFailures(), is(0));
        assertThat(s.graph.isClean(), is(true));
    }

    @Test
    public void replaysPromiseElimination() throws IOException {
        Session s = session();

        s.execute(script("action a 1 0\naction b 2 1\npromise p 2\npromise q 7\n"
                + "edge a b\nedge b p\n"
                + "expect-eliminate a p true\nexpect-eliminate a q false\nexpect-reach a p true\n"));

        assertThat(s.getFailures(), is(0));
        assertThat(s.graph.nodeCount(), is(3));
    }

    @Test
    public void legacyPolicyFromConfiguration() throws IOException {
        Session s = session("-rmw_policy", "legacy");

        s.execute(script("action w 1 0\naction r1 2 1\naction r2 3 2\n"
                + "rmw w r1\ncommit\nrmw w r2\nexpect-cycle true\nrollback\nexpect-cycle false\n"));

        assertThat(s.getFailures(), is(0));
        assertThat(s.graph.getRmwPolicy(), is(RmwRollbackPolicy.LEGACY));
        assertThat(s.graph.getRMW(s.getAction("w")), is(s.getAction("r2")));
    }

    @Test
    public void rejectsUnknownNamesAndRedefinitions() throws IOException {
        Session s = session();

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> s.execute(script("action a 1 0\nedge a ghost\n")));
        assertThat(thrown.getMessage(), containsString("ghost"));

        assertThrows(IllegalArgumentException.class,
                () -> session().execute(script("action a 1 0\naction a 2 1\n")));
    }

    @Test
    public void beginWhileDirtyFails() throws IOException {
        Session s = session();

        assertThrows(IllegalStateException.class,
                () -> s.execute(script("action a 1 0\naction b 2 1\nedge a b\nbegin\n")));
    }

    @Test
    public void startRunsScriptFileAndWritesDot(@TempDir Path dir) throws IOException {
        Path scriptFile = dir.resolve("orders.txt");
        Files.write(scriptFile, "action a 1 0\naction b 2 1\nedge a b\nexpect-cycle false\n"
                .getBytes(StandardCharsets.UTF_8));
        File dot = dir.resolve("out.dot").toFile();
        Session s = session("-script", scriptFile.toString(), "-dot", dot.toString());

        s.start();

        assertThat(s.getFailures(), is(0));
        assertThat(dot.isFile(), is(true));
    }

    @Test
    public void startWithoutScriptFails() {
        assertThrows(IllegalStateException.class, () -> session().start());
    }

    @Test
    public void extendConfigReadsPropertiesFile(@TempDir Path dir) throws IOException {
        Path cfg = dir.resolve(CycleCheck.CONFIG_FILE);
        Properties properties = new Properties();
        properties.setProperty("script", "from-file.txt");
        try (java.io.OutputStream out = Files.newOutputStream(cfg)) {
            properties.store(out, null);
        }
        Configuration config = new Configuration(new String[0]);

        CycleCheckMain.extendConfig(config, cfg.toFile());
        CycleCheckMain.extendConfig(config, dir.resolve("absent.properties").toFile());

        assertThat(config.scriptFile, is("from-file.txt"));
    }
}
