package tju.edu.cn.cyclegraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tju.edu.cn.cyclegraph.config.Configuration;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;


public class CycleCheckMain {

    private static final Logger LOG = LoggerFactory.getLogger(CycleCheckMain.class);

    public static void main(String[] args) throws Exception {
        Configuration config = new Configuration(args);
        extendConfig(config, new File(CycleCheck.CONFIG_FILE));
        if (config.isHelp() || config.scriptFile == null) {
            System.out.println(Configuration.getUsage());
            return;
        }
        Session s = new Session(config);
        long startTime = System.currentTimeMillis();
        s.start();
        long endTime = System.currentTimeMillis();
        double durationInSeconds = (endTime - startTime) / 1000.0;

        System.out.println("duration time: " + durationInSeconds);
        if (s.getFailures() > 0) {
            System.exit(1);
        }
    }

    static void extendConfig(Configuration config, File cfg) throws IOException {
        if (!cfg.isFile()) return;
        Properties properties = new Properties();
        try (FileInputStream fin = new FileInputStream(cfg)) {
            properties.load(fin);
        }
        config.extend(properties);
        LOG.info("loaded {}: {}", cfg, config);
    }
}
