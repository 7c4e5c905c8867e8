package tju.edu.cn.cyclegraph.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads ordering scripts. One command per line, blank lines and lines starting
 * with '#' are skipped:
 * <pre>
 * action w1 1 0 write
 * action r1 2 1 rmw
 * rmw w1 r1
 * expect-cycle false
 * </pre>
 */
public class ScriptLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptLoader.class);

    public static List<ScriptCommand> load(File f) throws IOException {
        if (!f.isFile() || !f.canRead()) {
            throw new IllegalArgumentException("Could not read script " + f);
        }
        try (FileReader reader = new FileReader(f, StandardCharsets.UTF_8)) {
            List<ScriptCommand> commands = parse(reader, f.getName());
            LOG.info("loaded {} commands from {}", commands.size(), f);
            return commands;
        }
    }

    public static List<ScriptCommand> parse(Reader in, String source) throws IOException {
        BufferedReader reader = new BufferedReader(in);
        List<ScriptCommand> commands = new ArrayList<>();
        int lineNo = 0;
        String line = reader.readLine();
        while (line != null) {
            lineNo++;
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                commands.add(parseLine(trimmed, source, lineNo));
            }
            line = reader.readLine();
        }
        return commands;
    }

    private static ScriptCommand parseLine(String line, String source, int lineNo) {
        String[] tokens = line.split("\\s+");
        ScriptCommand.Kind kind = ScriptCommand.Kind.fromKeyword(tokens[0]);
        if (kind == null) {
            throw new IllegalArgumentException(source + ":" + lineNo + " unknown command '" + tokens[0] + "'");
        }
        String[] args = Arrays.copyOfRange(tokens, 1, tokens.length);
        if (args.length < kind.minArgs || args.length > kind.maxArgs) {
            throw new IllegalArgumentException(source + ":" + lineNo + " wrong number of arguments for '"
                    + kind.keyword + "': " + args.length);
        }
        validate(kind, args, source + ":" + lineNo);
        return new ScriptCommand(kind, args, lineNo);
    }

    private static void validate(ScriptCommand.Kind kind, String[] args, String where) {
        switch (kind) {
            case ACTION:
                checkShort(args[1], where);
                checkLong(args[2], where);
                if (args.length > 3) {
                    try {
                        ActionType.fromString(args[3]);
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException(where + " " + e.getMessage(), e);
                    }
                }
                break;
            case PROMISE:
                for (int i = 1; i < args.length; i++) {
                    checkShort(args[i], where);
                }
                break;
            case EXPECT_CYCLE:
                checkBoolean(args[0], where);
                break;
            case EXPECT_REACH:
            case EXPECT_ELIMINATE:
                checkBoolean(args[2], where);
                break;
            default:
                break;
        }
    }

    private static void checkShort(String value, String where) {
        try {
            Short.parseShort(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(where + " thread id is not a short: '" + value + "'", e);
        }
    }

    private static void checkLong(String value, String where) {
        try {
            Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(where + " sequence number is not a long: '" + value + "'", e);
        }
    }

    private static void checkBoolean(String value, String where) {
        if (!"true".equals(value) && !"false".equals(value)) {
            throw new IllegalArgumentException(where + " expected true or false but was '" + value + "'");
        }
    }
}
