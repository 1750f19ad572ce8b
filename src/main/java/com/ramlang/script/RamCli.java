package com.ramlang.script;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.ramlang.debug.ConsoleDebugSink;
import com.ramlang.debug.Debug;
import com.ramlang.debug.DebugLevel;
import com.ramlang.script.error.RamException;
import com.ramlang.script.json.AstJsonWriter;

/**
 * Parses a Ram file and prints its AST as JSON.
 *
 * Usage: RamCli &lt;script-file&gt; [--mode=strict|lenient] [--pretty] [--verbose]
 */
public final class RamCli {

    public static final int OK = 0;
    public static final int PARSE_ERROR = 1;
    public static final int USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        Map<String, String> flags = parseArgs(args, positional);

        if (positional.size() != 1) {
            err.println("Usage: RamCli <script-file> [--mode=strict|lenient] [--pretty] [--verbose]");
            return USAGE;
        }

        RamScript engine = new RamScript();
        String mode = flags.getOrDefault("mode", "strict");
        try {
            engine.setMode(RamScript.Mode.valueOf(mode.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            err.println("Unknown mode: " + mode);
            return USAGE;
        }

        if (flags.containsKey("verbose")) {
            Debug.get().setSink(new ConsoleDebugSink(err));
            Debug.get().setLevel(DebugLevel.DEBUG);
        }

        Path file;
        try {
            file = Path.of(positional.get(0));
        } catch (InvalidPathException e) {
            err.println("Invalid path: " + e.getMessage());
            return USAGE;
        }

        try {
            RamModule module = engine.parseFile(file);
            out.println(new AstJsonWriter().toJson(module, flags.containsKey("pretty")));
            return OK;
        } catch (RamException e) {
            err.println(e.getMessage());
            return PARSE_ERROR;
        }
    }

    private static Map<String, String> parseArgs(String[] args, List<String> positional) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            } else {
                positional.add(a);
            }
        }
        return out;
    }

    private RamCli() {}
}
