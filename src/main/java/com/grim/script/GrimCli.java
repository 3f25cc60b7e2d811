package com.grim.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.grim.debug.Debug;
import com.grim.debug.DebugLevel;
import com.grim.debug.PrintStreamDebugSink;
import com.grim.script.parser.GrimRuntimeException;
import com.grim.script.parser.ParseException;

public final class GrimCli {
    private static final String TAG = "grim.cli";

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_READ_FAILURE = 3;

    private static final String USAGE =
            "Usage: GrimCli [--debug] [--max-depth=N] [--loop-scope=shared|per-iteration] [--ast] <script-file>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, System.in));
    }

    public static int run(String[] args, PrintStream out, PrintStream err, InputStream in) {
        List<String> positional = new ArrayList<>();
        Map<String, String> flags = parseArgs(args, positional);
        if (positional.size() != 1) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (flags.containsKey("debug")) {
            Debug.get().setSink(new PrintStreamDebugSink(err, DebugLevel.TRACE));
        }

        final GrimScript engine = new GrimScript();
        try {
            engine.setMaxCallDepth(Integer.parseInt(flags.getOrDefault("max-depth", "0")));
            engine.setLoopScope(loopScope(flags.getOrDefault("loop-scope", "shared")));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        engine.setOutput(out);
        engine.setInput(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));

        final Path scriptPath = Path.of(positional.get(0));
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            Debug.get().e(TAG, "read failed: " + scriptPath, e);
            return EXIT_READ_FAILURE;
        }

        try {
            if (flags.containsKey("ast")) {
                engine.runJson(script);
            } else {
                engine.run(script);
            }
            return EXIT_OK;
        } catch (ParseException e) {
            err.println("Parse error: " + e.getMessage());
            return EXIT_SCRIPT_ERROR;
        } catch (GrimRuntimeException e) {
            err.println(e.report());
            return EXIT_SCRIPT_ERROR;
        }
    }

    static GrimScript.LoopScope loopScope(String value) {
        switch (value) {
            case "shared":        return GrimScript.LoopScope.SHARED;
            case "per-iteration": return GrimScript.LoopScope.PER_ITERATION;
            default: throw new IllegalArgumentException("Unknown loop scope: " + value);
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

    private GrimCli() {}
}
