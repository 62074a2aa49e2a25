package com.kid.cmd;

import com.kid.InvalidKidException;
import com.kid.Kid;
import com.kid.KidGenerator;

import java.io.PrintStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Command-line tool to generate kids or inspect existing ones.
 *
 * <pre>
 *   kid                  generate one kid
 *   kid -c 4             generate four kids
 *   kid 06bpk9h5kd17xd7z decode and describe a kid
 * </pre>
 */
public class KidMain {

    private static final String OPT_COUNT = "-c";

    // 2025-03-08 17:50:27.758 +0000 UTC, fraction trimmed of trailing zeros
    private static final DateTimeFormatter TIME_FORMAT = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4, 10, SignStyle.NORMAL)
            .appendPattern("-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .appendLiteral(" +0000 UTC")
            .toFormatter()
            .withZone(ZoneOffset.UTC);

    private final KidGenerator generator;

    public KidMain(KidGenerator generator) {
        this.generator = generator;
    }

    public static void main(String[] args) {
        int code = new KidMain(new KidGenerator()).run(args, System.out, System.err);
        System.exit(code);
    }

    /**
     * Runs the tool and returns the process exit code.
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        int count = 1;
        List<String> encoded = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    printUsage(out);
                    return 0;
                case OPT_COUNT:
                    if (i + 1 >= args.length) {
                        err.println("Missing value for option: " + arg);
                        printUsage(err);
                        return 1;
                    }
                    try {
                        count = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        err.println("Invalid count: " + args[i]);
                        printUsage(err);
                        return 1;
                    }
                    if (count < 1) {
                        err.println("Count must be positive: " + count);
                        printUsage(err);
                        return 1;
                    }
                    break;
                default:
                    if (arg.startsWith("-")) {
                        err.println("Unknown option: " + arg);
                        printUsage(err);
                        return 1;
                    }
                    encoded.add(arg);
            }
        }

        if (count > 1 && !encoded.isEmpty()) {
            err.println("kid: Error, cannot generate ID(s) and inspect at the same time.");
            printUsage(err);
            return 1;
        }

        if (!encoded.isEmpty()) {
            for (String arg : encoded) {
                out.println(describe(arg));
            }
            return 0;
        }
        for (int c = 0; c < count; c++) {
            out.println(generator.next());
        }
        return 0;
    }

    static String describe(String arg) {
        Kid kid;
        try {
            kid = Kid.fromString(arg);
        } catch (InvalidKidException e) {
            return "[" + arg + "] kid: invalid id";
        }
        return String.format("%s ts:%d seq:%4d rnd:%5d %s ID{%s }",
                arg, kid.timestamp(), kid.sequence(), kid.random(), TIME_FORMAT.format(kid.time()), asHex(kid.bytes()));
    }

    private static String asHex(byte[] bytes) {
        StringJoiner joiner = new StringJoiner(",");
        for (byte b : bytes) {
            joiner.add(String.format(" %#4x", b & 0xFF));
        }
        return joiner.toString();
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: java -cp <jar> com.kid.cmd.KidMain [-c N] [kid ...]");
        out.println("  kid 06bpk9h5kd17xd7z   Decode the supplied base32 kid");
        out.println("  -c N                   Generate N kids (default: 1)");
        out.println();
        out.println("With no parameters, generates one kid encoded as base32.");
        out.println("Generate and inspect 4 kids using command substitution:");
        out.println("  kid `kid -c 4`");
    }
}
