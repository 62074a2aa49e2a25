package com.kid.cmd;

import com.kid.Kid;
import com.kid.KidGenerator;
import com.kid.util.Clock;
import com.kid.util.SystemClock;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks that kids generated concurrently from one {@link KidGenerator} never
 * repeat their timestamp and sequence.
 *
 * <p>Each thread generates {@code --count} kids. Ticks seen during the current
 * wall-clock millisecond are kept in a set that is cleared whenever the
 * millisecond changes. The random bytes are left out of the check.</p>
 */
public class UniqCheck {

    private static final String OPT_THREADS = "--threads";
    private static final String OPT_COUNT = "--count";

    private final KidGenerator generator;
    private final Clock clock;

    private final Object lock = new Object();
    private Set<Long> keys = new HashSet<>();
    private long lastMilli;
    private long totalKeys;
    private long dupes;

    public UniqCheck(KidGenerator generator, Clock clock) {
        this.generator = generator;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int code = new UniqCheck(new KidGenerator(), new SystemClock()).run(args, System.out, System.err);
        System.exit(code);
    }

    /**
     * Runs the check and returns the process exit code: 0 when no duplicates
     * were found, 1 for duplicates or bad arguments.
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> options = parseArgs(args, err);
        if (options == null) {
            printUsage(err);
            return 1;
        }
        if (options.containsKey("--help")) {
            printUsage(out);
            return 0;
        }
        int threads;
        int count;
        try {
            threads = Integer.parseInt(options.getOrDefault(OPT_THREADS, "4"));
            count = Integer.parseInt(options.getOrDefault(OPT_COUNT, "1000000"));
        } catch (NumberFormatException e) {
            err.println("Invalid number: " + e.getMessage());
            printUsage(err);
            return 1;
        }
        if (threads < 1 || count < 1) {
            err.println("Thread count and kid count must be positive.");
            printUsage(err);
            return 1;
        }

        out.printf(Locale.ROOT, "Generating %,d kids per %,d threads:%n", count, threads);
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            Thread worker = new Thread(() -> generate(count, out), "uniqcheck-" + t);
            workers.add(worker);
            worker.start();
        }
        try {
            for (Thread worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while waiting for workers");
            return 1;
        }

        synchronized (lock) {
            out.printf(Locale.ROOT, "Total keys: %,d. Keys in last time tick: %,d. Number of dupes: %,d%n",
                    totalKeys, keys.size(), dupes);
            if (dupes > 0) {
                out.println("!!! Dupes detected !!!");
                return 1;
            }
        }
        return 0;
    }

    private void generate(int count, PrintStream out) {
        for (int i = 0; i < count; i++) {
            Kid kid = generator.next();
            long tick = (kid.timestamp() << 16) | kid.sequence();
            long milli = clock.nowNanos() / 1_000_000L;
            synchronized (lock) {
                if (milli != lastMilli) {
                    lastMilli = milli;
                    keys = new HashSet<>();
                }
                totalKeys++;
                if (!keys.add(tick)) {
                    dupes++;
                    out.printf(Locale.ROOT, "Generated: %,d, found duplicate: %s%n", totalKeys, kid);
                }
            }
        }
    }

    private static Map<String, String> parseArgs(String[] args, PrintStream err) {
        Map<String, String> opts = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    opts.put("--help", "true");
                    break;
                case OPT_THREADS:
                case OPT_COUNT:
                    if (i + 1 >= args.length) {
                        err.println("Missing value for option: " + arg);
                        return null;
                    }
                    opts.put(arg, args[++i]);
                    break;
                default:
                    err.println("Unknown option: " + arg);
                    return null;
            }
        }
        return opts;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: java -cp <jar> com.kid.cmd.UniqCheck [--threads <n>] [--count <n>]");
        out.println("  --threads  Number of generating threads (default: 4)");
        out.println("  --count    Kids generated per thread (default: 1000000)");
    }
}
