import datagenerators.Generator;
import tree.suffix.BuildStrategy;
import tree.suffix.SuffixTree;
import tree.suffix.SuffixTreeConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Construction-only benchmark: builds suffix trees over random texts of growing size with each
 * strategy and reports the average build and preprocessing time. Naive construction is
 * quadratic, so it is skipped above {@code --naive-max}.
 */
public final class TrackBuildSpeed {

    private static final int[] DEFAULT_SIZES = {0, 1, 10, 100, 1000, 10000};
    private static final int DEFAULT_RUNS = 10;
    private static final int DEFAULT_NAIVE_MAX = 10000;
    private static final long DEFAULT_SEED = 42L;

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);

        System.out.printf(Locale.ROOT, "Runs: %d  Naive max: %d  Zipf: %s  Seed: %d%n",
                options.runs, options.naiveMax, options.zipf ? options.zipfExponent : "off", options.seed);

        for (int size : options.sizes) {
            String text = options.zipf
                    ? Generator.generateZipf(size, Generator.PRINTABLE, options.zipfExponent, options.seed)
                    : Generator.generateUniform(size, Generator.PRINTABLE, options.seed);
            for (BuildStrategy strategy : BuildStrategy.values()) {
                if (strategy == BuildStrategy.NAIVE && size > options.naiveMax) {
                    continue;
                }
                RunStats s = time(text, strategy, options.runs);
                System.out.printf(Locale.ROOT,
                        "%-8s n=%-8d nodes=%-8d build avg: %.3f ms | preprocess avg: %.3f ms%n",
                        strategy.token(), size, s.nodes, s.buildMs, s.preprocessMs);
            }
        }
    }

    private static RunStats time(String text, BuildStrategy strategy, int runs) {
        SuffixTreeConfiguration configuration = SuffixTreeConfiguration.builder()
                .strategy(strategy)
                .collectStats(true)
                .build();
        double buildMs = 0.0;
        double preprocessMs = 0.0;
        int nodes = 0;
        for (int i = 0; i < runs; i++) {
            SuffixTree tree = SuffixTree.build(text, configuration);
            buildMs += tree.stats().buildNanos() / 1e6;
            preprocessMs += tree.stats().preprocessNanos() / 1e6;
            nodes = tree.nodeCount();
        }
        return new RunStats(buildMs / runs, preprocessMs / runs, nodes);
    }

    private static final class RunStats {
        final double buildMs;
        final double preprocessMs;
        final int nodes;

        RunStats(double buildMs, double preprocessMs, int nodes) {
            this.buildMs = buildMs;
            this.preprocessMs = preprocessMs;
            this.nodes = nodes;
        }
    }

    static final class CliOptions {
        final int[] sizes;
        final int runs;
        final int naiveMax;
        final boolean zipf;
        final double zipfExponent;
        final long seed;

        private CliOptions(int[] sizes, int runs, int naiveMax, boolean zipf, double zipfExponent, long seed) {
            this.sizes = sizes;
            this.runs = runs;
            this.naiveMax = naiveMax;
            this.zipf = zipf;
            this.zipfExponent = zipfExponent;
            this.seed = seed;
        }

        static CliOptions parse(String[] args) {
            int[] sizes = DEFAULT_SIZES;
            int runs = DEFAULT_RUNS;
            int naiveMax = DEFAULT_NAIVE_MAX;
            boolean zipf = false;
            double zipfExponent = 1.0;
            long seed = DEFAULT_SEED;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "sizes" -> {
                        List<Integer> parsed = new ArrayList<>();
                        for (String token : value.split(",")) {
                            parsed.add(Integer.parseInt(token.trim()));
                        }
                        sizes = parsed.stream().mapToInt(Integer::intValue).toArray();
                    }
                    case "runs" -> runs = Integer.parseInt(value);
                    case "naive-max" -> naiveMax = Integer.parseInt(value);
                    case "zipf" -> {
                        zipf = true;
                        zipfExponent = Double.parseDouble(value);
                    }
                    case "seed" -> seed = Long.parseLong(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }
            if (runs <= 0) {
                throw new IllegalArgumentException("runs must be positive");
            }
            return new CliOptions(sizes, runs, naiveMax, zipf, zipfExponent, seed);
        }
    }
}
