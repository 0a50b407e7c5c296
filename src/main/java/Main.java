import staticds.RmqType;
import tree.suffix.BuildStrategy;
import tree.suffix.SuffixTree;
import tree.suffix.SuffixTreeConfiguration;
import utilities.MemUtil;
import utilities.SuffixTreeLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line driver: builds a suffix tree over a text given inline or read from a file and
 * answers the queries listed on the command line, one result per line.
 *
 * <pre>
 * java Main --file book.txt --strategy ukkonen --count the --lrs 2 --lcp 0,10
 * </pre>
 */
public final class Main {

    public static void main(String[] args) throws IOException {
        run(args, System.out);
    }

    static void run(String[] args, PrintStream out) throws IOException {
        CliOptions options = CliOptions.parse(args);
        String text = options.text != null
                ? options.text
                : Files.readString(options.file, StandardCharsets.UTF_8);

        SuffixTreeConfiguration configuration = SuffixTreeConfiguration.builder()
                .strategy(options.strategy)
                .rmqType(options.rmqType)
                .collectStats(options.stats)
                .build();
        SuffixTreeLogger.info("Building suffix tree over " + text.length() + " chars with " + configuration);
        SuffixTree tree = SuffixTree.build(text, configuration);

        if (options.stats) {
            out.println("stats: " + tree.stats());
        }
        if (options.print) {
            out.println(tree);
        }
        for (Query query : options.queries) {
            out.println(query.answer(tree));
        }
        if (options.memory) {
            out.println(MemUtil.jolMemoryReport(tree, false));
        }
    }

    private enum QueryKind { OCCURRENCES, COUNT, LRS, LCP }

    private static final class Query {
        final QueryKind kind;
        final String argument;

        Query(QueryKind kind, String argument) {
            this.kind = kind;
            this.argument = argument;
        }

        String answer(SuffixTree tree) {
            switch (kind) {
                case OCCURRENCES -> {
                    return "occurrences(" + argument + ") = " + tree.occurrences(argument);
                }
                case COUNT -> {
                    return "count(" + argument + ") = " + tree.occurrencesCount(argument);
                }
                case LRS -> {
                    int repetitions = Integer.parseInt(argument);
                    return "lrs(" + repetitions + ") = " + tree.longestRepeatedSubstring(repetitions)
                            + " \"" + tree.longestRepeatedSubstringText(repetitions) + "\"";
                }
                default -> {
                    String[] parts = argument.split(",");
                    if (parts.length != 2) {
                        throw new IllegalArgumentException("--lcp expects i,j but got " + argument);
                    }
                    int i = Integer.parseInt(parts[0].trim());
                    int j = Integer.parseInt(parts[1].trim());
                    return "lcp(" + i + "," + j + ") = " + tree.longestCommonPrefix(i, j);
                }
            }
        }
    }

    static final class CliOptions {
        final String text;
        final Path file;
        final BuildStrategy strategy;
        final RmqType rmqType;
        final List<Query> queries;
        final boolean print;
        final boolean memory;
        final boolean stats;

        private CliOptions(String text,
                           Path file,
                           BuildStrategy strategy,
                           RmqType rmqType,
                           List<Query> queries,
                           boolean print,
                           boolean memory,
                           boolean stats) {
            this.text = text;
            this.file = file;
            this.strategy = strategy;
            this.rmqType = rmqType;
            this.queries = queries;
            this.print = print;
            this.memory = memory;
            this.stats = stats;
        }

        static CliOptions parse(String[] args) {
            String text = null;
            Path file = null;
            BuildStrategy strategy = BuildStrategy.UKKONEN;
            RmqType rmqType = RmqType.FISCHER_HEUN;
            List<Query> queries = new ArrayList<>();
            boolean print = false;
            boolean memory = false;
            boolean stats = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key;
                String value = null;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                }
                // flags take no value
                switch (key) {
                    case "print" -> { print = true; continue; }
                    case "memory" -> { memory = true; continue; }
                    case "stats" -> { stats = true; continue; }
                    default -> { }
                }
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "text" -> text = value;
                    case "file" -> file = Path.of(value);
                    case "strategy" -> strategy = BuildStrategy.fromString(value);
                    case "rmq" -> rmqType = RmqType.fromString(value);
                    case "occurrences" -> queries.add(new Query(QueryKind.OCCURRENCES, value));
                    case "count" -> queries.add(new Query(QueryKind.COUNT, value));
                    case "lrs" -> queries.add(new Query(QueryKind.LRS, value));
                    case "lcp" -> queries.add(new Query(QueryKind.LCP, value));
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }
            if ((text == null) == (file == null)) {
                throw new IllegalArgumentException("Exactly one of --text or --file is required");
            }
            return new CliOptions(text, file, strategy, rmqType, queries, print, memory, stats);
        }
    }
}
