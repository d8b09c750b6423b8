package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);

    static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure ('_' marks an open cell)")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("output", true, "filename to which the first solution is also written as text (no image output)")
                .addOption("strategy", true, "variable selection: FIRST or MRV")
                .addOption("ordering", true, "value ordering: DOMAIN or LCV")
                .addOption("inference", false, "maintain arc consistency during search")
                .addOption("singletons", false, "prune words held by neighbors with a single candidate")
                .addOption("limit", true, "maximum number of solutions to print")
                .addOption("timelimit", true, "search time limit in ISO-8601 format")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader file(CommandLine cmd, String option) throws IOException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return new BufferedReader(new FileReader(cmd.getOptionValue(option), StandardCharsets.UTF_8));
    }

    private static <E extends Enum<E>> E choice(CommandLine cmd, String option, Class<E> type, E fallback) {
        if (!cmd.hasOption(option)) return fallback;
        String value = cmd.getOptionValue(option);
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + option + ": " + value, e);
        }
    }

    static long limit(CommandLine cmd) {
        String value = cmd.getOptionValue("limit", "1");
        long limit;
        try {
            limit = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad limit: " + value, e);
        }
        if (limit < 1) throw new IllegalArgumentException("limit must be positive: " + value);
        return limit;
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword;
        try (Reader structure = file(cmd, "structure"); Reader words = file(cmd, "words")) {
            crossword = Crossword.parseFrom(structure, words);
        }
        log.info("%dx%d grid, %d slots, %d words", crossword.height(), crossword.width(),
                crossword.variables().size(), crossword.words().size());
        CrosswordCreator creator = new CrosswordCreator(crossword)
                .setStrategy(choice(cmd, "strategy", CrosswordCreator.Strategy.class, CrosswordCreator.Strategy.MRV))
                .setValueOrder(choice(cmd, "ordering", CrosswordCreator.ValueOrder.class, CrosswordCreator.ValueOrder.LCV))
                .setInference(cmd.hasOption("inference"))
                .setSingletonPruning(cmd.hasOption("singletons"))
                .setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT5S")));
        if (cmd.hasOption("timelimit")) creator.setTimeLimit(Duration.parse(cmd.getOptionValue("timelimit")));
        long limit = limit(cmd);

        Stopwatch sw = Stopwatch.createStarted();
        List<Map<Variable, String>> solutions = creator.solutions().limit(limit).collect(Collectors.toList());
        sw.stop();
        log.info("%d solutions in %s", solutions.size(), sw);
        if (solutions.isEmpty()) {
            System.out.println("No solution.");
            return;
        }
        for (Map<Variable, String> s : solutions) {
            System.out.println(CrosswordFormatter.format(crossword, s));
        }
        if (cmd.hasOption("output")) {
            try (PrintWriter w = new PrintWriter(cmd.getOptionValue("output"), StandardCharsets.UTF_8.name())) {
                w.print(CrosswordFormatter.format(crossword, solutions.get(0)));
            }
        }
    }
}
