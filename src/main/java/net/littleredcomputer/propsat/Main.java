package net.littleredcomputer.propsat;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.io.CharStreams;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

public class Main {
    // Exit statuses follow minisat's, except that satisfiable is 0 unless -minisat is given.
    static final int EXIT_COMMAND_LINE_FAIL = 0;
    static final int EXIT_CANNOT_READ_INPUT = 1;
    static final int EXIT_CANNOT_PARSE_INPUT = 3;
    static final int EXIT_SATISFIABLE = 0;
    static final int EXIT_SATISFIABLE_MINISAT = 10;
    static final int EXIT_UNSATISFIABLE = 20;

    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final CharMatcher carriageReturn = CharMatcher.is('\r');

    private static final String description = "A toy SAT (boolean SATisfiability) solver.\n" +
            "Put the logic expression on the command line (in quotes), in a file, or send it via stdin.\n\n";
    private static final String examples = "\nExample expressions:\n" +
            "  a & ~b\n" +
            "  x & ~x\n" +
            "  mike & sally & ~peter\n" +
            "  ~(mike & sally) & ~peter\n\n" +
            "Supported: & = and, | = or, ~ = not, () = brackets, letters and digits = literals.\n" +
            "There is no attempt at optimization or avoiding recursion.";

    private static Options options() {
        return new Options()
                .addOption("?", "help", false, "print this message")
                .addOption("file", true, "read the expression from this file ('-' for stdin); not allowed with expression words")
                .addOption("algorithm", true, "search strategy: copy (default) or inplace")
                .addOption("minisat", false, "exit with status 10, as minisat does, when satisfiable")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static void usage(PrintStream err) {
        PrintWriter pw = new PrintWriter(err);
        new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "propsat [options] '<logic-expression>'",
                description, options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, examples);
        pw.flush();
    }

    private static Reader input(CommandLine cmd, InputStream in) throws FileNotFoundException {
        String p = cmd.getOptionValue("file", "-");
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    /**
     * The expression is the concatenation of the command line's arguments if there are any,
     * otherwise the contents of the input, with its line breaks turned into spaces.
     */
    static String expression(CommandLine cmd, InputStream in) throws IOException {
        List<String> words = cmd.getArgList();
        if (!words.isEmpty()) return spaceJoiner.join(words);
        try (Reader r = input(cmd, in)) {
            return carriageReturn.removeFrom(CharStreams.toString(r)).replace('\n', ' ');
        }
    }

    private static Function<Formula, AbstractSolver> solver(CommandLine cmd) {
        String a = cmd.getOptionValue("algorithm", "copy");
        switch (a) {
            case "copy": return BacktrackingSolver::new;
            case "inplace": return InPlaceSolver::new;
            default: throw new IllegalArgumentException("Unknown algorithm: " + a);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        CommandLine cmd;
        final Function<Formula, AbstractSolver> solver;
        final Duration logInterval;
        try {
            // Options may appear anywhere, before or among the expression words.
            cmd = new DefaultParser().parse(options(), args);
            if (cmd.hasOption("help")) {
                usage(err);
                return EXIT_COMMAND_LINE_FAIL;
            }
            if (cmd.hasOption("file") && !cmd.getArgList().isEmpty()) {
                throw new IllegalArgumentException("give the expression either with -file or as words, not both");
            }
            solver = solver(cmd);
            logInterval = logInterval(cmd);
        } catch (ParseException | IllegalArgumentException e) {
            // DateTimeParseException from a malformed -loginterval is an IllegalArgumentException.
            err.println(e.getMessage());
            usage(err);
            return EXIT_COMMAND_LINE_FAIL;
        }

        String text;
        try {
            text = expression(cmd, in);
        } catch (IOException e) {
            err.println("Cannot read input -- " + e.getMessage());
            return EXIT_CANNOT_READ_INPUT;
        }

        Formula formula;
        try {
            formula = Formula.parse(text);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_CANNOT_PARSE_INPUT;
        }
        out.println("Parsed Input: " + formula.tokens().render());
        out.println("Unique Literals: " + formula.universe());

        SearchResult result = solver.apply(formula).setLogInterval(logInterval).solve();
        if (result.isError()) {
            err.println("Formula has invalid syntax -- " + result);
            return EXIT_CANNOT_PARSE_INPUT;
        }
        SearchStatistics statistics = result.statistics();
        out.println(result);
        out.printf("Number of Evals: %,d%n", statistics.evaluations());
        out.printf("Number of Lookups: %,d%n", statistics.lookups());
        out.printf("Max Depth: %d%n", statistics.maxDepth());
        if (result.isSatisfied()) return cmd.hasOption("minisat") ? EXIT_SATISFIABLE_MINISAT : EXIT_SATISFIABLE;
        return EXIT_UNSATISFIABLE;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }
}
