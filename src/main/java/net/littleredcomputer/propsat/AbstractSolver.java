package net.littleredcomputer.propsat;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Common machinery for the backtracking searches: the up-front syntax check,
 * statistics, timing and progress logging. Subclasses supply the search itself.
 */
public abstract class AbstractSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSolver.class);
    final int logCheckNodes = 10000;
    protected final Formula formula;
    private long lastNodeCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public AbstractSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    AbstractSolver(String name, Formula formula) {
        this.name = name;
        this.formula = formula;
    }

    private void start() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastNodeCount = 0;
    }

    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;
    private String stateToString(Assignment a) {
        // The frozen prefix, one digit per literal.
        StringBuilder s = new StringBuilder();
        final int n = a.frozenCount();
        if (n > 100) {
            for (int i = 0; i < initialStateSegment; ++i) s.append(a.get(i) ? 1 : 0);
            s.append("...");
            for (int i = n - finalStateSegment; i < n; ++i) s.append(a.get(i) ? 1 : 0);
        } else {
            for (int i = 0; i < n; ++i) s.append(a.get(i) ? 1 : 0);
        }
        return s.toString();
    }

    private void maybeReportProgress(SearchStatistics statistics, Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final long nodes = statistics.nodes();
        final double perSec = 1e3 * (nodes - lastNodeCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d nodes %s %.0f/sec %s", name, nodes, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastNodeCount = nodes;
    }

    /**
     * Called on entry to each node of the search tree.
     * @param a the assignment to be evaluated at this node
     * @param depth the node's depth; the root is at depth 0
     * @param statistics counters for the current search
     */
    void visit(Assignment a, int depth, SearchStatistics statistics) {
        statistics.node(depth);
        if (statistics.nodes() % logCheckNodes == 0) maybeReportProgress(statistics, () -> stateToString(a));
    }

    /**
     * Determine whether the formula is satisfiable. The formula's syntax is checked
     * first, by evaluating it with every literal false; a malformed formula yields
     * an error result without any search.
     * @return the first satisfying assignment found, or the reason there is none
     */
    public SearchResult solve() {
        SearchStatistics statistics = new SearchStatistics();
        start();
        EvalResult check = Evaluator.evaluate(formula.tokens(), Assignment.allThawed(formula.universe()), statistics);
        SearchResult result = check.isError()
                ? SearchResult.error(check.error(), statistics)
                : search(statistics);
        stopwatch.stop();
        log.info("%s: %s in %s (%s)", name, result.verdict(), stopwatch, statistics);
        return result;
    }

    /**
     * Search for a satisfying assignment of a formula already known to be well formed.
     * @param statistics counters to be updated during the search
     */
    abstract SearchResult search(SearchStatistics statistics);

    /** Values tried for each newly frozen literal, in order. */
    static final ImmutableList<Boolean> truthValues = ImmutableList.of(true, false);
}
