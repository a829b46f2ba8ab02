package net.littleredcomputer.propsat;

/**
 * The same search as {@link BacktrackingSolver}, visiting the same nodes in
 * the same order, but with a single assignment which is frozen before and
 * thawed after each recursive call instead of copied. This is safe because
 * the two branches under a node are explored one after the other. The
 * assignment is copied only when it is found to satisfy the formula.
 */
public class InPlaceSolver extends AbstractSolver {

    public InPlaceSolver(Formula formula) {
        super("in-place", formula);
    }

    @Override
    SearchResult search(SearchStatistics statistics) {
        return solve(Assignment.allThawed(formula.universe()), 0, statistics);
    }

    private SearchResult solve(Assignment a, int depth, SearchStatistics statistics) {
        visit(a, depth, statistics);
        EvalResult r = Evaluator.evaluate(formula.tokens(), a, statistics);
        if (r.isError()) return SearchResult.error(r.error(), statistics);
        if (r.value()) return SearchResult.satisfied(a.copy(), statistics);
        if (a.thawedCount() == 0) return SearchResult.unsatisfiable(statistics);

        for (boolean b : truthValues) {
            a.freeze(b);
            SearchResult s = solve(a, depth + 1, statistics);
            a.thaw();
            if (!s.isUnsatisfiable()) return s;
        }
        return SearchResult.unsatisfiable(statistics);
    }
}
