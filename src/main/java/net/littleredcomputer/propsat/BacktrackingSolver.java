package net.littleredcomputer.propsat;

/**
 * Exhaustive search by case-splitting. At each node the whole formula is
 * evaluated; if it is false, the first thawed literal is frozen, to true and
 * then to false, in fresh copies of the assignment. Literals are frozen in
 * order of first appearance in the formula, so the first satisfying
 * assignment found is the same on every run.
 */
public class BacktrackingSolver extends AbstractSolver {

    public BacktrackingSolver(Formula formula) {
        super("backtrack", formula);
    }

    @Override
    SearchResult search(SearchStatistics statistics) {
        return solve(Assignment.allThawed(formula.universe()), 0, statistics);
    }

    private SearchResult solve(Assignment a, int depth, SearchStatistics statistics) {
        visit(a, depth, statistics);
        EvalResult r = Evaluator.evaluate(formula.tokens(), a, statistics);
        if (r.isError()) return SearchResult.error(r.error(), statistics);
        // The thawed literals' values are part of the solution: they are what made it true.
        if (r.value()) return SearchResult.satisfied(a, statistics);
        if (a.thawedCount() == 0) return SearchResult.unsatisfiable(statistics);

        for (boolean b : truthValues) {
            SearchResult s = solve(a.advance(b), depth + 1, statistics);
            if (!s.isUnsatisfiable()) return s;
        }
        return SearchResult.unsatisfiable(statistics);
    }
}
