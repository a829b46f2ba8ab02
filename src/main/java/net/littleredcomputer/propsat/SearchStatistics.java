package net.littleredcomputer.propsat;

/**
 * Counters accumulated during a search. Advisory only: nothing about the
 * result of a search depends on them.
 */
public final class SearchStatistics {
    private long evaluations;
    private long lookups;
    private long nodes;
    private int maxDepth;

    void evaluation() { ++evaluations; }

    void lookup() { ++lookups; }

    /** Record a visit to a node of the search tree at the given depth (the root is at depth 0). */
    void node(int depth) {
        ++nodes;
        if (depth > maxDepth) maxDepth = depth;
    }

    /** @return the number of expressions evaluated, counting bracketed subexpressions separately */
    public long evaluations() { return evaluations; }

    public long lookups() { return lookups; }

    public long nodes() { return nodes; }

    public int maxDepth() { return maxDepth; }

    @Override
    public String toString() {
        return String.format("%d evals, %d lookups, %d nodes, max depth %d", evaluations, lookups, nodes, maxDepth);
    }
}
