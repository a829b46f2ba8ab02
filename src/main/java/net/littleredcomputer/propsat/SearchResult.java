package net.littleredcomputer.propsat;

import com.google.common.base.Preconditions;

import java.util.Optional;

public final class SearchResult {
    public enum Verdict {
        SATISFIED,
        UNSATISFIABLE,
        ERROR,
    }

    private final Verdict verdict;
    private final Assignment assignment;  // only when SATISFIED
    private final String error;  // only when ERROR
    private final SearchStatistics statistics;

    private SearchResult(Verdict verdict, Assignment assignment, String error, SearchStatistics statistics) {
        this.verdict = verdict;
        this.assignment = assignment;
        this.error = error;
        this.statistics = statistics;
    }

    static SearchResult satisfied(Assignment assignment, SearchStatistics statistics) {
        return new SearchResult(Verdict.SATISFIED, Preconditions.checkNotNull(assignment), null, statistics);
    }

    static SearchResult unsatisfiable(SearchStatistics statistics) {
        return new SearchResult(Verdict.UNSATISFIABLE, null, null, statistics);
    }

    static SearchResult error(String error, SearchStatistics statistics) {
        return new SearchResult(Verdict.ERROR, null, Preconditions.checkNotNull(error), statistics);
    }

    public Verdict verdict() { return verdict; }
    public boolean isSatisfied() { return verdict == Verdict.SATISFIED; }
    public boolean isUnsatisfiable() { return verdict == Verdict.UNSATISFIABLE; }
    public boolean isError() { return verdict == Verdict.ERROR; }

    /** @return the satisfying assignment, present iff the formula was satisfied */
    public Optional<Assignment> assignment() { return Optional.ofNullable(assignment); }

    public Optional<String> error() { return Optional.ofNullable(error); }

    public SearchStatistics statistics() { return statistics; }

    @Override
    public String toString() {
        switch (verdict) {
            case SATISFIED: return "Satisfied with " + assignment;
            case UNSATISFIABLE: return "Unstatisfied";
            default: return error;
        }
    }
}
