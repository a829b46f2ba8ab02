package net.littleredcomputer.propsat;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Truth values for the literals of a {@link LiteralUniverse}, indexed as in the
 * universe. The values below the frozen boundary are fixed for the current
 * branch of a search; the rest are "thawed": not yet decided, and false until
 * they are.
 */
public final class Assignment {
    private final LiteralUniverse universe;
    private final boolean[] values;
    private int frozenBoundary;

    private Assignment(LiteralUniverse universe, boolean[] values, int frozenBoundary) {
        this.universe = universe;
        this.values = values;
        this.frozenBoundary = frozenBoundary;
    }

    /** @return an assignment in which no literal is frozen (and all are false) */
    public static Assignment allThawed(LiteralUniverse universe) {
        return new Assignment(universe, new boolean[universe.size()], 0);
    }

    /**
     * @param universe literals to assign
     * @param values one value per literal of the universe
     * @return an assignment in which every literal is frozen at the given value
     */
    public static Assignment of(LiteralUniverse universe, boolean... values) {
        Preconditions.checkArgument(values.length == universe.size(),
                "%s values supplied for %s literals", values.length, universe.size());
        return new Assignment(universe, values.clone(), values.length);
    }

    public LiteralUniverse universe() { return universe; }

    public int size() { return values.length; }

    public int frozenCount() { return frozenBoundary; }

    public int thawedCount() { return values.length - frozenBoundary; }

    public boolean isFrozen(int index) {
        Preconditions.checkElementIndex(index, values.length);
        return index < frozenBoundary;
    }

    public boolean get(int index) {
        Preconditions.checkElementIndex(index, values.length);
        return values[index];
    }

    public boolean get(String name) {
        int ix = universe.indexOf(name);
        if (ix < 0) throw new IllegalArgumentException("unknown literal: " + name);
        return values[ix];
    }

    /**
     * @param value value for the first thawed literal
     * @return a new assignment sharing this one's universe, in which the first
     * thawed literal is frozen at the given value
     */
    Assignment advance(boolean value) {
        Preconditions.checkState(thawedCount() > 0, "no thawed literal left to freeze");
        boolean[] vs = values.clone();
        vs[frozenBoundary] = value;
        return new Assignment(universe, vs, frozenBoundary + 1);
    }

    // In-place counterparts of advance(), for searches that save and restore one assignment.

    void freeze(boolean value) {
        Preconditions.checkState(thawedCount() > 0, "no thawed literal left to freeze");
        values[frozenBoundary++] = value;
    }

    void thaw() {
        Preconditions.checkState(frozenBoundary > 0, "no frozen literal left to thaw");
        values[--frozenBoundary] = false;
    }

    Assignment copy() {
        return new Assignment(universe, values.clone(), frozenBoundary);
    }

    public boolean[] toArray() { return values.clone(); }

    public ImmutableMap<String, Boolean> asMap() {
        ImmutableMap.Builder<String, Boolean> mb = ImmutableMap.builder();
        for (int i = 0; i < values.length; ++i) mb.put(universe.name(i), values[i]);
        return mb.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        Assignment a = (Assignment) o;
        return frozenBoundary == a.frozenBoundary && universe.equals(a.universe) && Arrays.equals(values, a.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(universe, frozenBoundary, Arrays.hashCode(values));
    }

    static String truthName(boolean b) { return b ? "True" : "False"; }

    @Override
    public String toString() {
        StringJoiner s = new StringJoiner(" ");
        for (int i = 0; i < values.length; ++i) s.add(universe.name(i) + '=' + truthName(values[i]));
        return s.toString();
    }
}
