package net.littleredcomputer.propsat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The distinct literal names of a formula, in order of first occurrence. Each
 * name's position in that order is its index, which assignments use to store
 * the name's value. Immutable, and so shared by every assignment derived
 * while solving a formula.
 */
public final class LiteralUniverse {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private final ImmutableList<String> names;
    private final ImmutableMap<String, Integer> nameIndex;  // inverse of names

    private LiteralUniverse(Iterable<String> names) {
        ImmutableMap.Builder<String, Integer> mb = ImmutableMap.builder();
        List<String> ns = new ArrayList<>();
        Set<String> namesSeen = new HashSet<>();
        for (String name : names) {
            if (!namesSeen.add(name)) throw new IllegalArgumentException("duplicate literal: " + name);
            mb.put(name, ns.size());
            ns.add(name);
        }
        this.names = ImmutableList.copyOf(ns);
        this.nameIndex = mb.build();
    }

    public static LiteralUniverse of(String... names) {
        return new LiteralUniverse(ImmutableList.copyOf(names));
    }

    /**
     * @param tokens a token sequence
     * @return the distinct names of the literal tokens, in order of first appearance
     */
    public static LiteralUniverse collectLiterals(TokenSequence tokens) {
        Set<String> seen = new LinkedHashSet<>();
        tokens.literals().map(Token::name).forEach(seen::add);
        return new LiteralUniverse(seen);
    }

    /**
     * @param tokens a token sequence
     * @return the sequence with each literal token carrying its index in this universe,
     * or {@link Token#UNRESOLVED} if its name is absent here
     */
    public TokenSequence resolve(TokenSequence tokens) {
        List<Token> resolved = new ArrayList<>(tokens.size() + 1);
        for (int i = 0; i <= tokens.size(); ++i) {
            Token t = tokens.get(i);
            resolved.add(t.isLiteral() ? t.withIndex(indexOf(t.name())) : t);
        }
        return new TokenSequence(resolved);
    }

    /** @return the index of the named literal, or -1 if it is not in this universe */
    public int indexOf(String name) {
        Integer ix = nameIndex.get(name);
        return ix == null ? Token.UNRESOLVED : ix;
    }

    public String name(int index) { return names.get(index); }

    public ImmutableList<String> names() { return names; }

    public int size() { return names.size(); }

    public boolean isEmpty() { return names.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof LiteralUniverse && names.equals(((LiteralUniverse) o).names));
    }

    @Override
    public int hashCode() { return names.hashCode(); }

    @Override
    public String toString() { return spaceJoiner.join(names); }
}
