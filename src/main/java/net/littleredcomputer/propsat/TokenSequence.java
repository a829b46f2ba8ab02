package net.littleredcomputer.propsat;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * An immutable list of tokens, terminated by exactly one {@link Token#EOF}.
 */
public final class TokenSequence implements Iterable<Token> {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private final ImmutableList<Token> tokens;

    TokenSequence(List<Token> tokens) {
        Preconditions.checkArgument(!tokens.isEmpty() && tokens.get(tokens.size() - 1).isEof(),
                "token sequence must end with Eof");
        Preconditions.checkArgument(tokens.stream().filter(Token::isEof).count() == 1,
                "token sequence must contain exactly one Eof");
        this.tokens = ImmutableList.copyOf(tokens);
    }

    /** @return the number of tokens, not counting the terminating Eof */
    public int size() { return tokens.size() - 1; }

    public boolean isEmpty() { return size() == 0; }

    public Token get(int i) {
        Preconditions.checkElementIndex(i, tokens.size());
        return tokens.get(i);
    }

    Stream<Token> literals() {
        return tokens.stream().filter(Token::isLiteral);
    }

    Cursor cursor() { return new Cursor(); }

    /**
     * @return the text forms of the tokens (excluding Eof) separated by single spaces.
     * Tokenizing the rendered text produces this sequence again (less any literal indices).
     */
    public String render() {
        return spaceJoiner.join(tokens.subList(0, size()));
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.subList(0, size()).iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TokenSequence && tokens.equals(((TokenSequence) o).tokens));
    }

    @Override
    public int hashCode() { return tokens.hashCode(); }

    @Override
    public String toString() { return render(); }

    /**
     * A read position in the sequence. Reading stops at Eof: once reached, it is
     * returned by every subsequent call to {@link #next()}.
     */
    final class Cursor {
        private int position = 0;

        Token peek() { return tokens.get(position); }

        Token next() {
            Token t = tokens.get(position);
            if (!t.isEof()) ++position;
            return t;
        }

        /** Step back over the token most recently returned by {@link #next()}. */
        void retreat() {
            Preconditions.checkState(position > 0, "cannot retreat before the first token");
            --position;
        }

        int position() { return position; }
    }
}
