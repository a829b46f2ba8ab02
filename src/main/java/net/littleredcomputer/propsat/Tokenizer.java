package net.littleredcomputer.propsat;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * Splits a line of text into {@link Token}s. Whitespace separates tokens and is
 * otherwise ignored. Tokenization never fails: a character which cannot start
 * any token becomes an {@link TokenType#UNKNOWN} token, to be reported when the
 * formula is evaluated.
 */
public class Tokenizer {
    private static final CharMatcher whitespace = CharMatcher.anyOf(" \t\n\u000B\f\r");
    private static final CharMatcher letter = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));
    private static final CharMatcher letterOrDigit = letter.or(CharMatcher.inRange('0', '9'));

    private final String line;
    private int position = 0;

    public Tokenizer(String line) {
        this.line = line;
    }

    /** @return the next token; {@link Token#EOF} once the text is exhausted, and forever after */
    public Token nextToken() {
        while (true) {
            if (position >= line.length()) return Token.EOF;
            final char c = line.charAt(position);
            if (whitespace.matches(c)) {
                ++position;
                continue;
            }
            switch (c) {
                case '&': ++position; return Token.AND;
                case '|': ++position; return Token.OR;
                case '~': ++position; return Token.NOT;
                case '(': ++position; return Token.OPEN_BRACKET;
                case ')': ++position; return Token.CLOSE_BRACKET;
            }
            if (letter.matches(c)) {
                // Maximal munch: a name runs until the first character which is neither letter nor digit.
                final int start = position++;
                while (position < line.length() && letterOrDigit.matches(line.charAt(position))) ++position;
                return Token.literal(line.substring(start, position));
            }
            ++position;
            return Token.unknown(c);
        }
    }

    public static TokenSequence tokenize(String line) {
        Tokenizer t = new Tokenizer(line);
        ImmutableList.Builder<Token> tokens = ImmutableList.builder();
        Token token;
        do {
            token = t.nextToken();
            tokens.add(token);
        } while (!token.isEof());
        return new TokenSequence(tokens.build());
    }
}
