package net.littleredcomputer.propsat;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * One lexical unit of a formula. Literal tokens carry the literal's name and,
 * once resolved against a {@link LiteralUniverse}, its index there. Unknown
 * tokens carry the character that could not be matched.
 */
public final class Token {
    static final int UNRESOLVED = -1;

    static final Token AND = new Token(TokenType.AND, null, UNRESOLVED);
    static final Token OR = new Token(TokenType.OR, null, UNRESOLVED);
    static final Token NOT = new Token(TokenType.NOT, null, UNRESOLVED);
    static final Token OPEN_BRACKET = new Token(TokenType.OPEN_BRACKET, null, UNRESOLVED);
    static final Token CLOSE_BRACKET = new Token(TokenType.CLOSE_BRACKET, null, UNRESOLVED);
    static final Token EOF = new Token(TokenType.EOF, null, UNRESOLVED);

    private final TokenType type;
    private final String text;  // literal name or unknown character; null otherwise
    private final int index;

    private Token(TokenType type, String text, int index) {
        this.type = type;
        this.text = text;
        this.index = index;
    }

    static Token literal(String name) {
        Preconditions.checkArgument(!name.isEmpty(), "literal name must not be empty");
        return new Token(TokenType.LITERAL, name, UNRESOLVED);
    }

    static Token unknown(char c) {
        return new Token(TokenType.UNKNOWN, String.valueOf(c), UNRESOLVED);
    }

    /**
     * @param index position of this literal in its universe, or {@link #UNRESOLVED}
     * @return a copy of this literal token carrying the index
     */
    Token withIndex(int index) {
        Preconditions.checkState(type == TokenType.LITERAL, "only literals can be resolved, not %s", type);
        return index == this.index ? this : new Token(type, text, index);
    }

    public TokenType type() { return type; }
    public boolean isLiteral() { return type == TokenType.LITERAL; }
    public boolean isCloseBracket() { return type == TokenType.CLOSE_BRACKET; }
    public boolean isEof() { return type == TokenType.EOF; }
    public boolean isResolved() { return index != UNRESOLVED; }

    public String name() {
        Preconditions.checkState(type == TokenType.LITERAL, "%s token has no name", type);
        return text;
    }

    public int index() { return index; }

    public String text() {
        return text != null ? text : type.symbol();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return type == t.type && index == t.index && Objects.equals(text, t.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, index);
    }

    @Override
    public String toString() {
        return text();
    }
}
