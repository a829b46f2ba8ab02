package net.littleredcomputer.propsat;

public enum TokenType {
    AND("&"),
    OR("|"),
    NOT("~"),
    OPEN_BRACKET("("),
    CLOSE_BRACKET(")"),
    LITERAL("Literal"),
    EOF("Eof"),
    UNKNOWN("Unknown");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the text form of tokens of this type. Literal and unknown tokens
     * render their own text instead; see {@link Token#text()}.
     */
    public String symbol() { return symbol; }

    boolean isConnective() { return this == AND || this == OR; }
}
