package net.littleredcomputer.propsat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A propositional formula over named literals, tokenized and with its literals
 * indexed, ready to be evaluated or solved. The formula is not known to be
 * well formed until it has been evaluated; see {@link #checkSyntax()}.
 */
public class Formula {
    private static final Logger log = LogManager.getFormatterLogger(Formula.class);
    private final String text;
    private final TokenSequence tokens;
    private final LiteralUniverse universe;

    private Formula(String text, TokenSequence tokens, LiteralUniverse universe) {
        this.text = text;
        this.tokens = tokens;
        this.universe = universe;
    }

    /**
     * @param text formula text, e.g. {@code ~(mike & sally) & ~peter}
     * @return the formula
     * @throws IllegalArgumentException if the text is empty, contains no tokens,
     * or mentions no literals (a formula without literals is rejected rather than
     * evaluated)
     */
    public static Formula parse(String text) {
        if (text.isEmpty()) throw new IllegalArgumentException("contents is empty -- cannot solve");
        TokenSequence raw = Tokenizer.tokenize(text);
        if (raw.isEmpty()) throw new IllegalArgumentException("no tokens found -- cannot solve");
        LiteralUniverse universe = LiteralUniverse.collectLiterals(raw);
        if (universe.isEmpty()) throw new IllegalArgumentException("no literals to solve");
        log.debug("parsed input: %s", raw);
        log.debug("unique literals: %s", universe);
        return new Formula(text, universe.resolve(raw), universe);
    }

    public String text() { return text; }

    public TokenSequence tokens() { return tokens; }

    public LiteralUniverse universe() { return universe; }

    public int nLiterals() { return universe.size(); }

    /** @return the result of evaluating the formula with every literal false */
    public EvalResult checkSyntax() {
        return evaluate(Assignment.allThawed(universe));
    }

    public EvalResult evaluate(Assignment a) {
        return Evaluator.evaluate(tokens, a);
    }

    /**
     * @param values one value per literal, in order of first appearance
     * @return the truth value of the formula at that point
     * @throws IllegalArgumentException if the formula is malformed
     */
    public boolean evaluate(boolean... values) {
        EvalResult r = evaluate(Assignment.of(universe, values));
        if (r.isError()) throw new IllegalArgumentException(r.error());
        return r.value();
    }

    public SearchResult solve() {
        return new BacktrackingSolver(this).solve();
    }

    @Override
    public String toString() { return tokens.render(); }
}
