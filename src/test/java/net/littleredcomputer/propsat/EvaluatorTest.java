package net.littleredcomputer.propsat;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class EvaluatorTest {

    private static String eval(String text, boolean... values) {
        Formula f = Formula.parse(text);
        return f.evaluate(Assignment.of(f.universe(), values)).toString();
    }

    private static String check(String text) {
        return Formula.parse(text).checkSyntax().toString();
    }

    @Test
    public void connectives() {
        assertThat(eval("a & b", true, true), is("True"));
        assertThat(eval("a & b", true, false), is("False"));
        assertThat(eval("a | b", false, true), is("True"));
        assertThat(eval("a | b", false, false), is("False"));
        assertThat(eval("~a", false), is("True"));
        assertThat(eval("~~a", false), is("False"));
    }

    @Test
    public void andAndOrShareOnePrecedenceLevel() {
        // Read left to right: (a | b) & c.
        assertThat(eval("a | b & c", true, false, false), is("False"));
        assertThat(eval("a | (b & c)", true, false, false), is("True"));
        // NOT binds tighter.
        assertThat(eval("~a & b", false, true), is("True"));
        assertThat(eval("~(a & b)", true, false), is("True"));
    }

    @Test
    public void bracketsPreserveValue() {
        assertThat(eval("((a))", true), is("True"));
        assertThat(eval("((a))", false), is("False"));
        assertThat(eval("(a | b) & (~a | ~b)", true, false), is("True"));
    }

    @Test
    public void repeatedLiteralsShareAValue() {
        assertThat(eval("x & ~x", true), is("False"));
        assertThat(eval("x | ~x", false), is("True"));
    }

    @Test
    public void clauseErrors() {
        assertThat(check("a & | b"), is("a clause cannot begin with OR"));
        assertThat(check("& a"), is("a clause cannot begin with AND"));
        assertThat(check(") a"), is("unexpected close bracket"));
        assertThat(check("a & ~"), is("expected something after a Not"));
        assertThat(check("a & ("), is("expected something after an open bracket"));
        assertThat(check("a & # b"), is("encountered unknown token #"));
        assertThat(check("~(a"), is("expected close bracket"));
    }

    @Test
    public void connectiveErrors() {
        assertThat(check("a |"), is("expected something after an And/Or"));
        assertThat(check("a b"), is("unexpected b -- only AND/OR may connect clauses"));
        assertThat(check("a ~b"), is("unexpected ~ -- only AND/OR may connect clauses"));
        assertThat(check("(a) (b)"), is("unexpected ( -- only AND/OR may connect clauses"));
    }

    @Test
    public void unbalancedCloseBracket() {
        assertThat(check("a & b)"), is("unexpected close bracket"));
        assertThat(check("(a))"), is("unexpected close bracket"));
    }

    @Test
    public void errorOnRightIsNotShortCircuited() {
        // a is true, so the OR is decided before its right operand; that operand is still parsed.
        Formula f = Formula.parse("a | (b & )");
        assertThat(f.evaluate(Assignment.of(f.universe(), true, true)).toString(), is("unexpected close bracket"));
        Formula g = Formula.parse("a & (b $ c)");
        assertThat(g.evaluate(Assignment.of(g.universe(), false, false, false)).isError(), is(true));
    }

    @Test
    public void firstErrorWins() {
        assertThat(check("a & & b |"), is("a clause cannot begin with AND"));
    }

    @Test
    public void unknownLiteral() {
        Formula f = Formula.parse("a & b");
        assertThat(Evaluator.evaluate(f.tokens(), Assignment.allThawed(LiteralUniverse.of("a"))).toString(),
                is("unknown literal b"));
    }

    @Test
    public void indicesFollowTheAssignmentsUniverse() {
        // Resolved against [a, b] but evaluated in [b, a]: names decide, not the stale indices.
        Formula f = Formula.parse("a & ~b");
        assertThat(Evaluator.evaluate(f.tokens(), Assignment.of(LiteralUniverse.of("b", "a"), false, true)).toString(),
                is("True"));
    }

    @Test
    public void unresolvedTokensAreLookedUpByName() {
        TokenSequence raw = Tokenizer.tokenize("p | q");
        assertThat(Evaluator.evaluate(raw, Assignment.of(LiteralUniverse.of("p", "q"), false, true)).toString(), is("True"));
    }

    @Test
    public void emptySequence() {
        assertThat(Evaluator.evaluate(Tokenizer.tokenize("  "), Assignment.allThawed(LiteralUniverse.of("a"))).toString(),
                is("no tokens found"));
    }

    @Test
    public void countsEvaluationsAndLookups() {
        Formula f = Formula.parse("(a & (b | c)) & a");
        SearchStatistics s = new SearchStatistics();
        Evaluator.evaluate(f.tokens(), Assignment.allThawed(f.universe()), s);
        assertThat(s.evaluations(), is(3L));
        assertThat(s.lookups(), is(4L));
    }

    @Test(expected = IllegalStateException.class)
    public void errorHasNoValue() {
        Formula.parse("a &").checkSyntax().value();
    }
}
