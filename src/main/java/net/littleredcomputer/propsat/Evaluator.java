package net.littleredcomputer.propsat;

/**
 * Evaluates a token sequence under an assignment by recursive descent over
 * the grammar
 * <pre>
 *    expr = clause (('&amp;' | '|') clause)*
 *  clause = '~' clause | literal | '(' expr ')'
 * </pre>
 * Parsing and evaluation happen in the same pass; no syntax tree is built. AND
 * and OR share a precedence level (being associative and commutative, the
 * grouping of a chain of them does not matter), and NOT binds tighter than
 * either. Both operands of a connective are always evaluated, so that a
 * syntax error on the right is found even when the left decides the value.
 * <p>
 * Errors are returned, never thrown. The first one found ends the evaluation.
 */
public final class Evaluator {
    private Evaluator() {}

    public static EvalResult evaluate(TokenSequence tokens, Assignment assignment) {
        return evaluate(tokens, assignment, new SearchStatistics());
    }

    static EvalResult evaluate(TokenSequence tokens, Assignment assignment, SearchStatistics statistics) {
        if (tokens.isEmpty()) return EvalResult.error("no tokens found");
        TokenSequence.Cursor cursor = tokens.cursor();
        EvalResult result = evalExpr(cursor, assignment, statistics);
        if (result.isError()) return result;
        // evalExpr stops at Eof or before a close bracket; at the top level only Eof is acceptable.
        if (!cursor.peek().isEof()) return EvalResult.error("unexpected close bracket");
        return result;
    }

    private static EvalResult evalExpr(TokenSequence.Cursor cursor, Assignment assignment, SearchStatistics statistics) {
        statistics.evaluation();
        EvalResult result = evalClause(cursor, assignment, statistics);
        if (result.isError()) return result;

        while (true) {
            Token t = cursor.next();
            switch (t.type()) {
                case EOF:
                    return result;
                case CLOSE_BRACKET:
                    // Unget, so that the enclosing clause sees its own closing bracket.
                    cursor.retreat();
                    return result;
                case AND:
                case OR: {
                    if (cursor.peek().isEof()) return EvalResult.error("expected something after an And/Or");
                    EvalResult right = evalClause(cursor, assignment, statistics);
                    if (right.isError()) return right;
                    result = EvalResult.of(t.type() == TokenType.AND
                            ? result.value() & right.value()
                            : result.value() | right.value());
                    break;
                }
                default:
                    return EvalResult.error("unexpected %s -- only AND/OR may connect clauses", t.text());
            }
        }
    }

    private static EvalResult evalClause(TokenSequence.Cursor cursor, Assignment assignment, SearchStatistics statistics) {
        Token t = cursor.next();
        switch (t.type()) {
            case NOT: {
                if (cursor.peek().isEof()) return EvalResult.error("expected something after a Not");
                EvalResult operand = evalClause(cursor, assignment, statistics);
                return operand.isError() ? operand : EvalResult.of(!operand.value());
            }
            case LITERAL: {
                int ix = indexIn(t, assignment.universe());
                if (ix < 0) return EvalResult.error("unknown literal %s", t.name());
                statistics.lookup();
                return EvalResult.of(assignment.get(ix));
            }
            case OPEN_BRACKET: {
                if (cursor.peek().isEof()) return EvalResult.error("expected something after an open bracket");
                EvalResult inner = evalExpr(cursor, assignment, statistics);
                if (inner.isError()) return inner;
                if (!cursor.next().isCloseBracket()) return EvalResult.error("expected close bracket");
                return inner;
            }
            case AND:
                return EvalResult.error("a clause cannot begin with AND");
            case OR:
                return EvalResult.error("a clause cannot begin with OR");
            case CLOSE_BRACKET:
                return EvalResult.error("unexpected close bracket");
            case EOF:
                return EvalResult.error("unexpected end of input");
            case UNKNOWN:
                return EvalResult.error("encountered unknown token %s", t.text());
        }
        throw new IllegalStateException("unhandled token type " + t.type());
    }

    /**
     * A resolved token's index is trusted if it names the same literal in the given universe;
     * otherwise the name is looked up there.
     */
    private static int indexIn(Token literal, LiteralUniverse universe) {
        int ix = literal.index();
        if (ix >= 0 && ix < universe.size() && universe.name(ix).equals(literal.name())) return ix;
        return universe.indexOf(literal.name());
    }
}
