package net.littleredcomputer.propsat;

import com.google.common.base.Preconditions;

/**
 * The outcome of evaluating a formula: either a truth value or a description
 * of the first problem found in the formula's text.
 */
public final class EvalResult {
    private static final EvalResult TRUE = new EvalResult(true, null);
    private static final EvalResult FALSE = new EvalResult(false, null);

    private final boolean value;
    private final String error;

    private EvalResult(boolean value, String error) {
        this.value = value;
        this.error = error;
    }

    static EvalResult of(boolean value) { return value ? TRUE : FALSE; }

    static EvalResult error(String format, Object... args) {
        return new EvalResult(false, String.format(format, args));
    }

    public boolean isError() { return error != null; }

    public boolean value() {
        Preconditions.checkState(error == null, "no value: %s", error);
        return value;
    }

    public String error() {
        Preconditions.checkState(error != null, "evaluation succeeded");
        return error;
    }

    @Override
    public String toString() {
        return isError() ? error : Assignment.truthName(value);
    }
}
