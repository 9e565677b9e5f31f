package com.jpexs.flowchart.statement;

/**
 * Represents a raise statement with an optional exception expression.
 *
 * @author JPEXS
 */
public class RaiseStatement extends Statement {

    private final String exception;

    /**
     * Creates a bare raise (re-raise of the current exception).
     */
    public RaiseStatement() {
        this(null);
    }

    /**
     * Creates a raise statement.
     *
     * @param exception the raised expression, null for a bare raise
     */
    public RaiseStatement(String exception) {
        this.exception = exception;
    }

    /**
     * Gets the raised expression.
     *
     * @return the expression, or null for a bare raise
     */
    public String getException() {
        return exception;
    }

    public boolean hasException() {
        return exception != null && !exception.isEmpty();
    }

    @Override
    public String getKindName() {
        return "Raise";
    }

    @Override
    public String toString(String indent) {
        if (hasException()) {
            return indent + "raise " + exception + "\n";
        }
        return indent + "raise\n";
    }
}
