package com.jpexs.flowchart.statement;

/**
 * Represents a return statement with an optional value.
 *
 * @author JPEXS
 */
public class ReturnStatement extends Statement {

    private final String value;

    /**
     * Creates a bare return.
     */
    public ReturnStatement() {
        this(null);
    }

    /**
     * Creates a return statement.
     *
     * @param value the returned expression, null for a bare return
     */
    public ReturnStatement(String value) {
        this.value = value;
    }

    /**
     * Gets the returned expression.
     *
     * @return the expression, or null for a bare return
     */
    public String getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }

    @Override
    public String getKindName() {
        return "Return";
    }

    @Override
    public String toString(String indent) {
        if (hasValue()) {
            return indent + "return " + value + "\n";
        }
        return indent + "return\n";
    }
}
