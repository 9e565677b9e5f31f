package com.jpexs.flowchart.statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents an if statement with optional else branch. An elif chain is an
 * if statement nested as the only statement of the else branch.
 *
 * @author JPEXS
 */
public class IfStatement extends Statement {

    private final String condition;
    private final List<Statement> onTrue;
    private final List<Statement> onFalse;

    /**
     * Creates a new if statement without else branch.
     *
     * @param condition the condition expression
     * @param onTrue the statements to execute when condition is true
     */
    public IfStatement(String condition, List<Statement> onTrue) {
        this(condition, onTrue, null);
    }

    /**
     * Creates a new if-else statement.
     *
     * @param condition the condition expression
     * @param onTrue the statements to execute when condition is true
     * @param onFalse the statements to execute when condition is false
     */
    public IfStatement(String condition, List<Statement> onTrue, List<Statement> onFalse) {
        this.condition = condition;
        this.onTrue = onTrue != null ? new ArrayList<>(onTrue) : new ArrayList<>();
        this.onFalse = onFalse != null ? new ArrayList<>(onFalse) : new ArrayList<>();
    }

    /**
     * Gets the condition expression.
     *
     * @return the condition expression
     */
    public String getCondition() {
        return condition;
    }

    /**
     * Gets the statements to execute when condition is true.
     *
     * @return the true branch statements
     */
    public List<Statement> getOnTrue() {
        return new ArrayList<>(onTrue);
    }

    /**
     * Gets the statements to execute when condition is false.
     *
     * @return the false branch statements
     */
    public List<Statement> getOnFalse() {
        return new ArrayList<>(onFalse);
    }

    /**
     * Checks if this if statement has an else branch.
     *
     * @return true if there is an else branch
     */
    public boolean hasElse() {
        return !onFalse.isEmpty();
    }

    @Override
    public String getKindName() {
        return "If";
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("if ").append(condition).append(":\n");

        String innerIndent = indent + "    ";
        appendBody(sb, onTrue, innerIndent);

        if (hasElse()) {
            sb.append(indent).append("else:\n");
            appendBody(sb, onFalse, innerIndent);
        }

        return sb.toString();
    }
}
