package com.jpexs.flowchart.statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Common base of for and while loops.
 *
 * @author JPEXS
 */
public abstract class LoopStatement extends Statement {

    private final List<Statement> body;
    private final List<Statement> orElse;

    /**
     * Creates a new loop.
     *
     * @param body the loop body statements
     * @param orElse statements of the else clause, run when the loop ends
     * without break (can be null)
     */
    protected LoopStatement(List<Statement> body, List<Statement> orElse) {
        this.body = body != null ? new ArrayList<>(body) : new ArrayList<>();
        this.orElse = orElse != null ? new ArrayList<>(orElse) : new ArrayList<>();
    }

    /**
     * Gets the text of the loop condition node, like "While: x &lt; 3".
     *
     * @return the header text
     */
    public abstract String getHeader();

    /**
     * Gets the loop body statements.
     *
     * @return the body statements
     */
    public List<Statement> getBody() {
        return new ArrayList<>(body);
    }

    /**
     * Gets the else clause statements.
     *
     * @return the else statements, empty when there is no else clause
     */
    public List<Statement> getOrElse() {
        return new ArrayList<>(orElse);
    }

    public boolean hasElse() {
        return !orElse.isEmpty();
    }

    /**
     * Renders body and else clause below an already rendered header line.
     *
     * @param sb target
     * @param indent indentation of the header
     */
    protected void appendBlocks(StringBuilder sb, String indent) {
        String innerIndent = indent + "    ";
        appendBody(sb, body, innerIndent);
        if (hasElse()) {
            sb.append(indent).append("else:\n");
            appendBody(sb, orElse, innerIndent);
        }
    }
}
