package com.jpexs.flowchart.statement;

/**
 * Base class of the statements of a statement tree.
 *
 * @author JPEXS
 */
public abstract class Statement {

    /**
     * Gets the kind name of the statement, like "If" or "AugAssign".
     * Statements the flowchart builder has no special handling for are
     * displayed with this name.
     *
     * @return the kind name
     */
    public abstract String getKindName();

    /**
     * Renders the statement as indented source text.
     *
     * @param indent the indentation prefix
     * @return source text ending with a newline
     */
    public abstract String toString(String indent);

    @Override
    public String toString() {
        return toString("");
    }

    /**
     * Renders a block of statements, "pass" if the block is empty.
     *
     * @param sb target
     * @param body the statements
     * @param indent indentation of the statements
     */
    protected static void appendBody(StringBuilder sb, Iterable<Statement> body, String indent) {
        boolean empty = true;
        for (Statement stmt : body) {
            sb.append(stmt.toString(indent));
            empty = false;
        }
        if (empty) {
            sb.append(indent).append("pass\n");
        }
    }
}
