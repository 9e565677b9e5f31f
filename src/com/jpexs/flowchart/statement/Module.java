package com.jpexs.flowchart.statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a statement tree: the top level statements of one source file.
 *
 * @author JPEXS
 */
public class Module {

    private final List<Statement> body;

    /**
     * Creates a new module.
     *
     * @param body the top level statements
     */
    public Module(List<Statement> body) {
        this.body = body != null ? new ArrayList<>(body) : new ArrayList<>();
    }

    /**
     * Gets the top level statements.
     *
     * @return the statements
     */
    public List<Statement> getBody() {
        return new ArrayList<>(body);
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Statement stmt : body) {
            sb.append(stmt.toString(""));
        }
        return sb.toString();
    }
}
