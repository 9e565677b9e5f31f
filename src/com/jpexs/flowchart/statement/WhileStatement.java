package com.jpexs.flowchart.statement;

import java.util.List;

/**
 * Represents a while loop.
 *
 * @author JPEXS
 */
public class WhileStatement extends LoopStatement {

    private final String condition;

    public WhileStatement(String condition, List<Statement> body) {
        this(condition, body, null);
    }

    public WhileStatement(String condition, List<Statement> body, List<Statement> orElse) {
        super(body, orElse);
        this.condition = condition;
    }

    public String getCondition() {
        return condition;
    }

    @Override
    public String getHeader() {
        return "While: " + condition;
    }

    @Override
    public String getKindName() {
        return "While";
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("while ").append(condition).append(":\n");
        appendBlocks(sb, indent);
        return sb.toString();
    }
}
