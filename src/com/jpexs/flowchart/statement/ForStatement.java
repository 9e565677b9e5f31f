package com.jpexs.flowchart.statement;

import java.util.List;

/**
 * Represents a for loop over an iterable.
 *
 * @author JPEXS
 */
public class ForStatement extends LoopStatement {

    private final String target;
    private final String iterable;
    private final boolean async;

    public ForStatement(String target, String iterable, List<Statement> body) {
        this(target, iterable, false, body, null);
    }

    /**
     * Creates a new for loop.
     *
     * @param target the loop variable(s)
     * @param iterable the iterated expression
     * @param async whether this is an "async for"
     * @param body the loop body statements
     * @param orElse statements of the else clause (can be null)
     */
    public ForStatement(String target, String iterable, boolean async, List<Statement> body, List<Statement> orElse) {
        super(body, orElse);
        this.target = target;
        this.iterable = iterable;
        this.async = async;
    }

    public String getTarget() {
        return target;
    }

    public String getIterable() {
        return iterable;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public String getHeader() {
        return "For: " + target + " in " + iterable;
    }

    @Override
    public String getKindName() {
        return async ? "AsyncFor" : "For";
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent);
        if (async) {
            sb.append("async ");
        }
        sb.append("for ").append(target).append(" in ").append(iterable).append(":\n");
        appendBlocks(sb, indent);
        return sb.toString();
    }
}
