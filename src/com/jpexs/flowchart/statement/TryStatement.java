package com.jpexs.flowchart.statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a try statement with except handlers and optional else and
 * finally blocks.
 *
 * @author JPEXS
 */
public class TryStatement extends Statement {

    private final List<Statement> tryBody;
    private final List<ExceptHandler> handlers;
    private final List<Statement> orElse;
    private final List<Statement> finallyBody;

    /**
     * Represents a single except clause.
     */
    public static class ExceptHandler {
        private final String type;
        private final String name;
        private final List<Statement> body;

        /**
         * Creates a new except clause.
         *
         * @param type the matched exception type expression, null for a bare except
         * @param name the name the exception is bound to, can be null
         * @param body the handler statements
         */
        public ExceptHandler(String type, String name, List<Statement> body) {
            this.type = type;
            this.name = name;
            this.body = body != null ? new ArrayList<>(body) : new ArrayList<>();
        }

        public ExceptHandler(String type, List<Statement> body) {
            this(type, null, body);
        }

        /**
         * Gets the matched exception type.
         *
         * @return the type expression, or null for a bare except
         */
        public String getType() {
            return type;
        }

        public String getName() {
            return name;
        }

        public List<Statement> getBody() {
            return new ArrayList<>(body);
        }

        /**
         * Gets the label of the edge leading into this handler.
         *
         * @return "Exc: type", or "Exception" for a bare except
         */
        public String getEdgeLabel() {
            if (type == null || type.isEmpty()) {
                return "Exception";
            }
            return "Exc: " + type;
        }
    }

    /**
     * Creates a new try statement.
     *
     * @param tryBody the statements in the try block
     * @param handlers the except clauses in source order
     * @param orElse the statements in the else block (can be null)
     * @param finallyBody the statements in the finally block (can be null)
     */
    public TryStatement(List<Statement> tryBody, List<ExceptHandler> handlers, List<Statement> orElse, List<Statement> finallyBody) {
        this.tryBody = tryBody != null ? new ArrayList<>(tryBody) : new ArrayList<>();
        this.handlers = handlers != null ? new ArrayList<>(handlers) : new ArrayList<>();
        this.orElse = orElse != null ? new ArrayList<>(orElse) : new ArrayList<>();
        this.finallyBody = finallyBody != null ? new ArrayList<>(finallyBody) : new ArrayList<>();
    }

    /**
     * Gets the try body statements.
     *
     * @return the try body statements
     */
    public List<Statement> getTryBody() {
        return new ArrayList<>(tryBody);
    }

    /**
     * Gets the except clauses.
     *
     * @return the handlers in source order
     */
    public List<ExceptHandler> getHandlers() {
        return new ArrayList<>(handlers);
    }

    public List<Statement> getOrElse() {
        return new ArrayList<>(orElse);
    }

    public List<Statement> getFinallyBody() {
        return new ArrayList<>(finallyBody);
    }

    public boolean hasElse() {
        return !orElse.isEmpty();
    }

    public boolean hasFinally() {
        return !finallyBody.isEmpty();
    }

    @Override
    public String getKindName() {
        return "Try";
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        String innerIndent = indent + "    ";

        sb.append(indent).append("try:\n");
        appendBody(sb, tryBody, innerIndent);

        for (ExceptHandler handler : handlers) {
            sb.append(indent).append("except");
            if (handler.getType() != null) {
                sb.append(' ').append(handler.getType());
                if (handler.getName() != null) {
                    sb.append(" as ").append(handler.getName());
                }
            }
            sb.append(":\n");
            appendBody(sb, handler.getBody(), innerIndent);
        }

        if (hasElse()) {
            sb.append(indent).append("else:\n");
            appendBody(sb, orElse, innerIndent);
        }
        if (hasFinally()) {
            sb.append(indent).append("finally:\n");
            appendBody(sb, finallyBody, innerIndent);
        }

        return sb.toString();
    }
}
