package com.jpexs.flowchart.statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a function definition.
 *
 * @author JPEXS
 */
public class FunctionStatement extends Statement {

    private final String name;
    private final String parameters;
    private final boolean async;
    private final List<Statement> body;

    /**
     * Creates a new function definition.
     *
     * @param name the function name
     * @param parameters parameter list text without parentheses
     * @param async whether this is an "async def"
     * @param body the body statements
     */
    public FunctionStatement(String name, String parameters, boolean async, List<Statement> body) {
        this.name = name;
        this.parameters = parameters != null ? parameters : "";
        this.async = async;
        this.body = body != null ? new ArrayList<>(body) : new ArrayList<>();
    }

    /**
     * Creates a new function definition without parameters.
     *
     * @param name the function name
     * @param body the body statements
     */
    public FunctionStatement(String name, List<Statement> body) {
        this(name, "", false, body);
    }

    public String getName() {
        return name;
    }

    public String getParameters() {
        return parameters;
    }

    public boolean isAsync() {
        return async;
    }

    public List<Statement> getBody() {
        return new ArrayList<>(body);
    }

    @Override
    public String getKindName() {
        return async ? "AsyncFunctionDef" : "FunctionDef";
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent);
        if (async) {
            sb.append("async ");
        }
        sb.append("def ").append(name).append('(').append(parameters).append("):\n");
        appendBody(sb, body, indent + "    ");
        return sb.toString();
    }
}
