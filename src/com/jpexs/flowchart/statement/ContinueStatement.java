package com.jpexs.flowchart.statement;

/**
 * Represents a continue statement.
 *
 * @author JPEXS
 */
public class ContinueStatement extends Statement {

    @Override
    public String getKindName() {
        return "Continue";
    }

    @Override
    public String toString(String indent) {
        return indent + "continue\n";
    }
}
