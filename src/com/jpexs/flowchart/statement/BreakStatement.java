package com.jpexs.flowchart.statement;

/**
 * Represents a break statement.
 *
 * @author JPEXS
 */
public class BreakStatement extends Statement {

    @Override
    public String getKindName() {
        return "Break";
    }

    @Override
    public String toString(String indent) {
        return indent + "break\n";
    }
}
