package com.jpexs.flowchart.statement;

/**
 * Represents the no-op statement "pass".
 *
 * @author JPEXS
 */
public class PassStatement extends Statement {

    @Override
    public String getKindName() {
        return "Pass";
    }

    @Override
    public String toString(String indent) {
        return indent + "pass\n";
    }
}
