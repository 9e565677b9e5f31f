package com.jpexs.flowchart.source;

/**
 * One logical line of source: physical lines joined across open brackets,
 * backslash continuations and triple-quoted strings, comments removed.
 *
 * @author JPEXS
 */
final class LogicalLine {
    final int lineNumber;   // first physical line
    final int indent;       // tabs expanded to multiples of 8
    final String text;      // trimmed

    LogicalLine(int lineNumber, int indent, String text) {
        this.lineNumber = lineNumber;
        this.indent = indent;
        this.text = text;
    }

    @Override
    public String toString() {
        return lineNumber + ":" + indent + ": " + text;
    }
}
