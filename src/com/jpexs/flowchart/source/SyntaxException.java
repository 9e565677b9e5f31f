package com.jpexs.flowchart.source;

/**
 * Thrown when source text cannot be read into a statement tree.
 *
 * @author JPEXS
 */
public class SyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String detail;

    /**
     * Creates a new syntax exception.
     *
     * @param lineNumber 1-based line of the error
     * @param detail description of the problem
     */
    public SyntaxException(int lineNumber, String detail) {
        super("line " + lineNumber + ": " + detail);
        this.lineNumber = lineNumber;
        this.detail = detail;
    }

    /**
     * Gets the line of the error.
     *
     * @return 1-based line number
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Gets the problem description without the line number.
     *
     * @return the description
     */
    public String getDetail() {
        return detail;
    }
}
