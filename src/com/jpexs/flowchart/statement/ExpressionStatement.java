package com.jpexs.flowchart.statement;

/**
 * Represents a bare expression statement, typically a call.
 *
 * @author JPEXS
 */
public class ExpressionStatement extends Statement {

    private final String expression;

    /**
     * Creates a new expression statement.
     *
     * @param expression the expression source text
     */
    public ExpressionStatement(String expression) {
        this.expression = expression;
    }

    /**
     * Gets the expression text.
     *
     * @return the expression text
     */
    public String getExpression() {
        return expression;
    }

    /**
     * Checks whether the expression is nothing but a string literal, which is
     * how documentation strings are written. Byte literals and f-strings are not
     * documentation strings.
     *
     * @return true for a documentation string
     */
    public boolean isDocString() {
        return isStringLiteral(expression);
    }

    /**
     * Checks whether a text consists of one or more adjacent string literals,
     * optionally wrapped in parentheses.
     *
     * @param text the expression text
     * @return true if the text is a plain string literal
     */
    public static boolean isStringLiteral(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == '(' && trimmed.charAt(trimmed.length() - 1) == ')') {
            // only literals inside, so the outer parentheses pair with each other
            return isStringLiteral(trimmed.substring(1, trimmed.length() - 1));
        }
        int pos = 0;
        int len = text.length();
        int literals = 0;
        while (true) {
            while (pos < len && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            if (pos >= len) {
                break;
            }

            int prefixStart = pos;
            while (pos < len && Character.isLetter(text.charAt(pos))) {
                pos++;
            }
            String prefix = text.substring(prefixStart, pos).toLowerCase();
            if (!prefix.isEmpty() && !prefix.equals("r") && !prefix.equals("u")) {
                return false;
            }
            if (pos >= len) {
                return false;
            }
            char quote = text.charAt(pos);
            if (quote != '"' && quote != '\'') {
                return false;
            }
            boolean triple = text.startsWith("" + quote + quote + quote, pos);
            pos += triple ? 3 : 1;

            boolean closed = false;
            while (pos < len) {
                char c = text.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                    continue;
                }
                if (c == quote) {
                    if (!triple) {
                        pos++;
                        closed = true;
                        break;
                    }
                    if (text.startsWith("" + quote + quote + quote, pos)) {
                        pos += 3;
                        closed = true;
                        break;
                    }
                }
                if (c == '\n' && !triple) {
                    return false;
                }
                pos++;
            }
            if (!closed) {
                return false;
            }
            literals++;
        }
        return literals > 0;
    }

    @Override
    public String getKindName() {
        return "Expr";
    }

    @Override
    public String toString(String indent) {
        return indent + expression + "\n";
    }
}
