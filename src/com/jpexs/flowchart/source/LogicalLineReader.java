package com.jpexs.flowchart.source;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits source text into logical lines.
 *
 * @author JPEXS
 */
final class LogicalLineReader {

    private static final int TAB_SIZE = 8;

    private final String source;
    private int pos = 0;
    private int lineNumber = 1;

    LogicalLineReader(String source) {
        String normalized = source.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }
        this.source = normalized;
    }

    /**
     * Reads all logical lines. Blank and comment-only lines are skipped.
     *
     * @return the lines
     * @throws SyntaxException on unterminated strings or unbalanced brackets
     */
    List<LogicalLine> readLines() {
        List<LogicalLine> ret = new ArrayList<>();
        while (pos < source.length()) {
            LogicalLine line = readLine();
            if (line != null) {
                ret.add(line);
            }
        }
        return ret;
    }

    private LogicalLine readLine() {
        int startLine = lineNumber;
        int indent = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent = (indent / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c != '\f') {
                break;
            }
            pos++;
        }

        StringBuilder sb = new StringBuilder();
        Deque<Character> brackets = new ArrayDeque<>();
        Deque<Integer> bracketLines = new ArrayDeque<>();

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                readString(sb);
                continue;
            }
            if (c == '\\' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                pos += 2;
                lineNumber++;
                skipIndentation();
                appendSpace(sb);
                continue;
            }
            if (c == '\\' && pos + 1 >= source.length()) {
                throw new SyntaxException(lineNumber, "unexpected end of file after line continuation");
            }
            if (c == '\n') {
                pos++;
                lineNumber++;
                if (brackets.isEmpty()) {
                    break;
                }
                skipIndentation();
                if (pos < source.length() && ")]}".indexOf(source.charAt(pos)) == -1
                        && sb.length() > 0 && "([{".indexOf(sb.charAt(sb.length() - 1)) == -1) {
                    appendSpace(sb);
                }
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                brackets.push(c);
                bracketLines.push(lineNumber);
            } else if (c == ')' || c == ']' || c == '}') {
                if (brackets.isEmpty()) {
                    throw new SyntaxException(lineNumber, "unmatched '" + c + "'");
                }
                char open = brackets.pop();
                bracketLines.pop();
                if (closing(open) != c) {
                    throw new SyntaxException(lineNumber, "closing parenthesis '" + c + "' does not match opening parenthesis '" + open + "'");
                }
            }
            sb.append(c);
            pos++;
        }

        if (!brackets.isEmpty()) {
            throw new SyntaxException(bracketLines.peek(), "'" + brackets.peek() + "' was never closed");
        }

        String text = sb.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        return new LogicalLine(startLine, indent, text);
    }

    private void readString(StringBuilder sb) {
        int start = pos;
        int startLine = lineNumber;
        char quote = source.charAt(pos);
        String triple = "" + quote + quote + quote;
        boolean isTriple = source.startsWith(triple, pos);
        pos += isTriple ? 3 : 1;
        while (true) {
            if (pos >= source.length()) {
                throw new SyntaxException(startLine, isTriple ? "unterminated triple-quoted string literal" : "unterminated string literal");
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                    lineNumber++;
                }
                pos += 2;
                continue;
            }
            if (c == '\n') {
                if (!isTriple) {
                    throw new SyntaxException(startLine, "unterminated string literal");
                }
                lineNumber++;
            }
            if (isTriple && source.startsWith(triple, pos)) {
                pos += 3;
                break;
            }
            if (!isTriple && c == quote) {
                pos++;
                break;
            }
            pos++;
        }
        sb.append(source, start, pos);
    }

    private void skipIndentation() {
        while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
            pos++;
        }
    }

    private static void appendSpace(StringBuilder sb) {
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ' ') {
            sb.append(' ');
        }
    }

    private static char closing(char open) {
        switch (open) {
            case '(':
                return ')';
            case '[':
                return ']';
            default:
                return '}';
        }
    }
}
