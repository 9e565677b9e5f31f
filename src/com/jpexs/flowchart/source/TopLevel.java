package com.jpexs.flowchart.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Searches in a logical line for characters and words that are outside of
 * brackets and string literals.
 *
 * @author JPEXS
 */
final class TopLevel {

    private static final String AUGMENTED_OPERATOR_CHARS = "+-*/%&|^@";

    private TopLevel() {

    }

    /**
     * Finds the first occurrence of a character at bracket depth 0.
     *
     * @param text the text
     * @param c the character
     * @param from start index
     * @return the index, or -1 when not found
     */
    static int indexOf(String text, char c, int from) {
        int depth = 0;
        int i = from;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '"' || ch == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (depth == 0 && ch == c) {
                return i;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
            }
            i++;
        }
        return -1;
    }

    /**
     * Finds the colon ending a compound statement header. Walrus operators
     * are skipped.
     *
     * @param text the header line
     * @param from start index
     * @return index of the colon, or -1
     */
    static int findHeaderColon(String text, int from) {
        int i = from;
        while (true) {
            int colon = indexOf(text, ':', i);
            if (colon == -1) {
                return -1;
            }
            if (colon + 1 < text.length() && text.charAt(colon + 1) == '=') {
                i = colon + 2;
                continue;
            }
            return colon;
        }
    }

    /**
     * Finds a keyword at bracket depth 0, like "in" of a for header.
     *
     * @param text the text
     * @param word the keyword
     * @param from start index
     * @return index of the keyword, or -1
     */
    static int indexOfWord(String text, String word, int from) {
        int depth = 0;
        int i = from;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '"' || ch == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
            } else if (depth == 0 && text.startsWith(word, i)
                    && (i == 0 || !isIdentifierChar(text.charAt(i - 1)))
                    && (i + word.length() >= text.length() || !isIdentifierChar(text.charAt(i + word.length())))) {
                return i;
            } else if (isIdentifierChar(ch)) {
                // skip the rest of the identifier so "within" never matches "in"
                while (i + 1 < text.length() && isIdentifierChar(text.charAt(i + 1))) {
                    i++;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Splits a text at a separator occurring at bracket depth 0.
     *
     * @param text the text
     * @param separator the separator
     * @return trimmed parts, empty parts included
     */
    static List<String> split(String text, char separator) {
        List<String> ret = new ArrayList<>();
        int start = 0;
        while (true) {
            int pos = indexOf(text, separator, start);
            if (pos == -1) {
                ret.add(text.substring(start).trim());
                return ret;
            }
            ret.add(text.substring(start, pos).trim());
            start = pos + 1;
        }
    }

    /**
     * Finds the bracket closing the one at the given index.
     *
     * @param text the text
     * @param open index of the opening bracket
     * @return index of the closing bracket, or -1
     */
    static int matchingBracket(String text, int open) {
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '"' || ch == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Finds the '=' of an assignment at bracket depth 0. Comparisons
     * ("==", "!=", "&lt;=", "&gt;=") and walrus operators are skipped.
     *
     * @param text the statement
     * @return index of '=', or -1 when the statement is no assignment
     */
    static int findAssignment(String text) {
        int i = 0;
        while (true) {
            int eq = indexOf(text, '=', i);
            if (eq == -1) {
                return -1;
            }
            if (eq + 1 < text.length() && text.charAt(eq + 1) == '=') {
                i = eq + 2;
                continue;
            }
            char prev = eq > 0 ? text.charAt(eq - 1) : ' ';
            if (prev == '!' || prev == ':') {
                i = eq + 1;
                continue;
            }
            if ((prev == '<' || prev == '>') && !(eq > 1 && text.charAt(eq - 2) == prev)) {
                i = eq + 1;
                continue;
            }
            return eq;
        }
    }

    /**
     * Checks whether the assignment '=' found by {@link #findAssignment}
     * belongs to an augmented operator like "+=" or "&gt;&gt;=".
     *
     * @param text the statement
     * @param eq index of '='
     * @return true for augmented assignment
     */
    static boolean isAugmented(String text, int eq) {
        if (eq == 0) {
            return false;
        }
        char prev = text.charAt(eq - 1);
        if (prev == '<' || prev == '>') {
            return true;
        }
        return AUGMENTED_OPERATOR_CHARS.indexOf(prev) != -1;
    }

    /**
     * Skips a string literal.
     *
     * @param text the text
     * @param start index of the opening quote
     * @return index after the closing quote, or text length when unterminated
     */
    static int skipString(String text, int start) {
        char quote = text.charAt(start);
        String triple = "" + quote + quote + quote;
        boolean isTriple = text.startsWith(triple, start);
        int i = start + (isTriple ? 3 : 1);
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (isTriple) {
                if (text.startsWith(triple, i)) {
                    return i + 3;
                }
            } else if (ch == quote) {
                return i + 1;
            }
            i++;
        }
        return text.length();
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Checks whether a text starts with a keyword followed by a non identifier
     * character.
     *
     * @param text the text
     * @param keyword the keyword
     * @return true if the text starts with the keyword
     */
    static boolean startsWithKeyword(String text, String keyword) {
        if (!text.startsWith(keyword)) {
            return false;
        }
        return text.length() == keyword.length() || !isIdentifierChar(text.charAt(keyword.length()));
    }
}
