package com.jpexs.flowchart.source;

import com.jpexs.flowchart.statement.AssignmentStatement;
import com.jpexs.flowchart.statement.BreakStatement;
import com.jpexs.flowchart.statement.ContinueStatement;
import com.jpexs.flowchart.statement.ExpressionStatement;
import com.jpexs.flowchart.statement.ForStatement;
import com.jpexs.flowchart.statement.FunctionStatement;
import com.jpexs.flowchart.statement.GenericStatement;
import com.jpexs.flowchart.statement.IfStatement;
import com.jpexs.flowchart.statement.Module;
import com.jpexs.flowchart.statement.PassStatement;
import com.jpexs.flowchart.statement.RaiseStatement;
import com.jpexs.flowchart.statement.ReturnStatement;
import com.jpexs.flowchart.statement.Statement;
import com.jpexs.flowchart.statement.TryStatement;
import com.jpexs.flowchart.statement.WhileStatement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads Python source text into a statement tree.
 * <p>
 * Only the statement structure is parsed: block nesting by indentation and
 * the kind of every statement. Expressions are kept as source text.
 *
 * @author JPEXS
 */
public class PythonSourceReader {

    private static final List<String> COMPOUND_KEYWORDS = Arrays.asList(
            "if", "elif", "else", "for", "while", "try", "except", "finally", "def", "class", "with", "async");

    /**
     * Simple statements that get no special treatment, keyword to kind name.
     */
    private static final Map<String, String> GENERIC_KEYWORDS = new LinkedHashMap<>();

    static {
        GENERIC_KEYWORDS.put("import", "Import");
        GENERIC_KEYWORDS.put("from", "ImportFrom");
        GENERIC_KEYWORDS.put("global", "Global");
        GENERIC_KEYWORDS.put("nonlocal", "Nonlocal");
        GENERIC_KEYWORDS.put("del", "Delete");
        GENERIC_KEYWORDS.put("assert", "Assert");
    }

    private List<LogicalLine> lines;
    private int pos;

    /**
     * Reads source text.
     *
     * @param source the source text
     * @return the statement tree
     * @throws SyntaxException when the text is not valid source
     */
    public Module read(String source) {
        lines = new LogicalLineReader(source).readLines();
        pos = 0;
        if (!lines.isEmpty() && lines.get(0).indent != 0) {
            throw new SyntaxException(lines.get(0).lineNumber, "unexpected indent");
        }
        List<Statement> body = parseBlock(0);
        return new Module(body);
    }

    private List<Statement> parseBlock(int indent) {
        List<Statement> body = new ArrayList<>();
        while (pos < lines.size()) {
            LogicalLine line = lines.get(pos);
            if (line.indent < indent) {
                break;
            }
            if (line.indent > indent) {
                if (pos > 0 && lines.get(pos - 1).indent > line.indent) {
                    throw new SyntaxException(line.lineNumber, "unindent does not match any outer indentation level");
                }
                throw new SyntaxException(line.lineNumber, "unexpected indent");
            }
            body.addAll(parseStatement(line));
        }
        return body;
    }

    private List<Statement> parseStatement(LogicalLine line) {
        String text = line.text;

        if (text.startsWith("@")) {
            pos++;
            if (pos >= lines.size() || lines.get(pos).indent != line.indent) {
                throw new SyntaxException(line.lineNumber, "decorator without function or class definition");
            }
            LogicalLine next = lines.get(pos);
            if (!next.text.startsWith("@") && !startsWithKeyword(next.text, "def")
                    && !startsWithKeyword(next.text, "class") && !startsWithKeyword(next.text, "async")) {
                throw new SyntaxException(next.lineNumber, "invalid syntax");
            }
            return parseStatement(next);
        }

        if (startsWithKeyword(text, "if")) {
            return single(parseIf(line, 2));
        }
        if (startsWithKeyword(text, "for")) {
            return single(parseFor(line, 3, false));
        }
        if (startsWithKeyword(text, "while")) {
            return single(parseWhile(line));
        }
        if (startsWithKeyword(text, "try")) {
            return single(parseTry(line));
        }
        if (startsWithKeyword(text, "def")) {
            return single(parseFunction(line, 3, false));
        }
        if (startsWithKeyword(text, "class")) {
            return single(parseOpaqueCompound(line, 5, "ClassDef"));
        }
        if (startsWithKeyword(text, "with")) {
            return single(parseOpaqueCompound(line, 4, "With"));
        }
        if (startsWithKeyword(text, "async")) {
            String rest = text.substring(5).trim();
            int offset = text.length() - rest.length();
            if (startsWithKeyword(rest, "def")) {
                return single(parseFunction(line, offset + 3, true));
            }
            if (startsWithKeyword(rest, "for")) {
                return single(parseFor(line, offset + 3, true));
            }
            if (startsWithKeyword(rest, "with")) {
                return single(parseOpaqueCompound(line, offset + 4, "AsyncWith"));
            }
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        if (isMatchHeader(text)) {
            return single(parseMatch(line));
        }
        for (String keyword : Arrays.asList("elif", "else", "except", "finally")) {
            if (startsWithKeyword(text, keyword)) {
                throw new SyntaxException(line.lineNumber, "'" + keyword + "' without matching statement");
            }
        }

        pos++;
        return parseSimpleStatements(text, line.lineNumber);
    }

    private IfStatement parseIf(LogicalLine line, int keywordLength) {
        Header header = splitHeader(line, keywordLength);
        if (header.expression.isEmpty()) {
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        pos++;
        List<Statement> onTrue = parseSuite(line, header.rest);

        List<Statement> onFalse;
        LogicalLine next = nextClause(line, "elif");
        if (next != null) {
            onFalse = single(parseIf(next, 4));
        } else {
            onFalse = parseElse(line);
        }
        return new IfStatement(header.expression, onTrue, onFalse);
    }

    private ForStatement parseFor(LogicalLine line, int keywordEnd, boolean async) {
        Header header = splitHeader(line, keywordEnd);
        int in = TopLevel.indexOfWord(header.expression, "in", 0);
        if (in <= 0) {
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        String target = header.expression.substring(0, in).trim();
        String iterable = header.expression.substring(in + 2).trim();
        if (target.isEmpty() || iterable.isEmpty()) {
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        pos++;
        List<Statement> body = parseSuite(line, header.rest);
        List<Statement> orElse = parseElse(line);
        return new ForStatement(target, iterable, async, body, orElse);
    }

    private WhileStatement parseWhile(LogicalLine line) {
        Header header = splitHeader(line, 5);
        if (header.expression.isEmpty()) {
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        pos++;
        List<Statement> body = parseSuite(line, header.rest);
        List<Statement> orElse = parseElse(line);
        return new WhileStatement(header.expression, body, orElse);
    }

    private TryStatement parseTry(LogicalLine line) {
        Header header = splitHeader(line, 3);
        requireEmpty(header, line);
        pos++;
        List<Statement> body = parseSuite(line, header.rest);

        List<TryStatement.ExceptHandler> handlers = new ArrayList<>();
        boolean bareSeen = false;
        LogicalLine next;
        while ((next = nextClause(line, "except")) != null) {
            if (bareSeen) {
                throw new SyntaxException(next.lineNumber, "default 'except:' must be last");
            }
            Header handlerHeader = splitHeader(next, 6);
            String type = handlerHeader.expression;
            if (type.startsWith("*")) {
                type = type.substring(1).trim();
            }
            String name = null;
            int as = TopLevel.indexOfWord(type, "as", 0);
            if (as != -1) {
                name = type.substring(as + 2).trim();
                type = type.substring(0, as).trim();
                if (name.isEmpty() || type.isEmpty()) {
                    throw new SyntaxException(next.lineNumber, "invalid syntax");
                }
            }
            if (type.isEmpty()) {
                type = null;
                bareSeen = true;
            }
            pos++;
            handlers.add(new TryStatement.ExceptHandler(type, name, parseSuite(next, handlerHeader.rest)));
        }

        List<Statement> orElse = null;
        next = nextClause(line, "else");
        if (next != null) {
            if (handlers.isEmpty()) {
                throw new SyntaxException(next.lineNumber, "expected 'except' or 'finally' block");
            }
            orElse = parseElse(line);
        }

        List<Statement> finallyBody = null;
        next = nextClause(line, "finally");
        if (next != null) {
            Header finallyHeader = splitHeader(next, 7);
            requireEmpty(finallyHeader, next);
            pos++;
            finallyBody = parseSuite(next, finallyHeader.rest);
        }

        if (handlers.isEmpty() && finallyBody == null) {
            throw new SyntaxException(line.lineNumber, "expected 'except' or 'finally' block");
        }
        return new TryStatement(body, handlers, orElse, finallyBody);
    }

    private FunctionStatement parseFunction(LogicalLine line, int keywordEnd, boolean async) {
        Header header = splitHeader(line, keywordEnd);
        String signature = header.expression;
        int open = signature.indexOf('(');
        if (open <= 0) {
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        String name = signature.substring(0, open).trim();
        if (!isIdentifier(name)) {
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        int close = TopLevel.matchingBracket(signature, open);
        String parameters = signature.substring(open + 1, close).trim();
        pos++;
        List<Statement> body = parseSuite(line, header.rest);
        return new FunctionStatement(name, parameters, async, body);
    }

    /**
     * Parses a compound statement whose body is not shown in the flowchart,
     * like a class definition or a with block.
     */
    private GenericStatement parseOpaqueCompound(LogicalLine line, int keywordEnd, String kindName) {
        Header header = splitHeader(line, keywordEnd);
        if (header.expression.isEmpty()) {
            throw new SyntaxException(line.lineNumber, "invalid syntax");
        }
        pos++;
        parseSuite(line, header.rest);
        return new GenericStatement(kindName, line.text.substring(0, header.colon + 1));
    }

    private GenericStatement parseMatch(LogicalLine line) {
        Header header = splitHeader(line, 5);
        pos++;
        if (pos >= lines.size() || lines.get(pos).indent <= line.indent) {
            throw new SyntaxException(line.lineNumber, "expected an indented block after 'match' statement on line " + line.lineNumber);
        }
        int caseIndent = lines.get(pos).indent;
        while (pos < lines.size() && lines.get(pos).indent == caseIndent) {
            LogicalLine caseLine = lines.get(pos);
            if (!startsWithKeyword(caseLine.text, "case")) {
                throw new SyntaxException(caseLine.lineNumber, "invalid syntax");
            }
            Header caseHeader = splitHeader(caseLine, 4);
            pos++;
            parseSuite(caseLine, caseHeader.rest);
        }
        return new GenericStatement("Match", line.text.substring(0, header.colon + 1));
    }

    /**
     * Parses an optional else clause following a statement at the same indent.
     *
     * @return the else body, or null when there is no else clause
     */
    private List<Statement> parseElse(LogicalLine owner) {
        LogicalLine next = nextClause(owner, "else");
        if (next == null) {
            return null;
        }
        Header header = splitHeader(next, 4);
        requireEmpty(header, next);
        pos++;
        return parseSuite(next, header.rest);
    }

    /**
     * Gets the next line if it is the given clause of the owner statement.
     */
    private LogicalLine nextClause(LogicalLine owner, String keyword) {
        if (pos >= lines.size()) {
            return null;
        }
        LogicalLine next = lines.get(pos);
        if (next.indent != owner.indent || !startsWithKeyword(next.text, keyword)) {
            return null;
        }
        return next;
    }

    /**
     * Parses the body of a compound statement: either the rest of the header
     * line or an indented block.
     */
    private List<Statement> parseSuite(LogicalLine header, String rest) {
        if (!rest.isEmpty()) {
            for (String keyword : COMPOUND_KEYWORDS) {
                if (startsWithKeyword(rest, keyword)) {
                    throw new SyntaxException(header.lineNumber, "invalid syntax");
                }
            }
            return parseSimpleStatements(rest, header.lineNumber);
        }
        if (pos >= lines.size() || lines.get(pos).indent <= header.indent) {
            String keyword = header.text.split("[^A-Za-z_]", 2)[0];
            throw new SyntaxException(header.lineNumber,
                    "expected an indented block after '" + keyword + "' statement on line " + header.lineNumber);
        }
        return parseBlock(lines.get(pos).indent);
    }

    private List<Statement> parseSimpleStatements(String text, int lineNumber) {
        List<Statement> ret = new ArrayList<>();
        List<String> parts = TopLevel.split(text, ';');
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i);
            if (part.isEmpty()) {
                if (i == parts.size() - 1 && i > 0) {
                    break;
                }
                throw new SyntaxException(lineNumber, "invalid syntax");
            }
            ret.add(parseSimpleStatement(part, lineNumber));
        }
        return ret;
    }

    private Statement parseSimpleStatement(String text, int lineNumber) {
        if (text.equals("pass")) {
            return new PassStatement();
        }
        if (text.equals("break")) {
            return new BreakStatement();
        }
        if (text.equals("continue")) {
            return new ContinueStatement();
        }
        if (startsWithKeyword(text, "return")) {
            String value = text.substring(6).trim();
            return new ReturnStatement(value.isEmpty() ? null : value);
        }
        if (startsWithKeyword(text, "raise")) {
            String exception = text.substring(5).trim();
            if (exception.isEmpty()) {
                return new RaiseStatement();
            }
            int from = TopLevel.indexOfWord(exception, "from", 0);
            if (from == 0) {
                throw new SyntaxException(lineNumber, "invalid syntax");
            }
            if (from > 0) {
                exception = exception.substring(0, from).trim();
            }
            return new RaiseStatement(exception);
        }
        for (Map.Entry<String, String> entry : GENERIC_KEYWORDS.entrySet()) {
            if (startsWithKeyword(text, entry.getKey())) {
                if (text.length() == entry.getKey().length()) {
                    throw new SyntaxException(lineNumber, "invalid syntax");
                }
                return new GenericStatement(entry.getValue(), text);
            }
        }
        for (String keyword : COMPOUND_KEYWORDS) {
            if (startsWithKeyword(text, keyword)) {
                throw new SyntaxException(lineNumber, "invalid syntax");
            }
        }

        int eq = TopLevel.findAssignment(text);
        int colon = TopLevel.findHeaderColon(text, 0);
        if (colon != -1 && (eq == -1 || colon < eq) && !startsWithKeyword(text, "lambda")) {
            if (colon == 0 || colon == text.length() - 1) {
                throw new SyntaxException(lineNumber, "invalid syntax");
            }
            return new AssignmentStatement(AssignmentStatement.Kind.ANN_ASSIGN, text);
        }
        if (eq != -1) {
            boolean augmented = TopLevel.isAugmented(text, eq);
            int operatorStart = eq;
            while (operatorStart > 0 && "+-*/%&|^@<>".indexOf(text.charAt(operatorStart - 1)) != -1) {
                operatorStart--;
            }
            if (text.substring(0, augmented ? operatorStart : eq).trim().isEmpty() || eq == text.length() - 1) {
                throw new SyntaxException(lineNumber, "invalid syntax");
            }
            return new AssignmentStatement(augmented ? AssignmentStatement.Kind.AUG_ASSIGN : AssignmentStatement.Kind.ASSIGN, text);
        }
        return new ExpressionStatement(text);
    }

    private Header splitHeader(LogicalLine line, int keywordEnd) {
        int colon = TopLevel.findHeaderColon(line.text, keywordEnd);
        if (colon == -1) {
            throw new SyntaxException(line.lineNumber, "expected ':'");
        }
        return new Header(line.text.substring(keywordEnd, colon).trim(), line.text.substring(colon + 1).trim(), colon);
    }

    private static void requireEmpty(Header header, LogicalLine line) {
        if (!header.expression.isEmpty()) {
            throw new SyntaxException(line.lineNumber, "expected ':'");
        }
    }

    /**
     * "match" is a soft keyword: "match = 1" is an assignment, "match(x)" a call.
     */
    private boolean isMatchHeader(String text) {
        if (!startsWithKeyword(text, "match") || !text.endsWith(":")) {
            return false;
        }
        if (TopLevel.findAssignment(text) != -1) {
            return false;
        }
        int colon = TopLevel.findHeaderColon(text, 5);
        return colon == text.length() - 1 && !text.substring(5, colon).trim().isEmpty()
                && pos + 1 < lines.size() && lines.get(pos + 1).indent > lines.get(pos).indent;
    }

    private static boolean startsWithKeyword(String text, String keyword) {
        return TopLevel.startsWithKeyword(text, keyword);
    }

    private static boolean isIdentifier(String name) {
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!TopLevel.isIdentifierChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static List<Statement> single(Statement stmt) {
        return new ArrayList<>(Collections.singletonList(stmt));
    }

    private static final class Header {
        final String expression;
        final String rest;
        final int colon;

        Header(String expression, String rest, int colon) {
            this.expression = expression;
            this.rest = rest;
            this.colon = colon;
        }
    }
}
