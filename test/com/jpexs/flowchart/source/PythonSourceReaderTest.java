package com.jpexs.flowchart.source;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.jpexs.flowchart.statement.AssignmentStatement;
import com.jpexs.flowchart.statement.BreakStatement;
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
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link PythonSourceReader}. */
@RunWith(JUnit4.class)
public final class PythonSourceReaderTest {

    private static List<Statement> read(String... lines) {
        return new PythonSourceReader().read(String.join("\n", lines) + "\n").getBody();
    }

    private static SyntaxException readFailing(final String... lines) {
        return assertThrows(SyntaxException.class, () -> read(lines));
    }

    @Test
    public void testFunctionWithBody() {
        List<Statement> body = read(
                "def hello(name: str = \"x\") -> bool:",
                "    print(\"Hello\")",
                "    return True");

        assertThat(body).hasSize(1);
        FunctionStatement function = (FunctionStatement) body.get(0);
        assertThat(function.getName()).isEqualTo("hello");
        assertThat(function.getParameters()).isEqualTo("name: str = \"x\"");
        assertThat(function.isAsync()).isFalse();
        assertThat(function.getBody()).hasSize(2);
        assertThat(((ExpressionStatement) function.getBody().get(0)).getExpression()).isEqualTo("print(\"Hello\")");
        assertThat(((ReturnStatement) function.getBody().get(1)).getValue()).isEqualTo("True");
    }

    @Test
    public void testAsyncFunction() {
        FunctionStatement function = (FunctionStatement) read(
                "async def fetch():",
                "    return 1").get(0);

        assertThat(function.isAsync()).isTrue();
        assertThat(function.getKindName()).isEqualTo("AsyncFunctionDef");
    }

    @Test
    public void testDecoratorIsSkipped() {
        List<Statement> body = read(
                "@cache",
                "@trace(level=2)",
                "def f():",
                "    pass");

        assertThat(body).hasSize(1);
        assertThat(((FunctionStatement) body.get(0)).getName()).isEqualTo("f");
    }

    @Test
    public void testElifChain() {
        List<Statement> body = read(
                "if a:",
                "    x = 1",
                "elif b:",
                "    x = 2",
                "else:",
                "    x = 3");

        IfStatement first = (IfStatement) body.get(0);
        assertThat(first.getCondition()).isEqualTo("a");
        assertThat(first.getOnFalse()).hasSize(1);
        IfStatement second = (IfStatement) first.getOnFalse().get(0);
        assertThat(second.getCondition()).isEqualTo("b");
        assertThat(second.hasElse()).isTrue();
        assertThat(((AssignmentStatement) second.getOnFalse().get(0)).getSource()).isEqualTo("x = 3");
    }

    @Test
    public void testIfWithoutElse() {
        IfStatement ifStmt = (IfStatement) read(
                "if x > 5:",
                "    y = 1").get(0);

        assertThat(ifStmt.hasElse()).isFalse();
        assertThat(ifStmt.getOnFalse()).isEmpty();
    }

    @Test
    public void testInlineSuiteAndSemicolons() {
        List<Statement> body = read(
                "if cond: return 1",
                "a = 1; b = 2;");

        assertThat(body).hasSize(3);
        IfStatement ifStmt = (IfStatement) body.get(0);
        assertThat(ifStmt.getOnTrue().get(0)).isInstanceOf(ReturnStatement.class);
        assertThat(((AssignmentStatement) body.get(1)).getSource()).isEqualTo("a = 1");
        assertThat(((AssignmentStatement) body.get(2)).getSource()).isEqualTo("b = 2");
    }

    @Test
    public void testLoops() {
        List<Statement> body = read(
                "for i, item in enumerate(items):",
                "    if item:",
                "        break",
                "else:",
                "    pass",
                "while not done:",
                "    step()");

        ForStatement forStmt = (ForStatement) body.get(0);
        assertThat(forStmt.getTarget()).isEqualTo("i, item");
        assertThat(forStmt.getIterable()).isEqualTo("enumerate(items)");
        assertThat(forStmt.getHeader()).isEqualTo("For: i, item in enumerate(items)");
        assertThat(forStmt.hasElse()).isTrue();
        assertThat(forStmt.getOrElse().get(0)).isInstanceOf(PassStatement.class);
        IfStatement ifStmt = (IfStatement) forStmt.getBody().get(0);
        assertThat(ifStmt.getOnTrue().get(0)).isInstanceOf(BreakStatement.class);

        WhileStatement whileStmt = (WhileStatement) body.get(1);
        assertThat(whileStmt.getHeader()).isEqualTo("While: not done");
        assertThat(whileStmt.hasElse()).isFalse();
    }

    @Test
    public void testTryClauses() {
        TryStatement tryStmt = (TryStatement) read(
                "try:",
                "    process()",
                "except ValueError as e:",
                "    handle(e)",
                "except (KeyError, IndexError):",
                "    pass",
                "except:",
                "    raise",
                "else:",
                "    ok()",
                "finally:",
                "    cleanup()").get(0);

        assertThat(tryStmt.getTryBody()).hasSize(1);
        List<TryStatement.ExceptHandler> handlers = tryStmt.getHandlers();
        assertThat(handlers).hasSize(3);
        assertThat(handlers.get(0).getType()).isEqualTo("ValueError");
        assertThat(handlers.get(0).getName()).isEqualTo("e");
        assertThat(handlers.get(0).getEdgeLabel()).isEqualTo("Exc: ValueError");
        assertThat(handlers.get(1).getEdgeLabel()).isEqualTo("Exc: (KeyError, IndexError)");
        assertThat(handlers.get(2).getType()).isNull();
        assertThat(handlers.get(2).getEdgeLabel()).isEqualTo("Exception");
        assertThat(handlers.get(2).getBody().get(0)).isInstanceOf(RaiseStatement.class);
        assertThat(tryStmt.hasElse()).isTrue();
        assertThat(tryStmt.hasFinally()).isTrue();
    }

    @Test
    public void testTryFinallyOnly() {
        TryStatement tryStmt = (TryStatement) read(
                "try:",
                "    work()",
                "finally:",
                "    cleanup()").get(0);

        assertThat(tryStmt.getHandlers()).isEmpty();
        assertThat(tryStmt.hasFinally()).isTrue();
    }

    @Test
    public void testSimpleStatementKinds() {
        List<Statement> body = read(
                "import os",
                "from sys import argv",
                "x = 1",
                "x += 1",
                "x <<= 2",
                "total: int = 0",
                "x == 1",
                "x <= 1",
                "print(x, sep='=')",
                "f(key=value)",
                "raise ValueError('bad') from err",
                "return");

        assertThat(((GenericStatement) body.get(0)).getKindName()).isEqualTo("Import");
        assertThat(((GenericStatement) body.get(1)).getKindName()).isEqualTo("ImportFrom");
        assertThat(((AssignmentStatement) body.get(2)).getKind()).isEqualTo(AssignmentStatement.Kind.ASSIGN);
        assertThat(((AssignmentStatement) body.get(3)).getKind()).isEqualTo(AssignmentStatement.Kind.AUG_ASSIGN);
        assertThat(((AssignmentStatement) body.get(4)).getKind()).isEqualTo(AssignmentStatement.Kind.AUG_ASSIGN);
        assertThat(((AssignmentStatement) body.get(5)).getKind()).isEqualTo(AssignmentStatement.Kind.ANN_ASSIGN);
        assertThat(body.get(6)).isInstanceOf(ExpressionStatement.class);
        assertThat(body.get(7)).isInstanceOf(ExpressionStatement.class);
        assertThat(body.get(8)).isInstanceOf(ExpressionStatement.class);
        assertThat(body.get(9)).isInstanceOf(ExpressionStatement.class);
        assertThat(((RaiseStatement) body.get(10)).getException()).isEqualTo("ValueError('bad')");
        assertThat(((ReturnStatement) body.get(11)).hasValue()).isFalse();
    }

    @Test
    public void testOpaqueCompoundStatements() {
        List<Statement> body = read(
                "class Foo(Base):",
                "    def method(self):",
                "        return 1",
                "with open(path) as handle:",
                "    data = handle.read()",
                "match command:",
                "    case \"go\":",
                "        go()",
                "    case _:",
                "        pass",
                "match = 1");

        assertThat(body).hasSize(4);
        assertThat(body.get(0).getKindName()).isEqualTo("ClassDef");
        assertThat(((GenericStatement) body.get(0)).getSource()).isEqualTo("class Foo(Base):");
        assertThat(body.get(1).getKindName()).isEqualTo("With");
        assertThat(body.get(2).getKindName()).isEqualTo("Match");
        assertThat(body.get(3)).isInstanceOf(AssignmentStatement.class);
    }

    @Test
    public void testCommentsAndContinuationLines() {
        List<Statement> body = read(
                "# leading comment",
                "x = compute(1,  # first",
                "            2)",
                "",
                "y = 1 + \\",
                "    2",
                "s = \"# not a comment\"");

        assertThat(body).hasSize(3);
        String first = ((AssignmentStatement) body.get(0)).getSource();
        assertThat(first).startsWith("x = compute(1,");
        assertThat(first).endsWith("2)");
        assertThat(first).doesNotContain("first");
        assertThat(((AssignmentStatement) body.get(1)).getSource()).isEqualTo("y = 1 + 2");
        assertThat(((AssignmentStatement) body.get(2)).getSource()).isEqualTo("s = \"# not a comment\"");
    }

    @Test
    public void testDocString() {
        FunctionStatement function = (FunctionStatement) read(
                "def f():",
                "    \"\"\"Does things.",
                "",
                "    More text.\"\"\"",
                "    return 1").get(0);

        assertThat(function.getBody()).hasSize(2);
        assertThat(((ExpressionStatement) function.getBody().get(0)).isDocString()).isTrue();
    }

    @Test
    public void testParenthesizedDocString() {
        FunctionStatement function = (FunctionStatement) read(
                "def f():",
                "    (\"Does things \"",
                "     \"in two parts.\")",
                "    return 1").get(0);

        assertThat(((ExpressionStatement) function.getBody().get(0)).isDocString()).isTrue();
    }

    @Test
    public void testEmptySource() {
        Module tree = new PythonSourceReader().read("# nothing here\n\n");

        assertThat(tree.isEmpty()).isTrue();
    }

    @Test
    public void testBrokenFunctionHeader() {
        readFailing(
                "def broken_code(:",
                "    print(\"Missing parenthesis\")");
    }

    @Test
    public void testMissingColon() {
        SyntaxException ex = readFailing(
                "if x",
                "    y = 1");

        assertThat(ex.getLineNumber()).isEqualTo(1);
        assertThat(ex.getDetail()).isEqualTo("expected ':'");
        assertThat(ex.getMessage()).isEqualTo("line 1: expected ':'");
    }

    @Test
    public void testUnexpectedIndent() {
        SyntaxException ex = readFailing(
                "x = 1",
                "    y = 2");

        assertThat(ex.getLineNumber()).isEqualTo(2);
        assertThat(ex.getDetail()).isEqualTo("unexpected indent");
    }

    @Test
    public void testInconsistentDedent() {
        SyntaxException ex = readFailing(
                "if x:",
                "        y = 1",
                "    z = 2");

        assertThat(ex.getLineNumber()).isEqualTo(3);
        assertThat(ex.getDetail()).isEqualTo("unindent does not match any outer indentation level");
    }

    @Test
    public void testMissingBlock() {
        SyntaxException ex = readFailing(
                "while x:",
                "y = 1");

        assertThat(ex.getDetail()).isEqualTo("expected an indented block after 'while' statement on line 1");
    }

    @Test
    public void testDanglingClauses() {
        assertThat(readFailing("else:", "    x = 1").getDetail()).isEqualTo("'else' without matching statement");
        assertThat(readFailing("except:", "    x = 1").getDetail()).isEqualTo("'except' without matching statement");
    }

    @Test
    public void testTryWithoutHandler() {
        SyntaxException ex = readFailing(
                "try:",
                "    x = 1",
                "y = 2");

        assertThat(ex.getDetail()).isEqualTo("expected 'except' or 'finally' block");
    }

    @Test
    public void testBareExceptMustBeLast() {
        SyntaxException ex = readFailing(
                "try:",
                "    x = 1",
                "except:",
                "    pass",
                "except ValueError:",
                "    pass");

        assertThat(ex.getLineNumber()).isEqualTo(5);
    }

    @Test
    public void testUnbalancedBrackets() {
        assertThat(readFailing("x = (1,", "y = 2").getDetail()).isEqualTo("'(' was never closed");
        assertThat(readFailing("x = 1)").getDetail()).isEqualTo("unmatched ')'");
        assertThat(readFailing("x = [1)").getDetail())
                .isEqualTo("closing parenthesis ')' does not match opening parenthesis '['");
    }

    @Test
    public void testUnterminatedString() {
        SyntaxException ex = readFailing(
                "x = 1",
                "s = 'abc");

        assertThat(ex.getLineNumber()).isEqualTo(2);
        assertThat(ex.getDetail()).isEqualTo("unterminated string literal");
    }
}
