package com.jpexs.flowchart;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests the command line of {@link Main}. */
@RunWith(JUnit4.class)
public final class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;

    @Before
    public void setUp() throws UnsupportedEncodingException {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream(outBytes, true, "UTF-8");
        err = new PrintStream(errBytes, true, "UTF-8");
    }

    private int run(String... args) {
        return Main.run(args, out, err);
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private File write(String name, String content) throws IOException {
        File file = folder.newFile(name);
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testFileToStandardOutput() throws IOException {
        File input = write("hello.py", "def hello():\n    return True\n");

        assertThat(run("--title", "Hello", "--direction", "LR", input.getPath())).isEqualTo(Main.EXIT_OK);
        assertThat(out()).startsWith("digraph {\n");
        assertThat(out()).contains("rankdir=\"LR\";");
        assertThat(out()).contains("label=\"Hello\";");
        assertThat(out()).contains("label=\"Function: hello\"");
        assertThat(out()).contains("n0 -> n1;");
    }

    @Test
    public void testOutputFile() throws IOException {
        File input = write("loop.py", "while True:\n    break\n");
        File output = new File(folder.getRoot(), "loop.dot");

        assertThat(run("-o", output.getPath(), "--theme", "Dark Mode", input.getPath())).isEqualTo(Main.EXIT_OK);
        String dot = new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8);
        assertThat(dot).contains("fillcolor=\"#883333\"");
        assertThat(out()).isEmpty();
        assertThat(err()).contains("Flowchart saved to: " + output.getPath());
    }

    @Test
    public void testExample() {
        assertThat(run("--example", "Smart Light (Loop & Condition)")).isEqualTo(Main.EXIT_OK);
        assertThat(out()).contains("label=\"For: reading in sensor_readings\"");
    }

    @Test
    public void testListExamples() {
        assertThat(run("--list-examples")).isEqualTo(Main.EXIT_OK);
        assertThat(out()).contains("File Safer (Try/Except/Finally)");
    }

    @Test
    public void testHelp() {
        assertThat(run("--help")).isEqualTo(Main.EXIT_OK);
        assertThat(out()).startsWith("Usage:");
    }

    @Test
    public void testPrintTree() throws IOException {
        File input = write("tree.py", "while x:  # loop\n    x -= 1\n");

        assertThat(run("--print-tree", input.getPath())).isEqualTo(Main.EXIT_OK);
        assertThat(out()).isEqualTo("while x:\n    x -= 1\n");
    }

    @Test
    public void testSyntaxError() throws IOException {
        File input = write("broken.py", "x = 1\nif x\n    y = 2\n");

        assertThat(run(input.getPath())).isEqualTo(Main.EXIT_SYNTAX_ERROR);
        assertThat(err()).contains("line 2: expected ':'");
        assertThat(out()).isEmpty();
    }

    @Test
    public void testBadArguments() {
        assertThat(run()).isEqualTo(Main.EXIT_ERROR);
        assertThat(err()).contains("Usage:");
        assertThat(run("a.py", "b.py")).isEqualTo(Main.EXIT_ERROR);
        assertThat(run("--theme", "Neon", "a.py")).isEqualTo(Main.EXIT_ERROR);
        assertThat(run("--title")).isEqualTo(Main.EXIT_ERROR);
        assertThat(run("--example", "Missing")).isEqualTo(Main.EXIT_ERROR);
    }

    @Test
    public void testMissingInputFile() {
        File missing = new File(folder.getRoot(), "missing.py");

        assertThat(run(missing.getPath())).isEqualTo(Main.EXIT_ERROR);
        assertThat(err()).contains("Cannot read " + missing.getPath());
    }
}
