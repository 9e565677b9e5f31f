package com.jpexs.flowchart;

import com.jpexs.flowchart.source.PythonSourceReader;
import com.jpexs.flowchart.source.SyntaxException;
import com.jpexs.flowchart.statement.Module;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: converts a source file into a Graphviz DOT
 * flowchart.
 *
 * @author JPEXS
 */
public class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_SYNTAX_ERROR = 2;

    private static final String USAGE =
            "Usage: flowchart [options] <input.py>\n" +
            "       flowchart [options] --example <name>\n" +
            "       flowchart --list-examples\n" +
            "\n" +
            "Options:\n" +
            "  -o, --output <file>     write DOT to file instead of standard output\n" +
            "  --title <title>         flowchart title (default: Flowchart)\n" +
            "  --direction <TB|LR>     layout direction (default: TB)\n" +
            "  --theme <name>          color theme: Classic (Pastel), Clean White, Dark Mode, Blueberry\n" +
            "  --print-tree            write the parsed statement tree instead of DOT\n" +
            "  -h, --help              show this help\n";

    private Main() {

    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the command line.
     *
     * @param args the arguments
     * @param out standard output
     * @param err error output
     * @return exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        FlowchartOptions.Builder options = FlowchartOptions.builder();
        String input = null;
        String example = null;
        String output = null;
        boolean printTree = false;

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h":
                    case "--help":
                        out.print(USAGE);
                        return EXIT_OK;
                    case "--list-examples":
                        for (String name : Examples.getNames()) {
                            out.println(name);
                        }
                        return EXIT_OK;
                    case "-o":
                    case "--output":
                        output = value(args, ++i, arg);
                        break;
                    case "--title":
                        options.setTitle(value(args, ++i, arg));
                        break;
                    case "--direction":
                        options.setDirection(LayoutDirection.fromString(value(args, ++i, arg)));
                        break;
                    case "--theme":
                        options.setTheme(Theme.fromName(value(args, ++i, arg)));
                        break;
                    case "--print-tree":
                        printTree = true;
                        break;
                    case "--example":
                        example = value(args, ++i, arg);
                        break;
                    default:
                        if (arg.startsWith("-") || input != null) {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        input = arg;
                }
            }
            if ((input == null) == (example == null)) {
                throw new IllegalArgumentException("Exactly one of <input.py> or --example is required");
            }
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.print(USAGE);
            return EXIT_ERROR;
        }

        String source;
        String sourceName;
        try {
            if (example != null) {
                source = Examples.getSource(example);
                sourceName = example;
            } else {
                source = new String(Files.readAllBytes(Paths.get(input)), StandardCharsets.UTF_8);
                sourceName = input;
            }
        } catch (IllegalArgumentException | IOException ex) {
            LOGGER.log(Level.FINE, "Cannot read input", ex);
            err.println("Cannot read " + (example != null ? "example " + example : input) + ": " + ex.getMessage());
            return EXIT_ERROR;
        }

        Module tree;
        try {
            tree = new PythonSourceReader().read(source);
        } catch (SyntaxException ex) {
            err.println("Syntax error in " + sourceName + ", " + ex.getMessage());
            return EXIT_SYNTAX_ERROR;
        }

        String text = printTree ? tree.toString() : new FlowchartBuilder(options.build()).build(tree).toDot();
        if (output == null) {
            out.print(text);
            return EXIT_OK;
        }
        try {
            Path path = Paths.get(output);
            Files.write(path, text.getBytes(StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | IOException ex) {
            err.println("Cannot write " + output + ": " + ex.getMessage());
            return EXIT_ERROR;
        }
        err.println("Flowchart saved to: " + output);
        return EXIT_OK;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value of " + option);
        }
        return args[index];
    }
}
