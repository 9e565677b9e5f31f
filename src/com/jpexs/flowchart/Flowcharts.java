package com.jpexs.flowchart;

import static com.google.common.base.Preconditions.checkNotNull;

import com.jpexs.flowchart.source.PythonSourceReader;
import com.jpexs.flowchart.source.SyntaxException;
import com.jpexs.flowchart.statement.Module;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry points turning source text or statement trees into flowcharts.
 *
 * @author JPEXS
 */
public final class Flowcharts {

    private static final Logger LOGGER = Logger.getLogger(Flowcharts.class.getName());

    public static final String SYNTAX_ERROR_LABEL = "Syntax Error: Cannot parse code";

    private Flowcharts() {

    }

    /**
     * Builds the flowchart of source text with default options.
     *
     * @param source the source text
     * @return the graph, a single error node when the text cannot be parsed
     */
    public static GraphDescription fromSource(String source) {
        return fromSource(source, FlowchartOptions.defaults());
    }

    /**
     * Builds the flowchart of source text. Unparseable text produces a graph
     * with a single error node instead of a partial diagram.
     *
     * @param source the source text
     * @param options build options
     * @return the graph
     */
    public static GraphDescription fromSource(String source, FlowchartOptions options) {
        checkNotNull(source, "source");
        checkNotNull(options, "options");
        Module tree;
        try {
            tree = new PythonSourceReader().read(source);
        } catch (SyntaxException ex) {
            LOGGER.log(Level.WARNING, "Cannot parse source of flowchart \"{0}\": {1}", new Object[]{options.getTitle(), ex.getMessage()});
            return FlowchartBuilder.errorGraph(SYNTAX_ERROR_LABEL, options);
        }
        return fromTree(tree, options);
    }

    /**
     * Builds the flowchart of a statement tree.
     *
     * @param tree the tree
     * @param options build options
     * @return the graph
     */
    public static GraphDescription fromTree(Module tree, FlowchartOptions options) {
        return new FlowchartBuilder(options).build(tree);
    }
}
