package com.jpexs.flowchart.statement;

/**
 * A statement of a kind that gets no special treatment, like an import or a
 * with block. It is kept as its kind name and source text only.
 *
 * @author JPEXS
 */
public class GenericStatement extends Statement {

    private final String kindName;
    private final String source;

    /**
     * Creates a new generic statement.
     *
     * @param kindName the kind name, like "Import" or "With"
     * @param source the source text of the statement, can be null
     */
    public GenericStatement(String kindName, String source) {
        this.kindName = kindName;
        this.source = source;
    }

    public GenericStatement(String kindName) {
        this(kindName, null);
    }

    public String getSource() {
        return source;
    }

    @Override
    public String getKindName() {
        return kindName;
    }

    @Override
    public String toString(String indent) {
        if (source == null || source.isEmpty()) {
            return indent + "# " + kindName + "\n";
        }
        StringBuilder sb = new StringBuilder();
        for (String line : source.split("\n", -1)) {
            sb.append(indent).append(line).append('\n');
        }
        return sb.toString();
    }
}
