package com.jpexs.flowchart.statement;

/**
 * Represents a plain, augmented ("+=") or annotated ("x: int = 0") assignment.
 *
 * @author JPEXS
 */
public class AssignmentStatement extends Statement {

    /**
     * Kind of assignment.
     */
    public enum Kind {
        ASSIGN("Assign"),
        AUG_ASSIGN("AugAssign"),
        ANN_ASSIGN("AnnAssign");

        private final String kindName;

        private Kind(String kindName) {
            this.kindName = kindName;
        }

        public String getKindName() {
            return kindName;
        }
    }

    private final Kind kind;
    private final String source;

    /**
     * Creates a new assignment.
     *
     * @param kind the assignment kind
     * @param source the whole statement text, like "total += x"
     */
    public AssignmentStatement(Kind kind, String source) {
        this.kind = kind;
        this.source = source;
    }

    /**
     * Creates a new plain assignment.
     *
     * @param source the whole statement text
     */
    public AssignmentStatement(String source) {
        this(Kind.ASSIGN, source);
    }

    public Kind getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String getKindName() {
        return kind.getKindName();
    }

    @Override
    public String toString(String indent) {
        return indent + source + "\n";
    }
}
