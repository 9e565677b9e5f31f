package com.jpexs.flowchart.structure;

import com.jpexs.flowchart.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Loop being traversed: its condition node and the break and continue nodes
 * found in its body so far.
 */
public class LoopContext {
    public final Node condition;         // target of back-edges and continues
    public final List<Node> breaks;      // connected to whatever follows the loop
    public final List<Node> continues;   // connected back to condition

    public LoopContext(Node condition) {
        this.condition = condition;
        this.breaks = new ArrayList<>();
        this.continues = new ArrayList<>();
    }

    @Override
    public String toString() {
        return "Loop{condition=" + condition +
               ", breaks=" + breaks +
               ", continues=" + continues + "}";
    }
}
