package com.jpexs.flowchart;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Builds the bundled examples. */
@RunWith(JUnit4.class)
public final class ExamplesTest {

    private static GraphDescription build(String name) {
        return Flowcharts.fromSource(Examples.getSource(name), FlowchartOptions.builder().setTitle(name).build());
    }

    private static List<String> edges(GraphDescription graph) {
        List<String> ret = new ArrayList<>();
        for (Edge edge : graph.getEdges()) {
            ret.add(edge.toString());
        }
        return ret;
    }

    private static List<String> unreachable(GraphDescription graph) {
        List<String> ret = new ArrayList<>();
        for (Node node : graph.getNodes()) {
            if (node.getKind() != NodeKind.START && graph.getInEdges(node).isEmpty()) {
                ret.add(node.getLabel());
            }
        }
        return ret;
    }

    @Test
    public void testNames() {
        assertThat(Examples.getNames()).containsExactly(
                "ATM Machine (If/Else)",
                "Smart Light (Loop & Condition)",
                "Server Connection (While Loop)",
                "File Safer (Try/Except/Finally)",
                "Order Processing (Nested)").inOrder();
        assertThrows(IllegalArgumentException.class, () -> Examples.getSource("Missing"));
    }

    @Test
    public void testAllExamplesBuild() {
        for (String name : Examples.getNames()) {
            GraphDescription graph = build(name);
            assertThat(graph.getNode(0).getKind()).isEqualTo(NodeKind.START);
            for (int i = 0; i < graph.getNodes().size(); i++) {
                assertThat(graph.getNodes().get(i).getId()).isEqualTo(i);
            }
            for (Edge edge : graph.getEdges()) {
                assertThat(graph.getNode(edge.getFrom())).isNotNull();
                assertThat(graph.getNode(edge.getTo())).isNotNull();
            }
            for (Node node : graph.getNodes()) {
                if (node.getKind() == NodeKind.TERMINAL) {
                    assertThat(graph.getOutEdges(node)).isEmpty();
                }
                if (node.getKind() == NodeKind.DEAD_END_JUMP) {
                    assertThat(graph.getOutEdges(node)).hasSize(1);
                }
            }
            assertThat(graph.toDot()).startsWith("digraph {\n");
        }
    }

    @Test
    public void testAtmMachine() {
        GraphDescription graph = build("ATM Machine (If/Else)");

        assertThat(unreachable(graph)).isEmpty();
        Node ret = graph.findNode("Return: result");
        List<Integer> sources = new ArrayList<>();
        for (Edge edge : graph.getInEdges(ret)) {
            sources.add(edge.getFrom());
        }
        assertThat(sources).containsExactly(
                graph.findNode("result = \"Error: Amount must be positive.\"").getId(),
                graph.findNode("result = \"Error: Not enough money.\"").getId(),
                graph.findNode("result = f\"Success. New balance: ${balance}\"").getId()).inOrder();
        assertThat(graph.findNode("If: request > balance")).isNotNull();
    }

    @Test
    public void testSmartLight() {
        GraphDescription graph = build("Smart Light (Loop & Condition)");

        assertThat(unreachable(graph)).isEmpty();
        assertThat(graph.getNode(1).getLabel()).isEqualTo("For: reading in sensor_readings");
        assertThat(graph.getNode(4).getLabel()).isEqualTo("continue");
        assertThat(graph.getNode(7).getLabel()).isEqualTo("break");
        assertThat(graph.getNode(9).getLabel()).isEqualTo("print(\"Lighting check complete.\")");
        assertThat(edges(graph)).containsExactly(
                "n0 -> n1",
                "n1 -> n2 [True]",
                "n2 -> n3 [True]",
                "n3 -> n4",
                "n2 -> n5 [False]",
                "n5 -> n6 [True]",
                "n6 -> n7",
                "n5 -> n8 [False]",
                "n8 -> n1",
                "n4 -> n1",
                "n1 -> n9 [False]",
                "n7 -> n9").inOrder();
    }

    @Test
    public void testServerConnection() {
        GraphDescription graph = build("Server Connection (While Loop)");

        assertThat(unreachable(graph)).isEmpty();
        Node loop = graph.findNode("While: attempt < max_retries and not connected");
        assertThat(loop.getKind()).isEqualTo(NodeKind.LOOP_CONDITION);
        assertThat(edges(graph)).contains("n6 -> n3");
        assertThat(edges(graph)).contains("n7 -> n3");
        assertThat(edges(graph)).contains("n3 -> n8 [False]");
        assertThat(graph.getNode(8).getLabel()).isEqualTo("If: connected");
    }

    @Test
    public void testFileSaferLeavesFinallyUnconnected() {
        GraphDescription graph = build("File Safer (Try/Except/Finally)");

        assertThat(edges(graph)).containsAtLeast(
                "n2 -> n3 [Attempt]",
                "n2 -> n9 [Exc: FileNotFoundError]",
                "n2 -> n10 [Exc: ValueError]").inOrder();
        // every path of the try statement returns, nothing reaches finally
        assertThat(unreachable(graph)).containsExactly("If: file_handle");
        assertThat(graph.findNode("print(\"Cleanup complete.\")")).isNotNull();
    }

    @Test
    public void testOrderProcessing() {
        GraphDescription graph = build("Order Processing (Nested)");

        assertThat(unreachable(graph)).isEmpty();
        Node loop = graph.findNode("For: order in orders");
        Node cont = graph.findNode("continue");
        Node brk = graph.findNode("break");
        Node ret = graph.findNode("Return: \"Batch Complete\"");
        assertThat(graph.getOutEdges(cont)).containsExactly(new Edge(cont.getId(), loop.getId()));
        assertThat(graph.getOutEdges(brk)).containsExactly(new Edge(brk.getId(), ret.getId()));
        assertThat(graph.getInEdges(ret)).containsExactly(
                new Edge(loop.getId(), ret.getId(), "False"),
                new Edge(brk.getId(), ret.getId())).inOrder();
    }
}
