package com.jpexs.flowchart.structure;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link Frontier} and {@link FlowPoint}. */
@RunWith(JUnit4.class)
public final class FrontierTest {

    @Test
    public void testEmpty() {
        assertThat(Frontier.empty().isEmpty()).isTrue();
        assertThat(Frontier.empty().size()).isEqualTo(0);
        assertThat(Frontier.of(Arrays.<FlowPoint>asList())).isSameInstanceAs(Frontier.empty());
    }

    @Test
    public void testConcatKeepsOrder() {
        Frontier first = Frontier.of(3, "True");
        Frontier second = Frontier.of(Arrays.asList(FlowPoint.of(5), FlowPoint.of(1, "False")));

        Frontier merged = first.concat(second);

        assertThat(merged.getPoints())
                .containsExactly(FlowPoint.of(3, "True"), FlowPoint.of(5), FlowPoint.of(1, "False")).inOrder();
        assertThat(first.size()).isEqualTo(1);
        assertThat(merged.concat(Frontier.empty())).isSameInstanceAs(merged);
        assertThat(Frontier.empty().concat(merged)).isSameInstanceAs(merged);
    }

    @Test
    public void testFlowPoint() {
        assertThat(FlowPoint.of(2).hasForcedLabel()).isFalse();
        assertThat(FlowPoint.of(2, "").hasForcedLabel()).isFalse();
        assertThat(FlowPoint.of(2, "Attempt").getForcedLabel()).isEqualTo("Attempt");
        assertThat(FlowPoint.of(2, "True")).isNotEqualTo(FlowPoint.of(2, "False"));
        assertThat(FlowPoint.of(2, "True").toString()).isEqualTo("(n2, True)");
        assertThat(Frontier.of(Arrays.asList(FlowPoint.of(1), FlowPoint.of(2, "True"))).toString())
                .isEqualTo("[n1, (n2, True)]");
    }
}
