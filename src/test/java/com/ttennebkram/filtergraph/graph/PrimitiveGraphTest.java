package com.ttennebkram.filtergraph.graph;

import com.ttennebkram.filtergraph.document.FilterFixtures;
import com.ttennebkram.filtergraph.document.JsonDocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.model.InputReference;
import com.ttennebkram.filtergraph.model.PrimitiveKind;
import com.ttennebkram.filtergraph.model.StandardSource;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrimitiveGraphTest {

    private static PrimitiveGraph build(JsonDocumentStore store) {
        return PrimitiveGraph.build(store, FilterFixtures.onlyFilter(store));
    }

    @Test
    void unspecifiedInputReadsPreviousPrimitive() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feGaussianBlur'}, {'type': 'feOffset'}"));

        ResolvedSource first = graph.resolve(graph.get(0), 0);
        ResolvedSource second = graph.resolve(graph.get(1), 0);

        assertThat(first.getType()).isEqualTo(ResolvedSource.Type.IMPLICIT_PREVIOUS);
        assertThat(first.getNode()).isNull();
        assertThat(second.getType()).isEqualTo(ResolvedSource.Type.IMPLICIT_PREVIOUS);
        assertThat(second.getNode().getHandle()).isEqualTo(graph.get(0).getHandle());
    }

    @Test
    void secondInputAlsoDefaultsToPrevious() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feFlood'}, {'type': 'feBlend', 'attributes': {'in': 'SourceGraphic'}}"));

        ResolvedSource in2 = graph.resolve(graph.get(1), 1);

        assertThat(in2.isImplicit()).isTrue();
        assertThat(in2.getNode().getHandle()).isEqualTo(graph.get(0).getHandle());
        assertThat(graph.resolve(graph.get(1), 0).readsStandardSource()).isTrue();
    }

    @Test
    void standardSourceResolvesDirectly() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feGaussianBlur', 'attributes': {'in': 'BackgroundAlpha'}}"));

        ResolvedSource source = graph.resolve(graph.get(0), 0);

        assertThat(source.getType()).isEqualTo(ResolvedSource.Type.STANDARD);
        assertThat(source.getSourceIndex()).isEqualTo(StandardSource.BACKGROUND_ALPHA.getIndex());
    }

    @Test
    void namedResultResolvesToClosestEarlierDeclaration() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feFlood', 'attributes': {'result': 'result1'}},"
                + "{'type': 'feTurbulence', 'attributes': {'result': 'result1'}},"
                + "{'type': 'feOffset', 'attributes': {'in': 'result1'}}"));

        ResolvedSource source = graph.resolve(graph.get(2), 0);

        assertThat(source.getType()).isEqualTo(ResolvedSource.Type.PRODUCER);
        assertThat(source.getNode().getHandle()).isEqualTo(graph.get(1).getHandle());
        assertThat(graph.duplicateOutputIds()).containsExactly(1);
    }

    @Test
    void forwardAndDanglingReferencesAreUnresolved() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feOffset', 'attributes': {'in': 'result0'}},"
                + "{'type': 'feFlood', 'attributes': {'result': 'result0'}},"
                + "{'type': 'feTile', 'attributes': {'in': 'result9'}}"));

        assertThat(graph.resolve(graph.get(0), 0).isResolved()).isFalse();
        assertThat(graph.resolve(graph.get(2), 0).getType()).isEqualTo(ResolvedSource.Type.UNRESOLVED);
    }

    @Test
    void mergeSlotsWithoutValueStayUnresolved() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feFlood', 'attributes': {'result': 'result0'}},"
                + "{'type': 'feMerge', 'children': ["
                + "  {'type': 'feMergeNode', 'attributes': {'in': 'result0'}},"
                + "  {'type': 'feMergeNode'},"
                + "  {'type': 'feFuncA'}]}"));
        PrimitiveNode merge = graph.get(1);

        assertThat(graph.inputCount(merge)).isEqualTo(2);
        assertThat(graph.renderSlotCount(merge)).isEqualTo(3);
        assertThat(graph.resolve(merge, 0).getNode().getHandle()).isEqualTo(graph.get(0).getHandle());
        assertThat(graph.resolve(merge, 1).getType()).isEqualTo(ResolvedSource.Type.UNRESOLVED);
        assertThat(graph.resolve(merge, 2).getType()).isEqualTo(ResolvedSource.Type.UNRESOLVED);
    }

    @Test
    void slotCounts() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feComposite'}, {'type': 'feColorMatrix'}, {'type': 'feMerge'}, {'type': 'feDropShadow'}"));

        assertThat(graph.inputCount(graph.get(0))).isEqualTo(2);
        assertThat(graph.inputCount(graph.get(1))).isEqualTo(1);
        assertThat(graph.inputCount(graph.get(2))).isZero();
        assertThat(graph.renderSlotCount(graph.get(2))).isEqualTo(1);
        assertThat(graph.get(3).getKind()).isEqualTo(PrimitiveKind.UNKNOWN);
        assertThat(graph.inputCount(graph.get(3))).isEqualTo(1);
        assertThat(graph.inputCount(null)).isZero();
    }

    @Test
    void resolveNeverThrowsForBadSlots() {
        PrimitiveGraph graph = build(FilterFixtures.filter("{'type': 'feOffset'}"));

        assertThat(graph.resolve(graph.get(0), 5).isResolved()).isFalse();
        assertThat(graph.resolve(graph.get(0), -1).isResolved()).isFalse();
    }

    @Test
    void positionsFollowDocumentOrder() {
        JsonDocumentStore store = FilterFixtures.filter("{'type': 'feFlood'}, {'type': 'feOffset'}");
        PrimitiveGraph graph = build(store);

        assertThat(graph.findIndex(graph.get(1))).isEqualTo(1);
        assertThat(graph.get(1).getPosition()).isEqualTo(1);
        assertThat(graph.findIndex(new NodeHandle(999))).isEqualTo(-1);
        assertThat(graph.findIndex((PrimitiveNode) null)).isEqualTo(-1);
        assertThat(graph.isBefore(graph.get(0), graph.get(1))).isTrue();
        assertThat(graph.isBefore(graph.get(1), graph.get(1))).isFalse();
    }

    @Test
    void nextFreeOutputIdFillsGaps() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feFlood', 'attributes': {'result': 'result0'}},"
                + "{'type': 'feOffset', 'attributes': {'result': 'result2'}}"));

        assertThat(graph.declaredOutputIds()).containsExactly(0, 2);
        assertThat(graph.nextFreeOutputId()).isEqualTo(1);
    }

    @Test
    void nonCanonicalResultNamesAreIgnored() {
        PrimitiveGraph graph = build(FilterFixtures.filter(
            "{'type': 'feFlood', 'attributes': {'result': 'glow'}}"));

        assertThat(graph.get(0).hasOutput()).isFalse();
    }

    @Test
    void emptyFilterBuildsEmptyGraph() {
        JsonDocumentStore store = FilterFixtures.filter("");

        assertThat(build(store).isEmpty()).isTrue();
        assertThat(PrimitiveGraph.build(store, new NodeHandle(999)).isEmpty()).isTrue();
    }

    @Test
    void rejectsRepeatedHandles() {
        NodeHandle handle = new NodeHandle(1);
        PrimitiveNode node = PrimitiveNode.create(handle, PrimitiveKind.OFFSET, null);

        assertThatThrownBy(() -> new PrimitiveGraph(new NodeHandle(0), Arrays.asList(node, node)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void handBuiltNodesPadMissingInputs() {
        PrimitiveNode blend = PrimitiveNode.create(new NodeHandle(3), PrimitiveKind.BLEND, 4,
            InputReference.standardSource(StandardSource.SOURCE_GRAPHIC));

        assertThat(blend.getInputCount()).isEqualTo(2);
        assertThat(blend.getInput(1).isUnspecified()).isTrue();
        assertThat(blend.getSlotAttribute(1)).isEqualTo(PrimitiveNode.ATTR_IN2);
        assertThat(blend.getOutputId()).isEqualTo(4);
    }
}
