package com.ttennebkram.filtergraph.graph;

import com.ttennebkram.filtergraph.document.DocumentStoreException;
import com.ttennebkram.filtergraph.document.FilterFixtures;
import com.ttennebkram.filtergraph.document.JsonDocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.model.PrimitiveKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrimitiveListModelTest {

    private JsonDocumentStore store;
    private PrimitiveListModel model;
    private NodeHandle a;
    private NodeHandle b;
    private NodeHandle c;

    @BeforeEach
    void setUp() {
        store = FilterFixtures.filter(
            "{'type': 'feFlood', 'attributes': {'result': 'result1'}},"
                + "{'type': 'feOffset', 'attributes': {'in': 'result1', 'dx': '4'}},"
                + "{'type': 'feTile'}");
        model = new PrimitiveListModel(store, FilterFixtures.onlyFilter(store));
        a = FilterFixtures.primitive(store, 0);
        b = FilterFixtures.primitive(store, 1);
        c = FilterFixtures.primitive(store, 2);
    }

    @AfterEach
    void tearDown() {
        model.close();
    }

    @Test
    void reorderSanitizesInTheSameUndoStep() {
        model.reorder(b, 0);

        assertThat(model.graph().get(0).getHandle()).isEqualTo(b);
        assertThat(store.getAttribute(b, "in")).isNull();
        assertThat(store.getUndoDescription()).isEqualTo("Reorder filter primitive");

        store.undo();

        assertThat(model.graph().get(1).getHandle()).isEqualTo(b);
        assertThat(store.getAttribute(b, "in")).isEqualTo("result1");
        assertThat(store.canUndo()).isFalse();
    }

    @Test
    void reorderRejectsBadIndexAndForeignNodes() {
        assertThatThrownBy(() -> model.reorder(a, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> model.reorder(a, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> model.reorder(new NodeHandle(999), 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.canUndo()).isFalse();
    }

    @Test
    void graphIsRebuiltOnEveryStoreChange() {
        AtomicInteger changes = new AtomicInteger();
        model.addChangeListener(changes::incrementAndGet);

        store.setAttribute(c, "in", "result1");

        assertThat(changes.get()).isEqualTo(1);
        PrimitiveGraph graph = model.graph();
        assertThat(graph.resolve(graph.get(2), 0).getNode().getHandle()).isEqualTo(a);
    }

    @Test
    void insertAddsAfterPosition() {
        NodeHandle added = model.insertPrimitive(0, PrimitiveKind.GAUSSIAN_BLUR);

        assertThat(model.graph().findIndex(added)).isEqualTo(1);
        assertThat(store.getKind(added)).isEqualTo("feGaussianBlur");
        assertThat(store.getUndoDescription()).isEqualTo("Add filter primitive");

        NodeHandle front = model.insertPrimitive(-1, PrimitiveKind.FLOOD);
        assertThat(model.graph().findIndex(front)).isZero();
    }

    @Test
    void insertedMergeStartsWithOneEmptyInput() {
        NodeHandle merge = model.insertPrimitive(2, PrimitiveKind.MERGE);

        PrimitiveNode node = model.graph().find(merge);
        assertThat(node.getInputCount()).isEqualTo(1);
        assertThat(node.getInput(0).isUnspecified()).isTrue();
        assertThat(store.getKind(node.getMergeInputs().get(0))).isEqualTo(PrimitiveKind.MERGE_NODE_ELEMENT);
    }

    @Test
    void insertRejectsUnknownKind() {
        assertThatThrownBy(() -> model.insertPrimitive(0, PrimitiveKind.UNKNOWN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeLeavesDanglingReferencesUnresolved() {
        model.removePrimitive(a);

        PrimitiveGraph graph = model.graph();
        assertThat(graph.size()).isEqualTo(2);
        assertThat(store.getAttribute(b, "in")).isEqualTo("result1");
        assertThat(graph.resolve(graph.find(b), 0).isResolved()).isFalse();

        store.undo();
        assertThat(model.graph().size()).isEqualTo(3);
        assertThat(model.graph().resolve(model.graph().find(b), 0).getNode().getHandle()).isEqualTo(a);
    }

    @Test
    void removeRepairsDuplicatesItExposes() {
        JsonDocumentStore dupStore = FilterFixtures.filter(
            "{'type': 'feFlood', 'attributes': {'result': 'result0'}},"
                + "{'type': 'feFlood', 'attributes': {'result': 'result0'}},"
                + "{'type': 'feTile'}");
        try (PrimitiveListModel dupModel = new PrimitiveListModel(dupStore, FilterFixtures.onlyFilter(dupStore))) {
            dupModel.removePrimitive(FilterFixtures.primitive(dupStore, 2));

            assertThat(dupModel.graph().duplicateOutputIds()).isEmpty();
            assertThat(dupModel.graph().declaredOutputIds()).containsExactly(0, 1);
        }
    }

    @Test
    void duplicateCopiesInputsButNotResult() {
        NodeHandle copyOfA = model.duplicatePrimitive(a);
        NodeHandle copyOfB = model.duplicatePrimitive(b);

        assertThat(model.graph().findIndex(copyOfA)).isEqualTo(1);
        assertThat(store.getAttribute(copyOfA, "result")).isNull();
        assertThat(store.getAttribute(copyOfB, "in")).isEqualTo("result1");
        assertThat(store.getAttribute(copyOfB, "dx")).isEqualTo("4");
        assertThat(store.getUndoDescription()).isEqualTo("Duplicate filter primitive");
    }

    @Test
    void duplicateCopiesMergeSubNodes() {
        JsonDocumentStore mergeStore = FilterFixtures.filter(
            "{'type': 'feMerge', 'attributes': {'result': 'result2'}, 'children': ["
                + "  {'type': 'feMergeNode', 'attributes': {'in': 'SourceGraphic'}},"
                + "  {'type': 'feMergeNode', 'attributes': {'in': 'SourceAlpha'}}]}");
        try (PrimitiveListModel mergeModel = new PrimitiveListModel(mergeStore, FilterFixtures.onlyFilter(mergeStore))) {
            NodeHandle copy = mergeModel.duplicatePrimitive(FilterFixtures.primitive(mergeStore, 0));

            PrimitiveNode node = mergeModel.graph().find(copy);
            assertThat(node.getInputCount()).isEqualTo(2);
            assertThat(mergeStore.getAttribute(node.getMergeInputs().get(1), "in")).isEqualTo("SourceAlpha");
            assertThat(node.hasOutput()).isFalse();
        }
    }

    @Test
    void setOutputIdRejectsIdsInUse() {
        assertThatThrownBy(() -> model.setOutputId(c, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already declared");
        assertThatThrownBy(() -> model.setOutputId(c, -3)).isInstanceOf(IllegalArgumentException.class);

        model.setOutputId(c, 7);
        model.setOutputId(a, 1);

        assertThat(store.getAttribute(c, "result")).isEqualTo("result7");
    }

    @Test
    void ensureOutputIdAllocatesSmallestFreeId() {
        assertThat(model.ensureOutputId(a)).isEqualTo(1);
        assertThat(model.ensureOutputId(c)).isZero();
        assertThat(store.getAttribute(c, "result")).isEqualTo("result0");
        assertThat(model.ensureOutputId(b)).isEqualTo(2);
    }

    @Test
    void storeRefusalLeavesDocumentUnchanged() {
        store.setReadOnly(true);

        assertThatThrownBy(() -> model.reorder(b, 0)).isInstanceOf(DocumentStoreException.class);

        assertThat(model.graph().get(1).getHandle()).isEqualTo(b);
        assertThat(store.getAttribute(b, "in")).isEqualTo("result1");
    }

    @Test
    void closeStopsRebuilding() {
        PrimitiveGraph before = model.graph();

        model.close();
        store.setAttribute(c, "in", "SourceAlpha");

        assertThat(model.isClosed()).isTrue();
        assertThat(model.graph()).isSameAs(before);
    }
}
