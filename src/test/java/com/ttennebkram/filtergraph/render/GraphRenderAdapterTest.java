package com.ttennebkram.filtergraph.render;

import com.ttennebkram.filtergraph.document.FilterFixtures;
import com.ttennebkram.filtergraph.document.JsonDocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.graph.PrimitiveGraph;
import com.ttennebkram.filtergraph.model.StandardSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GraphRenderAdapterTest {

    private final GraphRenderAdapter adapter = new GraphRenderAdapter(EditorSettings.defaults());

    private static PrimitiveGraph graph(String primitivesJson) {
        JsonDocumentStore store = FilterFixtures.filter(primitivesJson);
        return PrimitiveGraph.build(store, FilterFixtures.onlyFilter(store));
    }

    /** Connector commands of one slot, markers excluded. */
    private static List<DrawCommand> wires(List<DrawCommand> commands, NodeHandle node, int slot) {
        List<DrawCommand> result = new ArrayList<>();
        for (DrawCommand command : commands) {
            if (command.belongsTo(node, slot) && command.getType() != DrawCommand.Type.POLYGON) {
                result.add(command);
            }
        }
        return result;
    }

    private List<DrawCommand> render(PrimitiveGraph graph) {
        return adapter.render(graph, null, null, 0, 400);
    }

    // ========== Geometry ==========

    @Test
    void rowsStackOneCellPerSlot() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feBlend'},"
            + "{'type': 'feMerge', 'children': [{'type': 'feMergeNode'}, {'type': 'feMergeNode'}]}");

        assertThat(adapter.rowHeight(graph, 0)).isEqualTo(24);
        assertThat(adapter.rowHeight(graph, 1)).isEqualTo(48);
        assertThat(adapter.rowHeight(graph, 2)).isEqualTo(72);
        assertThat(adapter.rowTop(graph, 2)).isEqualTo(72);
        assertThat(adapter.contentHeight(graph)).isEqualTo(144);
    }

    @Test
    void emptyMergeStillGetsOneRow() {
        PrimitiveGraph graph = graph("{'type': 'feMerge'}");

        assertThat(adapter.rowHeight(graph, 0)).isEqualTo(24);
    }

    @Test
    void earlierRowsHaveWiderLanes() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feOffset'}, {'type': 'feTile'}");

        assertThat(adapter.laneRight(graph, 0)).isEqualTo(140 + 72);
        assertThat(adapter.laneRight(graph, 2)).isEqualTo(140 + 24);
        assertThat(adapter.sourceColumnX(graph, 0)).isEqualTo(140 + 72 + 16);
        assertThat(adapter.contentWidth(graph)).isEqualTo(140 + 72 + 16 * 7);
    }

    @Test
    void slotMarkerIsCentredInItsSlot() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feComposite'}");

        double[] marker = adapter.slotMarker(graph, 1, 1);

        // conW = 8, slot height 24, row top 24
        assertThat(marker).containsExactly(164, 52, 164, 68, 156, 60);
    }

    // ========== Pointer queries ==========

    @Test
    void hitTestFindsSlotMarkers() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feComposite'}");

        SlotHit hit = adapter.hitTest(graph, 150, 60);

        assertThat(hit).isEqualTo(new SlotHit(graph.get(1).getHandle(), 1, 1));
        assertThat(adapter.hitTest(graph, 163, 36).getSlot()).isZero();
        assertThat(adapter.hitTest(graph, 187, 12).getPosition()).isZero();
    }

    @Test
    void hitTestMissesOutsideMarkers() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feComposite'}");

        assertThat(adapter.hitTest(graph, 170, 60)).isNull();
        assertThat(adapter.hitTest(graph, 130, 60)).isNull();
        assertThat(adapter.hitTest(graph, 160, 48)).isNull();
        assertThat(adapter.hitTest(graph, 10, 10)).isNull();
    }

    @Test
    void dropTargetsMapColumnsAndRows() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feOffset'}");
        int sourcesX = adapter.sourcesStartX(graph);

        assertThat(adapter.dropTargetAt(graph, 20, 30)).isEqualTo(DropTarget.nodeRow(graph.get(1).getHandle()));
        assertThat(adapter.dropTargetAt(graph, sourcesX - 1, 5)).isEqualTo(DropTarget.nodeRow(graph.get(0).getHandle()));
        assertThat(adapter.dropTargetAt(graph, sourcesX + 1, 5)).isEqualTo(DropTarget.standardSource(0));
        assertThat(adapter.dropTargetAt(graph, sourcesX + 16 * 3 + 4, 30)).isEqualTo(DropTarget.standardSource(3));
        assertThat(adapter.dropTargetAt(graph, adapter.contentWidth(graph) - 1, 5))
            .isEqualTo(DropTarget.standardSource(StandardSource.count() - 1));
    }

    @Test
    void dropTargetsOutsideTheList() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}");

        assertThat(adapter.dropTargetAt(graph, 20, 24).getType()).isEqualTo(DropTarget.Type.OUTSIDE);
        assertThat(adapter.dropTargetAt(graph, 20, -3).getType()).isEqualTo(DropTarget.Type.OUTSIDE);
        assertThat(adapter.dropTargetAt(graph, adapter.contentWidth(graph), 5).getType())
            .isEqualTo(DropTarget.Type.OUTSIDE);
        assertThat(adapter.dropTargetAt(graph, -1, 5).getType()).isEqualTo(DropTarget.Type.OUTSIDE);
    }

    // ========== Connectors ==========

    @Test
    void standardSourceDrawsStraightExplicitWire() {
        PrimitiveGraph graph = graph("{'type': 'feGaussianBlur', 'attributes': {'in': 'SourceAlpha'}}");
        NodeHandle blur = graph.get(0).getHandle();

        List<DrawCommand> wire = wires(render(graph), blur, 0);

        assertThat(wire).hasSize(2);
        assertThat(wire).allMatch(c -> c.getStyle() == DrawCommand.Style.EXPLICIT);
        DrawCommand line = wire.get(1);
        assertThat(line.getType()).isEqualTo(DrawCommand.Type.LINE);
        double endX = adapter.sourceColumnX(graph, StandardSource.SOURCE_ALPHA.getIndex()) + 9;
        assertThat(line.getCoords()).containsExactly(164, 12, endX, 12);
    }

    @Test
    void firstRowImplicitlyReadsSourceGraphic() {
        PrimitiveGraph graph = graph("{'type': 'feGaussianBlur'}");
        NodeHandle blur = graph.get(0).getHandle();

        List<DrawCommand> wire = wires(render(graph), blur, 0);

        assertThat(wire).hasSize(2);
        assertThat(wire).allMatch(c -> c.getStyle() == DrawCommand.Style.IMPLICIT);
        assertThat(wire.get(1).coord(2)).isEqualTo(adapter.sourceColumnX(graph, 0) + 9);
    }

    @Test
    void implicitPreviousDrawsElbowToPreviousRow() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feOffset'}");
        NodeHandle offset = graph.get(1).getHandle();

        List<DrawCommand> wire = wires(render(graph), offset, 0);

        assertThat(wire).hasSize(3);
        assertThat(wire).allMatch(c -> c.getStyle() == DrawCommand.Style.IMPLICIT);
        // Vertical leg ends at the bottom of row 0, in the middle of its lane
        DrawCommand up = wire.get(2);
        assertThat(up.coord(0)).isEqualTo(adapter.laneRight(graph, 0) - 12);
        assertThat(up.coord(3)).isEqualTo(24);
    }

    @Test
    void producerDrawsExplicitElbow() {
        PrimitiveGraph graph = graph("{'type': 'feFlood', 'attributes': {'result': 'result0'}},"
            + "{'type': 'feTile'},"
            + "{'type': 'feOffset', 'attributes': {'in': 'result0'}}");
        NodeHandle offset = graph.get(2).getHandle();

        List<DrawCommand> wire = wires(render(graph), offset, 0);

        assertThat(wire).hasSize(3);
        assertThat(wire).allMatch(c -> c.getStyle() == DrawCommand.Style.EXPLICIT);
        DrawCommand across = wire.get(0);
        assertThat(across.coord(0)).isEqualTo(adapter.laneRight(graph, 2));
        assertThat(across.coord(2)).isEqualTo(adapter.laneRight(graph, 0) - 12 - 6);
        assertThat(wire.get(2).coord(3)).isEqualTo(24);
    }

    @Test
    void unresolvedAndUnknownSourcesDrawNoWire() {
        PrimitiveGraph graph = graph("{'type': 'feOffset', 'attributes': {'in': 'result4'}},"
            + "{'type': 'feTile', 'attributes': {'in': '-40'}},"
            + "{'type': 'feMerge', 'children': [{'type': 'feMergeNode'}]}");
        List<DrawCommand> commands = render(graph);

        assertThat(wires(commands, graph.get(0).getHandle(), 0)).isEmpty();
        assertThat(wires(commands, graph.get(1).getHandle(), 0)).isEmpty();
        assertThat(wires(commands, graph.get(2).getHandle(), 0)).isEmpty();
        assertThat(wires(commands, graph.get(2).getHandle(), 1)).isEmpty();
    }

    @Test
    void everyRenderSlotGetsAMarker() {
        PrimitiveGraph graph = graph("{'type': 'feBlend'},"
            + "{'type': 'feMerge', 'children': [{'type': 'feMergeNode'}]}");

        long markers = render(graph).stream()
            .filter(c -> c.getType() == DrawCommand.Type.POLYGON)
            .count();

        assertThat(markers).isEqualTo(4);
    }

    @Test
    void selectionAndColumnsComeFirst() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feOffset'}");

        List<DrawCommand> commands = adapter.render(graph, graph.get(1).getHandle(), null, 0, 400);

        DrawCommand selection = commands.get(0);
        assertThat(selection.getStyle()).isEqualTo(DrawCommand.Style.SELECTION);
        assertThat(selection.getCoords()).containsExactly(0, 24, adapter.contentWidth(graph), 24);
        assertThat(commands.get(2).getText()).isEqualTo(StandardSource.SOURCE_GRAPHIC.getLabel());
        assertThat(commands.get(2).isVertical()).isTrue();
    }

    @Test
    void draggedSlotShowsRubberBandInsteadOfWire() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}, {'type': 'feOffset', 'attributes': {'in': 'SourceAlpha'}}");
        NodeHandle offset = graph.get(1).getHandle();
        DragIndicator drag = mock(DragIndicator.class);
        when(drag.getOriginNode()).thenReturn(offset);
        when(drag.getOriginSlot()).thenReturn(0);
        when(drag.getPointerX()).thenReturn(300.0);
        when(drag.getPointerY()).thenReturn(5.0);

        List<DrawCommand> commands = adapter.render(graph, null, drag, 0, 400);

        List<DrawCommand> slotCommands = new ArrayList<>();
        for (DrawCommand command : commands) {
            if (command.belongsTo(offset, 0)) {
                slotCommands.add(command);
            }
        }
        assertThat(slotCommands).extracting(DrawCommand::getStyle).containsExactly(
            DrawCommand.Style.MARKER_ACTIVE, DrawCommand.Style.DRAG, DrawCommand.Style.DRAG);
        assertThat(slotCommands.get(0).isFilled()).isTrue();
        assertThat(slotCommands.get(2).getCoords()).containsExactly(300, 36, 300, 5);
    }

    @Test
    void paintSendsCommandsToSurface() {
        PrimitiveGraph graph = graph("{'type': 'feFlood'}");
        RecordingSurface surface = new RecordingSurface();

        adapter.paint(surface, graph, null, null);

        assertThat(surface.last).hasSize(adapter.render(graph, null, null, 0, 300).size());
    }

    private static class RecordingSurface implements RenderSurface {
        List<DrawCommand> last;

        @Override
        public void draw(List<DrawCommand> commands) {
            last = commands;
        }

        @Override
        public double getVisibleTop() {
            return 0;
        }

        @Override
        public double getVisibleHeight() {
            return 300;
        }

        @Override
        public void setScrollOffset(double offset) {
            throw new UnsupportedOperationException();
        }
    }
}
