package com.ttennebkram.filtergraph.fx;

import com.ttennebkram.filtergraph.render.DrawCommand;
import com.ttennebkram.filtergraph.render.RenderSurface;

import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.ScrollPane;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;

import java.util.List;

/**
 * Canvas inside a vertical scroll pane that replays draw commands.
 */
public class FXRenderSurface implements RenderSurface {

    // Colors
    private static final Color COLOR_BACKGROUND = Color.WHITE;
    private static final Color COLOR_OUTLINE = Color.rgb(160, 160, 160);
    private static final Color COLOR_COLUMN_BG = Color.rgb(235, 235, 245);
    private static final Color COLOR_SELECTION = Color.rgb(200, 220, 255);
    private static final Color COLOR_TEXT = Color.rgb(40, 40, 40);
    private static final Color COLOR_MARKER = Color.rgb(100, 100, 150);
    private static final Color COLOR_MARKER_ACTIVE = Color.rgb(0, 0, 255);
    private static final Color COLOR_EXPLICIT = Color.rgb(0, 100, 0);
    private static final Color COLOR_IMPLICIT = Color.rgb(150, 150, 150);
    private static final Color COLOR_DRAG = Color.rgb(200, 120, 0);

    private static final Font LABEL_FONT = Font.font("System", FontWeight.NORMAL, 12);
    private static final Font COLUMN_FONT = Font.font("System", FontWeight.NORMAL, 10);

    private final Canvas canvas;
    private final ScrollPane scrollPane;

    public FXRenderSurface() {
        canvas = new Canvas(400, 300);

        Pane canvasContainer = new Pane(canvas);
        canvasContainer.setStyle("-fx-background-color: white;");

        scrollPane = new ScrollPane(canvasContainer);
        scrollPane.setPannable(false);
        scrollPane.setVbarPolicy(ScrollPane.ScrollBarPolicy.AS_NEEDED);
        scrollPane.setHbarPolicy(ScrollPane.ScrollBarPolicy.AS_NEEDED);
    }

    public Canvas getCanvas() {
        return canvas;
    }

    public ScrollPane getScrollPane() {
        return scrollPane;
    }

    /**
     * Resize the canvas to the laid-out content.
     */
    public void setContentSize(double width, double height) {
        double viewportWidth = scrollPane.getViewportBounds().getWidth();
        double viewportHeight = scrollPane.getViewportBounds().getHeight();
        canvas.setWidth(Math.max(width, viewportWidth));
        canvas.setHeight(Math.max(height, viewportHeight));
    }

    // ========== RenderSurface ==========

    @Override
    public double getVisibleTop() {
        return scrollPane.getVvalue() * scrollRange();
    }

    @Override
    public double getVisibleHeight() {
        double height = scrollPane.getViewportBounds().getHeight();
        return height > 0 ? height : canvas.getHeight();
    }

    @Override
    public void setScrollOffset(double offset) {
        double range = scrollRange();
        scrollPane.setVvalue(range > 0 ? offset / range : 0);
    }

    @Override
    public void draw(List<DrawCommand> commands) {
        GraphicsContext gc = canvas.getGraphicsContext2D();
        gc.setFill(COLOR_BACKGROUND);
        gc.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());
        gc.setLineWidth(1);

        for (DrawCommand command : commands) {
            Color color = colorFor(command.getStyle());
            double[] c = command.getCoords();
            switch (command.getType()) {
                case RECT:
                    if (command.isFilled()) {
                        gc.setFill(color);
                        gc.fillRect(c[0], c[1], c[2], c[3]);
                    } else {
                        gc.setStroke(color);
                        gc.strokeRect(c[0], c[1], c[2], c[3]);
                    }
                    break;
                case LINE:
                    gc.setStroke(color);
                    gc.strokeLine(c[0], c[1], c[2], c[3]);
                    break;
                case POLYGON:
                    drawPolygon(gc, c, color, command.isFilled());
                    break;
                case TEXT:
                    drawText(gc, command, color);
                    break;
                default:
                    break;
            }
        }
    }

    // ========== Internals ==========

    private double scrollRange() {
        return Math.max(0, canvas.getHeight() - scrollPane.getViewportBounds().getHeight());
    }

    private static void drawPolygon(GraphicsContext gc, double[] c, Color color, boolean filled) {
        int n = c.length / 2;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = c[i * 2];
            ys[i] = c[i * 2 + 1];
        }
        if (filled) {
            gc.setFill(color);
            gc.fillPolygon(xs, ys, n);
        }
        gc.setStroke(color);
        gc.strokePolygon(xs, ys, n);
    }

    private static void drawText(GraphicsContext gc, DrawCommand command, Color color) {
        double[] c = command.getCoords();
        gc.setFill(color);
        if (!command.isVertical()) {
            gc.setFont(LABEL_FONT);
            gc.fillText(command.getText(), c[0], c[1]);
            return;
        }
        // Column labels read top to bottom
        gc.save();
        gc.setFont(COLUMN_FONT);
        gc.translate(c[0], c[1]);
        gc.rotate(90);
        gc.fillText(command.getText(), 4, -3);
        gc.restore();
    }

    private static Color colorFor(DrawCommand.Style style) {
        switch (style) {
            case BACKGROUND:
                return COLOR_COLUMN_BG;
            case SELECTION:
                return COLOR_SELECTION;
            case TEXT:
                return COLOR_TEXT;
            case MARKER:
                return COLOR_MARKER;
            case MARKER_ACTIVE:
                return COLOR_MARKER_ACTIVE;
            case EXPLICIT:
                return COLOR_EXPLICIT;
            case IMPLICIT:
                return COLOR_IMPLICIT;
            case DRAG:
                return COLOR_DRAG;
            default:
                return COLOR_OUTLINE;
        }
    }
}
