package com.ttennebkram.filtergraph;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.*;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyCodeCombination;
import javafx.scene.input.KeyCombination;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

import com.ttennebkram.filtergraph.document.DocumentStoreException;
import com.ttennebkram.filtergraph.document.JsonDocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.fx.FXPrimitiveListView;
import com.ttennebkram.filtergraph.graph.PrimitiveGraph;
import com.ttennebkram.filtergraph.graph.PrimitiveListModel;
import com.ttennebkram.filtergraph.model.PrimitiveKind;
import com.ttennebkram.filtergraph.render.EditorSettings;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.prefs.Preferences;

/**
 * Main JavaFX Application class for the filter graph editor.
 * Shows the primitive list of one filter of a JSON filter document.
 */
public class FilterGraphEditorApp extends Application {

    private static final String APP_TITLE = "Filter Graph Editor";
    private static final String LAST_FILE_KEY = "lastFile";
    private static final String DEFAULT_FILTER_ID = "filter0";

    private Stage primaryStage;
    private BorderPane rootPane;
    private Label statusLabel;
    private ComboBox<String> filterCombo;

    private Preferences prefs;
    private EditorSettings settings;

    private JsonDocumentStore store;
    private PrimitiveListModel model;
    private FXPrimitiveListView listView;
    private String currentFilePath = null;
    private boolean isDirty = false;

    // Command line options
    private String commandLineFile = null;
    private String commandLineFilter = null;
    private Integer commandLineCellSize = null;

    @Override
    public void start(Stage primaryStage) {
        this.primaryStage = primaryStage;

        if (!parseArguments(getParameters().getRaw())) {
            Platform.exit();
            return;
        }

        prefs = Preferences.userNodeForPackage(FilterGraphEditorApp.class);
        settings = EditorSettings.fromPreferences(prefs);
        if (commandLineCellSize != null) {
            try {
                settings = settings.withCellSize(commandLineCellSize);
            } catch (IllegalArgumentException e) {
                System.err.println("Error: --cell_size " + e.getMessage());
            }
        }

        rootPane = new BorderPane();
        BorderPane top = new BorderPane();
        top.setTop(createMenuBar());
        top.setBottom(createToolbar());
        rootPane.setTop(top);
        rootPane.setBottom(createStatusBar());

        Scene scene = new Scene(rootPane, 900, 600);
        primaryStage.setScene(scene);
        primaryStage.setOnCloseRequest(e -> {
            if (!checkUnsavedChanges()) {
                e.consume();
                return;
            }
            closeModel();
        });

        String path = commandLineFile != null ? commandLineFile : prefs.get(LAST_FILE_KEY, null);
        if (path != null && new File(path).isFile()) {
            openDocument(path, commandLineFilter);
        } else {
            if (commandLineFile != null) {
                System.err.println("Error: file not found: " + commandLineFile);
            }
            newDocument();
        }

        primaryStage.show();
    }

    /**
     * @return false if the application should exit
     */
    private boolean parseArguments(List<String> params) {
        for (int i = 0; i < params.size(); i++) {
            String param = params.get(i);
            if ("-h".equals(param) || "--help".equals(param)) {
                printHelp();
                return false;
            } else if ("--file".equals(param) || "-f".equals(param)) {
                if (i + 1 >= params.size()) {
                    System.err.println("Error: --file requires a path argument");
                    return false;
                }
                commandLineFile = params.get(++i);
            } else if ("--filter".equals(param)) {
                if (i + 1 >= params.size()) {
                    System.err.println("Error: --filter requires a filter id argument");
                    return false;
                }
                commandLineFilter = params.get(++i);
            } else if ("--cell_size".equals(param)) {
                if (i + 1 >= params.size()) {
                    System.err.println("Error: --cell_size requires a value in pixels");
                    return false;
                }
                try {
                    commandLineCellSize = Integer.parseInt(params.get(++i));
                } catch (NumberFormatException e) {
                    System.err.println("Error: --cell_size requires a numeric value in pixels");
                    return false;
                }
            } else if (!param.startsWith("-") && commandLineFile == null) {
                commandLineFile = param;
            } else {
                System.err.println("Warning: ignoring unknown argument " + param);
            }
        }
        return true;
    }

    private void printHelp() {
        System.out.println("Usage: filter-graph-editor [options] [file.json]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -f, --file <path>     Filter document to open");
        System.out.println("  --filter <id>         Filter to show (default: the first one)");
        System.out.println("  --cell_size <pixels>  Row and connector lane size");
        System.out.println("  -h, --help            Show this help");
    }

    // ========================= MENU BAR =========================

    private MenuBar createMenuBar() {
        MenuBar menuBar = new MenuBar();

        // File menu
        Menu fileMenu = new Menu("File");

        MenuItem newItem = new MenuItem("New");
        newItem.setAccelerator(new KeyCodeCombination(KeyCode.N, KeyCombination.SHORTCUT_DOWN));
        newItem.setOnAction(e -> {
            if (checkUnsavedChanges()) {
                newDocument();
            }
        });

        MenuItem openItem = new MenuItem("Open...");
        openItem.setAccelerator(new KeyCodeCombination(KeyCode.O, KeyCombination.SHORTCUT_DOWN));
        openItem.setOnAction(e -> chooseAndOpen());

        MenuItem saveItem = new MenuItem("Save");
        saveItem.setAccelerator(new KeyCodeCombination(KeyCode.S, KeyCombination.SHORTCUT_DOWN));
        saveItem.setOnAction(e -> saveDocument());

        MenuItem saveAsItem = new MenuItem("Save As...");
        saveAsItem.setAccelerator(new KeyCodeCombination(KeyCode.S, KeyCombination.SHORTCUT_DOWN, KeyCombination.SHIFT_DOWN));
        saveAsItem.setOnAction(e -> saveDocumentAs());

        MenuItem quitItem = new MenuItem("Quit");
        quitItem.setAccelerator(new KeyCodeCombination(KeyCode.Q, KeyCombination.SHORTCUT_DOWN));
        quitItem.setOnAction(e -> {
            if (!checkUnsavedChanges()) {
                return;
            }
            closeModel();
            Platform.exit();
        });

        fileMenu.getItems().addAll(newItem, openItem, new SeparatorMenuItem(), saveItem, saveAsItem,
                new SeparatorMenuItem(), quitItem);

        // Edit menu
        Menu editMenu = new Menu("Edit");

        MenuItem undoItem = new MenuItem("Undo");
        undoItem.setAccelerator(new KeyCodeCombination(KeyCode.Z, KeyCombination.SHORTCUT_DOWN));
        undoItem.setOnAction(e -> runEdit(() -> store.undo()));

        MenuItem redoItem = new MenuItem("Redo");
        redoItem.setAccelerator(new KeyCodeCombination(KeyCode.Z, KeyCombination.SHORTCUT_DOWN, KeyCombination.SHIFT_DOWN));
        redoItem.setOnAction(e -> runEdit(() -> store.redo()));

        editMenu.setOnShowing(e -> {
            undoItem.setDisable(store == null || !store.canUndo());
            undoItem.setText(store != null && store.getUndoDescription() != null
                ? "Undo " + store.getUndoDescription() : "Undo");
            redoItem.setDisable(store == null || !store.canRedo());
        });

        MenuItem duplicateItem = new MenuItem("Duplicate");
        duplicateItem.setAccelerator(new KeyCodeCombination(KeyCode.D, KeyCombination.SHORTCUT_DOWN));
        duplicateItem.setOnAction(e -> duplicateSelected());

        MenuItem deleteItem = new MenuItem("Delete");
        deleteItem.setAccelerator(new KeyCodeCombination(KeyCode.BACK_SPACE));
        deleteItem.setOnAction(e -> listView.deleteSelected());

        MenuItem moveUpItem = new MenuItem("Move Up");
        moveUpItem.setAccelerator(new KeyCodeCombination(KeyCode.UP, KeyCombination.ALT_DOWN));
        moveUpItem.setOnAction(e -> listView.moveSelected(-1));

        MenuItem moveDownItem = new MenuItem("Move Down");
        moveDownItem.setAccelerator(new KeyCodeCombination(KeyCode.DOWN, KeyCombination.ALT_DOWN));
        moveDownItem.setOnAction(e -> listView.moveSelected(1));

        editMenu.getItems().addAll(undoItem, redoItem, new SeparatorMenuItem(), duplicateItem, deleteItem,
                new SeparatorMenuItem(), moveUpItem, moveDownItem);

        // Add menu, one entry per primitive kind
        Menu addMenu = new Menu("Add");
        for (PrimitiveKind kind : PrimitiveKind.values()) {
            if (kind == PrimitiveKind.UNKNOWN) {
                continue;
            }
            MenuItem item = new MenuItem(kind.getLabel());
            item.setOnAction(e -> addPrimitive(kind));
            addMenu.getItems().add(item);
        }

        menuBar.getMenus().addAll(fileMenu, editMenu, addMenu);

        // macOS-specific menu bar integration
        String os = System.getProperty("os.name").toLowerCase();
        if (os.contains("mac")) {
            menuBar.setUseSystemMenuBar(true);
        }
        return menuBar;
    }

    private HBox createToolbar() {
        HBox toolbar = new HBox(10);
        toolbar.setPadding(new Insets(5, 10, 5, 10));
        toolbar.setAlignment(Pos.CENTER_LEFT);

        filterCombo = new ComboBox<>();
        filterCombo.setPrefWidth(200);
        filterCombo.setOnAction(e -> {
            String id = filterCombo.getValue();
            if (id != null && store != null) {
                showFilter(store.findFilter(id));
            }
        });

        toolbar.getChildren().addAll(new Label("Filter:"), filterCombo);
        return toolbar;
    }

    private HBox createStatusBar() {
        HBox statusBarBox = new HBox(10);
        statusBarBox.setPadding(new Insets(5, 10, 5, 10));
        statusBarBox.setStyle("-fx-background-color: rgb(160, 160, 160);");
        statusBarBox.setAlignment(Pos.CENTER_LEFT);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        statusLabel = new Label("Ready");
        statusLabel.setStyle("-fx-font-weight: bold; -fx-font-size: 12px;");

        statusBarBox.getChildren().addAll(statusLabel, spacer);
        return statusBarBox;
    }

    // ========================= DOCUMENT =========================

    private void newDocument() {
        JsonDocumentStore fresh = new JsonDocumentStore();
        NodeHandle filter = fresh.createFilter(DEFAULT_FILTER_ID);
        setDocument(fresh, null, filter);
        setStatus("New document");
    }

    private void chooseAndOpen() {
        if (!checkUnsavedChanges()) {
            return;
        }
        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Open Filter Document");
        fileChooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("Filter Documents", "*.json"));
        if (currentFilePath != null) {
            fileChooser.setInitialDirectory(new File(currentFilePath).getParentFile());
        }
        File file = fileChooser.showOpenDialog(primaryStage);
        if (file != null) {
            openDocument(file.getAbsolutePath(), null);
        }
    }

    private void openDocument(String path, String filterId) {
        try {
            JsonDocumentStore loaded = JsonDocumentStore.load(Paths.get(path));
            NodeHandle filter = filterId != null ? loaded.findFilter(filterId) : null;
            if (filter == null) {
                if (filterId != null) {
                    System.err.println("Warning: no filter with id '" + filterId + "' in " + path);
                }
                List<NodeHandle> filters = loaded.getFilters();
                filter = filters.isEmpty() ? loaded.createFilter(DEFAULT_FILTER_ID) : filters.get(0);
            }
            setDocument(loaded, path, filter);
            prefs.put(LAST_FILE_KEY, path);
            setStatus("Loaded " + new File(path).getName());
            System.out.println("Loaded filter document: " + path + " (" + loaded.getFilters().size() + " filters)");
        } catch (IOException e) {
            System.err.println("Failed to load filter document " + path + ": " + e.getMessage());
            showError("Load Error", "Failed to load filter document: " + e.getMessage());
            if (store == null) {
                newDocument();
            }
        }
    }

    private void saveDocument() {
        if (currentFilePath == null) {
            saveDocumentAs();
        } else {
            saveDocumentToPath(currentFilePath);
        }
    }

    private void saveDocumentAs() {
        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Save Filter Document");
        fileChooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("Filter Documents", "*.json"));
        if (currentFilePath != null) {
            fileChooser.setInitialDirectory(new File(currentFilePath).getParentFile());
            fileChooser.setInitialFileName(new File(currentFilePath).getName());
        }
        File file = fileChooser.showSaveDialog(primaryStage);
        if (file != null) {
            String path = file.getAbsolutePath();
            if (!path.endsWith(".json")) {
                path += ".json";
            }
            saveDocumentToPath(path);
        }
    }

    private void saveDocumentToPath(String path) {
        try {
            Path target = Paths.get(path);
            store.save(target);
            currentFilePath = path;
            isDirty = false;
            prefs.put(LAST_FILE_KEY, path);
            updateTitle();
            setStatus("Saved to: " + new File(path).getName());
        } catch (IOException e) {
            System.err.println("Failed to save filter document " + path + ": " + e.getMessage());
            showError("Save Error", "Failed to save filter document: " + e.getMessage());
        }
    }

    private void setDocument(JsonDocumentStore newStore, String path, NodeHandle filter) {
        closeModel();
        store = newStore;
        currentFilePath = path;
        isDirty = false;
        store.subscribe(description -> {
            isDirty = true;
            updateTitle();
            setStatus(description);
        });

        filterCombo.getItems().clear();
        for (NodeHandle handle : store.getFilters()) {
            String id = store.getAttribute(handle, "id");
            filterCombo.getItems().add(id != null ? id : handle.toString());
        }
        showFilter(filter);
        updateTitle();
    }

    private void showFilter(NodeHandle filter) {
        if (filter == null || (model != null && filter.equals(model.getFilter()))) {
            return;
        }
        closeModel();
        model = new PrimitiveListModel(store, filter);
        listView = new FXPrimitiveListView(model, settings);
        listView.setOnStatus(this::setStatus);
        rootPane.setCenter(listView.getNode());

        String id = store.getAttribute(filter, "id");
        if (id != null && !id.equals(filterCombo.getValue())) {
            filterCombo.setValue(id);
        }
    }

    private void closeModel() {
        if (listView != null) {
            listView.dispose();
            listView = null;
        }
        if (model != null) {
            model.close();
            model = null;
        }
    }

    // ========================= COMMANDS =========================

    private void addPrimitive(PrimitiveKind kind) {
        if (model == null) {
            return;
        }
        PrimitiveGraph graph = model.graph();
        int after = listView.getSelected() != null ? graph.findIndex(listView.getSelected()) : graph.size() - 1;
        runEdit(() -> listView.setSelected(model.insertPrimitive(after, kind)));
    }

    private void duplicateSelected() {
        if (model == null || listView.getSelected() == null) {
            return;
        }
        NodeHandle original = listView.getSelected();
        runEdit(() -> listView.setSelected(model.duplicatePrimitive(original)));
    }

    private void runEdit(Runnable edit) {
        if (store == null) {
            return;
        }
        try {
            edit.run();
        } catch (DocumentStoreException | IllegalArgumentException | IllegalStateException e) {
            System.err.println("Edit failed: " + e.getMessage());
            setStatus("Edit failed: " + e.getMessage());
        }
    }

    // ========================= HELPERS =========================

    private boolean checkUnsavedChanges() {
        if (!isDirty) {
            return true;
        }
        Alert alert = new Alert(Alert.AlertType.CONFIRMATION);
        alert.setTitle("Unsaved Changes");
        alert.setHeaderText("The filter document has unsaved changes.");
        alert.setContentText("Discard them?");
        return alert.showAndWait().filter(b -> b == ButtonType.OK).isPresent();
    }

    private void updateTitle() {
        String name = currentFilePath != null ? new File(currentFilePath).getName() : "Untitled";
        primaryStage.setTitle(APP_TITLE + " - " + name + (isDirty ? " *" : ""));
    }

    private void setStatus(String message) {
        if (statusLabel != null) {
            statusLabel.setText(message);
        }
    }

    private void showError(String title, String message) {
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.setTitle(title);
        alert.setHeaderText(null);
        alert.setContentText(message);
        alert.showAndWait();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
