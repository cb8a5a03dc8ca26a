package com.ttennebkram.filtergraph.document;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory document store backed by a JSON file.
 *
 * Layout of the JSON document:
 * <pre>
 * { "filters": [ { "id": "blur1",
 *                  "primitives": [ { "type": "feGaussianBlur",
 *                                    "attributes": { "in": "SourceGraphic", "result": "result0" },
 *                                    "children": [] } ] } ] }
 * </pre>
 *
 * Every mutation is recorded as an edit that can be undone and redone.
 * Mutations outside {@link #runAction} are one history entry each.
 */
public class JsonDocumentStore implements DocumentStore {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static final String FILTER_ELEMENT = "filter";
    private static final String DOCUMENT_ELEMENT = "document";

    /**
     * One node of the document tree.
     */
    private static class Element {
        final NodeHandle handle;
        final String kind;
        final Map<String, String> attributes = new LinkedHashMap<>();
        final List<Element> children = new ArrayList<>();
        Element parent;

        Element(NodeHandle handle, String kind) {
            this.handle = handle;
            this.kind = kind;
        }
    }

    /**
     * A single reversible change to the tree.
     */
    private interface Edit {
        void redo();

        void undo();
    }

    private static class HistoryEntry {
        final String description;
        final List<Edit> edits = new ArrayList<>();

        HistoryEntry(String description) {
            this.description = description;
        }
    }

    private final Element root = new Element(new NodeHandle(0), DOCUMENT_ELEMENT);
    private final Map<NodeHandle, Element> elements = new HashMap<>();
    private final List<DocumentListener> listeners = new ArrayList<>();
    private final Deque<HistoryEntry> undoStack = new ArrayDeque<>();
    private final Deque<HistoryEntry> redoStack = new ArrayDeque<>();

    private HistoryEntry currentAction = null;
    private int nextHandleId = 1;
    private boolean readOnly = false;

    // ========== Queries ==========

    @Override
    public List<NodeHandle> getFilters() {
        return handlesOf(root.children);
    }

    @Override
    public NodeHandle findFilter(String id) {
        for (Element filter : root.children) {
            if (Objects.equals(filter.attributes.get("id"), id)) {
                return filter.handle;
            }
        }
        return null;
    }

    @Override
    public List<NodeHandle> getOrderedPrimitives(NodeHandle filter) {
        return handlesOf(element(filter).children);
    }

    @Override
    public List<NodeHandle> getChildren(NodeHandle node) {
        return handlesOf(element(node).children);
    }

    @Override
    public String getKind(NodeHandle node) {
        return element(node).kind;
    }

    @Override
    public String getAttribute(NodeHandle node, String name) {
        return element(node).attributes.get(name);
    }

    @Override
    public Map<String, String> getAttributes(NodeHandle node) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(element(node).attributes));
    }

    @Override
    public boolean contains(NodeHandle node) {
        return node != null && elements.containsKey(node);
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * A read-only store rejects every mutation with {@link DocumentStoreException}.
     */
    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    // ========== Mutations ==========

    /**
     * Append a new, empty filter with the given id.
     */
    public NodeHandle createFilter(String id) {
        checkWritable();
        Element filter = newElement(FILTER_ELEMENT);
        if (id != null) {
            filter.attributes.put("id", id);
        }
        apply("Add filter", new InsertEdit(root, root.children.size(), filter));
        return filter.handle;
    }

    @Override
    public void setAttribute(NodeHandle node, String name, String value) {
        checkWritable();
        Element target = element(node);
        String old = target.attributes.get(name);
        if (Objects.equals(old, value)) {
            return;
        }
        apply("Set attribute", new AttributeEdit(target, name, old, value));
    }

    @Override
    public NodeHandle insertNode(NodeHandle filter, int afterPosition, String kind) {
        checkWritable();
        Element parent = element(filter);
        if (afterPosition < -1 || afterPosition >= parent.children.size()) {
            throw new IllegalArgumentException("Insert position " + afterPosition
                + " out of range for " + parent.children.size() + " primitives");
        }
        Element created = newElement(kind);
        apply("Add node", new InsertEdit(parent, afterPosition + 1, created));
        return created.handle;
    }

    @Override
    public NodeHandle appendChild(NodeHandle parent, String kind) {
        checkWritable();
        Element parentElement = element(parent);
        Element created = newElement(kind);
        apply("Add node", new InsertEdit(parentElement, parentElement.children.size(), created));
        return created.handle;
    }

    @Override
    public void removeNode(NodeHandle node) {
        checkWritable();
        Element target = element(node);
        Element parent = target.parent;
        int index = parent.children.indexOf(target);
        apply("Remove node", new RemoveEdit(new InsertEdit(parent, index, target)));
    }

    @Override
    public void setPosition(NodeHandle node, int index) {
        checkWritable();
        Element target = element(node);
        Element parent = target.parent;
        if (index < 0 || index >= parent.children.size()) {
            throw new IllegalArgumentException("Position " + index
                + " out of range for " + parent.children.size() + " siblings");
        }
        int from = parent.children.indexOf(target);
        if (from == index) {
            return;
        }
        apply("Move node", new MoveEdit(parent, target, from, index));
    }

    @Override
    public void runAction(String description, Runnable mutation) {
        if (currentAction != null) {
            // Nested actions join the outer one
            mutation.run();
            return;
        }

        HistoryEntry entry = new HistoryEntry(description);
        currentAction = entry;
        try {
            mutation.run();
        } catch (RuntimeException e) {
            currentAction = null;
            revert(entry);
            throw e;
        }
        currentAction = null;

        if (!entry.edits.isEmpty()) {
            undoStack.push(entry);
            redoStack.clear();
            fireChanged(description);
        }
    }

    // ========== History ==========

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    /**
     * Description of the entry {@link #undo()} would revert, or null.
     */
    public String getUndoDescription() {
        HistoryEntry entry = undoStack.peek();
        return entry != null ? entry.description : null;
    }

    public boolean undo() {
        checkNotInAction();
        checkWritable();
        HistoryEntry entry = undoStack.poll();
        if (entry == null) {
            return false;
        }
        revert(entry);
        redoStack.push(entry);
        fireChanged("Undo " + entry.description);
        return true;
    }

    public boolean redo() {
        checkNotInAction();
        checkWritable();
        HistoryEntry entry = redoStack.poll();
        if (entry == null) {
            return false;
        }
        for (Edit edit : entry.edits) {
            edit.redo();
        }
        undoStack.push(entry);
        fireChanged("Redo " + entry.description);
        return true;
    }

    // ========== Observers ==========

    @Override
    public Subscription subscribe(DocumentListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return new Subscription() {
            private boolean active = true;

            @Override
            public boolean isActive() {
                return active;
            }

            @Override
            public void close() {
                if (active) {
                    active = false;
                    listeners.remove(listener);
                }
            }
        };
    }

    private void fireChanged(String description) {
        // Copy so listeners may unsubscribe while being notified
        for (DocumentListener listener : new ArrayList<>(listeners)) {
            listener.documentChanged(description);
        }
    }

    // ========== Load / save ==========

    public static JsonDocumentStore load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    /**
     * Read a filter document. History starts out empty.
     */
    public static JsonDocumentStore load(Reader reader) throws IOException {
        JsonObject rootJson;
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid filter document: not a valid JSON object");
            }
            rootJson = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid filter document: " + e.getMessage(), e);
        }

        if (!rootJson.has("filters") || !rootJson.get("filters").isJsonArray()) {
            throw new IOException("Invalid filter document: missing 'filters' array");
        }

        JsonDocumentStore store = new JsonDocumentStore();
        for (JsonElement filterElem : rootJson.getAsJsonArray("filters")) {
            if (!filterElem.isJsonObject()) {
                throw new IOException("Invalid filter document: filter entry is not an object");
            }
            JsonObject filterJson = filterElem.getAsJsonObject();
            Element filter = store.newElement(FILTER_ELEMENT);
            if (filterJson.has("id")) {
                filter.attributes.put("id", scalar(filterJson, "id"));
            }
            readAttributes(filterJson, filter);
            store.attach(store.root, filter);

            if (filterJson.has("primitives")) {
                for (JsonElement primElem : array(filterJson, "primitives")) {
                    store.readElement(primElem, filter);
                }
            }
        }
        return store;
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            save(writer);
        }
    }

    public void save(Writer writer) throws IOException {
        JsonObject rootJson = new JsonObject();
        JsonArray filtersArray = new JsonArray();
        for (Element filter : root.children) {
            JsonObject filterJson = new JsonObject();
            String id = filter.attributes.get("id");
            if (id != null) {
                filterJson.addProperty("id", id);
            }
            Map<String, String> extra = new LinkedHashMap<>(filter.attributes);
            extra.remove("id");
            if (!extra.isEmpty()) {
                filterJson.add("attributes", attributesToJson(extra));
            }
            JsonArray primitives = new JsonArray();
            for (Element primitive : filter.children) {
                primitives.add(elementToJson(primitive));
            }
            filterJson.add("primitives", primitives);
            filtersArray.add(filterJson);
        }
        rootJson.add("filters", filtersArray);

        try {
            GSON.toJson(rootJson, writer);
            writer.flush();
        } catch (JsonParseException e) {
            throw new IOException("Failed to write filter document: " + e.getMessage(), e);
        }
    }

    private void readElement(JsonElement json, Element parent) throws IOException {
        if (!json.isJsonObject()) {
            throw new IOException("Invalid filter document: element is not an object");
        }
        JsonObject obj = json.getAsJsonObject();
        if (!obj.has("type")) {
            throw new IOException("Invalid filter document: element without 'type'");
        }
        Element element = newElement(scalar(obj, "type"));
        readAttributes(obj, element);
        attach(parent, element);

        if (obj.has("children")) {
            for (JsonElement child : array(obj, "children")) {
                readElement(child, element);
            }
        }
    }

    private static String scalar(JsonObject obj, String name) throws IOException {
        JsonElement value = obj.get(name);
        if (value == null || !value.isJsonPrimitive()) {
            throw new IOException("Invalid filter document: '" + name + "' is not a scalar");
        }
        return value.getAsString();
    }

    private static JsonArray array(JsonObject obj, String name) throws IOException {
        JsonElement value = obj.get(name);
        if (value == null || !value.isJsonArray()) {
            throw new IOException("Invalid filter document: '" + name + "' is not an array");
        }
        return value.getAsJsonArray();
    }

    private static void readAttributes(JsonObject obj, Element element) throws IOException {
        if (!obj.has("attributes")) {
            return;
        }
        JsonElement attrs = obj.get("attributes");
        if (!attrs.isJsonObject()) {
            throw new IOException("Invalid filter document: 'attributes' is not an object");
        }
        for (Map.Entry<String, JsonElement> entry : attrs.getAsJsonObject().entrySet()) {
            JsonElement value = entry.getValue();
            if (value.isJsonNull()) {
                continue;
            }
            if (!value.isJsonPrimitive()) {
                throw new IOException("Invalid filter document: attribute '" + entry.getKey() + "' is not a scalar");
            }
            element.attributes.put(entry.getKey(), value.getAsString());
        }
    }

    private static JsonObject elementToJson(Element element) {
        JsonObject json = new JsonObject();
        json.addProperty("type", element.kind);
        json.add("attributes", attributesToJson(element.attributes));
        if (!element.children.isEmpty()) {
            JsonArray children = new JsonArray();
            for (Element child : element.children) {
                children.add(elementToJson(child));
            }
            json.add("children", children);
        }
        return json;
    }

    private static JsonObject attributesToJson(Map<String, String> attributes) {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            json.addProperty(entry.getKey(), entry.getValue());
        }
        return json;
    }

    // ========== Internals ==========

    private Element element(NodeHandle handle) {
        Element element = handle != null ? elements.get(handle) : null;
        if (element == null) {
            throw new IllegalArgumentException("Unknown node: " + handle);
        }
        return element;
    }

    private Element newElement(String kind) {
        return new Element(new NodeHandle(nextHandleId++), kind);
    }

    private void attach(Element parent, Element child) {
        parent.children.add(child);
        child.parent = parent;
        register(child);
    }

    private void register(Element element) {
        elements.put(element.handle, element);
        for (Element child : element.children) {
            register(child);
        }
    }

    private void unregister(Element element) {
        elements.remove(element.handle);
        for (Element child : element.children) {
            unregister(child);
        }
    }

    private static List<NodeHandle> handlesOf(List<Element> list) {
        List<NodeHandle> handles = new ArrayList<>(list.size());
        for (Element element : list) {
            handles.add(element.handle);
        }
        return handles;
    }

    private void apply(String description, Edit edit) {
        edit.redo();
        if (currentAction != null) {
            currentAction.edits.add(edit);
            return;
        }
        HistoryEntry entry = new HistoryEntry(description);
        entry.edits.add(edit);
        undoStack.push(entry);
        redoStack.clear();
        fireChanged(description);
    }

    private static void revert(HistoryEntry entry) {
        for (int i = entry.edits.size() - 1; i >= 0; i--) {
            entry.edits.get(i).undo();
        }
    }

    private void checkWritable() {
        if (readOnly) {
            throw new DocumentStoreException("Document is read-only");
        }
    }

    private void checkNotInAction() {
        if (currentAction != null) {
            throw new IllegalStateException("Cannot undo or redo while an action is running");
        }
    }

    // ========== Edits ==========

    private static class AttributeEdit implements Edit {
        private final Element element;
        private final String name;
        private final String oldValue;
        private final String newValue;

        AttributeEdit(Element element, String name, String oldValue, String newValue) {
            this.element = element;
            this.name = name;
            this.oldValue = oldValue;
            this.newValue = newValue;
        }

        @Override
        public void redo() {
            put(newValue);
        }

        @Override
        public void undo() {
            put(oldValue);
        }

        private void put(String value) {
            if (value == null) {
                element.attributes.remove(name);
            } else {
                element.attributes.put(name, value);
            }
        }
    }

    private class InsertEdit implements Edit {
        private final Element parent;
        private final int index;
        private final Element element;

        InsertEdit(Element parent, int index, Element element) {
            this.parent = parent;
            this.index = index;
            this.element = element;
        }

        @Override
        public void redo() {
            parent.children.add(index, element);
            element.parent = parent;
            register(element);
        }

        @Override
        public void undo() {
            parent.children.remove(element);
            element.parent = null;
            unregister(element);
        }
    }

    private static class RemoveEdit implements Edit {
        private final InsertEdit insert;

        RemoveEdit(InsertEdit insert) {
            this.insert = insert;
        }

        @Override
        public void redo() {
            insert.undo();
        }

        @Override
        public void undo() {
            insert.redo();
        }
    }

    private static class MoveEdit implements Edit {
        private final Element parent;
        private final Element element;
        private final int from;
        private final int to;

        MoveEdit(Element parent, Element element, int from, int to) {
            this.parent = parent;
            this.element = element;
            this.from = from;
            this.to = to;
        }

        @Override
        public void redo() {
            parent.children.remove(element);
            parent.children.add(to, element);
        }

        @Override
        public void undo() {
            parent.children.remove(element);
            parent.children.add(from, element);
        }
    }
}
