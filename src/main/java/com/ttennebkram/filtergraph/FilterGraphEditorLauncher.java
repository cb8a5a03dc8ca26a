package com.ttennebkram.filtergraph;

import java.util.logging.Filter;
import java.util.logging.Logger;

/**
 * Non-Application main class, so the editor can start from a plain or
 * shaded jar with JavaFX on the classpath.
 */
public class FilterGraphEditorLauncher {

    private static final String APP_NAME = "Filter Graph Editor";

    public static void main(String[] args) {
        suppressJavaFXModuleWarning();

        // macOS application name, must be set before toolkit startup
        System.setProperty("apple.awt.application.name", APP_NAME);

        FilterGraphEditorApp.main(args);
    }

    /**
     * JavaFX warns about "Unsupported JavaFX configuration" when loaded from
     * the classpath instead of the module path; filter that one message out.
     */
    private static void suppressJavaFXModuleWarning() {
        Logger javafxLogger = Logger.getLogger("javafx");
        Filter existingFilter = javafxLogger.getFilter();
        javafxLogger.setFilter(record -> {
            String msg = record.getMessage();
            if (msg != null && msg.contains("Unsupported JavaFX configuration")) {
                return false;
            }
            return existingFilter == null || existingFilter.isLoggable(record);
        });
    }
}
