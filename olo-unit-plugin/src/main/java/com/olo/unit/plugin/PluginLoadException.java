package com.olo.unit.plugin;

import java.nio.file.Path;

/**
 * Thrown when a plug-in module cannot be loaded. The manager is left as it was before the call;
 * modules loaded earlier stay usable.
 */
public final class PluginLoadException extends RuntimeException {

    public enum Kind {
        /** Path missing or unreadable. */
        MODULE_NOT_FOUND,
        /** No {@link TestPluginFactory} registered, or the registration cannot be instantiated. */
        ENTRY_POINT_MISSING,
        /** Factory built against another {@link TestPlugin#INTERFACE_VERSION}. */
        INTERFACE_VERSION_MISMATCH,
        /** Factory or plug-in threw while creating or initializing the plug-in. */
        INITIALIZATION_FAILED
    }

    private final Kind kind;
    private final Path modulePath;

    public PluginLoadException(Kind kind, Path modulePath, String message) {
        this(kind, modulePath, message, null);
    }

    public PluginLoadException(Kind kind, Path modulePath, String message, Throwable cause) {
        super(String.format("Failed to load plug-in module %s (%s): %s", modulePath, kind, message), cause);
        this.kind = kind;
        this.modulePath = modulePath;
    }

    public Kind getKind() {
        return kind;
    }

    public Path getModulePath() {
        return modulePath;
    }
}
