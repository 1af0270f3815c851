package com.olo.unit.plugin;

/**
 * Parameter string handed to a plug-in at initialization. The manager never interprets it.
 */
public record PluginParameters(String value) {

    public static final PluginParameters EMPTY = new PluginParameters("");

    public PluginParameters {
        value = value != null ? value : "";
    }

    public static PluginParameters of(String value) {
        return value == null || value.isEmpty() ? EMPTY : new PluginParameters(value);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public String toString() {
        return value;
    }
}
