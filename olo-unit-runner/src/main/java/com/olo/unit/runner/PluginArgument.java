package com.olo.unit.runner;

import com.olo.unit.plugin.PluginParameters;

import java.nio.file.Path;
import java.util.Objects;

/** A plug-in module named on the command line, with the parameters to pass it. */
public record PluginArgument(Path module, PluginParameters parameters) {

    public PluginArgument {
        Objects.requireNonNull(module, "module");
        parameters = parameters != null ? parameters : PluginParameters.EMPTY;
    }

    /**
     * Parses {@code module[=parameters]}. Everything after the first {@code =} is the parameter string.
     *
     * @throws IllegalArgumentException if the module part is empty
     */
    public static PluginArgument parse(String argument) {
        Objects.requireNonNull(argument, "argument");
        int eq = argument.indexOf('=');
        String module = eq >= 0 ? argument.substring(0, eq) : argument;
        if (module.isBlank()) {
            throw new IllegalArgumentException("Missing plug-in module in '" + argument + "'");
        }
        String parameters = eq >= 0 ? argument.substring(eq + 1) : "";
        return new PluginArgument(Path.of(module), PluginParameters.of(parameters));
    }
}
