package com.olo.unit.plugin;

import com.olo.unit.core.registry.TestFactory;
import com.olo.unit.core.result.TestListener;
import com.olo.unit.report.xml.XmlOutputterHook;

import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A loaded plug-in module: where it came from, the class loader that keeps it loaded, the plug-in it
 * created and what it contributed. Owned by {@link PluginManager}.
 */
public final class PluginDescriptor {

    private final Path modulePath;
    private final PluginParameters parameters;
    private final URLClassLoader classLoader;
    private final TestPlugin plugin;
    private final List<TestFactory> contributedFactories;
    private final TestListener listener;
    private final XmlOutputterHook xmlOutputterHook;

    PluginDescriptor(Path modulePath, PluginParameters parameters, URLClassLoader classLoader,
                     TestPlugin plugin, List<TestFactory> contributedFactories) {
        this.modulePath = modulePath;
        this.parameters = parameters;
        this.classLoader = classLoader;
        this.plugin = plugin;
        this.contributedFactories = List.copyOf(contributedFactories);
        this.listener = plugin.getListener().orElse(null);
        this.xmlOutputterHook = plugin.getXmlOutputterHook().orElse(null);
    }

    public Path getModulePath() {
        return modulePath;
    }

    public PluginParameters getParameters() {
        return parameters;
    }

    public TestPlugin getPlugin() {
        return plugin;
    }

    /** Factories the plug-in registered during initialization. */
    public List<TestFactory> getContributedFactories() {
        return contributedFactories;
    }

    public Optional<TestListener> getListener() {
        return Optional.ofNullable(listener);
    }

    public Optional<XmlOutputterHook> getXmlOutputterHook() {
        return Optional.ofNullable(xmlOutputterHook);
    }

    URLClassLoader getClassLoader() {
        return classLoader;
    }

    @Override
    public String toString() {
        return "PluginDescriptor{" + modulePath + (parameters.isEmpty() ? "" : "=" + parameters) + "}";
    }
}
