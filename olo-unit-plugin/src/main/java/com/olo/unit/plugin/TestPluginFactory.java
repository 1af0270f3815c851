package com.olo.unit.plugin;

/**
 * Entry point of a plug-in module, discovered with {@link java.util.ServiceLoader}
 * ({@code META-INF/services/com.olo.unit.plugin.TestPluginFactory}). Implementations need a public
 * no-arg constructor.
 */
public interface TestPluginFactory {

    /** Contract version the module was built against; must equal {@link TestPlugin#INTERFACE_VERSION}. */
    default String getInterfaceVersion() {
        return TestPlugin.INTERFACE_VERSION;
    }

    TestPlugin createPlugin();
}
