package com.olo.unit.plugin;

import com.olo.unit.core.registry.TestFactoryRegistry;
import com.olo.unit.core.result.TestListener;
import com.olo.unit.report.xml.XmlOutputterHook;

import java.util.Optional;

/**
 * A test plug-in: a unit of test code loaded at runtime by {@link PluginManager}. Every capability is
 * optional.
 * <p>
 * The manager calls {@link #initialize} once after loading, asks for the listener and XML hook once
 * (the same instances are attached and detached for the lifetime of the module) and calls
 * {@link #uninitialize} once before the module is unloaded.
 */
public interface TestPlugin {

    /** Version of this contract. A factory reporting a different version is rejected at load time. */
    String INTERFACE_VERSION = "1.0";

    /** Contributes tests, typically by registering {@link com.olo.unit.core.registry.TestFactory}s. */
    default void initialize(TestFactoryRegistry registry, PluginParameters parameters) {
    }

    /** Listener attached to every run controller the host passes to the manager. */
    default Optional<TestListener> getListener() {
        return Optional.empty();
    }

    /** Hook attached to the XML outputter for the duration of one render. */
    default Optional<XmlOutputterHook> getXmlOutputterHook() {
        return Optional.empty();
    }

    /** Withdraws whatever {@link #initialize} contributed. */
    default void uninitialize(TestFactoryRegistry registry) {
    }
}
