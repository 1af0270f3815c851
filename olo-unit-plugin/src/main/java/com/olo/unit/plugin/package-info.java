/**
 * Test plug-ins: modules of test code loaded at runtime, each through its own class loader.
 * <ul>
 *   <li>{@link com.olo.unit.plugin.TestPluginFactory} – entry point of a module (ServiceLoader)</li>
 *   <li>{@link com.olo.unit.plugin.TestPlugin} – contributes tests, a listener and an XML hook</li>
 *   <li>{@link com.olo.unit.plugin.PluginManager} – loads modules, attaches their contributions and unloads them</li>
 *   <li>{@link com.olo.unit.plugin.RestrictedPluginClassLoader} – parent loader exposing only the framework API,
 *       slf4j and Jackson</li>
 *   <li>{@link com.olo.unit.plugin.PluginLoadException} – load failure with its {@link com.olo.unit.plugin.PluginLoadException.Kind}</li>
 * </ul>
 * A module's contributions must be released before the module is unloaded; see {@link com.olo.unit.plugin.PluginManager#close()}.
 */
package com.olo.unit.plugin;
