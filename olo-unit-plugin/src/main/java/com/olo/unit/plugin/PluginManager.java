package com.olo.unit.plugin;

import com.olo.unit.core.registry.TestFactory;
import com.olo.unit.core.registry.TestFactoryRegistry;
import com.olo.unit.core.result.TestListener;
import com.olo.unit.core.result.TestResult;
import com.olo.unit.plugin.PluginLoadException.Kind;
import com.olo.unit.report.xml.XmlOutputter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Loads test plug-in modules (a JAR or a class directory) and manages their lifecycle. Each module gets
 * its own {@link URLClassLoader} over a {@link RestrictedPluginClassLoader}; unloading a module closes
 * that loader.
 * <p>
 * A module stays loaded while anything it provided is reachable from the host: its contributed tests,
 * its listener on a run controller, its hook on an XML outputter. {@link #close()} therefore refuses to
 * run while a listener or hook is still attached, and callers scope the controller and outputters
 * inside a try-with-resources block on the manager:
 * <pre>{@code
 * try (PluginManager plugins = new PluginManager(registry)) {
 *     plugins.load(module, PluginParameters.EMPTY);
 *     TestResult controller = new TestResult();
 *     plugins.addListener(controller);
 *     ...
 *     plugins.removeListener(controller);
 * }
 * }</pre>
 * Not thread-safe.
 */
public final class PluginManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final TestFactoryRegistry registry;
    private final List<PluginDescriptor> descriptors = new ArrayList<>();
    private final List<TestResult> attachedControllers = new ArrayList<>();
    private XmlOutputter hooksTarget;
    private boolean closed;

    public PluginManager(TestFactoryRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Loads one module, creates its plug-in and initializes it against the registry.
     *
     * @throws PluginLoadException if the module cannot be loaded; the manager is unchanged
     */
    public PluginDescriptor load(Path module, PluginParameters parameters) {
        Objects.requireNonNull(module, "module");
        ensureOpen();
        PluginParameters params = parameters != null ? parameters : PluginParameters.EMPTY;
        if (!Files.exists(module) || !Files.isReadable(module)) {
            throw new PluginLoadException(Kind.MODULE_NOT_FOUND, module, "path does not exist or is not readable");
        }
        URLClassLoader loader = new URLClassLoader(new URL[]{toUrl(module)}, new RestrictedPluginClassLoader());
        try {
            PluginDescriptor descriptor = createDescriptor(module, params, loader);
            descriptors.add(descriptor);
            log.info("Loaded test plug-in module {} ({} factory(ies) contributed)",
                    module.getFileName(), descriptor.getContributedFactories().size());
            return descriptor;
        } catch (RuntimeException | Error e) {
            closeQuietly(module, loader);
            throw e;
        }
    }

    /**
     * Loads every {@code *.jar} of {@code directory} in file name order, with empty parameters.
     * A missing directory loads nothing. Stops at the first module that fails.
     *
     * @throws PluginLoadException if a module cannot be loaded; modules loaded before it stay loaded
     */
    public List<PluginDescriptor> loadAll(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            log.debug("Plug-in directory does not exist: {}", directory);
            return List.of();
        }
        if (!Files.isDirectory(directory)) {
            throw new PluginLoadException(Kind.MODULE_NOT_FOUND, directory, "not a directory");
        }
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.jar")) {
            stream.forEach(jars::add);
        } catch (IOException e) {
            throw new PluginLoadException(Kind.MODULE_NOT_FOUND, directory, "cannot list directory: " + e.getMessage(), e);
        }
        jars.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        List<PluginDescriptor> loaded = new ArrayList<>(jars.size());
        for (Path jar : jars) {
            loaded.add(load(jar, PluginParameters.EMPTY));
        }
        return loaded;
    }

    private PluginDescriptor createDescriptor(Path module, PluginParameters params, URLClassLoader loader) {
        TestPluginFactory factory = findFactory(module, loader);
        String version;
        try {
            version = factory.getInterfaceVersion();
        } catch (RuntimeException | Error e) {
            throw initializationFailed(module, "getInterfaceVersion", e);
        }
        if (!TestPlugin.INTERFACE_VERSION.equals(version)) {
            throw new PluginLoadException(Kind.INTERFACE_VERSION_MISMATCH, module,
                    "module built against interface " + version + ", host provides " + TestPlugin.INTERFACE_VERSION);
        }
        TestPlugin plugin;
        try {
            plugin = Objects.requireNonNull(factory.createPlugin(), "createPlugin() returned null");
        } catch (RuntimeException | Error e) {
            throw initializationFailed(module, "createPlugin", e);
        }
        List<TestFactory> before = registry.getFactories();
        try {
            plugin.initialize(registry, params);
        } catch (RuntimeException | Error e) {
            unregisterContributed(module, newFactories(before), false);
            throw initializationFailed(module, "initialize", e);
        }
        return new PluginDescriptor(module, params, loader, plugin, newFactories(before));
    }

    /**
     * Wraps what plug-in code threw. A {@link LinkageError} usually means the module references a host
     * class the restricted loader does not expose. {@link VirtualMachineError}s are rethrown as they are.
     */
    private static PluginLoadException initializationFailed(Path module, String step, Throwable e) {
        if (e instanceof VirtualMachineError) {
            throw (VirtualMachineError) e;
        }
        String reason = e instanceof LinkageError ? "linkage error" : "failed";
        return new PluginLoadException(Kind.INITIALIZATION_FAILED, module,
                step + " " + reason + ": " + e, e);
    }

    private static TestPluginFactory findFactory(Path module, ClassLoader loader) {
        try {
            Iterator<TestPluginFactory> it = ServiceLoader.load(TestPluginFactory.class, loader).iterator();
            if (!it.hasNext()) {
                throw new PluginLoadException(Kind.ENTRY_POINT_MISSING, module,
                        "no META-INF/services/" + TestPluginFactory.class.getName() + " registration");
            }
            TestPluginFactory factory = it.next();
            if (it.hasNext()) {
                log.warn("Plug-in module {} registers more than one factory; using {}",
                        module.getFileName(), factory.getClass().getName());
            }
            return factory;
        } catch (ServiceConfigurationError e) {
            throw new PluginLoadException(Kind.ENTRY_POINT_MISSING, module, e.getMessage(), e);
        }
    }

    private List<TestFactory> newFactories(List<TestFactory> before) {
        List<TestFactory> added = new ArrayList<>();
        for (TestFactory factory : registry.getFactories()) {
            if (!containsIdentity(before, factory)) {
                added.add(factory);
            }
        }
        return added;
    }

    /**
     * Attaches every plug-in listener to {@code controller}, in module load order. If the controller
     * rejects one, the listeners attached so far are detached again before the exception propagates.
     */
    public void addListener(TestResult controller) {
        Objects.requireNonNull(controller, "controller");
        ensureOpen();
        if (containsIdentity(attachedControllers, controller)) {
            throw new IllegalStateException("Plug-in listeners are already attached to this controller");
        }
        List<TestListener> attached = new ArrayList<>();
        try {
            for (PluginDescriptor descriptor : descriptors) {
                Optional<TestListener> listener = descriptor.getListener();
                if (listener.isPresent()) {
                    controller.addListener(listener.get());
                    attached.add(listener.get());
                }
            }
        } catch (RuntimeException e) {
            attached.forEach(controller::removeListener);
            throw e;
        }
        attachedControllers.add(controller);
    }

    /** Detaches the plug-in listeners from {@code controller}. No-op if they were not attached. */
    public void removeListener(TestResult controller) {
        if (!removeIdentity(attachedControllers, controller)) {
            return;
        }
        for (PluginDescriptor descriptor : descriptors) {
            descriptor.getListener().ifPresent(controller::removeListener);
        }
    }

    /**
     * Attaches every plug-in XML hook to {@code outputter}, in module load order. Hooks stay attached
     * until {@link #removeXmlOutputterHooks(XmlOutputter)}.
     *
     * @throws IllegalStateException if hooks are attached to an outputter already
     */
    public void addXmlOutputterHooks(XmlOutputter outputter) {
        Objects.requireNonNull(outputter, "outputter");
        ensureOpen();
        if (hooksTarget != null) {
            throw new IllegalStateException("Plug-in XML hooks are already attached to an outputter");
        }
        for (PluginDescriptor descriptor : descriptors) {
            descriptor.getXmlOutputterHook().ifPresent(outputter::addHook);
        }
        hooksTarget = outputter;
    }

    /**
     * Detaches the plug-in XML hooks from {@code outputter}. No-op if no hooks are attached.
     *
     * @throws IllegalStateException if the hooks are attached to another outputter
     */
    public void removeXmlOutputterHooks(XmlOutputter outputter) {
        if (hooksTarget == null) {
            return;
        }
        if (hooksTarget != outputter) {
            throw new IllegalStateException("Plug-in XML hooks are attached to another outputter");
        }
        for (PluginDescriptor descriptor : descriptors) {
            descriptor.getXmlOutputterHook().ifPresent(outputter::removeHook);
        }
        hooksTarget = null;
    }

    /** Loaded modules in load order. */
    public List<PluginDescriptor> getDescriptors() {
        return Collections.unmodifiableList(descriptors);
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Uninitializes and unloads every module, last loaded first. Factories a plug-in left in the
     * registry are removed with a warning. Idempotent.
     *
     * @throws IllegalStateException if a listener or hook of a plug-in is still attached; nothing is
     *                               unloaded in that case
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (!attachedControllers.isEmpty() || hooksTarget != null) {
            throw new IllegalStateException("Cannot unload plug-ins while their listeners or XML hooks are attached ("
                    + attachedControllers.size() + " controller(s), hooks " + (hooksTarget != null ? "attached" : "detached") + ")");
        }
        closed = true;
        for (int i = descriptors.size() - 1; i >= 0; i--) {
            unload(descriptors.get(i));
        }
        descriptors.clear();
    }

    private void unload(PluginDescriptor descriptor) {
        Path module = descriptor.getModulePath();
        try {
            descriptor.getPlugin().uninitialize(registry);
        } catch (RuntimeException e) {
            log.warn("Plug-in {} failed to uninitialize: {}", module.getFileName(), e.getMessage(), e);
        }
        unregisterContributed(module, descriptor.getContributedFactories(), true);
        closeQuietly(module, descriptor.getClassLoader());
        log.debug("Unloaded test plug-in module {}", module.getFileName());
    }

    private void unregisterContributed(Path module, List<TestFactory> factories, boolean warn) {
        for (TestFactory factory : factories) {
            if (registry.unregisterFactory(factory) && warn) {
                log.warn("Plug-in {} left factory {} registered; removed it", module.getFileName(), factory);
            }
        }
    }

    private static void closeQuietly(Path module, URLClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader of plug-in module {}: {}", module, e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Plug-in manager is closed");
        }
    }

    private static URL toUrl(Path module) {
        try {
            return module.toAbsolutePath().toUri().toURL();
        } catch (MalformedURLException e) {
            throw new PluginLoadException(Kind.MODULE_NOT_FOUND, module, "invalid module path: " + e.getMessage(), e);
        }
    }

    private static <T> boolean containsIdentity(List<T> list, T item) {
        for (T t : list) {
            if (t == item) {
                return true;
            }
        }
        return false;
    }

    private static <T> boolean removeIdentity(List<T> list, T item) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == item) {
                list.remove(i);
                return true;
            }
        }
        return false;
    }
}
