package com.olo.unit.plugin;

/**
 * Parent class loader for plug-in modules. Only the test framework API and the libraries it exposes
 * are visible to a module; any other host class throws {@link ClassNotFoundException}, so a module
 * carries its own copy of everything else.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.olo.unit.*}, {@code org.slf4j.*},
 * {@code com.fasterxml.jackson.*}
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "com.olo.unit.",
            "org.slf4j.",
            "com.fasterxml.jackson."
    };

    private final ClassLoader hostLoader;

    /** Delegates allowed names to the loader of the plug-in API. */
    public RestrictedPluginClassLoader() {
        this(TestPluginFactory.class.getClassLoader());
    }

    RestrictedPluginClassLoader(ClassLoader hostLoader) {
        super(null);
        this.hostLoader = hostLoader;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            if (!isAllowed(name)) {
                throw new ClassNotFoundException("Access denied: " + name
                        + " (plug-in modules may only use java.*, javax.*, com.olo.unit.*, org.slf4j.*, com.fasterxml.jackson.*)");
            }
            Class<?> c = hostLoader.loadClass(name);
            if (resolve) resolveClass(c);
            return c;
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
