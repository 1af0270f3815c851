package com.olo.unit.plugin.clocker;

import com.olo.unit.plugin.TestPlugin;
import com.olo.unit.plugin.TestPluginFactory;

/** Service entry point of the clocker module. */
public class ClockerPluginFactory implements TestPluginFactory {

    @Override
    public TestPlugin createPlugin() {
        return new ClockerPlugin();
    }
}
