package com.olo.unit.plugin.clocker;

import com.olo.unit.core.registry.TestFactoryRegistry;
import com.olo.unit.core.result.TestListener;
import com.olo.unit.plugin.PluginParameters;
import com.olo.unit.plugin.TestPlugin;
import com.olo.unit.report.xml.XmlOutputterHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Times tests and reports the times in the XML report. Contributes no tests. Accepts the parameter
 * {@value #FLAT} to time test cases only.
 */
public class ClockerPlugin implements TestPlugin {

    public static final String FLAT = "flat";

    private static final Logger log = LoggerFactory.getLogger(ClockerPlugin.class);

    private TestTimer timer;
    private ClockerXmlHook hook;

    @Override
    public void initialize(TestFactoryRegistry registry, PluginParameters parameters) {
        String value = parameters.value().trim();
        boolean flat = FLAT.equalsIgnoreCase(value);
        if (!flat && !value.isEmpty()) {
            log.warn("Clocker plug-in ignores unknown parameter '{}'", value);
        }
        timer = new TestTimer(flat);
        hook = new ClockerXmlHook(timer);
        log.debug("Clocker plug-in initialized (flat={})", flat);
    }

    @Override
    public Optional<TestListener> getListener() {
        return Optional.ofNullable(timer);
    }

    @Override
    public Optional<XmlOutputterHook> getXmlOutputterHook() {
        return Optional.ofNullable(hook);
    }

    TestTimer getTimer() {
        return timer;
    }
}
