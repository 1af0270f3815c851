package com.olo.unit.plugin.clocker;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

/** {@code <SuiteTimes><Suite name="Math"><Time>1.250</Time></Suite>...</SuiteTimes>} */
public final class SuiteTimesElement {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Suite")
    private final List<SuiteTime> suites;

    SuiteTimesElement(List<SuiteTime> suites) {
        this.suites = List.copyOf(suites);
    }

    public List<SuiteTime> getSuites() {
        return suites;
    }

    public static final class SuiteTime {

        @JacksonXmlProperty(isAttribute = true, localName = "name")
        private final String name;

        @JacksonXmlProperty(localName = "Time")
        private final String time;

        SuiteTime(String name, String time) {
            this.name = name;
            this.time = time;
        }

        public String getName() {
            return name;
        }

        public String getTime() {
            return time;
        }
    }
}
