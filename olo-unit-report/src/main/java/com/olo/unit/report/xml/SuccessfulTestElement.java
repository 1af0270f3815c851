package com.olo.unit.report.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/** {@code <Test id="n"><Name/></Test>} for a test that reported no failure. */
public final class SuccessfulTestElement extends ExtensibleElement {

    @JacksonXmlProperty(isAttribute = true, localName = "id")
    private final int id;

    @JacksonXmlProperty(localName = "Name")
    private final String name;

    SuccessfulTestElement(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}
