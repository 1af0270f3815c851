package com.olo.unit.report.xml;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Element of the XML report that {@link XmlOutputterHook}s may extend with extra child elements.
 * Extra elements are written after the standard ones, in insertion order. Values are serialized by
 * Jackson (strings and numbers as text, maps as nested elements).
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public abstract class ExtensibleElement {

    @JsonIgnore
    private final Map<String, Object> extras = new LinkedHashMap<>();

    /**
     * Adds (or replaces) a child element.
     *
     * @param name  element name; must be a valid XML name
     * @param value element content
     */
    public void addElement(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Element name must be non-blank");
        }
        extras.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtraElements() {
        return Collections.unmodifiableMap(extras);
    }
}
