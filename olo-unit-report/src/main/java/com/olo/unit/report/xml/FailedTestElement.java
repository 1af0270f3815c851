package com.olo.unit.report.xml;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.olo.unit.core.result.SourceLine;
import com.olo.unit.core.result.TestFailure;

/** {@code <FailedTest id="n">} with name, failure type, optional location and message. */
public final class FailedTestElement extends ExtensibleElement {

    @JacksonXmlProperty(isAttribute = true, localName = "id")
    private final int id;

    @JacksonXmlProperty(localName = "Name")
    private final String name;

    @JacksonXmlProperty(localName = "FailureType")
    private final String failureType;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JacksonXmlProperty(localName = "Location")
    private final Location location;

    @JacksonXmlProperty(localName = "Message")
    private final String message;

    FailedTestElement(int id, TestFailure failure) {
        this.id = id;
        this.name = failure.failedTest().getName();
        this.failureType = failure.getFailureType();
        SourceLine line = failure.getSourceLine();
        this.location = line.isValid() ? new Location(line.fileName(), line.lineNumber()) : null;
        this.message = failure.getMessage();
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getFailureType() {
        return failureType;
    }

    public String getMessage() {
        return message;
    }

    /** Null when the failure location is unknown. */
    public Location getLocation() {
        return location;
    }

    /** {@code <Location><File/><Line/></Location>}. */
    public static final class Location {

        @JacksonXmlProperty(localName = "File")
        private final String file;

        @JacksonXmlProperty(localName = "Line")
        private final int line;

        Location(String file, int line) {
            this.file = file;
            this.line = line;
        }

        public String getFile() {
            return file;
        }

        public int getLine() {
            return line;
        }
    }
}
