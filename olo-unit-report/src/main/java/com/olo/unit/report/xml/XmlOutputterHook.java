package com.olo.unit.report.xml;

import com.olo.unit.core.Test;
import com.olo.unit.core.result.TestFailure;

/**
 * Extension point of {@link XmlOutputter}: called while the report document is built, so a hook can
 * add elements (timings, environment details). Hooks see the document in build order and must not
 * keep references to it after {@link #endDocument}.
 */
public interface XmlOutputterHook {

    default void beginDocument(TestRunDocument document) {
    }

    default void endDocument(TestRunDocument document) {
    }

    default void failTestAdded(TestRunDocument document, FailedTestElement element, Test test, TestFailure failure) {
    }

    default void successfulTestAdded(TestRunDocument document, SuccessfulTestElement element, Test test) {
    }

    default void statisticsAdded(TestRunDocument document, StatisticsElement statistics) {
    }
}
