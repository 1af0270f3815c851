package com.olo.unit.plugin.clocker;

import com.olo.unit.core.Test;
import com.olo.unit.core.result.TestFailure;
import com.olo.unit.report.xml.ExtensibleElement;
import com.olo.unit.report.xml.FailedTestElement;
import com.olo.unit.report.xml.StatisticsElement;
import com.olo.unit.report.xml.SuccessfulTestElement;
import com.olo.unit.report.xml.TestRunDocument;
import com.olo.unit.report.xml.XmlOutputterHook;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Adds {@code <Time>} to each test element and {@code <TotalTime>} to the statistics. Unless the timer
 * is flat, the document also gets a {@code <SuiteTimes>} element with one {@code <Suite name="...">}
 * per suite that ran.
 */
public class ClockerXmlHook implements XmlOutputterHook {

    private final TestTimer timer;

    public ClockerXmlHook(TestTimer timer) {
        this.timer = timer;
    }

    @Override
    public void failTestAdded(TestRunDocument document, FailedTestElement element, Test test, TestFailure failure) {
        addTime(element, timer.getTestTime(test));
    }

    @Override
    public void successfulTestAdded(TestRunDocument document, SuccessfulTestElement element, Test test) {
        addTime(element, timer.getTestTime(test));
    }

    @Override
    public void statisticsAdded(TestRunDocument document, StatisticsElement statistics) {
        statistics.addElement("TotalTime", format(timer.getTotalTestTime()));
    }

    @Override
    public void endDocument(TestRunDocument document) {
        if (timer.isFlat() || timer.getSuiteTimes().isEmpty()) {
            return;
        }
        List<SuiteTimesElement.SuiteTime> suites = new ArrayList<>();
        for (Map.Entry<Test, Double> entry : timer.getSuiteTimes().entrySet()) {
            suites.add(new SuiteTimesElement.SuiteTime(entry.getKey().getName(), format(entry.getValue())));
        }
        document.addElement("SuiteTimes", new SuiteTimesElement(suites));
    }

    private static void addTime(ExtensibleElement element, OptionalDouble time) {
        if (time.isPresent()) {
            element.addElement("Time", format(time.getAsDouble()));
        }
    }

    static String format(double millis) {
        return String.format(Locale.ROOT, "%.3f", millis);
    }
}
