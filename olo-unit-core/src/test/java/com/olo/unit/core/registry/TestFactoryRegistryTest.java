package com.olo.unit.core.registry;

import com.olo.unit.core.TestCase;
import com.olo.unit.core.TestSuite;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestFactoryRegistryTest {

    @Test
    void makeTest_buildsSuiteNamedAfterRegistryInRegistrationOrder() {
        TestFactoryRegistry registry = new TestFactoryRegistry();
        registry.registerFactory(() -> TestCase.of("first", () -> { }));
        registry.registerFactory(() -> {
            TestSuite suite = new TestSuite("second");
            suite.addTest(TestCase.of("inner", () -> { }));
            return suite;
        });

        TestSuite root = registry.makeTest();

        assertEquals(TestFactoryRegistry.DEFAULT_NAME, root.getName());
        assertEquals(List.of("first", "second"),
                root.getTests().stream().map(com.olo.unit.core.Test::getName).toList());
        assertEquals(2, root.countTestCases());
    }

    @Test
    void makeTest_returnsFreshTreeEachCall() {
        TestFactoryRegistry registry = new TestFactoryRegistry("Plugins");
        registry.registerFactory(() -> TestCase.of("t", () -> { }));

        assertNotSame(registry.makeTest().getTests().get(0), registry.makeTest().getTests().get(0));
    }

    @Test
    void unregisterFactory_removesOnlyThatFactory() {
        TestFactoryRegistry registry = new TestFactoryRegistry();
        TestFactory a = () -> TestCase.of("a", () -> { });
        TestFactory b = () -> TestCase.of("b", () -> { });
        registry.registerFactory(a);
        registry.registerFactory(b);

        assertTrue(registry.unregisterFactory(a));
        assertFalse(registry.unregisterFactory(a));
        assertEquals(List.of(b), registry.getFactories());
        assertFalse(registry.contains(a));
    }

    @Test
    void registerFactory_rejectsDuplicates() {
        TestFactoryRegistry registry = new TestFactoryRegistry();
        TestFactory a = () -> TestCase.of("a", () -> { });
        registry.registerFactory(a);

        assertThrows(IllegalArgumentException.class, () -> registry.registerFactory(a));
    }
}
