/**
 * The test tree. {@link com.olo.unit.core.TestSuite} composes {@link com.olo.unit.core.Test}s,
 * {@link com.olo.unit.core.TestCase} is a leaf; both run against a
 * {@link com.olo.unit.core.result.TestResult} that broadcasts every lifecycle event to its listeners.
 */
package com.olo.unit.core;
