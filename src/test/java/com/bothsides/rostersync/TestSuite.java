package com.bothsides.rostersync;

import org.junit.platform.suite.api.SelectPackages;
import org.junit.platform.suite.api.Suite;
import org.junit.platform.suite.api.SuiteDisplayName;

/**
 * Test suite for running all roster sync engine tests
 *
 * Usage:
 * - Run all tests: mvn test
 * - Run specific suite: mvn test -Dtest=TestSuite
 */
@Suite
@SuiteDisplayName("Roster Sync Engine Test Suite")
@SelectPackages({
    "com.bothsides.rostersync.config",
    "com.bothsides.rostersync.queue",
    "com.bothsides.rostersync.service",
    "com.bothsides.rostersync.processor",
    "com.bothsides.rostersync.provider",
    "com.bothsides.rostersync.controller",
    "com.bothsides.rostersync.scheduler",
    "com.bothsides.rostersync.integration"
})
public class TestSuite {
    // Test suite aggregator class
}
