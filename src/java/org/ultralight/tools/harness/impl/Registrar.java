// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import org.ultralight.harness.AssertionFailure;
import org.ultralight.harness.TestCatalog;
import org.ultralight.harness.TestDescriptor;
import org.ultralight.harness.TestSuite;

/**
 * Turns declared tests into registry entries.
 *
 * Every declared test gets exactly one {@link TestRunner}, registered in the order the suites are
 * handed over and, within a suite, in declaration order.
 */
public final class Registrar {
  private static final Logger LOG = Logger.getLogger(Registrar.class.getName());

  private final TestRegistry registry;
  private final ResultCollector collector;

  public Registrar(TestRegistry registry, ResultCollector collector) {
    this.registry = Preconditions.checkNotNull(registry);
    this.collector = Preconditions.checkNotNull(collector);
  }

  public void register(TestDescriptor descriptor) {
    registry.register(new TestRunner(descriptor, collector));
  }

  /**
   * Registers every test the suite declares.
   *
   * If the suite fails while declaring, the failure is reported against the suite and none of its
   * tests are registered.
   *
   * @param suite The suite to register.
   * @return the number of tests registered.
   */
  public int registerSuite(TestSuite suite) {
    String suiteName = suite.name();
    TestCatalog catalog;
    try {
      catalog = new TestCatalog(suiteName);
      suite.declare(catalog);
    } catch (RuntimeException e) {
      LOG.log(Level.FINE, "Suite " + suiteName + " failed to declare its tests", e);
      collector.addFailure(new AssertionFailure(
          "Caught exception: " + e + " in " + suiteLabel(suiteName), e));
      return 0;
    }
    for (TestDescriptor descriptor : catalog.getDescriptors()) {
      register(descriptor);
    }
    LOG.fine(String.format("Registered %d tests from suite %s",
        catalog.getDescriptors().size(), suiteName));
    return catalog.getDescriptors().size();
  }

  /**
   * Registers all tests of all {@code suites}, suite by suite.
   *
   * @return the number of tests registered.
   */
  public int registerAll(Iterable<? extends TestSuite> suites) {
    int registered = 0;
    for (TestSuite suite : suites) {
      registered += registerSuite(suite);
    }
    return registered;
  }

  static String suiteLabel(String suiteName) {
    return "[suite <" + suiteName + ">]";
  }
}
