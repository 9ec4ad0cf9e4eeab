// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.ultralight.harness.TestSuite;

/**
 * Finds the {@link TestSuite TestSuites} on a class path.
 *
 * Suites are the providers listed in {@code META-INF/services/org.ultralight.harness.TestSuite}
 * resources, which {@code @AutoService(TestSuite.class)} writes at compile time. Within one
 * services file, suites come back in the order listed; the order across class path entries is
 * whatever the class loader yields.
 */
class SuiteLoader {
  private static final Logger LOG = Logger.getLogger(SuiteLoader.class.getName());

  private final ClassLoader classLoader;

  SuiteLoader(ClassLoader classLoader) {
    this.classLoader = Preconditions.checkNotNull(classLoader);
  }

  /**
   * Instantiates every suite provider.
   *
   * @return the suites, in discovery order.
   * @throws SuiteLoadingException if a listed provider cannot be found, linked or instantiated.
   */
  ImmutableList<TestSuite> load() throws SuiteLoadingException {
    ImmutableList.Builder<TestSuite> suites = ImmutableList.builder();
    try {
      for (TestSuite suite : ServiceLoader.load(TestSuite.class, classLoader)) {
        LOG.fine("Discovered suite " + suite.getClass().getName());
        suites.add(suite);
      }
    } catch (ServiceConfigurationError e) {
      throw new SuiteLoadingException(e.getMessage(), e);
    } catch (LinkageError e) {
      // A provider whose class fails to link or initialize surfaces here rather than as a
      // ServiceConfigurationError.
      throw new SuiteLoadingException("Error linking a suite provider: " + e, e);
    }
    return suites.build();
  }
}
