// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Collects the tests a {@link TestSuite} declares, in declaration order.
 */
public final class TestCatalog {
  private final String suiteName;
  private final List<TestDescriptor> descriptors = Lists.newArrayList();
  private final Set<String> testNames = Sets.newHashSet();

  public TestCatalog(String suiteName) {
    Preconditions.checkArgument(suiteName != null && !suiteName.isEmpty(),
        "A suite needs a name");
    this.suiteName = suiteName;
  }

  /**
   * Declares one test of this suite.
   *
   * @param testName The test's name, unique within the suite.
   * @param body The code to run for the test.
   * @return this catalog, for chaining declarations.
   * @throws IllegalArgumentException if the suite already declares a test called {@code testName}.
   */
  public TestCatalog test(String testName, TestBody body) {
    Preconditions.checkArgument(testName != null && !testName.isEmpty(),
        "Tests in suite %s need a name", suiteName);
    Preconditions.checkNotNull(body);
    Preconditions.checkArgument(testNames.add(testName),
        "Test %s is declared more than once in suite %s", testName, suiteName);
    descriptors.add(TestDescriptor.create(TestIdentity.of(suiteName, testName), body));
    return this;
  }

  public String getSuiteName() {
    return suiteName;
  }

  public ImmutableList<TestDescriptor> getDescriptors() {
    return ImmutableList.copyOf(descriptors);
  }
}
