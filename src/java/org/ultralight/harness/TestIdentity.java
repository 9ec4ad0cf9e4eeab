// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

import com.google.auto.value.AutoValue;

/**
 * Names one test case within its suite. Used only for reporting, never for lookup.
 */
@AutoValue
public abstract class TestIdentity {

  public static TestIdentity of(String suiteName, String testName) {
    return new AutoValue_TestIdentity(suiteName, testName);
  }

  public abstract String suiteName();

  public abstract String testName();

  /**
   * Returns the label failure reports use to name this test.
   *
   * @return {@code [test <testName> in suite <suiteName>]}
   */
  public String label() {
    return "[test <" + testName() + "> in suite <" + suiteName() + ">]";
  }

  @Override
  public String toString() {
    return label();
  }
}
