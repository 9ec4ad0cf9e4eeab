// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import org.ultralight.harness.AssertionFailure;

/**
 * Counts reported failures so a run can print a summary. The count never affects the exit status.
 */
class TallyingResultCollector implements ResultCollector {
  private int failureCount;

  @Override
  public void addFailure(AssertionFailure failure) {
    failureCount++;
  }

  int getFailureCount() {
    return failureCount;
  }
}
