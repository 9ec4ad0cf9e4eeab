// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import org.ultralight.harness.AssertionFailure;

/**
 * Receives the failures a test run produces.
 *
 * Collectors only observe: nothing they do changes which tests run or in what order.
 */
public interface ResultCollector {

  /**
   * Reports one failure.
   *
   * @param failure The failure, its message already fully formatted.
   */
  void addFailure(AssertionFailure failure);
}
