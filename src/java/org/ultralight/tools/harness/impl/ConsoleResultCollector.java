// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.io.PrintStream;

import com.google.common.base.Preconditions;

import org.ultralight.harness.AssertionFailure;

/**
 * A collector that prints each failure's message as one line.
 */
class ConsoleResultCollector implements ResultCollector {
  private final PrintStream out;

  ConsoleResultCollector(PrintStream out) {
    this.out = Preconditions.checkNotNull(out);
  }

  @Override
  public void addFailure(AssertionFailure failure) {
    out.println(failure.getMessage());
    out.flush();
  }
}
