// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness;

import org.ultralight.tools.harness.impl.ConsoleRunnerImpl;

/**
 * Main entry point for the harness: runs every registered test suite.
 *
 * All implementation classes live in sub-packages so they can be shaded.
 */
public class ConsoleRunner {
  public static void main(String[] args) {
    ConsoleRunnerImpl.main(args);
  }
}
