// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

class SuiteLoadingException extends Exception {
  private static final long serialVersionUID = 1L;

  SuiteLoadingException(String message, Throwable t) {
    super(formatMessage(message), t);
  }

  private static String formatMessage(String message) {
    return String.format("FATAL: Error loading suites: %s", message);
  }
}
