// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

/**
 * Signals that a check inside a test body did not hold.
 *
 * The message is fully formatted by {@link MessageFormatter} before the failure is raised and is
 * reported as-is; nothing downstream re-renders it.
 */
public class AssertionFailure extends AssertionError {
  private static final long serialVersionUID = 1L;

  public AssertionFailure(String message) {
    super(message);
  }

  public AssertionFailure(String message, Throwable cause) {
    super(message, cause);
  }
}
