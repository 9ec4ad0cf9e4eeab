// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * The source location of the statement that called into {@link Assertions}.
 */
final class CallSite {
  static final String UNKNOWN_FILE = "Unknown Source";

  private final String fileName;
  private final int lineNumber;

  @VisibleForTesting
  CallSite(String fileName, int lineNumber) {
    this.fileName = Preconditions.checkNotNull(fileName);
    this.lineNumber = lineNumber;
  }

  /**
   * Finds the first stack frame outside of the assertion machinery.
   *
   * @return the caller's location, or an unknown location if the VM recorded no usable frame.
   */
  static CallSite capture() {
    for (StackTraceElement frame : new Throwable().getStackTrace()) {
      if (!isHarnessFrame(frame)) {
        return of(frame);
      }
    }
    return new CallSite(UNKNOWN_FILE, 0);
  }

  @VisibleForTesting
  static CallSite of(StackTraceElement frame) {
    String fileName = frame.getFileName();
    // Negative line numbers mean the class was compiled without line tables or the frame is native.
    int lineNumber = Math.max(frame.getLineNumber(), 0);
    return new CallSite(fileName == null ? UNKNOWN_FILE : fileName, lineNumber);
  }

  private static boolean isHarnessFrame(StackTraceElement frame) {
    String className = frame.getClassName();
    return className.equals(CallSite.class.getName())
        || className.equals(Assertions.class.getName());
  }

  String getFileName() {
    return fileName;
  }

  int getLineNumber() {
    return lineNumber;
  }

  @Override
  public String toString() {
    return fileName + ":" + lineNumber;
  }
}
