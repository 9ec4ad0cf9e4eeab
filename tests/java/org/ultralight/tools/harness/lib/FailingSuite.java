// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.lib;

import java.io.IOException;

import com.google.auto.service.AutoService;

import org.ultralight.harness.TestCatalog;
import org.ultralight.harness.TestSuite;

/**
 * Discovered and run by the ConsoleRunnerImpl tests. Each test but the last fails in its own way.
 */
@AutoService(TestSuite.class)
public class FailingSuite implements TestSuite {
  @Override
  public void declare(TestCatalog tests) {
    tests.test("equalMismatch", check -> {
      CallLog.record("failing.equalMismatch");
      check.assertEqual("abc", "abd");
    });
    tests.test("stopsAtFirstFailure", check -> {
      check.fail("first");
      CallLog.record("failing.afterFirstFailure");
    });
    tests.test("throwsException", check -> {
      CallLog.record("failing.throwsException");
      throw new IOException("disk gone");
    });
    tests.test("throwsError", check -> {
      CallLog.record("failing.throwsError");
      throw new Error("opaque");
    });
    tests.test("runsAfterFailures", check -> CallLog.record("failing.runsAfterFailures"));
  }
}
