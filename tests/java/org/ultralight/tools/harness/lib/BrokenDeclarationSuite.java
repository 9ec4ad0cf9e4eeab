// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.lib;

import com.google.auto.service.AutoService;

import org.ultralight.harness.TestCatalog;
import org.ultralight.harness.TestSuite;

/**
 * A suite that blows up while declaring its tests. The harness should report it and carry on.
 */
@AutoService(TestSuite.class)
public class BrokenDeclarationSuite implements TestSuite {
  @Override
  public void declare(TestCatalog tests) {
    tests.test("neverRegistered", check -> CallLog.record("broken.neverRegistered"));
    throw new IllegalStateException("cannot declare");
  }
}
