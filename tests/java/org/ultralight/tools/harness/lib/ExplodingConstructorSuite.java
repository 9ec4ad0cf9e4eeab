// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.lib;

import org.ultralight.harness.TestCatalog;
import org.ultralight.harness.TestSuite;

/**
 * Not registered with AutoService on purpose: tests list it in a hand-written services file to
 * check how a provider that cannot be instantiated is reported.
 */
public class ExplodingConstructorSuite implements TestSuite {
  public ExplodingConstructorSuite() {
    throw new IllegalStateException("no suite for you");
  }

  @Override
  public void declare(TestCatalog tests) {
  }
}
