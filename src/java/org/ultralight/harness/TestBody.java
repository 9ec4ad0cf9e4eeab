// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

/**
 * The code of a single test case.
 */
@FunctionalInterface
public interface TestBody {

  /**
   * Executes the test once.
   *
   * @param check The checks bound to this test's identity.
   * @throws Exception Anything the test code raises; the runner reports it and moves on.
   */
  void run(Assertions check) throws Exception;
}
