// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The ordered set of tests a run executes.
 *
 * Runners are only ever appended; a registry never forgets one. Tests run in registration order,
 * one at a time, on the calling thread.
 */
public final class TestRegistry {
  private final List<TestRunner> runners = Lists.newArrayList();

  /**
   * Appends a runner. Must not be called while {@link #runAll()} is in progress.
   *
   * @param runner The runner to append.
   */
  public void register(TestRunner runner) {
    runners.add(Preconditions.checkNotNull(runner));
  }

  /**
   * Runs every registered test in registration order. Failures are reported by each runner and
   * never stop the run.
   */
  public void runAll() {
    for (TestRunner runner : runners) {
      runner.run();
    }
  }

  public int size() {
    return runners.size();
  }

  public boolean isEmpty() {
    return runners.isEmpty();
  }

  public ImmutableList<TestRunner> getRunners() {
    return ImmutableList.copyOf(runners);
  }
}
