// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import org.ultralight.harness.AssertionFailure;
import org.ultralight.harness.Assertions;
import org.ultralight.harness.TestDescriptor;
import org.ultralight.harness.TestIdentity;

/**
 * Runs one declared test inside a failure boundary.
 *
 * <p>Whatever the test body throws is turned into a single report to the {@link ResultCollector}
 * and {@link #run()} returns normally, so one broken test never keeps the rest of the run from
 * executing:
 * <ul>
 *   <li>an {@link AssertionFailure} is reported as-is;</li>
 *   <li>any other {@link Exception} is reported as {@code Caught exception: <e> in <label>};</li>
 *   <li>anything else is reported as {@code Caught unknown exception in <label>}.</li>
 * </ul>
 *
 * <p>Each call to {@link #run()} executes the body again; no outcome is cached between calls.
 */
public final class TestRunner {
  private static final Logger LOG = Logger.getLogger(TestRunner.class.getName());

  private final TestDescriptor descriptor;
  private final ResultCollector collector;

  public TestRunner(TestDescriptor descriptor, ResultCollector collector) {
    this.descriptor = Preconditions.checkNotNull(descriptor);
    this.collector = Preconditions.checkNotNull(collector);
  }

  public TestIdentity getIdentity() {
    return descriptor.identity();
  }

  public void run() {
    TestIdentity identity = descriptor.identity();
    LOG.fine("Running " + identity.label());
    try {
      descriptor.body().run(new Assertions(identity));
    } catch (AssertionFailure failure) {
      collector.addFailure(failure);
    } catch (Exception e) {
      LOG.log(Level.FINE, identity.label() + " threw", e);
      reportError("Caught exception: " + e, identity, e);
    } catch (Throwable t) {
      // Errors are absorbed here too: a test that overflows its stack must not end the run.
      LOG.log(Level.WARNING, identity.label() + " threw an unrecognized error", t);
      reportError("Caught unknown exception", identity, t);
    }
  }

  private void reportError(String description, TestIdentity identity, Throwable cause) {
    collector.addFailure(new AssertionFailure(description + " in " + identity.label(), cause));
  }

  @Override
  public String toString() {
    return "TestRunner{" + descriptor.identity().label() + "}";
  }
}
