// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.util.List;

import com.google.common.collect.Lists;

import org.junit.Before;
import org.junit.Test;
import org.ultralight.harness.AssertionFailure;
import org.ultralight.harness.TestBody;
import org.ultralight.harness.TestDescriptor;
import org.ultralight.harness.TestIdentity;

import static org.hamcrest.CoreMatchers.endsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestRegistryTest {
  private final List<String> executed = Lists.newArrayList();
  private final List<String> reports = Lists.newArrayList();
  private final ResultCollector collector = failure -> reports.add(failure.getMessage());

  private TestRegistry registry;

  @Before
  public void setUp() {
    registry = new TestRegistry();
  }

  private void register(String name, TestBody body) {
    TestBody recording = check -> {
      executed.add(name);
      body.run(check);
    };
    registry.register(new TestRunner(
        TestDescriptor.create(TestIdentity.of("RegistrySuite", name), recording), collector));
  }

  @Test
  public void testStartsEmpty() {
    assertTrue(registry.isEmpty());
    assertEquals(0, registry.size());
    registry.runAll();
    assertTrue(executed.isEmpty());
    assertTrue(reports.isEmpty());
  }

  @Test
  public void testOneFailureDoesNotStopTheRun() {
    register("A", check -> check.assertTrue(true));
    register("B", check -> check.assertEqual(1, 2));
    register("C", check -> check.assertFalse(false));

    assertFalse(registry.isEmpty());
    assertEquals(3, registry.size());

    registry.runAll();

    assertThat(executed, contains("A", "B", "C"));
    assertEquals(1, reports.size());
    assertThat(reports.get(0),
        endsWith("[test <B> in suite <RegistrySuite>] expected: <1> but was: <2>"));
  }

  @Test
  public void testUnknownErrorStillContinues() {
    register("A", check -> {
      throw new OutOfMemoryError("simulated");
    });
    register("B", check -> { });

    registry.runAll();

    assertThat(executed, contains("A", "B"));
    assertThat(reports,
        contains("Caught unknown exception in [test <A> in suite <RegistrySuite>]"));
  }

  @Test
  public void testRunAllTwiceRunsEverythingTwice() {
    register("A", check -> { });
    register("B", check -> check.fail("nope"));
    register("C", check -> {
      throw new IllegalArgumentException("bad");
    });

    registry.runAll();
    registry.runAll();

    assertThat(executed, contains("A", "B", "C", "A", "B", "C"));
    assertEquals(4, reports.size());
    assertEquals(reports.subList(0, 2), reports.subList(2, 4));
  }

  @Test
  public void testRegistrationOrderIsKept() {
    register("third", check -> { });
    register("first", check -> { });
    register("second", check -> { });

    List<String> names = Lists.newArrayList();
    for (TestRunner runner : registry.getRunners()) {
      names.add(runner.getIdentity().testName());
    }
    assertThat(names, contains("third", "first", "second"));
  }

  @Test(expected = NullPointerException.class)
  public void testNullRunnerIsRejected() {
    registry.register(null);
  }

  @Test
  public void testReportsAreForwardedAsRaised() {
    AssertionFailure failure = new AssertionFailure("verbatim");
    register("A", check -> {
      throw failure;
    });
    registry.runAll();
    assertThat(reports, contains("verbatim"));
  }

  @Test
  public void testTallyCountsEveryReport() {
    TallyingResultCollector tally = new TallyingResultCollector();
    ForwardingResultCollector forwarding = new ForwardingResultCollector();
    forwarding.addCollector(tally);
    forwarding.addCollector(collector);
    TestRegistry tallied = new TestRegistry();
    tallied.register(new TestRunner(TestDescriptor.create(
        TestIdentity.of("RegistrySuite", "A"), check -> { }), forwarding));
    tallied.register(new TestRunner(TestDescriptor.create(
        TestIdentity.of("RegistrySuite", "B"), check -> check.fail("nope")), forwarding));
    tallied.register(new TestRunner(TestDescriptor.create(
        TestIdentity.of("RegistrySuite", "C"), check -> {
          throw new IllegalStateException("broken");
        }), forwarding));

    tallied.runAll();

    assertEquals(2, tally.getFailureCount());
    assertEquals(2, reports.size());
  }
}
