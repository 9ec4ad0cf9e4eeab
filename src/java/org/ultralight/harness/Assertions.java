// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * The checks available to a test body.
 *
 * An instance is bound to the identity of the test being run. Each check either returns normally
 * or throws exactly one {@link AssertionFailure} whose message carries the caller's file and line
 * and the test's label. Checks have no other side effects, so the first failing check ends the
 * test body and the checks after it never run.
 */
public final class Assertions {
  private final TestIdentity identity;

  public Assertions(TestIdentity identity) {
    this.identity = Preconditions.checkNotNull(identity);
  }

  public TestIdentity getIdentity() {
    return identity;
  }

  /**
   * Checks that two values are equal.
   *
   * Two {@link CharSequence CharSequences} are compared by content, arrays element by element and
   * everything else with {@link Object#equals(Object)}.
   */
  public void assertEqual(Object expected, Object actual) {
    if (areEqual(expected, actual)) {
      return;
    }
    CallSite site = CallSite.capture();
    throw new AssertionFailure(MessageFormatter.equalsMessage(site.getFileName(),
        site.getLineNumber(), identity.label(), printable(expected), printable(actual)));
  }

  public void assertEqual(long expected, long actual) {
    if (expected != actual) {
      raiseNotEqual(expected, actual);
    }
  }

  public void assertEqual(double expected, double actual) {
    if (Double.compare(expected, actual) != 0) {
      raiseNotEqual(expected, actual);
    }
  }

  public void assertEqual(char expected, char actual) {
    if (expected != actual) {
      raiseNotEqual(expected, actual);
    }
  }

  public void assertEqual(boolean expected, boolean actual) {
    if (expected != actual) {
      raiseNotEqual(expected, actual);
    }
  }

  /**
   * Checks that {@code observed} has the value {@code sense}.
   *
   * @param observed The value the checked expression produced.
   * @param sense The value the expression is required to have.
   * @param expression The text reported for the checked expression.
   */
  public void assertBool(boolean observed, boolean sense, String expression) {
    if (observed == sense) {
      return;
    }
    CallSite site = CallSite.capture();
    throw new AssertionFailure(MessageFormatter.boolMessage(site.getFileName(),
        site.getLineNumber(), identity.label(), expression, observed));
  }

  public void assertTrue(boolean condition) {
    assertBool(condition, true, String.valueOf(condition));
  }

  public void assertTrue(String expression, boolean condition) {
    assertBool(condition, true, expression);
  }

  public void assertFalse(boolean condition) {
    assertBool(condition, false, String.valueOf(condition));
  }

  public void assertFalse(String expression, boolean condition) {
    assertBool(condition, false, expression);
  }

  public void assertNull(Object value) {
    assertBool(value == null, true, "<" + printable(value) + "> == null");
  }

  public void assertNull(String expression, Object value) {
    assertBool(value == null, true, expression + " == null");
  }

  public void assertNotNull(Object value) {
    assertBool(value != null, true, "<" + printable(value) + "> != null");
  }

  public void assertNotNull(String expression, Object value) {
    assertBool(value != null, true, expression + " != null");
  }

  /**
   * Fails the running test unconditionally.
   *
   * @param message Free form text appended after {@code error: }.
   */
  public void fail(String message) {
    CallSite site = CallSite.capture();
    throw new AssertionFailure(MessageFormatter.failMessage(site.getFileName(),
        site.getLineNumber(), identity.label(), message));
  }

  private void raiseNotEqual(Object expected, Object actual) {
    CallSite site = CallSite.capture();
    throw new AssertionFailure(MessageFormatter.equalsMessage(site.getFileName(),
        site.getLineNumber(), identity.label(), expected, actual));
  }

  private static boolean areEqual(Object expected, Object actual) {
    if (expected instanceof CharSequence && actual instanceof CharSequence) {
      return expected.toString().equals(actual.toString());
    }
    // Wrapping lets deepEquals pick the right comparison for primitive and nested arrays.
    return Arrays.deepEquals(new Object[] {expected}, new Object[] {actual});
  }

  private static Object printable(Object value) {
    if (value != null && value.getClass().isArray()) {
      String wrapped = Arrays.deepToString(new Object[] {value});
      return wrapped.substring(1, wrapped.length() - 1);
    }
    return value;
  }
}
