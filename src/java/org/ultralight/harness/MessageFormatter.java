// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

/**
 * Renders the human readable text of assertion failures.
 *
 * Every message starts with a location of the form {@code <file>:<line>: <label> }, trailing space
 * included, so tools that scan for {@code file:line:} prefixes can jump to the failing check.
 */
public final class MessageFormatter {

  private MessageFormatter() {
    // utility
  }

  /**
   * Returns the location prefix shared by all failure messages.
   *
   * @param fileName The source file holding the failed check.
   * @param lineNumber The line of the failed check.
   * @param testLabel The label of the test the check belongs to.
   * @return {@code <file>:<line>: <label> } with a single trailing space.
   */
  public static String location(String fileName, long lineNumber, String testLabel) {
    return fileName + ":" + lineNumber + ": " + testLabel + " ";
  }

  public static String failMessage(String fileName, long lineNumber, String testLabel,
      String message) {
    return location(fileName, lineNumber, testLabel) + "error: " + message;
  }

  public static String equalsMessage(String fileName, long lineNumber, String testLabel,
      Object expected, Object actual) {
    return location(fileName, lineNumber, testLabel)
        + "expected: <" + expected + "> but was: <" + actual + ">";
  }

  /**
   * Renders a failed boolean check.
   *
   * The message names the value the expression should have had, which is the negation of the
   * observed one.
   *
   * @param expression The source text (or rendering) of the checked expression.
   * @param observed The value the expression actually had.
   */
  public static String boolMessage(String fileName, long lineNumber, String testLabel,
      String expression, boolean observed) {
    return location(fileName, lineNumber, testLabel)
        + "expected: " + expression + " to be " + conditionText(!observed);
  }

  private static String conditionText(boolean value) {
    return value ? "true" : "false";
  }
}
