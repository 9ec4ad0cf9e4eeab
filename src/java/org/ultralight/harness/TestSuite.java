// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

/**
 * A named group of tests.
 *
 * <p>Implementations are found with {@link java.util.ServiceLoader}. The easiest way to make a
 * suite visible is to annotate it with {@code @AutoService(TestSuite.class)}, which writes the
 * provider entry at compile time:
 *
 * <pre>
 * {@literal @}AutoService(TestSuite.class)
 * public class StackSuite implements TestSuite {
 *   {@literal @}Override public void declare(TestCatalog tests) {
 *     tests.test("pushThenPop", check -&gt; {
 *       Deque&lt;String&gt; stack = new ArrayDeque&lt;&gt;();
 *       stack.push("a");
 *       check.assertEqual("a", stack.pop());
 *     });
 *   }
 * }
 * </pre>
 *
 * <p>Implementations need a public no-argument constructor. Suites share no fixture state with
 * the runner; anything a suite keeps in fields is its own business.
 */
public interface TestSuite {

  /**
   * Returns the name reported for this suite's tests. Defaults to the simple class name.
   */
  default String name() {
    return getClass().getSimpleName();
  }

  /**
   * Declares this suite's tests. Tests run in the order they are declared here.
   *
   * @param tests The catalog to declare tests into.
   */
  void declare(TestCatalog tests);
}
