// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.args4j;

/**
 * Thrown from an args4j option setter when the value parses but is not acceptable.
 *
 * <p>args4j re-throws unchecked exceptions raised by {@code @Option} annotated setters unwrapped,
 * so callers of {@link org.kohsuke.args4j.CmdLineParser#parseArgument(String...)} catch this next
 * to {@link org.kohsuke.args4j.CmdLineException}.
 */
public class InvalidCmdLineArgumentException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String optionName;
  private final Object optionValue;

  public InvalidCmdLineArgumentException(String optionName, Object optionValue, String message) {
    super(String.format("Invalid value for %s: %s (%s)", optionName, optionValue, message));
    this.optionName = optionName;
    this.optionValue = optionValue;
  }

  public String getOptionName() {
    return optionName;
  }

  public Object getOptionValue() {
    return optionValue;
  }
}
