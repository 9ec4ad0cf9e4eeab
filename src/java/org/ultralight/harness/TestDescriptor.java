// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.harness;

import com.google.auto.value.AutoValue;

/**
 * A declared test: its identity together with the body to run.
 */
@AutoValue
public abstract class TestDescriptor {

  public static TestDescriptor create(TestIdentity identity, TestBody body) {
    return new AutoValue_TestDescriptor(identity, body);
  }

  public abstract TestIdentity identity();

  public abstract TestBody body();
}
