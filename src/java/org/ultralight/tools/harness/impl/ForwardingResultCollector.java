// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.ultralight.harness.AssertionFailure;

/**
 * A collector that forwards every failure to a sequence of registered collectors, in
 * registration order.
 */
class ForwardingResultCollector implements ResultCollector, CollectorRegistry {
  private final List<ResultCollector> collectors = Lists.newArrayList();

  @Override
  public void addCollector(ResultCollector collector) {
    collectors.add(Preconditions.checkNotNull(collector));
  }

  @Override
  public void addFailure(AssertionFailure failure) {
    for (ResultCollector collector : collectors) {
      collector.addFailure(failure);
    }
  }
}
