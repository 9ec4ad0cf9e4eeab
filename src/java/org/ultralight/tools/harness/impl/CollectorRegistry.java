// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

/**
 * Registers {@link ResultCollector ResultCollectors} for callbacks during a test run session.
 */
interface CollectorRegistry {

  /**
   * Registers the {@code collector} for callbacks.
   *
   * @param collector The collector to register.
   */
  void addCollector(ResultCollector collector);
}
