package com.skintip.placement.app.service;

import java.time.Duration;

/** Suspends the polling loop between requests. Swapped for a no-op in tests. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
