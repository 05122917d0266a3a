package com.flamingo.ai.stripsequencer.service.sequencing;

import com.flamingo.ai.stripsequencer.service.distance.DistanceOracle;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Per-run wrapper counting the calls made to a delegate oracle. */
final class CountingDistanceOracle implements DistanceOracle {

  private final DistanceOracle delegate;
  private final AtomicInteger calls = new AtomicInteger();

  CountingDistanceOracle(DistanceOracle delegate) {
    this.delegate = delegate;
  }

  @Override
  public double distance(List<String> from, List<String> to) {
    calls.incrementAndGet();
    return delegate.distance(from, to);
  }

  int calls() {
    return calls.get();
  }
}
