package ca.gc.cra.opencoffee.testutil;

import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Throttle that records requested pauses instead of sleeping. */
public final class RecordingThrottle implements ThrottlePort {
  private final List<Duration> pauses = new ArrayList<>();

  @Override
  public void pause(Duration delay) {
    pauses.add(delay);
  }

  public List<Duration> pauses() {
    return pauses;
  }
}
