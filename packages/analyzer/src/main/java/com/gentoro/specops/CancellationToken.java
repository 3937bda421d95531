package com.gentoro.specops;

import com.gentoro.specops.exception.AnalysisCancelledException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for long analyses. The analyzer polls the token between files; work
 * already started on a file always completes.
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** @throws AnalysisCancelledException once {@link #cancel()} has been called */
  public void throwIfCancelled(String stage, Object position) {
    if (cancelled.get()) {
      throw new AnalysisCancelledException(
          "Analysis cancelled during " + stage,
          Map.of("stage", stage, "position", String.valueOf(position)));
    }
  }
}
