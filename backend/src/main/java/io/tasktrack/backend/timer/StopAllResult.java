package io.tasktrack.backend.timer;

import java.util.List;
import java.util.UUID;

public record StopAllResult(int stoppedCount, List<UUID> stoppedIds) {

  public static StopAllResult of(List<UUID> stoppedIds) {
    return new StopAllResult(stoppedIds.size(), List.copyOf(stoppedIds));
  }
}
