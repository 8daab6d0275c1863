package org.groupscholar.planner.domain.aggregate;

import java.util.List;
import java.util.Objects;
import org.groupscholar.planner.domain.record.Action;

/**
 * Top-priority actions sharing a preferred channel.
 *
 * @param channel canonical channel
 * @param count qualifying actions for the channel within the batch pool
 * @param actions sample of at most the configured batch size, in global order
 * @since 0.1.0
 */
public record ChannelBatch(String channel, int count, List<Action> actions) {

  public ChannelBatch {
    Objects.requireNonNull(channel, "channel");
    actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
    if (count < 1 || actions.isEmpty()) {
      throw new IllegalArgumentException("channel batches require at least one action");
    }
  }
}
