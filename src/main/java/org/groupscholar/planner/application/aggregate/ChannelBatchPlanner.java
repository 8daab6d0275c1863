package org.groupscholar.planner.application.aggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.aggregate.ChannelBatch;
import org.groupscholar.planner.domain.record.Action;

/**
 * Groups the global top actions by preferred channel so staff can work one channel at a time.
 *
 * <p>Only the first {@code channelBatchPool} actions are considered. Each channel keeps up to
 * {@code channelBatchSize} actions in global order and reports its full count within the pool. Channels are
 * ordered by count descending, then name, and cut to {@code channelBatchLimit}.</p>
 *
 * @since 0.1.0
 */
public final class ChannelBatchPlanner {
  private static final Comparator<ChannelBatch> BATCH_ORDER =
      Comparator.comparingInt(ChannelBatch::count).reversed().thenComparing(ChannelBatch::channel);

  private final int pool;
  private final int limit;
  private final int size;

  /**
   * Creates a planner from the run configuration.
   *
   * @param config validated planner configuration
   */
  public ChannelBatchPlanner(PlannerConfig config) {
    Objects.requireNonNull(config, "config");
    this.pool = config.channelBatchPool();
    this.limit = config.channelBatchLimit();
    this.size = config.channelBatchSize();
  }

  /**
   * Builds channel batches.
   *
   * @param actions ranked actions in global order
   * @return batches, never containing an empty channel
   */
  public List<ChannelBatch> plan(List<Action> actions) {
    Objects.requireNonNull(actions, "actions");
    if (size == 0) {
      return List.of();
    }
    Map<String, List<Action>> grouped = new LinkedHashMap<>();
    for (Action action : actions.subList(0, Math.min(pool, actions.size()))) {
      grouped.computeIfAbsent(action.scored().record().channelPreference(), key -> new ArrayList<>()).add(action);
    }
    List<ChannelBatch> batches = new ArrayList<>();
    grouped.forEach((channel, members) ->
        batches.add(new ChannelBatch(channel, members.size(), members.subList(0, Math.min(size, members.size())))));
    batches.sort(BATCH_ORDER);
    return List.copyOf(batches.subList(0, Math.min(limit, batches.size())));
  }
}
