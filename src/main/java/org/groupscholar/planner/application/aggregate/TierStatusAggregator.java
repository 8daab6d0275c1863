package org.groupscholar.planner.application.aggregate;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.groupscholar.planner.domain.aggregate.PlannerInvariantException;
import org.groupscholar.planner.domain.aggregate.TierStatusTable;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * Cross-tabulates touch status by risk tier.
 *
 * @since 0.1.0
 */
public final class TierStatusAggregator {

  /**
   * Builds the table.
   *
   * @param scored scored records
   * @return table whose cells sum to {@code scored.size()}
   * @throws PlannerInvariantException when the cells do not add up
   */
  public TierStatusTable aggregate(List<ScoredRecord> scored) {
    Objects.requireNonNull(scored, "scored");
    Map<RiskTier, Map<TouchStatus, Integer>> cells = new EnumMap<>(RiskTier.class);
    for (RiskTier tier : RiskTier.values()) {
      cells.put(tier, new EnumMap<>(TouchStatus.class));
    }
    for (ScoredRecord record : scored) {
      cells.get(record.tier()).merge(record.status(), 1, Integer::sum);
    }
    TierStatusTable table = new TierStatusTable(cells);
    PlannerInvariantException.requireEqual("tier/status table total", scored.size(), table.total());
    return table;
  }
}
