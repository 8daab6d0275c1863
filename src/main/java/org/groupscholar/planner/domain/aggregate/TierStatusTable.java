package org.groupscholar.planner.domain.aggregate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * <strong>What:</strong> Cross-tabulation of touch status by risk tier.
 * <p><strong>Role:</strong> Immutable aggregate; rows follow {@link RiskTier} order, columns {@link TouchStatus} order.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class TierStatusTable {
  private final Map<RiskTier, Map<TouchStatus, Integer>> cells;

  /**
   * Creates a table from a fully populated cell map.
   *
   * @param cells tier to status to count; missing cells read as zero
   */
  public TierStatusTable(Map<RiskTier, Map<TouchStatus, Integer>> cells) {
    Objects.requireNonNull(cells, "cells");
    Map<RiskTier, Map<TouchStatus, Integer>> copy = new EnumMap<>(RiskTier.class);
    for (RiskTier tier : RiskTier.values()) {
      Map<TouchStatus, Integer> row = new EnumMap<>(TouchStatus.class);
      Map<TouchStatus, Integer> source = cells.getOrDefault(tier, Map.of());
      for (TouchStatus status : TouchStatus.values()) {
        int count = source.getOrDefault(status, 0);
        if (count < 0) {
          throw new IllegalArgumentException("cell counts must be non-negative");
        }
        row.put(status, count);
      }
      copy.put(tier, Collections.unmodifiableMap(row));
    }
    this.cells = Collections.unmodifiableMap(copy);
  }

  public int count(RiskTier tier, TouchStatus status) {
    return cells.get(tier).get(status);
  }

  public int rowTotal(RiskTier tier) {
    return cells.get(tier).values().stream().mapToInt(Integer::intValue).sum();
  }

  public int columnTotal(TouchStatus status) {
    int sum = 0;
    for (RiskTier tier : RiskTier.values()) {
      sum += count(tier, status);
    }
    return sum;
  }

  public int total() {
    int sum = 0;
    for (RiskTier tier : RiskTier.values()) {
      sum += rowTotal(tier);
    }
    return sum;
  }

  /**
   * Returns the unmodifiable tier to status to count view.
   *
   * @return cell map in tier/status declaration order
   */
  public Map<RiskTier, Map<TouchStatus, Integer>> cells() {
    return cells;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof TierStatusTable that && cells.equals(that.cells);
  }

  @Override
  public int hashCode() {
    return cells.hashCode();
  }

  @Override
  public String toString() {
    return "TierStatusTable" + cells;
  }
}
