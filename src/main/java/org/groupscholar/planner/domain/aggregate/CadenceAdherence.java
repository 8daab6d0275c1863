package org.groupscholar.planner.domain.aggregate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.groupscholar.planner.domain.record.RiskTier;

/**
 * Share of records kept within cadence, overall and per tier.
 *
 * @param byTier per-tier rows, every tier present
 * @param overall row across all tiers
 * @since 0.1.0
 */
public record CadenceAdherence(Map<RiskTier, Row> byTier, Row overall) {

  public CadenceAdherence {
    Objects.requireNonNull(byTier, "byTier");
    Objects.requireNonNull(overall, "overall");
    Map<RiskTier, Row> copy = new EnumMap<>(RiskTier.class);
    for (RiskTier tier : RiskTier.values()) {
      copy.put(tier, byTier.getOrDefault(tier, Row.EMPTY));
    }
    byTier = Collections.unmodifiableMap(copy);
  }

  /**
   * Adherence counts for one slice.
   *
   * @param total records in the slice
   * @param compliant on-track plus due-soon records
   * @param overdue overdue records
   * @param noTouch never-touched records
   * @param complianceRate {@code compliant / total}, two decimals; zero for an empty slice
   */
  public record Row(int total, int compliant, int overdue, int noTouch, double complianceRate) {
    static final Row EMPTY = new Row(0, 0, 0, 0, 0.0);
  }
}
