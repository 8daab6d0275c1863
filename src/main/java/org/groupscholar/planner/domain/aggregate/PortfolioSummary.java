package org.groupscholar.planner.domain.aggregate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * Run-wide totals by status and tier plus data-quality counters.
 *
 * @param total scored records
 * @param byStatus status to count, every status present
 * @param byTier tier to count, every tier present
 * @param stale stale records
 * @param staleByTier tier to stale count, every tier present
 * @param futureDated records whose last touch lay after today
 * @param rejected rows excluded by normalization
 * @since 0.1.0
 */
public record PortfolioSummary(
    int total,
    Map<TouchStatus, Integer> byStatus,
    Map<RiskTier, Integer> byTier,
    int stale,
    Map<RiskTier, Integer> staleByTier,
    int futureDated,
    int rejected) {

  public PortfolioSummary {
    byStatus = complete(TouchStatus.class, TouchStatus.values(), byStatus);
    byTier = complete(RiskTier.class, RiskTier.values(), byTier);
    staleByTier = complete(RiskTier.class, RiskTier.values(), staleByTier);
  }

  private static <K extends Enum<K>> Map<K, Integer> complete(Class<K> type, K[] keys, Map<K, Integer> source) {
    Objects.requireNonNull(source, type.getSimpleName());
    Map<K, Integer> copy = new EnumMap<>(type);
    for (K key : keys) {
      copy.put(key, source.getOrDefault(key, 0));
    }
    return Collections.unmodifiableMap(copy);
  }
}
