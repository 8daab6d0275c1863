package org.groupscholar.planner.config;

import java.util.Objects;
import org.groupscholar.planner.domain.record.RiskTier;

/**
 * Target number of days between touches for each risk tier.
 *
 * <p>Implementations must return a value of at least one day for every tier.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CadencePolicy {

  /** Default cadence: high every 7 days, medium every 21, low every 45. */
  CadencePolicy STANDARD = of(7, 21, 45);

  /**
   * Returns the cadence for {@code tier}.
   *
   * @param tier risk tier
   * @return days between touches, {@code >= 1}
   */
  int cadenceDays(RiskTier tier);

  /**
   * Creates a fixed per-tier cadence.
   *
   * @param high high-tier days
   * @param medium medium-tier days
   * @param low low-tier days
   * @return immutable cadence policy
   * @throws IllegalArgumentException when any value is below one
   */
  static CadencePolicy of(int high, int medium, int low) {
    return new TierCadence(high, medium, low);
  }

  /**
   * Fixed cadence per tier.
   *
   * @param high high-tier days
   * @param medium medium-tier days
   * @param low low-tier days
   */
  record TierCadence(int high, int medium, int low) implements CadencePolicy {
    public TierCadence {
      requirePositive("cadence.high", high);
      requirePositive("cadence.medium", medium);
      requirePositive("cadence.low", low);
    }

    @Override
    public int cadenceDays(RiskTier tier) {
      return switch (Objects.requireNonNull(tier, "tier")) {
        case HIGH -> high;
        case MEDIUM -> medium;
        case LOW -> low;
      };
    }

    private static void requirePositive(String name, int days) {
      if (days < 1) {
        throw new IllegalArgumentException(name + " must be >= 1 (was " + days + ")");
      }
    }
  }
}
