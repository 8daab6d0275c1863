package org.groupscholar.planner.application.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchAssessment;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * <strong>What:</strong> Computes each record's priority score and, in explain mode, its ordered reasons.
 * <p><strong>Components, in order:</strong> risk score, touch status (no-touch 35, overdue 30, due-soon 12,
 * on-track 0), stale boost, and a fixed weight per high-impact flag. Every component is non-negative and
 * non-decreasing in its input, so the total is monotone in risk score, status severity and flag count.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class PriorityScorer {
  /** Status points; severity order matches the point order. */
  public static final Map<TouchStatus, Double> STATUS_POINTS = statusPoints();

  private final List<ScoreComponent> components;
  private final boolean explain;

  /**
   * Creates a scorer with the standard component table.
   *
   * @param config validated planner configuration
   */
  public PriorityScorer(PlannerConfig config) {
    this(standardComponents(config), config.explain());
  }

  /**
   * Creates a scorer with a custom component table.
   *
   * @param components ordered components
   * @param explain whether reasons are produced
   */
  public PriorityScorer(List<ScoreComponent> components, boolean explain) {
    this.components = List.copyOf(Objects.requireNonNull(components, "components"));
    this.explain = explain;
  }

  /**
   * Scores one classified record.
   *
   * @param record normalized record
   * @param assessment classifier output for the record
   * @return scored record with recommendation and, in explain mode, reasons
   */
  public ScoredRecord score(NormalizedRecord record, TouchAssessment assessment) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(assessment, "assessment");
    double[] points = new double[components.size()];
    double total = 0.0;
    for (int i = 0; i < components.size(); i++) {
      points[i] = components.get(i).points(record, assessment);
      total += points[i];
    }
    List<String> reasons = explain ? explain(record, assessment, points) : List.of();
    String recommendation =
        RecommendationBuilder.build(assessment.riskTier(), record.channelPreference(), assessment.status());
    return new ScoredRecord(record, assessment, round2(total), reasons, recommendation);
  }

  private List<String> explain(NormalizedRecord record, TouchAssessment assessment, double[] points) {
    List<String> reasons = new ArrayList<>();
    for (int i = 0; i < components.size(); i++) {
      if (points[i] != 0.0) {
        components.get(i).reason(record, assessment, points[i]).ifPresent(reasons::add);
      }
    }
    return reasons;
  }

  /**
   * Rounds half-up to two decimals.
   *
   * @param value raw value
   * @return rounded value
   */
  public static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  /**
   * Returns the standard component table for a configuration.
   *
   * @param config validated planner configuration
   * @return risk, status, stale and flag components in reason order
   */
  public static List<ScoreComponent> standardComponents(PlannerConfig config) {
    return List.of(
        new RiskComponent(),
        new StatusComponent(),
        new StaleComponent(config.staleBoost()),
        new FlagComponent(config.highImpactFlags(), config.flagWeight()));
  }

  private static Map<TouchStatus, Double> statusPoints() {
    Map<TouchStatus, Double> map = new EnumMap<>(TouchStatus.class);
    map.put(TouchStatus.NO_TOUCH, 35.0);
    map.put(TouchStatus.OVERDUE, 30.0);
    map.put(TouchStatus.DUE_SOON, 12.0);
    map.put(TouchStatus.ON_TRACK, 0.0);
    return Collections.unmodifiableMap(map);
  }

  private static String format(double points) {
    return points == Math.rint(points)
        ? Long.toString((long) points)
        : String.format(Locale.ROOT, "%.2f", points);
  }

  static final class RiskComponent implements ScoreComponent {
    @Override
    public String name() {
      return "risk";
    }

    @Override
    public double points(NormalizedRecord record, TouchAssessment assessment) {
      return record.riskScore();
    }

    @Override
    public Optional<String> reason(NormalizedRecord record, TouchAssessment assessment, double points) {
      return Optional.of(assessment.riskTier().displayName() + " risk tier (risk score "
          + record.riskScore() + ", +" + format(points) + ")");
    }
  }

  static final class StatusComponent implements ScoreComponent {
    @Override
    public String name() {
      return "status";
    }

    @Override
    public double points(NormalizedRecord record, TouchAssessment assessment) {
      return STATUS_POINTS.get(assessment.status());
    }

    @Override
    public Optional<String> reason(NormalizedRecord record, TouchAssessment assessment, double points) {
      String detail = switch (assessment.status()) {
        case NO_TOUCH -> "No recorded touch";
        case OVERDUE -> "Overdue by " + (-assessment.dueInDays().getAsInt()) + " days on a "
            + assessment.cadenceDays() + "-day cadence";
        case DUE_SOON -> "Due in " + assessment.dueInDays().getAsInt() + " days";
        case ON_TRACK -> "On track";
      };
      return Optional.of(detail + " (+" + format(points) + ")");
    }
  }

  static final class StaleComponent implements ScoreComponent {
    private final double boost;

    StaleComponent(double boost) {
      this.boost = boost;
    }

    @Override
    public String name() {
      return "stale";
    }

    @Override
    public double points(NormalizedRecord record, TouchAssessment assessment) {
      return assessment.stale() ? boost : 0.0;
    }

    @Override
    public Optional<String> reason(NormalizedRecord record, TouchAssessment assessment, double points) {
      return Optional.of("Stale: " + assessment.daysSinceTouch().getAsInt() + " days since last touch (+"
          + format(points) + ")");
    }
  }

  static final class FlagComponent implements ScoreComponent {
    private final Set<String> highImpact;
    private final double weight;

    FlagComponent(Set<String> highImpact, double weight) {
      this.highImpact = Set.copyOf(highImpact);
      this.weight = weight;
    }

    @Override
    public String name() {
      return "flags";
    }

    @Override
    public double points(NormalizedRecord record, TouchAssessment assessment) {
      return weight * matching(record).size();
    }

    @Override
    public Optional<String> reason(NormalizedRecord record, TouchAssessment assessment, double points) {
      return Optional.of("High-impact flags: " + String.join(", ", matching(record)) + " (+" + format(points) + ")");
    }

    private List<String> matching(NormalizedRecord record) {
      List<String> matched = new ArrayList<>();
      for (String flag : record.flags()) {
        if (highImpact.contains(flag)) {
          matched.add(flag);
        }
      }
      return matched;
    }
  }
}
