package org.groupscholar.planner.domain.record;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Canonical outreach record produced by the normalizer.
 * <p><strong>Why:</strong> Gives the scoring engine one typed shape regardless of which header aliases the
 * source used.</p>
 * <p><strong>Thread-safety:</strong> Immutable; flags are copied into an unmodifiable insertion-ordered set.</p>
 *
 * @param rowNumber source row number for traceability
 * @param id identifier, unique within a run
 * @param name display name
 * @param cohort cohort label; may be empty
 * @param owner responsible staff member when assigned
 * @param channelPreference canonical channel ({@code sms}, {@code call}, {@code email}, ... or {@code unknown})
 * @param lastTouchDate last recorded contact when known
 * @param riskScore integer risk score in {@code [0, 100]}
 * @param flags lower-case flags
 * @since 0.1.0
 */
public record NormalizedRecord(
    int rowNumber,
    String id,
    String name,
    String cohort,
    Optional<String> owner,
    String channelPreference,
    Optional<LocalDate> lastTouchDate,
    int riskScore,
    Set<String> flags) {

  /** Owner label used when a record has no assigned owner. */
  public static final String UNASSIGNED = "Unassigned";

  public NormalizedRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    cohort = cohort == null ? "" : cohort;
    owner = owner == null ? Optional.empty() : owner;
    channelPreference = channelPreference == null ? "unknown" : channelPreference;
    lastTouchDate = lastTouchDate == null ? Optional.empty() : lastTouchDate;
    if (riskScore < 0 || riskScore > 100) {
      throw new IllegalArgumentException("riskScore must be between 0 and 100 (was " + riskScore + ")");
    }
    flags = flags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(flags));
  }

  /**
   * Returns the owner or {@link #UNASSIGNED} when none is set.
   *
   * @return owner bucket label
   */
  public String ownerOrUnassigned() {
    return owner.orElse(UNASSIGNED);
  }

  /**
   * Returns the cohort or {@link #UNASSIGNED} when blank.
   *
   * @return cohort bucket label
   */
  public String cohortOrUnassigned() {
    return cohort.isBlank() ? UNASSIGNED : cohort;
  }
}
