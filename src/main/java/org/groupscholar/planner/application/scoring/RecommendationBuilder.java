package org.groupscholar.planner.application.scoring;

import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * Builds the suggested outreach sentence: channel phrase, urgency, then a tier-specific goal.
 *
 * @since 0.1.0
 */
public final class RecommendationBuilder {
  private RecommendationBuilder() {}

  /**
   * Builds a recommendation such as {@code "Schedule a short call within 48 hours. Confirm support needs and
   * capture blockers."}.
   *
   * @param tier risk tier
   * @param channel canonical channel
   * @param status touch status
   * @return recommendation sentence
   */
  public static String build(RiskTier tier, String channel, TouchStatus status) {
    return channelPhrase(channel) + " " + urgency(status) + ". " + tierPhrase(tier) + ".";
  }

  static String channelPhrase(String channel) {
    if (channel == null) {
      return "Send a check-in";
    }
    return switch (channel) {
      case "sms" -> "Send a brief text check-in";
      case "email" -> "Send a focused email check-in";
      case "call" -> "Schedule a short call";
      default -> "Send a check-in";
    };
  }

  static String urgency(TouchStatus status) {
    return switch (status) {
      case OVERDUE -> "within 48 hours";
      case DUE_SOON -> "within the next week";
      case NO_TOUCH -> "today";
      case ON_TRACK -> "during the next touch window";
    };
  }

  static String tierPhrase(RiskTier tier) {
    return switch (tier) {
      case HIGH -> "Confirm support needs and capture blockers";
      case MEDIUM -> "Reconfirm goals and offer resource links";
      case LOW -> "Share a light encouragement and next milestone";
    };
  }
}
