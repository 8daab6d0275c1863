package org.groupscholar.planner.infrastructure.json;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.application.report.RunMetadata;
import org.groupscholar.planner.domain.aggregate.AlertReason;
import org.groupscholar.planner.domain.aggregate.CadenceAdherence;
import org.groupscholar.planner.domain.aggregate.ChannelBatch;
import org.groupscholar.planner.domain.aggregate.CohortHotspot;
import org.groupscholar.planner.domain.aggregate.ForecastSeries;
import org.groupscholar.planner.domain.aggregate.HorizonBucket;
import org.groupscholar.planner.domain.aggregate.HorizonBuckets;
import org.groupscholar.planner.domain.aggregate.OwnerAlert;
import org.groupscholar.planner.domain.aggregate.OwnerCapacity;
import org.groupscholar.planner.domain.aggregate.OwnerHorizon;
import org.groupscholar.planner.domain.aggregate.OwnerLoadSummary;
import org.groupscholar.planner.domain.aggregate.OwnerQueue;
import org.groupscholar.planner.domain.aggregate.PortfolioSummary;
import org.groupscholar.planner.domain.aggregate.TierStatusTable;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.RecordIssue;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchAssessment;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * <strong>What:</strong> Serializes a {@link PlanReport} to JSON with Jackson's streaming {@link JsonGenerator}.
 * <p><strong>Shape:</strong> One top-level object; enums are written by their lower-case keys, dates as ISO-8601
 * strings and absent optionals as {@code null}. Queue and batch entries carry a compact action reference; the
 * {@code actions} and {@code escalations} arrays carry full rows.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the factory is shared, generators are per call.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportWriter {
  /** Version of the JSON layout; bump when fields are renamed or removed. */
  public static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();
  private final boolean pretty;

  /**
   * Creates a writer.
   *
   * @param pretty whether to indent output
   */
  public JsonReportWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Renders the report to a UTF-8 string.
   *
   * @param report report to render
   * @return JSON text
   */
  public String toJson(PlanReport report) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      write(report, out);
    } catch (IOException ex) {
      throw new IllegalStateException("in-memory JSON rendering failed", ex);
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  /**
   * Renders a flat string map, such as a configuration snapshot, as one JSON object.
   *
   * @param values keys and values in output order
   * @return JSON text
   */
  public String toJson(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      for (Map.Entry<String, String> entry : values.entrySet()) {
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("in-memory JSON rendering failed", ex);
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  /**
   * Streams the report to {@code out}; the stream is flushed but not closed.
   *
   * @param report report to render
   * @param out destination
   * @throws IOException if the stream fails
   */
  public void write(PlanReport report, OutputStream out) throws IOException {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      writeMetadata(gen, report.metadata());
      writeSummary(gen, report.summary());
      writeTierStatus(gen, report.tierStatus());
      gen.writeFieldName("horizon");
      writeHorizon(gen, report.horizon());
      writeForecast(gen, report.forecast());
      writeCounts(gen, "channelMix", report.channelMix());
      writeCounts(gen, "flagFrequency", report.flagFrequency());
      writeCohorts(gen, report.cohortHotspots());
      writeAdherence(gen, report.cadenceAdherence());
      gen.writeArrayFieldStart("cadenceGuidance");
      for (String line : report.cadenceGuidance()) {
        gen.writeString(line);
      }
      gen.writeEndArray();
      writeActions(gen, "actions", report.actions());
      writeOwnerLoads(gen, report.ownerLoads());
      writeOwnerAlerts(gen, report.ownerAlerts());
      writeOwnerHorizons(gen, report.ownerHorizons());
      writeOwnerCapacities(gen, report.ownerCapacities());
      writeOwnerQueues(gen, report.ownerQueues());
      writeChannelBatches(gen, report.channelBatches());
      writeActions(gen, "escalations", report.escalations());
      writeIssues(gen, report.issues());
      gen.writeEndObject();
      gen.flush();
    }
  }

  private static void writeMetadata(JsonGenerator gen, RunMetadata metadata) throws IOException {
    gen.writeObjectFieldStart("metadata");
    gen.writeStringField("source", metadata.source());
    gen.writeStringField("today", metadata.today().toString());
    gen.writeStringField("generatedAt", metadata.generatedAt().toString());
    gen.writeNumberField("rowsRead", metadata.rowsRead());
    gen.writeNumberField("scored", metadata.scoredCount());
    gen.writeNumberField("rejected", metadata.rejectedCount());
    gen.writeObjectFieldStart("config");
    for (Map.Entry<String, String> entry : metadata.config().entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeSummary(JsonGenerator gen, PortfolioSummary summary) throws IOException {
    gen.writeObjectFieldStart("summary");
    gen.writeNumberField("total", summary.total());
    gen.writeObjectFieldStart("byStatus");
    for (TouchStatus status : TouchStatus.values()) {
      gen.writeNumberField(status.key(), summary.byStatus().get(status));
    }
    gen.writeEndObject();
    gen.writeObjectFieldStart("byTier");
    for (RiskTier tier : RiskTier.values()) {
      gen.writeNumberField(tier.label(), summary.byTier().get(tier));
    }
    gen.writeEndObject();
    gen.writeNumberField("stale", summary.stale());
    gen.writeObjectFieldStart("staleByTier");
    for (RiskTier tier : RiskTier.values()) {
      gen.writeNumberField(tier.label(), summary.staleByTier().get(tier));
    }
    gen.writeEndObject();
    gen.writeNumberField("futureDated", summary.futureDated());
    gen.writeNumberField("rejected", summary.rejected());
    gen.writeEndObject();
  }

  private static void writeTierStatus(JsonGenerator gen, TierStatusTable table) throws IOException {
    gen.writeObjectFieldStart("tierStatus");
    for (RiskTier tier : RiskTier.values()) {
      gen.writeObjectFieldStart(tier.label());
      for (TouchStatus status : TouchStatus.values()) {
        gen.writeNumberField(status.key(), table.count(tier, status));
      }
      gen.writeNumberField("total", table.rowTotal(tier));
      gen.writeEndObject();
    }
    gen.writeNumberField("total", table.total());
    gen.writeEndObject();
  }

  private static void writeHorizon(JsonGenerator gen, HorizonBuckets horizon) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("overdue", horizon.overdue());
    for (HorizonBucket bucket : HorizonBucket.values()) {
      gen.writeNumberField(bucket.key(), horizon.count(bucket));
    }
    gen.writeNumberField("no_due_date", horizon.noDueDate());
    gen.writeNumberField("total", horizon.total());
    gen.writeEndObject();
  }

  private static void writeForecast(JsonGenerator gen, ForecastSeries forecast) throws IOException {
    gen.writeObjectFieldStart("forecast");
    gen.writeStringField("startDate", forecast.startDate().toString());
    gen.writeNumberField("windowDays", forecast.windowDays());
    gen.writeBooleanField("includesOverdue", forecast.includesOverdue());
    gen.writeNumberField("inWindow", forecast.inWindow());
    gen.writeNumberField("overdue", forecast.overdue());
    gen.writeNumberField("beyondWindow", forecast.beyondWindow());
    gen.writeNumberField("noDueDate", forecast.noDueDate());
    gen.writeNumberField("total", forecast.total());
    gen.writeArrayFieldStart("daily");
    for (ForecastSeries.Day day : forecast.daily()) {
      gen.writeStartObject();
      gen.writeNumberField("offset", day.offset());
      gen.writeStringField("date", day.date().toString());
      gen.writeNumberField("count", day.count());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeCounts(JsonGenerator gen, String field, Map<String, Integer> counts) throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static void writeCohorts(JsonGenerator gen, List<CohortHotspot> hotspots) throws IOException {
    gen.writeArrayFieldStart("cohortHotspots");
    for (CohortHotspot hotspot : hotspots) {
      gen.writeStartObject();
      gen.writeStringField("cohort", hotspot.cohort());
      gen.writeNumberField("total", hotspot.total());
      gen.writeNumberField("overdue", hotspot.overdue());
      gen.writeNumberField("dueSoon", hotspot.dueSoon());
      gen.writeNumberField("noTouch", hotspot.noTouch());
      gen.writeNumberField("highRisk", hotspot.highRisk());
      gen.writeNumberField("mediumRisk", hotspot.mediumRisk());
      gen.writeNumberField("lowRisk", hotspot.lowRisk());
      gen.writeNumberField("avgPriority", hotspot.avgPriority());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeAdherence(JsonGenerator gen, CadenceAdherence adherence) throws IOException {
    gen.writeObjectFieldStart("cadenceAdherence");
    gen.writeFieldName("overall");
    writeAdherenceRow(gen, adherence.overall());
    gen.writeObjectFieldStart("byTier");
    for (RiskTier tier : RiskTier.values()) {
      gen.writeFieldName(tier.label());
      writeAdherenceRow(gen, adherence.byTier().get(tier));
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeAdherenceRow(JsonGenerator gen, CadenceAdherence.Row row) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("total", row.total());
    gen.writeNumberField("compliant", row.compliant());
    gen.writeNumberField("overdue", row.overdue());
    gen.writeNumberField("noTouch", row.noTouch());
    gen.writeNumberField("complianceRate", row.complianceRate());
    gen.writeEndObject();
  }

  private static void writeActions(JsonGenerator gen, String field, List<Action> actions) throws IOException {
    gen.writeArrayFieldStart(field);
    for (Action action : actions) {
      writeAction(gen, action);
    }
    gen.writeEndArray();
  }

  private static void writeAction(JsonGenerator gen, Action action) throws IOException {
    ScoredRecord scored = action.scored();
    NormalizedRecord record = scored.record();
    TouchAssessment assessment = scored.assessment();
    gen.writeStartObject();
    gen.writeNumberField("rank", action.rank());
    gen.writeStringField("id", record.id());
    gen.writeStringField("name", record.name());
    gen.writeStringField("cohort", record.cohort());
    writeOptionalString(gen, "owner", record.owner());
    gen.writeStringField("channel", record.channelPreference());
    gen.writeNumberField("riskScore", record.riskScore());
    gen.writeStringField("riskTier", assessment.riskTier().label());
    gen.writeStringField("status", assessment.status().key());
    writeOptionalString(gen, "lastTouchDate", record.lastTouchDate().map(Object::toString));
    writeOptionalInt(gen, "daysSinceTouch", assessment.daysSinceTouch());
    writeOptionalString(gen, "nextDueDate", assessment.nextDueDate().map(Object::toString));
    writeOptionalInt(gen, "dueInDays", assessment.dueInDays());
    gen.writeNumberField("cadenceDays", assessment.cadenceDays());
    gen.writeBooleanField("stale", assessment.stale());
    gen.writeBooleanField("futureTouchDate", assessment.futureTouchDate());
    gen.writeNumberField("priorityScore", scored.priorityScore());
    gen.writeStringField("recommendedAction", scored.recommendedAction());
    gen.writeArrayFieldStart("flags");
    for (String flag : record.flags()) {
      gen.writeString(flag);
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("reasons");
    for (String reason : scored.priorityReasons()) {
      gen.writeString(reason);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeActionRefs(JsonGenerator gen, List<Action> actions) throws IOException {
    gen.writeArrayFieldStart("actions");
    for (Action action : actions) {
      gen.writeStartObject();
      gen.writeNumberField("rank", action.rank());
      gen.writeStringField("id", action.id());
      gen.writeStringField("name", action.scored().record().name());
      gen.writeNumberField("priorityScore", action.priorityScore());
      gen.writeStringField("status", action.scored().status().key());
      gen.writeStringField("recommendedAction", action.scored().recommendedAction());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeOwnerLoads(JsonGenerator gen, List<OwnerLoadSummary> loads) throws IOException {
    gen.writeArrayFieldStart("ownerLoads");
    for (OwnerLoadSummary load : loads) {
      gen.writeStartObject();
      gen.writeStringField("owner", load.owner());
      gen.writeNumberField("total", load.total());
      gen.writeNumberField("overdue", load.overdue());
      gen.writeNumberField("dueSoon", load.dueSoon());
      gen.writeNumberField("onTrack", load.onTrack());
      gen.writeNumberField("noTouch", load.noTouch());
      gen.writeNumberField("stale", load.stale());
      gen.writeNumberField("highRisk", load.highRisk());
      gen.writeNumberField("avgPriority", load.avgPriority());
      gen.writeNumberField("dueWithinWindow", load.dueWithinWindow());
      gen.writeNumberField("capacity", load.capacity());
      gen.writeNumberField("gap", load.gap());
      gen.writeNumberField("capacityRatio", load.capacityRatio());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeOwnerAlerts(JsonGenerator gen, List<OwnerAlert> alerts) throws IOException {
    gen.writeArrayFieldStart("ownerAlerts");
    for (OwnerAlert alert : alerts) {
      gen.writeStartObject();
      gen.writeStringField("owner", alert.owner());
      gen.writeArrayFieldStart("reasons");
      for (AlertReason reason : alert.reasons()) {
        gen.writeString(reason.key());
      }
      gen.writeEndArray();
      gen.writeNumberField("overdue", alert.overdue());
      gen.writeNumberField("noTouch", alert.noTouch());
      gen.writeNumberField("total", alert.total());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeOwnerHorizons(JsonGenerator gen, List<OwnerHorizon> horizons) throws IOException {
    gen.writeArrayFieldStart("ownerHorizons");
    for (OwnerHorizon horizon : horizons) {
      gen.writeStartObject();
      gen.writeStringField("owner", horizon.owner());
      gen.writeNumberField("total", horizon.total());
      gen.writeNumberField("avgPriority", horizon.avgPriority());
      gen.writeFieldName("buckets");
      writeHorizon(gen, horizon.buckets());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeOwnerCapacities(JsonGenerator gen, List<OwnerCapacity> capacities) throws IOException {
    gen.writeArrayFieldStart("ownerCapacity");
    for (OwnerCapacity capacity : capacities) {
      gen.writeStartObject();
      gen.writeStringField("owner", capacity.owner());
      gen.writeNumberField("dueWithinWindow", capacity.dueWithinWindow());
      gen.writeNumberField("overdue", capacity.overdue());
      gen.writeNumberField("capacity", capacity.capacity());
      gen.writeNumberField("gap", capacity.gap());
      gen.writeNumberField("utilization", capacity.utilization());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeOwnerQueues(JsonGenerator gen, List<OwnerQueue> queues) throws IOException {
    gen.writeArrayFieldStart("ownerQueues");
    for (OwnerQueue queue : queues) {
      gen.writeStartObject();
      gen.writeStringField("owner", queue.owner());
      gen.writeNumberField("total", queue.total());
      writeActionRefs(gen, queue.actions());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeChannelBatches(JsonGenerator gen, List<ChannelBatch> batches) throws IOException {
    gen.writeArrayFieldStart("channelBatches");
    for (ChannelBatch batch : batches) {
      gen.writeStartObject();
      gen.writeStringField("channel", batch.channel());
      gen.writeNumberField("count", batch.count());
      writeActionRefs(gen, batch.actions());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeIssues(JsonGenerator gen, List<RecordIssue> issues) throws IOException {
    gen.writeArrayFieldStart("issues");
    for (RecordIssue issue : issues) {
      gen.writeStartObject();
      gen.writeNumberField("row", issue.rowNumber());
      writeOptionalString(gen, "recordId", issue.recordId());
      gen.writeStringField("kind", issue.kind().name());
      gen.writeStringField("field", issue.field());
      gen.writeStringField("message", issue.message());
      gen.writeBooleanField("excluded", issue.excluded());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeOptionalString(JsonGenerator gen, String field, Optional<String> value)
      throws IOException {
    if (value.isPresent()) {
      gen.writeStringField(field, value.get());
    } else {
      gen.writeNullField(field);
    }
  }

  private static void writeOptionalInt(JsonGenerator gen, String field, OptionalInt value) throws IOException {
    if (value.isPresent()) {
      gen.writeNumberField(field, value.getAsInt());
    } else {
      gen.writeNullField(field);
    }
  }
}
