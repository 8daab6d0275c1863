/**
 * Read-only aggregation stages over the scored record set: tier/status table, horizon and forecast, owner
 * workload, channel batches, escalations and portfolio summaries.
 *
 * <p>Every stage takes the scored records (or ranked actions) and returns new immutable values; none mutates its
 * input.</p>
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.application.aggregate;
