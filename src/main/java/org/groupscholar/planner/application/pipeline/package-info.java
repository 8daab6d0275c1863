/**
 * Planner engine and the use case that connects it to the record source, outputs and metrics.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.application.pipeline;
