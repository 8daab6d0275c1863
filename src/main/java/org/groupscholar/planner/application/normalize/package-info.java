/**
 * Maps raw rows with heterogeneous headers to canonical records, collecting per-row issues instead of failing
 * the run.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.application.normalize;
