/**
 * Per-record classification and scoring: tier and status rule tables, additive priority components with their
 * explanations, the global action order and recommended outreach phrases.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.application.scoring;
