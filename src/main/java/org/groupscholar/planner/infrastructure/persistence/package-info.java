/**
 * Relational run store: one transaction per report, plain JDBC.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.infrastructure.persistence;
