/**
 * Adapters implementing the planner ports: CSV intake, console and JSON reports, the JDBC run store, metrics
 * and time.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.infrastructure;
