/**
 * CSV record source built on Apache Commons CSV.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.infrastructure.csv;
