/**
 * Plain-text rendering of plan reports for operators.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.infrastructure.console;
