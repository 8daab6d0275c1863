/**
 * Ports through which the planner use case reaches records, outputs, metrics and time.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.application.port;
