/**
 * The immutable plan report and the assembler that bundles stage outputs into it.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.application.report;
