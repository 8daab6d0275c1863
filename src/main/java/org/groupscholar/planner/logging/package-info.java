/**
 * Logging helpers: runtime level control and credential redaction.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.logging;
