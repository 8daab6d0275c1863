/**
 * Clock adapters.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.infrastructure.time;
