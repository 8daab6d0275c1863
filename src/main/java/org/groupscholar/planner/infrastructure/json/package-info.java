/**
 * JSON rendering of plan reports with Jackson's streaming generator.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.infrastructure.json;
