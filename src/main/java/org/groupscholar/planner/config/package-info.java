/**
 * Planner configuration: validated run settings, YAML loading, precedence merging and database settings.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.config;
