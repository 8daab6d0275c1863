/**
 * Command-line entry points: the {@code planner} dispatcher with its {@code plan} and {@code seed} commands.
 *
 * @since 0.1.0
 */
package org.groupscholar.planner.api;
