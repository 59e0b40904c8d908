/**
 * Preflight validation of a sequence before a run is allowed.
 * <ul>
 *   <li>{@link com.nightshade.preflight.PreflightValidator} – runs composable {@link com.nightshade.preflight.ValidationCheck}s</li>
 *   <li>{@code check} – built-in Structure, Targets, Exposures, Equipment, Settings and Timing categories</li>
 *   <li>{@link com.nightshade.preflight.ValidationResult} – ordered issues with severity counts</li>
 * </ul>
 */
package com.nightshade.preflight;
