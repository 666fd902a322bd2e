/**
 * Logging utilities: verbosity control for the CLI and payload hygiene for instrumentation events.
 *
 * @since 0.1.0
 */
package ca.gc.cra.apkrisk.logging;
