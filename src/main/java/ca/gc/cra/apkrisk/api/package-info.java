/**
 * CLI entry points for APKRISK assessments.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * telemetry, invokes the assessment pipeline, and maps outcomes to {@link ca.gc.cra.apkrisk.api.ExitCode}.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded; static extraction spawns its own workers.</p>
 */
package ca.gc.cra.apkrisk.api;
