/**
 * Configuration loading and composition root wiring for APKRISK CLIs.
 * <p><strong>Role:</strong> Application bootstrap layer; merges defaults, YAML and CLI settings and selects
 * adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.apkrisk.config;
