/**
 * Input validation for CLI arguments and configuration values.
 *
 * <p>Helpers throw {@link java.lang.IllegalArgumentException} with messages suitable for CLI output.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.apkrisk.validation;
