/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.shato.exception.ShatoException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.shato.exception.UpstreamUnavailableException} - Generation or
 *       validation collaborator failed or timed out (HTTP 503)</li>
 *   <li>{@link com.phillippitts.shato.exception.InvalidRequestException} - Inbound request
 *       lacks required input (HTTP 400)</li>
 *   <li>{@link com.phillippitts.shato.exception.RequestCancelledException} - Request thread
 *       was interrupted mid-pipeline</li>
 * </ul>
 *
 * <p>Schema violations are not exceptions: the validator returns them as
 * {@link com.phillippitts.shato.domain.ValidationOutcome.Invalid} values.
 *
 * @see com.phillippitts.shato.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.shato.exception;
