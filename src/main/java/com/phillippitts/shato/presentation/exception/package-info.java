/**
 * Maps application exceptions to HTTP responses. See
 * {@link com.phillippitts.shato.exception} for the hierarchy.
 */
package com.phillippitts.shato.presentation.exception;
