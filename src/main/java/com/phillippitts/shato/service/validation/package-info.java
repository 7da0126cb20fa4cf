/**
 * Schema validation of proposed robot commands.
 *
 * <p>{@link com.phillippitts.shato.service.validation.CommandValidator} returns its verdict as a
 * {@link com.phillippitts.shato.domain.ValidationOutcome} value; violations never surface as
 * exceptions, so callers branch on data rather than catch blocks.
 */
package com.phillippitts.shato.service.validation;
