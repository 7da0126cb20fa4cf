/**
 * Immutable values exchanged between the router and its collaborators.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.shato.domain.CorrelationContext} - per-request tracing token</li>
 *   <li>{@link com.phillippitts.shato.domain.CommandProposal} - the model's chat reply or command guess</li>
 *   <li>{@link com.phillippitts.shato.domain.ValidationOutcome} - schema verdict on a proposal</li>
 *   <li>{@link com.phillippitts.shato.domain.CommandExecutionResult} - validator response after simulation</li>
 * </ul>
 *
 * <p>The closed command set itself lives in {@code domain.command}.
 */
package com.phillippitts.shato.domain;
