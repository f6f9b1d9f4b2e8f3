/**
 * Review findings, blocking policies and verdicts.
 *
 * <p>Every issue a reviewer raises is recorded in the
 * {@link com.ryuqq.devloop.core.finding.FindingLedger} and must end up fixed, deferred with an
 * accepted justification, or escalated. Nothing is silently dropped.</p>
 *
 * <h2>Deferral Justifications</h2>
 * <p>{@link com.ryuqq.devloop.core.finding.DeferralJustifications} maps free text onto a fixed
 * list of valid and invalid categories. Unrecognized text counts as invalid.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.finding;
