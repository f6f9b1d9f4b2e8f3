/**
 * Specialist selection for the implementer.
 *
 * <p>{@link com.ryuqq.devloop.core.classify.SpecialistClassifier} is a pure keyword table:
 * the most specific match wins and ties are reported as ambiguous, in which case the caller has
 * to supply an explicit override.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.classify;
