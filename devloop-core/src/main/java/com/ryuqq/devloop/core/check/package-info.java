/**
 * Layered automated validation.
 *
 * <p>A {@link com.ryuqq.devloop.core.check.CheckRunner} runs
 * {@link com.ryuqq.devloop.core.check.Check} layers cheapest first, stops at the first failure
 * and reports the remaining layers as skipped. Artifact-triggered layers (schema migrations,
 * interface definitions) only take part when the change touches such files, as decided by
 * {@link com.ryuqq.devloop.core.check.ArtifactClassifier}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.devloop.core.check;
