package com.ryuqq.devloop.testkit.scripted;

import com.ryuqq.devloop.adapter.inmemory.workspace.InMemoryWorkspace;
import com.ryuqq.devloop.core.actor.Actor;
import com.ryuqq.devloop.core.actor.ActorContext;
import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.contract.MessageKinds;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.statemachine.Phase;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Implementer actor driven by a script.
 *
 * <p>Each implementation pass applies the next scripted round of file edits to an
 * {@link InMemoryWorkspace} and reports {@code implementation.ready}. Findings are fixed by
 * default; a finding whose description contains a registered fragment gets a deferral proposal
 * with the registered justification instead.</p>
 *
 * <p><strong>Protocol:</strong></p>
 * <ul>
 *   <li>task.assigned (PLANNING) → plan.drafted</li>
 *   <li>task.assigned (IMPLEMENTATION), plan.approved, validation.failed → edits + implementation.ready</li>
 *   <li>finding.opened → finding.fixed or deferral.proposed</li>
 *   <li>review.changes_requested → optional fixes of deferred findings + implementation.ready</li>
 *   <li>reflection.requested → reflection.done</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedImplementer implements Actor {

    private final ActorName name;
    private final InMemoryWorkspace workspace;
    private final List<Map<String, String>> rounds = new CopyOnWriteArrayList<>();
    private final Map<String, String> deferrals = new ConcurrentHashMap<>();
    private final Set<String> deferredFindings = ConcurrentHashMap.newKeySet();
    private final List<String> receivedKinds = new CopyOnWriteArrayList<>();
    private final AtomicInteger implementations = new AtomicInteger();

    private volatile boolean unresponsive;
    private volatile boolean fixesDeferredOnRouteBack;
    private volatile long fixDelayMs;

    public ScriptedImplementer(ActorName name, InMemoryWorkspace workspace) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        this.name = name;
        this.workspace = workspace;
    }

    /**
     * Adds a round of edits applied on the next implementation pass.
     *
     * <p>When all rounds are used, later passes re-apply the last round.</p>
     *
     * @param edits path → content
     * @return this
     */
    public ScriptedImplementer withRound(Map<String, String> edits) {
        rounds.add(Map.copyOf(edits));
        return this;
    }

    /**
     * Proposes a deferral for findings whose description contains the fragment.
     *
     * @param descriptionFragment fragment of the finding description
     * @param justification deferral justification sent to the reviewer
     * @return this
     */
    public ScriptedImplementer defers(String descriptionFragment, String justification) {
        deferrals.put(descriptionFragment, justification);
        return this;
    }

    /**
     * Never reports implementation.ready. The actor still consumes messages and stays IDLE.
     *
     * @return this
     */
    public ScriptedImplementer unresponsive() {
        this.unresponsive = true;
        return this;
    }

    public ScriptedImplementer fixesDeferredOnRouteBack() {
        this.fixesDeferredOnRouteBack = true;
        return this;
    }

    /**
     * Delays each fix, so that other reviewers answer before the revision changes.
     *
     * @param millis delay before a fix is reported
     * @return this
     */
    public ScriptedImplementer withFixDelay(long millis) {
        this.fixDelayMs = millis;
        return this;
    }

    @Override
    public ActorName name() {
        return name;
    }

    @Override
    public void onMessage(Message message, ActorContext context) {
        receivedKinds.add(message.kind());
        switch (message.kind()) {
            case MessageKinds.TASK_ASSIGNED -> {
                if (Phase.PLANNING.name().equals(message.attribute(MessageKinds.ATTR_PHASE))) {
                    context.tellOrchestrator(MessageKinds.PLAN_DRAFTED, "Plan for: " + message.body(), Map.of());
                } else {
                    implement(context);
                }
            }
            case MessageKinds.PLAN_APPROVED, MessageKinds.VALIDATION_FAILED -> implement(context);
            case MessageKinds.FINDING_OPENED -> onFindingOpened(message, context);
            case MessageKinds.CHANGES_REQUESTED -> {
                if (fixesDeferredOnRouteBack) {
                    for (String findingId : deferredFindings) {
                        workspace.write("fixes/" + findingId + ".txt", "fixed after route-back");
                        context.tellOrchestrator(MessageKinds.FINDING_FIXED, "Fixed after route-back",
                            Map.of(MessageKinds.ATTR_FINDING_ID, findingId));
                    }
                    deferredFindings.clear();
                }
                implement(context);
            }
            case MessageKinds.REFLECTION_REQUESTED ->
                context.tellOrchestrator(MessageKinds.REFLECTION_DONE, "Nothing to add", Map.of());
            default -> {
                // deferral.decided, session.closed
            }
        }
    }

    private void implement(ActorContext context) {
        if (unresponsive) {
            return;
        }
        int pass = implementations.incrementAndGet();
        if (!rounds.isEmpty()) {
            Map<String, String> edits = rounds.get(Math.min(pass, rounds.size()) - 1);
            edits.forEach(workspace::write);
        }
        context.tellOrchestrator(MessageKinds.IMPLEMENTATION_READY, "Implementation pass " + pass, Map.of());
    }

    private void onFindingOpened(Message message, ActorContext context) {
        String findingId = message.requireAttribute(MessageKinds.ATTR_FINDING_ID);
        String justification = deferrals.entrySet().stream()
            .filter(entry -> message.body().contains(entry.getKey()))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse(null);

        if (justification != null) {
            deferredFindings.add(findingId);
            context.tellOrchestrator(MessageKinds.DEFERRAL_PROPOSED, justification,
                Map.of(MessageKinds.ATTR_FINDING_ID, findingId));
            return;
        }
        if (fixDelayMs > 0) {
            try {
                Thread.sleep(fixDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        workspace.write("fixes/" + findingId + ".txt", "fix for: " + message.body());
        context.tellOrchestrator(MessageKinds.FINDING_FIXED, "Fixed: " + message.body(),
            Map.of(MessageKinds.ATTR_FINDING_ID, findingId));
    }

    public int implementations() {
        return implementations.get();
    }

    public List<String> receivedKinds() {
        return List.copyOf(receivedKinds);
    }
}
