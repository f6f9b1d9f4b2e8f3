package com.ryuqq.devloop.testkit.scripted;

import com.ryuqq.devloop.core.actor.Actor;
import com.ryuqq.devloop.core.actor.ActorContext;
import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.contract.MessageKinds;
import com.ryuqq.devloop.core.finding.Severity;
import com.ryuqq.devloop.core.finding.Verdict;
import com.ryuqq.devloop.core.model.ActorName;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reviewer actor driven by a script.
 *
 * <p>On the first review request the reviewer raises its scripted findings, then waits until
 * every finding has a fix or a deferral decision before sending its verdict. Later review
 * requests and re-verdict requests are answered with a verdict right away.</p>
 *
 * <p>Without findings the stated verdict is CLEAR, with findings RESOLVED, unless a verdict is
 * forced with {@link #states(Verdict)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedReviewer implements Actor {

    /**
     * Finding the reviewer raises on its first review.
     *
     * @param description finding description
     * @param severity severity
     */
    public record PlannedFinding(String description, Severity severity) {
    }

    private final ActorName name;
    private final List<PlannedFinding> findings = new CopyOnWriteArrayList<>();
    private final List<String> receivedKinds = new CopyOnWriteArrayList<>();
    private final AtomicBoolean raised = new AtomicBoolean();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicInteger verdictsSent = new AtomicInteger();

    private volatile boolean acceptsDeferrals = true;
    private volatile boolean waitsForResolution = true;
    private volatile boolean confirmsPlan = true;
    private volatile Verdict forcedVerdict;

    public ScriptedReviewer(ActorName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
    }

    public ScriptedReviewer raises(String description, Severity severity) {
        findings.add(new PlannedFinding(description, severity));
        return this;
    }

    public ScriptedReviewer rejectsDeferrals() {
        this.acceptsDeferrals = false;
        return this;
    }

    /**
     * Sends the verdict right after raising findings, without waiting for fixes.
     *
     * @return this
     */
    public ScriptedReviewer verdictImmediately() {
        this.waitsForResolution = false;
        return this;
    }

    public ScriptedReviewer silentOnPlan() {
        this.confirmsPlan = false;
        return this;
    }

    public ScriptedReviewer states(Verdict verdict) {
        this.forcedVerdict = verdict;
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
            case MessageKinds.PLAN_REVIEW_REQUESTED -> {
                if (confirmsPlan) {
                    context.tellOrchestrator(MessageKinds.PLAN_CONFIRMED, "Plan looks good", Map.of());
                }
            }
            case MessageKinds.REVIEW_REQUESTED -> onReviewRequested(context);
            case MessageKinds.FIX_SUBMITTED -> resolveOne(context);
            case MessageKinds.DEFERRAL_REVIEW_REQUESTED -> {
                String kind = acceptsDeferrals ? MessageKinds.DEFERRAL_ACCEPTED : MessageKinds.DEFERRAL_REJECTED;
                context.tellOrchestrator(kind, acceptsDeferrals ? "Accepted as technical debt" : "Fix it now",
                    Map.of(MessageKinds.ATTR_FINDING_ID, message.requireAttribute(MessageKinds.ATTR_FINDING_ID)));
                resolveOne(context);
            }
            case MessageKinds.REVERDICT_REQUESTED -> sendVerdict(context);
            case MessageKinds.REFLECTION_REQUESTED ->
                context.tellOrchestrator(MessageKinds.REFLECTION_DONE, "No new patterns", Map.of());
            default -> {
                // task.assigned, finding.opened, session.closed
            }
        }
    }

    private void onReviewRequested(ActorContext context) {
        if (findings.isEmpty() || !raised.compareAndSet(false, true)) {
            sendVerdict(context);
            return;
        }
        outstanding.set(findings.size());
        for (PlannedFinding finding : findings) {
            context.tellOrchestrator(MessageKinds.FINDING_RAISED, finding.description(),
                Map.of(MessageKinds.ATTR_SEVERITY, finding.severity().name()));
        }
        if (!waitsForResolution) {
            sendVerdict(context);
        }
    }

    private void resolveOne(ActorContext context) {
        if (outstanding.decrementAndGet() == 0 && waitsForResolution) {
            sendVerdict(context);
        }
    }

    private void sendVerdict(ActorContext context) {
        Verdict verdict = forcedVerdict != null
            ? forcedVerdict
            : raised.get() ? Verdict.RESOLVED : Verdict.CLEAR;
        verdictsSent.incrementAndGet();
        context.tellOrchestrator(MessageKinds.VERDICT, "Verdict " + verdict,
            Map.of(MessageKinds.ATTR_VERDICT, verdict.name()));
    }

    public int verdictsSent() {
        return verdictsSent.get();
    }

    public List<String> receivedKinds() {
        return List.copyOf(receivedKinds);
    }
}
