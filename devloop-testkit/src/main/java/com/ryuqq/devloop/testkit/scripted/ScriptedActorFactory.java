package com.ryuqq.devloop.testkit.scripted;

import com.ryuqq.devloop.core.actor.Actor;
import com.ryuqq.devloop.core.actor.ActorFactory;
import com.ryuqq.devloop.core.actor.ActorSpec;
import com.ryuqq.devloop.core.model.ActorName;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ActorFactory that hands out pre-registered actors by name.
 *
 * <p>Records the specialist each actor was created for, so tests can verify specialist selection.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedActorFactory implements ActorFactory {

    private final Map<ActorName, Actor> actors = new ConcurrentHashMap<>();
    private final List<String> specialists = new CopyOnWriteArrayList<>();

    public ScriptedActorFactory register(Actor actor) {
        actors.put(actor.name(), actor);
        return this;
    }

    @Override
    public Actor create(ActorSpec spec, String specialist) {
        Actor actor = actors.get(spec.name());
        if (actor == null) {
            throw new IllegalArgumentException("No scripted actor registered for " + spec.name());
        }
        specialists.add(specialist);
        return actor;
    }

    /**
     * Specialists passed to {@link #create}, one per spawned actor.
     *
     * @return specialists in creation order
     */
    public List<String> specialists() {
        return List.copyOf(specialists);
    }
}
