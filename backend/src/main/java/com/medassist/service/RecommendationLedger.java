package com.medassist.service;

import com.medassist.exception.RecommendationNotFoundException;
import com.medassist.model.Recommendation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only store of recommendation versions, their review states and the
 * transition log of each version chain. Versions are never replaced or removed.
 */
@Component
public class RecommendationLedger {

    private final Map<UUID, Recommendation> versions = new ConcurrentHashMap<>();
    private final Map<UUID, UUID> successors = new ConcurrentHashMap<>();
    private final Map<UUID, PlanReviewState> states = new ConcurrentHashMap<>();
    private final Map<UUID, List<PlanTransition>> transitionsByChain = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException the id is already recorded, or the predecessor already has a successor
     */
    public synchronized void append(Recommendation recommendation, PlanReviewState initialState, PlanTransition registration) {
        UUID id = recommendation.getId();
        if (versions.containsKey(id)) {
            throw new IllegalStateException("Recommendation " + id + " is already recorded");
        }
        UUID predecessor = recommendation.getSupersedes();
        if (predecessor != null) {
            get(predecessor);
            if (successors.containsKey(predecessor)) {
                throw new IllegalStateException("Recommendation " + predecessor + " is already superseded");
            }
            successors.put(predecessor, id);
        }
        versions.put(id, recommendation);
        states.put(id, initialState);
        transitionsByChain.computeIfAbsent(rootOf(id), k -> new CopyOnWriteArrayList<>()).add(registration);
    }

    public Optional<Recommendation> find(UUID id) {
        return Optional.ofNullable(versions.get(id));
    }

    public Recommendation get(UUID id) {
        Recommendation recommendation = versions.get(id);
        if (recommendation == null) {
            throw new RecommendationNotFoundException(id);
        }
        return recommendation;
    }

    public PlanReviewState state(UUID id) {
        get(id);
        return states.get(id);
    }

    synchronized void recordTransition(PlanTransition transition) {
        states.put(transition.recommendationId(), transition.to());
        transitionsByChain.computeIfAbsent(rootOf(transition.recommendationId()), k -> new CopyOnWriteArrayList<>())
            .add(transition);
    }

    public boolean isSuperseded(UUID id) {
        return successors.containsKey(id);
    }

    /**
     * Every version of the chain {@code id} belongs to, oldest first.
     */
    public List<Recommendation> history(UUID id) {
        Recommendation current = get(rootOf(id));
        List<Recommendation> chain = new ArrayList<>();
        chain.add(current);
        UUID next = successors.get(current.getId());
        while (next != null) {
            chain.add(versions.get(next));
            next = successors.get(next);
        }
        return Collections.unmodifiableList(chain);
    }

    /**
     * Newest version of the chain {@code id} belongs to.
     */
    public Recommendation latest(UUID id) {
        List<Recommendation> chain = history(id);
        return chain.get(chain.size() - 1);
    }

    public List<PlanTransition> transitions(UUID id) {
        return List.copyOf(transitionsByChain.getOrDefault(rootOf(id), List.of()));
    }

    public int size() {
        return versions.size();
    }

    private UUID rootOf(UUID id) {
        UUID current = get(id).getId();
        UUID previous = versions.get(current).getSupersedes();
        while (previous != null) {
            current = previous;
            previous = get(current).getSupersedes();
        }
        return current;
    }
}
