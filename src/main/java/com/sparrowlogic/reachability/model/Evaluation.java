package com.sparrowlogic.reachability.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of one reachability evaluation: a success message, a failure message, or neither,
 * plus the distinct near-miss hints gathered on the way.
 *
 * <p>Only a present success means the destination is reachable. A missing failure does not
 * mean the opposite, because ingress checking never records one.
 */
public class Evaluation {

    private String success;
    private String failure;
    private final Set<String> context = new LinkedHashSet<>();

    public void markSuccess(String message) {
        this.success = message;
    }

    public void markFailure(String message) {
        this.failure = message;
    }

    public void addContext(String message) {
        context.add(message);
    }

    public Optional<String> success() {
        return Optional.ofNullable(success);
    }

    public Optional<String> failure() {
        return Optional.ofNullable(failure);
    }

    public Set<String> context() {
        return Collections.unmodifiableSet(context);
    }

    public boolean isReachable() {
        return success != null;
    }

    @Override
    public String toString() {
        return "Evaluation[success=" + success + ", failure=" + failure + ", context=" + context + "]";
    }
}
