/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import java.util.List;
import java.util.stream.Collectors;

import io.osdn.kubernetes.master.network.Violation;

/**
 * Signals that the desired network configuration is inconsistent with the local host
 * or with objects already present in the cluster. Carries every violation found,
 * in the order they were detected.
 */
public class NetworkConflictException extends RuntimeException {

    private final transient List<Violation> violations;

    public NetworkConflictException(List<Violation> violations) {
        super(render(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    private static String render(List<Violation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be empty");
        }
        if (violations.size() == 1) {
            return violations.get(0).detail();
        }
        return violations.stream()
                .map(Violation::detail)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
