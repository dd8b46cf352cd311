/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.util.Objects;

/**
 * A single inconsistency between a candidate network configuration and the state of the host or cluster.
 *
 * @param kind the kind of inconsistency
 * @param detail human-readable description naming the offending object
 */
public record Violation(Kind kind, String detail) {

    public enum Kind {
        UNPARSABLE_NODE_SUBNET,
        NODE_SUBNET_OUTSIDE_CLUSTER_NETWORK,
        SERVICE_OUTSIDE_SERVICE_NETWORK,
        HOST_NETWORK_CONFLICT
    }

    public Violation {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(detail, "detail cannot be null");
    }

    @Override
    public String toString() {
        return detail;
    }
}
