/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

/**
 * Tracks the virtual network ID of each namespace.
 */
@FunctionalInterface
public interface VnidTracking {

    /**
     * @param multiTenant true to give every tenant its own VNID, false to share a global one
     */
    void start(boolean multiTenant);
}
