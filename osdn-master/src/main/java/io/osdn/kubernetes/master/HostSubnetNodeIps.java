/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The IP address each node had when its host subnet was created, keyed by node UID.
 * <p>
 * One instance is owned by the {@link SdnMaster} for the life of the process. It is written
 * by subnet allocation, which may process nodes on several threads, so it is safe for concurrent use.
 */
public final class HostSubnetNodeIps {

    private final Map<String, String> nodeIps = new ConcurrentHashMap<>();

    /**
     * @return the IP previously recorded for the node, if any
     */
    public Optional<String> put(String nodeUid, String nodeIp) {
        return Optional.ofNullable(nodeIps.put(nodeUid, nodeIp));
    }

    public Optional<String> get(String nodeUid) {
        return Optional.ofNullable(nodeIps.get(nodeUid));
    }

    public Optional<String> remove(String nodeUid) {
        return Optional.ofNullable(nodeIps.remove(nodeUid));
    }

    public int size() {
        return nodeIps.size();
    }

    public boolean isEmpty() {
        return nodeIps.isEmpty();
    }
}
