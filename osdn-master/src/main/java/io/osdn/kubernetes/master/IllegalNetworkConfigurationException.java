/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

/**
 * Signals that the configured cluster or service network is malformed, degenerate,
 * or otherwise unusable. Raised before any cluster state is read or written.
 */
public class IllegalNetworkConfigurationException extends RuntimeException {

    public IllegalNetworkConfigurationException(String message) {
        super(message);
    }

    public IllegalNetworkConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
