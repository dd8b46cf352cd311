/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

/**
 * Signals that a downstream subsystem failed to start after the cluster network
 * had been reconciled. The persisted cluster network is valid at this point,
 * so invoking the bootstrap again is safe.
 */
public class BootstrapException extends RuntimeException {

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
