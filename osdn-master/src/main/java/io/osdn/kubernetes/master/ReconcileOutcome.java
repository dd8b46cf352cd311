/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master;

import java.util.Locale;

/**
 * What reconciling the cluster network record did.
 */
public enum ReconcileOutcome {
    NO_OP,
    CREATE,
    UPDATE;

    String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
