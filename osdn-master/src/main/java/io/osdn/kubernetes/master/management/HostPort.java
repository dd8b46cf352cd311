/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.management;

import java.util.Objects;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A host and port the management server binds to.
 *
 * @param host hostname, IPv4 address, or bracketed IPv6 address
 * @param port port number
 */
public record HostPort(@NonNull String host, int port) {

    private static final Pattern IPV6_WITH_PORT = Pattern.compile("^(\\[.+]):(.+)$");

    public HostPort {
        Objects.requireNonNull(host, "host cannot be null");
    }

    /**
     * Parses {@code host:port}. IPv6 hosts must use the bracketed form of
     * <a href="https://www.rfc-editor.org/rfc/rfc4038#section-5.1">rfc4038</a>, e.g. {@code [::1]:8080}.
     *
     * @param address the address
     * @return the host port
     * @throws IllegalArgumentException if the address is malformed
     */
    public static HostPort parse(@NonNull String address) {
        var exceptionText = "unexpected address formation '%s'. Valid formations are 'host:8080', 'host.example.com:8080', or '[::1]:8080'".formatted(address);
        if (address == null) {
            throw new IllegalArgumentException(exceptionText);
        }
        var ipv6Match = IPV6_WITH_PORT.matcher(address);
        if (ipv6Match.matches()) {
            return new HostPort(ipv6Match.group(1), parsePort(exceptionText, ipv6Match.group(2)));
        }
        int separator = address.indexOf(':');
        if (separator <= 0 || separator != address.lastIndexOf(':') || address.substring(0, separator).isBlank()) {
            throw new IllegalArgumentException(exceptionText);
        }
        return new HostPort(address.substring(0, separator), parsePort(exceptionText, address.substring(separator + 1)));
    }

    private static int parsePort(String exceptionText, String port) {
        try {
            int parsed = Integer.parseInt(port);
            if (parsed < 0 || parsed > 65535) {
                throw new IllegalArgumentException(exceptionText);
            }
            return parsed;
        }
        catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(exceptionText, nfe);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
