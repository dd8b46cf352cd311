/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An IPv4 network in CIDR notation, for example {@code 10.128.0.0/14}.
 * <p>
 * Instances are always normalised: the address has no bits set beyond the prefix.
 */
public final class Cidr {

    private static final Pattern IPV4_PATTERN = Pattern.compile("(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})");
    // hex digits and colons, optionally ending in a dotted quad; never a hostname
    private static final Pattern IPV6_LITERAL_PATTERN = Pattern.compile("[0-9A-Fa-f:]*:[0-9A-Fa-f:.]*");
    private static final int IPV6_ADDRESS_BITS = 128;
    private static final int ADDRESS_BITS = 32;

    private final int address;
    private final int prefixLength;

    private Cidr(int address, int prefixLength) {
        this.address = address;
        this.prefixLength = prefixLength;
    }

    /**
     * Parses a CIDR, masking any host bits of the address.
     * {@code 10.128.0.1/14} gives {@code 10.128.0.0/14}.
     *
     * @param cidr the CIDR
     * @return the parsed network
     * @throws IllegalArgumentException if the input is not an IPv4 CIDR
     */
    public static Cidr parseLenient(@NonNull String cidr) {
        if (cidr == null) {
            throw new IllegalArgumentException("CIDR cannot be null");
        }
        int slash = cidr.indexOf('/');
        if (slash < 0 || slash != cidr.lastIndexOf('/')) {
            throw new IllegalArgumentException("'" + cidr + "' is not in CIDR notation");
        }
        int address = parseAddress(cidr, addressPart(cidr));
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(cidr.substring(slash + 1));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + cidr + "' has an invalid prefix length", e);
        }
        if (prefixLength < 0 || prefixLength > ADDRESS_BITS) {
            throw new IllegalArgumentException("'" + cidr + "' has a prefix length outside 0-32");
        }
        return new Cidr(address & mask(prefixLength), prefixLength);
    }

    /**
     * Parses a literal IP address. IPv6 literals are accepted so that callers can report them
     * as lying outside any IPv4 network; hostnames are never resolved.
     *
     * @param ip the address, e.g. {@code 172.30.0.1} or {@code fd00::10}
     * @return the address, or empty if {@code ip} is null, empty or not an IP literal
     */
    public static Optional<InetAddress> parseIp(@Nullable String ip) {
        if (ip == null) {
            return Optional.empty();
        }
        if (IPV4_PATTERN.matcher(ip).matches()) {
            return parseIpv4(ip);
        }
        if (IPV6_LITERAL_PATTERN.matcher(ip).matches()) {
            return parseIpv6(ip);
        }
        return Optional.empty();
    }

    /**
     * @param cidr a value that failed to parse as an IPv4 CIDR
     * @return true if {@code cidr} is a well-formed IPv6 CIDR such as {@code fd00::/64}
     */
    static boolean isIpv6Cidr(@Nullable String cidr) {
        if (cidr == null) {
            return false;
        }
        int slash = cidr.indexOf('/');
        if (slash < 0 || slash != cidr.lastIndexOf('/')) {
            return false;
        }
        String addressPart = cidr.substring(0, slash);
        if (!IPV6_LITERAL_PATTERN.matcher(addressPart).matches() || parseIpv6(addressPart).isEmpty()) {
            return false;
        }
        String prefixPart = cidr.substring(slash + 1);
        if (prefixPart.isEmpty() || prefixPart.length() > 3 || !prefixPart.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return Integer.parseInt(prefixPart) <= IPV6_ADDRESS_BITS;
    }

    private static Optional<InetAddress> parseIpv4(String ip) {
        try {
            return Optional.of(InetAddress.getByAddress(toBytes(parseAddress(ip, ip))));
        }
        catch (IllegalArgumentException | UnknownHostException e) {
            return Optional.empty();
        }
    }

    private static Optional<InetAddress> parseIpv6(String ip) {
        try {
            // a literal containing ':' is parsed, never looked up
            return Optional.of(InetAddress.getByName(ip));
        }
        catch (IllegalArgumentException | UnknownHostException e) {
            return Optional.empty();
        }
    }

    /**
     * Creates the network of the given address and prefix length.
     *
     * @param address an IPv4 address
     * @param prefixLength prefix length, 0-32
     * @return the network, with host bits masked
     */
    public static Cidr of(InetAddress address, int prefixLength) {
        if (!(address instanceof Inet4Address)) {
            throw new IllegalArgumentException(address + " is not an IPv4 address");
        }
        if (prefixLength < 0 || prefixLength > ADDRESS_BITS) {
            throw new IllegalArgumentException("prefix length " + prefixLength + " is outside 0-32");
        }
        return new Cidr(toInt(address.getAddress()) & mask(prefixLength), prefixLength);
    }

    public InetAddress address() {
        try {
            return InetAddress.getByAddress(toBytes(address));
        }
        catch (UnknownHostException e) {
            // getByAddress only throws for arrays of illegal length
            throw new IllegalStateException(e);
        }
    }

    public int prefixLength() {
        return prefixLength;
    }

    /**
     * A network with a zero-length prefix would cover the whole address space.
     *
     * @return true if this network has a prefix length of zero
     */
    public boolean isDegenerate() {
        return prefixLength == 0;
    }

    public boolean contains(InetAddress ip) {
        if (!(ip instanceof Inet4Address)) {
            return false;
        }
        return (toInt(ip.getAddress()) & mask(prefixLength)) == address;
    }

    /**
     * @param other another network
     * @return true if every address of {@code other} is also in this network
     */
    public boolean contains(Cidr other) {
        return other.prefixLength >= prefixLength
                && (other.address & mask(prefixLength)) == address;
    }

    public boolean overlaps(Cidr other) {
        return contains(other) || other.contains(this);
    }

    private static String addressPart(String cidr) {
        int slash = cidr.indexOf('/');
        return slash < 0 ? cidr : cidr.substring(0, slash);
    }

    private static int parseAddress(String input, String address) {
        var matcher = IPV4_PATTERN.matcher(address);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("'" + input + "' does not contain an IPv4 address");
        }
        int result = 0;
        for (int i = 1; i <= 4; i++) {
            int octet = Integer.parseInt(matcher.group(i));
            if (octet > 255) {
                throw new IllegalArgumentException("'" + input + "' does not contain an IPv4 address");
            }
            result = (result << 8) | octet;
        }
        return result;
    }

    private static int mask(int prefixLength) {
        return prefixLength == 0 ? 0 : -1 << (ADDRESS_BITS - prefixLength);
    }

    private static int toInt(byte[] bytes) {
        return ((bytes[0] & 0xff) << 24) | ((bytes[1] & 0xff) << 16) | ((bytes[2] & 0xff) << 8) | (bytes[3] & 0xff);
    }

    private static byte[] toBytes(int address) {
        return new byte[]{ (byte) (address >>> 24), (byte) (address >>> 16), (byte) (address >>> 8), (byte) address };
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        var that = (Cidr) obj;
        return this.address == that.address && this.prefixLength == that.prefixLength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, prefixLength);
    }

    /**
     * @return the canonical form, {@code a.b.c.d/n}
     */
    @Override
    public String toString() {
        return ((address >>> 24) & 0xff) + "." + ((address >>> 16) & 0xff) + "." + ((address >>> 8) & 0xff) + "." + (address & 0xff) + "/" + prefixLength;
    }
}
