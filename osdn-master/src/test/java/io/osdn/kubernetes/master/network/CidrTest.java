/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CidrTest {

    @ParameterizedTest
    @ValueSource(strings = { "10.128.0.0/14", "172.30.0.0/16", "0.0.0.0/0", "192.168.1.5/32", "255.255.255.255/32" })
    void shouldRenderParsedCidrCanonically(String cidr) {
        // Given

        // When
        var parsed = Cidr.parseLenient(cidr);

        // Then
        assertThat(parsed).hasToString(cidr);
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "10.128.0.0", "10.128.0.0/", "10.128.0.0/33", "10.128.0.0/-1", "10.128.0/14", "256.0.0.0/8", "a.b.c.d/8",
            "10.128.0.0/14/2", "fe80::/64", "10.128.0.0/x" })
    void shouldRejectMalformedCidr(String cidr) {
        assertThatThrownBy(() -> Cidr.parseLenient(cidr)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNullCidr() {
        assertThatThrownBy(() -> Cidr.parseLenient(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lenientParseShouldMaskHostBits() {
        // Given

        // When
        var parsed = Cidr.parseLenient("10.131.255.7/14");

        // Then
        assertThat(parsed).hasToString("10.128.0.0/14");
        assertThat(parsed.prefixLength()).isEqualTo(14);
    }

    @ParameterizedTest
    @CsvSource({
            "10.128.0.0/14, 10.128.0.0, true",
            "10.128.0.0/14, 10.131.255.255, true",
            "10.128.0.0/14, 10.132.0.0, false",
            "10.128.0.0/14, 10.127.255.255, false",
            "0.0.0.0/0, 192.168.1.5, true",
            "192.168.1.5/32, 192.168.1.5, true",
            "192.168.1.5/32, 192.168.1.6, false"
    })
    void shouldTestAddressContainment(String cidr, String ip, boolean expected) throws UnknownHostException {
        assertThat(Cidr.parseLenient(cidr).contains(InetAddress.getByName(ip))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "10.128.0.0/14, 10.131.0.0/23, true",
            "10.128.0.0/14, 10.128.0.0/14, true",
            "10.128.0.0/14, 10.128.0.0/13, false",
            "10.128.0.0/14, 10.132.0.0/23, false",
            "10.128.0.0/23, 10.128.0.0/14, false"
    })
    void shouldTestNetworkContainment(String outer, String inner, boolean expected) {
        assertThat(Cidr.parseLenient(outer).contains(Cidr.parseLenient(inner))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "10.128.0.0/14, 172.30.0.0/16, false",
            "10.128.0.0/14, 10.130.0.0/16, true",
            "10.130.0.0/16, 10.128.0.0/14, true",
            "10.0.0.0/8, 10.128.0.0/14, true",
            "10.128.0.0/15, 10.130.0.0/15, false"
    })
    void shouldTestOverlap(String first, String second, boolean expected) {
        assertThat(Cidr.parseLenient(first).overlaps(Cidr.parseLenient(second))).isEqualTo(expected);
    }

    @Test
    void shouldNotContainIpv6Address() throws UnknownHostException {
        assertThat(Cidr.parseLenient("0.0.0.0/0").contains(InetAddress.getByName("::1"))).isFalse();
    }

    @Test
    void shouldDetectDegenerateNetwork() {
        assertThat(Cidr.parseLenient("0.0.0.0/0").isDegenerate()).isTrue();
        assertThat(Cidr.parseLenient("10.0.0.0/8").isDegenerate()).isFalse();
    }

    @Test
    void shouldBuildFromAddressAndPrefix() throws UnknownHostException {
        // Given
        var address = InetAddress.getByName("192.168.122.17");

        // When
        var cidr = Cidr.of(address, 24);

        // Then
        assertThat(cidr).hasToString("192.168.122.0/24");
        assertThat(cidr.address().getHostAddress()).isEqualTo("192.168.122.0");
    }

    @ParameterizedTest
    @ValueSource(strings = { "172.30.0.1", "0.0.0.0", "255.255.255.255" })
    void shouldParseIpLiteral(String ip) {
        assertThat(Cidr.parseIp(ip)).get().extracting(InetAddress::getHostAddress).isEqualTo(ip);
    }

    @ParameterizedTest
    @CsvSource({
            "fd00::10, fd00:0:0:0:0:0:0:10",
            "::1, 0:0:0:0:0:0:0:1",
            "2001:DB8::1, 2001:db8:0:0:0:0:0:1"
    })
    void shouldParseIpv6Literal(String ip, String expected) {
        assertThat(Cidr.parseIp(ip)).get()
                .isInstanceOf(Inet6Address.class)
                .extracting(InetAddress::getHostAddress).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "None", "300.1.1.1", "example.com", "10.0.0", "fd00::1::2", "fd00::g", "fe80::1%eth0", "[::1]", ":" })
    void shouldIgnoreValuesThatAreNotIpLiterals(String ip) {
        assertThat(Cidr.parseIp(ip)).isEmpty();
    }

    @Test
    void shouldNotContainParsedIpv6Literal() {
        var address = Cidr.parseIp("fd00::10").orElseThrow();
        assertThat(Cidr.parseLenient("0.0.0.0/0").contains(address)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "fd00::/64", "::/0", "2001:db8::1/128", "fd00:0:0:1::/48" })
    void shouldRecognizeIpv6Cidr(String cidr) {
        assertThat(Cidr.isIpv6Cidr(cidr)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "not-a-subnet", "10.128.0.0/14", "fd00::", "fd00::/129", "fd00::/x", "fd00::/", "fd00::/64/1", "host.example:1/64", "fd00::1::2/64" })
    void shouldNotRecognizeOtherValuesAsIpv6Cidr(String cidr) {
        assertThat(Cidr.isIpv6Cidr(cidr)).isFalse();
    }
}
