/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.network;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import io.osdn.kubernetes.master.IllegalNetworkConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkInfoTest {

    @ParameterizedTest
    @CsvSource({
            "10.128.0.0/14, 172.30.0.0/16",
            "10.0.0.0/8, 192.168.0.0/16",
            "10.128.0.0/15, 10.130.0.0/15",
            "192.168.1.0/24, 192.168.2.0/24"
    })
    void shouldAcceptNonOverlappingNetworks(String cluster, String service) {
        // Given

        // When
        var networkInfo = NetworkInfo.parse(cluster, service);

        // Then
        assertThat(networkInfo.clusterNetwork()).hasToString(cluster);
        assertThat(networkInfo.serviceNetwork()).hasToString(service);
    }

    @ParameterizedTest
    @CsvSource({
            "10.128.0.0/14, 10.128.0.0/14",
            "10.0.0.0/8, 10.128.0.0/16",
            "172.30.0.0/24, 172.30.0.0/16",
            "10.128.0.0/14, 10.131.255.0/24"
    })
    void shouldRejectOverlappingNetworks(String cluster, String service) {
        assertThatThrownBy(() -> NetworkInfo.parse(cluster, service))
                .isInstanceOf(IllegalNetworkConfigurationException.class)
                .hasMessageContaining("overlaps");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "not-a-cidr", "10.128.0.0", "10.128.0.0/40" })
    void shouldRejectUnparsableClusterNetwork(String cluster) {
        assertThatThrownBy(() -> NetworkInfo.parse(cluster, "172.30.0.0/16"))
                .isInstanceOf(IllegalNetworkConfigurationException.class)
                .hasMessageStartingWith("failed to parse ClusterNetwork CIDR");
    }

    @Test
    void shouldRejectUnparsableServiceNetwork() {
        assertThatThrownBy(() -> NetworkInfo.parse("10.128.0.0/14", "172.30/16"))
                .isInstanceOf(IllegalNetworkConfigurationException.class)
                .hasMessageStartingWith("failed to parse ServiceNetwork CIDR");
    }

    @Test
    void shouldRejectDegenerateClusterNetwork() {
        assertThatThrownBy(() -> NetworkInfo.parse("0.0.0.0/0", "172.30.0.0/16"))
                .isInstanceOf(IllegalNetworkConfigurationException.class)
                .hasMessageContaining("non-zero prefix length");
    }

    @Test
    void shouldRejectDegenerateServiceNetwork() {
        assertThatThrownBy(() -> NetworkInfo.parse("10.128.0.0/14", "0.0.0.0/0"))
                .isInstanceOf(IllegalNetworkConfigurationException.class)
                .hasMessageContaining("non-zero prefix length");
    }

    @Test
    void shouldMaskHostBits() {
        // Given

        // When
        var networkInfo = NetworkInfo.parse("10.128.0.1/14", "172.30.5.5/16");

        // Then
        assertThat(networkInfo.clusterNetwork()).hasToString("10.128.0.0/14");
        assertThat(networkInfo.serviceNetwork()).hasToString("172.30.0.0/16");
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 9, 18 })
    void shouldAcceptHostSubnetLengthThatFits(int hostSubnetLength) {
        var networkInfo = NetworkInfo.parse("10.128.0.0/14", "172.30.0.0/16");
        networkInfo.validateHostSubnetLength(hostSubnetLength);
    }

    @ParameterizedTest
    @ValueSource(ints = { -1, 0, 19, 32 })
    void shouldRejectHostSubnetLengthThatDoesNotFit(int hostSubnetLength) {
        var networkInfo = NetworkInfo.parse("10.128.0.0/14", "172.30.0.0/16");
        assertThatThrownBy(() -> networkInfo.validateHostSubnetLength(hostSubnetLength))
                .isInstanceOf(IllegalNetworkConfigurationException.class)
                .hasMessageContaining("hostSubnetLength " + hostSubnetLength);
    }

    @Test
    void shouldFindNoConflictWithUnrelatedHostNetworks() {
        // Given
        var networkInfo = NetworkInfo.parse("10.128.0.0/14", "172.30.0.0/16");

        // When
        var violations = networkInfo.checkHostNetworks(List.of(Cidr.parseLenient("127.0.0.0/8"), Cidr.parseLenient("192.168.122.0/24")));

        // Then
        assertThat(violations).isEmpty();
    }

    @Test
    void shouldReportEveryHostNetworkConflict() {
        // Given
        var networkInfo = NetworkInfo.parse("10.128.0.0/14", "172.30.0.0/16");
        var wide = Cidr.parseLenient("10.0.0.0/8");
        var inside = Cidr.parseLenient("172.30.4.0/24");

        // When
        var violations = networkInfo.checkHostNetworks(List.of(wide, inside));

        // Then
        assertThat(violations)
                .extracting(Violation::kind)
                .containsOnly(Violation.Kind.HOST_NETWORK_CONFLICT);
        assertThat(violations)
                .extracting(Violation::detail)
                .containsExactly(
                        "cluster IP: 10.128.0.0 conflicts with host network: 10.0.0.0/8",
                        "host network with IP: 172.30.4.0 conflicts with service network: 172.30.0.0/16");
    }

    @Test
    void shouldReportHostNetworkInsideClusterNetwork() {
        // Given
        var networkInfo = NetworkInfo.parse("10.128.0.0/14", "172.30.0.0/16");

        // When
        var violations = networkInfo.checkHostNetworks(List.of(Cidr.parseLenient("10.130.0.0/16")));

        // Then
        assertThat(violations)
                .extracting(Violation::detail)
                .containsExactly("host network with IP: 10.130.0.0 conflicts with cluster network: 10.128.0.0/14");
    }
}
