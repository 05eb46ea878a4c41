package com.bastion.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CidrBlock Tests")
class CidrBlockTest {

    @Test
    @DisplayName("Should match addresses inside an IPv4 block")
    void shouldMatchIpv4Block() {
        CidrBlock block = CidrBlock.parse("10.0.0.0/8").orElseThrow();

        assertThat(block.contains("10.1.2.3")).isTrue();
        assertThat(block.contains("10.255.255.255")).isTrue();
        assertThat(block.contains("11.0.0.1")).isFalse();
        assertThat(block.getPrefixLength()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should handle prefixes that are not byte aligned")
    void shouldHandleUnalignedPrefix() {
        CidrBlock block = CidrBlock.parse("192.168.4.0/22").orElseThrow();

        assertThat(block.contains("192.168.7.200")).isTrue();
        assertThat(block.contains("192.168.8.1")).isFalse();
    }

    @Test
    @DisplayName("Should treat a bare address as a host block")
    void shouldTreatBareAddressAsHost() {
        CidrBlock block = CidrBlock.parse("203.0.113.9").orElseThrow();

        assertThat(block.getPrefixLength()).isEqualTo(32);
        assertThat(block.contains("203.0.113.9")).isTrue();
        assertThat(block.contains("203.0.113.10")).isFalse();
    }

    @Test
    @DisplayName("Should match IPv6 blocks and never cross address families")
    void shouldMatchIpv6() {
        CidrBlock block = CidrBlock.parse("2001:db8::/32").orElseThrow();

        assertThat(block.contains("2001:db8:1::1")).isTrue();
        assertThat(block.contains("2001:db9::1")).isFalse();
        assertThat(block.contains("10.0.0.1")).isFalse();
    }

    @Test
    @DisplayName("Should reject malformed notation without resolving names")
    void shouldRejectMalformedNotation() {
        assertThat(CidrBlock.parse(null)).isEmpty();
        assertThat(CidrBlock.parse("")).isEmpty();
        assertThat(CidrBlock.parse("example.com/24")).isEmpty();
        assertThat(CidrBlock.parse("10.0.0.0/33")).isEmpty();
        assertThat(CidrBlock.parse("10.0.0.0/abc")).isEmpty();
        assertThat(CidrBlock.parse("10.0.0.0/8").orElseThrow().contains("not-an-ip")).isFalse();
    }
}
