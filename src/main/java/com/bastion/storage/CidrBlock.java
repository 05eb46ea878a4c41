package com.bastion.storage;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.util.Optional;

/**
 * An IPv4 or IPv6 network block parsed from CIDR notation.
 * Parsing never touches DNS.
 */
public final class CidrBlock {

    private final String notation;
    private final byte[] network;
    private final int prefixLength;

    private CidrBlock(String notation, byte[] network, int prefixLength) {
        this.notation = notation;
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * Parse "address/prefix". A bare address is treated as a host block.
     *
     * @return the block, or empty for malformed input
     */
    public static Optional<CidrBlock> parse(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            return Optional.empty();
        }
        String trimmed = cidr.trim();
        int slash = trimmed.indexOf('/');
        String address = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
        if (!InetAddresses.isInetAddress(address)) {
            return Optional.empty();
        }
        byte[] bytes = InetAddresses.forString(address).getAddress();
        int maxBits = bytes.length * 8;
        int prefix = maxBits;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(trimmed.substring(slash + 1));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (prefix < 0 || prefix > maxBits) {
            return Optional.empty();
        }
        return Optional.of(new CidrBlock(trimmed, mask(bytes, prefix), prefix));
    }

    /**
     * Whether the address lies inside this block. Malformed addresses and
     * addresses of the other IP family never match.
     */
    public boolean contains(String ip) {
        Optional<InetAddress> address = parseAddress(ip);
        if (address.isEmpty()) {
            return false;
        }
        byte[] bytes = address.get().getAddress();
        if (bytes.length != network.length) {
            return false;
        }
        byte[] masked = mask(bytes, prefixLength);
        for (int i = 0; i < masked.length; i++) {
            if (masked[i] != network[i]) {
                return false;
            }
        }
        return true;
    }

    static Optional<InetAddress> parseAddress(String ip) {
        if (ip == null || ip.isBlank() || !InetAddresses.isInetAddress(ip.trim())) {
            return Optional.empty();
        }
        return Optional.of(InetAddresses.forString(ip.trim()));
    }

    private static byte[] mask(byte[] address, int prefix) {
        byte[] result = address.clone();
        for (int i = 0; i < result.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefix - i * 8));
            int byteMask = bitsInByte == 0 ? 0 : (0xFF << (8 - bitsInByte)) & 0xFF;
            result[i] = (byte) (result[i] & byteMask);
        }
        return result;
    }

    public String getNotation() {
        return notation;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    @Override
    public String toString() {
        return notation;
    }
}
