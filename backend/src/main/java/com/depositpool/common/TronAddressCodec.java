package com.depositpool.common;

import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

import java.util.HexFormat;

/**
 * TRON addresses: Base58Check over the 0x41 prefix byte plus a 20-byte account id.
 */
public final class TronAddressCodec {

    public static final int ADDRESS_LENGTH = 34;
    public static final int ACCOUNT_ID_LENGTH = 20;
    private static final int ADDRESS_PREFIX = 0x41;

    private TronAddressCodec() {
    }

    /**
     * True for a 34-char string starting with T whose Base58Check payload carries the TRON prefix.
     */
    public static boolean isValid(String address) {
        if (address == null || address.length() != ADDRESS_LENGTH || address.charAt(0) != 'T') {
            return false;
        }
        try {
            byte[] payload = Base58.decodeChecked(address);
            return payload.length == ACCOUNT_ID_LENGTH + 1 && (payload[0] & 0xff) == ADDRESS_PREFIX;
        } catch (AddressFormatException e) {
            return false;
        }
    }

    /**
     * Converts a hex address as returned by TRON node APIs ("41" + 40 hex chars, or the bare 40 chars) to Base58Check.
     */
    public static String hexToBase58(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex address is null");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() == ACCOUNT_ID_LENGTH * 2) {
            normalized = "41" + normalized;
        }
        byte[] payload = HexFormat.of().parseHex(normalized);
        if (payload.length != ACCOUNT_ID_LENGTH + 1 || (payload[0] & 0xff) != ADDRESS_PREFIX) {
            throw new IllegalArgumentException("Not a TRON hex address: " + hex);
        }
        byte[] accountId = new byte[ACCOUNT_ID_LENGTH];
        System.arraycopy(payload, 1, accountId, 0, ACCOUNT_ID_LENGTH);
        return fromAccountId(accountId);
    }

    public static String fromAccountId(byte[] accountId) {
        if (accountId == null || accountId.length != ACCOUNT_ID_LENGTH) {
            throw new IllegalArgumentException("TRON account id must be " + ACCOUNT_ID_LENGTH + " bytes");
        }
        return Base58.encodeChecked(ADDRESS_PREFIX, accountId);
    }
}
