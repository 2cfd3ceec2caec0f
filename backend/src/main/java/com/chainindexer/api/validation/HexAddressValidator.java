package com.chainindexer.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Addresses are stored as uppercase hex of the raw bytes, so a valid one is a whole number of bytes.
 */
@Component
public class HexAddressValidator {

    private static final Pattern HEX_BYTES = Pattern.compile("^(0x)?([0-9a-fA-F]{2})+$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return HEX_BYTES.matcher(address.trim()).matches();
    }
}
