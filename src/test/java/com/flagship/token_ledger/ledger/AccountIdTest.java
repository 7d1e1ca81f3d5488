package com.flagship.token_ledger.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountIdTest {

    private static final String HEX = "0101010101010101010101010101010101010101010101010101010101010101";

    @Test
    @DisplayName("Hex parsing accepts an optional 0x prefix and either case")
    void testFromHex() {
        AccountId expected = AccountId.filledWith(0x01);

        assertEquals(expected, AccountId.fromHex(HEX));
        assertEquals(expected, AccountId.fromHex("0x" + HEX));
        assertEquals(AccountId.filledWith(0xAB), AccountId.fromHex("AB".repeat(32)));
        assertEquals(HEX, expected.toHex());
    }

    @Test
    @DisplayName("Malformed ids are rejected")
    void testInvalidHex() {
        assertThrows(IllegalArgumentException.class, () -> AccountId.fromHex(null));
        assertThrows(IllegalArgumentException.class, () -> AccountId.fromHex(""));
        assertThrows(IllegalArgumentException.class, () -> AccountId.fromHex("01"));
        assertThrows(IllegalArgumentException.class, () -> AccountId.fromHex(HEX + "01"));
        assertThrows(IllegalArgumentException.class, () -> AccountId.fromHex("zz".repeat(32)));
        assertThrows(IllegalArgumentException.class, () -> AccountId.of(new byte[31]));
    }

    @Test
    @DisplayName("Equality and hashing are by content, and the bytes cannot be mutated from outside")
    void testValueSemantics() {
        byte[] bytes = new byte[AccountId.LENGTH];
        bytes[0] = 7;
        AccountId first = AccountId.of(bytes);
        AccountId second = AccountId.of(bytes.clone());

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        bytes[0] = 8;
        first.toBytes()[1] = 9;
        assertEquals(second, first);
        assertNotEquals(AccountId.of(bytes), first);
    }

    @Test
    @DisplayName("JSON form is the hex string")
    void testJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"" + HEX + "\"", mapper.writeValueAsString(AccountId.filledWith(0x01)));
        assertEquals(AccountId.filledWith(0x01), mapper.readValue("\"" + HEX + "\"", AccountId.class));
    }
}
