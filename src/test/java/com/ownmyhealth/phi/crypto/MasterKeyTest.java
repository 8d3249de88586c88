package com.ownmyhealth.phi.crypto;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MasterKeyTest {
    private static final String PLACEHOLDER = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

    @Test
    void acceptsA256BitHexKey() {
        MasterKey key = MasterKey.fromHex("a1b2c3d4".repeat(8), true);

        assertEquals(256, key.bits());
        assertEquals(32, key.aesKey().length);
    }

    @Test
    void longerKeysStillYieldAnAes256Key() {
        MasterKey key = MasterKey.fromHex("ab".repeat(48), false);

        assertEquals(384, key.bits());
        assertEquals(32, key.aesKey().length);
    }

    @Test
    void rejectsMissingShortAndNonHexKeys() {
        assertThrows(IllegalStateException.class, () -> MasterKey.fromHex(null, false));
        assertThrows(IllegalStateException.class, () -> MasterKey.fromHex("  ", false));
        assertThrows(IllegalStateException.class, () -> MasterKey.fromHex("abcd", false));
        assertThrows(IllegalStateException.class, () -> MasterKey.fromHex("zz".repeat(32), false));
    }

    @Test
    void placeholderOnlyRejectedInProduction() {
        assertDoesNotThrow(() -> MasterKey.fromHex(PLACEHOLDER, false));
        assertThrows(IllegalStateException.class, () -> MasterKey.fromHex(PLACEHOLDER, true));
        assertThrows(IllegalStateException.class, () -> MasterKey.fromHex("F".repeat(64), true));
        assertTrue(MasterKey.isPlaceholder(" " + PLACEHOLDER.toUpperCase() + " "));
    }

    @Test
    void toStringNeverShowsKeyMaterial() {
        String hex = "a1b2c3d4".repeat(8);

        assertFalse(MasterKey.fromHex(hex, false).toString().contains("a1b2"));
    }
}
