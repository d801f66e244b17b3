package com.genads.api.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Sha256HexPasswordEncoderTest {

    private final Sha256HexPasswordEncoder encoder = new Sha256HexPasswordEncoder();

    @Test
    void testEncodeProducesLowercaseHexDigest() {
        assertEquals("5e884898da28047151d0e56f8dc6292773603d0d6aabbdd62a11ef721d1542d8",
                encoder.encode("password"));
    }

    @Test
    void testEncodeIsUnsaltedAndStable() {
        assertEquals(encoder.encode("s3cret"), encoder.encode("s3cret"));
        assertEquals(64, encoder.encode("").length());
    }

    @Test
    void testMatches() {
        String hash = encoder.encode("correct horse");
        assertTrue(encoder.matches("correct horse", hash));
        assertFalse(encoder.matches("wrong horse", hash));
        assertFalse(encoder.matches("correct horse", null));
        assertFalse(encoder.matches("correct horse", ""));
    }
}
