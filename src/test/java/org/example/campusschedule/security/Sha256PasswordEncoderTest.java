package org.example.campusschedule.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Sha256PasswordEncoderTest {

    private final Sha256PasswordEncoder encoder = new Sha256PasswordEncoder();

    @Test
    void encodesAsLowercaseHexDigest() {
        assertEquals("5e884898da28047151d0e56f8dc6292773603d0d6aabbdd62a11ef721d1542d8", encoder.encode("password"));
    }

    @Test
    void matchesOnlyTheExactPassword() {
        String hash = encoder.encode("s3cret");

        assertTrue(encoder.matches("s3cret", hash));
        assertFalse(encoder.matches("S3cret", hash));
        assertFalse(encoder.matches("s3cret ", hash));
        assertFalse(encoder.matches("s3cret", null));
    }

    @Test
    void hashesUtf8Bytes() {
        assertNotEquals(encoder.encode("cafe"), encoder.encode("café"));
        assertEquals(64, encoder.encode("café").length());
    }
}
