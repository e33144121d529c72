package com.mindcanvus.adapter.out.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BCryptPasswordHasherTest {

    private final BCryptPasswordHasher hasher = new BCryptPasswordHasher(4);

    @Test
    void shouldMatchOriginalPassword() {
        String hash = hasher.hash("secret1");

        assertNotEquals("secret1", hash);
        assertTrue(hasher.matches("secret1", hash));
        assertFalse(hasher.matches("secret2", hash));
    }

    @Test
    void shouldSaltEachHash() {
        assertNotEquals(hasher.hash("secret1"), hasher.hash("secret1"));
    }
}
