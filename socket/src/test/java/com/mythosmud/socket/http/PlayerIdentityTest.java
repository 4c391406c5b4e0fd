package com.mythosmud.socket.http;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PlayerIdentityTest {

    @Test
    void testHeaderWins() {
        assertEquals(Optional.of("alice"), PlayerIdentity.resolve(" alice ", "/ws?playerId=bob"));
    }

    @Test
    void testFallsBackToQueryParameter() {
        assertEquals(Optional.of("bob"), PlayerIdentity.resolve(null, "/ws?playerId=bob"));
        assertEquals(Optional.of("bob"), PlayerIdentity.resolve("  ", "/stream?x=1&playerId=bob"));
    }

    @Test
    void testMissingEverywhere() {
        assertEquals(Optional.empty(), PlayerIdentity.resolve(null, "/ws"));
        assertEquals(Optional.empty(), PlayerIdentity.resolve("", "/ws?playerId="));
    }
}
