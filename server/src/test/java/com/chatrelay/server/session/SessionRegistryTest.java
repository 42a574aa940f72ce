package com.chatrelay.server.session;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.chatrelay.server.support.Ids.ALICE;
import static com.chatrelay.server.support.Ids.BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    public void shouldCountSessionsPerUser() {
        Registration first = registry.register("c1", ALICE, "alice");
        Registration second = registry.register("c2", ALICE, "alice");

        assertTrue(first.firstForUser());
        assertFalse(second.firstForUser());
        assertEquals(2, second.sessionsForUser());
        assertEquals(2, registry.countSessionsFor(ALICE));
        assertEquals(Set.of("c1", "c2"), registry.connectionsOf(ALICE));
    }

    @Test
    public void shouldReportLastDepartureOnlyWhenNoSessionRemains() {
        registry.register("c1", ALICE, "alice");
        registry.register("c2", ALICE, "alice");

        Departure d1 = registry.unregister("c1").orElseThrow();
        assertFalse(d1.lastForUser());
        assertEquals(1, d1.remainingSessions());

        Departure d2 = registry.unregister("c2").orElseThrow();
        assertTrue(d2.lastForUser());
        assertEquals(0, registry.countSessionsFor(ALICE));
    }

    @Test
    public void shouldIgnoreUnknownConnection() {
        assertEquals(Optional.empty(), registry.unregister("nope"));
        assertEquals(Optional.empty(), registry.lookup("nope"));
    }

    @Test
    public void shouldKeepCountWhenSameUserReauthenticatesSameConnection() {
        registry.register("c1", ALICE, "alice");
        Registration again = registry.register("c1", ALICE, "alice");

        assertFalse(again.firstForUser());
        assertEquals(1, again.sessionsForUser());
        assertTrue(again.displacedSession().isEmpty());
    }

    @Test
    public void shouldDisplacePreviousUserWhenConnectionReauthenticatesAsAnother() {
        registry.register("c1", ALICE, "alice");
        Registration bob = registry.register("c1", BOB, "bob");

        Departure displaced = bob.displacedSession().orElseThrow();
        assertEquals(ALICE, displaced.session().userId());
        assertTrue(displaced.lastForUser());
        assertTrue(bob.firstForUser());
        assertEquals(0, registry.countSessionsFor(ALICE));
        assertEquals(BOB, registry.lookup("c1").orElseThrow().userId());
    }

    @Test
    public void shouldUnregisterAllSessionsOfUser() {
        registry.register("c1", ALICE, "alice");
        registry.register("c2", ALICE, "alice");
        registry.register("c3", BOB, "bob");

        List<Departure> departures = registry.unregisterAll(ALICE);

        assertEquals(2, departures.size());
        assertTrue(departures.get(1).lastForUser());
        assertFalse(departures.get(0).lastForUser());
        assertEquals(0, registry.countSessionsFor(ALICE));
        assertEquals(1, registry.countSessionsFor(BOB));
        assertTrue(registry.lookup("c1").isEmpty());
    }
}
