package com.questrail.relaybridge.protocol.session;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionTagFilterTest {

    @Test
    void noRecordedTagAcceptsEverything() {
        assertTrue(SessionTagFilter.accepts(null, Optional.of("s1")));
        assertTrue(SessionTagFilter.accepts("", Optional.of("s1")));
        assertTrue(SessionTagFilter.accepts(null, Optional.empty()));
    }

    @Test
    void untaggedEnvelopeIsAccepted() {
        assertTrue(SessionTagFilter.accepts("s1", Optional.empty()));
    }

    @Test
    void matchingTagIsAccepted() {
        assertTrue(SessionTagFilter.accepts("s1", Optional.of("s1")));
    }

    @Test
    void mismatchedTagIsDropped() {
        assertFalse(SessionTagFilter.accepts("s1", Optional.of("s0")));
    }
}
