package com.questrail.relaybridge.protocol.session;

import java.util.Optional;

/**
 * SessionTagFilter
 * =============================================================================
 * Decides whether an inbound envelope belongs to the executor session the
 * caller currently knows about.
 *
 * <h2>Rule</h2>
 * <pre>
 *   recorded empty              → accept
 *   incoming empty              → accept
 *   recorded == incoming        → accept
 *   otherwise                   → drop (stale executor)
 * </pre>
 *
 * A missing tag on either side means "no opinion", so executors that never
 * announce a session tag are never filtered.
 */
final class SessionTagFilter
{
    private SessionTagFilter() {
    }

    static boolean accepts(String recorded, Optional<String> incoming)
    {
        if (recorded == null || recorded.isEmpty()) {
            return true;
        }
        return incoming.map(recorded::equals).orElse(true);
    }
}
