package com.questrail.relaybridge.protocol.broker;

import java.security.SecureRandom;

/**
 * Mints channel ids for executors that connect without one.
 */
@FunctionalInterface
public interface ChannelIdGenerator
{
    String next();

    /**
     * Eight characters drawn uniformly from {@code [A-Z0-9]} using a
     * {@link SecureRandom}, so ids cannot be guessed from earlier ones.
     */
    static ChannelIdGenerator secureRandom()
    {
        SecureRandom random = new SecureRandom();
        String alphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
        return () -> {
            char[] id = new char[8];
            for (int i = 0; i < id.length; i++) {
                id[i] = alphabet.charAt(random.nextInt(alphabet.length()));
            }
            return new String(id);
        };
    }
}
