package org.calista.formalizer.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Bounded retry of collaborator calls: {@code 1 + retries} tries, linear backoff.
 * The last {@link CollaboratorException} is rethrown.
 */
public final class Retries {
    private static final Logger log = LogManager.getLogger(Retries.class);

    @FunctionalInterface
    public interface Call<T> {
        T run() throws CollaboratorException;
    }

    private final int retries;
    private final long delayMs;

    public Retries(int retries, long delayMs) {
        this.retries = Math.max(0, retries);
        this.delayMs = Math.max(0L, delayMs);
    }

    public static Retries none() {
        return new Retries(0, 0);
    }

    public int retries() {
        return retries;
    }

    public <T> T call(String what, Call<T> call) throws CollaboratorException {
        CollaboratorException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return call.run();
            } catch (CollaboratorException e) {
                last = e;
                if (attempt < retries) {
                    log.warn("{}: {} ({}), retry {}/{}", what, e.getMessage(), e.kind(), attempt + 1, retries);
                    pause(delayMs * (attempt + 1));
                }
            }
        }
        throw last;
    }

    private static void pause(long ms) throws CollaboratorException {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw CollaboratorException.unavailable("retry", "interrupted while backing off", ie);
        }
    }
}
