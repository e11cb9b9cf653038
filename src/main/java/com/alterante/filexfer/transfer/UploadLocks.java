package com.alterante.filexfer.transfer;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-filename advisory locks held by a session for the whole of one UPLOAD.
 *
 * Two sessions appending to the same stored file would interleave bytes; the second one is
 * refused instead.
 */
public class UploadLocks {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    /** A held lock; closing it releases the name. */
    public final class Lease implements AutoCloseable {
        private final String name;
        private boolean released;

        private Lease(String name) {
            this.name = name;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                held.remove(name);
            }
        }
    }

    /**
     * @return a lease on {@code name}, or null if another session holds it
     */
    public Lease tryAcquire(String name) {
        return held.add(name) ? new Lease(name) : null;
    }

    public boolean isHeld(String name) {
        return held.contains(name);
    }
}
