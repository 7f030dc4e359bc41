package net.spookly.livecheck.probe;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import lombok.NonNull;

/**
 * Maps request ids to the scope of the operation currently running under that id.
 * <p>
 * The lock guards the map only. Scopes are always cancelled after it is released, so cancellation
 * listeners may call back into the registry.
 */
public final class CancellationRegistry {
    private final Object lock = new Object();
    private final Map<Long, ProbeScope> handles = new HashMap<>();

    /**
     * Register a new operation for {@code id}, deriving its scope from {@code baseScope}.
     *
     * @throws DuplicateRequestIdException when an operation for {@code id} is still active.
     */
    public ActiveOperation begin(@NonNull ProbeScope baseScope, long id) {
        ProbeScope scope = baseScope.child();
        synchronized (lock) {
            if (!handles.containsKey(id)) {
                handles.put(id, scope);
                return new ActiveOperation(this, id, scope);
            }
        }
        scope.cancel();
        throw new DuplicateRequestIdException(id);
    }

    /**
     * Cancel the operation registered for {@code id}. Unknown or finished ids are ignored.
     */
    public void cancel(long id) {
        ProbeScope handle;
        synchronized (lock) {
            handle = handles.remove(id);
        }
        if (handle != null) {
            handle.cancel();
        }
    }

    public boolean isActive(long id) {
        synchronized (lock) {
            return handles.containsKey(id);
        }
    }

    public int activeCount() {
        synchronized (lock) {
            return handles.size();
        }
    }

    public Set<Long> activeIds() {
        synchronized (lock) {
            return Set.copyOf(handles.keySet());
        }
    }

    void complete(long id, ProbeScope scope) {
        scope.cancel();
        synchronized (lock) {
            // The id may already belong to a later operation.
            handles.remove(id, scope);
        }
    }
}
