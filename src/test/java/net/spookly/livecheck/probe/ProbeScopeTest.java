package net.spookly.livecheck.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class ProbeScopeTest {
    @Test
    void cancellingParentCancelsChildren() {
        ProbeScope root = ProbeScope.root();
        ProbeScope child = root.child();
        ProbeScope grandChild = child.child();

        root.cancel();

        assertTrue(child.isCancelled());
        assertTrue(grandChild.isCancelled());
    }

    @Test
    void cancellingChildLeavesParentRunning() {
        ProbeScope root = ProbeScope.root();
        ProbeScope first = root.child();
        ProbeScope second = root.child();

        first.cancel();

        assertTrue(first.isCancelled());
        assertFalse(root.isCancelled());
        assertFalse(second.isCancelled());
    }

    @Test
    void listenersRunOnceAndLateListenersRunImmediately() {
        ProbeScope scope = ProbeScope.root();
        AtomicInteger calls = new AtomicInteger();
        scope.onCancel(calls::incrementAndGet);

        scope.cancel();
        scope.cancel();
        assertEquals(1, calls.get());

        scope.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());
    }

    @Test
    void removedListenerDoesNotRun() {
        ProbeScope scope = ProbeScope.root();
        AtomicInteger calls = new AtomicInteger();
        ProbeScope.Registration registration = scope.onCancel(calls::incrementAndGet);

        registration.remove();
        scope.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        ProbeScope scope = ProbeScope.root();
        AtomicInteger calls = new AtomicInteger();
        scope.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        scope.onCancel(calls::incrementAndGet);

        scope.cancel();

        assertTrue(scope.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void childOfCancelledScopeStartsCancelled() {
        ProbeScope root = ProbeScope.root();
        root.cancel();

        assertTrue(root.child().isCancelled());
        assertTrue(root.withTimeout(Duration.ofSeconds(5)).isCancelled());
    }

    @Test
    void timeoutCancelsScope() {
        ProbeScope scope = ProbeScope.root().withTimeout(Duration.ofMillis(50));

        assertTrue(scope.awaitCancellation(Duration.ofSeconds(5)));
    }

    @Test
    void endedScopesDropTheirDeadlines() {
        int before = ProbeScope.pendingDeadlines();
        List<ProbeScope> scopes = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            scopes.add(ProbeScope.root().withTimeout(Duration.ofHours(1)));
        }
        assertTrue(ProbeScope.pendingDeadlines() >= before + 100);

        for (ProbeScope scope : scopes) {
            scope.cancel();
        }

        assertTrue(ProbeScope.pendingDeadlines() <= before);
    }

    @Test
    void awaitReturnsFalseWhenStillRunning() {
        ProbeScope scope = ProbeScope.root();

        long start = System.nanoTime();
        assertFalse(scope.awaitCancellation(Duration.ofMillis(50)));
        assertTrue(System.nanoTime() - start >= Duration.ofMillis(40).toNanos());
        assertFalse(scope.awaitCancellation(Duration.ofMillis(-5)));
    }

    @Test
    void interruptCancelsWaitingScope() {
        ProbeScope scope = ProbeScope.root();
        Thread.currentThread().interrupt();
        try {
            assertTrue(scope.awaitCancellation(Duration.ofSeconds(5)));
            assertTrue(scope.isCancelled());
        } finally {
            Thread.interrupted();
        }
    }
}
