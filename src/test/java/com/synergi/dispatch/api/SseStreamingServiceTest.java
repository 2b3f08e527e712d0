package com.synergi.dispatch.api;

import com.synergi.core.events.EventBus;
import com.synergi.core.events.SynergiEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    // -- Emitter creation tests -----------------------------------------------

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("each task emitter owns one bus subscription")
        void subscribesPerEmitter() {
            SseEmitter first = service.createEmitter("SYN-1");
            SseEmitter second = service.createEmitter("SYN-1");

            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
            assertEquals(2, eventBus.subscriberCount());
        }

        @Test
        @DisplayName("publishing to a task with open emitters does not throw")
        void forwardsEvents() {
            service.createEmitter("SYN-1");
            service.createEmitter("SYN-2");

            assertDoesNotThrow(() -> eventBus.publish(SynergiEvent.of(SynergiEvent.STEP, "SYN-1", 0,
                    Map.of("phase", "started", "capability", "math"))));
            assertEquals(2, service.activeEmitterCount());
        }
    }

    // -- Global stream tests --------------------------------------------------

    @Nested
    @DisplayName("createGlobalEmitter")
    class GlobalEmitterTests {

        @Test
        @DisplayName("reconnecting with the same client id replaces the previous stream")
        void reconnectReplaces() {
            service.createGlobalEmitter("dashboard");
            service.createGlobalEmitter("dashboard");

            assertEquals(1, service.activeEmitterCount());
            assertEquals(1, eventBus.subscriberCount());
        }

        @Test
        @DisplayName("different clients get their own streams")
        void separateClients() {
            service.createGlobalEmitter("a");
            service.createGlobalEmitter("b");

            assertEquals(2, service.activeEmitterCount());
        }
    }

    // -- Cleanup tests --------------------------------------------------------

    @Nested
    @DisplayName("cleanup")
    class CleanupTests {

        @Test
        @DisplayName("shutdown closes every stream and removes its subscription")
        void shutdownClosesAll() {
            service.createEmitter("SYN-1");
            service.createGlobalEmitter("cli-watch");

            service.stopHeartbeat();

            assertEquals(0, service.activeEmitterCount());
            assertEquals(0, eventBus.subscriberCount());
        }

        @Test
        @DisplayName("heartbeats on open emitters do not drop them")
        void heartbeats() {
            service.createEmitter("SYN-1");

            service.sendHeartbeats();

            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("short timeout service still registers emitters")
        void shortTimeout() {
            SseStreamingService shortTimeout = new SseStreamingService(eventBus, 100L);
            assertNotNull(shortTimeout.createEmitter("SYN-1"));
            assertEquals(1, shortTimeout.activeEmitterCount());
        }
    }

    // -- Concurrent publish tests ---------------------------------------------

    @Test
    @DisplayName("concurrent event publishing does not throw")
    void concurrentPublish() throws InterruptedException {
        service.createEmitter("SYN-1");
        service.createGlobalEmitter("watcher");

        int threads = 5;
        CountDownLatch latch = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            final int threadId = t;
            new Thread(() -> {
                for (int i = 0; i < 20; i++) {
                    eventBus.publish(SynergiEvent.of(SynergiEvent.PAYMENT, "SYN-1", i,
                            Map.of("worker", "w" + threadId)));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
