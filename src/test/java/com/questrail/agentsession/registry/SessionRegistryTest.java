package com.questrail.agentsession.registry;

import com.questrail.agentsession.api.Provider;
import com.questrail.agentsession.api.SessionMetadata;
import com.questrail.agentsession.api.SessionRoutingException;
import com.questrail.agentsession.api.SessionSummary;
import com.questrail.agentsession.config.SessionCoreConfig;
import com.questrail.agentsession.internal.events.ClientCommand;
import com.questrail.agentsession.internal.events.RuntimeEvent;
import com.questrail.agentsession.internal.exec.DefaultEffectExecutor;
import com.questrail.agentsession.internal.exec.SessionActor;
import com.questrail.agentsession.internal.exec.SubscribeResult;
import com.questrail.agentsession.internal.log.EventLog;
import com.questrail.agentsession.internal.log.Fanout;
import com.questrail.agentsession.internal.log.SessionEventChannel;
import com.questrail.agentsession.internal.log.SessionEventCodec;
import com.questrail.agentsession.internal.log.Subscription;
import com.questrail.agentsession.internal.state.SessionState;
import com.questrail.agentsession.internal.state.SessionTransition;
import com.questrail.agentsession.internal.state.WorkPhase;
import com.questrail.agentsession.observability.NullObservabilitySink;
import com.questrail.agentsession.runtime.RecordingRuntimeConnector;
import com.questrail.agentsession.time.SteppingWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionRegistryTest
 * -----------------------------------------------------------------------------
 * Routing, listing and concurrent access through the registry, using real
 * session actors.
 */
class SessionRegistryTest
{

    private final SessionTransition transition = new SessionTransition();
    private final SessionEventCodec codec = new SessionEventCodec();
    private final RecordingRuntimeConnector connector = new RecordingRuntimeConnector();
    private final SessionRegistry registry = new SessionRegistry(64);
    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        registry.close();
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private SessionActor actor(String id, Instant startedAt, Executor executor, SessionCoreConfig config) {
        SessionState initial = SessionState.created(id, SessionMetadata.of(Provider.CLAUDE, "/work/" + id, startedAt));
        SessionEventChannel channel = new SessionEventChannel(id, codec,
                new EventLog(config.eventLogCapacity()), new Fanout<>(config.subscriberBufferSize(), sub -> { }));
        return new SessionActor(initial, transition,
                new DefaultEffectExecutor(write -> true, connector, channel),
                channel, executor, config, SteppingWallClock.fixed(), NullObservabilitySink.INSTANCE);
    }

    private SessionActor inlineActor(String id) {
        return actor(id, SteppingWallClock.EPOCH, Runnable::run, SessionCoreConfig.defaults());
    }

    // ---------------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------------

    @Test
    void unknownSessionIsNotFound() {
        SessionRoutingException e = assertThrows(SessionRoutingException.class,
                () -> registry.send("missing", new ClientCommand.UserInterrupted()));

        assertEquals(SessionRoutingException.Reason.NOT_FOUND, e.reason());
        assertEquals("missing", e.sessionId());
        assertThrows(SessionRoutingException.class, () -> registry.snapshot("missing"));
        assertThrows(SessionRoutingException.class, () -> registry.subscribe("missing", 0));
    }

    @Test
    void sendReachesTheSession() throws Exception {
        registry.register(inlineActor("s-1"));

        registry.send("s-1", ClientCommand.UserSentMessage.of("hello"));

        assertInstanceOf(WorkPhase.Working.class, registry.snapshot("s-1").phase());
        assertEquals("s-1", connector.sent().get(0).sessionId());
    }

    @Test
    void endedSessionRejectsEverythingButResume() throws Exception {
        registry.register(inlineActor("s-1"));
        registry.send("s-1", new ClientCommand.UserEnded());
        assertTrue(registry.snapshot("s-1").isEnded());

        SessionRoutingException e = assertThrows(SessionRoutingException.class,
                () -> registry.send("s-1", ClientCommand.UserSentMessage.of("still there?")));
        assertEquals(SessionRoutingException.Reason.ENDED, e.reason());

        registry.send("s-1", new ClientCommand.Resume());
        assertInstanceOf(WorkPhase.Idle.class, registry.snapshot("s-1").phase());
    }

    @Test
    void fullInboxIsBusy() throws Exception {
        List<Runnable> parked = new ArrayList<>();
        SessionCoreConfig config = SessionCoreConfig.builder().withInboxCapacity(1).build();
        registry.register(actor("s-1", SteppingWallClock.EPOCH, parked::add, config));

        registry.send("s-1", new RuntimeEvent.PlanUpdated("a"));
        SessionRoutingException e = assertThrows(SessionRoutingException.class,
                () -> registry.send("s-1", new RuntimeEvent.PlanUpdated("b")));

        assertEquals(SessionRoutingException.Reason.BUSY, e.reason());
    }

    @Test
    void stoppedSessionIsClosed() throws Exception {
        SessionActor actor = inlineActor("s-1");
        registry.register(actor);
        actor.stop().get(1, TimeUnit.SECONDS);

        SessionRoutingException e = assertThrows(SessionRoutingException.class,
                () -> registry.send("s-1", new ClientCommand.UserInterrupted()));
        assertEquals(SessionRoutingException.Reason.CLOSED, e.reason());
    }

    @Test
    void subscribeGoesThroughTheActor() throws Exception {
        registry.register(inlineActor("s-1"));
        registry.send("s-1", new ClientCommand.UserRenamed("first"));

        SubscribeResult result = registry.subscribe("s-1", 0).get(1, TimeUnit.SECONDS);

        SubscribeResult.Replay replay = assertInstanceOf(SubscribeResult.Replay.class, result);
        assertEquals(1, replay.events().size());
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    @Test
    void duplicateRegistrationIsRejected() {
        registry.register(inlineActor("s-1"));

        assertThrows(IllegalStateException.class, () -> registry.register(inlineActor("s-1")));
        assertEquals(1, registry.size());
    }

    @Test
    void removeOnlyMatchingHandle() {
        SessionActor original = inlineActor("s-1");
        registry.register(original);

        assertFalse(registry.remove("s-1", inlineActor("s-1")));
        assertTrue(registry.contains("s-1"));

        assertTrue(registry.remove("s-1", original));
        assertFalse(registry.contains("s-1"));
        assertTrue(registry.remove("s-1").isEmpty());
    }

    @Test
    void listIsOrderedByStartTime() {
        registry.register(actor("late", SteppingWallClock.EPOCH.plusSeconds(20), Runnable::run, SessionCoreConfig.defaults()));
        registry.register(actor("early", SteppingWallClock.EPOCH, Runnable::run, SessionCoreConfig.defaults()));
        registry.register(actor("middle", SteppingWallClock.EPOCH.plusSeconds(10), Runnable::run, SessionCoreConfig.defaults()));

        List<String> ids = registry.list().stream().map(SessionSummary::id).toList();

        assertEquals(List.of("early", "middle", "late"), ids);
    }

    @Test
    void listSubscriptionSeesCurrentAndLaterChanges() {
        registry.register(inlineActor("s-1"));

        ListSubscription subscription = registry.subscribeList();
        assertEquals(1, subscription.sessions().size());

        registry.register(inlineActor("s-2"));
        registry.remove("s-1");

        List<SessionListEvent> events = subscription.live().drain();
        assertEquals(2, events.size());
        SessionListEvent.Registered registered = assertInstanceOf(SessionListEvent.Registered.class, events.get(0));
        assertEquals("s-2", registered.sessionId());
        assertEquals(new SessionListEvent.Removed("s-1"), events.get(1));
    }

    @Test
    void listEventsReplayToTheRegistryContentsUnderChurn() throws Exception {
        SessionRegistry churned = new SessionRegistry(100_000);
        int rounds = 300;
        AtomicBoolean registering = new AtomicBoolean(true);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger failures = new AtomicInteger();

        Thread registrar = new Thread(() -> {
            try {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    churned.register(inlineActor("shared-" + i));
                    if (i % 10 == 0) {
                        churned.register(inlineActor("kept-" + i));
                    }
                }
            } catch (Exception e) {
                failures.incrementAndGet();
            } finally {
                registering.set(false);
            }
        });
        Thread remover = new Thread(() -> {
            try {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    while (churned.remove("shared-" + i).isEmpty() && registering.get()) {
                        Thread.onSpinWait();
                    }
                }
            } catch (Exception e) {
                failures.incrementAndGet();
            }
        });
        registrar.start();
        remover.start();

        List<ListSubscription> subscriptions = new ArrayList<>();
        start.countDown();
        while (registrar.isAlive()) {
            subscriptions.add(churned.subscribeList());
            Thread.sleep(1);
        }
        registrar.join(5_000);
        remover.join(5_000);
        assertEquals(0, failures.get());

        Set<String> expected = new TreeSet<>();
        churned.list().forEach(summary -> expected.add(summary.id()));
        for (ListSubscription subscription : subscriptions) {
            Set<String> replayed = new TreeSet<>();
            subscription.sessions().forEach(summary -> replayed.add(summary.id()));
            for (SessionListEvent event : subscription.live().drain()) {
                if (event instanceof SessionListEvent.Registered) {
                    assertTrue(replayed.add(event.sessionId()), "registered twice: " + event.sessionId());
                } else {
                    assertTrue(replayed.remove(event.sessionId()), "removed while absent: " + event.sessionId());
                }
            }
            assertEquals(expected, replayed);
        }
        churned.close();
    }

    @Test
    void closeEndsListSubscriptions() {
        ListSubscription subscription = registry.subscribeList();

        registry.close();

        assertEquals(Subscription.State.ENDED, subscription.live().state());
    }

    // ---------------------------------------------------------------------
    // Concurrency
    // ---------------------------------------------------------------------

    @Test
    void concurrentSendsAndRegistrationsStayConsistent() throws Exception {
        pool = Executors.newFixedThreadPool(4);
        int sessions = 32;
        int sendsPerSession = 50;
        List<SessionActor> actors = new ArrayList<>();
        for (int i = 0; i < sessions; i++) {
            SessionActor actor = actor("s-" + i, SteppingWallClock.EPOCH.plusSeconds(i), pool,
                    SessionCoreConfig.builder().withInboxCapacity(sendsPerSession * 2).build());
            actors.add(actor);
            registry.register(actor);
        }

        int senders = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(senders + 1);
        AtomicInteger failures = new AtomicInteger();

        for (int t = 0; t < senders; t++) {
            int offset = t;
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = offset; i < sessions; i += senders) {
                        for (int n = 0; n < sendsPerSession; n++) {
                            registry.send("s-" + i, new ClientCommand.UserRenamed("name-" + n));
                        }
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        // Churn unrelated sessions while the senders run
        new Thread(() -> {
            try {
                start.await();
                for (int i = 0; i < 200; i++) {
                    SessionActor extra = actor("extra-" + i, SteppingWallClock.EPOCH, pool, SessionCoreConfig.defaults());
                    registry.register(extra);
                    registry.list();
                    registry.remove("extra-" + i, extra);
                }
            } catch (Exception e) {
                failures.incrementAndGet();
            } finally {
                done.countDown();
            }
        }).start();

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(0, failures.get());

        for (SessionActor actor : actors) {
            SessionState last = actor.stop().get(5, TimeUnit.SECONDS);
            assertEquals(sendsPerSession, last.revision(), "session " + last.id());
            assertEquals("name-" + (sendsPerSession - 1), last.metadata().customName());
        }
        assertEquals(sessions, registry.size());
    }
}
