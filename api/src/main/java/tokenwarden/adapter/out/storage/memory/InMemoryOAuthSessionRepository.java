package tokenwarden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.port.out.OAuthSessionRepository;

/**
 * In-memory implementation of authorization session storage.
 *
 * <p>Intended for development and single-instance deployments. Sessions are lost
 * on restart and not shared across instances. {@link #take} relies on
 * {@link ConcurrentMap#remove(Object)}, so only one caller ever sees a session.
 */
public class InMemoryOAuthSessionRepository implements OAuthSessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryOAuthSessionRepository.class);

    private final ConcurrentMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;
    private final Clock clock;

    public InMemoryOAuthSessionRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryOAuthSessionRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "oauth-session-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory OAuth session repository");
    }

    @Override
    public Uni<Void> store(OAuthSession session, Duration ttl) {
        return Uni.createFrom().item(() -> {
            sessions.put(session.sessionId(), new SessionEntry(session, clock.instant().plus(ttl)));
            LOG.debugf("Stored OAuth session %s with TTL %s", session.sessionId(), ttl);
            return null;
        });
    }

    @Override
    public Uni<Optional<OAuthSession>> find(String sessionId) {
        return Uni.createFrom().item(() -> live(sessions.get(sessionId)));
    }

    @Override
    public Uni<Optional<OAuthSession>> take(String sessionId) {
        return Uni.createFrom().item(() -> {
            final var taken = live(sessions.remove(sessionId));
            LOG.debugf("Take of OAuth session %s: %s", sessionId, taken.isPresent() ? "consumed" : "absent");
            return taken;
        });
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        return Uni.createFrom().item(() -> {
            sessions.remove(sessionId);
            return null;
        });
    }

    private Optional<OAuthSession> live(SessionEntry entry) {
        if (entry == null || !clock.instant().isBefore(entry.evictAt())) {
            return Optional.empty();
        }
        return Optional.of(entry.session());
    }

    void cleanupExpired() {
        final Instant now = clock.instant();
        final int before = sessions.size();
        sessions.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().evictAt()));
        final int removed = before - sessions.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired OAuth sessions", removed);
        }
    }

    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private record SessionEntry(OAuthSession session, Instant evictAt) {}
}
