package tokenwarden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tokenwarden.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;
import tokenwarden.core.port.out.CredentialMetrics;

@DisplayName("RedisTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String REPOSITORY_NAME = "oauth-session";
    private static final String OPERATION_NAME = "take";

    @Mock
    private CredentialMetrics metrics;

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, metrics, REPOSITORY_NAME);
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResult() {
            final var result = helper.withTimeout(Uni.createFrom().item("value"), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertEquals("value", result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should fail with RedisTimeoutException when operation times out")
        void shouldFailOnTimeout() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    RedisTimeoutException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(OPERATION_NAME, exception.getOperation());
            assertEquals(REPOSITORY_NAME, exception.getRepository());
            verify(metrics).recordStorageTimeout(REPOSITORY_NAME, OPERATION_NAME);
        }

        @Test
        @DisplayName("should propagate other failures and count them")
        void shouldPropagateFailures() {
            final var operation = Uni.createFrom().<String>failure(new IllegalStateException("Connection refused"));

            final var exception = assertThrows(
                    IllegalStateException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals("Connection refused", exception.getMessage());
            verify(metrics).recordStorageFailure(REPOSITORY_NAME, OPERATION_NAME);
        }
    }

    @Nested
    @DisplayName("withTimeoutSilent()")
    class WithTimeoutSilentTests {

        @Test
        @DisplayName("should complete normally when operation completes within timeout")
        void shouldComplete() {
            final var ran = new AtomicBoolean();
            final Uni<Void> operation = Uni.createFrom().item(() -> {
                ran.set(true);
                return null;
            });

            helper.withTimeoutSilent(operation, "delete").await().indefinitely();

            assertTrue(ran.get());
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should swallow a timeout")
        void shouldSwallowTimeout() {
            helper.withTimeoutSilent(Uni.createFrom().nothing(), "delete").await().indefinitely();

            verify(metrics).recordStorageTimeout(REPOSITORY_NAME, "delete");
        }

        @Test
        @DisplayName("should swallow a failure")
        void shouldSwallowFailure() {
            helper.withTimeoutSilent(Uni.createFrom().failure(new RuntimeException("boom")), "delete")
                    .await()
                    .indefinitely();

            verify(metrics).recordStorageFailure(REPOSITORY_NAME, "delete");
        }
    }

    @Test
    @DisplayName("should tolerate a missing metrics sink")
    void shouldTolerateMissingMetrics() {
        final var withoutMetrics = new RedisTimeoutHelper(TIMEOUT, null, REPOSITORY_NAME);

        assertThrows(
                RedisTimeoutException.class,
                () -> withoutMetrics.withTimeout(Uni.createFrom().nothing(), OPERATION_NAME).await().indefinitely());
    }
}
