package tokenwarden.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.quarkiverse.resteasy.problem.HttpProblem;

import tokenwarden.core.exception.AccountNotFoundException;
import tokenwarden.core.exception.StaleAccountException;
import tokenwarden.spi.StorageProviderException;

@DisplayName("CredentialExceptionMappers")
class CredentialExceptionMappersTest {

    private CredentialExceptionMappers mappers;

    @BeforeEach
    void setUp() {
        mappers = new CredentialExceptionMappers();
    }

    @Test
    @DisplayName("should render credential errors as problem+json")
    void shouldRenderCredentialErrors() {
        final var response = mappers.mapCredentialException(new AccountNotFoundException("a"));

        assertEquals(404, response.getStatus());
        assertEquals("application/problem+json", response.getMediaType().toString());
        assertInstanceOf(HttpProblem.class, response.getEntity());
    }

    @Test
    @DisplayName("should map illegal arguments to 400")
    void shouldMapIllegalArgument() {
        final var response = mappers.mapIllegalArgumentException(new IllegalArgumentException("Unknown provider"));

        assertEquals(400, response.getStatus());
        assertEquals("Unknown provider", ((HttpProblem) response.getEntity()).getDetail());
    }

    @Test
    @DisplayName("should map lost update races to 409")
    void shouldMapStaleAccount() {
        assertEquals(409, mappers.mapStaleAccountException(new StaleAccountException("a", 3)).getStatus());
    }

    @Test
    @DisplayName("should hide storage failure details behind 503")
    void shouldMapStorageFailure() {
        final var response = mappers.mapStorageProviderException(new StorageProviderException("pool exhausted"));

        assertEquals(503, response.getStatus());
        assertEquals("Storage is unavailable", ((HttpProblem) response.getEntity()).getDetail());
    }
}
