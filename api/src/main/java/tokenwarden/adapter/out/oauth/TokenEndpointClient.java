package tokenwarden.adapter.out.oauth;

import java.util.Map;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.core.net.ProxyOptions;
import io.vertx.core.net.ProxyType;
import io.vertx.mutiny.core.MultiMap;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import tokenwarden.core.config.OAuthProvidersConfig;
import tokenwarden.core.model.account.ProxyConfig;
import tokenwarden.spi.TokenEndpointException;

/**
 * HTTP client shared by the OAuth provider adapters for token endpoint calls.
 *
 * <p>Every request is routed through the account's proxy when one is set and is
 * bounded by {@code tokenwarden.providers.request-timeout}. Non-2xx responses and
 * transport failures both surface as {@link TokenEndpointException}; the latter
 * with status 0.
 */
@ApplicationScoped
public class TokenEndpointClient {

    private static final Logger LOG = Logger.getLogger(TokenEndpointClient.class);
    private static final int MAX_LOGGED_BODY = 512;

    private final WebClient webClient;
    private final OAuthProvidersConfig config;

    @Inject
    public TokenEndpointClient(Vertx vertx, OAuthProvidersConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    /**
     * POST a JSON body to a token endpoint.
     *
     * @param url     token endpoint
     * @param body    request body
     * @param headers extra headers
     * @param proxy   proxy, may be null
     * @return the parsed JSON response
     */
    public Uni<JsonObject> postJson(String url, JsonObject body, Map<String, String> headers, ProxyConfig proxy) {
        return send(url, headers, proxy, request -> request.putHeader("Content-Type", "application/json")
                .sendJsonObject(body));
    }

    /**
     * POST an {@code application/x-www-form-urlencoded} body to a token endpoint.
     *
     * @param url     token endpoint
     * @param form    form fields
     * @param headers extra headers
     * @param proxy   proxy, may be null
     * @return the parsed JSON response
     */
    public Uni<JsonObject> postForm(String url, Map<String, String> form, Map<String, String> headers, ProxyConfig proxy) {
        final var fields = MultiMap.caseInsensitiveMultiMap();
        form.forEach(fields::add);
        return send(url, headers, proxy, request -> request.sendForm(fields));
    }

    private Uni<JsonObject> send(
            String url,
            Map<String, String> headers,
            ProxyConfig proxy,
            Function<HttpRequest<Buffer>, Uni<HttpResponse<Buffer>>> sender) {
        var request = webClient
                .postAbs(url)
                .timeout(config.requestTimeout().toMillis())
                .putHeader("Accept", "application/json");
        for (var header : headers.entrySet()) {
            request = request.putHeader(header.getKey(), header.getValue());
        }
        if (proxy != null) {
            request = request.proxy(toProxyOptions(proxy));
            LOG.debugf("Calling token endpoint %s via proxy %s", url, proxy);
        } else {
            LOG.debugf("Calling token endpoint %s", url);
        }

        final var prepared = request;
        return Uni.createFrom()
                .deferred(() -> sender.apply(prepared))
                .onFailure(error -> !(error instanceof TokenEndpointException))
                .transform(error -> new TokenEndpointException("Token endpoint unreachable: " + error.getMessage(), error))
                .flatMap(this::parseResponse);
    }

    private Uni<JsonObject> parseResponse(HttpResponse<Buffer> response) {
        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            final var error = parseError(status, response.bodyAsString());
            LOG.warnf("Token endpoint returned HTTP %d (%s)", status, error.getError());
            return Uni.createFrom().failure(error);
        }
        try {
            final var json = response.bodyAsJsonObject();
            if (json == null) {
                return Uni.createFrom().failure(new TokenEndpointException(status, "invalid_response", "Empty response body"));
            }
            return Uni.createFrom().item(json);
        } catch (DecodeException e) {
            return Uni.createFrom()
                    .failure(new TokenEndpointException(status, "invalid_response", "Response body is not JSON"));
        }
    }

    /**
     * Extract the OAuth error from a failed response. Handles both the RFC 6749
     * shape ({@code error}, {@code error_description}) and nested error objects.
     */
    static TokenEndpointException parseError(int status, String body) {
        if (body == null || body.isBlank()) {
            return new TokenEndpointException(status, null, null);
        }
        try {
            final var json = new JsonObject(body);
            final var error = json.getValue("error");
            if (error instanceof JsonObject nested) {
                return new TokenEndpointException(status, nested.getString("type"), nested.getString("message"));
            }
            return new TokenEndpointException(
                    status, error != null ? error.toString() : null, json.getString("error_description"));
        } catch (DecodeException | ClassCastException e) {
            return new TokenEndpointException(status, null, truncate(body));
        }
    }

    private static ProxyOptions toProxyOptions(ProxyConfig proxy) {
        final var options = new ProxyOptions()
                .setType(proxy.socks() ? ProxyType.SOCKS5 : ProxyType.HTTP)
                .setHost(proxy.host())
                .setPort(proxy.port());
        if (proxy.hasCredentials()) {
            options.setUsername(proxy.username());
            if (proxy.password() != null) {
                options.setPassword(proxy.password());
            }
        }
        return options;
    }

    private static String truncate(String body) {
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
