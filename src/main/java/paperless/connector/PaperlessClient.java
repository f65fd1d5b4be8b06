package paperless.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import paperless.exception.ExternalServiceException;
import paperless.exception.RateLimitException;
import paperless.exception.ResourceNotFoundException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Blokující HTTP klient pro Paperless Parts API postavený nad WebClientem.
 * <p>
 * 5xx odpovědi, chyby spojení a timeouty se opakují s exponenciálním backoffem, ostatní chyby
 * se převedou na výjimky konektoru hned: 404 na {@link ResourceNotFoundException}, 429 na
 * {@link RateLimitException}, zbytek 4xx na {@link ExternalServiceException}.
 */
@Slf4j
public class PaperlessClient implements PaperlessTransport {

    private static final String USER_AGENT = "Paperless-Connector/1.0";
    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");

    private final WebClient webClient;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Duration timeout;

    public PaperlessClient(WebClient.Builder webClientBuilder,
                           ObjectMapper objectMapper,
                           String baseUrl,
                           String apiToken,
                           int maxAttempts,
                           Duration retryDelay,
                           Duration timeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts musí být alespoň 1");
        }
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeaders(headers -> {
                    headers.add(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
                    headers.add(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
                    headers.add(HttpHeaders.USER_AGENT, USER_AGENT);
                    if (apiToken != null && !apiToken.isBlank()) {
                        headers.add(HttpHeaders.AUTHORIZATION, "API-Token " + apiToken);
                    } else {
                        log.warn("Chybí API token pro Paperless API, volání pravděpodobně selžou.");
                    }
                })
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                })
                .build();
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
        this.timeout = timeout;
    }

    @Override
    public JsonNode getResource(String url, Map<String, ?> params) {
        return exchange(HttpMethod.GET, url, params, null).block();
    }

    @Override
    public JsonNode getResourceList(String url, Map<String, ?> params) {
        return exchange(HttpMethod.GET, url, params, null).block();
    }

    @Override
    public JsonNode createResource(String url, JsonNode data) {
        return exchange(HttpMethod.POST, url, null, data).block();
    }

    @Override
    public JsonNode updateResource(String url, Object primaryKey, JsonNode data, Map<String, ?> params) {
        return exchange(HttpMethod.PATCH, url + "/" + primaryKey, params, data).block();
    }

    @Override
    public JsonNode request(String url, HttpMethod method, JsonNode data, Map<String, ?> params) {
        return exchange(method, url, params, data).block();
    }

    /**
     * Jedno volání API včetně opakování. Prázdné tělo odpovědi se vrátí jako JSON null.
     */
    public Mono<JsonNode> exchange(HttpMethod method, String url, Map<String, ?> params, JsonNode body) {
        String path = "/" + (url.startsWith("/") ? url.substring(1) : url);
        log.debug("Volání Paperless API: {} {}", method, path);

        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(builder -> buildUri(builder, path, params));
        WebClient.RequestHeadersSpec<?> ready = body != null ? request.bodyValue(body) : request;

        return ready.retrieve()
                // Převod 4xx chyb (které se neopakují) na výjimky konektoru
                .onStatus(status -> status.value() == 404, response -> readBody(response)
                        .map(responseBody -> new ResourceNotFoundException(path, responseBody)))
                .onStatus(status -> status.value() == 429, response -> readBody(response)
                        .map(responseBody -> new RateLimitException(path, retryAfterSeconds(response))))
                .onStatus(HttpStatusCode::is4xxClientError, response -> readBody(response)
                        .map(responseBody -> new ExternalServiceException(
                                String.format("4xx chyba od Paperless API (%d)", response.statusCode().value()),
                                response.statusCode().value(), path, responseBody)))
                // 5xx chyby zůstanou jako WebClientResponseException, aby je zachytil retry
                .onStatus(HttpStatusCode::is5xxServerError, response -> readBody(response)
                        .map(responseBody -> WebClientResponseException.create(
                                response.statusCode().value(),
                                "Paperless API selhalo.",
                                response.headers().asHttpHeaders(),
                                responseBody.getBytes(StandardCharsets.UTF_8),
                                StandardCharsets.UTF_8)))
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(NullNode.getInstance())
                .timeout(timeout)
                .retryWhen(Retry.backoff(maxAttempts - 1L, retryDelay)
                        .filter(PaperlessClient::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Opakuji volání {} {} (pokus {}): {}",
                                method, path, signal.totalRetries() + 2, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> {
                            log.error("Volání {} {} selhalo po všech pokusech: {}",
                                    method, path, signal.failure().getMessage());
                            return new ExternalServiceException(
                                    String.format("Paperless API není dostupné po %d pokusech", maxAttempts),
                                    statusOf(signal.failure()),
                                    path,
                                    signal.failure().getMessage(),
                                    signal.failure());
                        }))
                .doOnSuccess(response -> log.debug("Paperless API: úspěšná odpověď pro {} {}", method, path));
    }

    private static URI buildUri(UriBuilder builder, String path, Map<String, ?> params) {
        builder.path(path);
        Map<String, Object> variables = new HashMap<>();
        if (params != null) {
            params.forEach((key, value) -> {
                if (value instanceof Iterable) {
                    for (Object item : (Iterable<?>) value) {
                        addQueryParam(builder, variables, key, item);
                    }
                } else {
                    addQueryParam(builder, variables, key, value);
                }
            });
        }
        return builder.build(variables);
    }

    // Hodnoty jdou přes URI proměnné, aby se striktně zakódovaly i znaky jako & a =
    private static void addQueryParam(UriBuilder builder, Map<String, Object> variables, String key, Object value) {
        if (value == null) {
            return;
        }
        String variable = "p" + variables.size();
        builder.queryParam(key, "{" + variable + "}");
        variables.put(variable, String.valueOf(value));
    }

    private static Mono<String> readBody(ClientResponse response) {
        return response.bodyToMono(String.class).defaultIfEmpty("");
    }

    private static Long retryAfterSeconds(ClientResponse response) {
        String retryAfter = response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        if (retryAfter == null || !DIGITS.matcher(retryAfter.trim()).matches()) {
            return null;
        }
        return Long.valueOf(retryAfter.trim());
    }

    private static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            return ((WebClientResponseException) throwable).getStatusCode().is5xxServerError();
        }
        return throwable instanceof WebClientRequestException || throwable instanceof TimeoutException;
    }

    private static Integer statusOf(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            return ((WebClientResponseException) throwable).getStatusCode().value();
        }
        return null;
    }
}
