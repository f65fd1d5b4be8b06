package paperless.exception;

/**
 * Výjimka pro případy kdy API odmítne požadavek kvůli rate limitu (HTTP 429)
 */
public class RateLimitException extends PaperlessException {

    private static final String ERROR_CODE = "RATE_LIMIT_EXCEEDED";

    /**
     * Doba v sekundách za jak dlouho lze zkusit znovu (null pokud ji API neuvedlo)
     */
    private final Long retryAfterSeconds;

    /**
     * Konstruktor s retry-after časem
     *
     * @param resourcePath      cesta volaného resource
     * @param retryAfterSeconds doba do dalšího pokusu v sekundách
     */
    public RateLimitException(String resourcePath, Long retryAfterSeconds) {
        super(
                String.format("Překročen rate limit Paperless API pro '%s'", resourcePath),
                retryAfterSeconds != null
                        ? String.format("Rate limit exceeded. Retry after %d seconds", retryAfterSeconds)
                        : "Rate limit exceeded",
                ERROR_CODE,
                resourcePath);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
