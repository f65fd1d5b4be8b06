package paperless.exception;

/**
 * Výjimka pro stránkovanou odpověď, ze které nelze odvodit další požadavek
 * Celé volání list() selže a dosud načtené stránky se zahodí
 */
public class MalformedPaginationEnvelopeException extends PaperlessException {

    private static final String ERROR_CODE = "MALFORMED_PAGINATION_ENVELOPE";

    /**
     * @param message chybová zpráva
     * @param next    hodnota pole "next" (může být null)
     */
    public MalformedPaginationEnvelopeException(String message, String next) {
        super(message, next != null ? "next: " + next : null, ERROR_CODE, next);
    }

    public MalformedPaginationEnvelopeException(String message, String next, Throwable cause) {
        super(message, next != null ? "next: " + next : null, ERROR_CODE, next, cause);
    }
}
