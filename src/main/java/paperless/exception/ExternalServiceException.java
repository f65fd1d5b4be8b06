package paperless.exception;

/**
 * Výjimka pro chyby při komunikaci s Paperless API
 * Používá se když API vrátí chybu nebo není dostupné ani po opakování
 */
public class ExternalServiceException extends PaperlessException {

    private static final String ERROR_CODE = "EXTERNAL_SERVICE_ERROR";

    /**
     * HTTP status kód vrácený API (null pokud odpověď vůbec nepřišla)
     */
    private final Integer externalStatusCode;

    /**
     * Konstruktor s plnou specifikací
     *
     * @param message            uživatelsky přívětivá zpráva
     * @param externalStatusCode HTTP status vrácený API
     * @param resourcePath       cesta volaného resource
     * @param detailMessage      detaily pro debugging (např. tělo chybové odpovědi)
     * @param cause              původní výjimka
     */
    public ExternalServiceException(
            String message,
            Integer externalStatusCode,
            String resourcePath,
            String detailMessage,
            Throwable cause) {
        super(message, detailMessage, ERROR_CODE, resourcePath, cause);
        this.externalStatusCode = externalStatusCode;
    }

    /**
     * Konstruktor pro chybovou odpověď bez původní výjimky
     */
    public ExternalServiceException(String message, Integer externalStatusCode, String resourcePath, String detailMessage) {
        this(message, externalStatusCode, resourcePath, detailMessage, null);
    }

    public Integer getExternalStatusCode() {
        return externalStatusCode;
    }
}
