package paperless.exception;

/**
 * Výjimka pro data, která neodpovídají deklaraci resource
 * Používá se když validátor pole selže nebo je objekt v nekonzistentním stavu
 */
public class ValidationException extends PaperlessException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    /**
     * Konstruktor s chybovou zprávou
     *
     * @param message popis validační chyby
     */
    public ValidationException(String message) {
        super(message, ERROR_CODE);
    }

    /**
     * Konstruktor s cestou k poli
     *
     * @param message   chybová zpráva
     * @param fieldPath cesta k poli (např. order_items[0].components[2].id)
     * @param detailMessage detaily pro debugging
     */
    public ValidationException(String message, String fieldPath, String detailMessage) {
        super(message, detailMessage, ERROR_CODE, fieldPath);
    }

    protected ValidationException(String message, String fieldPath, String detailMessage, String errorCode) {
        super(message, detailMessage, errorCode, fieldPath);
    }

    /**
     * Cesta k poli, kterého se chyba týká (může být null)
     */
    public String getFieldPath() {
        return getReferenceId();
    }
}
