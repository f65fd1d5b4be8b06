package paperless.exception;

import lombok.Getter;

/**
 * Abstraktní základní třída pro všechny výjimky konektoru
 * Poskytuje společnou funkcionalitu jako error code, reference ID a detailní zprávu
 */
@Getter
public abstract class PaperlessException extends RuntimeException {

    /**
     * Kód chyby pro identifikaci typu chyby
     */
    private final String errorCode;

    /**
     * Reference ID (např. primární klíč resource nebo cesta k poli) pokud existuje
     */
    private final String referenceId;

    /**
     * Detailní zpráva pro debugging
     */
    private final String detailMessage;

    /**
     * Konstruktor s plnou specifikací
     *
     * @param message       uživatelsky přívětivá zpráva
     * @param detailMessage detailní zpráva pro debugging
     * @param errorCode     kód chyby
     * @param referenceId   reference ID
     * @param cause         původní příčina výjimky
     */
    protected PaperlessException(
            String message,
            String detailMessage,
            String errorCode,
            String referenceId,
            Throwable cause) {
        super(message, cause);
        this.detailMessage = detailMessage;
        this.errorCode = errorCode;
        this.referenceId = referenceId;
    }

    /**
     * Zjednodušený konstruktor bez cause
     */
    protected PaperlessException(String message, String detailMessage, String errorCode, String referenceId) {
        this(message, detailMessage, errorCode, referenceId, null);
    }

    /**
     * Minimální konstruktor pro jednoduché použití
     */
    protected PaperlessException(String message, String errorCode) {
        this(message, null, errorCode, null, null);
    }
}
