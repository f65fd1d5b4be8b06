package paperless.exception;

/**
 * Výjimka pro případy kdy vzdálené API požadovaný resource nezná (HTTP 404)
 */
public class ResourceNotFoundException extends PaperlessException {

    private static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    /**
     * Konstruktor s cestou resource a tělem odpovědi
     *
     * @param resourcePath relativní cesta resource (např. orders/public/72)
     * @param responseBody tělo odpovědi serveru
     */
    public ResourceNotFoundException(String resourcePath, String responseBody) {
        super(
                String.format("Resource '%s' nebyl nalezen", resourcePath),
                responseBody,
                ERROR_CODE,
                resourcePath);
    }
}
