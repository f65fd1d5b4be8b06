package paperless.exception;

import lombok.Getter;

/**
 * Výjimka pro povinné pole, které v JSON odpovědi chybí
 */
@Getter
public class MissingRequiredFieldException extends ValidationException {

    private static final String ERROR_CODE = "MISSING_REQUIRED_FIELD";

    /**
     * Název typu resource, jehož pole chybí
     */
    private final String resourceType;

    public MissingRequiredFieldException(String fieldPath, String resourceType) {
        super(
                String.format("Povinné pole '%s' (%s) chybí", fieldPath, resourceType),
                fieldPath,
                String.format("Resource type: %s, field: %s", resourceType, fieldPath),
                ERROR_CODE);
        this.resourceType = resourceType;
    }
}
