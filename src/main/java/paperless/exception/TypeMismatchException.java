package paperless.exception;

import lombok.Getter;

/**
 * Výjimka pro hodnotu z JSON, kterou nelze převést na deklarovaný typ pole
 */
@Getter
public class TypeMismatchException extends ValidationException {

    private static final String ERROR_CODE = "TYPE_MISMATCH";

    /**
     * Očekávaný typ (např. "integer", "list<OrderItem>")
     */
    private final String expectedType;

    /**
     * Typ hodnoty, která skutečně přišla (např. "STRING", "NULL")
     */
    private final String actualType;

    public TypeMismatchException(String fieldPath, String expectedType, String actualType) {
        super(
                String.format("Pole '%s' má neplatný typ: očekáváno %s, přišlo %s", fieldPath, expectedType, actualType),
                fieldPath,
                String.format("Field: %s, expected: %s, actual: %s", fieldPath, expectedType, actualType),
                ERROR_CODE);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }
}
