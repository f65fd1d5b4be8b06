package paperless.mapping;

/**
 * Typ resource, jehož instance lze vypsat ({@code GET listUrl}, případně po stránkách).
 */
@FunctionalInterface
public interface ListableEndpoint {
    String listUrl();
}
