package paperless.mapping;

/**
 * Typ resource, který lze načíst podle primárního klíče ({@code GET readUrl/{key}}).
 */
@FunctionalInterface
public interface ReadableEndpoint {
    String readUrl();
}
