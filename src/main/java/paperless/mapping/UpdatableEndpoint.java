package paperless.mapping;

/**
 * Typ resource, který lze částečně aktualizovat ({@code PATCH updateUrl/{key}}).
 */
@FunctionalInterface
public interface UpdatableEndpoint {
    String updateUrl();
}
