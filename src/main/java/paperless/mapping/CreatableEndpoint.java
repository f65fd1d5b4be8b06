package paperless.mapping;

/**
 * Typ resource, který lze založit ({@code POST createUrl}).
 */
@FunctionalInterface
public interface CreatableEndpoint {
    String createUrl();
}
