package paperless.mapping;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Obousměrný převod mezi hodnotou z JSON a typovanou hodnotou pole.
 *
 * @param <T> typ hodnoty pole
 */
public interface Converter<T> {

    /**
     * Převede surovou JSON hodnotu na typovanou hodnotu.
     *
     * @param path cesta k poli pro chybové hlášení (např. order_items[0].id)
     * @param node JSON hodnota, nikdy Java null
     * @throws paperless.exception.TypeMismatchException pokud hodnotu nelze převést
     */
    T fromJson(String path, JsonNode node);

    /**
     * Převede typovanou hodnotu zpět na JSON. Hodnota null se zapíše jako JSON null.
     */
    JsonNode toJson(T value);

    /**
     * Popis očekávaného typu pro chybové zprávy.
     */
    String describe();
}
