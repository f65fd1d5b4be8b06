package paperless.connector;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * HTTP vrstva pod resource službami. Vrací surový JSON, o převod na objekty se stará
 * {@link paperless.mapping.ResourceMapper}.
 * <p>
 * Cesty jsou relativní k base URL (např. {@code orders/public/72}). Parametry s hodnotou null
 * se do query stringu nezapisují, hodnota typu {@link Iterable} se zapíše jako opakovaný parametr.
 */
public interface PaperlessTransport {

    JsonNode getResource(String url, Map<String, ?> params);

    /**
     * @return stránka ve tvaru {@code {"results": [...], "next": ...}} nebo holé JSON pole
     */
    JsonNode getResourceList(String url, Map<String, ?> params);

    JsonNode createResource(String url, JsonNode data);

    /**
     * Částečná aktualizace ({@code PATCH url/primaryKey}).
     */
    JsonNode updateResource(String url, Object primaryKey, JsonNode data, Map<String, ?> params);

    /**
     * Obecné volání pro akce mimo CRUD (např. změna stavu nabídky).
     */
    JsonNode request(String url, HttpMethod method, JsonNode data, Map<String, ?> params);
}
