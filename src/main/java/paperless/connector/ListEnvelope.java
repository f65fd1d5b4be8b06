package paperless.connector;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import paperless.exception.MalformedPaginationEnvelopeException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jedna stránka seznamu: {@code {"results": [...], "next": "<url>"|null}} nebo holé pole.
 */
@Getter
public final class ListEnvelope {

    private final List<JsonNode> results;
    private final String next;

    private ListEnvelope(List<JsonNode> results, String next) {
        this.results = results;
        this.next = next;
    }

    /**
     * @throws MalformedPaginationEnvelopeException pokud odpověď není pole ani obálka s polem results
     */
    public static ListEnvelope parse(JsonNode page) {
        if (page != null && page.isArray()) {
            return new ListEnvelope(toList(page), null);
        }
        if (page == null || !page.isObject() || !page.path("results").isArray()) {
            throw new MalformedPaginationEnvelopeException(
                    "Odpověď seznamu není pole ani obálka s polem 'results'", null);
        }
        JsonNode next = page.path("next");
        if (next.isMissingNode() || next.isNull()) {
            return new ListEnvelope(toList(page.get("results")), null);
        }
        if (!next.isTextual() || next.textValue().isBlank()) {
            throw new MalformedPaginationEnvelopeException(
                    "Pole 'next' musí být URL nebo null", next.toString());
        }
        return new ListEnvelope(toList(page.get("results")), next.textValue());
    }

    public boolean hasNext() {
        return next != null;
    }

    /**
     * Query parametry z URL další stránky. Opakovaný parametr se vrací jako seznam hodnot.
     *
     * @throws MalformedPaginationEnvelopeException pokud URL nelze rozebrat nebo nemá query string
     */
    public Map<String, Object> nextParams() {
        if (next == null) {
            return Map.of();
        }
        MultiValueMap<String, String> query;
        Map<String, Object> params = new LinkedHashMap<>();
        try {
            UriComponents components = UriComponentsBuilder.fromUriString(next).build();
            query = components.getQueryParams();
            query.forEach((key, values) -> {
                List<String> decoded = new ArrayList<>(values.size());
                for (String value : values) {
                    decoded.add(value == null ? "" : decodeQueryPart(value));
                }
                params.put(decodeQueryPart(key), decoded.size() == 1 ? decoded.get(0) : decoded);
            });
        } catch (IllegalArgumentException e) {
            throw new MalformedPaginationEnvelopeException("URL další stránky nelze rozebrat", next, e);
        }
        if (query.isEmpty()) {
            // bez parametrů by další požadavek byl stejný jako první
            throw new MalformedPaginationEnvelopeException("URL další stránky neobsahuje query parametry", next);
        }
        return params;
    }

    // query string ve tvaru formuláře: '+' je mezera, doslovné plus přichází jako %2B
    private static String decodeQueryPart(String part) {
        return UriUtils.decode(part.replace('+', ' '), StandardCharsets.UTF_8);
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> items = new ArrayList<>(array.size());
        array.forEach(items::add);
        return items;
    }
}
