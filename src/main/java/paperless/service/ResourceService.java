package paperless.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import paperless.connector.ListEnvelope;
import paperless.connector.PaperlessTransport;
import paperless.exception.MalformedPaginationEnvelopeException;
import paperless.exception.ValidationException;
import paperless.mapping.CreatableEndpoint;
import paperless.mapping.ListableEndpoint;
import paperless.mapping.ReadableEndpoint;
import paperless.mapping.Resource;
import paperless.mapping.ResourceMapper;
import paperless.mapping.ResourceSchema;
import paperless.mapping.UpdatableEndpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Obecné operace nad libovolným typem resource: načtení, výpis po stránkách, založení a aktualizace.
 * <p>
 * Každá operace je jedno synchronní volání (u výpisu postupná volání stránku po stránce).
 * Služba nic neopakuje a nic necachuje; chyby jdou rovnou volajícímu.
 */
@Slf4j
public class ResourceService {

    private final PaperlessTransport transport;
    private final int maxPages;

    public ResourceService(PaperlessTransport transport, int maxPages) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages musí být alespoň 1");
        }
        this.transport = transport;
        this.maxPages = maxPages;
    }

    public PaperlessTransport getTransport() {
        return transport;
    }

    public <R extends Resource> R get(ResourceSchema<R> schema, ReadableEndpoint endpoint, Object primaryKey) {
        return get(schema, endpoint, primaryKey, null);
    }

    public <R extends Resource> R get(ResourceSchema<R> schema, ReadableEndpoint endpoint, Object primaryKey,
                                      Map<String, ?> params) {
        JsonNode response = transport.getResource(endpoint.readUrl() + "/" + primaryKey, params);
        return ResourceMapper.fromJson(schema, response);
    }

    public <R extends Resource> List<R> list(ResourceSchema<R> schema, ListableEndpoint endpoint) {
        return list(schema, endpoint, null);
    }

    /**
     * Načte všechny stránky seznamu a vrátí je spojené v pořadí, v jakém je poslal server.
     * <p>
     * Parametry z URL {@code next} se sloučí s parametry volajícího, při kolizi vyhrává volající.
     * Pokud kterákoliv stránka selže, vyhodí se výjimka a nic z dosud načteného se nevrátí.
     */
    public <R extends Resource> List<R> list(ResourceSchema<R> schema, ListableEndpoint endpoint,
                                             Map<String, ?> params) {
        String url = endpoint.listUrl();
        Map<String, Object> callerParams = withoutNulls(params);
        List<R> results = new ArrayList<>();

        ListEnvelope page = ListEnvelope.parse(transport.getResourceList(url, callerParams));
        int pages = 1;
        appendResults(schema, page, results);

        while (page.hasNext()) {
            if (pages >= maxPages) {
                throw new MalformedPaginationEnvelopeException(
                        String.format("Seznam %s překročil limit %d stránek", url, maxPages), page.getNext());
            }
            Map<String, Object> nextParams = new LinkedHashMap<>(page.nextParams());
            nextParams.putAll(callerParams);
            log.debug("Načítám stránku {} seznamu {} s parametry {}", pages + 1, url, nextParams);
            page = ListEnvelope.parse(transport.getResourceList(url, nextParams));
            pages++;
            appendResults(schema, page, results);
        }
        log.debug("Seznam {}: {} položek z {} stránek", url, results.size(), pages);
        return results;
    }

    /**
     * Založí resource na serveru a sladí lokální instanci s odpovědí (id, ceny, časová razítka...).
     *
     * @return tatáž instance, kterou volající předal
     */
    public <R extends Resource> R create(R resource, CreatableEndpoint endpoint) {
        JsonNode response = transport.createResource(endpoint.createUrl(), resource.toJson());
        return reconcile(resource, response);
    }

    public <R extends Resource> R update(R resource, UpdatableEndpoint endpoint) {
        return update(resource, endpoint, null);
    }

    /**
     * Pošle na server jen pole, která volající nastavil, a lokální instanci sladí s odpovědí.
     *
     * @return tatáž instance, kterou volající předal
     * @throws ValidationException pokud instance ještě nemá primární klíč
     */
    public <R extends Resource> R update(R resource, UpdatableEndpoint endpoint, Map<String, ?> params) {
        Object primaryKey = resource.getPrimaryKey();
        if (primaryKey == null) {
            throw new ValidationException(String.format(
                    "%s bez primárního klíče nelze aktualizovat, nejdřív ho založte", resource.schema().getName()));
        }
        JsonNode response = transport.updateResource(
                endpoint.updateUrl(), primaryKey, resource.toJson(), withoutNulls(params));
        return reconcile(resource, response);
    }

    /**
     * Libovolné volání, jehož odpovědí je nová verze resource (např. změna stavu).
     */
    public <R extends Resource> R request(R resource, String url, HttpMethod method, JsonNode data,
                                          Map<String, ?> params) {
        JsonNode response = transport.request(url, method, data, withoutNulls(params));
        return reconcile(resource, response);
    }

    private <R extends Resource> R reconcile(R resource, JsonNode response) {
        Resource serverCopy = resource.schema().fromJson(response);
        resource.reconcileWith(serverCopy);
        return resource;
    }

    private static <R extends Resource> void appendResults(ResourceSchema<R> schema, ListEnvelope page,
                                                           List<R> results) {
        for (JsonNode item : page.getResults()) {
            results.add(ResourceMapper.fromJson(schema, item));
        }
    }

    static Map<String, Object> withoutNulls(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (value != null) {
                result.put(key, value);
            }
        });
        return result;
    }
}
