package paperless.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import paperless.exception.ValidationException;
import paperless.mapping.Converters;
import paperless.model.quotes.Quote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operace nad nabídkami. Nabídku určuje číslo a revize, revize se posílá jako query parametr.
 */
@Slf4j
public class QuoteService {

    private static final String NEW_QUOTES_URL = "quotes/public/new";

    private final ResourceService resourceService;

    public QuoteService(ResourceService resourceService) {
        this.resourceService = resourceService;
    }

    /**
     * @param revision revize nabídky, null pro aktuální
     */
    public Quote get(int number, Integer revision) {
        return resourceService.get(Quote.SCHEMA, Quote.READ, number, revisionParams(revision));
    }

    public List<Quote> list() {
        return list(null);
    }

    public List<Quote> list(Map<String, ?> params) {
        return resourceService.list(Quote.SCHEMA, Quote.LIST, params);
    }

    /**
     * Uloží lokální změny nabídky a sladí ji s odpovědí serveru.
     */
    public Quote update(Quote quote) {
        return resourceService.update(quote, Quote.UPDATE, revisionParams(quote.getRevisionNumber()));
    }

    /**
     * Změní stav nabídky (např. {@link Quote#STATUS_LOST}). Instance se sladí s odpovědí serveru.
     */
    public Quote setStatus(Quote quote, String status) {
        if (quote.getNumber() == null) {
            throw new ValidationException("Nabídce bez čísla nelze změnit stav");
        }
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("status", status);
        String url = Quote.UPDATE.updateUrl() + "/" + quote.getNumber() + "/status_change";
        log.info("Měním stav nabídky {} na {}", quote.getNumber(), status);
        return resourceService.request(quote, url, HttpMethod.PATCH, data, revisionParams(quote.getRevisionNumber()));
    }

    /**
     * Čísla nabídek novějších než {@code lastQuote}. Bez {@code lastQuote} se revize neposílá.
     */
    public List<Integer> getNew(Integer lastQuote, Integer revision) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (lastQuote != null) {
            params.put("last_quote", lastQuote);
            if (revision != null) {
                params.put("revision", revision);
            }
        }
        JsonNode response = resourceService.getTransport().getResource(NEW_QUOTES_URL, params);
        return Converters.list(Converters.integer()).fromJson(NEW_QUOTES_URL, response);
    }

    private static Map<String, ?> revisionParams(Integer revision) {
        return revision == null ? Collections.emptyMap() : Map.of("revision", revision);
    }
}
