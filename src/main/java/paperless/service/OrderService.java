package paperless.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import paperless.mapping.Converters;
import paperless.model.orders.Order;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Čtení objednávek.
 */
@Slf4j
public class OrderService {

    private static final String NEW_ORDERS_URL = "orders/public/new";

    private final ResourceService resourceService;

    public OrderService(ResourceService resourceService) {
        this.resourceService = resourceService;
    }

    public Order get(int number) {
        return resourceService.get(Order.SCHEMA, Order.READ, number);
    }

    public List<Order> list() {
        return list(null);
    }

    public List<Order> list(Map<String, ?> params) {
        return resourceService.list(Order.SCHEMA, Order.LIST, params);
    }

    /**
     * Čísla objednávek novějších než {@code lastOrderNumber}; bez něj server vrátí všechna.
     */
    public List<Integer> getNew(Integer lastOrderNumber) {
        Map<String, ?> params = lastOrderNumber == null
                ? Collections.emptyMap()
                : Map.of("last_order", lastOrderNumber);
        JsonNode response = resourceService.getTransport().getResource(NEW_ORDERS_URL, params);
        List<Integer> numbers = Converters.list(Converters.integer()).fromJson(NEW_ORDERS_URL, response);
        log.debug("Nové objednávky od {}: {}", lastOrderNumber, numbers);
        return numbers;
    }
}
