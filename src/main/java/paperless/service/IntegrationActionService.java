package paperless.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import paperless.model.integrations.IntegrationAction;
import paperless.model.integrations.IntegrationActionDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Integrační akce a jejich definice. Výpisy jsou vždy v rámci jedné managed integrace.
 */
@Slf4j
public class IntegrationActionService {

    private final ResourceService resourceService;

    public IntegrationActionService(ResourceService resourceService) {
        this.resourceService = resourceService;
    }

    public IntegrationAction get(String uuid) {
        return resourceService.get(IntegrationAction.SCHEMA, IntegrationAction.READ, uuid);
    }

    public List<IntegrationAction> list(String managedIntegrationUuid) {
        return list(managedIntegrationUuid, null);
    }

    public List<IntegrationAction> list(String managedIntegrationUuid, Map<String, ?> params) {
        return resourceService.list(IntegrationAction.SCHEMA,
                IntegrationAction.listEndpoint(managedIntegrationUuid), params);
    }

    /**
     * Výpis filtrovaný podle stavu a typu akce; null filtr se neposílá.
     */
    public List<IntegrationAction> filter(String managedIntegrationUuid, String status, String actionType) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("status", status);
        params.put("action_type", actionType);
        return list(managedIntegrationUuid, params);
    }

    public IntegrationAction create(IntegrationAction action) {
        return resourceService.create(action, IntegrationAction.CREATE);
    }

    public IntegrationAction update(IntegrationAction action) {
        return resourceService.update(action, IntegrationAction.UPDATE);
    }

    /**
     * Založí akce jedním voláním. Odpověď serveru se nezpracovává, předané instance zůstávají beze změny.
     */
    public void createMany(List<IntegrationAction> actions) {
        resourceService.getTransport().createResource(IntegrationAction.CREATE.createUrl(), toArray(actions));
        log.info("Založeno {} integračních akcí", actions.size());
    }

    /**
     * Aktualizuje akce jedním voláním (PATCH na kolekci). Instance se se serverem neslaďují.
     */
    public void updateMany(List<IntegrationAction> actions) {
        resourceService.getTransport().request(
                IntegrationAction.UPDATE.updateUrl(), HttpMethod.PATCH, toArray(actions), null);
        log.info("Aktualizováno {} integračních akcí", actions.size());
    }

    public List<IntegrationActionDefinition> listDefinitions(String managedIntegrationUuid) {
        return resourceService.list(IntegrationActionDefinition.SCHEMA,
                IntegrationActionDefinition.listEndpoint(managedIntegrationUuid));
    }

    private static ArrayNode toArray(List<IntegrationAction> actions) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(actions.size());
        for (IntegrationAction action : actions) {
            array.add(action.toJson());
        }
        return array;
    }
}
