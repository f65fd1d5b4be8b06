package paperless.service;

import lombok.extern.slf4j.Slf4j;
import paperless.model.integrations.ManagedIntegration;

import java.util.List;

@Slf4j
public class ManagedIntegrationService {

    private final ResourceService resourceService;

    public ManagedIntegrationService(ResourceService resourceService) {
        this.resourceService = resourceService;
    }

    public ManagedIntegration get(String uuid) {
        return resourceService.get(ManagedIntegration.SCHEMA, ManagedIntegration.READ, uuid);
    }

    public List<ManagedIntegration> list() {
        return resourceService.list(ManagedIntegration.SCHEMA, ManagedIntegration.LIST);
    }

    public ManagedIntegration create(ManagedIntegration integration) {
        ManagedIntegration created = resourceService.create(integration, ManagedIntegration.CREATE);
        log.info("Založena integrace {} ({})", created.getUuid(), created.getErpName());
        return created;
    }

    public ManagedIntegration update(ManagedIntegration integration) {
        return resourceService.update(integration, ManagedIntegration.UPDATE);
    }
}
