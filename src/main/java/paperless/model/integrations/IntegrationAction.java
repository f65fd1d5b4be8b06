package paperless.model.integrations;

import paperless.mapping.Converters;
import paperless.mapping.CreatableEndpoint;
import paperless.mapping.Field;
import paperless.mapping.ListableEndpoint;
import paperless.mapping.ReadableEndpoint;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;
import paperless.mapping.UpdatableEndpoint;
import paperless.util.DateTimes;

import java.time.OffsetDateTime;

/**
 * Úloha pro ERP integraci, např. export objednávky. Integrace si úlohy vyzvedává
 * a hlásí zpět jejich stav.
 * <p>
 * Kromě {@code type} a {@code entity_id} jsou všechna pole při založení nenastavená
 * a doplní je server.
 */
public class IntegrationAction extends Resource {

    public static final String STATUS_QUEUED = "queued";
    public static final String STATUS_IN_PROGRESS = "in_progress";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_CANCELLED = "cancelled";

    private static final String BASE_URL = "integration_actions/public";

    public static final ReadableEndpoint READ = () -> BASE_URL;
    public static final CreatableEndpoint CREATE = () -> BASE_URL;
    public static final UpdatableEndpoint UPDATE = () -> BASE_URL;

    public static final Field<String> TYPE = Field.required("type", Converters.string());
    public static final Field<String> ENTITY_ID = Field.required("entity_id", Converters.string());
    public static final Field<String> UUID = Field.untouched("uuid", Converters.optional(Converters.string()));
    public static final Field<String> STATUS = Field.untouched("status", Converters.optional(Converters.string()));
    public static final Field<String> STATUS_MESSAGE =
            Field.untouched("status_message", Converters.optional(Converters.string()));
    public static final Field<String> CREATED = Field.untouched("created", Converters.optional(Converters.string()));
    public static final Field<String> UPDATED = Field.untouched("updated", Converters.optional(Converters.string()));

    public static final ResourceSchema<IntegrationAction> SCHEMA =
            ResourceSchema.builder("IntegrationAction", IntegrationAction::new)
                    .fields(TYPE, ENTITY_ID, UUID, STATUS, STATUS_MESSAGE, CREATED, UPDATED)
                    .primaryKey(UUID)
                    .build();

    public IntegrationAction() {
    }

    public IntegrationAction(String type, String entityId) {
        setType(type);
        setEntityId(entityId);
    }

    /**
     * Akce se vypisují jen v rámci jedné integrace.
     */
    public static ListableEndpoint listEndpoint(String managedIntegrationUuid) {
        return () -> ManagedIntegration.LIST.listUrl() + "/" + managedIntegrationUuid + "/integration_actions";
    }

    @Override
    public ResourceSchema<IntegrationAction> schema() {
        return SCHEMA;
    }

    public OffsetDateTime getCreatedDateTime() {
        return DateTimes.parseDateTime(getCreated());
    }

    public OffsetDateTime getUpdatedDateTime() {
        return DateTimes.parseDateTime(getUpdated());
    }

    public String getType() {
        return get(TYPE);
    }

    public void setType(String type) {
        set(TYPE, type);
    }

    public String getEntityId() {
        return get(ENTITY_ID);
    }

    public void setEntityId(String entityId) {
        set(ENTITY_ID, entityId);
    }

    public String getUuid() {
        return get(UUID);
    }

    public String getStatus() {
        return get(STATUS);
    }

    public void setStatus(String status) {
        set(STATUS, status);
    }

    public String getStatusMessage() {
        return get(STATUS_MESSAGE);
    }

    public void setStatusMessage(String statusMessage) {
        set(STATUS_MESSAGE, statusMessage);
    }

    public String getCreated() {
        return get(CREATED);
    }

    public String getUpdated() {
        return get(UPDATED);
    }
}
