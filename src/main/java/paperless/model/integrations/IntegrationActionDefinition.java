package paperless.model.integrations;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.ListableEndpoint;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Typ akce, který integrace umí zpracovat.
 */
public class IntegrationActionDefinition extends Resource {

    public static final Field<String> UUID = Field.required("uuid", Converters.string());
    public static final Field<String> NAME = Field.required("name", Converters.string());
    public static final Field<String> TYPE = Field.required("type", Converters.string());
    public static final Field<String> RELATED_OBJECT_TYPE =
            Field.defaultingTo("related_object_type", Converters.optional(Converters.string()), null);

    public static final ResourceSchema<IntegrationActionDefinition> SCHEMA =
            ResourceSchema.builder("IntegrationActionDefinition", IntegrationActionDefinition::new)
                    .fields(UUID, NAME, TYPE, RELATED_OBJECT_TYPE)
                    .primaryKey(UUID)
                    .build();

    public static ListableEndpoint listEndpoint(String managedIntegrationUuid) {
        return () -> ManagedIntegration.LIST.listUrl() + "/" + managedIntegrationUuid
                + "/integration_action_definitions";
    }

    @Override
    public ResourceSchema<IntegrationActionDefinition> schema() {
        return SCHEMA;
    }

    public String getUuid() {
        return get(UUID);
    }

    public String getName() {
        return get(NAME);
    }

    public String getType() {
        return get(TYPE);
    }

    public String getRelatedObjectType() {
        return get(RELATED_OBJECT_TYPE);
    }
}
