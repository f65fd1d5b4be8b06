package paperless.model.integrations;

import paperless.mapping.Converters;
import paperless.mapping.CreatableEndpoint;
import paperless.mapping.Field;
import paperless.mapping.ListableEndpoint;
import paperless.mapping.ReadableEndpoint;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;
import paperless.mapping.UpdatableEndpoint;

/**
 * Registrace ERP integrace v Paperless Parts. Pod ní se evidují integrační akce.
 */
public class ManagedIntegration extends Resource {

    private static final String BASE_URL = "managed_integrations/public";

    public static final ReadableEndpoint READ = () -> BASE_URL;
    public static final ListableEndpoint LIST = () -> BASE_URL;
    public static final CreatableEndpoint CREATE = () -> BASE_URL;
    public static final UpdatableEndpoint UPDATE = () -> BASE_URL;

    public static final Field<String> UUID = Field.untouched("uuid", Converters.optional(Converters.string()));
    public static final Field<String> ERP_NAME = Field.required("erp_name", Converters.string());
    public static final Field<Boolean> IS_ACTIVE = Field.required("is_active", Converters.bool());
    public static final Field<String> ERP_VERSION = Field.untouched("erp_version", Converters.optional(Converters.string()));
    public static final Field<String> INTEGRATION_VERSION =
            Field.untouched("integration_version", Converters.optional(Converters.string()));
    public static final Field<String> INTEGRATION_PROJECT_SUBCOMMIT =
            Field.untouched("integration_project_subcommit", Converters.optional(Converters.string()));
    public static final Field<Boolean> CREATE_INTEGRATION_ACTION_AFTER_CREATING_NEW_ORDER =
            Field.untouched("create_integration_action_after_creating_new_order", Converters.optional(Converters.bool()));

    public static final ResourceSchema<ManagedIntegration> SCHEMA =
            ResourceSchema.builder("ManagedIntegration", ManagedIntegration::new)
                    .fields(UUID, ERP_NAME, IS_ACTIVE, ERP_VERSION, INTEGRATION_VERSION, INTEGRATION_PROJECT_SUBCOMMIT,
                            CREATE_INTEGRATION_ACTION_AFTER_CREATING_NEW_ORDER)
                    .primaryKey(UUID)
                    .build();

    public ManagedIntegration() {
    }

    public ManagedIntegration(String erpName, boolean active) {
        setErpName(erpName);
        setActive(active);
    }

    @Override
    public ResourceSchema<ManagedIntegration> schema() {
        return SCHEMA;
    }

    public String getUuid() {
        return get(UUID);
    }

    public String getErpName() {
        return get(ERP_NAME);
    }

    public void setErpName(String erpName) {
        set(ERP_NAME, erpName);
    }

    public Boolean getIsActive() {
        return get(IS_ACTIVE);
    }

    public void setActive(boolean active) {
        set(IS_ACTIVE, active);
    }

    public String getErpVersion() {
        return get(ERP_VERSION);
    }

    public void setErpVersion(String erpVersion) {
        set(ERP_VERSION, erpVersion);
    }

    public String getIntegrationVersion() {
        return get(INTEGRATION_VERSION);
    }

    public void setIntegrationVersion(String integrationVersion) {
        set(INTEGRATION_VERSION, integrationVersion);
    }

    public String getIntegrationProjectSubcommit() {
        return get(INTEGRATION_PROJECT_SUBCOMMIT);
    }

    public void setIntegrationProjectSubcommit(String subcommit) {
        set(INTEGRATION_PROJECT_SUBCOMMIT, subcommit);
    }

    public Boolean getCreateIntegrationActionAfterCreatingNewOrder() {
        return get(CREATE_INTEGRATION_ACTION_AFTER_CREATING_NEW_ORDER);
    }

    public void setCreateIntegrationActionAfterCreatingNewOrder(Boolean value) {
        set(CREATE_INTEGRATION_ACTION_AFTER_CREATING_NEW_ORDER, value);
    }
}
