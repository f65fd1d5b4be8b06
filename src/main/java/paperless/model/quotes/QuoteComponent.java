package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.ResourceSchema;
import paperless.model.components.BaseComponent;

import java.util.List;

public class QuoteComponent extends BaseComponent {

    public static final Field<List<AddOn>> ADD_ONS =
            Field.required("add_ons", Converters.list(Converters.nested(AddOn.SCHEMA)));
    public static final Field<List<QuoteOperation>> MATERIAL_OPERATIONS =
            Field.required("material_operations", Converters.list(Converters.nested(QuoteOperation.SCHEMA)));
    public static final Field<List<QuoteOperation>> SHOP_OPERATIONS =
            Field.required("shop_operations", Converters.list(Converters.nested(QuoteOperation.SCHEMA)));
    public static final Field<List<Quantity>> QUANTITIES =
            Field.required("quantities", Converters.list(Converters.nested(Quantity.SCHEMA)));

    public static final ResourceSchema<QuoteComponent> SCHEMA = ResourceSchema.builder("QuoteComponent", QuoteComponent::new)
            .fields(COMPONENT_FIELDS)
            .fields(ADD_ONS, MATERIAL_OPERATIONS, SHOP_OPERATIONS, QUANTITIES)
            .build();

    @Override
    public ResourceSchema<QuoteComponent> schema() {
        return SCHEMA;
    }

    public List<AddOn> getAddOns() {
        return get(ADD_ONS);
    }

    public List<QuoteOperation> getMaterialOperations() {
        return get(MATERIAL_OPERATIONS);
    }

    public List<QuoteOperation> getShopOperations() {
        return get(SHOP_OPERATIONS);
    }

    public List<Quantity> getQuantities() {
        return get(QUANTITIES);
    }
}
