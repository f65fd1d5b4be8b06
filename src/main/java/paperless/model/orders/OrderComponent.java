package paperless.model.orders;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.ResourceSchema;
import paperless.model.components.BaseComponent;
import paperless.model.components.Operation;

import java.util.List;

public class OrderComponent extends BaseComponent {

    public static final Field<List<Operation>> MATERIAL_OPERATIONS =
            Field.required("material_operations", Converters.list(Converters.nested(Operation.SCHEMA)));
    public static final Field<List<Operation>> SHOP_OPERATIONS =
            Field.required("shop_operations", Converters.list(Converters.nested(Operation.SCHEMA)));

    public static final ResourceSchema<OrderComponent> SCHEMA = ResourceSchema.builder("OrderComponent", OrderComponent::new)
            .fields(COMPONENT_FIELDS)
            .fields(MATERIAL_OPERATIONS, SHOP_OPERATIONS)
            .build();

    @Override
    public ResourceSchema<OrderComponent> schema() {
        return SCHEMA;
    }

    public List<Operation> getMaterialOperations() {
        return get(MATERIAL_OPERATIONS);
    }

    public List<Operation> getShopOperations() {
        return get(SHOP_OPERATIONS);
    }
}
