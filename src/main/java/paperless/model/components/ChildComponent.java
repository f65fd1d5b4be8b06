package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Odkaz z komponenty na potomka v sestavě a počet kusů potomka na jeden kus rodiče.
 */
public class ChildComponent extends Resource {

    public static final Field<Integer> CHILD_ID = Field.required("child_id", Converters.integer());
    public static final Field<Integer> QUANTITY = Field.required("quantity", Converters.integer());

    public static final ResourceSchema<ChildComponent> SCHEMA = ResourceSchema.builder("ChildComponent", ChildComponent::new)
            .fields(CHILD_ID, QUANTITY)
            .build();

    @Override
    public ResourceSchema<ChildComponent> schema() {
        return SCHEMA;
    }

    public Integer getChildId() {
        return get(CHILD_ID);
    }

    public Integer getQuantity() {
        return get(QUANTITY);
    }
}
