package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

public class AddOnQuantity extends Resource {

    public static final Field<Money> PRICE = Field.nullable("price", Converters.money());
    public static final Field<Money> MANUAL_PRICE = Field.nullable("manual_price", Converters.money());
    public static final Field<Integer> QUANTITY = Field.required("quantity", Converters.integer());

    public static final ResourceSchema<AddOnQuantity> SCHEMA = ResourceSchema.builder("AddOnQuantity", AddOnQuantity::new)
            .fields(PRICE, MANUAL_PRICE, QUANTITY)
            .build();

    @Override
    public ResourceSchema<AddOnQuantity> schema() {
        return SCHEMA;
    }

    public Money getPrice() {
        return get(PRICE);
    }

    public Money getManualPrice() {
        return get(MANUAL_PRICE);
    }

    public Integer getQuantity() {
        return get(QUANTITY);
    }
}
