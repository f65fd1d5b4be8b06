package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Cena a dodací lhůta operace pro jedno objednané množství.
 */
public class OperationQuantity extends Resource {

    public static final Field<Money> PRICE = Field.nullable("price", Converters.money());
    public static final Field<Money> MANUAL_PRICE = Field.nullable("manual_price", Converters.money());
    public static final Field<Integer> LEAD_TIME = Field.nullable("lead_time", Converters.integer());
    public static final Field<Integer> QUANTITY = Field.required("quantity", Converters.integer());

    public static final ResourceSchema<OperationQuantity> SCHEMA = ResourceSchema.builder("OperationQuantity", OperationQuantity::new)
            .fields(PRICE, MANUAL_PRICE, LEAD_TIME, QUANTITY)
            .build();

    @Override
    public ResourceSchema<OperationQuantity> schema() {
        return SCHEMA;
    }

    public Money getPrice() {
        return get(PRICE);
    }

    public Money getManualPrice() {
        return get(MANUAL_PRICE);
    }

    public Integer getLeadTime() {
        return get(LEAD_TIME);
    }

    public Integer getQuantity() {
        return get(QUANTITY);
    }
}
