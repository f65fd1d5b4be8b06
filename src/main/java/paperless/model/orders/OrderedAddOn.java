package paperless.model.orders;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;
import paperless.model.components.CostingVariable;

import java.util.List;

/**
 * Doplňková služba objednaná k položce (např. certifikát nebo balení).
 */
public class OrderedAddOn extends Resource {

    public static final Field<Boolean> IS_REQUIRED = Field.required("is_required", Converters.bool());
    public static final Field<String> NAME = Field.required("name", Converters.string());
    public static final Field<String> NOTES = Field.nullable("notes", Converters.string());
    public static final Field<Money> PRICE = Field.required("price", Converters.money());
    public static final Field<Integer> QUANTITY = Field.required("quantity", Converters.integer());
    public static final Field<List<CostingVariable>> COSTING_VARIABLES =
            Field.required("costing_variables", Converters.list(Converters.nested(CostingVariable.SCHEMA)));

    public static final ResourceSchema<OrderedAddOn> SCHEMA = ResourceSchema.builder("OrderedAddOn", OrderedAddOn::new)
            .fields(IS_REQUIRED, NAME, NOTES, PRICE, QUANTITY, COSTING_VARIABLES)
            .build();

    @Override
    public ResourceSchema<OrderedAddOn> schema() {
        return SCHEMA;
    }

    public boolean isRequired() {
        return Boolean.TRUE.equals(get(IS_REQUIRED));
    }

    public String getName() {
        return get(NAME);
    }

    public String getNotes() {
        return get(NOTES);
    }

    public Money getPrice() {
        return get(PRICE);
    }

    public Integer getQuantity() {
        return get(QUANTITY);
    }

    public List<CostingVariable> getCostingVariables() {
        return get(COSTING_VARIABLES);
    }
}
