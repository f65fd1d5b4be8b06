package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.util.List;

/**
 * Doplňková služba nabízená ke komponentě, s cenou pro každé množství.
 */
public class AddOn extends Resource {

    public static final Field<Boolean> IS_REQUIRED = Field.required("is_required", Converters.bool());
    public static final Field<String> NAME = Field.required("name", Converters.string());
    public static final Field<String> NOTES = Field.nullable("notes", Converters.string());
    public static final Field<List<AddOnQuantity>> QUANTITIES =
            Field.required("quantities", Converters.list(Converters.nested(AddOnQuantity.SCHEMA)));
    public static final Field<List<QuoteCostingVariable>> COSTING_VARIABLES =
            Field.required("costing_variables", Converters.list(Converters.nested(QuoteCostingVariable.SCHEMA)));

    public static final ResourceSchema<AddOn> SCHEMA = ResourceSchema.builder("AddOn", AddOn::new)
            .fields(IS_REQUIRED, NAME, NOTES, QUANTITIES, COSTING_VARIABLES)
            .build();

    @Override
    public ResourceSchema<AddOn> schema() {
        return SCHEMA;
    }

    public CostingVariablePayload getVariableForQuantity(String label, int quantity) {
        return QuoteCostingVariable.payloadFor(getCostingVariables(), label, quantity);
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

    public List<AddOnQuantity> getQuantities() {
        return get(QUANTITIES);
    }

    public List<QuoteCostingVariable> getCostingVariables() {
        return get(COSTING_VARIABLES);
    }
}
