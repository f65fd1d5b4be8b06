package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.util.Map;

/**
 * Kalkulační proměnná nabídky. Kromě výchozí hodnoty nese hodnoty pro jednotlivá množství.
 */
public class QuoteCostingVariable extends Resource {

    public static final Field<Object> VALUE = Field.nullable("value", Converters.scalar());
    public static final Field<String> LABEL = Field.required("label", Converters.string());
    public static final Field<Boolean> QUANTITY_SPECIFIC = Field.required("quantity_specific", Converters.bool());
    public static final Field<Map<Integer, CostingVariablePayload>> QUANTITIES =
            Field.required("quantities", Converters.mapping(Converters.nested(CostingVariablePayload.SCHEMA)));
    public static final Field<String> VARIABLE_CLASS = Field.required("variable_class", Converters.string());
    public static final Field<String> VALUE_TYPE = Field.required("value_type", Converters.string());

    public static final ResourceSchema<QuoteCostingVariable> SCHEMA =
            ResourceSchema.builder("QuoteCostingVariable", QuoteCostingVariable::new)
                    .fields(VALUE, LABEL, QUANTITY_SPECIFIC, QUANTITIES, VARIABLE_CLASS, VALUE_TYPE)
                    .build();

    @Override
    public ResourceSchema<QuoteCostingVariable> schema() {
        return SCHEMA;
    }

    public Object getValue() {
        return get(VALUE);
    }

    public String getLabel() {
        return get(LABEL);
    }

    public boolean isQuantitySpecific() {
        return Boolean.TRUE.equals(get(QUANTITY_SPECIFIC));
    }

    public Map<Integer, CostingVariablePayload> getQuantities() {
        return get(QUANTITIES);
    }

    public String getVariableClass() {
        return get(VARIABLE_CLASS);
    }

    public String getValueType() {
        return get(VALUE_TYPE);
    }

    static CostingVariablePayload payloadFor(Iterable<QuoteCostingVariable> variables, String label, int quantity) {
        if (variables == null) {
            return null;
        }
        for (QuoteCostingVariable variable : variables) {
            if (variable.getLabel().equals(label)) {
                Map<Integer, CostingVariablePayload> quantities = variable.getQuantities();
                return quantities == null ? null : quantities.get(quantity);
            }
        }
        return null;
    }
}
