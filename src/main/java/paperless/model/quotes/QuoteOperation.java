package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.ResourceSchema;
import paperless.model.components.BaseOperation;

import java.util.List;

public class QuoteOperation extends BaseOperation {

    public static final Field<List<QuoteCostingVariable>> COSTING_VARIABLES =
            Field.required("costing_variables", Converters.list(Converters.nested(QuoteCostingVariable.SCHEMA)));

    public static final ResourceSchema<QuoteOperation> SCHEMA = ResourceSchema.builder("QuoteOperation", QuoteOperation::new)
            .fields(OPERATION_FIELDS)
            .fields(COSTING_VARIABLES)
            .build();

    @Override
    public ResourceSchema<QuoteOperation> schema() {
        return SCHEMA;
    }

    public List<QuoteCostingVariable> getCostingVariables() {
        return get(COSTING_VARIABLES);
    }

    /**
     * Hodnota proměnné pro konkrétní množství.
     *
     * @return payload, nebo null pokud proměnná nebo množství neexistuje
     */
    public CostingVariablePayload getVariableForQuantity(String label, int quantity) {
        return QuoteCostingVariable.payloadFor(getCostingVariables(), label, quantity);
    }

    @Override
    public Object getVariable(String label) {
        List<QuoteCostingVariable> variables = getCostingVariables();
        if (variables == null) {
            return null;
        }
        for (QuoteCostingVariable variable : variables) {
            if (variable.getLabel().equals(label)) {
                return variable.getValue();
            }
        }
        return null;
    }
}
