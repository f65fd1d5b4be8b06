package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.ResourceSchema;

import java.util.List;

/**
 * Operace na objednané komponentě.
 */
public class Operation extends BaseOperation {

    public static final Field<List<CostingVariable>> COSTING_VARIABLES =
            Field.required("costing_variables", Converters.list(Converters.nested(CostingVariable.SCHEMA)));

    public static final ResourceSchema<Operation> SCHEMA = ResourceSchema.builder("Operation", Operation::new)
            .fields(OPERATION_FIELDS)
            .fields(COSTING_VARIABLES)
            .build();

    @Override
    public ResourceSchema<Operation> schema() {
        return SCHEMA;
    }

    public List<CostingVariable> getCostingVariables() {
        return get(COSTING_VARIABLES);
    }

    @Override
    public Object getVariable(String label) {
        List<CostingVariable> variables = getCostingVariables();
        if (variables == null) {
            return null;
        }
        for (CostingVariable variable : variables) {
            if (variable.getLabel().equals(label)) {
                return variable.getValue();
            }
        }
        return null;
    }
}
