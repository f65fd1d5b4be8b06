package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Vstupní proměnná kalkulace operace. Hodnota je string, číslo nebo boolean podle typu proměnné.
 */
public class CostingVariable extends Resource {

    public static final Field<String> LABEL = Field.required("label", Converters.string());
    public static final Field<String> TYPE = Field.nullable("type", Converters.string());
    public static final Field<Object> VALUE = Field.nullable("value", Converters.scalar());

    public static final ResourceSchema<CostingVariable> SCHEMA = ResourceSchema.builder("CostingVariable", CostingVariable::new)
            .fields(LABEL, TYPE, VALUE)
            .build();

    @Override
    public ResourceSchema<CostingVariable> schema() {
        return SCHEMA;
    }

    public String getLabel() {
        return get(LABEL);
    }

    public String getType() {
        return get(TYPE);
    }

    public Object getValue() {
        return get(VALUE);
    }
}
