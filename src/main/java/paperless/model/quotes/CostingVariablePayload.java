package paperless.model.quotes;

import com.fasterxml.jackson.databind.JsonNode;
import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.util.List;

/**
 * Hodnota kalkulační proměnné pro jedno množství. {@code row} a {@code options} jsou vyplněné
 * jen u proměnných typu drop_down.
 */
public class CostingVariablePayload extends Resource {

    public static final Field<Object> VALUE = Field.nullable("value", Converters.scalar());
    public static final Field<JsonNode> ROW = Field.nullable("row", Converters.json());
    public static final Field<List<Object>> OPTIONS = Field.nullable("options", Converters.list(Converters.scalar()));

    public static final ResourceSchema<CostingVariablePayload> SCHEMA =
            ResourceSchema.builder("CostingVariablePayload", CostingVariablePayload::new)
                    .fields(VALUE, ROW, OPTIONS)
                    .build();

    @Override
    public ResourceSchema<CostingVariablePayload> schema() {
        return SCHEMA;
    }

    public Object getValue() {
        return get(VALUE);
    }

    public JsonNode getRow() {
        return get(ROW);
    }

    public List<Object> getOptions() {
        return get(OPTIONS);
    }
}
