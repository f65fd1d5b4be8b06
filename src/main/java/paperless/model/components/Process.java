package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Výrobní proces komponenty (např. CNC Machining).
 */
public class Process extends Resource {

    public static final Field<Integer> ID = Field.nullable("id", Converters.integer());
    public static final Field<String> NAME = Field.nullable("name", Converters.string());
    public static final Field<String> EXTERNAL_NAME = Field.nullable("external_name", Converters.string());

    public static final ResourceSchema<Process> SCHEMA = ResourceSchema.builder("Process", Process::new)
            .fields(ID, NAME, EXTERNAL_NAME)
            .build();

    @Override
    public ResourceSchema<Process> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public String getName() {
        return get(NAME);
    }

    public String getExternalName() {
        return get(EXTERNAL_NAME);
    }
}
