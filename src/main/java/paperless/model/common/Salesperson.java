package paperless.model.common;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

public class Salesperson extends Resource {

    public static final Field<String> FIRST_NAME = Field.required("first_name", Converters.string());
    public static final Field<String> LAST_NAME = Field.required("last_name", Converters.string());
    public static final Field<String> EMAIL = Field.required("email", Converters.string());

    public static final ResourceSchema<Salesperson> SCHEMA = ResourceSchema.builder("Salesperson", Salesperson::new)
            .fields(FIRST_NAME, LAST_NAME, EMAIL)
            .build();

    @Override
    public ResourceSchema<Salesperson> schema() {
        return SCHEMA;
    }

    public String getFirstName() {
        return get(FIRST_NAME);
    }

    public String getLastName() {
        return get(LAST_NAME);
    }

    public String getEmail() {
        return get(EMAIL);
    }
}
