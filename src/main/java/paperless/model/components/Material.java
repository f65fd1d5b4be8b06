package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

public class Material extends Resource {

    public static final Field<Integer> ID = Field.nullable("id", Converters.integer());
    public static final Field<String> NAME = Field.nullable("name", Converters.string());
    public static final Field<String> DISPLAY_NAME = Field.nullable("display_name", Converters.string());
    public static final Field<String> FAMILY = Field.nullable("family", Converters.string());
    public static final Field<String> MATERIAL_CLASS = Field.nullable("material_class", Converters.string());

    public static final ResourceSchema<Material> SCHEMA = ResourceSchema.builder("Material", Material::new)
            .fields(ID, NAME, DISPLAY_NAME, FAMILY, MATERIAL_CLASS)
            .build();

    @Override
    public ResourceSchema<Material> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public String getName() {
        return get(NAME);
    }

    public String getDisplayName() {
        return get(DISPLAY_NAME);
    }

    public String getFamily() {
        return get(FAMILY);
    }

    public String getMaterialClass() {
        return get(MATERIAL_CLASS);
    }
}
