package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

public class SupportingFile extends Resource {

    public static final Field<String> FILENAME = Field.required("filename", Converters.string());
    public static final Field<String> URL = Field.required("url", Converters.string());

    public static final ResourceSchema<SupportingFile> SCHEMA = ResourceSchema.builder("SupportingFile", SupportingFile::new)
            .fields(FILENAME, URL)
            .build();

    @Override
    public ResourceSchema<SupportingFile> schema() {
        return SCHEMA;
    }

    public String getFilename() {
        return get(FILENAME);
    }

    public String getUrl() {
        return get(URL);
    }
}
