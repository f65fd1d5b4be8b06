package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Nabídka, ze které tato nabídka vznikla jako revize nebo kopie.
 */
public class ParentQuote extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<Integer> NUMBER = Field.required("number", Converters.integer());
    public static final Field<String> STATUS = Field.required("status", Converters.string());

    public static final ResourceSchema<ParentQuote> SCHEMA = ResourceSchema.builder("ParentQuote", ParentQuote::new)
            .fields(ID, NUMBER, STATUS)
            .build();

    @Override
    public ResourceSchema<ParentQuote> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public Integer getNumber() {
        return get(NUMBER);
    }

    public String getStatus() {
        return get(STATUS);
    }
}
