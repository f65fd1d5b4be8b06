package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

public class Company extends Resource {

    public static final Field<Integer> ID = Field.nullable("id", Converters.integer());
    public static final Field<String> NOTES = Field.nullable("notes", Converters.string());
    public static final Field<Metrics> METRICS = Field.required("metrics", Converters.nested(Metrics.SCHEMA));
    public static final Field<String> BUSINESS_NAME = Field.required("business_name", Converters.string());
    public static final Field<String> ERP_CODE = Field.nullable("erp_code", Converters.string());

    public static final ResourceSchema<Company> SCHEMA = ResourceSchema.builder("Company", Company::new)
            .fields(ID, NOTES, METRICS, BUSINESS_NAME, ERP_CODE)
            .build();

    @Override
    public ResourceSchema<Company> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public String getNotes() {
        return get(NOTES);
    }

    public Metrics getMetrics() {
        return get(METRICS);
    }

    public String getBusinessName() {
        return get(BUSINESS_NAME);
    }

    public String getErpCode() {
        return get(ERP_CODE);
    }
}
