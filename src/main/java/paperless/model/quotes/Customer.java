package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

public class Customer extends Resource {

    public static final Field<Integer> ID = Field.nullable("id", Converters.integer());
    public static final Field<String> FIRST_NAME = Field.required("first_name", Converters.string());
    public static final Field<String> LAST_NAME = Field.required("last_name", Converters.string());
    public static final Field<String> EMAIL = Field.required("email", Converters.string());
    public static final Field<String> NOTES = Field.nullable("notes", Converters.string());
    public static final Field<Company> COMPANY = Field.required("company", Converters.nested(Company.SCHEMA));

    public static final ResourceSchema<Customer> SCHEMA = ResourceSchema.builder("Customer", Customer::new)
            .fields(ID, FIRST_NAME, LAST_NAME, EMAIL, NOTES, COMPANY)
            .build();

    @Override
    public ResourceSchema<Customer> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
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

    public String getNotes() {
        return get(NOTES);
    }

    public Company getCompany() {
        return get(COMPANY);
    }
}
