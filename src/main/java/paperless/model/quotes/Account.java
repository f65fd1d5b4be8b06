package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Zákaznický účet (firma), ke kterému patří kontakt.
 */
public class Account extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<String> NOTES = Field.nullable("notes", Converters.string());
    public static final Field<String> NAME = Field.required("name", Converters.string());
    public static final Field<String> ERP_CODE = Field.nullable("erp_code", Converters.string());

    public static final ResourceSchema<Account> SCHEMA = ResourceSchema.builder("Account", Account::new)
            .fields(ID, NOTES, NAME, ERP_CODE)
            .build();

    @Override
    public ResourceSchema<Account> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public String getNotes() {
        return get(NOTES);
    }

    public String getName() {
        return get(NAME);
    }

    public String getErpCode() {
        return get(ERP_CODE);
    }
}
