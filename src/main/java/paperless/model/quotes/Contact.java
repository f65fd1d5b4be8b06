package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Kontaktní osoba zákazníka na nabídce.
 */
public class Contact extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<String> FIRST_NAME = Field.required("first_name", Converters.string());
    public static final Field<String> LAST_NAME = Field.required("last_name", Converters.string());
    public static final Field<String> EMAIL = Field.required("email", Converters.string());
    public static final Field<String> NOTES = Field.nullable("notes", Converters.string());
    public static final Field<String> PHONE = Field.nullable("phone", Converters.string());
    public static final Field<String> PHONE_EXT = Field.nullable("phone_ext", Converters.string());
    public static final Field<Account> ACCOUNT = Field.required("account", Converters.nested(Account.SCHEMA));

    public static final ResourceSchema<Contact> SCHEMA = ResourceSchema.builder("Contact", Contact::new)
            .fields(ID, FIRST_NAME, LAST_NAME, EMAIL, NOTES, PHONE, PHONE_EXT, ACCOUNT)
            .build();

    @Override
    public ResourceSchema<Contact> schema() {
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

    public String getPhone() {
        return get(PHONE);
    }

    public String getPhoneExt() {
        return get(PHONE_EXT);
    }

    public Account getAccount() {
        return get(ACCOUNT);
    }
}
