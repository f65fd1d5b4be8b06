package paperless.model.common;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.util.Set;

/**
 * Poštovní adresa (fakturační nebo doručovací). Podporované země jsou CA a USA.
 */
public class Address extends Resource {

    private static final Set<String> COUNTRIES = Set.of("CA", "USA");

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<String> ADDRESS1 = Field.required("address1", Converters.string());
    public static final Field<String> CITY = Field.required("city", Converters.string());
    public static final Field<String> COUNTRY = Field.required("country", Converters.string())
            .validatedBy("one of " + COUNTRIES, COUNTRIES::contains);
    public static final Field<String> POSTAL_CODE = Field.required("postal_code", Converters.string());
    public static final Field<String> STATE = Field.required("state", Converters.string());

    public static final Field<String> ADDRESS2 = optionalText("address2");
    public static final Field<String> BUSINESS_NAME = optionalText("business_name");
    public static final Field<String> FIRST_NAME = optionalText("first_name");
    public static final Field<String> LAST_NAME = optionalText("last_name");
    public static final Field<String> PHONE = optionalText("phone");
    public static final Field<String> PHONE_EXT = optionalText("phone_ext");

    public static final ResourceSchema<Address> SCHEMA = ResourceSchema.builder("Address", Address::new)
            .fields(ID, ADDRESS1, CITY, COUNTRY, POSTAL_CODE, STATE,
                    ADDRESS2, BUSINESS_NAME, FIRST_NAME, LAST_NAME, PHONE, PHONE_EXT)
            .primaryKey(ID)
            .build();

    private static Field<String> optionalText(String name) {
        return Field.defaultingTo(name, Converters.optional(Converters.string()), null);
    }

    @Override
    public ResourceSchema<Address> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public String getAddress1() {
        return get(ADDRESS1);
    }

    public String getAddress2() {
        return get(ADDRESS2);
    }

    public String getCity() {
        return get(CITY);
    }

    public String getStateCode() {
        return get(STATE);
    }

    public String getPostalCode() {
        return get(POSTAL_CODE);
    }

    public String getCountry() {
        return get(COUNTRY);
    }

    public void setCountry(String country) {
        set(COUNTRY, country);
    }

    public String getBusinessName() {
        return get(BUSINESS_NAME);
    }

    public String getFirstName() {
        return get(FIRST_NAME);
    }

    public String getLastName() {
        return get(LAST_NAME);
    }

    public String getPhone() {
        return get(PHONE);
    }

    public String getPhoneExt() {
        return get(PHONE_EXT);
    }
}
