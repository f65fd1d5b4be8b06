package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

/**
 * Poptávka zadaná zákazníkem přes webový formulář.
 */
public class RequestForQuote extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<String> EMAIL = Field.required("email", Converters.string());
    public static final Field<String> FIRST_NAME = Field.required("first_name", Converters.string());
    public static final Field<String> LAST_NAME = Field.required("last_name", Converters.string());
    public static final Field<String> BUSINESS_NAME = Field.required("business_name", Converters.string());
    public static final Field<String> PHONE = Field.nullable("phone", Converters.string());
    public static final Field<String> PHONE_EXT = Field.nullable("phone_ext", Converters.string());
    public static final Field<String> REQUESTED_DELIVERY_DATE =
            Field.nullable("requested_delivery_date", Converters.string());
    public static final Field<Boolean> CONTACT_INFO_CONFLICT = Field.required("contact_info_conflict", Converters.bool());

    public static final ResourceSchema<RequestForQuote> SCHEMA = ResourceSchema.builder("RequestForQuote", RequestForQuote::new)
            .fields(ID, EMAIL, FIRST_NAME, LAST_NAME, BUSINESS_NAME, PHONE, PHONE_EXT, REQUESTED_DELIVERY_DATE,
                    CONTACT_INFO_CONFLICT)
            .build();

    @Override
    public ResourceSchema<RequestForQuote> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public String getEmail() {
        return get(EMAIL);
    }

    public String getFirstName() {
        return get(FIRST_NAME);
    }

    public String getLastName() {
        return get(LAST_NAME);
    }

    public String getBusinessName() {
        return get(BUSINESS_NAME);
    }

    public String getPhone() {
        return get(PHONE);
    }

    public String getPhoneExt() {
        return get(PHONE_EXT);
    }

    public String getRequestedDeliveryDate() {
        return get(REQUESTED_DELIVERY_DATE);
    }

    public boolean isContactInfoConflict() {
        return Boolean.TRUE.equals(get(CONTACT_INFO_CONFLICT));
    }
}
