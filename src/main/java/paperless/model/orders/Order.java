package paperless.model.orders;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.ListableEndpoint;
import paperless.mapping.ReadableEndpoint;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;
import paperless.model.common.Address;
import paperless.model.common.Salesperson;
import paperless.util.DateTimes;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Objednávka vzniklá z přijaté nabídky. Přes API se dá jen číst.
 */
public class Order extends Resource {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_IN_PROCESS = "in_process";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_CANCELLED = "cancelled";

    public static final ReadableEndpoint READ = () -> "orders/public";
    public static final ListableEndpoint LIST = () -> "orders/public";

    public static final Field<Integer> NUMBER = Field.required("number", Converters.integer());
    public static final Field<String> UUID = Field.untouched("uuid", Converters.optional(Converters.string()));
    public static final Field<Integer> QUOTE_NUMBER = Field.required("quote_number", Converters.integer());
    public static final Field<Integer> QUOTE_REVISION_NUMBER =
            Field.defaultingTo("quote_revision_number", Converters.optional(Converters.integer()), null);
    public static final Field<String> STATUS = Field.required("status", Converters.string());
    public static final Field<Salesperson> SALES_PERSON =
            Field.required("sales_person", Converters.nested(Salesperson.SCHEMA));
    public static final Field<Salesperson> ESTIMATOR = Field.required("estimator", Converters.nested(Salesperson.SCHEMA));
    public static final Field<PaymentDetails> PAYMENT_DETAILS =
            Field.required("payment_details", Converters.nested(PaymentDetails.SCHEMA));
    public static final Field<Address> BILLING_INFO = Field.required("billing_info", Converters.nested(Address.SCHEMA));
    public static final Field<Address> SHIPPING_INFO = Field.required("shipping_info", Converters.nested(Address.SCHEMA));
    public static final Field<ShippingOption> SHIPPING_OPTION =
            Field.required("shipping_option", Converters.nested(ShippingOption.SCHEMA));
    public static final Field<List<OrderItem>> ORDER_ITEMS =
            Field.required("order_items", Converters.list(Converters.nested(OrderItem.SCHEMA)));
    public static final Field<String> PRIVATE_NOTES = Field.nullable("private_notes", Converters.string());
    public static final Field<String> SHIPS_ON = Field.nullable("ships_on", Converters.string());
    public static final Field<String> DELIVER_BY = Field.nullable("deliver_by", Converters.string());
    public static final Field<String> CREATED = Field.required("created", Converters.string());

    public static final ResourceSchema<Order> SCHEMA = ResourceSchema.builder("Order", Order::new)
            .fields(NUMBER, UUID, QUOTE_NUMBER, QUOTE_REVISION_NUMBER, STATUS, SALES_PERSON, ESTIMATOR,
                    PAYMENT_DETAILS, BILLING_INFO, SHIPPING_INFO, SHIPPING_OPTION, ORDER_ITEMS, PRIVATE_NOTES,
                    SHIPS_ON, DELIVER_BY, CREATED)
            .primaryKey(NUMBER)
            .build();

    @Override
    public ResourceSchema<Order> schema() {
        return SCHEMA;
    }

    public OffsetDateTime getCreatedDateTime() {
        return DateTimes.parseDateTime(getCreated());
    }

    public Integer getNumber() {
        return get(NUMBER);
    }

    public String getUuid() {
        return get(UUID);
    }

    public Integer getQuoteNumber() {
        return get(QUOTE_NUMBER);
    }

    public Integer getQuoteRevisionNumber() {
        return get(QUOTE_REVISION_NUMBER);
    }

    public String getStatus() {
        return get(STATUS);
    }

    public Salesperson getSalesPerson() {
        return get(SALES_PERSON);
    }

    public Salesperson getEstimator() {
        return get(ESTIMATOR);
    }

    public PaymentDetails getPaymentDetails() {
        return get(PAYMENT_DETAILS);
    }

    public Address getBillingInfo() {
        return get(BILLING_INFO);
    }

    public Address getShippingInfo() {
        return get(SHIPPING_INFO);
    }

    public ShippingOption getShippingOption() {
        return get(SHIPPING_OPTION);
    }

    public List<OrderItem> getOrderItems() {
        return get(ORDER_ITEMS);
    }

    public String getPrivateNotes() {
        return get(PRIVATE_NOTES);
    }

    public String getShipsOn() {
        return get(SHIPS_ON);
    }

    public String getDeliverBy() {
        return get(DELIVER_BY);
    }

    public String getCreated() {
        return get(CREATED);
    }
}
