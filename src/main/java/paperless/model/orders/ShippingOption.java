package paperless.model.orders;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Způsob dopravy zvolený zákazníkem.
 */
public class ShippingOption extends Resource {

    public static final String TYPE_PICKUP = "pickup";
    public static final String TYPE_CUSTOMERS_SHIPPING_ACCOUNT = "customers_shipping_account";
    public static final String TYPE_SUPPLIERS_SHIPPING_ACCOUNT = "suppliers_shipping_account";

    private static final DateTimeFormatter SHIP_DATE_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    public static final Field<String> CUSTOMERS_ACCOUNT_NUMBER =
            Field.nullable("customers_account_number", Converters.string());
    public static final Field<String> CUSTOMERS_CARRIER = Field.nullable("customers_carrier", Converters.string());
    public static final Field<String> SHIPPING_METHOD = Field.nullable("shipping_method", Converters.string());
    public static final Field<String> TYPE = Field.required("type", Converters.string());

    public static final ResourceSchema<ShippingOption> SCHEMA = ResourceSchema.builder("ShippingOption", ShippingOption::new)
            .fields(CUSTOMERS_ACCOUNT_NUMBER, CUSTOMERS_CARRIER, SHIPPING_METHOD, TYPE)
            .build();

    @Override
    public ResourceSchema<ShippingOption> schema() {
        return SCHEMA;
    }

    /**
     * Víceřádkový text pro dodací list nebo ERP.
     *
     * @param shipDate    datum expedice
     * @param paymentType typ platby objednávky ({@link PaymentDetails#PAYMENT_TYPE_CREDIT_CARD} apod.)
     */
    public String summary(LocalDate shipDate, String paymentType) {
        String shipOn = "Ship Date: " + (shipDate == null ? "N/A" : SHIP_DATE_FORMAT.format(shipDate));
        String type = getType();
        if (TYPE_PICKUP.equals(type)) {
            return "Customer will pickup from supplier's location.\n" + shipOn;
        }
        StringBuilder summary = new StringBuilder();
        if (TYPE_CUSTOMERS_SHIPPING_ACCOUNT.equals(type)) {
            summary.append("Use Customer's Shipping Account\n")
                    .append(shipOn).append('\n')
                    .append("Carrier: ").append(upper(getCustomersCarrier())).append('\n')
                    .append("Method: ").append(upper(getShippingMethod())).append('\n')
                    .append("Account #: ").append(getCustomersAccountNumber() == null ? "" : getCustomersAccountNumber());
        } else if (TYPE_SUPPLIERS_SHIPPING_ACCOUNT.equals(type)) {
            summary.append("Ship with Supplier's Shipping Account\n")
                    .append(shipOn).append('\n')
                    .append("Method: ").append(upper(getShippingMethod())).append('\n');
            if (PaymentDetails.PAYMENT_TYPE_CREDIT_CARD.equals(paymentType)) {
                summary.append("Shipping cost has been charged to the customer's credit card.");
            } else {
                summary.append("Supplier will bill customer for actual shipping costs.");
            }
        } else {
            summary.append("Shipping type: ").append(type).append('\n').append(shipOn);
        }
        return summary.toString();
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT);
    }

    public String getCustomersAccountNumber() {
        return get(CUSTOMERS_ACCOUNT_NUMBER);
    }

    public void setCustomersAccountNumber(String accountNumber) {
        set(CUSTOMERS_ACCOUNT_NUMBER, accountNumber);
    }

    public String getCustomersCarrier() {
        return get(CUSTOMERS_CARRIER);
    }

    public void setCustomersCarrier(String carrier) {
        set(CUSTOMERS_CARRIER, carrier);
    }

    public String getShippingMethod() {
        return get(SHIPPING_METHOD);
    }

    public void setShippingMethod(String shippingMethod) {
        set(SHIPPING_METHOD, shippingMethod);
    }

    public String getType() {
        return get(TYPE);
    }

    public void setType(String type) {
        set(TYPE, type);
    }
}
