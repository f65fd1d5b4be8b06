package paperless.model.orders;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.math.BigDecimal;

/**
 * Platební údaje objednávky. U nezaplacených objednávek jsou všechna pole null.
 */
public class PaymentDetails extends Resource {

    public static final String PAYMENT_TYPE_CREDIT_CARD = "credit_card";
    public static final String PAYMENT_TYPE_PURCHASE_ORDER = "purchase_order";

    public static final Field<String> CARD_BRAND = Field.nullable("card_brand", Converters.string());
    public static final Field<String> CARD_LAST4 = Field.nullable("card_last4", Converters.string());
    public static final Field<Money> NET_PAYOUT = Field.nullable("net_payout", Converters.money());
    public static final Field<String> PAYMENT_TYPE = Field.nullable("payment_type", Converters.string());
    public static final Field<String> PURCHASE_ORDER_NUMBER = Field.nullable("purchase_order_number", Converters.string());
    public static final Field<String> PURCHASING_DEPT_CONTACT_EMAIL =
            Field.nullable("purchasing_dept_contact_email", Converters.string());
    public static final Field<String> PURCHASING_DEPT_CONTACT_NAME =
            Field.nullable("purchasing_dept_contact_name", Converters.string());
    public static final Field<Money> SHIPPING_COST = Field.nullable("shipping_cost", Converters.money());
    public static final Field<Money> SUBTOTAL = Field.nullable("subtotal", Converters.money());
    public static final Field<Money> TAX_COST = Field.nullable("tax_cost", Converters.money());
    public static final Field<BigDecimal> TAX_RATE = Field.nullable("tax_rate", Converters.decimal());
    public static final Field<String> TERMS = Field.nullable("terms", Converters.string());
    public static final Field<Money> TOTAL_PRICE = Field.nullable("total_price", Converters.money());

    public static final ResourceSchema<PaymentDetails> SCHEMA = ResourceSchema.builder("PaymentDetails", PaymentDetails::new)
            .fields(CARD_BRAND, CARD_LAST4, NET_PAYOUT, PAYMENT_TYPE, PURCHASE_ORDER_NUMBER,
                    PURCHASING_DEPT_CONTACT_EMAIL, PURCHASING_DEPT_CONTACT_NAME, SHIPPING_COST, SUBTOTAL,
                    TAX_COST, TAX_RATE, TERMS, TOTAL_PRICE)
            .build();

    @Override
    public ResourceSchema<PaymentDetails> schema() {
        return SCHEMA;
    }

    public String getCardBrand() {
        return get(CARD_BRAND);
    }

    public String getCardLast4() {
        return get(CARD_LAST4);
    }

    public Money getNetPayout() {
        return get(NET_PAYOUT);
    }

    public String getPaymentType() {
        return get(PAYMENT_TYPE);
    }

    public String getPurchaseOrderNumber() {
        return get(PURCHASE_ORDER_NUMBER);
    }

    public String getPurchasingDeptContactEmail() {
        return get(PURCHASING_DEPT_CONTACT_EMAIL);
    }

    public String getPurchasingDeptContactName() {
        return get(PURCHASING_DEPT_CONTACT_NAME);
    }

    public Money getShippingCost() {
        return get(SHIPPING_COST);
    }

    public Money getSubtotal() {
        return get(SUBTOTAL);
    }

    public Money getTaxCost() {
        return get(TAX_COST);
    }

    public BigDecimal getTaxRate() {
        return get(TAX_RATE);
    }

    public String getTerms() {
        return get(TERMS);
    }

    public Money getTotalPrice() {
        return get(TOTAL_PRICE);
    }
}
