package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.util.List;

/**
 * Nacenění komponenty pro jedno poptávané množství.
 */
public class Quantity extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<Integer> QUANTITY = Field.required("quantity", Converters.integer());
    public static final Field<Money> MARKUP_1_PRICE = Field.nullable("markup_1_price", Converters.money());
    public static final Field<String> MARKUP_1_NAME = Field.nullable("markup_1_name", Converters.string());
    public static final Field<Money> MARKUP_2_PRICE = Field.nullable("markup_2_price", Converters.money());
    public static final Field<String> MARKUP_2_NAME = Field.nullable("markup_2_name", Converters.string());
    public static final Field<Money> UNIT_PRICE = Field.required("unit_price", Converters.money());
    public static final Field<Money> TOTAL_PRICE = Field.required("total_price", Converters.money());
    public static final Field<Money> TOTAL_PRICE_WITH_REQUIRED_ADD_ONS =
            Field.required("total_price_with_required_add_ons", Converters.money());
    public static final Field<Integer> LEAD_TIME = Field.required("lead_time", Converters.integer());
    public static final Field<List<Expedite>> EXPEDITES =
            Field.required("expedites", Converters.list(Converters.nested(Expedite.SCHEMA)));
    public static final Field<Boolean> IS_MOST_LIKELY_WON_QUANTITY =
            Field.required("is_most_likely_won_quantity", Converters.bool());
    public static final Field<Integer> MOST_LIKELY_WON_QUANTITY_PERCENT =
            Field.nullable("most_likely_won_quantity_percent", Converters.integer());

    public static final ResourceSchema<Quantity> SCHEMA = ResourceSchema.builder("Quantity", Quantity::new)
            .fields(ID, QUANTITY, MARKUP_1_PRICE, MARKUP_1_NAME, MARKUP_2_PRICE, MARKUP_2_NAME, UNIT_PRICE,
                    TOTAL_PRICE, TOTAL_PRICE_WITH_REQUIRED_ADD_ONS, LEAD_TIME, EXPEDITES,
                    IS_MOST_LIKELY_WON_QUANTITY, MOST_LIKELY_WON_QUANTITY_PERCENT)
            .build();

    @Override
    public ResourceSchema<Quantity> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public Integer getQuantity() {
        return get(QUANTITY);
    }

    public Money getMarkup1Price() {
        return get(MARKUP_1_PRICE);
    }

    public String getMarkup1Name() {
        return get(MARKUP_1_NAME);
    }

    public Money getMarkup2Price() {
        return get(MARKUP_2_PRICE);
    }

    public String getMarkup2Name() {
        return get(MARKUP_2_NAME);
    }

    public Money getUnitPrice() {
        return get(UNIT_PRICE);
    }

    public Money getTotalPrice() {
        return get(TOTAL_PRICE);
    }

    public Money getTotalPriceWithRequiredAddOns() {
        return get(TOTAL_PRICE_WITH_REQUIRED_ADD_ONS);
    }

    public Integer getLeadTime() {
        return get(LEAD_TIME);
    }

    public List<Expedite> getExpedites() {
        return get(EXPEDITES);
    }

    public boolean isMostLikelyWonQuantity() {
        return Boolean.TRUE.equals(get(IS_MOST_LIKELY_WON_QUANTITY));
    }

    public Integer getMostLikelyWonQuantityPercent() {
        return get(MOST_LIKELY_WON_QUANTITY_PERCENT);
    }
}
