package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

import java.math.BigDecimal;

/**
 * Zrychlená dodací lhůta za příplatek.
 */
public class Expedite extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<Integer> LEAD_TIME = Field.required("lead_time", Converters.integer());
    public static final Field<BigDecimal> MARKUP = Field.required("markup", Converters.decimal());
    public static final Field<Money> UNIT_PRICE = Field.required("unit_price", Converters.money());
    public static final Field<Money> TOTAL_PRICE = Field.required("total_price", Converters.money());

    public static final ResourceSchema<Expedite> SCHEMA = ResourceSchema.builder("Expedite", Expedite::new)
            .fields(ID, LEAD_TIME, MARKUP, UNIT_PRICE, TOTAL_PRICE)
            .build();

    @Override
    public ResourceSchema<Expedite> schema() {
        return SCHEMA;
    }

    public Integer getId() {
        return get(ID);
    }

    public Integer getLeadTime() {
        return get(LEAD_TIME);
    }

    public BigDecimal getMarkup() {
        return get(MARKUP);
    }

    public Money getUnitPrice() {
        return get(UNIT_PRICE);
    }

    public Money getTotalPrice() {
        return get(TOTAL_PRICE);
    }
}
