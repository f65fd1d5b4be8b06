package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;

public class Metrics extends Resource {

    public static final Field<Money> ORDER_REVENUE_ALL_TIME = Field.required("order_revenue_all_time", Converters.money());
    public static final Field<Money> ORDER_REVENUE_LAST_THIRTY_DAYS =
            Field.required("order_revenue_last_thirty_days", Converters.money());
    public static final Field<Integer> QUOTES_SENT_ALL_TIME = Field.required("quotes_sent_all_time", Converters.integer());
    public static final Field<Integer> QUOTES_SENT_LAST_THIRTY_DAYS =
            Field.required("quotes_sent_last_thirty_days", Converters.integer());

    public static final ResourceSchema<Metrics> SCHEMA = ResourceSchema.builder("Metrics", Metrics::new)
            .fields(ORDER_REVENUE_ALL_TIME, ORDER_REVENUE_LAST_THIRTY_DAYS, QUOTES_SENT_ALL_TIME,
                    QUOTES_SENT_LAST_THIRTY_DAYS)
            .build();

    @Override
    public ResourceSchema<Metrics> schema() {
        return SCHEMA;
    }

    public Money getOrderRevenueAllTime() {
        return get(ORDER_REVENUE_ALL_TIME);
    }

    public Money getOrderRevenueLastThirtyDays() {
        return get(ORDER_REVENUE_LAST_THIRTY_DAYS);
    }

    public Integer getQuotesSentAllTime() {
        return get(QUOTES_SENT_ALL_TIME);
    }

    public Integer getQuotesSentLastThirtyDays() {
        return get(QUOTES_SENT_LAST_THIRTY_DAYS);
    }
}
