package paperless.mapping;

import java.util.List;

/**
 * Jednoduchý resource pro testy mapovací vrstvy.
 */
class Widget extends Resource {

    static final Field<Integer> ID = Field.required("id", Converters.integer());
    static final Field<String> NAME = Field.required("name", Converters.string());
    static final Field<String> NOTE = Field.defaultingTo("note", Converters.optional(Converters.string()), null);
    static final Field<String> ERP_CODE = Field.untouched("erp_code", Converters.optional(Converters.string()));
    static final Field<Integer> QUANTITY = Field.untouched("quantity", Converters.integer())
            .validatedBy("positive", value -> value > 0);
    static final Field<List<Part>> PARTS = Field.defaultingTo("parts",
            Converters.list(Converters.nested(Part.SCHEMA)), List.of());
    static final Field<Money> PRICE = Field.nullable("price", Converters.money());

    static final ResourceSchema<Widget> SCHEMA = ResourceSchema.builder("Widget", Widget::new)
            .fields(ID, NAME, NOTE, ERP_CODE, QUANTITY, PARTS, PRICE)
            .primaryKey(ID)
            .build();

    @Override
    public ResourceSchema<Widget> schema() {
        return SCHEMA;
    }

    static class Part extends Resource {

        static final Field<String> SKU = Field.required("sku", Converters.string());
        static final Field<Integer> COUNT = Field.required("count", Converters.integer());

        static final ResourceSchema<Part> SCHEMA = ResourceSchema.builder("Part", Part::new)
                .fields(SKU, COUNT)
                .build();

        @Override
        public ResourceSchema<Part> schema() {
            return SCHEMA;
        }
    }
}
