package paperless.model.orders;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;
import paperless.model.components.Assembly;
import paperless.model.components.AssemblyNode;
import paperless.util.DateTimes;

import java.time.LocalDate;
import java.util.List;

/**
 * Řádek objednávky. Komponenty tvoří sestavu, jejíž kořen je objednaný díl.
 */
public class OrderItem extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<List<OrderComponent>> COMPONENTS =
            Field.required("components", Converters.list(Converters.nested(OrderComponent.SCHEMA)));
    public static final Field<String> DESCRIPTION = Field.nullable("description", Converters.string());
    public static final Field<Boolean> EXPEDITE_REVENUE = Field.nullable("expedite_revenue", Converters.bool());
    public static final Field<Boolean> EXPORT_CONTROLLED = Field.required("export_controlled", Converters.bool());
    public static final Field<String> FILENAME = Field.nullable("filename", Converters.string());
    public static final Field<Integer> LEAD_DAYS = Field.nullable("lead_days", Converters.integer());
    public static final Field<Money> MARKUP_1_PRICE = Field.nullable("markup_1_price", Converters.money());
    public static final Field<String> MARKUP_1_NAME = Field.nullable("markup_1_name", Converters.string());
    public static final Field<Money> MARKUP_2_PRICE = Field.nullable("markup_2_price", Converters.money());
    public static final Field<String> MARKUP_2_NAME = Field.nullable("markup_2_name", Converters.string());
    public static final Field<String> PRIVATE_NOTES = Field.nullable("private_notes", Converters.string());
    public static final Field<String> PUBLIC_NOTES = Field.nullable("public_notes", Converters.string());
    public static final Field<Integer> QUANTITY = Field.required("quantity", Converters.integer());
    public static final Field<String> QUOTE_ITEM_TYPE = Field.required("quote_item_type", Converters.string());
    public static final Field<Integer> ROOT_COMPONENT_ID = Field.required("root_component_id", Converters.integer());
    public static final Field<String> SHIPS_ON = Field.required("ships_on", Converters.string());
    public static final Field<Money> TOTAL_PRICE = Field.required("total_price", Converters.money());
    public static final Field<Money> UNIT_PRICE = Field.required("unit_price", Converters.money());
    public static final Field<Money> BASE_PRICE = Field.required("base_price", Converters.money());
    public static final Field<Money> ADD_ON_FEES = Field.nullable("add_on_fees", Converters.money());
    public static final Field<List<OrderedAddOn>> ORDERED_ADD_ONS =
            Field.required("ordered_add_ons", Converters.list(Converters.nested(OrderedAddOn.SCHEMA)));

    public static final ResourceSchema<OrderItem> SCHEMA = ResourceSchema.builder("OrderItem", OrderItem::new)
            .fields(ID, COMPONENTS, DESCRIPTION, EXPEDITE_REVENUE, EXPORT_CONTROLLED, FILENAME, LEAD_DAYS,
                    MARKUP_1_PRICE, MARKUP_1_NAME, MARKUP_2_PRICE, MARKUP_2_NAME, PRIVATE_NOTES, PUBLIC_NOTES,
                    QUANTITY, QUOTE_ITEM_TYPE, ROOT_COMPONENT_ID, SHIPS_ON, TOTAL_PRICE, UNIT_PRICE, BASE_PRICE,
                    ADD_ON_FEES, ORDERED_ADD_ONS)
            .build();

    @Override
    public ResourceSchema<OrderItem> schema() {
        return SCHEMA;
    }

    public OrderComponent getRootComponent() {
        return assembly().getRootComponent();
    }

    public OrderComponent getComponent(int componentId) {
        return assembly().getComponent(componentId);
    }

    /**
     * Komponenty sestavy v pořadí průchodu do hloubky od kořene.
     */
    public List<AssemblyNode<OrderComponent>> iterateAssembly() {
        return assembly().iterate();
    }

    public int getTotalChildQuantity(int componentId) {
        return assembly().getTotalChildQuantity(componentId);
    }

    public void validateAssembly() {
        assembly().validate();
    }

    private Assembly<OrderComponent> assembly() {
        return new Assembly<>(getComponents());
    }

    public LocalDate getShipsOnDate() {
        return DateTimes.parseDate(getShipsOn());
    }

    public Integer getId() {
        return get(ID);
    }

    public List<OrderComponent> getComponents() {
        return get(COMPONENTS);
    }

    public String getDescription() {
        return get(DESCRIPTION);
    }

    public Boolean getExpediteRevenue() {
        return get(EXPEDITE_REVENUE);
    }

    public boolean isExportControlled() {
        return Boolean.TRUE.equals(get(EXPORT_CONTROLLED));
    }

    public String getFilename() {
        return get(FILENAME);
    }

    public Integer getLeadDays() {
        return get(LEAD_DAYS);
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

    public String getPrivateNotes() {
        return get(PRIVATE_NOTES);
    }

    public String getPublicNotes() {
        return get(PUBLIC_NOTES);
    }

    public Integer getQuantity() {
        return get(QUANTITY);
    }

    public String getQuoteItemType() {
        return get(QUOTE_ITEM_TYPE);
    }

    public Integer getRootComponentId() {
        return get(ROOT_COMPONENT_ID);
    }

    public String getShipsOn() {
        return get(SHIPS_ON);
    }

    public Money getTotalPrice() {
        return get(TOTAL_PRICE);
    }

    public Money getUnitPrice() {
        return get(UNIT_PRICE);
    }

    public Money getBasePrice() {
        return get(BASE_PRICE);
    }

    public Money getAddOnFees() {
        return get(ADD_ON_FEES);
    }

    public List<OrderedAddOn> getOrderedAddOns() {
        return get(ORDERED_ADD_ONS);
    }
}
