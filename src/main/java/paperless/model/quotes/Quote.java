package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.ListableEndpoint;
import paperless.mapping.Money;
import paperless.mapping.ReadableEndpoint;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;
import paperless.mapping.UpdatableEndpoint;
import paperless.model.common.Salesperson;
import paperless.util.DateTimes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Nabídka. Jednoznačně ji určuje dvojice číslo + revize, proto se čte přes
 * {@link paperless.service.QuoteService#get(int, Integer)} s parametrem {@code revision}.
 */
public class Quote extends Resource {

    public static final String STATUS_OUTSTANDING = "outstanding";
    public static final String STATUS_CANCELLED = "cancelled";
    public static final String STATUS_TRASH = "trash";
    public static final String STATUS_LOST = "lost";

    public static final ReadableEndpoint READ = () -> "quotes/public";
    public static final ListableEndpoint LIST = () -> "quotes/public";
    public static final UpdatableEndpoint UPDATE = () -> "quotes/public";

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<Integer> NUMBER = Field.required("number", Converters.integer());
    public static final Field<Integer> REVISION_NUMBER = Field.nullable("revision_number", Converters.integer());
    public static final Field<Salesperson> SALES_PERSON =
            Field.required("sales_person", Converters.nested(Salesperson.SCHEMA));
    public static final Field<Salesperson> SALESPERSON =
            Field.required("salesperson", Converters.nested(Salesperson.SCHEMA));
    public static final Field<Salesperson> ESTIMATOR = Field.required("estimator", Converters.nested(Salesperson.SCHEMA));
    public static final Field<Contact> CONTACT = Field.required("contact", Converters.nested(Contact.SCHEMA));
    public static final Field<Customer> CUSTOMER = Field.required("customer", Converters.nested(Customer.SCHEMA));
    public static final Field<BigDecimal> TAX_RATE = Field.nullable("tax_rate", Converters.decimal());
    public static final Field<Money> TAX_COST = Field.nullable("tax_cost", Converters.money());
    public static final Field<String> PRIVATE_NOTES = Field.nullable("private_notes", Converters.string());
    public static final Field<List<QuoteItem>> QUOTE_ITEMS =
            Field.required("quote_items", Converters.list(Converters.nested(QuoteItem.SCHEMA)));
    public static final Field<String> STATUS = Field.nullable("status", Converters.string());
    public static final Field<String> SENT_DATE = Field.nullable("sent_date", Converters.string());
    public static final Field<String> EXPIRED_DATE = Field.required("expired_date", Converters.string());
    public static final Field<String> QUOTE_NOTES = Field.nullable("quote_notes", Converters.string());
    public static final Field<Boolean> EXPORT_CONTROLLED = Field.required("export_controlled", Converters.bool());
    public static final Field<String> DIGITAL_LAST_VIEWED_ON =
            Field.nullable("digital_last_viewed_on", Converters.string());
    public static final Field<Boolean> EXPIRED = Field.required("expired", Converters.bool());
    public static final Field<RequestForQuote> REQUEST_FOR_QUOTE =
            Field.required("request_for_quote", Converters.nested(RequestForQuote.SCHEMA));
    public static final Field<ParentQuote> PARENT_QUOTE =
            Field.required("parent_quote", Converters.nested(ParentQuote.SCHEMA));
    public static final Field<ParentSupplierOrder> PARENT_SUPPLIER_ORDER =
            Field.required("parent_supplier_order", Converters.nested(ParentSupplierOrder.SCHEMA));
    public static final Field<String> AUTHENTICATED_PDF_QUOTE_URL =
            Field.nullable("authenticated_pdf_quote_url", Converters.string());
    public static final Field<Boolean> IS_UNVIEWED_DRAFTED_RFQ =
            Field.required("is_unviewed_drafted_rfq", Converters.bool());
    public static final Field<String> CREATED = Field.required("created", Converters.string());
    public static final Field<String> ERP_CODE = Field.untouched("erp_code", Converters.optional(Converters.string()));

    public static final ResourceSchema<Quote> SCHEMA = ResourceSchema.builder("Quote", Quote::new)
            .fields(ID, NUMBER, REVISION_NUMBER, SALES_PERSON, SALESPERSON, ESTIMATOR, CONTACT, CUSTOMER, TAX_RATE,
                    TAX_COST, PRIVATE_NOTES, QUOTE_ITEMS, STATUS, SENT_DATE, EXPIRED_DATE, QUOTE_NOTES,
                    EXPORT_CONTROLLED, DIGITAL_LAST_VIEWED_ON, EXPIRED, REQUEST_FOR_QUOTE, PARENT_QUOTE,
                    PARENT_SUPPLIER_ORDER, AUTHENTICATED_PDF_QUOTE_URL, IS_UNVIEWED_DRAFTED_RFQ, CREATED, ERP_CODE)
            .primaryKey(NUMBER)
            .build();

    @Override
    public ResourceSchema<Quote> schema() {
        return SCHEMA;
    }

    public OffsetDateTime getCreatedDateTime() {
        return DateTimes.parseDateTime(getCreated());
    }

    public Integer getId() {
        return get(ID);
    }

    public Integer getNumber() {
        return get(NUMBER);
    }

    public Integer getRevisionNumber() {
        return get(REVISION_NUMBER);
    }

    public Salesperson getSalesPerson() {
        return get(SALES_PERSON);
    }

    public Salesperson getSalesperson() {
        return get(SALESPERSON);
    }

    public Salesperson getEstimator() {
        return get(ESTIMATOR);
    }

    public Contact getContact() {
        return get(CONTACT);
    }

    public Customer getCustomer() {
        return get(CUSTOMER);
    }

    public BigDecimal getTaxRate() {
        return get(TAX_RATE);
    }

    public Money getTaxCost() {
        return get(TAX_COST);
    }

    public String getPrivateNotes() {
        return get(PRIVATE_NOTES);
    }

    public void setPrivateNotes(String privateNotes) {
        set(PRIVATE_NOTES, privateNotes);
    }

    public List<QuoteItem> getQuoteItems() {
        return get(QUOTE_ITEMS);
    }

    public String getStatus() {
        return get(STATUS);
    }

    public String getSentDate() {
        return get(SENT_DATE);
    }

    public String getExpiredDate() {
        return get(EXPIRED_DATE);
    }

    public String getQuoteNotes() {
        return get(QUOTE_NOTES);
    }

    public boolean isExportControlled() {
        return Boolean.TRUE.equals(get(EXPORT_CONTROLLED));
    }

    public String getDigitalLastViewedOn() {
        return get(DIGITAL_LAST_VIEWED_ON);
    }

    public boolean isExpired() {
        return Boolean.TRUE.equals(get(EXPIRED));
    }

    public RequestForQuote getRequestForQuote() {
        return get(REQUEST_FOR_QUOTE);
    }

    public ParentQuote getParentQuote() {
        return get(PARENT_QUOTE);
    }

    public ParentSupplierOrder getParentSupplierOrder() {
        return get(PARENT_SUPPLIER_ORDER);
    }

    public String getAuthenticatedPdfQuoteUrl() {
        return get(AUTHENTICATED_PDF_QUOTE_URL);
    }

    public boolean isUnviewedDraftedRfq() {
        return Boolean.TRUE.equals(get(IS_UNVIEWED_DRAFTED_RFQ));
    }

    public String getCreated() {
        return get(CREATED);
    }

    public String getErpCode() {
        return get(ERP_CODE);
    }

    public void setErpCode(String erpCode) {
        set(ERP_CODE, erpCode);
    }
}
