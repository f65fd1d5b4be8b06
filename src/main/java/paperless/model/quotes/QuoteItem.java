package paperless.model.quotes;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;
import paperless.mapping.ResourceSchema;
import paperless.model.components.Assembly;
import paperless.model.components.AssemblyNode;

import java.util.List;

/**
 * Položka nabídky. Stejně jako položka objednávky tvoří její komponenty sestavu.
 */
public class QuoteItem extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<List<QuoteComponent>> COMPONENTS =
            Field.required("components", Converters.list(Converters.nested(QuoteComponent.SCHEMA)));
    public static final Field<String> TYPE = Field.required("type", Converters.string());
    public static final Field<Integer> POSITION = Field.required("position", Converters.integer());
    public static final Field<Boolean> EXPORT_CONTROLLED = Field.required("export_controlled", Converters.bool());
    public static final Field<List<Integer>> COMPONENT_IDS =
            Field.required("component_ids", Converters.list(Converters.integer()));
    public static final Field<String> PRIVATE_NOTES = Field.nullable("private_notes", Converters.string());
    public static final Field<String> PUBLIC_NOTES = Field.nullable("public_notes", Converters.string());

    public static final ResourceSchema<QuoteItem> SCHEMA = ResourceSchema.builder("QuoteItem", QuoteItem::new)
            .fields(ID, COMPONENTS, TYPE, POSITION, EXPORT_CONTROLLED, COMPONENT_IDS, PRIVATE_NOTES, PUBLIC_NOTES)
            .build();

    @Override
    public ResourceSchema<QuoteItem> schema() {
        return SCHEMA;
    }

    public QuoteComponent getRootComponent() {
        return assembly().getRootComponent();
    }

    public QuoteComponent getComponent(int componentId) {
        return assembly().getComponent(componentId);
    }

    public List<AssemblyNode<QuoteComponent>> iterateAssembly() {
        return assembly().iterate();
    }

    public int getTotalChildQuantity(int componentId) {
        return assembly().getTotalChildQuantity(componentId);
    }

    public void validateAssembly() {
        assembly().validate();
    }

    private Assembly<QuoteComponent> assembly() {
        return new Assembly<>(getComponents());
    }

    public Integer getId() {
        return get(ID);
    }

    public List<QuoteComponent> getComponents() {
        return get(COMPONENTS);
    }

    public String getType() {
        return get(TYPE);
    }

    public Integer getPosition() {
        return get(POSITION);
    }

    public boolean isExportControlled() {
        return Boolean.TRUE.equals(get(EXPORT_CONTROLLED));
    }

    public List<Integer> getComponentIds() {
        return get(COMPONENT_IDS);
    }

    public String getPrivateNotes() {
        return get(PRIVATE_NOTES);
    }

    public String getPublicNotes() {
        return get(PUBLIC_NOTES);
    }
}
