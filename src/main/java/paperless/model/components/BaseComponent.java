package paperless.model.components;

import com.fasterxml.jackson.databind.JsonNode;
import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pole společná komponentám objednávky i nabídky. Komponenta je uzel sestavy, vztahy k ostatním
 * komponentám téže položky drží přes {@code children} a {@code parent_ids}.
 */
public abstract class BaseComponent extends Resource {

    public static final String TYPE_ASSEMBLED = "assembled";
    public static final String TYPE_MANUFACTURED = "manufactured";
    public static final String TYPE_PURCHASED = "purchased";

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<List<ChildComponent>> CHILDREN =
            Field.required("children", Converters.list(Converters.nested(ChildComponent.SCHEMA)));
    public static final Field<Integer> DELIVER_QUANTITY = Field.required("deliver_quantity", Converters.integer());
    public static final Field<String> DESCRIPTION = Field.nullable("description", Converters.string());
    public static final Field<Boolean> EXPORT_CONTROLLED = Field.required("export_controlled", Converters.bool());
    public static final Field<List<String>> FINISHES = Field.required("finishes", Converters.list(Converters.string()));
    public static final Field<Integer> INNATE_QUANTITY = Field.required("innate_quantity", Converters.integer());
    public static final Field<Integer> MAKE_QUANTITY = Field.required("make_quantity", Converters.integer());
    public static final Field<Material> MATERIAL = Field.required("material", Converters.nested(Material.SCHEMA));
    public static final Field<List<Integer>> PARENT_IDS =
            Field.required("parent_ids", Converters.list(Converters.integer()));
    public static final Field<JsonNode> PART_CUSTOM_ATTRS =
            Field.defaultingTo("part_custom_attrs", Converters.optional(Converters.json()), null);
    public static final Field<String> PART_NAME = Field.nullable("part_name", Converters.string());
    public static final Field<String> PART_NUMBER = Field.nullable("part_number", Converters.string());
    public static final Field<String> PART_UUID = Field.nullable("part_uuid", Converters.string());
    public static final Field<Process> PROCESS = Field.required("process", Converters.nested(Process.SCHEMA));
    public static final Field<String> REVISION = Field.nullable("revision", Converters.string());
    public static final Field<List<SupportingFile>> SUPPORTING_FILES =
            Field.required("supporting_files", Converters.list(Converters.nested(SupportingFile.SCHEMA)));
    public static final Field<String> TYPE = Field.required("type", Converters.string());

    protected static final List<Field<?>> COMPONENT_FIELDS = List.of(ID, CHILDREN, DELIVER_QUANTITY, DESCRIPTION,
            EXPORT_CONTROLLED, FINISHES, INNATE_QUANTITY, MAKE_QUANTITY, MATERIAL, PARENT_IDS, PART_CUSTOM_ATTRS,
            PART_NAME, PART_NUMBER, PART_UUID, PROCESS, REVISION, SUPPORTING_FILES, TYPE);

    /**
     * Nakupovaný díl (spojovací materiál apod.), který se nevyrábí.
     */
    public boolean isHardware() {
        return TYPE_PURCHASED.equals(getType());
    }

    public boolean isRootComponent() {
        List<Integer> parents = getParentIds();
        return parents == null || parents.isEmpty();
    }

    /**
     * Id přímých potomků v pořadí, v jakém je uvádí server.
     */
    public List<Integer> getChildIds() {
        List<ChildComponent> children = getChildren();
        if (children == null) {
            return Collections.emptyList();
        }
        List<Integer> ids = new ArrayList<>(children.size());
        for (ChildComponent child : children) {
            ids.add(child.getChildId());
        }
        return ids;
    }

    public Integer getId() {
        return get(ID);
    }

    public List<ChildComponent> getChildren() {
        return get(CHILDREN);
    }

    public Integer getDeliverQuantity() {
        return get(DELIVER_QUANTITY);
    }

    public String getDescription() {
        return get(DESCRIPTION);
    }

    public boolean isExportControlled() {
        return Boolean.TRUE.equals(get(EXPORT_CONTROLLED));
    }

    public List<String> getFinishes() {
        return get(FINISHES);
    }

    public Integer getInnateQuantity() {
        return get(INNATE_QUANTITY);
    }

    public Integer getMakeQuantity() {
        return get(MAKE_QUANTITY);
    }

    public Material getMaterial() {
        return get(MATERIAL);
    }

    public List<Integer> getParentIds() {
        return get(PARENT_IDS);
    }

    public JsonNode getPartCustomAttrs() {
        return get(PART_CUSTOM_ATTRS);
    }

    public String getPartName() {
        return get(PART_NAME);
    }

    public String getPartNumber() {
        return get(PART_NUMBER);
    }

    public String getPartUuid() {
        return get(PART_UUID);
    }

    public Process getProcess() {
        return get(PROCESS);
    }

    public String getRevision() {
        return get(REVISION);
    }

    public List<SupportingFile> getSupportingFiles() {
        return get(SUPPORTING_FILES);
    }

    public String getType() {
        return get(TYPE);
    }
}
