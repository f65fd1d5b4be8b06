package paperless.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import paperless.exception.MissingRequiredFieldException;

/**
 * Převod mezi instancí resource a JSON dokumentem.
 * <ul>
 *     <li>{@code fromJson} - každé deklarované pole se dohledá podle názvu, převede a zvaliduje;
 *     chybějící pole dostane výchozí hodnotu, neznámé klíče se ignorují.</li>
 *     <li>{@code toJson} - zapíše právě ta pole, jejichž hodnota není {@link NoUpdate#NO_UPDATE};
 *     null se zapíše jako explicitní null. Tak se vyjadřuje částečná aktualizace.</li>
 * </ul>
 */
public final class ResourceMapper {

    private ResourceMapper() {
        // Utility class
    }

    public static <R extends Resource> R fromJson(ResourceSchema<R> schema, JsonNode raw) {
        return fromJson(schema, "", raw);
    }

    static <R extends Resource> R fromJson(ResourceSchema<R> schema, String path, JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw Converters.mismatch(path.isEmpty() ? schema.getName() : path, schema.getName(),
                    raw == null ? Converters.NODES.missingNode() : raw);
        }
        R instance = schema.newInstance();
        for (Field<?> field : schema.getFields()) {
            bindField(instance, schema, field, path, raw);
        }
        instance.markPersisted();
        return instance;
    }

    public static ObjectNode toJson(Resource resource) {
        ObjectNode json = Converters.NODES.objectNode();
        for (Field<?> field : resource.schema().getFields()) {
            writeField(json, field, resource.rawValue(field));
        }
        return json;
    }

    private static <T> void bindField(Resource instance, ResourceSchema<?> schema, Field<T> field,
                                      String path, JsonNode raw) {
        String fieldPath = path.isEmpty() ? field.getName() : path + "." + field.getName();
        JsonNode node = raw.get(field.getName());
        if (node == null) {
            if (field.isRequired()) {
                throw new MissingRequiredFieldException(fieldPath, schema.getName());
            }
            instance.bind(field, field.getDefaultValue());
            return;
        }
        T value = field.getConverter().fromJson(fieldPath, node);
        field.validate(fieldPath, value);
        instance.bind(field, value);
    }

    private static <T> void writeField(ObjectNode json, Field<T> field, Object value) {
        if (NoUpdate.isUnset(value)) {
            return;
        }
        if (value == null) {
            json.putNull(field.getName());
            return;
        }
        json.set(field.getName(), field.getConverter().toJson(field.cast(value)));
    }
}
