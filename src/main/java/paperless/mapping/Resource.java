package paperless.mapping;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Lokální obraz entity Paperless Parts. Hodnoty jsou uloženy podle deklarací polí ze {@link #schema()}.
 * <p>
 * Pole, které nikdo nenastavil, drží {@link NoUpdate#NO_UPDATE}; typovaný getter pro něj vrací null,
 * rozlišit ho od explicitního null lze přes {@link #isUnset(Field)}.
 * <p>
 * Instance nejsou thread-safe. Knihovna je nikde neukládá ani nesdílí, patří volajícímu;
 * souběžné čtení a zápis (včetně sladění po create/update) vyžaduje externí synchronizaci.
 */
public abstract class Resource {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private boolean persisted;
    private boolean modified;

    protected Resource() {
        for (Field<?> field : schema().getFields()) {
            values.put(field.getName(), field.initialValue());
        }
    }

    /**
     * Schéma typu. Implementace vrací statickou konstantu.
     */
    public abstract ResourceSchema<? extends Resource> schema();

    /**
     * @return hodnota pole, nebo null pokud je pole null nebo nenastavené
     */
    public <T> T get(Field<T> field) {
        Object value = rawValue(field);
        if (NoUpdate.isUnset(value)) {
            return null;
        }
        return field.cast(value);
    }

    /**
     * Nastaví hodnotu pole (null znamená explicitní null, které se pošle na server).
     */
    public <T> void set(Field<T> field, T value) {
        requireDeclared(field);
        field.validate(field.getName(), value);
        values.put(field.getName(), value);
        if (persisted) {
            modified = true;
        }
    }

    /**
     * Vrátí pole do stavu "nezadáno", takže se při příští aktualizaci neodešle.
     */
    public void unset(Field<?> field) {
        requireDeclared(field);
        values.put(field.getName(), NoUpdate.NO_UPDATE);
        if (persisted) {
            modified = true;
        }
    }

    public boolean isUnset(Field<?> field) {
        return NoUpdate.isUnset(rawValue(field));
    }

    /**
     * @return hodnota primárního klíče, nebo null pokud ji typ nemá nebo ještě není známa
     */
    public Object getPrimaryKey() {
        Field<?> primaryKey = schema().getPrimaryKey();
        if (primaryKey == null) {
            return null;
        }
        Object value = rawValue(primaryKey);
        return NoUpdate.isUnset(value) ? null : value;
    }

    public ResourceState getState() {
        if (!persisted) {
            return ResourceState.TRANSIENT;
        }
        return modified ? ResourceState.MODIFIED : ResourceState.PERSISTED;
    }

    /**
     * Zkratka pro {@link ResourceMapper#toJson(Resource)}.
     */
    public ObjectNode toJson() {
        return ResourceMapper.toJson(this);
    }

    /**
     * Převezme hodnoty všech deklarovaných polí z verze vrácené serverem. Identita této instance
     * se nemění, takže reference držené volajícím zůstávají platné.
     *
     * @param serverCopy čerstvě naparsovaná instance stejného typu
     */
    public void reconcileWith(Resource serverCopy) {
        if (serverCopy.schema() != schema()) {
            throw new IllegalArgumentException(String.format(
                    "Nelze sladit %s s %s", schema().getName(), serverCopy.schema().getName()));
        }
        for (Field<?> field : schema().getFields()) {
            values.put(field.getName(), serverCopy.values.get(field.getName()));
        }
        markPersisted();
    }

    Object rawValue(Field<?> field) {
        requireDeclared(field);
        return values.get(field.getName());
    }

    void bind(Field<?> field, Object value) {
        values.put(field.getName(), value);
    }

    void markPersisted() {
        persisted = true;
        modified = false;
    }

    private void requireDeclared(Field<?> field) {
        if (!schema().declares(field)) {
            throw new IllegalArgumentException(String.format(
                    "Pole '%s' není deklarováno v %s", field.getName(), schema().getName()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((Resource) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), values);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", schema().getName() + "(", ")");
        values.forEach((name, value) -> joiner.add(name + "=" + value));
        return joiner.toString();
    }
}
