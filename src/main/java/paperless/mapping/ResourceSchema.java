package paperless.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Deklarativní popis typu resource: pole v pořadí, primární klíč a továrna na prázdné instance.
 * Vytváří se jednou při definici typu a poté se nemění.
 *
 * @param <R> typ resource
 */
@Getter
public final class ResourceSchema<R extends Resource> {

    private final String name;
    private final List<Field<?>> fields;
    private final Field<?> primaryKey;
    private final Supplier<R> factory;
    private final Map<String, Field<?>> fieldsByName;

    private ResourceSchema(String name, List<Field<?>> fields, Field<?> primaryKey, Supplier<R> factory) {
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.primaryKey = primaryKey;
        this.factory = factory;
        Map<String, Field<?>> byName = new LinkedHashMap<>();
        for (Field<?> field : fields) {
            if (byName.put(field.getName(), field) != null) {
                throw new IllegalArgumentException("Duplicitní pole '" + field.getName() + "' v " + name);
            }
        }
        if (primaryKey != null && byName.get(primaryKey.getName()) != primaryKey) {
            throw new IllegalArgumentException("Primární klíč '" + primaryKey.getName() + "' není polem " + name);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    public static <R extends Resource> Builder<R> builder(String name, Supplier<R> factory) {
        return new Builder<>(name, factory);
    }

    /**
     * Prázdná instance, všechna pole mají svou výchozí hodnotu.
     */
    public R newInstance() {
        return factory.get();
    }

    public Optional<Field<?>> findField(String fieldName) {
        return Optional.ofNullable(fieldsByName.get(fieldName));
    }

    /**
     * @return true pokud je právě tato deklarace pole součástí schématu
     */
    public boolean declares(Field<?> field) {
        return fieldsByName.get(field.getName()) == field;
    }

    /**
     * Zkratka pro {@link ResourceMapper#fromJson(ResourceSchema, JsonNode)}.
     */
    public R fromJson(JsonNode raw) {
        return ResourceMapper.fromJson(this, raw);
    }

    @Override
    public String toString() {
        return name + fields;
    }

    public static final class Builder<R extends Resource> {

        private final String name;
        private final Supplier<R> factory;
        private final List<Field<?>> fields = new ArrayList<>();
        private Field<?> primaryKey;

        private Builder(String name, Supplier<R> factory) {
            this.name = Objects.requireNonNull(name, "name");
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder<R> fields(Field<?>... fields) {
            this.fields.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder<R> fields(List<Field<?>> fields) {
            this.fields.addAll(fields);
            return this;
        }

        public Builder<R> primaryKey(Field<?> primaryKey) {
            this.primaryKey = primaryKey;
            return this;
        }

        public ResourceSchema<R> build() {
            return new ResourceSchema<>(name, fields, primaryKey, factory);
        }
    }
}
