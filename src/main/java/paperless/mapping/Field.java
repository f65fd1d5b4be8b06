package paperless.mapping;

import lombok.Getter;
import paperless.exception.ValidationException;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Neměnná deklarace jednoho pole resource: název na drátě, převodník, výchozí hodnota a validátor.
 * <p>
 * Pole bez výchozí hodnoty je povinné, musí být v každé odpovědi serveru. Výchozí hodnotou bývá
 * nejčastěji {@link NoUpdate#NO_UPDATE}, tj. pole, které klient neposílá, dokud ho sám nenastaví.
 *
 * @param <T> typ hodnoty pole
 */
@Getter
public final class Field<T> {

    private final String name;
    private final Converter<T> converter;
    private final boolean required;
    private final Object defaultValue;
    private final Predicate<? super T> validator;
    private final String validatorDescription;

    private Field(String name, Converter<T> converter, boolean required, Object defaultValue,
                  Predicate<? super T> validator, String validatorDescription) {
        this.name = Objects.requireNonNull(name, "name");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.required = required;
        this.defaultValue = defaultValue;
        this.validator = validator;
        this.validatorDescription = validatorDescription;
    }

    /**
     * Povinné pole bez výchozí hodnoty.
     */
    public static <T> Field<T> required(String name, Converter<T> converter) {
        return new Field<>(name, converter, true, null, null, null);
    }

    /**
     * Povinné pole, které smí mít hodnotu null.
     */
    public static <T> Field<T> nullable(String name, Converter<T> converter) {
        return required(name, Converters.optional(converter));
    }

    /**
     * Nepovinné pole s výchozí hodnotou {@link NoUpdate#NO_UPDATE}.
     */
    public static <T> Field<T> untouched(String name, Converter<T> converter) {
        return new Field<>(name, converter, false, NoUpdate.NO_UPDATE, null, null);
    }

    /**
     * Nepovinné pole s konkrétní výchozí hodnotou (může být i null).
     */
    public static <T> Field<T> defaultingTo(String name, Converter<T> converter, T defaultValue) {
        return new Field<>(name, converter, false, defaultValue, null, null);
    }

    /**
     * Vrátí kopii pole s validátorem. Validátor se volá jen pro hodnoty různé od null.
     */
    public Field<T> validatedBy(String description, Predicate<? super T> validator) {
        return new Field<>(name, converter, required, defaultValue, validator, description);
    }

    /**
     * Popis očekávaného typu podle převodníku.
     */
    public String getExpectedType() {
        return converter.describe();
    }

    Object initialValue() {
        return required ? NoUpdate.NO_UPDATE : defaultValue;
    }

    /**
     * Uložené hodnoty pole prošly převodníkem nebo {@link Resource#set}, proto mají typ {@code T}.
     */
    T cast(Object value) {
        @SuppressWarnings("unchecked")
        T typed = (T) value;
        return typed;
    }

    void validate(String path, T value) {
        if (value == null || validator == null) {
            return;
        }
        if (!validator.test(value)) {
            throw new ValidationException(
                    String.format("Pole '%s' neprošlo validací: %s", path, validatorDescription),
                    path,
                    String.format("Field: %s, value: %s, rule: %s", path, value, validatorDescription));
        }
    }

    @Override
    public String toString() {
        return name + ": " + converter.describe();
    }
}
