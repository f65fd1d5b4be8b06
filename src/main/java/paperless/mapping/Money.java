package paperless.mapping;

import java.math.BigDecimal;

/**
 * Peněžní částka v dolarech. Porovnává se podle číselné hodnoty, ne podle zápisu (2757.8 == 2757.80).
 */
public final class Money implements Comparable<Money> {

    private final BigDecimal dollars;

    private Money(BigDecimal dollars) {
        this.dollars = dollars;
    }

    /**
     * Vytvoří částku z libovolné podporované hodnoty. Instance {@code Money} se vrací beze změny,
     * čísla a řetězce se převedou přes BigDecimal.
     *
     * @throws paperless.exception.TypeMismatchException pokud hodnotu nelze převést
     */
    public static Money of(Object value) {
        return of("money", value);
    }

    static Money of(String path, Object value) {
        if (value instanceof Money) {
            return (Money) value;
        }
        return new Money(Converters.coerceDecimal(path, value, "money"));
    }

    public BigDecimal getDollars() {
        return dollars;
    }

    @Override
    public int compareTo(Money other) {
        return dollars.compareTo(other.dollars);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money)) {
            return false;
        }
        return dollars.compareTo(((Money) o).dollars) == 0;
    }

    @Override
    public int hashCode() {
        return dollars.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return "$" + dollars.toPlainString();
    }
}
