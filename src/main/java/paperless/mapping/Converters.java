package paperless.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import paperless.exception.TypeMismatchException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Sada převodníků pro deklarace polí.
 * <p>
 * Všechny převodníky jsou bezstavové. Neplatná vstupní hodnota vždy vyvolá
 * {@link TypeMismatchException} s cestou k poli, nikdy se tiše nenahradí výchozí hodnotou.
 */
public final class Converters {

    static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    // kladné celé číslo v rozsahu int
    private static final Pattern QUANTITY_KEY = Pattern.compile("[1-9][0-9]{0,8}");

    private static final Converter<String> STRING = new ScalarConverter<>(
            "string", JsonNode::isTextual, JsonNode::textValue, NODES::textNode);

    private static final Converter<Integer> INTEGER = new ScalarConverter<>(
            "integer", node -> node.isIntegralNumber() && node.canConvertToInt(), JsonNode::intValue, NODES::numberNode);

    private static final Converter<Long> LONG = new ScalarConverter<>(
            "long", node -> node.isIntegralNumber() && node.canConvertToLong(), JsonNode::longValue, NODES::numberNode);

    private static final Converter<Boolean> BOOLEAN = new ScalarConverter<>(
            "boolean", JsonNode::isBoolean, JsonNode::booleanValue, NODES::booleanNode);

    private Converters() {
        // Utility class
    }

    public static Converter<String> string() {
        return STRING;
    }

    public static Converter<Integer> integer() {
        return INTEGER;
    }

    public static Converter<Long> longValue() {
        return LONG;
    }

    public static Converter<Boolean> bool() {
        return BOOLEAN;
    }

    /**
     * Desetinné číslo z JSON čísla nebo číselného řetězce.
     */
    public static Converter<BigDecimal> decimal() {
        return new Converter<>() {
            @Override
            public BigDecimal fromJson(String path, JsonNode node) {
                return coerceDecimal(path, node, describe());
            }

            @Override
            public JsonNode toJson(BigDecimal value) {
                return value == null ? NODES.nullNode() : NODES.numberNode(value);
            }

            @Override
            public String describe() {
                return "decimal";
            }
        };
    }

    /**
     * Peněžní částka z JSON čísla nebo číselného řetězce; ven se zapisuje jako číslo.
     */
    public static Converter<Money> money() {
        return new Converter<>() {
            @Override
            public Money fromJson(String path, JsonNode node) {
                return Money.of(path, node);
            }

            @Override
            public JsonNode toJson(Money value) {
                return value == null ? NODES.nullNode() : NODES.numberNode(value.getDollars());
            }

            @Override
            public String describe() {
                return "money";
            }
        };
    }

    /**
     * Skalár, jehož typ se liší podle kontextu (string, číslo nebo boolean).
     * Celá čísla se vrací jako Integer nebo Long, desetinná jako BigDecimal.
     */
    public static Converter<Object> scalar() {
        return new Converter<>() {
            @Override
            public Object fromJson(String path, JsonNode node) {
                if (node.isTextual()) {
                    return node.textValue();
                }
                if (node.isBoolean()) {
                    return node.booleanValue();
                }
                if (node.isIntegralNumber()) {
                    if (node.canConvertToInt()) {
                        return node.intValue();
                    }
                    if (node.canConvertToLong()) {
                        return node.longValue();
                    }
                    return node.bigIntegerValue();
                }
                if (node.isNumber()) {
                    return node.decimalValue();
                }
                throw mismatch(path, describe(), node);
            }

            @Override
            public JsonNode toJson(Object value) {
                if (value == null) {
                    return NODES.nullNode();
                }
                if (value instanceof String) {
                    return NODES.textNode((String) value);
                }
                if (value instanceof Boolean) {
                    return NODES.booleanNode((Boolean) value);
                }
                if (value instanceof Integer) {
                    return NODES.numberNode((Integer) value);
                }
                if (value instanceof Long) {
                    return NODES.numberNode((Long) value);
                }
                if (value instanceof BigInteger) {
                    return NODES.numberNode((BigInteger) value);
                }
                if (value instanceof Number) {
                    return NODES.numberNode(coerceDecimal("scalar", value, describe()));
                }
                throw new TypeMismatchException("scalar", describe(), value.getClass().getSimpleName());
            }

            @Override
            public String describe() {
                return "string|number|boolean";
            }
        };
    }

    /**
     * Libovolný JSON bez převodu (např. volně strukturované řádky tabulek).
     */
    public static Converter<JsonNode> json() {
        return new Converter<>() {
            @Override
            public JsonNode fromJson(String path, JsonNode node) {
                if (node.isNull() || node.isMissingNode()) {
                    throw mismatch(path, describe(), node);
                }
                return node.deepCopy();
            }

            @Override
            public JsonNode toJson(JsonNode value) {
                return value == null ? NODES.nullNode() : value.deepCopy();
            }

            @Override
            public String describe() {
                return "json";
            }
        };
    }

    /**
     * Vnořený objekt podle schématu. JSON null projde jako null, z prázdných dat se objekt nevytváří.
     */
    public static <R extends Resource> Converter<R> nested(ResourceSchema<R> schema) {
        return new Converter<>() {
            @Override
            public R fromJson(String path, JsonNode node) {
                if (node.isNull()) {
                    return null;
                }
                if (!node.isObject()) {
                    throw mismatch(path, describe(), node);
                }
                return ResourceMapper.fromJson(schema, path, node);
            }

            @Override
            public JsonNode toJson(R value) {
                return value == null ? NODES.nullNode() : ResourceMapper.toJson(value);
            }

            @Override
            public String describe() {
                return schema.getName();
            }
        };
    }

    /**
     * Seznam hodnot ve stejném pořadí jako v JSON poli. JSON null je chyba, pokud se převodník
     * nezabalí do {@link #optional(Converter)}.
     */
    public static <T> Converter<List<T>> list(Converter<T> inner) {
        return new Converter<>() {
            @Override
            public List<T> fromJson(String path, JsonNode node) {
                if (!node.isArray()) {
                    throw mismatch(path, describe(), node);
                }
                List<T> result = new ArrayList<>(node.size());
                for (int i = 0; i < node.size(); i++) {
                    result.add(inner.fromJson(path + "[" + i + "]", node.get(i)));
                }
                return result;
            }

            @Override
            public JsonNode toJson(List<T> value) {
                if (value == null) {
                    return NODES.nullNode();
                }
                ArrayNode array = NODES.arrayNode(value.size());
                for (T item : value) {
                    array.add(item == null ? NODES.nullNode() : inner.toJson(item));
                }
                return array;
            }

            @Override
            public String describe() {
                return "list<" + inner.describe() + ">";
            }
        };
    }

    /**
     * Objekt, jehož klíče jsou kladná celá čísla (objednaná množství). Výsledek je seřazen podle klíče.
     */
    public static <V> Converter<Map<Integer, V>> mapping(Converter<V> inner) {
        return new Converter<>() {
            @Override
            public Map<Integer, V> fromJson(String path, JsonNode node) {
                if (!node.isObject()) {
                    throw mismatch(path, describe(), node);
                }
                Map<Integer, V> result = new TreeMap<>();
                Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    String entryPath = path + "." + entry.getKey();
                    result.put(parseQuantityKey(entryPath, entry.getKey()), inner.fromJson(entryPath, entry.getValue()));
                }
                return result;
            }

            @Override
            public JsonNode toJson(Map<Integer, V> value) {
                if (value == null) {
                    return NODES.nullNode();
                }
                ObjectNode object = NODES.objectNode();
                value.forEach((key, item) ->
                        object.set(String.valueOf(key), item == null ? NODES.nullNode() : inner.toJson(item)));
                return object;
            }

            @Override
            public String describe() {
                return "map<quantity, " + inner.describe() + ">";
            }
        };
    }

    /**
     * Obalí převodník tak, že JSON null projde jako null. Sentinel {@link NoUpdate#NO_UPDATE}
     * se do převodníku nikdy nedostane, {@link ResourceMapper} takové pole vynechá.
     */
    public static <T> Converter<T> optional(Converter<T> inner) {
        return new Converter<>() {
            @Override
            public T fromJson(String path, JsonNode node) {
                if (node.isNull()) {
                    return null;
                }
                return inner.fromJson(path, node);
            }

            @Override
            public JsonNode toJson(T value) {
                return value == null ? NODES.nullNode() : inner.toJson(value);
            }

            @Override
            public String describe() {
                return "optional<" + inner.describe() + ">";
            }
        };
    }

    /**
     * Převede hodnotu na BigDecimal. BigDecimal projde beze změny, čísla a číselné řetězce
     * (i jako JSON uzly) se převedou, cokoliv jiného skončí {@link TypeMismatchException}.
     */
    public static BigDecimal coerceDecimal(String path, Object value, String expectedType) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Money) {
            return ((Money) value).getDollars();
        }
        if (value instanceof JsonNode) {
            JsonNode node = (JsonNode) value;
            if (node.isNumber()) {
                return node.decimalValue();
            }
            if (node.isTextual()) {
                return parseDecimal(path, node.textValue(), expectedType);
            }
            throw mismatch(path, expectedType, node);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new TypeMismatchException(path, expectedType, String.valueOf(d));
            }
            return new BigDecimal(value.toString());
        }
        if (value instanceof String) {
            return parseDecimal(path, (String) value, expectedType);
        }
        throw new TypeMismatchException(path, expectedType, value == null ? "null" : value.getClass().getSimpleName());
    }

    private static BigDecimal parseDecimal(String path, String text, String expectedType) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new TypeMismatchException(path, expectedType, "STRING '" + text + "'");
        }
    }

    private static Integer parseQuantityKey(String path, String key) {
        if (!QUANTITY_KEY.matcher(key).matches()) {
            throw new TypeMismatchException(path, "positive integer key", "'" + key + "'");
        }
        return Integer.valueOf(key);
    }

    static TypeMismatchException mismatch(String path, String expectedType, JsonNode node) {
        return new TypeMismatchException(path, expectedType, node.getNodeType().name());
    }

    /**
     * Převodník pro jednoduché JSON skaláry.
     */
    private static final class ScalarConverter<T> implements Converter<T> {

        private final String typeName;
        private final Predicate<JsonNode> accepts;
        private final Function<JsonNode, T> reader;
        private final Function<T, JsonNode> writer;

        private ScalarConverter(String typeName, Predicate<JsonNode> accepts,
                                Function<JsonNode, T> reader, Function<T, JsonNode> writer) {
            this.typeName = typeName;
            this.accepts = accepts;
            this.reader = reader;
            this.writer = writer;
        }

        @Override
        public T fromJson(String path, JsonNode node) {
            if (!accepts.test(node)) {
                throw mismatch(path, typeName, node);
            }
            return reader.apply(node);
        }

        @Override
        public JsonNode toJson(T value) {
            return value == null ? NODES.nullNode() : writer.apply(value);
        }

        @Override
        public String describe() {
            return typeName;
        }
    }
}
