package paperless.model.components;

import paperless.mapping.Converters;
import paperless.mapping.Field;
import paperless.mapping.Money;
import paperless.mapping.Resource;

import java.math.BigDecimal;
import java.util.List;

/**
 * Společný základ materiálové nebo dílenské operace. Objednávky a nabídky se liší jen
 * tvarem kalkulačních proměnných, ty deklaruje potomek.
 */
public abstract class BaseOperation extends Resource {

    public static final Field<Integer> ID = Field.required("id", Converters.integer());
    public static final Field<String> CATEGORY = Field.required("category", Converters.string());
    public static final Field<Money> COST = Field.nullable("cost", Converters.money());
    public static final Field<Boolean> IS_FINISH = Field.required("is_finish", Converters.bool());
    public static final Field<Boolean> IS_OUTSIDE_SERVICE = Field.required("is_outside_service", Converters.bool());
    public static final Field<String> NAME = Field.required("name", Converters.string());
    public static final Field<String> OPERATION_DEFINITION_NAME =
            Field.nullable("operation_definition_name", Converters.string());
    public static final Field<String> NOTES = Field.nullable("notes", Converters.string());
    public static final Field<List<OperationQuantity>> QUANTITIES =
            Field.required("quantities", Converters.list(Converters.nested(OperationQuantity.SCHEMA)));
    public static final Field<Integer> POSITION = Field.required("position", Converters.integer());
    public static final Field<BigDecimal> RUNTIME = Field.nullable("runtime", Converters.decimal());
    public static final Field<BigDecimal> SETUP_TIME = Field.nullable("setup_time", Converters.decimal());

    protected static final List<Field<?>> OPERATION_FIELDS = List.of(ID, CATEGORY, COST, IS_FINISH,
            IS_OUTSIDE_SERVICE, NAME, OPERATION_DEFINITION_NAME, NOTES, QUANTITIES, POSITION, RUNTIME, SETUP_TIME);

    /**
     * Hodnota kalkulační proměnné podle jejího popisku.
     *
     * @return hodnota, nebo null pokud operace takovou proměnnou nemá
     */
    public abstract Object getVariable(String label);

    public Integer getId() {
        return get(ID);
    }

    public String getCategory() {
        return get(CATEGORY);
    }

    public Money getCost() {
        return get(COST);
    }

    public boolean isFinish() {
        return Boolean.TRUE.equals(get(IS_FINISH));
    }

    public boolean isOutsideService() {
        return Boolean.TRUE.equals(get(IS_OUTSIDE_SERVICE));
    }

    public String getName() {
        return get(NAME);
    }

    public String getOperationDefinitionName() {
        return get(OPERATION_DEFINITION_NAME);
    }

    public String getNotes() {
        return get(NOTES);
    }

    public List<OperationQuantity> getQuantities() {
        return get(QUANTITIES);
    }

    public Integer getPosition() {
        return get(POSITION);
    }

    public BigDecimal getRuntime() {
        return get(RUNTIME);
    }

    public BigDecimal getSetupTime() {
        return get(SETUP_TIME);
    }
}
