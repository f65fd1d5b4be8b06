package paperless.mapping;

/**
 * Značka "pole nebylo zadáno" pro částečné aktualizace.
 * <p>
 * Pole s touto hodnotou se do odchozího JSON vůbec nezapíše, pole s hodnotou null
 * se zapíše jako explicitní null. Jde o jedinou instanci v rámci procesu, porovnává se identitou.
 */
public enum NoUpdate {
    NO_UPDATE;

    /**
     * @return true právě tehdy, když je hodnota sentinel {@link #NO_UPDATE}
     */
    public static boolean isUnset(Object value) {
        return value == NO_UPDATE;
    }

    @Override
    public String toString() {
        return "NO_UPDATE";
    }
}
