package paperless.mapping;

/**
 * Stav lokální instance resource vůči serveru.
 */
public enum ResourceState {
    /** Vytvořeno lokálně, na serveru zatím neexistuje. */
    TRANSIENT,
    /** Odpovídá poslední známé verzi ze serveru. */
    PERSISTED,
    /** Načteno ze serveru a poté lokálně změněno. */
    MODIFIED
}
