package paperless.model.components;

import lombok.Value;

/**
 * Komponenta spolu s její pozicí ve stromu sestavy.
 * <p>
 * {@code level} je hloubka (kořen má 0), {@code levelIndex} pořadí mezi sourozenci
 * a {@code levelCount} počet sourozenců včetně komponenty samotné.
 */
@Value
public class AssemblyNode<C extends BaseComponent> {

    C component;
    int level;
    int levelIndex;
    int levelCount;
    C parent;
}
