package paperless.model.components;

import paperless.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strom sestavy postavený nad plochým seznamem komponent jedné položky.
 * <p>
 * Průchod je do hloubky (preorder) od kořene a potomky bere v pořadí {@code children}.
 * Komponenta, na kterou odkazuje víc rodičů, se vydá jen jednou, při prvním výskytu.
 */
public class Assembly<C extends BaseComponent> {

    private final Map<Integer, C> componentsById = new LinkedHashMap<>();

    public Assembly(List<C> components) {
        if (components != null) {
            for (C component : components) {
                componentsById.put(component.getId(), component);
            }
        }
    }

    /**
     * @throws ValidationException pokud položka nemá právě jeden kořen
     */
    public C getRootComponent() {
        C root = null;
        for (C component : componentsById.values()) {
            if (component.isRootComponent()) {
                if (root != null) {
                    throw new ValidationException(String.format(
                            "Sestava má více kořenových komponent (%d, %d)", root.getId(), component.getId()));
                }
                root = component;
            }
        }
        if (root == null) {
            throw new ValidationException("Sestava nemá kořenovou komponentu");
        }
        return root;
    }

    /**
     * @return komponenta s daným id, nebo null
     */
    public C getComponent(int componentId) {
        return componentsById.get(componentId);
    }

    /**
     * Součet {@code quantity} přes všechny vazby rodič-potomek, které odkazují na danou komponentu,
     * tj. kolik kusů komponenty spotřebuje jeden kus přímých rodičů dohromady.
     */
    public int getTotalChildQuantity(int componentId) {
        int total = 0;
        for (C component : componentsById.values()) {
            List<ChildComponent> children = component.getChildren();
            if (children == null) {
                continue;
            }
            for (ChildComponent child : children) {
                if (child.getChildId() == componentId) {
                    total += child.getQuantity();
                }
            }
        }
        return total;
    }

    public List<AssemblyNode<C>> iterate() {
        List<AssemblyNode<C>> nodes = new ArrayList<>(componentsById.size());
        visit(getRootComponent(), 0, 0, 1, null, new HashSet<>(), new HashSet<>(), nodes);
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Ověří, že sestava je strom: jediný kořen, všechny odkazy na potomky vedou na existující
     * komponenty, žádný cyklus, z kořene je dosažitelná každá komponenta a seznamy
     * {@code parent_ids} odpovídají seznamům {@code children} v obou směrech.
     *
     * @throws ValidationException při první nalezené chybě
     */
    public void validate() {
        List<AssemblyNode<C>> nodes = iterate();
        if (nodes.size() != componentsById.size()) {
            Set<Integer> unreachable = new HashSet<>(componentsById.keySet());
            for (AssemblyNode<C> node : nodes) {
                unreachable.remove(node.getComponent().getId());
            }
            throw new ValidationException(String.format(
                    "Komponenty %s nejsou dosažitelné z kořene sestavy", unreachable));
        }
        checkLinks();
    }

    private void checkLinks() {
        for (C component : componentsById.values()) {
            for (Integer childId : component.getChildIds()) {
                if (!parentIdsOf(componentsById.get(childId)).contains(component.getId())) {
                    throw new ValidationException(String.format(
                            "Komponenta %d má potomka %d, který ji neuvádí mezi rodiči", component.getId(), childId));
                }
            }
            for (Integer parentId : parentIdsOf(component)) {
                C parent = componentsById.get(parentId);
                if (parent == null || !parent.getChildIds().contains(component.getId())) {
                    throw new ValidationException(String.format(
                            "Komponenta %d uvádí rodiče %d, který ji nemá mezi potomky", component.getId(), parentId));
                }
            }
        }
    }

    private static List<Integer> parentIdsOf(BaseComponent component) {
        List<Integer> parentIds = component.getParentIds();
        return parentIds != null ? parentIds : Collections.emptyList();
    }

    private void visit(C component, int level, int levelIndex, int levelCount, C parent,
                       Set<Integer> visited, Set<Integer> path, List<AssemblyNode<C>> nodes) {
        visited.add(component.getId());
        path.add(component.getId());
        nodes.add(new AssemblyNode<>(component, level, levelIndex, levelCount, parent));

        List<Integer> childIds = component.getChildIds();
        for (int i = 0; i < childIds.size(); i++) {
            Integer childId = childIds.get(i);
            if (path.contains(childId)) {
                throw new ValidationException(String.format(
                        "Cyklus v sestavě: komponenta %d je potomkem sama sebe", childId));
            }
            C child = componentsById.get(childId);
            if (child == null) {
                throw new ValidationException(String.format(
                        "Komponenta %d odkazuje na neexistujícího potomka %d", component.getId(), childId));
            }
            if (!visited.contains(childId)) {
                visit(child, level + 1, i, childIds.size(), component, visited, path, nodes);
            }
        }
        path.remove(component.getId());
    }
}
