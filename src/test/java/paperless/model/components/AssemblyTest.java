package paperless.model.components;

import org.junit.jupiter.api.Test;
import paperless.exception.ValidationException;
import paperless.model.orders.OrderComponent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssemblyTest {

    @Test
    void shouldIterateSharedChildOnce() {
        // 3 je potomkem 1 i 2
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(
                component(1, List.of(), 2, 3),
                component(2, List.of(1), 3),
                component(3, List.of(1, 2))));

        List<Integer> order = assembly.iterate().stream()
                .map(node -> node.getComponent().getId())
                .collect(Collectors.toList());

        assertThat(order).containsExactly(1, 2, 3);
        assertThat(assembly.getTotalChildQuantity(3)).isEqualTo(2);
        assembly.validate();
    }

    @Test
    void shouldRejectCycle() {
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(
                component(1, List.of(), 2),
                component(2, List.of(1, 3), 3),
                component(3, List.of(2), 2)));

        assertThatThrownBy(assembly::iterate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Cyklus");
    }

    @Test
    void shouldRejectMissingChild() {
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(component(1, List.of(), 42)));

        assertThatThrownBy(assembly::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("42");
    }

    @Test
    void shouldRejectMultipleRoots() {
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(
                component(1, List.of()),
                component(2, List.of())));

        assertThatThrownBy(assembly::getRootComponent).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectMissingRoot() {
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(component(1, List.of(2)), component(2, List.of(1))));

        assertThatThrownBy(assembly::getRootComponent)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("kořenovou");
    }

    @Test
    void shouldReportUnreachableComponents() {
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(
                component(1, List.of()),
                component(5, List.of(9))));

        assertThatThrownBy(assembly::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("5");
    }

    @Test
    void shouldRejectChildThatDoesNotListItsParent() {
        // 1 uvádí 3 jako potomka, 3 ale uvádí jen rodiče 2
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(
                component(1, List.of(), 2, 3),
                component(2, List.of(1)),
                component(3, List.of(2))));

        assertThatThrownBy(assembly::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Komponenta 1 má potomka 3");
    }

    @Test
    void shouldRejectParentThatDoesNotListItsChild() {
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(
                component(1, List.of(), 2, 3),
                component(2, List.of(1)),
                component(3, List.of(1, 2))));

        assertThatThrownBy(assembly::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Komponenta 3 uvádí rodiče 2");
    }

    @Test
    void shouldReturnNullForUnknownComponent() {
        Assembly<OrderComponent> assembly = new Assembly<>(List.of(component(1, List.of())));

        assertThat(assembly.getComponent(1).getId()).isEqualTo(1);
        assertThat(assembly.getComponent(2)).isNull();
    }

    private static OrderComponent component(int id, List<Integer> parentIds, int... childIds) {
        OrderComponent component = new OrderComponent();
        component.set(BaseComponent.ID, id);
        component.set(BaseComponent.PARENT_IDS, parentIds);
        List<ChildComponent> children = new ArrayList<>();
        for (int childId : childIds) {
            ChildComponent child = new ChildComponent();
            child.set(ChildComponent.CHILD_ID, childId);
            child.set(ChildComponent.QUANTITY, 1);
            children.add(child);
        }
        component.set(BaseComponent.CHILDREN, children);
        component.set(BaseComponent.TYPE, childIds.length > 0 ? BaseComponent.TYPE_ASSEMBLED : BaseComponent.TYPE_MANUFACTURED);
        return component;
    }
}
