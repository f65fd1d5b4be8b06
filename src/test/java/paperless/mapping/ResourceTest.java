package paperless.mapping;

import org.junit.jupiter.api.Test;
import paperless.exception.ValidationException;
import paperless.model.common.Salesperson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static paperless.MockData.json;

class ResourceTest {

    @Test
    void shouldStartTransientWithRequiredFieldsUnset() {
        Widget widget = new Widget();

        assertThat(widget.getState()).isEqualTo(ResourceState.TRANSIENT);
        assertThat(widget.isUnset(Widget.ID)).isTrue();
        assertThat(widget.getPrimaryKey()).isNull();
    }

    @Test
    void shouldBecomeModifiedAfterLocalChange() {
        Widget widget = Widget.SCHEMA.fromJson(json("{\"id\": 1, \"name\": \"a\", \"price\": null}"));
        assertThat(widget.getState()).isEqualTo(ResourceState.PERSISTED);

        widget.set(Widget.NAME, "b");

        assertThat(widget.getState()).isEqualTo(ResourceState.MODIFIED);
        assertThat(widget.getPrimaryKey()).isEqualTo(1);
    }

    @Test
    void shouldUnsetFieldBackToSentinel() {
        Widget widget = new Widget();
        widget.set(Widget.ERP_CODE, "E-1");

        widget.unset(Widget.ERP_CODE);

        assertThat(widget.isUnset(Widget.ERP_CODE)).isTrue();
        assertThat(widget.toJson().has("erp_code")).isFalse();
    }

    @Test
    void shouldValidateOnSet() {
        Widget widget = new Widget();

        assertThatThrownBy(() -> widget.set(Widget.QUANTITY, -1))
                .isInstanceOf(ValidationException.class);
        assertThat(widget.isUnset(Widget.QUANTITY)).isTrue();
    }

    @Test
    void shouldRejectFieldOfAnotherType() {
        Widget widget = new Widget();

        assertThatThrownBy(() -> widget.set(Salesperson.EMAIL, "a@b.c"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReconcileInPlace() {
        Widget local = new Widget();
        local.set(Widget.NAME, "draft");
        Widget server = Widget.SCHEMA.fromJson(
                json("{\"id\": 99, \"name\": \"final\", \"erp_code\": \"E-9\", \"price\": 10}"));

        local.reconcileWith(server);

        assertThat(local.get(Widget.ID)).isEqualTo(99);
        assertThat(local.get(Widget.NAME)).isEqualTo("final");
        assertThat(local.get(Widget.ERP_CODE)).isEqualTo("E-9");
        assertThat(local.getState()).isEqualTo(ResourceState.PERSISTED);
        assertThat(local).isEqualTo(server).isNotSameAs(server);
    }

    @Test
    void shouldRefuseToReconcileDifferentType() {
        Salesperson other = new Salesperson();

        assertThatThrownBy(() -> new Widget().reconcileWith(other))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
