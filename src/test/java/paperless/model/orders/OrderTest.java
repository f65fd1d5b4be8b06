package paperless.model.orders;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import paperless.MockData;
import paperless.mapping.Money;
import paperless.mapping.ResourceMapper;
import paperless.mapping.ResourceState;
import paperless.model.components.AssemblyNode;
import paperless.model.components.Operation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class OrderTest {

    private Order order;

    @BeforeEach
    void setUp() {
        order = ResourceMapper.fromJson(Order.SCHEMA, MockData.load("order.json"));
    }

    @Test
    void shouldParseOrderHeader() {
        assertThat(order.getNumber()).isEqualTo(72);
        assertThat(order.getQuoteNumber()).isEqualTo(194);
        assertThat(order.getQuoteRevisionNumber()).isNull();
        assertThat(order.getStatus()).isEqualTo(Order.STATUS_PENDING);
        assertThat(order.getPrimaryKey()).isEqualTo(72);
        assertThat(order.getState()).isEqualTo(ResourceState.PERSISTED);
        assertThat(order.getSalesPerson().getFirstName()).isEqualTo("Heathrow Chester");
        assertThat(order.getEstimator().getFirstName()).isEqualTo("Heathrow Chester");
        assertThat(order.getPrivateNotes()).isNull();
        assertThat(order.getDeliverBy()).isNull();
    }

    @Test
    void shouldParseDates() {
        assertThat(order.getCreatedDateTime())
                .isEqualTo(OffsetDateTime.of(2020, 6, 22, 15, 37, 8, 587375000, ZoneOffset.ofHours(-4)));
        assertThat(order.getOrderItems().get(0).getShipsOnDate()).isEqualTo(LocalDate.of(2020, 7, 10));
    }

    @Test
    void shouldParsePaymentAndAddresses() {
        PaymentDetails payment = order.getPaymentDetails();
        assertThat(payment.getPaymentType()).isEqualTo(PaymentDetails.PAYMENT_TYPE_CREDIT_CARD);
        assertThat(payment.getTotalPrice()).isEqualTo(Money.of("3035.00"));
        assertThat(payment.getPurchaseOrderNumber()).isNull();

        assertThat(order.getBillingInfo().getCountry()).isEqualTo("USA");
        assertThat(order.getBillingInfo().getBusinessName()).isEqualTo("Acme Machining");
        assertThat(order.getShippingInfo().getBusinessName()).isNull();
        assertThat(order.getShippingInfo().getPostalCode()).isEqualTo("02114");
    }

    @Test
    void shouldParseOrderItemPrices() {
        OrderItem item = order.getOrderItems().get(0);

        assertThat(item.getId()).isEqualTo(2001);
        assertThat(item.getBasePrice()).isEqualTo(Money.of("2757.80"));
        assertThat(item.getAddOnFees()).isEqualTo(Money.of(125));
        assertThat(item.getOrderedAddOns()).hasSize(1);
        assertThat(item.getOrderedAddOns().get(0).getQuantity()).isEqualTo(5);
        assertThat(item.getComponents()).hasSize(8);

        assertThat(order.getOrderItems().get(1).getAddOnFees()).isNull();
        assertThat(order.getOrderItems().get(2).getDescription()).isEmpty();
    }

    @Test
    void shouldParseOperations() {
        OrderComponent root = order.getOrderItems().get(0).getRootComponent();
        Operation assemble = root.getShopOperations().get(0);

        assertThat(assemble.getName()).isEqualTo("Assemble");
        assertThat(assemble.getVariable("Material Selection")).isEqualTo("304-#4");
        assertThat(assemble.getVariable("Lot Charge")).isEqualTo(150);
        assertThat(assemble.getVariable("Missing")).isNull();

        OrderComponent single = order.getOrderItems().get(1).getRootComponent();
        assertThat(single.getMaterialOperations()).hasSize(2);
        assertThat(single.getShopOperations()).hasSize(7);
        Operation chromate = single.getShopOperations().get(6);
        assertThat(chromate.getName()).isEqualTo("Chromate");
        assertThat(chromate.getCost()).isEqualTo(Money.of(150));
        assertThat(chromate.getSetupTime()).isNull();
        assertThat(chromate.getRuntime()).isEqualByComparingTo(new BigDecimal("0.25"));
        assertThat(chromate.getQuantities().get(0).getQuantity()).isEqualTo(1);
    }

    @Test
    void shouldSerializeBackToSameJson() {
        assertThat(order.toJson().equals(MockData.NUMERIC, MockData.load("order.json"))).isTrue();
    }

    @Nested
    @DisplayName("Sestava položky")
    class AssemblyTests {

        @Test
        void shouldFindRootComponent() {
            OrderItem item = order.getOrderItems().get(0);
            OrderComponent root = item.getRootComponent();

            assertThat(root.getId()).isEqualTo(69652);
            assertThat(root.getPartUuid()).isEqualTo("ddab27ae-ff7b-4db2-be24-41002be6cb58");
            assertThat(root.getPartName()).isEqualTo("small-sub-assembly.STEP");
            assertThat(root.getSupportingFiles()).hasSize(1);
            assertThat(root.getId()).isEqualTo(item.getRootComponentId());
        }

        @Test
        void shouldIterateDepthFirst() {
            OrderItem item = order.getOrderItems().get(0);
            List<AssemblyNode<OrderComponent>> nodes = item.iterateAssembly();

            assertThat(nodes.stream().map(node -> node.getComponent().getId()).collect(Collectors.toList()))
                    .containsExactly(69652, 69658, 69657, 69659, 69656, 69655, 69654, 69653);

            AssemblyNode<OrderComponent> node = nodes.get(4);
            assertThat(node.getLevel()).isEqualTo(2);
            assertThat(node.getLevelIndex()).isEqualTo(1);
            assertThat(node.getLevelCount()).isEqualTo(4);
            assertThat(node.getParent().getId()).isEqualTo(69657);

            assertThat(nodes.get(0).getLevel()).isZero();
            assertThat(nodes.get(0).getParent()).isNull();
        }

        @Test
        void shouldCountHardwareQuantity() {
            OrderItem item = order.getOrderItems().get(0);
            List<OrderComponent> hardware = item.getComponents().stream()
                    .filter(OrderComponent::isHardware)
                    .collect(Collectors.toList());

            assertThat(hardware).hasSize(1);
            assertThat(hardware.get(0).getPartNumber()).isEqualTo("AC-M6-2");
            assertThat(item.getTotalChildQuantity(hardware.get(0).getId())).isEqualTo(1);
            assertThat(item.getTotalChildQuantity(69653)).isEqualTo(2);
        }

        @Test
        void shouldValidateEveryItem() {
            order.getOrderItems().forEach(OrderItem::validateAssembly);

            assertThat(order.getOrderItems().get(2).iterateAssembly()).hasSize(1);
        }
    }

    @Test
    void shouldParseMinimalOrder() {
        Order minimal = ResourceMapper.fromJson(Order.SCHEMA, MockData.load("minimal_order.json"));

        assertThat(minimal.getNumber()).isEqualTo(73);
        assertThat(minimal.getSalesPerson()).isNull();
        assertThat(minimal.getEstimator()).isNull();
        assertThat(minimal.getBillingInfo()).isNull();
        assertThat(minimal.getShippingInfo()).isNull();
        assertThat(minimal.getShippingOption()).isNull();
        assertThat(minimal.getPaymentDetails().getPaymentType()).isNull();
        assertThat(minimal.getOrderItems()).hasSize(1);
    }
}
