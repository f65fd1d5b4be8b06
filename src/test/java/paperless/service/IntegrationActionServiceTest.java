package paperless.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import paperless.MockData;
import paperless.connector.PaperlessTransport;
import paperless.mapping.ResourceState;
import paperless.model.integrations.IntegrationAction;
import paperless.model.integrations.IntegrationActionDefinition;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntegrationActionServiceTest {

    private static final String MI_UUID = "abcef968-7903-44eb-9037-2033573c6c3e";
    private static final String ACTIONS_URL = "managed_integrations/public/" + MI_UUID + "/integration_actions";

    @Mock
    private PaperlessTransport transport;

    private IntegrationActionService integrationActionService;

    @BeforeEach
    void setUp() {
        integrationActionService = new IntegrationActionService(new ResourceService(transport, 10));
    }

    @Test
    void shouldBuildNestedListUrls() {
        assertThat(IntegrationAction.listEndpoint(MI_UUID).listUrl()).isEqualTo(ACTIONS_URL);
        assertThat(IntegrationActionDefinition.listEndpoint(MI_UUID).listUrl())
                .isEqualTo("managed_integrations/public/" + MI_UUID + "/integration_action_definitions");
    }

    @Test
    void shouldGetAction() {
        when(transport.getResource(eq("integration_actions/public/abc-123"), any()))
                .thenReturn(MockData.load("integration_action.json"));

        IntegrationAction action = integrationActionService.get("abc-123");

        assertThat(action.getType()).isEqualTo("export_order");
        assertThat(action.getEntityId()).isEqualTo("1");
        assertThat(action.getStatus()).isEqualTo(IntegrationAction.STATUS_QUEUED);
        assertThat(action.getStatusMessage()).isNull();
        assertThat(action.isUnset(IntegrationAction.STATUS_MESSAGE)).isFalse();
        assertThat(action.getCreatedDateTime()).isNotNull();
    }

    @Test
    void shouldListActionsOfIntegration() {
        when(transport.getResourceList(eq(ACTIONS_URL), anyMap()))
                .thenReturn(MockData.load("integration_action_list.json"));

        List<IntegrationAction> actions = integrationActionService.list(MI_UUID);

        assertThat(actions).hasSize(8);
        assertThat(actions.get(0).getUuid()).isEqualTo("20bf3744-625a-49d3-b6a8-5293334e9476");
        assertThat(actions.get(0).getStatus()).isEqualTo(IntegrationAction.STATUS_COMPLETED);
        assertThat(actions.get(0).getEntityId()).isEqualTo("1");
        assertThat(actions.get(0).getCreatedDateTime())
                .isEqualTo(OffsetDateTime.of(2021, 5, 4, 14, 21, 9, 123456000, ZoneOffset.UTC));
        assertThat(actions.get(7).getUuid()).isEqualTo("f9e8b33c-2361-47b2-ad23-c9390d488619");
        assertThat(actions.get(7).getStatus()).isEqualTo(IntegrationAction.STATUS_QUEUED);
        assertThat(actions.get(7).getEntityId()).isEqualTo("99");
    }

    @Test
    void shouldListUnwrappedArray() {
        when(transport.getResourceList(eq(ACTIONS_URL), anyMap()))
                .thenReturn(MockData.load("integration_action_list_unwrapped.json"));

        assertThat(integrationActionService.list(MI_UUID)).hasSize(2);
    }

    @Test
    void shouldFilterByStatusAndType() {
        when(transport.getResourceList(ACTIONS_URL, Map.of("status", "queued", "action_type", "export_order")))
                .thenReturn(MockData.json("{\"results\": [], \"next\": null}"));

        assertThat(integrationActionService.filter(MI_UUID, "queued", "export_order")).isEmpty();
    }

    @Test
    void shouldSkipNullFilters() {
        when(transport.getResourceList(ACTIONS_URL, Map.of("status", "failed")))
                .thenReturn(MockData.json("{\"results\": [], \"next\": null}"));

        assertThat(integrationActionService.filter(MI_UUID, "failed", null)).isEmpty();
    }

    @Test
    void shouldCreateActionWithTypeAndEntityOnly() {
        when(transport.createResource(eq("integration_actions/public"), any()))
                .thenReturn(MockData.load("integration_action.json"));
        IntegrationAction action = new IntegrationAction("export_order", "1");

        integrationActionService.create(action);

        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(transport).createResource(eq("integration_actions/public"), body.capture());
        assertThat(body.getValue()).isEqualTo(MockData.json("{\"type\": \"export_order\", \"entity_id\": \"1\"}"));
        assertThat(action.getUuid()).isEqualTo("abc-123");
        assertThat(action.getState()).isEqualTo(ResourceState.PERSISTED);
    }

    @Test
    void shouldCreateManyInOneCall() {
        when(transport.createResource(eq("integration_actions/public"), any()))
                .thenReturn(MockData.json("[]"));
        IntegrationAction first = new IntegrationAction("export_order", "1");
        IntegrationAction second = new IntegrationAction("export_quote", "2");

        integrationActionService.createMany(List.of(first, second));

        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(transport).createResource(eq("integration_actions/public"), body.capture());
        assertThat(body.getValue()).isEqualTo(MockData.json("[{\"type\": \"export_order\", \"entity_id\": \"1\"},"
                + " {\"type\": \"export_quote\", \"entity_id\": \"2\"}]"));
        // instance se se serverem neslaďují
        assertThat(first.getUuid()).isNull();
    }

    @Test
    void shouldUpdateManyWithPatch() {
        when(transport.getResourceList(eq(ACTIONS_URL), anyMap()))
                .thenReturn(MockData.load("integration_action_list_unwrapped.json"));
        List<IntegrationAction> actions = integrationActionService.list(MI_UUID);
        actions.forEach(action -> action.setStatus(IntegrationAction.STATUS_FAILED));

        integrationActionService.updateMany(actions);

        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(transport).request(eq("integration_actions/public"), eq(HttpMethod.PATCH), body.capture(), isNull());
        assertThat(body.getValue()).hasSize(2);
        assertThat(body.getValue().get(0).get("uuid").textValue()).isEqualTo("20bf3744-625a-49d3-b6a8-5293334e9476");
        assertThat(body.getValue().get(1).get("status").textValue()).isEqualTo(IntegrationAction.STATUS_FAILED);
    }

    @Test
    void shouldListDefinitions() {
        when(transport.getResourceList(
                eq("managed_integrations/public/" + MI_UUID + "/integration_action_definitions"), anyMap()))
                .thenReturn(MockData.load("integration_action_definition_list.json"));

        List<IntegrationActionDefinition> definitions = integrationActionService.listDefinitions(MI_UUID);

        assertThat(definitions).extracting(IntegrationActionDefinition::getName)
                .containsExactly("Export Order", "Export Quote");
        assertThat(definitions.get(0).getRelatedObjectType()).isEqualTo("order");
        assertThat(definitions.get(1).getRelatedObjectType()).isNull();
    }
}
