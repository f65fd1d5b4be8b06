package paperless.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import paperless.MockData;
import paperless.connector.PaperlessTransport;
import paperless.exception.MalformedPaginationEnvelopeException;
import paperless.exception.ResourceNotFoundException;
import paperless.exception.ValidationException;
import paperless.mapping.ResourceState;
import paperless.model.integrations.ManagedIntegration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceServiceTest {

    private static final String URL = "managed_integrations/public";
    private static final String NEXT_BASE = "https://api.paperlessparts.com/api/" + URL;

    // Mockuje HTTP vrstvu, služba se testuje bez sítě
    @Mock
    private PaperlessTransport transport;

    @Captor
    private ArgumentCaptor<Map<String, ?>> paramsCaptor;

    private ResourceService resourceService;

    @BeforeEach
    void setUp() {
        resourceService = new ResourceService(transport, 10);
    }

    @Nested
    @DisplayName("Výpis po stránkách")
    class ListTests {

        @Test
        void shouldFollowNextPagesAndKeepCallerParams() {
            when(transport.getResourceList(eq(URL), anyMap())).thenReturn(
                    page(NEXT_BASE + "?page=2&is_active=false", integration("a"), integration("b"), integration("c")),
                    page(NEXT_BASE + "?page=3&is_active=false", integration("d"), integration("e"), integration("f")),
                    page(null, integration("g"), integration("h")));

            Map<String, Object> params = new HashMap<>();
            params.put("is_active", "true");
            params.put("erp_name", null);

            List<ManagedIntegration> result = resourceService.list(
                    ManagedIntegration.SCHEMA, ManagedIntegration.LIST, params);

            assertThat(result).extracting(ManagedIntegration::getUuid)
                    .containsExactly("a", "b", "c", "d", "e", "f", "g", "h");
            assertThat(result).allMatch(integration -> integration.getState() == ResourceState.PERSISTED);

            verify(transport, times(3)).getResourceList(eq(URL), paramsCaptor.capture());
            List<Map<String, ?>> calls = paramsCaptor.getAllValues();
            // null parametr se neposílá
            assertThat(calls.get(0)).isEqualTo(Map.of("is_active", "true"));
            // parametr volajícího přebije hodnotu z URL další stránky
            assertThat(calls.get(1)).isEqualTo(Map.of("page", "2", "is_active", "true"));
            assertThat(calls.get(2)).isEqualTo(Map.of("page", "3", "is_active", "true"));
        }

        @Test
        void shouldAcceptBareArray() {
            ArrayNode bare = MockData.MAPPER.createArrayNode().add(integration("a")).add(integration("b"));
            when(transport.getResourceList(eq(URL), anyMap())).thenReturn(bare);

            List<ManagedIntegration> result = resourceService.list(ManagedIntegration.SCHEMA, ManagedIntegration.LIST);

            assertThat(result).extracting(ManagedIntegration::getUuid).containsExactly("a", "b");
            verify(transport, times(1)).getResourceList(eq(URL), anyMap());
        }

        @Test
        void shouldReturnEmptyListForEmptyPage() {
            when(transport.getResourceList(eq(URL), anyMap())).thenReturn(page(null));

            assertThat(resourceService.list(ManagedIntegration.SCHEMA, ManagedIntegration.LIST)).isEmpty();
        }

        @Test
        void shouldFailOnNextWithoutQuery() {
            when(transport.getResourceList(eq(URL), anyMap())).thenReturn(page(NEXT_BASE, integration("a")));

            assertThatThrownBy(() -> resourceService.list(ManagedIntegration.SCHEMA, ManagedIntegration.LIST))
                    .isInstanceOf(MalformedPaginationEnvelopeException.class);
        }

        @Test
        void shouldFailOnEnvelopeWithoutResults() {
            when(transport.getResourceList(eq(URL), anyMap())).thenReturn(MockData.json("{\"next\": null}"));

            assertThatThrownBy(() -> resourceService.list(ManagedIntegration.SCHEMA, ManagedIntegration.LIST))
                    .isInstanceOf(MalformedPaginationEnvelopeException.class);
        }

        @Test
        void shouldStopAtPageCeiling() {
            ResourceService limited = new ResourceService(transport, 2);
            // server posílá pořád stejný odkaz na další stránku
            when(transport.getResourceList(eq(URL), anyMap()))
                    .thenReturn(page(NEXT_BASE + "?page=2", integration("a")));

            assertThatThrownBy(() -> limited.list(ManagedIntegration.SCHEMA, ManagedIntegration.LIST))
                    .isInstanceOfSatisfying(MalformedPaginationEnvelopeException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo("MALFORMED_PAGINATION_ENVELOPE"));
            verify(transport, times(2)).getResourceList(eq(URL), anyMap());
        }

        @Test
        void shouldRejectNonPositiveCeiling() {
            assertThatThrownBy(() -> new ResourceService(transport, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Načtení, založení a aktualizace")
    class CrudTests {

        @Test
        void shouldGetByPrimaryKey() {
            when(transport.getResource(eq(URL + "/712f4343-a29c-4263-be38-3c1694f53439"), any()))
                    .thenReturn(MockData.load("managed_integration.json"));

            ManagedIntegration integration = resourceService.get(
                    ManagedIntegration.SCHEMA, ManagedIntegration.READ, "712f4343-a29c-4263-be38-3c1694f53439");

            assertThat(integration.getErpName()).isEqualTo("jobboss");
            assertThat(integration.getState()).isEqualTo(ResourceState.PERSISTED);
        }

        @Test
        void shouldPropagateNotFound() {
            when(transport.getResource(anyString(), any()))
                    .thenThrow(new ResourceNotFoundException(URL + "/missing", "{\"detail\": \"Not found.\"}"));

            assertThatThrownBy(() -> resourceService.get(ManagedIntegration.SCHEMA, ManagedIntegration.READ, "missing"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void shouldCreateAndReconcileSameInstance() {
            ManagedIntegration integration = new ManagedIntegration("jobboss", true);
            when(transport.createResource(eq(URL), any())).thenReturn(MockData.load("managed_integration.json"));

            ManagedIntegration result = resourceService.create(integration, ManagedIntegration.CREATE);

            // volající drží stále stejnou instanci, jen s hodnotami ze serveru
            assertThat(result).isSameAs(integration);
            assertThat(integration.getUuid()).isEqualTo("712f4343-a29c-4263-be38-3c1694f53439");
            assertThat(integration.getErpVersion()).isEqualTo("12.1");
            assertThat(integration.getState()).isEqualTo(ResourceState.PERSISTED);

            ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
            verify(transport).createResource(eq(URL), body.capture());
            assertThat(body.getValue()).isEqualTo(MockData.json("{\"erp_name\": \"jobboss\", \"is_active\": true}"));
        }

        @Test
        void shouldUpdateOnlySetFields() {
            when(transport.getResource(anyString(), any())).thenReturn(MockData.load("managed_integration.json"));
            ManagedIntegration integration = resourceService.get(
                    ManagedIntegration.SCHEMA, ManagedIntegration.READ, "712f4343-a29c-4263-be38-3c1694f53439");
            integration.setErpVersion("12.2");
            assertThat(integration.getState()).isEqualTo(ResourceState.MODIFIED);

            ObjectNode serverCopy = (ObjectNode) MockData.load("managed_integration.json");
            serverCopy.put("erp_version", "12.2");
            when(transport.updateResource(eq(URL), eq("712f4343-a29c-4263-be38-3c1694f53439"), any(), anyMap()))
                    .thenReturn(serverCopy);

            ManagedIntegration result = resourceService.update(integration, ManagedIntegration.UPDATE);

            assertThat(result).isSameAs(integration);
            assertThat(integration.getErpVersion()).isEqualTo("12.2");
            assertThat(integration.getState()).isEqualTo(ResourceState.PERSISTED);
        }

        @Test
        void shouldRejectUpdateWithoutPrimaryKey() {
            ManagedIntegration integration = new ManagedIntegration("jobboss", true);

            assertThatThrownBy(() -> resourceService.update(integration, ManagedIntegration.UPDATE))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(transport);
        }
    }

    private static ObjectNode integration(String uuid) {
        ObjectNode node = MockData.MAPPER.createObjectNode();
        node.put("uuid", uuid);
        node.put("erp_name", "jobboss");
        node.put("is_active", true);
        return node;
    }

    private static ObjectNode page(String next, ObjectNode... items) {
        ObjectNode page = MockData.MAPPER.createObjectNode();
        ArrayNode results = page.putArray("results");
        for (ObjectNode item : items) {
            results.add(item);
        }
        if (next == null) {
            page.putNull("next");
        } else {
            page.put("next", next);
        }
        return page;
    }
}
