package paperless.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import paperless.MockData;
import paperless.connector.PaperlessTransport;
import paperless.exception.ValidationException;
import paperless.mapping.ResourceState;
import paperless.model.quotes.Quote;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuoteServiceTest {

    @Mock
    private PaperlessTransport transport;

    private QuoteService quoteService;

    @BeforeEach
    void setUp() {
        quoteService = new QuoteService(new ResourceService(transport, 10));
    }

    @Test
    void shouldGetQuoteRevision() {
        when(transport.getResource("quotes/public/211", Map.of("revision", 2))).thenReturn(MockData.load("quote.json"));

        Quote quote = quoteService.get(211, 2);

        assertThat(quote.getNumber()).isEqualTo(211);
        assertThat(quote.getRevisionNumber()).isEqualTo(2);
    }

    @Test
    void shouldGetLatestRevisionWithoutParam() {
        when(transport.getResource("quotes/public/211", Collections.emptyMap())).thenReturn(MockData.load("quote.json"));

        assertThat(quoteService.get(211, null).getNumber()).isEqualTo(211);
    }

    @Test
    void shouldUpdateAndReconcileQuote() {
        Quote quote = loadQuote();
        quote.setErpCode("E-1");
        assertThat(quote.getState()).isEqualTo(ResourceState.MODIFIED);

        ObjectNode serverCopy = (ObjectNode) MockData.load("quote.json");
        serverCopy.put("erp_code", "E-1");
        serverCopy.put("private_notes", "Updated by server");
        when(transport.updateResource(eq("quotes/public"), eq(211), any(), eq(Map.of("revision", 2))))
                .thenReturn(serverCopy);

        Quote result = quoteService.update(quote);

        assertThat(result).isSameAs(quote);
        assertThat(quote.getErpCode()).isEqualTo("E-1");
        assertThat(quote.getPrivateNotes()).isEqualTo("Updated by server");
        assertThat(quote.getState()).isEqualTo(ResourceState.PERSISTED);

        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(transport).updateResource(eq("quotes/public"), eq(211), body.capture(), any());
        assertThat(body.getValue().get("erp_code").textValue()).isEqualTo("E-1");
    }

    @Test
    void shouldChangeStatus() {
        Quote quote = loadQuote();
        ObjectNode serverCopy = (ObjectNode) MockData.load("quote.json");
        serverCopy.put("status", Quote.STATUS_LOST);
        when(transport.request(eq("quotes/public/211/status_change"), eq(HttpMethod.PATCH), any(),
                eq(Map.of("revision", 2)))).thenReturn(serverCopy);

        quoteService.setStatus(quote, Quote.STATUS_LOST);

        assertThat(quote.getStatus()).isEqualTo(Quote.STATUS_LOST);
        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(transport).request(eq("quotes/public/211/status_change"), eq(HttpMethod.PATCH), body.capture(), any());
        assertThat(body.getValue()).isEqualTo(MockData.json("{\"status\": \"lost\"}"));
    }

    @Test
    void shouldRejectStatusChangeWithoutNumber() {
        assertThatThrownBy(() -> quoteService.setStatus(new Quote(), Quote.STATUS_LOST))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(transport);
    }

    @Test
    void shouldGetNewQuotes() {
        when(transport.getResource("quotes/public/new", Map.of("last_quote", 200, "revision", 1)))
                .thenReturn(MockData.json("[201, 211]"));

        assertThat(quoteService.getNew(200, 1)).containsExactly(201, 211);
    }

    @Test
    void shouldIgnoreRevisionWithoutLastQuote() {
        when(transport.getResource("quotes/public/new", Map.of())).thenReturn(MockData.json("[]"));

        assertThat(quoteService.getNew(null, 3)).isEmpty();
    }

    private Quote loadQuote() {
        when(transport.getResource(eq("quotes/public/211"), any())).thenReturn(MockData.load("quote.json"));
        return quoteService.get(211, 2);
    }
}
