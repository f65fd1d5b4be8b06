package paperless.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;
import paperless.connector.PaperlessClient;
import paperless.connector.PaperlessTransport;
import paperless.service.IntegrationActionService;
import paperless.service.ManagedIntegrationService;
import paperless.service.OrderService;
import paperless.service.QuoteService;
import paperless.service.ResourceService;

import java.time.Duration;

/**
 * Automatická konfigurace klienta Paperless Parts API. Všechny beany lze přepsat vlastní definicí.
 */
@AutoConfiguration
public class PaperlessClientConfig {

    /**
     * Vytvoří HTTP transport:
     * 1. Má Base URL a API token z konfigurace
     * 2. Čísla s desetinnou čárkou čte jako BigDecimal
     * 3. Opakuje volání při 5xx chybách a výpadcích spojení
     */
    @Bean
    @ConditionalOnMissingBean
    public PaperlessTransport paperlessTransport(ObjectProvider<WebClient.Builder> webClientBuilder,
                                                 @Value("${paperless.api.base-url:https://api.paperlessparts.com}") String baseUrl,
                                                 @Value("${paperless.api.token:}") String apiToken,
                                                 @Value("${paperless.api.retry.max-attempts:3}") int maxAttempts,
                                                 @Value("${paperless.api.retry.delay-ms:1000}") long retryDelayMs,
                                                 @Value("${paperless.api.timeout-ms:30000}") long timeoutMs) {
        // Vlastní mapper, aby nastavení čísel neovlivnilo zbytek aplikace
        ObjectMapper objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

        return new PaperlessClient(
                webClientBuilder.getIfAvailable(WebClient::builder),
                objectMapper,
                baseUrl,
                apiToken,
                maxAttempts,
                Duration.ofMillis(retryDelayMs),
                Duration.ofMillis(timeoutMs));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceService paperlessResourceService(PaperlessTransport paperlessTransport,
                                                    @Value("${paperless.api.pagination.max-pages:10000}") int maxPages) {
        return new ResourceService(paperlessTransport, maxPages);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderService paperlessOrderService(ResourceService resourceService) {
        return new OrderService(resourceService);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuoteService paperlessQuoteService(ResourceService resourceService) {
        return new QuoteService(resourceService);
    }

    @Bean
    @ConditionalOnMissingBean
    public ManagedIntegrationService paperlessManagedIntegrationService(ResourceService resourceService) {
        return new ManagedIntegrationService(resourceService);
    }

    @Bean
    @ConditionalOnMissingBean
    public IntegrationActionService paperlessIntegrationActionService(ResourceService resourceService) {
        return new IntegrationActionService(resourceService);
    }
}
