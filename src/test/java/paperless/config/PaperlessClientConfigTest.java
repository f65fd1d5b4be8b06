package paperless.config;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import paperless.connector.PaperlessClient;
import paperless.connector.PaperlessTransport;
import paperless.service.IntegrationActionService;
import paperless.service.ManagedIntegrationService;
import paperless.service.OrderService;
import paperless.service.QuoteService;
import paperless.service.ResourceService;

import static org.assertj.core.api.Assertions.assertThat;

class PaperlessClientConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PaperlessClientConfig.class));

    @Test
    void shouldCreateAllServices() {
        contextRunner
                .withPropertyValues(
                        "paperless.api.base-url=http://localhost:8089",
                        "paperless.api.token=test-token",
                        "paperless.api.retry.max-attempts=5")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(PaperlessTransport.class);
                    assertThat(context.getBean(PaperlessTransport.class)).isInstanceOf(PaperlessClient.class);
                    assertThat(context).hasSingleBean(ResourceService.class);
                    assertThat(context).hasSingleBean(OrderService.class);
                    assertThat(context).hasSingleBean(QuoteService.class);
                    assertThat(context).hasSingleBean(ManagedIntegrationService.class);
                    assertThat(context).hasSingleBean(IntegrationActionService.class);
                });
    }

    @Test
    void shouldBackOffForCustomTransport() {
        PaperlessTransport custom = Mockito.mock(PaperlessTransport.class);

        contextRunner
                .withBean(PaperlessTransport.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(PaperlessTransport.class);
                    assertThat(context.getBean(ResourceService.class).getTransport()).isSameAs(custom);
                });
    }

    @Test
    void shouldFailOnInvalidPageLimit() {
        contextRunner
                .withPropertyValues("paperless.api.pagination.max-pages=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
