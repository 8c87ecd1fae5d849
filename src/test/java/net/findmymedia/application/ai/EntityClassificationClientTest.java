package net.findmymedia.application.ai;

import com.openai.client.OpenAIClient;
import net.findmymedia.config.CacheFactory;
import net.findmymedia.service.ResolverOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class EntityClassificationClientTest {

    private final List<OpenAIClient> built = new ArrayList<>();
    private final EntityClassificationClient client = new EntityClassificationClient(new CacheFactory(), credentials -> {
        OpenAIClient sdkClient = mock(OpenAIClient.class);
        built.add(sdkClient);
        return sdkClient;
    });

    @Test
    void should_ReusePooledClient_When_CredentialsMatch() {
        OpenAIClient first = client.clientFor(credentials("key-1", "https://api.example.com/v1/"));
        OpenAIClient second = client.clientFor(credentials("key-1", "https://api.example.com/v1"));
        OpenAIClient other = client.clientFor(credentials("key-2", "https://api.example.com/v1"));

        assertThat(second).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(built).hasSize(2);
        verify(first, never()).close();
    }

    @Test
    void should_CloseEveryPooledClient_When_PoolIsShutDown() {
        OpenAIClient first = client.clientFor(credentials("key-1", null));
        OpenAIClient second = client.clientFor(credentials("key-2", null));

        client.closeClients();

        verify(first, timeout(2000)).close();
        verify(second, timeout(2000)).close();
    }

    @Test
    void should_RejectCall_When_ApiKeyMissing() {
        assertThatThrownBy(() -> client.complete(credentials(" ", null), "prompt", Duration.ofSeconds(1)))
            .isInstanceOfSatisfying(EntityClassificationException.class, e ->
                assertThat(e.errorCode()).isEqualTo(EntityClassificationException.ErrorCode.NOT_CONFIGURED));
        assertThat(built).isEmpty();
    }

    @Test
    void resolveModel_fallsBackToDefault() {
        assertThat(EntityClassificationClient.resolveModel(credentials("k", null))).isEqualTo(EntityClassificationClient.DEFAULT_MODEL);
        assertThat(EntityClassificationClient.resolveModel(new ResolverOptions.AiClassifierCredentials("k", null, " gpt-4o-mini ")))
            .isEqualTo("gpt-4o-mini");
    }

    private static ResolverOptions.AiClassifierCredentials credentials(String apiKey, String baseUrl) {
        return new ResolverOptions.AiClassifierCredentials(apiKey, baseUrl, null);
    }
}
