package net.findmymedia.application.ai;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.ChatModel;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import jakarta.annotation.PreDestroy;
import net.findmymedia.config.CacheFactory;
import net.findmymedia.service.ResolverOptions;
import net.findmymedia.util.HashUtils;
import net.findmymedia.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Sends classification prompts to an OpenAI-compatible chat completion endpoint in JSON mode.
 * <p>
 * Credentials arrive per call, so SDK clients are pooled by (API key, base URL).
 * The SDK is blocking; callers schedule it off the event loop.
 */
@Component
class EntityClassificationClient {

    private static final Logger log = LoggerFactory.getLogger(EntityClassificationClient.class);
    static final String DEFAULT_MODEL = "gemini-2.5-flash";
    private static final double SAMPLING_TEMPERATURE = 0.1;
    private static final int MAX_POOLED_CLIENTS = 16;

    private final Cache<String, OpenAIClient> clients;
    private final Function<ResolverOptions.AiClassifierCredentials, OpenAIClient> clientBuilder;

    @Autowired
    EntityClassificationClient(CacheFactory cacheFactory) {
        this(cacheFactory, EntityClassificationClient::buildClient);
    }

    EntityClassificationClient(CacheFactory cacheFactory,
                               Function<ResolverOptions.AiClassifierCredentials, OpenAIClient> clientBuilder) {
        this.clientBuilder = clientBuilder;
        this.clients = cacheFactory.createCacheWithSize("aiClassifierClients", MAX_POOLED_CLIENTS,
            (String key, OpenAIClient client, RemovalCause cause) -> {
                if (client != null) {
                    log.debug("Closing pooled AI classifier client ({})", cause);
                    client.close();
                }
            });
    }

    @PreDestroy
    void closeClients() {
        clients.invalidateAll();
        clients.cleanUp();
    }

    /**
     * Model used for a set of credentials, falling back to the default.
     */
    static String resolveModel(ResolverOptions.AiClassifierCredentials credentials) {
        return StringUtils.hasText(credentials.model()) ? credentials.model().trim() : DEFAULT_MODEL;
    }

    /**
     * Runs one chat completion and returns the raw reply text.
     *
     * @throws EntityClassificationException when credentials are missing, the call fails or the reply is empty
     */
    String complete(ResolverOptions.AiClassifierCredentials credentials, String prompt, Duration timeout) {
        if (credentials == null || !StringUtils.hasText(credentials.apiKey())) {
            throw new EntityClassificationException(EntityClassificationException.ErrorCode.NOT_CONFIGURED,
                "AI classifier API key is not configured");
        }
        String model = resolveModel(credentials);
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .messages(List.of(
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder().content(prompt).build())
            ))
            .temperature(SAMPLING_TEMPERATURE)
            .responseFormat(ResponseFormatJsonObject.builder().build())
            .build();

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(timeout)
                .read(timeout)
                .build())
            .build();

        try {
            ChatCompletion completion = clientFor(credentials).chat().completions().create(params, options);
            if (completion.choices().isEmpty()) {
                throw new EntityClassificationException(EntityClassificationException.ErrorCode.EMPTY_RESPONSE,
                    "Classifier response contained no choices");
            }
            String response = completion.choices().get(0).message().content().orElse("");
            if (!StringUtils.hasText(response)) {
                throw new EntityClassificationException(EntityClassificationException.ErrorCode.EMPTY_RESPONSE,
                    "Classifier response was empty");
            }
            return response;
        } catch (OpenAIException openAiException) {
            String detail = EntityClassificationException.describeApiError(openAiException);
            log.error("Classifier API call failed (model={}): {}", model, detail);
            throw new EntityClassificationException(EntityClassificationException.ErrorCode.API_CALL_FAILED,
                "Classifier call failed (%s): %s".formatted(model, detail), openAiException);
        }
    }

    OpenAIClient clientFor(ResolverOptions.AiClassifierCredentials credentials) {
        String baseUrl = UrlUtils.normalizeAiBaseUrl(credentials.baseUrl());
        String poolKey = HashUtils.sha256Hex(credentials.apiKey().trim() + "|" + baseUrl);
        return clients.get(poolKey, key -> {
            log.info("Creating AI classifier client (baseUrl={})", baseUrl);
            return clientBuilder.apply(credentials);
        });
    }

    private static OpenAIClient buildClient(ResolverOptions.AiClassifierCredentials credentials) {
        return OpenAIOkHttpClient.builder()
            .apiKey(credentials.apiKey().trim())
            .baseUrl(UrlUtils.normalizeAiBaseUrl(credentials.baseUrl()))
            .maxRetries(0)
            .build();
    }
}
