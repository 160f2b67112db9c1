package net.papermentat.application.enrichment;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import net.papermentat.config.PaperMentatProperties;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.WeakMetadata;
import net.papermentat.util.ExternalApiLogger;
import net.papermentat.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Enrichment through an OpenAI-compatible chat completions API.
 *
 * <p>Without an API key the extractor stays registered but disabled and every call yields empty.</p>
 */
@Component
@ConditionalOnProperty(prefix = "papermentat.enrichment", name = "provider", havingValue = "openai")
public class OpenAiMetadataExtractor implements MetadataEnrichmentCapability {

    private static final Logger log = LoggerFactory.getLogger(OpenAiMetadataExtractor.class);
    private static final String PROVIDER = "OpenAI";
    private static final double SAMPLING_TEMPERATURE = 0.1;
    private static final long MAX_COMPLETION_TOKENS = 1200L;

    private final OpenAIClient openAiClient;
    private final EnrichmentResponseParser parser;
    private final String model;
    private final Duration timeout;

    @Autowired
    public OpenAiMetadataExtractor(ObjectMapper objectMapper, PaperMentatProperties properties) {
        this(buildClient(properties.getEnrichment().getOpenai()),
            objectMapper,
            properties.getEnrichment().getOpenai().getModel(),
            properties.getEnrichment().getOpenai().getTimeout());
    }

    OpenAiMetadataExtractor(OpenAIClient openAiClient, ObjectMapper objectMapper, String model, Duration timeout) {
        this.openAiClient = openAiClient;
        this.parser = new EnrichmentResponseParser(objectMapper);
        this.model = model;
        this.timeout = timeout;
        if (openAiClient == null) {
            log.warn("OpenAI metadata enrichment is disabled: papermentat.enrichment.openai.api-key is not set");
        } else {
            log.info("OpenAI metadata enrichment configured (model={})", model);
        }
    }

    @Override
    public boolean isAvailable() {
        return openAiClient != null;
    }

    @Override
    public Optional<PaperMetadata> extract(String text, WeakMetadata weak) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        String label = weak != null && weak.title() != null ? weak.title() : "(untitled)";
        ExternalApiLogger.logApiCallAttempt(log, PROVIDER, "EXTRACT_METADATA", label);
        try {
            String raw = complete(EnrichmentPromptFactory.buildPrompt(text, weak));
            PaperMetadata extracted = parser.parse(raw, weak);
            ExternalApiLogger.logApiCallSuccess(log, PROVIDER, "EXTRACT_METADATA", label, 1);
            return Optional.of(extracted);
        } catch (MetadataEnrichmentException e) {
            ExternalApiLogger.logApiCallFailure(log, PROVIDER, "EXTRACT_METADATA", label, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "OpenAI extraction failed for '{}'", label);
            return Optional.empty();
        }
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    private String complete(String prompt) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(ChatCompletionSystemMessageParam.builder()
                    .content(EnrichmentPromptFactory.SYSTEM_PROMPT).build()),
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder().content(prompt).build())
            ))
            .maxCompletionTokens(MAX_COMPLETION_TOKENS)
            .temperature(SAMPLING_TEMPERATURE)
            .build();
        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder().request(timeout).read(timeout).build())
            .build();

        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params, options);
            if (completion.choices().isEmpty()) {
                throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE,
                    "Chat completion contained no choices");
            }
            return completion.choices().get(0).message().content().orElse("");
        } catch (OpenAIException openAiException) {
            throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.PROVIDER_FAILED,
                "OpenAI call failed (%s): %s".formatted(model, MetadataEnrichmentException.describeApiError(openAiException)),
                openAiException);
        }
    }

    private static OpenAIClient buildClient(PaperMentatProperties.OpenAi settings) {
        if (!StringUtils.hasText(settings.getApiKey())) {
            return null;
        }
        return OpenAIOkHttpClient.builder()
            .apiKey(settings.getApiKey())
            .baseUrl(normalizeBaseUrl(settings.getBaseUrl()))
            .maxRetries(0)
            .build();
    }

    static String normalizeBaseUrl(String rawUrl) {
        if (!StringUtils.hasText(rawUrl)) {
            return "https://api.openai.com/v1";
        }
        String normalized = rawUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.endsWith("/v1") ? normalized : normalized + "/v1";
    }
}
