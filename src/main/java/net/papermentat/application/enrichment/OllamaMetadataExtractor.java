package net.papermentat.application.enrichment;

import net.papermentat.config.PaperMentatProperties;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.WeakMetadata;
import net.papermentat.util.ExternalApiLogger;
import net.papermentat.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Enrichment through a local Ollama server's {@code /api/generate} endpoint.
 */
@Component
@ConditionalOnProperty(prefix = "papermentat.enrichment", name = "provider", havingValue = "ollama")
public class OllamaMetadataExtractor implements MetadataEnrichmentCapability {

    private static final Logger log = LoggerFactory.getLogger(OllamaMetadataExtractor.class);
    private static final String PROVIDER = "Ollama";
    private static final double SAMPLING_TEMPERATURE = 0.1;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final EnrichmentResponseParser parser;
    private final String model;
    private final Duration timeout;

    @Autowired
    public OllamaMetadataExtractor(WebClient.Builder webClientBuilder,
                                   ObjectMapper objectMapper,
                                   PaperMentatProperties properties) {
        this(webClientBuilder.clone()
                .baseUrl(properties.getEnrichment().getOllama().getBaseUrl())
                // generation can run far past the provider read timeout
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create()
                    .responseTimeout(properties.getEnrichment().getOllama().getTimeout())))
                .build(),
            objectMapper,
            properties.getEnrichment().getOllama().getModel(),
            properties.getEnrichment().getOllama().getTimeout());
    }

    OllamaMetadataExtractor(WebClient webClient, ObjectMapper objectMapper, String model, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.parser = new EnrichmentResponseParser(objectMapper);
        this.model = model;
        this.timeout = timeout;
        log.info("Ollama metadata enrichment configured (model={})", model);
    }

    @Override
    public Optional<PaperMetadata> extract(String text, WeakMetadata weak) {
        String label = weak != null && weak.title() != null ? weak.title() : "(untitled)";
        ExternalApiLogger.logApiCallAttempt(log, PROVIDER, "EXTRACT_METADATA", label);
        try {
            String raw = generate(EnrichmentPromptFactory.buildPrompt(text, weak));
            PaperMetadata extracted = parser.parse(raw, weak);
            ExternalApiLogger.logApiCallSuccess(log, PROVIDER, "EXTRACT_METADATA", label, 1);
            return Optional.of(extracted);
        } catch (MetadataEnrichmentException e) {
            ExternalApiLogger.logApiCallFailure(log, PROVIDER, "EXTRACT_METADATA", label, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Ollama extraction failed for '{}'", label);
            return Optional.empty();
        }
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    private String generate(String prompt) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        request.put("prompt", prompt);
        request.put("stream", false);
        request.putObject("options").put("temperature", SAMPLING_TEMPERATURE);

        JsonNode response;
        try {
            response = webClient.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(objectMapper.writeValueAsString(request))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout);
        } catch (RuntimeException e) {
            throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.PROVIDER_FAILED,
                "Ollama request failed: " + LoggingUtils.describe(e), e);
        }
        if (response == null || !response.has("response")) {
            throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE,
                "Ollama response had no 'response' field");
        }
        return response.get("response").asString("");
    }
}
