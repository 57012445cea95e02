package github.sarthakdev143.reel_forge.integration.provider;

import com.fasterxml.jackson.annotation.JsonProperty;
import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.exception.ProviderPermanentException;
import github.sarthakdev143.reel_forge.exception.ProviderTransientException;
import github.sarthakdev143.reel_forge.integration.storage.AssetStorage;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.PromptAnalysis;
import github.sarthakdev143.reel_forge.model.SceneOutline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Default provider adapter. Every capability is a JSON POST to {@code <base-url>/v1/<capability>}; media
 * capabilities answer with an {@code asset_url} that is downloaded into asset storage.
 */
@Component
public class HttpGenerationProviderClient
        implements ScriptProvider, ImageProvider, SpeechProvider, MusicProvider, VideoProvider {

    private static final Logger logger = LoggerFactory.getLogger(HttpGenerationProviderClient.class);

    private final RestTemplate restTemplate;
    private final AssetStorage assetStorage;
    private final TaskExecutor providerCallExecutor;
    private final String baseUrl;

    public HttpGenerationProviderClient(
            @Qualifier("providerRestTemplate") RestTemplate restTemplate,
            AssetStorage assetStorage,
            @Qualifier("providerCallExecutor") TaskExecutor providerCallExecutor,
            ReelForgeProperties properties) {
        this.restTemplate = restTemplate;
        this.assetStorage = assetStorage;
        this.providerCallExecutor = providerCallExecutor;
        String configured = properties.providers().baseUrl();
        this.baseUrl = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
    }

    @Override
    public CompletableFuture<PromptAnalysis> analyzePrompt(String prompt, GenerationConfig config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        body.put("config", config);
        return callAsync(() -> post("prompt-analysis", body, PromptAnalysis.class));
    }

    @Override
    public CompletableFuture<List<SceneOutline>> breakdownScenes(
            String prompt,
            PromptAnalysis analysis,
            GenerationConfig config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        body.put("analysis", analysis);
        body.put("config", config);
        return callAsync(() -> {
            SceneBreakdownResponse response = post("scene-breakdown", body, SceneBreakdownResponse.class);
            if (response.scenes() == null || response.scenes().isEmpty()) {
                throw new ProviderPermanentException("Scene breakdown returned no scenes.");
            }
            return response.scenes();
        });
    }

    @Override
    public CompletableFuture<AssetRef> generateImage(String visualPrompt, GenerationConfig config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", visualPrompt);
        body.put("aspect_ratio", config.aspectRatio());
        body.put("style", config.style());
        return callAsync(() -> generateAsset("image", body, "png"));
    }

    @Override
    public CompletableFuture<AssetRef> synthesizeSpeech(String text, double targetDurationSeconds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        body.put("target_duration", targetDurationSeconds);
        return callAsync(() -> generateAsset("speech", body, "mp3"));
    }

    @Override
    public CompletableFuture<AssetRef> composeMusic(String musicPrompt, double durationSeconds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", musicPrompt);
        body.put("duration", durationSeconds);
        return callAsync(() -> generateAsset("music", body, "mp3"));
    }

    @Override
    public CompletableFuture<AssetRef> animateImage(
            AssetRef image,
            String visualPrompt,
            double durationSeconds,
            GenerationConfig config) {
        return callAsync(() -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("image_base64", Base64.getEncoder().encodeToString(readAsset(image)));
            body.put("prompt", visualPrompt);
            body.put("duration", durationSeconds);
            body.put("aspect_ratio", config.aspectRatio());
            return generateAsset("video", body, "mp4");
        });
    }

    private <T> CompletableFuture<T> callAsync(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, providerCallExecutor);
    }

    private AssetRef generateAsset(String capability, Map<String, Object> body, String defaultExtension) {
        AssetResponse response = post(capability, body, AssetResponse.class);
        if (response.assetUrl() == null || response.assetUrl().isBlank()) {
            throw new ProviderPermanentException("Provider " + capability + " returned no asset_url.");
        }

        byte[] content = exchange(capability, () -> restTemplate.getForObject(URI.create(response.assetUrl()), byte[].class));
        if (content == null || content.length == 0) {
            throw new ProviderTransientException("Provider " + capability + " asset download was empty.");
        }

        try {
            AssetRef ref = assetStorage.put(content, extensionOf(response.assetUrl(), defaultExtension));
            logger.debug("Stored {} asset from provider as {}", capability, ref);
            return ref;
        } catch (IOException e) {
            throw new ProviderTransientException("Could not store " + capability + " asset: " + e.getMessage(), e);
        }
    }

    private <T> T post(String capability, Object body, Class<T> responseType) {
        String url = baseUrl + "/v1/" + capability;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Object> entity = new HttpEntity<>(body, headers);

        logger.debug("Calling provider capability {} at {}", capability, url);
        T response = exchange(capability, () -> restTemplate.postForObject(url, entity, responseType));
        if (response == null) {
            throw new ProviderTransientException("Provider " + capability + " returned an empty response.");
        }
        return response;
    }

    private <T> T exchange(String capability, Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpStatusCodeException e) {
            throw translate(capability, e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderTransientException("Provider " + capability + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ProviderPermanentException("Provider " + capability + " call failed: " + e.getMessage(), e);
        }
    }

    static RuntimeException translate(String capability, HttpStatusCode status, Throwable cause) {
        int code = status.value();
        String message = "Provider " + capability + " responded with HTTP " + code;
        if (code == 408 || code == 429 || status.is5xxServerError()) {
            return new ProviderTransientException(message, cause);
        }
        return new ProviderPermanentException(message, cause);
    }

    private byte[] readAsset(AssetRef ref) {
        try {
            return assetStorage.get(ref);
        } catch (IOException e) {
            throw new ProviderPermanentException("Could not read asset " + ref + ": " + e.getMessage(), e);
        }
    }

    static String extensionOf(String assetUrl, String fallback) {
        String path = URI.create(assetUrl).getPath();
        if (path == null) {
            return fallback;
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash || dot == path.length() - 1) {
            return fallback;
        }
        String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return extension.matches("[a-z0-9]{1,8}") ? extension : fallback;
    }

    record AssetResponse(@JsonProperty("asset_url") String assetUrl) {
    }

    record SceneBreakdownResponse(List<SceneOutline> scenes) {
    }
}
