package org.csits.butler.server.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.SocketTimeoutException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 火山方舟图片生成接口客户端。
 * <p>
 * 同步接口直接在 data[0].url 返回图片地址；若只返回任务号则轮询任务状态直到完成、失败或超时。
 */
@Slf4j
@Component
public class ArkGenerationClient implements GenerationClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final String size;
    private final long pollIntervalMs;
    private final long maxWaitMs;

    public ArkGenerationClient(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                               @Value("${butler.provider.base-url:https://ark.cn-beijing.volces.com/api/v3}") String baseUrl,
                               @Value("${butler.provider.api-key:}") String apiKey,
                               @Value("${butler.provider.model:doubao-seedream-4-5-251128}") String model,
                               @Value("${butler.provider.size:2K}") String size,
                               @Value("${butler.provider.poll-interval-ms:2000}") long pollIntervalMs,
                               @Value("${butler.provider.max-wait-ms:180000}") long maxWaitMs) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.size = size;
        this.pollIntervalMs = pollIntervalMs;
        this.maxWaitMs = maxWaitMs;
    }

    @Override
    public GenerationResult generate(byte[] image, String prompt) {
        if (image == null || image.length == 0) {
            return GenerationResult.failure("Reference image is required");
        }
        if (prompt == null || prompt.trim().isEmpty()) {
            return GenerationResult.failure("Prompt is required");
        }
        if (apiKey == null || apiKey.trim().isEmpty()) {
            return GenerationResult.failure("Provider API key is not configured");
        }
        try {
            JsonNode body = submit(image, prompt);
            String url = firstImageUrl(body);
            if (url != null) {
                log.info("模型服务返回图片地址");
                return GenerationResult.success(url);
            }
            String jobId = text(body, "task_id");
            if (jobId == null) {
                jobId = text(body, "id");
            }
            if (jobId == null) {
                return GenerationResult.failure("Invalid API response format: no image data received");
            }
            log.info("模型服务返回异步任务，开始轮询: jobId={}", jobId);
            return waitForCompletion(jobId);
        } catch (HttpStatusCodeException e) {
            return GenerationResult.failure(describe(e));
        } catch (ResourceAccessException e) {
            return GenerationResult.failure(describe(e));
        } catch (RestClientException e) {
            return GenerationResult.failure("Provider request failed: " + e.getMessage());
        }
    }

    private JsonNode submit(byte[] image, String prompt) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("prompt", prompt);
        request.put("image", "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(image));
        request.put("size", size);
        request.put("response_format", "url");
        request.put("watermark", false);

        ResponseEntity<JsonNode> response = restTemplate.exchange(
            baseUrl + "/images/generations", HttpMethod.POST, new HttpEntity<>(request, headers()), JsonNode.class);
        return response.getBody();
    }

    private GenerationResult waitForCompletion(String jobId) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(maxWaitMs);
        while (true) {
            JsonNode body = restTemplate.exchange(
                baseUrl + "/image/task/" + jobId, HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class).getBody();
            JsonNode data = body != null && body.has("data") ? body.get("data") : body;
            String status = text(data, "status");
            if ("completed".equalsIgnoreCase(status) || "succeeded".equalsIgnoreCase(status)) {
                String url = text(data, "image_url");
                if (url == null) {
                    url = firstImageUrl(data);
                }
                return url != null
                    ? GenerationResult.success(url)
                    : GenerationResult.failure("Provider task completed without image url");
            }
            if ("failed".equalsIgnoreCase(status)) {
                String message = text(body, "message");
                return GenerationResult.failure("Provider task failed" + (message != null ? ": " + message : ""));
            }
            if (System.nanoTime() >= deadline) {
                return GenerationResult.failure("Provider task timeout after " + maxWaitMs + "ms");
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return GenerationResult.failure("Provider polling interrupted");
            }
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);
        return headers;
    }

    private static String describe(HttpStatusCodeException e) {
        if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return "429 rate limit: 请求过于频繁，请稍后重试";
        }
        String body = e.getResponseBodyAsString();
        log.warn("模型服务返回错误: status={}, body={}", e.getStatusCode().value(), body);
        return "HTTP " + e.getStatusCode().value() + ": " + (body.isEmpty() ? e.getStatusText() : body);
    }

    private static String describe(ResourceAccessException e) {
        if (e.getCause() instanceof SocketTimeoutException) {
            return "Provider request timeout: " + e.getMessage();
        }
        return "Provider network error: " + e.getMessage();
    }

    private static String firstImageUrl(JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode data = body.get("data");
        if (data != null && data.isArray() && data.size() > 0) {
            return text(data.get(0), "url");
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.asText().isEmpty() ? value.asText() : null;
    }
}
