package com.yoursp.ledger.modules.biometric;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.ledger.config.LedgerProperties;
import com.yoursp.ledger.exception.FeatureExtractionException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the face-encoding sidecar.
 * <p>
 * {@code POST {encoder-url}/encodings} with {@code {"image": "<base64>"}};
 * the sidecar answers {@code {"encodings": [[...], ...]}} in detector order.
 * Protected by a Resilience4j circuit breaker. Encodings are never logged.
 * </p>
 */
@Slf4j
@Component
public class FaceEncodingSidecarClient implements FaceEncoder {

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String encoderUrl;
    private final Duration requestTimeout;

    public FaceEncodingSidecarClient(ObjectMapper objectMapper, LedgerProperties properties) {
        this.objectMapper = objectMapper;
        this.encoderUrl = properties.getBiometric().getEncoderUrl();
        this.requestTimeout = properties.getBiometric().getEncoderTimeout();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    @CircuitBreaker(name = "faceEncoder", fallbackMethod = "encodeFallback")
    public List<double[]> encode(byte[] image) {
        String url = encoderUrl + "/encodings";
        log.debug("Face encoder request: url={}, imageSize={}", url, image.length);

        try {
            String requestBody = objectMapper.writeValueAsString(Map.of(
                    "image", Base64.getEncoder().encodeToString(image)));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new FeatureExtractionException("Face encoder returned HTTP " + response.statusCode());
            }

            List<double[]> encodings = parseEncodings(response.body());
            log.debug("Face encoder returned {} encoding(s)", encodings.size());
            return encodings;

        } catch (FeatureExtractionException e) {
            throw e;
        } catch (ConnectException e) {
            throw new FeatureExtractionException("Face encoder is not reachable at " + encoderUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeatureExtractionException("Face encoder call interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Face encoder call failed: {}", e.getMessage());
            throw new FeatureExtractionException("Face encoder call failed", e);
        }
    }

    List<double[]> parseEncodings(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode encodingsNode = root == null ? null : root.get("encodings");
        if (encodingsNode == null || !encodingsNode.isArray()) {
            throw new FeatureExtractionException("Face encoder response has no encodings array");
        }

        List<double[]> encodings = new ArrayList<>(encodingsNode.size());
        for (JsonNode vectorNode : encodingsNode) {
            if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                throw new FeatureExtractionException("Face encoder returned a malformed encoding");
            }
            double[] vector = new double[vectorNode.size()];
            for (int i = 0; i < vector.length; i++) {
                JsonNode component = vectorNode.get(i);
                if (!component.isNumber()) {
                    throw new FeatureExtractionException("Face encoder returned a non-numeric component");
                }
                vector[i] = component.asDouble();
            }
            encodings.add(vector);
        }
        return encodings;
    }

    @SuppressWarnings("unused")
    private List<double[]> encodeFallback(byte[] image, Throwable t) {
        if (t instanceof FeatureExtractionException e) {
            throw e;
        }
        log.error("Face encoder circuit breaker open: {}", t.getMessage());
        throw new FeatureExtractionException("Face encoding service is temporarily unavailable", t);
    }
}
