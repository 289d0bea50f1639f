package com.intellibank.analysis.classification;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.intellibank.analysis.exceptions.ClassifierUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Client for a remote classification service.
 *
 * POST {baseUrl}/classify with {"merchant": ..., "description": ...}, answered by
 * {"category": ..., "confidence": ...}. Timeouts, connection errors, 5xx and 429 are reported as
 * {@link ClassifierUnavailableException}; any other 4xx means "no opinion".
 */
@Slf4j
public class HttpClassifierBackend implements ClassifierBackend {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpClassifierBackend(String baseUrl, RestTemplate restTemplate) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        String url = baseUrl.trim();
        if (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        this.baseUrl = url;
        this.restTemplate = restTemplate;
    }

    @Override
    public ClassifierVerdict classify(String merchantText, String description) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<ClassifyRequest> request = new HttpEntity<>(new ClassifyRequest(merchantText, description), headers);

        try {
            ResponseEntity<ClassifyResponse> response =
                    restTemplate.postForEntity(baseUrl + "/classify", request, ClassifyResponse.class);
            ClassifyResponse body = response.getBody();
            if (body == null || body.confidence() == null) {
                return ClassifierVerdict.none();
            }
            return new ClassifierVerdict(body.category(), body.confidence());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new ClassifierUnavailableException(
                        "Classifier service error status=" + e.getStatusCode().value(), e);
            }
            log.warn("[HttpClassifier] rejected merchant='{}' status={}", merchantText, e.getStatusCode().value());
            return ClassifierVerdict.none();
        } catch (ResourceAccessException e) {
            throw new ClassifierUnavailableException("Classifier service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ClassifierUnavailableException("Classifier service returned an unreadable answer: " + e.getMessage(), e);
        }
    }

    public record ClassifyRequest(String merchant, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassifyResponse(String category, Double confidence) {
    }
}
