package com.coparent.service.push;

import com.coparent.config.CoparentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts push batches as JSON to an external gateway. The gateway answers with
 * {@code {successCount, failureCount, invalidTokens}}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "coparent.push", name = "provider", havingValue = "http")
public class HttpPushGateway implements PushGateway {

    private final RestTemplate restTemplate;
    private final CoparentProperties properties;

    @Override
    public PushResult send(PushMessage message) {
        String url = properties.getPush().getGatewayUrl();
        if (url == null || url.isBlank()) {
            throw new PushDeliveryException("coparent.push.gateway-url is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getPush().getApiKey() != null) {
            headers.setBearerAuth(properties.getPush().getApiKey());
        }

        try {
            ResponseEntity<PushResult> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(message, headers), PushResult.class);
            PushResult result = response.getBody();
            if (result == null) {
                return PushResult.builder().successCount(message.getTokens().size()).build();
            }
            log.debug("Push gateway accepted {} of {} tokens", result.getSuccessCount(), message.getTokens().size());
            return result;
        } catch (RestClientException e) {
            throw new PushDeliveryException("Push gateway call failed: " + e.getMessage(), e);
        }
    }
}
