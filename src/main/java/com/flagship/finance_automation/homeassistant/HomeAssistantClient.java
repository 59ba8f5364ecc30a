package com.flagship.finance_automation.homeassistant;

import com.flagship.finance_automation.config.FinanceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Thin client for the Home Assistant REST service API.
 *
 * With a blank base URL the client only logs what it would have sent, which
 * keeps local runs and tests free of outbound calls.
 */
@Component
@Slf4j
public class HomeAssistantClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String token;

    @Autowired
    public HomeAssistantClient(@Qualifier("homeAssistantRestTemplate") RestTemplate restTemplate,
                               FinanceProperties properties) {
        this(restTemplate, properties.getHomeAssistant().getBaseUrl(), properties.getHomeAssistant().getToken());
    }

    public HomeAssistantClient(RestTemplate restTemplate, String baseUrl, String token) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        this.token = token;
    }

    public boolean isConfigured() {
        return !baseUrl.isEmpty();
    }

    /**
     * Calls {@code POST /api/services/{domain}/{service}}.
     *
     * @throws org.springframework.web.client.RestClientException when the call fails
     */
    public void callService(String domain, String service, Map<String, Object> data) {
        if (!isConfigured()) {
            log.info("Home Assistant not configured, skipping {}.{}: {}", domain, service, data);
            return;
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/api/services/{domain}/{service}")
                .buildAndExpand(domain, service)
                .encode()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        restTemplate.postForEntity(uri, new HttpEntity<>(data, headers), String.class);
        log.debug("Called Home Assistant service {}.{}", domain, service);
    }
}
