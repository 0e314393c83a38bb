package com.focusflow.backend.modules.notification.infrastructure.webhook;

import java.util.LinkedHashMap;
import java.util.Map;

import com.focusflow.backend.global.config.FocusFlowProperties;
import com.focusflow.backend.modules.notification.application.NotificationMessage;

import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts notifications to an external chat webhook as {@code {"userId", "text", ...}} JSON.
 */
@Component
public class WebhookNotificationClient {

    private final RestClient restClient;
    private final FocusFlowProperties.Webhook settings;

    public WebhookNotificationClient(RestClient.Builder restClientBuilder, FocusFlowProperties properties) {
        this.settings = properties.notification().webhook();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.timeout());
        requestFactory.setReadTimeout(settings.timeout());
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
    }

    public boolean isEnabled() {
        return settings.enabled() && StringUtils.hasText(settings.url());
    }

    public void post(NotificationMessage message) throws RestClientException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", message.userId());
        body.put("kind", message.kindCode());
        body.put("title", message.title());
        body.put("text", message.body());
        restClient.post()
                .uri(settings.url())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity();
    }
}
