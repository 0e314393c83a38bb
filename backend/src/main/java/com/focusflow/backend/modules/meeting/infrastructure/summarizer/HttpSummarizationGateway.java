package com.focusflow.backend.modules.meeting.infrastructure.summarizer;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.focusflow.backend.global.config.FocusFlowProperties;
import com.focusflow.backend.modules.meeting.application.SummarizationException;
import com.focusflow.backend.modules.meeting.application.SummarizationGateway;
import com.focusflow.backend.modules.meeting.application.SummarizationRequest;

import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client for the summarizer service: {@code POST /summarize {"text"}} answering
 * {@code {"summary", "length", "compression_ratio"}}.
 */
@Component
public class HttpSummarizationGateway implements SummarizationGateway {

    private final RestClient restClient;

    public HttpSummarizationGateway(RestClient.Builder restClientBuilder, FocusFlowProperties properties) {
        FocusFlowProperties.Summarizer settings = properties.summarizer();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.timeout());
        requestFactory.setReadTimeout(settings.timeout());
        this.restClient = restClientBuilder
                .baseUrl(settings.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public String summarize(SummarizationRequest request) {
        if (!StringUtils.hasText(request.transcript())) {
            throw new SummarizationException("empty transcript for user " + request.userId());
        }
        SummaryResponse response;
        try {
            response = restClient.post()
                    .uri("/summarize")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("text", request.transcript()))
                    .retrieve()
                    .body(SummaryResponse.class);
        } catch (RestClientException ex) {
            throw new SummarizationException("summarizer call failed: " + ex.getMessage(), ex);
        }
        if (response == null || !StringUtils.hasText(response.summary())) {
            throw new SummarizationException("summarizer returned no summary");
        }
        return response.summary().trim();
    }

    record SummaryResponse(
            String summary,
            Integer length,
            @JsonProperty("compression_ratio") Double compressionRatio
    ) {
    }
}
