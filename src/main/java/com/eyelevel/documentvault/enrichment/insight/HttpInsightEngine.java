package com.eyelevel.documentvault.enrichment.insight;

import com.eyelevel.documentvault.common.apiclient.ApiClient;
import com.eyelevel.documentvault.common.apiclient.authentication.Authentication;
import com.eyelevel.documentvault.common.apiclient.model.ApiRequest;
import com.eyelevel.documentvault.common.apiclient.model.ApiResponse;
import com.eyelevel.documentvault.common.json.JsonParser;
import com.eyelevel.documentvault.model.DocumentInsight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Calls the external insight service over HTTP.
 *
 * <p>Long texts are trimmed to their head and tail before sending, since the opening and closing
 * sections of a document carry most of its identifying facts.
 */
@Slf4j
public class HttpInsightEngine extends ApiClient implements InsightEngine {

    static final int TRIM_THRESHOLD = 2000;
    static final int TRIM_EDGE = 1000;
    static final String TRIM_MARKER = "\n\n[... content trimmed ...]\n\n";

    private final JsonParser jsonParser;
    private final String insightsEndpoint;
    private final boolean enabled;

    public HttpInsightEngine(final WebClient webClient, final Authentication authentication,
                             final JsonParser jsonParser, final String insightsEndpoint, final boolean enabled) {
        super(webClient, authentication);
        this.jsonParser = jsonParser;
        this.insightsEndpoint = insightsEndpoint;
        this.enabled = enabled;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public List<DocumentInsight> generateInsights(final String documentName, final String text,
                                                  final String mimeType) {
        final ApiRequest apiRequest = ApiRequest.builder()
                                                .method(HttpMethod.POST)
                                                .path(insightsEndpoint)
                                                .contentType(MediaType.APPLICATION_JSON)
                                                .body(new InsightRequest(documentName, mimeType, trimContent(text)))
                                                .build();
        final ApiResponse apiResponse = call(apiRequest);
        final InsightResponse response = jsonParser.parseObject(apiResponse.getData(), InsightResponse.class);
        final List<DocumentInsight> insights = response.insights() == null ? List.of() : response.insights();
        log.info("Insight service returned {} insight(s) for '{}'.", insights.size(), documentName);
        return insights;
    }

    static String trimContent(final String text) {
        if (text.length() <= TRIM_THRESHOLD) {
            return text;
        }
        return text.substring(0, TRIM_EDGE) + TRIM_MARKER + text.substring(text.length() - TRIM_EDGE);
    }
}
