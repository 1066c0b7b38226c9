package com.eyelevel.documentvault.common.apiclient;

import com.eyelevel.documentvault.common.apiclient.authentication.Authentication;
import com.eyelevel.documentvault.common.apiclient.model.ApiRequest;
import com.eyelevel.documentvault.common.apiclient.model.ApiResponse;
import com.eyelevel.documentvault.exception.apiclient.ApiException;
import com.eyelevel.documentvault.exception.apiclient.BadRequestException;
import com.eyelevel.documentvault.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.documentvault.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.documentvault.exception.apiclient.TooManyRequestsException;
import com.eyelevel.documentvault.exception.apiclient.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Base class for blocking calls to external HTTP APIs over a {@link WebClient}.
 *
 * <p>Non-2xx responses and transport failures are mapped to {@link ApiException} subclasses by
 * status code, so subclasses only deal with successful payloads.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;

    /**
     * Executes the request and blocks for the response.
     *
     * @throws ApiException if the call fails or the response is not successful.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());
        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(DEFAULT_TIMEOUT)
                                                     .onErrorMap(this::mapException)
                                                     .block();
            log.debug("Received response with status {}", apiResponse != null ? apiResponse.getStatusCode() : null);
            return apiResponse;
        } catch (ApiException e) {
            log.error("Exception during API call to {}", apiRequest.getPath(), e);
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call to {}", apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException
            || error instanceof java.net.UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build();
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());
        apiRequest.getHeaders().forEach(requestBodySpec::header);
        requestBodySpec.accept(MediaType.APPLICATION_JSON);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder().data(data).statusCode(statusCode)
                                                   .timestamp(Instant.now()).build());
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private ApiException createException(String body, int statusCode) {
        ApiException exception = switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401 -> new UnauthorizedException(body);
            case 429 -> new TooManyRequestsException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
        log.warn("Api request failing with status {}: {}", statusCode, exception.getMessage());
        return exception;
    }
}
