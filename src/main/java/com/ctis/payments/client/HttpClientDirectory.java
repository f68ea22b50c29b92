package com.ctis.payments.client;

import com.ctis.payments.config.ClientDirectoryProperties;
import com.ctis.payments.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Asks the client service whether {@code GET /api/v1/clients/{id}} exists.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.clients.mode", havingValue = "http", matchIfMissing = true)
public class HttpClientDirectory implements ClientDirectory {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpClientDirectory(ClientDirectoryProperties properties) {
        this(buildRestTemplate(properties), properties.getBaseUrl());
    }

    HttpClientDirectory(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public boolean exists(String clientId) {
        try {
            restTemplate.headForHeaders(baseUrl + "/api/v1/clients/{id}", clientId);
            return true;
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND) {
                log.debug("Client {} not found in client service", clientId);
                return false;
            }
            throw new ProviderUnavailableException("Client service rejected lookup of " + clientId + ": " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.warn("Client service unreachable while checking clientId={}: {}", clientId, e.getMessage());
            throw new ProviderUnavailableException("Client service unreachable", e);
        }
    }

    private static RestTemplate buildRestTemplate(ClientDirectoryProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) properties.getTimeout().toMillis();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setRequestFactory(factory);
        return restTemplate;
    }
}
