package com.medassist.fhir;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.rest.client.api.IGenericClient;
import ca.uhn.fhir.rest.client.interceptor.BearerTokenAuthInterceptor;

/**
 * FHIR R4 client for the EHR patient fact source.
 *
 * Only created with {@code medassist.fhir.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "medassist.fhir", name = "enabled", havingValue = "true")
public class FhirClientConfig {

    @Value("${medassist.fhir.base-url:https://hapi.fhir.org/baseR4}")
    private String baseUrl;

    @Value("${medassist.fhir.access-token:}")
    private String accessToken;

    @Value("${medassist.fhir.socket-timeout-ms:2000}")
    private int socketTimeoutMs;

    @Bean
    public FhirContext fhirContext() {
        FhirContext context = FhirContext.forR4();
        context.getRestfulClientFactory().setSocketTimeout(socketTimeoutMs);
        context.getRestfulClientFactory().setConnectTimeout(socketTimeoutMs);
        return context;
    }

    @Bean
    public IGenericClient ehrFhirClient(FhirContext fhirContext) {
        IGenericClient client = fhirContext.newRestfulGenericClient(baseUrl);

        // Add auth if token provided
        if (accessToken != null && !accessToken.isEmpty()) {
            client.registerInterceptor(new BearerTokenAuthInterceptor(accessToken));
        }

        return client;
    }
}
