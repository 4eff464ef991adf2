package com.hrflow.onboarding.employee;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * HTTP client for the HR backend's employee API.
 *
 * GET {base-url}/employees/{id} → 200 with the employee JSON, 404 when unknown.
 * Uses java.net.http.HttpClient with short timeouts: the lookup only
 * decorates workflow views and must never hold up a command.
 */
@Component
public class EmployeeDirectoryClient implements EmployeeDirectory {

    private static final Logger log = LoggerFactory.getLogger(EmployeeDirectoryClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public EmployeeDirectoryClient(
            @Value("${onboarding.employee-directory.base-url}") String baseUrl,
            @Value("${onboarding.employee-directory.timeout-ms:3000}") long timeoutMs,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl;
        this.json           = objectMapper;
        this.requestTimeout = Duration.ofMillis(timeoutMs);
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @Override
    public Optional<EmployeeSummary> findEmployee(UUID employeeId) {
        log.debug("Looking up employee {}", employeeId);
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/employees/" + employeeId))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmployeeDirectoryException("findEmployee interrupted for " + employeeId, e);
        } catch (Exception e) {
            throw new EmployeeDirectoryException("findEmployee failed for " + employeeId, e);
        }

        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new EmployeeDirectoryException(
                    "findEmployee failed for " + employeeId
                    + ": HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            return Optional.of(json.readValue(resp.body(), EmployeeSummary.class));
        } catch (JsonProcessingException e) {
            throw new EmployeeDirectoryException("Failed to parse employee response for " + employeeId, e);
        }
    }
}
