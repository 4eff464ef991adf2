package com.hrflow.onboarding.employee;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * The slice of an employee record the onboarding views display.
 * Field names follow the HR backend's snake_case payload; anything else
 * in that payload is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmployeeSummary(
        @JsonProperty("id")         UUID    id,
        @JsonProperty("first_name") String  firstName,
        @JsonProperty("last_name")  String  lastName,
        @JsonProperty("email")      String  email,
        @JsonProperty("department") String  department,
        @JsonProperty("position")   String  position,
        @JsonProperty("hire_date")  Instant hireDate
) {}
