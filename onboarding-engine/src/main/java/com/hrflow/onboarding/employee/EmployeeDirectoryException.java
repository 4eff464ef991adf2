package com.hrflow.onboarding.employee;

/**
 * Thrown when the employee directory returns an error or is unreachable.
 */
public class EmployeeDirectoryException extends RuntimeException {

    public EmployeeDirectoryException(String message) {
        super(message);
    }

    public EmployeeDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
