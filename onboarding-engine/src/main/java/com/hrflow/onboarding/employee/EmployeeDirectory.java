package com.hrflow.onboarding.employee;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the HR employee records owned by another service.
 */
public interface EmployeeDirectory {

    /**
     * @return the employee, or empty if the directory has no such id
     * @throws EmployeeDirectoryException if the directory cannot be reached or answers with an error
     */
    Optional<EmployeeSummary> findEmployee(UUID employeeId);
}
