package com.permit.payment.application;

import com.permit.payment.domain.ApplicationStatus;

import java.util.Optional;

/**
 * Access to the permit application status, owned by the permit subsystem.
 */
public interface PermitApplicationGateway {

    /** Empty when the application does not exist. */
    Optional<ApplicationStatus> findStatus(String applicationId);

    void updateStatus(String applicationId, ApplicationStatus status);
}
