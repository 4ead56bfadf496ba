package com.permit.payment.application;

import com.permit.payment.domain.ApplicationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the status column of the permit applications table.
 */
@Slf4j
@Repository
public class JdbcPermitApplicationGateway implements PermitApplicationGateway {

    private final JdbcTemplate jdbcTemplate;
    private final String table;

    public JdbcPermitApplicationGateway(JdbcTemplate jdbcTemplate,
                                        @Value("${payment.application.table:permit_applications}") String table) {
        if (!table.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
            throw new IllegalArgumentException("Invalid application table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
    }

    @Override
    public Optional<ApplicationStatus> findStatus(String applicationId) {
        Long id = toId(applicationId);
        if (id == null) {
            return Optional.empty();
        }
        List<String> statuses = jdbcTemplate.queryForList(
                "SELECT status FROM " + table + " WHERE id = ?", String.class, id);
        return statuses.stream().findFirst().map(ApplicationStatus::fromValue);
    }

    @Override
    public void updateStatus(String applicationId, ApplicationStatus status) {
        Long id = toId(applicationId);
        if (id == null) {
            log.warn("Cannot set status {} on application with non-numeric id {}", status, applicationId);
            return;
        }
        int updated = jdbcTemplate.update(
                "UPDATE " + table + " SET status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                status.name(), id);
        if (updated == 0) {
            log.warn("Application {} not found while setting status {}", applicationId, status);
        } else {
            log.info("Application {} status set to {}", applicationId, status);
        }
    }

    /** Application ids are numeric keys; anything else cannot exist. */
    private static Long toId(String applicationId) {
        if (applicationId == null || !applicationId.matches("\\d{1,18}")) {
            return null;
        }
        return Long.valueOf(applicationId);
    }
}
