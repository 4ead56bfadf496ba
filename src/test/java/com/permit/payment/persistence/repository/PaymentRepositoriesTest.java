package com.permit.payment.persistence.repository;

import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.PaymentMethod;
import com.permit.payment.domain.RecoveryStatus;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.entity.RecoveryAttemptEntity;
import com.permit.payment.persistence.service.PaymentIntentPersistenceService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Repository queries used by the intent guard, reconciliation sweep and recovery
 * statistics, run against H2.
 */
@DataJpaTest
class PaymentRepositoriesTest {

    @Autowired
    private PaymentIntentRepository intentRepository;

    @Autowired
    private RecoveryAttemptRepository recoveryRepository;

    @Test
    void openIntentsForApplicationAreFoundByStatus() {
        intentRepository.save(intent("pi_card_app-1_cus_1", "pi_1", "app-1", IntentStatus.CANCELED));
        intentRepository.save(intent("pi_card_app-1_cus_1_1", "pi_2", "app-1", IntentStatus.REQUIRES_CONFIRMATION));
        intentRepository.save(intent("pi_card_app-2_cus_1", "pi_3", "app-2", IntentStatus.PROCESSING));

        List<PaymentIntentEntity> open = intentRepository.findByApplicationIdAndStatusIn("app-1",
                EnumSet.of(IntentStatus.REQUIRES_CONFIRMATION, IntentStatus.PROCESSING));

        assertThat(open).extracting(PaymentIntentEntity::getPaymentIntentId).containsExactly("pi_2");
        assertThat(intentRepository.countByApplicationIdAndStatusIn("app-1",
                EnumSet.of(IntentStatus.CANCELED, IntentStatus.FAILED))).isEqualTo(1);
        assertThat(intentRepository.findByPaymentIntentId("pi_3")).get()
                .extracting(PaymentIntentEntity::getApplicationId).isEqualTo("app-2");
    }

    @Test
    void sweepQueryReturnsNonTerminalIntentsNotUpdatedSinceCutoff() {
        intentRepository.save(intent("k1", "pi_1", "app-1", IntentStatus.PROCESSING));
        intentRepository.save(intent("k2", "pi_2", "app-2", IntentStatus.SUCCEEDED));
        intentRepository.save(intent("k3", "pi_3", "app-3", IntentStatus.REQUIRES_ACTION));

        List<PaymentIntentEntity> stale = intentRepository.findByStatusInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
                EnumSet.of(IntentStatus.PROCESSING, IntentStatus.REQUIRES_ACTION),
                Instant.now().plus(1, ChronoUnit.MINUTES), PageRequest.of(0, 50));
        List<PaymentIntentEntity> none = intentRepository.findByStatusInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
                EnumSet.of(IntentStatus.PROCESSING, IntentStatus.REQUIRES_ACTION),
                Instant.now().minus(1, ChronoUnit.HOURS), PageRequest.of(0, 50));

        assertThat(stale).extracting(PaymentIntentEntity::getPaymentIntentId).containsExactlyInAnyOrder("pi_1", "pi_3");
        assertThat(none).isEmpty();
    }

    @Test
    void checkedIntentMovesBehindOtherStaleIntents() throws InterruptedException {
        PaymentIntentPersistenceService persistence = new PaymentIntentPersistenceService(intentRepository);
        PaymentIntentEntity oldest = intentRepository.saveAndFlush(intent("k1", "pi_1", "app-1", IntentStatus.PROCESSING));
        Thread.sleep(5);
        intentRepository.saveAndFlush(intent("k2", "pi_2", "app-2", IntentStatus.REQUIRES_ACTION));
        Thread.sleep(5);
        Instant cutoff = Instant.now().plus(1, ChronoUnit.MINUTES);
        assertThat(persistence.findStuck(cutoff, 1)).extracting(PaymentIntentEntity::getPaymentIntentId)
                .containsExactly("pi_1");

        persistence.markChecked(oldest);
        intentRepository.flush();

        assertThat(persistence.findStuck(cutoff, 1)).extracting(PaymentIntentEntity::getPaymentIntentId)
                .containsExactly("pi_2");
        assertThat(persistence.findStuck(cutoff, 2)).extracting(PaymentIntentEntity::getPaymentIntentId)
                .containsExactly("pi_2", "pi_1");
    }

    @Test
    void recoveryAttemptsAreCountedByStatusSince() {
        Instant now = Instant.now();
        recoveryRepository.save(attempt("app-1", "pi_1", RecoveryStatus.SUCCEEDED, now.minus(1, ChronoUnit.HOURS)));
        recoveryRepository.save(attempt("app-2", "pi_2", RecoveryStatus.SUCCEEDED, now.minus(2, ChronoUnit.HOURS)));
        recoveryRepository.save(attempt("app-3", "pi_3", RecoveryStatus.RECOVERING, now.minus(3, ChronoUnit.HOURS)));
        recoveryRepository.save(attempt("app-4", "pi_4", RecoveryStatus.FAILED, now.minus(48, ChronoUnit.HOURS)));

        List<Object[]> rows = recoveryRepository.countByStatusSince(now.minus(24, ChronoUnit.HOURS));

        assertThat(rows).hasSize(2);
        assertThat(rows).anySatisfy(row -> {
            assertThat(row[0]).isEqualTo(RecoveryStatus.SUCCEEDED);
            assertThat(((Number) row[1]).longValue()).isEqualTo(2L);
        });
        assertThat(recoveryRepository.findByApplicationIdAndPaymentIntentId("app-3", "pi_3")).isPresent();
        assertThat(recoveryRepository.findByRecoveryStatusAndLastAttemptTimeBeforeOrderByLastAttemptTimeAsc(
                RecoveryStatus.RECOVERING, now.minus(30, ChronoUnit.MINUTES), PageRequest.of(0, 10)))
                .extracting(RecoveryAttemptEntity::getApplicationId).containsExactly("app-3");
    }

    private static PaymentIntentEntity intent(String key, String paymentIntentId, String applicationId, IntentStatus status) {
        return PaymentIntentEntity.builder()
                .idempotencyKey(key)
                .paymentIntentId(paymentIntentId)
                .applicationId(applicationId)
                .customerId("cus_1")
                .amount(new BigDecimal("150.00"))
                .currency("MXN")
                .method(PaymentMethod.CARD)
                .status(status)
                .build();
    }

    private static RecoveryAttemptEntity attempt(String applicationId, String paymentIntentId,
                                                 RecoveryStatus status, Instant lastAttempt) {
        return RecoveryAttemptEntity.builder()
                .applicationId(applicationId)
                .paymentIntentId(paymentIntentId)
                .attemptCount(1)
                .recoveryStatus(status)
                .lastAttemptTime(lastAttempt)
                .build();
    }
}
