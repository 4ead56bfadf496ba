package com.permit.payment;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

/**
 * Integration test: verifies that the application context loads against H2 with the
 * mock provider. Kafka and Redis are only contacted lazily, but a running broker and
 * Redis (docker-compose up -d) keep the logs quiet. Run with:
 *   mvn test -Dgroups=integration -DexcludedGroups=none
 */
@Tag("integration")
@SpringBootTest(classes = PermitPaymentApplication.class)
@TestPropertySource(properties = {
		"spring.datasource.url=jdbc:h2:mem:permits;MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
		"spring.datasource.username=sa",
		"spring.datasource.password=",
		"spring.jpa.hibernate.ddl-auto=create-drop",
		"payment.provider.mode=mock",
		"payment.webhook.secret=whsec_test",
		"payment.recovery.sweep.enabled=false"
})
class PermitPaymentApplicationTests {

	@Test
	void contextLoads() {
	}
}
