package com.workledger.api.repository;

import com.workledger.api.model.GmailSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class GmailSettingsRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @Autowired
    private GmailSettingsRepository gmailSettingsRepository;

    @Test
    @DisplayName("Settings are found by user id")
    void findByUserId() {
        // given
        gmailSettingsRepository.saveAndFlush(settings("user-1", "alice@example.com"));

        // when / then
        assertThat(gmailSettingsRepository.findByUserId("user-1"))
                .get()
                .extracting(GmailSettings::getGmailEmail)
                .isEqualTo("alice@example.com");
        assertThat(gmailSettingsRepository.findByUserId("user-2")).isEmpty();
    }

    @Test
    @DisplayName("A second mailbox for the same user is rejected")
    void oneMailboxPerUser() {
        // given
        gmailSettingsRepository.saveAndFlush(settings("user-1", "alice@example.com"));

        // when / then
        assertThatThrownBy(() -> gmailSettingsRepository.saveAndFlush(settings("user-1", "other@example.com")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private static GmailSettings settings(String userId, String email) {
        GmailSettings settings = new GmailSettings();
        settings.setUserId(userId);
        settings.setGmailEmail(email);
        settings.setGmailPassword("app-password");
        return settings;
    }
}
