package com.workledger.api.repository;

import com.workledger.api.model.GmailSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GmailSettingsRepository extends JpaRepository<GmailSettings, Long> {

    Optional<GmailSettings> findByUserId(String userId);
}
