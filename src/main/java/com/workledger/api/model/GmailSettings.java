package com.workledger.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Mailbox credentials the extraction worker signs in with. Owned by the settings screen.
 */
@Entity
@Table(name = "gmail_settings",
        uniqueConstraints = @UniqueConstraint(name = "ux_gmail_settings_user", columnNames = "user_id"))
@Getter
@Setter
public class GmailSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "gmail_email", nullable = false)
    private String gmailEmail;

    @Column(name = "gmail_password", nullable = false)
    private String gmailPassword;

    public boolean isComplete() {
        return gmailEmail != null && !gmailEmail.isBlank()
                && gmailPassword != null && !gmailPassword.isBlank();
    }
}
