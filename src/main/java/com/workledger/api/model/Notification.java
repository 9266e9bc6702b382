package com.workledger.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Entity
@Table(name = "notifications")
@Getter
@Setter
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_email", nullable = false)
    private String userEmail;

    @Column(nullable = false)
    private String type;

    @Column
    private String title;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(nullable = false)
    private OffsetDateTime timestamp;

    @Column(name = "read", nullable = false)
    private boolean read;

    @Column(name = "recipient_role")
    private String recipientRole;

    @Column(name = "action_url")
    private String actionUrl;
}
