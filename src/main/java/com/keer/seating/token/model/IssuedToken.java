package com.keer.seating.token.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Every token ever minted. Rows are never deleted, not even on guest removal or event teardown.
 */
@Entity
@Table(name = "issued_token")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuedToken {

    @Id
    @Column(length = 80)
    private String token;

    @Column(nullable = false)
    private Instant issuedAt;
}
