package com.keer.seating.token.repository;

import com.keer.seating.token.model.IssuedToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IssuedTokenRepository extends JpaRepository<IssuedToken, String> {
}
