package org.sjsu.puffplanner.repository;

import org.sjsu.puffplanner.model.entity.WizardSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WizardSessionRepository extends JpaRepository<WizardSession, Long> {

    Optional<WizardSession> findByUserId(Long userId);

    // Single DELETE statement; returns the number of rows removed (0 when the user had no session)
    @Modifying
    @Query("delete from WizardSession s where s.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
