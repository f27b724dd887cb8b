package com.chicu.airetrain.promotion;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface StabilityRecordRepository extends JpaRepository<StabilityRecordEntity, Long> {

    Optional<StabilityRecordEntity> findByTargetId(String targetId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StabilityRecordEntity s where s.targetId = :targetId")
    Optional<StabilityRecordEntity> findForUpdate(@Param("targetId") String targetId);

    boolean existsByTargetIdAndFrozenTrue(String targetId);
}
