package com.chicu.airetrain.admission;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface WeekendBudgetRepository extends JpaRepository<WeekendBudgetEntity, Long> {

    Optional<WeekendBudgetEntity> findByTargetId(String targetId);

    /**
     * Строка бюджета под SELECT ... FOR UPDATE: списание и создание job сериализуются по target.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from WeekendBudgetEntity b where b.targetId = :targetId")
    Optional<WeekendBudgetEntity> findForUpdate(@Param("targetId") String targetId);
}
