package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OrderNumberSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface JpaOrderNumberSequenceRepository extends JpaRepository<OrderNumberSequence, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM OrderNumberSequence s WHERE s.shopId = :shopId AND s.year = :year")
    Optional<OrderNumberSequence> findForUpdate(@Param("shopId") Long shopId, @Param("year") Integer year);
}
