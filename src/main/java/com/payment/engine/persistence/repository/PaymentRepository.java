package com.payment.engine.persistence.repository;

import com.payment.engine.persistence.entity.PaymentEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for payments. The {@code ...ForUpdate} finders take a row lock and must run
 * inside a transaction.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, Long> {

    Optional<PaymentEntity> findByPublicId(String publicId);

    Optional<PaymentEntity> findByGatewayPaymentId(String gatewayPaymentId);

    Optional<PaymentEntity> findFirstBySessionIdOrderByCreatedAtDesc(String sessionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.publicId = :publicId")
    Optional<PaymentEntity> findByPublicIdForUpdate(@Param("publicId") String publicId);
}
