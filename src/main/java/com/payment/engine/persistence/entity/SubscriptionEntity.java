package com.payment.engine.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Subscription as owned by the billing side. Only the stored card token is read here.
 */
@Entity
@Immutable
@Table(name = "subscriptions", indexes = {
    @Index(name = "idx_subscription_public_id", columnList = "public_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionEntity {

    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "public_id", nullable = false, unique = true)
    private String publicId;

    @Column(name = "business_id", nullable = false)
    private String businessId;

    @Column(name = "moyasar_token")
    private String moyasarToken;

    @Override
    public String toString() {
        return "SubscriptionEntity(publicId=" + publicId + ", businessId=" + businessId + ")";
    }
}
