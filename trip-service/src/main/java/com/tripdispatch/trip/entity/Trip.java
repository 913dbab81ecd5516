package com.tripdispatch.trip.entity;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tripdispatch.shared.enums.TripActor;
import com.tripdispatch.shared.enums.TripStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "trips",
        indexes = {
                @Index(name = "idx_trip_rider_status", columnList = "rider_id, status"),
                @Index(name = "idx_trip_driver_status", columnList = "driver_id, status"),
                @Index(name = "idx_trip_status", columnList = "status")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_trip_active_rider", columnNames = "active_rider_key"),
                @UniqueConstraint(name = "uk_trip_engaged_driver", columnNames = "engaged_driver_key")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Trip {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "rider_id", nullable = false)
    private String riderId;

    // Set on acceptance; kept after a post-acceptance cancellation for audit
    @Column(name = "driver_id")
    private String driverId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TripStatus status;

    @Column(name = "pickup_lat", nullable = false)
    private double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private double pickupLng;

    @Column(name = "pickup_address")
    private String pickupAddress;

    @Column(name = "dropoff_lat")
    private Double dropoffLat;

    @Column(name = "dropoff_lng")
    private Double dropoffLng;

    @Column(name = "dropoff_address")
    private String dropoffAddress;

    @Column(name = "fare_estimate", precision = 10, scale = 2)
    private BigDecimal fareEstimate;

    @Column(name = "final_fare", precision = 10, scale = 2)
    private BigDecimal finalFare;

    @Column(name = "surge_multiplier")
    private double surgeMultiplier;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "payment_method", length = 20)
    private String paymentMethod;

    @Column(name = "rider_comment", length = 500)
    private String riderComment;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 10)
    private TripActor cancelledBy;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    /** Rider's rating of the driver, 1-5. */
    @Column(name = "driver_rating")
    private Integer driverRating;

    /** Driver's rating of the rider, 1-5. */
    @Column(name = "rider_rating")
    private Integer riderRating;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;

    @Column(name = "accepted_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant acceptedAt;

    @Column(name = "arrived_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant arrivedAt;

    @Column(name = "started_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant startedAt;

    @Column(name = "completed_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant completedAt;

    @Column(name = "cancelled_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant cancelledAt;

    @Column(name = "expired_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiredAt;

    // Written explicitly by every conditional update, which bypasses entity callbacks
    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant updatedAt;

    /*
     * Uniqueness guards: rider id while the trip is active, driver id while the driver is
     * engaged, null otherwise. The unique constraints on these columns make the one-active-trip
     * rules hold under concurrent writers.
     */
    @JsonIgnore
    @Column(name = "active_rider_key")
    private String activeRiderKey;

    @JsonIgnore
    @Column(name = "engaged_driver_key")
    private String engagedDriverKey;

    @PrePersist
    public void syncGuards() {
        activeRiderKey = status != null && TripStatus.ACTIVE.contains(status) ? riderId : null;
        engagedDriverKey = status != null && TripStatus.DRIVER_ENGAGED.contains(status) ? driverId : null;
    }
}
