package com.tripdispatch.trip.repository;

import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.trip.entity.Trip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TripRepository extends JpaRepository<Trip, UUID>, TripRepositoryCustom {

    boolean existsByRiderIdAndStatusIn(String riderId, Collection<TripStatus> statuses);

    boolean existsByDriverIdAndStatusIn(String driverId, Collection<TripStatus> statuses);

    Optional<Trip> findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(String riderId, Collection<TripStatus> statuses);

    Optional<Trip> findFirstByDriverIdAndStatusInOrderByCreatedAtDesc(String driverId, Collection<TripStatus> statuses);

    List<Trip> findByRiderIdOrderByCreatedAtDesc(String riderId);
}
