package com.tripdispatch.trip.repository;

import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.trip.entity.Trip;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Compare-and-set updates on {@code trips}, issued as a single
 * {@code UPDATE trips SET ... WHERE id = ? AND status = ?} built with the Criteria API.
 * All values travel as bind parameters; column names come from {@link TripField} only.
 */
@Slf4j
public class TripRepositoryCustomImpl implements TripRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public boolean conditionalUpdateStatus(UUID tripId, TripStatus expected, TripStatus next, TripUpdate update) {
        return execute(tripId, expected, next, update);
    }

    @Override
    @Transactional
    public boolean conditionalUpdate(UUID tripId, TripStatus expected, TripUpdate update) {
        return execute(tripId, expected, null, update);
    }

    private boolean execute(UUID tripId, TripStatus expected, TripStatus next, TripUpdate update) {
        // Pending changes to managed entities must not overwrite what this statement writes
        entityManager.flush();

        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaUpdate<Trip> criteria = cb.createCriteriaUpdate(Trip.class);
        Root<Trip> root = criteria.from(Trip.class);

        if (next != null) {
            criteria.set(root.<TripStatus>get("status"), next);
            setGuards(cb, criteria, root, next, update);
        }
        for (Map.Entry<TripField, Object> entry : update.values().entrySet()) {
            criteria.set(root.get(entry.getKey().attribute()), entry.getValue());
        }
        criteria.set(root.<Instant>get("updatedAt"), Instant.now());
        criteria.where(
                cb.equal(root.get("id"), tripId),
                cb.equal(root.get("status"), expected));

        int rows = entityManager.createQuery(criteria).executeUpdate();
        // Managed copies are stale now; the next read must hit the database
        entityManager.clear();

        log.debug("Conditional update trip={} {}->{} {}: {} row(s)", tripId, expected, next, update, rows);
        return rows == 1;
    }

    /**
     * Keeps the uniqueness guard columns in step with the new status. Binding a driver that is
     * already engaged elsewhere fails the statement with a constraint violation.
     */
    private static void setGuards(CriteriaBuilder cb, CriteriaUpdate<Trip> criteria, Root<Trip> root,
                                  TripStatus next, TripUpdate update) {
        if (next.isTerminal()) {
            criteria.set(root.<String>get("activeRiderKey"), cb.nullLiteral(String.class));
            criteria.set(root.<String>get("engagedDriverKey"), cb.nullLiteral(String.class));
        } else if (TripStatus.DRIVER_ENGAGED.contains(next) && update.values().containsKey(TripField.DRIVER_ID)) {
            criteria.set(root.<String>get("engagedDriverKey"), (String) update.values().get(TripField.DRIVER_ID));
        }
    }
}
