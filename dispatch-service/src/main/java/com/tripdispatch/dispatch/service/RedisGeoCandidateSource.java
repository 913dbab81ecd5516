package com.tripdispatch.dispatch.service;

import com.tripdispatch.dispatch.model.DriverCandidate;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds nearby drivers with Redis GEOSEARCH/GEORADIUS on a single sorted set.
 *
 * Key:     drivers:geo (dispatch.geo.key)
 * Member:  driverId, maintained by the location pipeline for drivers that are online and free
 *
 * Transient Redis errors are retried by the "geo-candidates" Resilience4j instance; once
 * retries are exhausted the fallback reports no candidates for this iteration.
 */
@Slf4j
@Service
public class RedisGeoCandidateSource implements GeoCandidateSource {

    private final RedisTemplate<String, String> redisTemplate;
    private final String geoKey;

    public RedisGeoCandidateSource(RedisTemplate<String, String> redisTemplate,
                                   @Value("${dispatch.geo.key:drivers:geo}") String geoKey) {
        this.redisTemplate = redisTemplate;
        this.geoKey = geoKey;
    }

    @Override
    @Retry(name = "geo-candidates", fallbackMethod = "noCandidates")
    public List<DriverCandidate> nearby(double lat, double lon, double radiusKm, int limit) {
        Circle circle = new Circle(new Point(lon, lat), new Distance(radiusKm, Metrics.KILOMETERS));

        GeoResults<RedisGeoCommands.GeoLocation<String>> geoResults = redisTemplate.opsForGeo().radius(
                geoKey,
                circle,
                RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                        .includeDistance()
                        .sortAscending()
                        .limit(limit));

        if (geoResults == null) {
            return List.of();
        }

        List<DriverCandidate> candidates = new ArrayList<>();
        for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : geoResults.getContent()) {
            candidates.add(DriverCandidate.of(result.getContent().getName(), result.getDistance().getValue()));
        }
        log.debug("Found {} candidates within {} km of ({},{})", candidates.size(), radiusKm, lat, lon);
        return candidates;
    }

    private List<DriverCandidate> noCandidates(double lat, double lon, double radiusKm, int limit, Throwable cause) {
        log.warn("Geo lookup failed near ({},{}) r={}km, treating as no candidates: {}",
                lat, lon, radiusKm, cause.getMessage());
        return List.of();
    }
}
