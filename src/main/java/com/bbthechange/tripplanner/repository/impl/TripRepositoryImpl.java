package com.bbthechange.tripplanner.repository.impl;

import com.bbthechange.tripplanner.exception.RepositoryException;
import com.bbthechange.tripplanner.exception.VersionConflictException;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.repository.TripRepository;
import com.bbthechange.tripplanner.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Trip documents in the Trips table via the DynamoDB Enhanced Client.
 * The client's versioned record extension turns every write into a conditional write on {@code version}.
 */
@Repository
public class TripRepositoryImpl implements TripRepository {

    private static final Logger logger = LoggerFactory.getLogger(TripRepositoryImpl.class);
    public static final String TABLE_NAME = "Trips";
    public static final String OWNER_INDEX = "OwnerIndex";

    private final DynamoDbTable<Trip> tripTable;
    private final DynamoDbIndex<Trip> ownerIndex;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public TripRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient, QueryPerformanceTracker queryTracker) {
        this.tripTable = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(Trip.class));
        this.ownerIndex = tripTable.index(OWNER_INDEX);
        this.queryTracker = queryTracker;
    }

    @Override
    public Trip create(Trip trip) {
        if (trip.getVersion() != null) {
            throw new IllegalArgumentException("New trip must not carry a version");
        }
        return write("CreateTrip", trip);
    }

    @Override
    public Optional<Trip> findById(String tripId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                Trip trip = tripTable.getItem(Key.builder().partitionValue(tripId).build());
                return Optional.ofNullable(trip);
            } catch (DynamoDbException e) {
                logger.error("Failed to load trip {}", tripId, e);
                throw new RepositoryException("Failed to load trip", e);
            }
        });
    }

    @Override
    public List<Trip> findByOwnerId(String ownerId) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                List<Trip> trips = ownerIndex.query(QueryConditional.keyEqualTo(Key.builder()
                        .partitionValue(ownerId)
                        .build()))
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .sorted(Comparator.comparing(Trip::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                    .collect(Collectors.toList());
                logger.debug("Found {} trips for owner {}", trips.size(), ownerId);
                return trips;
            } catch (DynamoDbException e) {
                logger.error("Failed to query trips for owner {}", ownerId, e);
                throw new RepositoryException("Failed to query trips", e);
            }
        });
    }

    @Override
    public Trip update(Trip trip) {
        if (trip.getVersion() == null) {
            throw new IllegalArgumentException("Trip update requires the version that was read");
        }
        return write("UpdateTrip", trip);
    }

    @Override
    public void delete(String tripId) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                tripTable.deleteItem(Key.builder().partitionValue(tripId).build());
                logger.info("Deleted trip {}", tripId);
                return null;
            } catch (DynamoDbException e) {
                logger.error("Failed to delete trip {}", tripId, e);
                throw new RepositoryException("Failed to delete trip", e);
            }
        });
    }

    private Trip write(String operation, Trip trip) {
        return queryTracker.trackQuery(operation, TABLE_NAME, () -> {
            try {
                Trip stored = tripTable.updateItem(trip);
                logger.debug("{} {} now at version {}", operation, trip.getTripId(), stored.getVersion());
                return stored;
            } catch (ConditionalCheckFailedException e) {
                logger.info("Version conflict writing trip {} at version {}", trip.getTripId(), trip.getVersion());
                throw new VersionConflictException("Trip " + trip.getTripId() + " was modified concurrently", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to write trip {}", trip.getTripId(), e);
                throw new RepositoryException("Failed to save trip", e);
            }
        });
    }
}
