package com.bbthechange.tripplanner.repository.impl;

import com.bbthechange.tripplanner.exception.RepositoryException;
import com.bbthechange.tripplanner.exception.VersionConflictException;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.repository.TripTransactionRepository;
import com.bbthechange.tripplanner.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

/**
 * TransactWriteItems across Trips, TripTokens, TripMemberships and Users.
 * The trip update inside each transaction is conditioned on its version by the versioned record extension.
 */
@Repository
public class TripTransactionRepositoryImpl implements TripTransactionRepository {

    private static final Logger logger = LoggerFactory.getLogger(TripTransactionRepositoryImpl.class);
    private static final String OPERATION_TABLES = "Trips+TripTokens+TripMemberships+Users";

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<Trip> tripTable;
    private final DynamoDbTable<TripToken> tokenTable;
    private final DynamoDbTable<TripMembership> membershipTable;
    private final DynamoDbTable<User> userTable;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public TripTransactionRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient, QueryPerformanceTracker queryTracker) {
        this.enhancedClient = dynamoDbEnhancedClient;
        this.tripTable = dynamoDbEnhancedClient.table(TripRepositoryImpl.TABLE_NAME, TableSchema.fromBean(Trip.class));
        this.tokenTable = dynamoDbEnhancedClient.table(TripTokenRepositoryImpl.TABLE_NAME, TableSchema.fromBean(TripToken.class));
        this.membershipTable = dynamoDbEnhancedClient.table(TripMembershipRepositoryImpl.TABLE_NAME,
            TableSchema.fromBean(TripMembership.class));
        this.userTable = dynamoDbEnhancedClient.table(UserRepositoryImpl.TABLE_NAME, TableSchema.fromBean(User.class));
        this.queryTracker = queryTracker;
    }

    @Override
    public Trip updateTripWithToken(Trip trip, TripToken token) {
        TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
            .addPutItem(tokenTable, TransactPutItemEnhancedRequest.builder(TripToken.class)
                .item(token)
                .conditionExpression(notExists("token"))
                .build())
            .addUpdateItem(tripTable, trip)
            .build();
        return execute("updateTripWithToken", trip, request);
    }

    @Override
    public Trip updateTripWithMembership(Trip trip, TripMembership membership) {
        TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
            .addPutItem(membershipTable, membership)
            .addUpdateItem(tripTable, trip)
            .build();
        return execute("updateTripWithMembership", trip, request);
    }

    @Override
    public Trip createUserAndUpdateTrip(User user, Trip trip, TripMembership membership) {
        TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
            .addPutItem(userTable, TransactPutItemEnhancedRequest.builder(User.class)
                .item(user)
                .conditionExpression(notExists("id"))
                .build())
            .addPutItem(membershipTable, membership)
            .addUpdateItem(tripTable, trip)
            .build();
        return execute("createUserAndUpdateTrip", trip, request);
    }

    private Trip execute(String operation, Trip trip, TransactWriteItemsEnhancedRequest request) {
        return queryTracker.trackQuery(operation, OPERATION_TABLES, () -> {
            try {
                enhancedClient.transactWriteItems(request);
                trip.setVersion(nextVersion(trip.getVersion()));
                logger.debug("{} committed for trip {} (version {})", operation, trip.getTripId(), trip.getVersion());
                return trip;
            } catch (TransactionCanceledException e) {
                logger.info("{} cancelled for trip {}: {}", operation, trip.getTripId(), e.cancellationReasons());
                throw new VersionConflictException("Trip " + trip.getTripId() + " was modified concurrently", e);
            } catch (DynamoDbException e) {
                logger.error("{} failed for trip {}", operation, trip.getTripId(), e);
                throw new RepositoryException("Failed to commit trip transaction", e);
            }
        });
    }

    private static Expression notExists(String attribute) {
        return Expression.builder()
            .expression("attribute_not_exists(#attr)")
            .putExpressionName("#attr", attribute)
            .build();
    }

    private static Long nextVersion(Long current) {
        return current == null ? 1L : current + 1;
    }
}
