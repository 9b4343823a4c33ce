package com.bbthechange.tripplanner.repository.impl;

import com.bbthechange.tripplanner.exception.RepositoryException;
import com.bbthechange.tripplanner.exception.VersionConflictException;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.TripTokenType;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.util.QueryPerformanceTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.time.Instant;

import static com.bbthechange.tripplanner.testutil.TripTestBuilder.aTrip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TripTransactionRepositoryImpl Tests")
class TripTransactionRepositoryImplTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    @Mock
    private DynamoDbEnhancedClient mockEnhancedClient;

    @Mock
    private DynamoDbTable<Trip> mockTripTable;

    @Mock
    private DynamoDbTable<TripToken> mockTokenTable;

    @Mock
    private DynamoDbTable<TripMembership> mockMembershipTable;

    @Mock
    private DynamoDbTable<User> mockUserTable;

    private TripTransactionRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        when(mockEnhancedClient.table(eq("Trips"), any(TableSchema.class))).thenReturn(mockTripTable);
        when(mockEnhancedClient.table(eq("TripTokens"), any(TableSchema.class))).thenReturn(mockTokenTable);
        when(mockEnhancedClient.table(eq("TripMemberships"), any(TableSchema.class))).thenReturn(mockMembershipTable);
        when(mockEnhancedClient.table(eq("Users"), any(TableSchema.class))).thenReturn(mockUserTable);
        // Request builders read the item type from each table's schema.
        lenient().when(mockTripTable.tableSchema()).thenReturn(TableSchema.fromBean(Trip.class));
        lenient().when(mockTokenTable.tableSchema()).thenReturn(TableSchema.fromBean(TripToken.class));
        lenient().when(mockMembershipTable.tableSchema()).thenReturn(TableSchema.fromBean(TripMembership.class));
        lenient().when(mockUserTable.tableSchema()).thenReturn(TableSchema.fromBean(User.class));
        repository = new TripTransactionRepositoryImpl(mockEnhancedClient, new QueryPerformanceTracker(new SimpleMeterRegistry()));
    }

    @Test
    void updateTripWithToken_CommitsBothWritesAndAdvancesVersion() {
        // Given
        Trip trip = aTrip().withVersion(2L).build();
        TripToken token = new TripToken("tok", TripTokenType.SHARE_LINK, trip.getTripId(), null, NOW);

        // When
        Trip saved = repository.updateTripWithToken(trip, token);

        // Then
        assertThat(saved).isSameAs(trip);
        assertThat(saved.getVersion()).isEqualTo(3L);
        verify(mockEnhancedClient).transactWriteItems(any(TransactWriteItemsEnhancedRequest.class));
    }

    @Test
    void createUserAndUpdateTrip_CancelledTransactionIsVersionConflict() {
        Trip trip = aTrip().withVersion(2L).build();
        User user = new User("dave@example.com", "Dave", "hash", NOW);
        TripMembership membership = new TripMembership(user.getId(), trip, NOW);
        doThrow(TransactionCanceledException.builder().message("ConditionalCheckFailed").build())
            .when(mockEnhancedClient).transactWriteItems(any(TransactWriteItemsEnhancedRequest.class));

        assertThatThrownBy(() -> repository.createUserAndUpdateTrip(user, trip, membership))
            .isInstanceOf(VersionConflictException.class);
        assertThat(trip.getVersion()).isEqualTo(2L);
    }

    @Test
    void updateTripWithMembership_CommitsBothWritesAndAdvancesVersion() {
        // Given
        Trip trip = aTrip().withVersion(4L).build();
        TripMembership membership = new TripMembership("user-bob", trip, NOW);

        // When
        Trip saved = repository.updateTripWithMembership(trip, membership);

        // Then
        assertThat(saved.getVersion()).isEqualTo(5L);
        verify(mockEnhancedClient).transactWriteItems(any(TransactWriteItemsEnhancedRequest.class));
    }

    @Test
    void updateTripWithToken_OtherFailureIsRepositoryError() {
        Trip trip = aTrip().withVersion(2L).build();
        TripToken token = new TripToken("tok", TripTokenType.INVITATION, trip.getTripId(), null, NOW);
        doThrow(DynamoDbException.builder().message("throttled").build())
            .when(mockEnhancedClient).transactWriteItems(any(TransactWriteItemsEnhancedRequest.class));

        assertThatThrownBy(() -> repository.updateTripWithToken(trip, token))
            .isInstanceOf(RepositoryException.class);
    }
}
