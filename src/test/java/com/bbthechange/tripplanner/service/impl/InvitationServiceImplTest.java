package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.CreateInvitationRequest;
import com.bbthechange.tripplanner.dto.CreateInvitationResponse;
import com.bbthechange.tripplanner.dto.InvitationDTO;
import com.bbthechange.tripplanner.dto.InvitationDetailsDTO;
import com.bbthechange.tripplanner.dto.RegisterWithInviteRequest;
import com.bbthechange.tripplanner.dto.RegisterWithInviteResponse;
import com.bbthechange.tripplanner.dto.TripAccessDTO;
import com.bbthechange.tripplanner.exception.ConflictException;
import com.bbthechange.tripplanner.exception.ForbiddenException;
import com.bbthechange.tripplanner.exception.InvitationAlreadyUsedException;
import com.bbthechange.tripplanner.exception.InvitationExpiredException;
import com.bbthechange.tripplanner.exception.ResourceNotFoundException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.CollaboratorStatus;
import com.bbthechange.tripplanner.model.Invitation;
import com.bbthechange.tripplanner.model.InvitationStatus;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.model.TripRole;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.TripTokenType;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.service.EmailNotificationService;
import com.bbthechange.tripplanner.service.JwtService;
import com.bbthechange.tripplanner.service.PasswordService;
import com.bbthechange.tripplanner.testutil.InMemoryTripStore;
import com.bbthechange.tripplanner.testutil.InMemoryUserRepository;
import com.bbthechange.tripplanner.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.bbthechange.tripplanner.testutil.TripTestBuilder.aTrip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("InvitationService Tests")
class InvitationServiceImplTest {

    private static final Instant START = Instant.parse("2025-05-01T10:00:00Z");
    private static final String BASE_URL = "https://trips.example.com";

    @Mock
    private JwtService jwtService;

    @Mock
    private EmailNotificationService emailNotificationService;

    private InMemoryUserRepository users;
    private InMemoryTripStore store;
    private MutableClock clock;
    private InvitationServiceImpl invitationService;

    private User alice;
    private User bob;
    private Trip trip;

    @BeforeEach
    void setUp() {
        users = new InMemoryUserRepository();
        store = new InMemoryTripStore(users);
        clock = new MutableClock(START);
        PasswordService passwordService = new PasswordService();
        UserServiceImpl userService = new UserServiceImpl(users, passwordService, jwtService, clock);
        invitationService = new InvitationServiceImpl(store, store.tokens(), store, new TripAccessEvaluatorImpl(),
            userService, passwordService, jwtService, emailNotificationService, clock, BASE_URL);

        alice = users.save(new User("alice@example.com", "Alice", passwordService.hash("secret1"), START));
        bob = users.save(new User("bob@example.com", "Bob", passwordService.hash("secret2"), START));
        trip = store.create(aTrip().ownedBy(alice.getId()).build());

        lenient().when(jwtService.generateToken(anyString())).thenReturn("jwt-token");
        lenient().when(jwtService.getAccessTokenExpirationSeconds()).thenReturn(86400);
    }

    private CreateInvitationRequest request(String role) {
        CreateInvitationRequest request = new CreateInvitationRequest();
        request.setRole(role);
        return request;
    }

    private void addPendingDirectInvite(String email, String token) {
        Trip current = store.peek(trip.getTripId());
        Collaborator entry = new Collaborator("", email, email.substring(0, email.indexOf('@')), TripRole.VIEWER,
            alice.getId(), START);
        entry.setInviteToken(token);
        current.addCollaborator(entry);
        store.updateTripWithToken(current, new TripToken(token, TripTokenType.COLLABORATOR_INVITE, trip.getTripId(), email, START));
    }

    private String createInvitation(String role) {
        return invitationService.createInvitationLink(trip.getTripId(), request(role), alice.getId())
            .getInvitation().getToken();
    }

    @Nested
    @DisplayName("createInvitationLink")
    class CreateTests {

        @Test
        void create_DefaultsToSevenDaysAndIndexesToken() {
            // When
            CreateInvitationResponse response = invitationService.createInvitationLink(
                trip.getTripId(), request("editor"), alice.getId());

            // Then
            InvitationDTO invitation = response.getInvitation();
            assertThat(invitation.getUrl()).isEqualTo(BASE_URL + "/invite/" + invitation.getToken());
            assertThat(invitation.getExpiresAt()).isEqualTo(START.plus(Duration.ofDays(7)));
            assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
            assertThat(invitation.getRole()).isEqualTo(TripRole.EDITOR);
            assertThat(invitation.isRequiresSignup()).isTrue();
            assertThat(store.tokens().exists(invitation.getToken())).isTrue();
            assertThat(response.isEmailSent()).isFalse();
            verify(emailNotificationService, never()).sendInviteEmail(any(), any(), any(), any(), any(), any());
        }

        @Test
        void create_TargetedInvitationSendsEmail() {
            CreateInvitationRequest request = request("viewer");
            request.setEmail("Carol@Example.com");
            request.setMessage("Join us!");
            when(emailNotificationService.sendInviteEmail(eq("carol@example.com"), eq("Alice"), eq("Lisbon Getaway"),
                eq(TripRole.VIEWER), anyString(), eq("Join us!"))).thenReturn(true);

            CreateInvitationResponse response = invitationService.createInvitationLink(trip.getTripId(), request, alice.getId());

            assertThat(response.isEmailSent()).isTrue();
            assertThat(response.getInvitation().getInvitedEmail()).isEqualTo("carol@example.com");
        }

        @Test
        void create_RejectsOutOfRangeExpiry() {
            CreateInvitationRequest request = request("viewer");
            request.setExpiresInDays(31);

            assertThatThrownBy(() -> invitationService.createInvitationLink(trip.getTripId(), request, alice.getId()))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void create_RejectsUnknownRole() {
            assertThatThrownBy(() -> invitationService.createInvitationLink(trip.getTripId(), request("owner"), alice.getId()))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void create_RequiresInviteOthers() {
            Trip shared = store.create(aTrip().withId("trip-2").ownedBy(alice.getId())
                .withCollaborator(bob.getId(), bob.getEmail(), TripRole.EDITOR, CollaboratorStatus.ACCEPTED)
                .build());

            assertThatThrownBy(() -> invitationService.createInvitationLink(shared.getTripId(), request("viewer"), bob.getId()))
                .isInstanceOf(ForbiddenException.class);
            assertThat(store.tokenCount()).isZero();
        }
    }

    @Nested
    @DisplayName("getInvitationDetails")
    class DetailsTests {

        @Test
        void details_ShowPreviewAndRolePermissions() {
            String token = createInvitation("editor");

            InvitationDetailsDTO details = invitationService.getInvitationDetails(token);

            assertThat(details.getTrip().getOwnerName()).isEqualTo("Alice");
            assertThat(details.getTrip().getTitle()).isEqualTo("Lisbon Getaway");
            assertThat(details.getPermissions().isCanEdit()).isTrue();
            assertThat(details.getPermissions().isCanInvite()).isFalse();
        }

        @Test
        void details_UnknownTokenIsNotFound() {
            assertThatThrownBy(() -> invitationService.getInvitationDetails("nope"))
                .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void details_ExpiredInvitation() {
            String token = createInvitation("viewer");
            clock.advance(Duration.ofDays(7).plusSeconds(1));

            assertThatThrownBy(() -> invitationService.getInvitationDetails(token))
                .isInstanceOf(InvitationExpiredException.class);
        }

        @Test
        void details_UsedInvitationReportsUsedEvenAfterExpiry() {
            String token = createInvitation("viewer");
            invitationService.acceptInvitation(token, bob.getId());
            clock.advance(Duration.ofDays(30));

            assertThatThrownBy(() -> invitationService.getInvitationDetails(token))
                .isInstanceOf(InvitationAlreadyUsedException.class);
        }
    }

    @Nested
    @DisplayName("acceptInvitation")
    class AcceptTests {

        @Test
        void accept_AddsAcceptedCollaboratorAndConsumesInvitation() {
            // Given
            String token = createInvitation("editor");
            clock.advance(Duration.ofHours(1));

            // When
            TripAccessDTO access = invitationService.acceptInvitation(token, bob.getId());

            // Then
            assertThat(access.getRole()).isEqualTo(TripRole.EDITOR);
            assertThat(access.getPermissions().isCanEdit()).isTrue();
            Trip saved = store.peek(trip.getTripId());
            Collaborator collaborator = saved.collaboratorForUser(bob.getId()).orElseThrow();
            assertThat(collaborator.getStatus()).isEqualTo(CollaboratorStatus.ACCEPTED);
            assertThat(collaborator.getAcceptedAt()).isEqualTo(START.plus(Duration.ofHours(1)));
            Invitation invitation = saved.invitationForToken(token).orElseThrow();
            assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.ACCEPTED);
            assertThat(invitation.getUsedBy()).isEqualTo(bob.getId());
            assertThat(store.memberships().findByUserId(bob.getId()))
                .extracting(TripMembership::getTripId)
                .containsExactly(trip.getTripId());
        }

        @Test
        void accept_ConcurrentAcceptLosesAndLeavesOneEntry() {
            // Given
            String token = createInvitation("editor");
            User carol = users.save(new User("carol@example.com", "Carol", "hash", START));
            // Carol's accept commits between Bob's read and Bob's write.
            store.beforeNextWrite(() -> invitationService.acceptInvitation(token, carol.getId()));

            // When / Then
            assertThatThrownBy(() -> invitationService.acceptInvitation(token, bob.getId()))
                .isInstanceOf(InvitationAlreadyUsedException.class);
            assertThat(store.conflictCount()).isEqualTo(1);
            Trip saved = store.peek(trip.getTripId());
            assertThat(saved.getCollaborators()).hasSize(1);
            assertThat(saved.getCollaborators().get(0).getUserId()).isEqualTo(carol.getId());
            assertThat(saved.invitationForToken(token).orElseThrow().getUsedBy()).isEqualTo(carol.getId());
            assertThat(store.memberships().findByUserId(bob.getId())).isEmpty();
        }

        @Test
        void accept_SecondUseIsRejectedAndLeavesOneEntry() {
            String token = createInvitation("viewer");
            User carol = users.save(new User("carol@example.com", "Carol", "hash", START));
            invitationService.acceptInvitation(token, bob.getId());

            assertThatThrownBy(() -> invitationService.acceptInvitation(token, bob.getId()))
                .isInstanceOf(InvitationAlreadyUsedException.class);
            assertThatThrownBy(() -> invitationService.acceptInvitation(token, carol.getId()))
                .isInstanceOf(InvitationAlreadyUsedException.class);
            assertThat(store.peek(trip.getTripId()).getCollaborators()).hasSize(1);
        }

        @Test
        void accept_OwnerIsConflict() {
            String token = createInvitation("viewer");

            assertThatThrownBy(() -> invitationService.acceptInvitation(token, alice.getId()))
                .isInstanceOf(ConflictException.class);
        }

        @Test
        void accept_ExistingCollaboratorByEmailIsConflict() {
            String first = createInvitation("viewer");
            String second = createInvitation("admin");
            invitationService.acceptInvitation(first, bob.getId());

            assertThatThrownBy(() -> invitationService.acceptInvitation(second, bob.getId()))
                .isInstanceOf(ConflictException.class);
            assertThat(store.peek(trip.getTripId()).invitationForToken(second).orElseThrow().isPending()).isTrue();
        }

        @Test
        void accept_TargetedInvitationForSomeoneElseIsForbidden() {
            CreateInvitationRequest request = request("viewer");
            request.setEmail("carol@example.com");
            String token = invitationService.createInvitationLink(trip.getTripId(), request, alice.getId())
                .getInvitation().getToken();

            assertThatThrownBy(() -> invitationService.acceptInvitation(token, bob.getId()))
                .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("registerWithInvite")
    class RegisterWithInviteTests {

        @Test
        void register_CreatesAccountSessionAndMembership() {
            String token = createInvitation("editor");

            RegisterWithInviteResponse response = invitationService.registerWithInvite(
                new RegisterWithInviteRequest("Dave", "Dave@Example.com", "secret3", token));

            assertThat(response.getToken()).isEqualTo("jwt-token");
            assertThat(response.getUser().getEmail()).isEqualTo("dave@example.com");
            assertThat(response.getTripAccess().getRole()).isEqualTo(TripRole.EDITOR);
            assertThat(users.findByEmail("dave@example.com")).isPresent();
            assertThat(store.peek(trip.getTripId()).collaboratorForEmail("dave@example.com").orElseThrow().getStatus())
                .isEqualTo(CollaboratorStatus.ACCEPTED);
            assertThat(store.memberships().findByUserId(response.getUser().getId()))
                .extracting(TripMembership::getTripId)
                .containsExactly(trip.getTripId());
        }

        @Test
        void register_EmailWithPendingDirectInviteIsConflictAndNothingChanges() {
            // Given
            addPendingDirectInvite("carol@example.com", "direct-carol");
            String token = createInvitation("editor");

            // When / Then
            assertThatThrownBy(() -> invitationService.registerWithInvite(
                new RegisterWithInviteRequest("Carol", "carol@example.com", "secret3", token)))
                .isInstanceOf(ConflictException.class);
            Trip saved = store.peek(trip.getTripId());
            assertThat(saved.getCollaborators()).filteredOn(c -> "carol@example.com".equals(c.getEmail())).hasSize(1);
            assertThat(saved.invitationForToken(token).orElseThrow().isPending()).isTrue();
            assertThat(users.findByEmail("carol@example.com")).isEmpty();
            assertThat(store.membershipCount()).isZero();
        }

        @Test
        void register_ExistingEmailIsConflictAndNothingChanges() {
            String token = createInvitation("viewer");

            assertThatThrownBy(() -> invitationService.registerWithInvite(
                new RegisterWithInviteRequest("Bob", "bob@example.com", "secret3", token)))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("sign in instead");
            assertThat(store.peek(trip.getTripId()).invitationForToken(token).orElseThrow().isPending()).isTrue();
            assertThat(users.count()).isEqualTo(2);
        }

        @Test
        void register_InvitationWithoutSignupIsForbidden() {
            CreateInvitationRequest request = request("viewer");
            request.setAllowSignup(false);
            String token = invitationService.createInvitationLink(trip.getTripId(), request, alice.getId())
                .getInvitation().getToken();

            assertThatThrownBy(() -> invitationService.registerWithInvite(
                new RegisterWithInviteRequest("Dave", "dave@example.com", "secret3", token)))
                .isInstanceOf(ForbiddenException.class);
        }

        @Test
        void register_ValidatesInputBeforeResolvingToken() {
            assertThatThrownBy(() -> invitationService.registerWithInvite(
                new RegisterWithInviteRequest("Dave", "not-an-email", "secret3", "nope")))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    void pendingInvitations_OnlyPendingUnexpiredForCallerEmail() {
        // Given
        CreateInvitationRequest forBob = request("viewer");
        forBob.setEmail("bob@example.com");
        invitationService.createInvitationLink(trip.getTripId(), forBob, alice.getId());
        CreateInvitationRequest shortLived = request("editor");
        shortLived.setEmail("bob@example.com");
        shortLived.setExpiresInDays(1);
        clock.advance(Duration.ofDays(1));
        invitationService.createInvitationLink(trip.getTripId(), shortLived, alice.getId());
        CreateInvitationRequest forCarol = request("viewer");
        forCarol.setEmail("carol@example.com");
        invitationService.createInvitationLink(trip.getTripId(), forCarol, alice.getId());
        clock.advance(Duration.ofDays(2));

        // When
        List<InvitationDTO> pending = invitationService.getPendingInvitations(bob.getId());

        // Then
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).getRole()).isEqualTo(TripRole.VIEWER);
        assertThat(pending.get(0).getInviteType()).isEqualTo(InvitationDTO.TYPE_LINK);
    }

    @Test
    void pendingInvitations_IncludeUnansweredDirectInvites() {
        // Given
        addPendingDirectInvite("bob@example.com", "direct-bob");
        addPendingDirectInvite("carol@example.com", "direct-carol");

        // When
        List<InvitationDTO> pending = invitationService.getPendingInvitations(bob.getId());

        // Then
        assertThat(pending).hasSize(1);
        InvitationDTO direct = pending.get(0);
        assertThat(direct.getInviteType()).isEqualTo(InvitationDTO.TYPE_DIRECT);
        assertThat(direct.getToken()).isEqualTo("direct-bob");
        assertThat(direct.getTripTitle()).isEqualTo("Lisbon Getaway");
        assertThat(direct.getInviterName()).isEqualTo("Alice");
        assertThat(direct.getUrl()).isEqualTo(BASE_URL + "/invite/respond?token=direct-bob");
        assertThat(direct.getExpiresAt()).isNull();
    }

    @Test
    void revoke_MakesTokenUnusable() {
        String token = createInvitation("viewer");

        invitationService.revokeInvitation(token, alice.getId());

        assertThat(store.peek(trip.getTripId()).invitationForToken(token).orElseThrow().getStatus())
            .isEqualTo(InvitationStatus.REVOKED);
        assertThatThrownBy(() -> invitationService.acceptInvitation(token, bob.getId()))
            .isInstanceOf(InvitationAlreadyUsedException.class);
        assertThatThrownBy(() -> invitationService.revokeInvitation(token, alice.getId()))
            .isInstanceOf(InvitationAlreadyUsedException.class);
    }
}
