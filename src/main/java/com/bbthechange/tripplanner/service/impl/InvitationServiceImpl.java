package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.CreateInvitationRequest;
import com.bbthechange.tripplanner.dto.CreateInvitationResponse;
import com.bbthechange.tripplanner.dto.InvitationDTO;
import com.bbthechange.tripplanner.dto.InvitationDetailsDTO;
import com.bbthechange.tripplanner.dto.PermissionsDTO;
import com.bbthechange.tripplanner.dto.RegisterWithInviteRequest;
import com.bbthechange.tripplanner.dto.RegisterWithInviteResponse;
import com.bbthechange.tripplanner.dto.TripAccessDTO;
import com.bbthechange.tripplanner.dto.TripPreviewDTO;
import com.bbthechange.tripplanner.dto.UserDTO;
import com.bbthechange.tripplanner.exception.ConflictException;
import com.bbthechange.tripplanner.exception.ForbiddenException;
import com.bbthechange.tripplanner.exception.InvitationAlreadyUsedException;
import com.bbthechange.tripplanner.exception.InvitationExpiredException;
import com.bbthechange.tripplanner.exception.ResourceNotFoundException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.Capability;
import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.CollaboratorStatus;
import com.bbthechange.tripplanner.model.Invitation;
import com.bbthechange.tripplanner.model.InvitationStatus;
import com.bbthechange.tripplanner.model.RolePermissions;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.model.TripRole;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.TripTokenType;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.repository.TripRepository;
import com.bbthechange.tripplanner.repository.TripTokenRepository;
import com.bbthechange.tripplanner.repository.TripTransactionRepository;
import com.bbthechange.tripplanner.service.EmailNotificationService;
import com.bbthechange.tripplanner.service.InvitationService;
import com.bbthechange.tripplanner.service.JwtService;
import com.bbthechange.tripplanner.service.PasswordService;
import com.bbthechange.tripplanner.service.TripAccessEvaluator;
import com.bbthechange.tripplanner.service.UserService;
import com.bbthechange.tripplanner.util.EmailAddresses;
import com.bbthechange.tripplanner.util.OptimisticRetry;
import com.bbthechange.tripplanner.util.SecureTokenGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Invitation link lifecycle.
 *
 * Tokens resolve through the TripTokens index, never by scanning trips. Consumption is a versioned
 * write of the trip, so two concurrent accepts of one token cannot both succeed: the loser re-reads
 * the trip, finds the invitation no longer pending and fails with {@link InvitationAlreadyUsedException}.
 */
@Service
public class InvitationServiceImpl implements InvitationService {

    private static final Logger logger = LoggerFactory.getLogger(InvitationServiceImpl.class);

    static final int MIN_EXPIRY_DAYS = 1;
    static final int MAX_EXPIRY_DAYS = 30;

    private final TripRepository tripRepository;
    private final TripTokenRepository tokenRepository;
    private final TripTransactionRepository transactionRepository;
    private final TripAccessEvaluator accessEvaluator;
    private final UserService userService;
    private final PasswordService passwordService;
    private final JwtService jwtService;
    private final EmailNotificationService emailNotificationService;
    private final Clock clock;
    private final String baseUrl;

    @Autowired
    public InvitationServiceImpl(TripRepository tripRepository,
                                 TripTokenRepository tokenRepository,
                                 TripTransactionRepository transactionRepository,
                                 TripAccessEvaluator accessEvaluator,
                                 UserService userService,
                                 PasswordService passwordService,
                                 JwtService jwtService,
                                 EmailNotificationService emailNotificationService,
                                 Clock clock,
                                 @Value("${app.base-url:http://localhost:3000}") String baseUrl) {
        this.tripRepository = tripRepository;
        this.tokenRepository = tokenRepository;
        this.transactionRepository = transactionRepository;
        this.accessEvaluator = accessEvaluator;
        this.userService = userService;
        this.passwordService = passwordService;
        this.jwtService = jwtService;
        this.emailNotificationService = emailNotificationService;
        this.clock = clock;
        this.baseUrl = baseUrl;
    }

    @Override
    public CreateInvitationResponse createInvitationLink(String tripId, CreateInvitationRequest request, String userId) {
        TripRole role = TripRole.parse(request.getRole());
        String targetEmail = request.getEmail() == null || request.getEmail().isBlank()
            ? null
            : EmailAddresses.requireValid(request.getEmail());
        int expiresInDays = request.getExpiresInDays() == null
            ? Invitation.DEFAULT_EXPIRY_DAYS
            : request.getExpiresInDays();
        if (expiresInDays < MIN_EXPIRY_DAYS || expiresInDays > MAX_EXPIRY_DAYS) {
            throw new ValidationException("expires_in_days must be between " + MIN_EXPIRY_DAYS + " and " + MAX_EXPIRY_DAYS);
        }
        User inviter = userService.requireUser(userId);

        Trip saved = OptimisticRetry.run("create invitation", () -> {
            Trip trip = loadTrip(tripId);
            accessEvaluator.requireAccess(trip, userId, Capability.INVITE_OTHERS);

            Instant now = clock.instant();
            String token = SecureTokenGenerator.generateUnique(tokenRepository::exists);
            Invitation invitation = new Invitation(token, tripId, inviter, role, now, expiresInDays);
            invitation.setEmail(targetEmail);
            invitation.setMessage(request.getMessage());
            if (request.getAllowSignup() != null) {
                invitation.setAllowSignup(request.getAllowSignup());
            }
            trip.addInvitation(invitation);
            trip.touch(now);

            return transactionRepository.updateTripWithToken(trip,
                new TripToken(token, TripTokenType.INVITATION, tripId, targetEmail, now));
        });

        Invitation invitation = saved.getInvitations().get(saved.getInvitations().size() - 1);
        String url = invitationUrl(invitation.getToken());
        logger.info("User {} created {} invitation on trip {} expiring {}", userId, role.getValue(), tripId,
            invitation.getExpiresAt());

        boolean emailSent = false;
        if (targetEmail != null) {
            emailSent = emailNotificationService.sendInviteEmail(targetEmail, inviter.getName(), saved.getTitle(),
                role, url, request.getMessage());
        }
        return new CreateInvitationResponse("Invitation created successfully",
            InvitationDTO.from(invitation, saved.getTitle(), url), emailSent);
    }

    @Override
    public InvitationDetailsDTO getInvitationDetails(String token) {
        ResolvedInvitation resolved = resolve(token);
        Trip trip = resolved.trip;
        Invitation invitation = resolved.invitation;

        String ownerName = userService.findById(trip.getOwnerId())
            .map(User::getName)
            .orElse(invitation.getInviterName());
        return new InvitationDetailsDTO(
            InvitationDTO.from(invitation, trip.getTitle(), invitationUrl(token)),
            TripPreviewDTO.from(trip, ownerName),
            PermissionsDTO.of(RolePermissions.capabilitiesFor(invitation.getRole())));
    }

    @Override
    public TripAccessDTO acceptInvitation(String token, String userId) {
        User user = userService.requireUser(userId);

        Trip saved = OptimisticRetry.run("accept invitation", () -> {
            ResolvedInvitation resolved = resolve(token);
            Trip trip = resolved.trip;
            Invitation invitation = resolved.invitation;

            requireNotAlreadyMember(trip, user);
            requireAddressedTo(invitation, user.getEmail());

            Instant now = clock.instant();
            consume(trip, invitation, user, now);
            return transactionRepository.updateTripWithMembership(trip, new TripMembership(user.getId(), trip, now));
        });

        Invitation invitation = saved.invitationForToken(token)
            .orElseThrow(() -> new IllegalStateException("Accepted invitation missing from trip " + saved.getTripId()));
        logger.info("User {} accepted invitation to trip {} as {}", userId, saved.getTripId(), invitation.getRole().getValue());
        return tripAccess(saved, invitation.getRole());
    }

    @Override
    public RegisterWithInviteResponse registerWithInvite(RegisterWithInviteRequest request) {
        String email = EmailAddresses.requireValid(request.getEmail());
        UserServiceImpl.requireAcceptablePassword(request.getPassword());
        String passwordHash = passwordService.hash(request.getPassword());
        User user = new User(email, request.getName(), passwordHash, clock.instant());

        Trip saved = OptimisticRetry.run("register with invitation", () -> {
            ResolvedInvitation resolved = resolve(request.getInviteToken());
            Trip trip = resolved.trip;
            Invitation invitation = resolved.invitation;

            if (!invitation.allowsSignup()) {
                throw new ForbiddenException("This invitation does not allow creating a new account");
            }
            requireAddressedTo(invitation, email);
            if (userService.findByEmail(email).isPresent()) {
                logger.warn("Register-with-invite rejected, account exists for {}", email);
                throw new ConflictException("An account with this email already exists. Please sign in instead.");
            }
            if (trip.collaboratorForEmail(email).isPresent()) {
                logger.warn("Register-with-invite rejected, {} already has an entry on trip {}", email, trip.getTripId());
                throw new ConflictException("This email has already been invited to this trip");
            }

            Instant now = clock.instant();
            consume(trip, invitation, user, now);
            return transactionRepository.createUserAndUpdateTrip(user, trip, new TripMembership(user.getId(), trip, now));
        });

        Invitation invitation = saved.invitationForToken(request.getInviteToken())
            .orElseThrow(() -> new IllegalStateException("Accepted invitation missing from trip " + saved.getTripId()));
        logger.info("Registered user {} through invitation to trip {}", user.getId(), saved.getTripId());

        return new RegisterWithInviteResponse(UserDTO.from(user), jwtService.generateToken(user.getId()),
            jwtService.getAccessTokenExpirationSeconds(), tripAccess(saved, invitation.getRole()));
    }

    /**
     * Pending invitations addressed to the caller's email: unexpired invitation links plus direct
     * collaborator invites still awaiting an answer.
     */
    @Override
    public List<InvitationDTO> getPendingInvitations(String userId) {
        User user = userService.requireUser(userId);
        Instant now = clock.instant();
        List<InvitationDTO> pending = new ArrayList<>();

        for (TripToken tripToken : tokenRepository.findByTargetEmail(user.getEmail())) {
            if (tripToken.getTokenType() == TripTokenType.SHARE_LINK) {
                continue;
            }
            Optional<Trip> found = tripRepository.findById(tripToken.getTripId());
            if (found.isEmpty()) {
                logger.debug("Skipping token for deleted trip {}", tripToken.getTripId());
                continue;
            }
            Trip trip = found.get();
            if (tripToken.getTokenType() == TripTokenType.INVITATION) {
                trip.invitationForToken(tripToken.getToken())
                    .filter(Invitation::isPending)
                    .filter(i -> !i.isExpiredAt(now))
                    .ifPresent(i -> pending.add(InvitationDTO.from(i, trip.getTitle(), invitationUrl(i.getToken()))));
            } else {
                trip.collaboratorForInviteToken(tripToken.getToken())
                    .filter(c -> c.getStatus() == CollaboratorStatus.PENDING)
                    .ifPresent(c -> pending.add(InvitationDTO.fromCollaborator(c, trip.getTripId(), trip.getTitle(),
                        inviterName(c), baseUrl + "/invite/respond?token=" + c.getInviteToken())));
            }
        }
        return pending;
    }

    @Override
    public void revokeInvitation(String token, String userId) {
        TripToken tripToken = findInvitationToken(token);

        OptimisticRetry.run("revoke invitation", () -> {
            Trip trip = loadTrip(tripToken.getTripId());
            accessEvaluator.requireAccess(trip, userId, Capability.INVITE_OTHERS);
            Invitation invitation = trip.invitationForToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("Invitation not found"));
            if (!invitation.isPending()) {
                throw new InvitationAlreadyUsedException("Only pending invitations can be revoked");
            }
            Instant now = clock.instant();
            invitation.revoke(userId, now);
            trip.touch(now);
            return tripRepository.update(trip);
        });
        logger.info("User {} revoked invitation on trip {}", userId, tripToken.getTripId());
    }

    /**
     * Token to pending, unexpired invitation. Status is checked before expiry:
     * a consumed invitation reports as used even once its window has also passed.
     */
    private ResolvedInvitation resolve(String token) {
        TripToken tripToken = findInvitationToken(token);
        Trip trip = loadTrip(tripToken.getTripId());
        Invitation invitation = trip.invitationForToken(token)
            .orElseThrow(() -> new ResourceNotFoundException("Invitation not found"));

        if (invitation.getStatus() == InvitationStatus.REVOKED) {
            throw new InvitationAlreadyUsedException("This invitation has been revoked");
        }
        if (!invitation.isPending()) {
            throw new InvitationAlreadyUsedException("This invitation has already been used");
        }
        if (invitation.isExpiredAt(clock.instant())) {
            throw new InvitationExpiredException("This invitation has expired");
        }
        return new ResolvedInvitation(trip, invitation);
    }

    private TripToken findInvitationToken(String token) {
        if (token == null || token.isBlank()) {
            throw new ResourceNotFoundException("Invitation not found");
        }
        return tokenRepository.findByToken(token)
            .filter(t -> t.getTokenType() == TripTokenType.INVITATION)
            .orElseThrow(() -> new ResourceNotFoundException("Invitation not found"));
    }

    private void requireNotAlreadyMember(Trip trip, User user) {
        if (trip.isOwnedBy(user.getId())) {
            throw new ConflictException("You already own this trip");
        }
        if (trip.collaboratorForUser(user.getId()).isPresent() || trip.collaboratorForEmail(user.getEmail()).isPresent()) {
            throw new ConflictException("You are already a collaborator on this trip");
        }
    }

    private static void requireAddressedTo(Invitation invitation, String email) {
        if (invitation.isTargeted() && !invitation.getEmail().equalsIgnoreCase(email)) {
            throw new ForbiddenException("This invitation was sent to a different email address");
        }
    }

    private static void consume(Trip trip, Invitation invitation, User user, Instant now) {
        Collaborator collaborator = new Collaborator(user.getId(), user.getEmail(), user.getName(),
            invitation.getRole(), invitation.getInviterId(), invitation.getCreatedAt());
        collaborator.setInviteToken(invitation.getToken());
        collaborator.accept(user.getId(), now);
        trip.addCollaborator(collaborator);
        invitation.markUsed(user.getId(), now);
        trip.touch(now);
    }

    private String inviterName(Collaborator collaborator) {
        return userService.findById(collaborator.getInvitedBy())
            .map(User::getName)
            .orElse(null);
    }

    private TripAccessDTO tripAccess(Trip trip, TripRole role) {
        return new TripAccessDTO(trip.getTripId(), trip.getTitle(), role,
            PermissionsDTO.of(RolePermissions.capabilitiesFor(role)));
    }

    private Trip loadTrip(String tripId) {
        return tripRepository.findById(tripId)
            .orElseThrow(() -> new ResourceNotFoundException("Trip not found: " + tripId));
    }

    private String invitationUrl(String token) {
        return baseUrl + "/invite/" + token;
    }

    private static final class ResolvedInvitation {
        private final Trip trip;
        private final Invitation invitation;

        private ResolvedInvitation(Trip trip, Invitation invitation) {
            this.trip = trip;
            this.invitation = invitation;
        }
    }
}
