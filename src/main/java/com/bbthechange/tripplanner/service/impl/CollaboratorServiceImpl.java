package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.CollaboratorDTO;
import com.bbthechange.tripplanner.dto.InviteCollaboratorRequest;
import com.bbthechange.tripplanner.dto.InviteCollaboratorResponse;
import com.bbthechange.tripplanner.dto.InviteResponseResult;
import com.bbthechange.tripplanner.dto.PermissionsDTO;
import com.bbthechange.tripplanner.dto.RespondToInviteRequest;
import com.bbthechange.tripplanner.dto.TripAccessDTO;
import com.bbthechange.tripplanner.exception.ConflictException;
import com.bbthechange.tripplanner.exception.ForbiddenException;
import com.bbthechange.tripplanner.exception.InvitationAlreadyUsedException;
import com.bbthechange.tripplanner.exception.ResourceNotFoundException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.Capability;
import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.CollaboratorStatus;
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
import com.bbthechange.tripplanner.service.CollaboratorService;
import com.bbthechange.tripplanner.service.EmailNotificationService;
import com.bbthechange.tripplanner.service.EmailVerificationService;
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
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class CollaboratorServiceImpl implements CollaboratorService {

    private static final Logger logger = LoggerFactory.getLogger(CollaboratorServiceImpl.class);

    private final TripRepository tripRepository;
    private final TripTokenRepository tokenRepository;
    private final TripTransactionRepository transactionRepository;
    private final TripAccessEvaluator accessEvaluator;
    private final UserService userService;
    private final EmailVerificationService emailVerificationService;
    private final EmailNotificationService emailNotificationService;
    private final Clock clock;
    private final String baseUrl;

    @Autowired
    public CollaboratorServiceImpl(TripRepository tripRepository,
                                   TripTokenRepository tokenRepository,
                                   TripTransactionRepository transactionRepository,
                                   TripAccessEvaluator accessEvaluator,
                                   UserService userService,
                                   EmailVerificationService emailVerificationService,
                                   EmailNotificationService emailNotificationService,
                                   Clock clock,
                                   @Value("${app.base-url:http://localhost:3000}") String baseUrl) {
        this.tripRepository = tripRepository;
        this.tokenRepository = tokenRepository;
        this.transactionRepository = transactionRepository;
        this.accessEvaluator = accessEvaluator;
        this.userService = userService;
        this.emailVerificationService = emailVerificationService;
        this.emailNotificationService = emailNotificationService;
        this.clock = clock;
        this.baseUrl = baseUrl;
    }

    @Override
    public InviteCollaboratorResponse inviteCollaborator(String tripId, InviteCollaboratorRequest request, String userId) {
        String email = EmailAddresses.requireValid(request.getEmail());
        TripRole role = request.getRole() == null || request.getRole().isBlank()
            ? TripRole.VIEWER
            : TripRole.parse(request.getRole());
        User inviter = userService.requireUser(userId);
        Optional<User> invitee = userService.findByEmail(email);

        Trip saved = OptimisticRetry.run("invite collaborator", () -> {
            Trip trip = loadTrip(tripId);
            accessEvaluator.requireAccess(trip, userId, Capability.INVITE_OTHERS);

            if (trip.isOwnedBy(userId) && email.equalsIgnoreCase(inviter.getEmail())) {
                throw new ValidationException("You cannot invite yourself to your own trip");
            }
            if (invitee.isPresent() && trip.isOwnedBy(invitee.get().getId())) {
                throw new ConflictException("This user already owns the trip");
            }
            if (trip.collaboratorForEmail(email).isPresent()) {
                throw new ConflictException("User is already a collaborator on this trip");
            }

            Instant now = clock.instant();
            String token = SecureTokenGenerator.generateUnique(tokenRepository::exists);
            Collaborator entry = new Collaborator(
                invitee.map(User::getId).orElse(""),
                email,
                invitee.map(User::getName).orElse(User.defaultNameFor(email)),
                role,
                userId,
                now);
            entry.setInviteToken(token);
            trip.addCollaborator(entry);
            trip.touch(now);

            return transactionRepository.updateTripWithToken(trip,
                new TripToken(token, TripTokenType.COLLABORATOR_INVITE, tripId, email, now));
        });
        Collaborator collaborator = saved.collaboratorForEmail(email)
            .orElseThrow(() -> new IllegalStateException("Invited collaborator missing from saved trip " + tripId));
        logger.info("User {} invited {} as {} to trip {}", userId, email, role.getValue(), tripId);

        CollaboratorDTO dto = CollaboratorDTO.from(collaborator);
        if (!emailVerificationService.isVerified(email)) {
            boolean verificationSent = emailVerificationService.requestVerification(email);
            logger.info("Invitee {} has not verified their address, verification email sent: {}", email, verificationSent);
            return new InviteCollaboratorResponse("Email verification required", dto,
                collaborator.getInviteToken(), false, true);
        }

        boolean emailSent = emailNotificationService.sendInviteEmail(email, inviter.getName(), saved.getTitle(),
            role, responseUrl(collaborator.getInviteToken()), request.getMessage());
        return new InviteCollaboratorResponse("Collaborator invited successfully", dto,
            collaborator.getInviteToken(), emailSent, false);
    }

    @Override
    public InviteResponseResult respondToInvite(RespondToInviteRequest request, String userId) {
        User user = userService.requireUser(userId);
        TripToken tripToken = tokenRepository.findByToken(request.getInviteToken())
            .filter(t -> t.getTokenType() == TripTokenType.COLLABORATOR_INVITE)
            .orElseThrow(() -> new ResourceNotFoundException("Invitation not found"));
        boolean accept = request.isAccept();

        return OptimisticRetry.run("respond to invite", () -> {
            Trip trip = loadTrip(tripToken.getTripId());
            Collaborator collaborator = trip.collaboratorForInviteToken(request.getInviteToken())
                .orElseThrow(() -> new ResourceNotFoundException("Invitation not found"));

            if (collaborator.getStatus() != CollaboratorStatus.PENDING) {
                throw new InvitationAlreadyUsedException("This invitation has already been responded to");
            }
            if (!isAddressedTo(collaborator, user)) {
                logger.warn("User {} tried to answer an invitation addressed to {}", userId, collaborator.getEmail());
                throw new ForbiddenException("This invitation was sent to a different user");
            }

            Instant now = clock.instant();
            if (accept) {
                collaborator.accept(userId, now);
                if (collaborator.getName() == null || collaborator.getName().isBlank()) {
                    collaborator.setName(user.getName());
                }
            } else {
                collaborator.decline(now);
            }
            trip.touch(now);
            // Declined entries keep their pointer so the caller still sees the answered invite.
            Trip saved = transactionRepository.updateTripWithMembership(trip, new TripMembership(userId, trip, now));
            logger.info("User {} {} invitation to trip {}", userId, accept ? "accepted" : "declined", saved.getTripId());

            TripAccessDTO access = accept
                ? new TripAccessDTO(saved.getTripId(), saved.getTitle(), collaborator.getRole(),
                    PermissionsDTO.of(RolePermissions.capabilitiesFor(collaborator.getRole())))
                : null;
            return new InviteResponseResult(saved.getTripId(), saved.getTitle(), collaborator.getStatus(), access);
        });
    }

    @Override
    public List<CollaboratorDTO> getCollaborators(String tripId, String userId) {
        Trip trip = loadTrip(tripId);
        accessEvaluator.requireAccess(trip, userId, Capability.VIEW_TRIP);
        return trip.getCollaborators() == null ? List.of() : trip.getCollaborators().stream()
            .map(CollaboratorDTO::from)
            .collect(Collectors.toList());
    }

    private static boolean isAddressedTo(Collaborator collaborator, User user) {
        String boundUserId = collaborator.getUserId();
        if (boundUserId != null && !boundUserId.isEmpty()) {
            return boundUserId.equals(user.getId());
        }
        return collaborator.getEmail() != null && collaborator.getEmail().equalsIgnoreCase(user.getEmail());
    }

    private Trip loadTrip(String tripId) {
        return tripRepository.findById(tripId)
            .orElseThrow(() -> new ResourceNotFoundException("Trip not found: " + tripId));
    }

    private String responseUrl(String token) {
        return baseUrl + "/invite/respond?token=" + token;
    }
}
