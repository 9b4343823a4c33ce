package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.CollaborationTripDTO;
import com.bbthechange.tripplanner.dto.CreateTripRequest;
import com.bbthechange.tripplanner.dto.PermissionsDTO;
import com.bbthechange.tripplanner.dto.TripDTO;
import com.bbthechange.tripplanner.dto.UpdateItineraryRequest;
import com.bbthechange.tripplanner.dto.UpdateTripRequest;
import com.bbthechange.tripplanner.exception.ConflictException;
import com.bbthechange.tripplanner.exception.ForbiddenException;
import com.bbthechange.tripplanner.exception.ResourceNotFoundException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.Capability;
import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.CollaboratorStatus;
import com.bbthechange.tripplanner.model.Invitation;
import com.bbthechange.tripplanner.model.ItineraryItem;
import com.bbthechange.tripplanner.model.Place;
import com.bbthechange.tripplanner.model.ShareLink;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.TripTokenType;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.repository.TripMembershipRepository;
import com.bbthechange.tripplanner.repository.TripRepository;
import com.bbthechange.tripplanner.repository.TripTokenRepository;
import com.bbthechange.tripplanner.service.TripAccessEvaluator;
import com.bbthechange.tripplanner.service.TripService;
import com.bbthechange.tripplanner.service.UserService;
import com.bbthechange.tripplanner.util.OptimisticRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class TripServiceImpl implements TripService {

    private static final Logger logger = LoggerFactory.getLogger(TripServiceImpl.class);

    private final TripRepository tripRepository;
    private final TripTokenRepository tokenRepository;
    private final TripMembershipRepository membershipRepository;
    private final UserService userService;
    private final TripAccessEvaluator accessEvaluator;
    private final Clock clock;

    @Autowired
    public TripServiceImpl(TripRepository tripRepository, TripTokenRepository tokenRepository,
                           TripMembershipRepository membershipRepository, UserService userService,
                           TripAccessEvaluator accessEvaluator, Clock clock) {
        this.tripRepository = tripRepository;
        this.tokenRepository = tokenRepository;
        this.membershipRepository = membershipRepository;
        this.userService = userService;
        this.accessEvaluator = accessEvaluator;
        this.clock = clock;
    }

    @Override
    public List<TripDTO> getTrips(String userId) {
        List<Trip> trips = tripRepository.findByOwnerId(userId);
        logger.debug("Retrieved {} trips for user {}", trips.size(), userId);
        return trips.stream()
            .map(trip -> toDto(trip, userId))
            .collect(Collectors.toList());
    }

    @Override
    public List<CollaborationTripDTO> getSharedTrips(String userId) {
        User user = userService.requireUser(userId);
        Map<String, CollaborationTripDTO> shared = new LinkedHashMap<>();

        // Answered invites, through the caller's membership pointers
        for (TripMembership membership : membershipRepository.findByUserId(userId)) {
            Optional<Trip> trip = tripRepository.findById(membership.getTripId());
            if (trip.isEmpty()) {
                logger.debug("Skipping membership of user {} in deleted trip {}", userId, membership.getTripId());
                continue;
            }
            trip.get().collaboratorForUser(userId)
                .ifPresent(c -> shared.put(trip.get().getTripId(), toCollaborationDto(trip.get(), c, userId)));
        }

        // Direct invites still awaiting an answer are only known by email
        for (TripToken tripToken : tokenRepository.findByTargetEmail(user.getEmail())) {
            if (tripToken.getTokenType() != TripTokenType.COLLABORATOR_INVITE || shared.containsKey(tripToken.getTripId())) {
                continue;
            }
            Optional<Trip> trip = tripRepository.findById(tripToken.getTripId());
            trip.flatMap(t -> t.collaboratorForInviteToken(tripToken.getToken()))
                .filter(c -> c.getStatus() == CollaboratorStatus.PENDING)
                .ifPresent(c -> shared.put(trip.get().getTripId(), toCollaborationDto(trip.get(), c, userId)));
        }

        List<CollaborationTripDTO> result = new ArrayList<>(shared.values());
        result.sort(Comparator.comparing((CollaborationTripDTO t) -> t.getCollaboration().getInvitedAt(),
            Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        logger.debug("Retrieved {} shared trips for user {}", result.size(), userId);
        return result;
    }

    @Override
    public TripDTO createTrip(CreateTripRequest request, String userId) {
        requireOrderedDates(request.getStartDate(), request.getEndDate());

        Trip trip = new Trip(userId, request.getTitle().trim(), request.getDestination().trim(),
            request.getStartDate(), request.getEndDate(), clock.instant());
        if (request.getDescription() != null) {
            trip.setDescription(request.getDescription());
        }
        if (request.getTotalBudget() != null) {
            trip.setTotalBudget(request.getTotalBudget());
        }
        if (request.getCurrency() != null && !request.getCurrency().isBlank()) {
            trip.setCurrency(request.getCurrency().trim().toUpperCase());
        }
        if (request.getStatus() != null) {
            trip.setStatus(request.getStatus());
        }
        if (request.getIsPublic() != null) {
            trip.setIsPublic(request.getIsPublic());
        }

        Trip created = tripRepository.create(trip);
        logger.info("Created trip {} for user {}", created.getTripId(), userId);
        return toDto(created, userId);
    }

    @Override
    public TripDTO getTrip(String tripId, String userId) {
        Trip trip = loadTrip(tripId);
        accessEvaluator.requireAccess(trip, userId, Capability.VIEW_TRIP);
        return toDto(trip, userId);
    }

    @Override
    public TripDTO updateTrip(String tripId, UpdateTripRequest request, String userId) {
        if (!request.hasUpdates()) {
            throw new ValidationException("No fields to update");
        }
        return mutate("update trip", tripId, userId, Capability.MANAGE_SETTINGS, trip -> {
            if (request.getTitle() != null) {
                if (request.getTitle().isBlank()) {
                    throw new ValidationException("Title cannot be blank");
                }
                trip.setTitle(request.getTitle().trim());
            }
            if (request.getDescription() != null) {
                trip.setDescription(request.getDescription());
            }
            if (request.getDestination() != null) {
                trip.setDestination(request.getDestination().trim());
            }
            LocalDate start = request.getStartDate() != null ? request.getStartDate() : trip.getStartDate();
            LocalDate end = request.getEndDate() != null ? request.getEndDate() : trip.getEndDate();
            requireOrderedDates(start, end);
            trip.setStartDate(start);
            trip.setEndDate(end);
            trip.setDuration(Trip.calculateDuration(start, end));
            if (request.getTotalBudget() != null) {
                trip.setTotalBudget(request.getTotalBudget());
            }
            if (request.getCurrency() != null) {
                trip.setCurrency(request.getCurrency().trim().toUpperCase());
            }
            if (request.getStatus() != null) {
                trip.setStatus(request.getStatus());
            }
            if (request.getIsPublic() != null) {
                trip.setIsPublic(request.getIsPublic());
            }
        });
    }

    @Override
    public void deleteTrip(String tripId, String userId) {
        Trip trip = loadTrip(tripId);
        if (!trip.isOwnedBy(userId)) {
            logger.warn("User {} attempted to delete trip {} they do not own", userId, tripId);
            throw new ForbiddenException("Only the trip owner can delete this trip");
        }

        tripRepository.delete(tripId);
        List<String> tokens = tokensOf(trip);
        tokens.forEach(tokenRepository::delete);
        List<String> members = memberIdsOf(trip);
        members.forEach(memberId -> membershipRepository.delete(memberId, tripId));
        logger.info("Deleted trip {} with {} token index entries and {} memberships", tripId, tokens.size(), members.size());
    }

    @Override
    public TripDTO updateItinerary(String tripId, UpdateItineraryRequest request, String userId) {
        List<ItineraryItem> items = request.getItinerary();
        if (items == null) {
            throw new ValidationException("Itinerary is required");
        }
        return mutate("update itinerary", tripId, userId, Capability.EDIT_ITINERARY, trip -> {
            List<ItineraryItem> ordered = new ArrayList<>(items);
            for (int i = 0; i < ordered.size(); i++) {
                if (ordered.get(i).getOrder() == null) {
                    ordered.get(i).setOrder(i);
                }
            }
            trip.setItinerary(ordered);
        });
    }

    @Override
    public TripDTO addWishlistPlace(String tripId, Place place, String userId) {
        if (place == null || isBlank(place.getName()) && isBlank(place.getPlaceId())) {
            throw new ValidationException("Place must have a name or a place id");
        }
        return mutate("add wishlist place", tripId, userId, Capability.EDIT_ITINERARY, trip -> {
            List<Place> wishlist = trip.getWishlist() == null ? new ArrayList<>() : new ArrayList<>(trip.getWishlist());
            boolean duplicate = place.getPlaceId() != null && wishlist.stream()
                .anyMatch(p -> place.getPlaceId().equals(p.getPlaceId()));
            if (duplicate) {
                throw new ConflictException("Place is already on the wishlist");
            }
            wishlist.add(place);
            trip.setWishlist(wishlist);
        });
    }

    @Override
    public TripDTO removeWishlistPlace(String tripId, String placeId, String userId) {
        return mutate("remove wishlist place", tripId, userId, Capability.EDIT_ITINERARY, trip -> {
            List<Place> wishlist = trip.getWishlist() == null ? new ArrayList<>() : new ArrayList<>(trip.getWishlist());
            boolean removed = wishlist.removeIf(p -> placeId.equals(p.getPlaceId()));
            if (!removed) {
                throw new ResourceNotFoundException("Place not found on wishlist: " + placeId);
            }
            trip.setWishlist(wishlist);
        });
    }

    /**
     * Versioned read-modify-write. Access and validation are re-checked on every attempt
     * against the freshly read trip.
     */
    private TripDTO mutate(String operation, String tripId, String userId, Capability required, Consumer<Trip> change) {
        Trip saved = OptimisticRetry.run(operation, () -> {
            Trip trip = loadTrip(tripId);
            accessEvaluator.requireAccess(trip, userId, required);
            change.accept(trip);
            trip.touch(clock.instant());
            return tripRepository.update(trip);
        });
        logger.info("{} on trip {} by user {}", operation, tripId, userId);
        return toDto(saved, userId);
    }

    private Trip loadTrip(String tripId) {
        return tripRepository.findById(tripId)
            .orElseThrow(() -> new ResourceNotFoundException("Trip not found: " + tripId));
    }

    private TripDTO toDto(Trip trip, String userId) {
        return TripDTO.from(trip, PermissionsDTO.of(accessEvaluator.effectiveCapabilities(trip, userId)));
    }

    private CollaborationTripDTO toCollaborationDto(Trip trip, Collaborator collaborator, String userId) {
        User owner = userService.findById(trip.getOwnerId()).orElse(null);
        return CollaborationTripDTO.from(trip, collaborator, owner,
            PermissionsDTO.of(accessEvaluator.effectiveCapabilities(trip, userId)));
    }

    private static List<String> memberIdsOf(Trip trip) {
        return trip.getCollaborators() == null ? List.of() : trip.getCollaborators().stream()
            .map(Collaborator::getUserId)
            .filter(id -> id != null && !id.isEmpty())
            .distinct()
            .collect(Collectors.toList());
    }

    private static List<String> tokensOf(Trip trip) {
        Stream<String> collaboratorTokens = trip.getCollaborators() == null ? Stream.empty()
            : trip.getCollaborators().stream().map(Collaborator::getInviteToken);
        Stream<String> invitationTokens = trip.getInvitations() == null ? Stream.empty()
            : trip.getInvitations().stream().map(Invitation::getToken);
        Stream<String> shareTokens = trip.getShareLinks() == null ? Stream.empty()
            : trip.getShareLinks().stream().map(ShareLink::getToken);
        return Stream.of(collaboratorTokens, invitationTokens, shareTokens)
            .flatMap(s -> s)
            .filter(Objects::nonNull)
            .distinct()
            .collect(Collectors.toList());
    }

    private static void requireOrderedDates(LocalDate start, LocalDate end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new ValidationException("End date cannot be before start date");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
