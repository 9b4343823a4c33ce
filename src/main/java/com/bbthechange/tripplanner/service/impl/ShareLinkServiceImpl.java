package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.CreateShareLinkRequest;
import com.bbthechange.tripplanner.dto.CreateShareLinkResponse;
import com.bbthechange.tripplanner.dto.ShareLinkDTO;
import com.bbthechange.tripplanner.dto.SharedTripView;
import com.bbthechange.tripplanner.exception.RateLimitExceededException;
import com.bbthechange.tripplanner.exception.ResourceNotFoundException;
import com.bbthechange.tripplanner.exception.ShareLinkExpiredException;
import com.bbthechange.tripplanner.exception.UnauthorizedException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.Capability;
import com.bbthechange.tripplanner.model.ShareLink;
import com.bbthechange.tripplanner.model.ShareSettings;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.TripTokenType;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.repository.TripRepository;
import com.bbthechange.tripplanner.repository.TripTokenRepository;
import com.bbthechange.tripplanner.repository.TripTransactionRepository;
import com.bbthechange.tripplanner.service.EmailNotificationService;
import com.bbthechange.tripplanner.service.PasswordService;
import com.bbthechange.tripplanner.service.RateLimitingService;
import com.bbthechange.tripplanner.service.ShareLinkService;
import com.bbthechange.tripplanner.service.TripAccessEvaluator;
import com.bbthechange.tripplanner.service.UserService;
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
import java.util.stream.Collectors;

@Service
public class ShareLinkServiceImpl implements ShareLinkService {

    private static final Logger logger = LoggerFactory.getLogger(ShareLinkServiceImpl.class);

    static final int MIN_EXPIRY_DAYS = 1;
    static final int MAX_EXPIRY_DAYS = 365;

    private final TripRepository tripRepository;
    private final TripTokenRepository tokenRepository;
    private final TripTransactionRepository transactionRepository;
    private final TripAccessEvaluator accessEvaluator;
    private final UserService userService;
    private final PasswordService passwordService;
    private final RateLimitingService rateLimitingService;
    private final EmailNotificationService emailNotificationService;
    private final Clock clock;
    private final String baseUrl;

    @Autowired
    public ShareLinkServiceImpl(TripRepository tripRepository,
                                TripTokenRepository tokenRepository,
                                TripTransactionRepository transactionRepository,
                                TripAccessEvaluator accessEvaluator,
                                UserService userService,
                                PasswordService passwordService,
                                RateLimitingService rateLimitingService,
                                EmailNotificationService emailNotificationService,
                                Clock clock,
                                @Value("${app.base-url:http://localhost:3000}") String baseUrl) {
        this.tripRepository = tripRepository;
        this.tokenRepository = tokenRepository;
        this.transactionRepository = transactionRepository;
        this.accessEvaluator = accessEvaluator;
        this.userService = userService;
        this.passwordService = passwordService;
        this.rateLimitingService = rateLimitingService;
        this.emailNotificationService = emailNotificationService;
        this.clock = clock;
        this.baseUrl = baseUrl;
    }

    @Override
    public CreateShareLinkResponse createShareLink(String tripId, CreateShareLinkRequest request, String userId) {
        boolean passwordProtected = Boolean.TRUE.equals(request.getPasswordProtected());
        if (passwordProtected && (request.getPassword() == null || request.getPassword().isBlank())) {
            throw new ValidationException("A password is required for password-protected share links");
        }
        int expiresInDays = request.getExpiresInDays() == null
            ? ShareLink.DEFAULT_EXPIRY_DAYS
            : request.getExpiresInDays();
        if (expiresInDays < MIN_EXPIRY_DAYS || expiresInDays > MAX_EXPIRY_DAYS) {
            throw new ValidationException("expires_in_days must be between " + MIN_EXPIRY_DAYS + " and " + MAX_EXPIRY_DAYS);
        }

        ShareSettings settings = new ShareSettings(
            request.getIsPublic() == null || request.getIsPublic(),
            Boolean.TRUE.equals(request.getAllowComments()),
            passwordProtected,
            passwordProtected ? passwordService.hash(request.getPassword()) : null);

        Trip saved = OptimisticRetry.run("create share link", () -> {
            Trip trip = loadTrip(tripId);
            accessEvaluator.requireAccess(trip, userId, Capability.MANAGE_SETTINGS);

            Instant now = clock.instant();
            String token = SecureTokenGenerator.generateUnique(tokenRepository::exists);
            trip.addShareLink(new ShareLink(token, tripId, userId, settings, now, expiresInDays));
            trip.touch(now);

            return transactionRepository.updateTripWithToken(trip,
                new TripToken(token, TripTokenType.SHARE_LINK, tripId, null, now));
        });

        ShareLink link = saved.getShareLinks().get(saved.getShareLinks().size() - 1);
        String url = shareUrl(link.getToken());
        logger.info("User {} created share link on trip {} (password protected: {}, expires {})",
            userId, tripId, passwordProtected, link.getExpiresAt());

        boolean emailSent = false;
        if (Boolean.TRUE.equals(request.getSendEmail())) {
            User creator = userService.requireUser(userId);
            emailSent = emailNotificationService.sendShareNotificationEmail(creator.getEmail(), saved.getTitle(),
                saved.getDestination(), url, settings);
        }
        return new CreateShareLinkResponse("Share link created successfully", ShareLinkDTO.from(link, url), emailSent);
    }

    @Override
    public SharedTripView resolveSharedTrip(String token, String password, String clientIp) {
        TripToken tripToken = findShareToken(token);
        Trip trip = loadSharedTrip(tripToken.getTripId());
        ShareLink link = findLink(trip, token);

        if (link.isExpiredAt(clock.instant())) {
            logger.info("Share link for trip {} expired at {}", trip.getTripId(), link.getExpiresAt());
            throw new ShareLinkExpiredException("This share link has expired");
        }
        if (link.getSettings() != null && link.getSettings().requiresPassword()) {
            checkPassword(token, link, password, clientIp);
        }

        // Counted through a versioned write so concurrent views are never lost.
        Trip saved = OptimisticRetry.run("record share link access", () -> {
            Trip current = loadSharedTrip(tripToken.getTripId());
            ShareLink currentLink = findLink(current, token);
            Instant now = clock.instant();
            if (currentLink.isExpiredAt(now)) {
                throw new ShareLinkExpiredException("This share link has expired");
            }
            currentLink.recordAccess(now);
            return tripRepository.update(current);
        });

        ShareLink recorded = findLink(saved, token);
        logger.debug("Share link on trip {} accessed, count now {}", saved.getTripId(), recorded.getAccessCount());
        return SharedTripView.of(saved, recorded);
    }

    @Override
    public List<ShareLinkDTO> getShareLinks(String tripId, String userId) {
        Trip trip = loadTrip(tripId);
        accessEvaluator.requireAccess(trip, userId, Capability.MANAGE_SETTINGS);
        return trip.getShareLinks() == null ? List.of() : trip.getShareLinks().stream()
            .map(link -> ShareLinkDTO.from(link, shareUrl(link.getToken())))
            .collect(Collectors.toList());
    }

    /**
     * A correct password always gets through. Failed attempts are counted per token and client,
     * and once the limit is reached further failures report 429 instead of 401.
     */
    private void checkPassword(String token, ShareLink link, String password, String clientIp) {
        boolean supplied = password != null && !password.isEmpty();
        if (supplied && passwordService.matches(password, link.getSettings().getPasswordHash())) {
            return;
        }
        if (!rateLimitingService.isSharePasswordAttemptAllowed(token, clientIp)) {
            throw new RateLimitExceededException("Too many incorrect password attempts. Please try again later.");
        }
        if (!supplied) {
            throw new UnauthorizedException("This shared trip requires a password");
        }
        rateLimitingService.recordSharePasswordFailure(token, clientIp);
        logger.warn("Incorrect share link password for trip {} from {}", link.getTripId(), clientIp);
        throw new UnauthorizedException("Incorrect password");
    }

    private TripToken findShareToken(String token) {
        if (token == null || token.isBlank()) {
            throw new ResourceNotFoundException("Share link not found");
        }
        return tokenRepository.findByToken(token)
            .filter(t -> t.getTokenType() == TripTokenType.SHARE_LINK)
            .orElseThrow(() -> new ResourceNotFoundException("Share link not found"));
    }

    private Trip loadSharedTrip(String tripId) {
        return tripRepository.findById(tripId)
            .orElseThrow(() -> new ResourceNotFoundException("Share link not found"));
    }

    private static ShareLink findLink(Trip trip, String token) {
        return trip.shareLinkForToken(token)
            .orElseThrow(() -> new ResourceNotFoundException("Share link not found"));
    }

    private Trip loadTrip(String tripId) {
        return tripRepository.findById(tripId)
            .orElseThrow(() -> new ResourceNotFoundException("Trip not found: " + tripId));
    }

    private String shareUrl(String token) {
        return baseUrl + "/shared/" + token;
    }
}
