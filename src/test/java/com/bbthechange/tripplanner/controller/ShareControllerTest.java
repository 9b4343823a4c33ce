package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.CreateShareLinkRequest;
import com.bbthechange.tripplanner.dto.CreateShareLinkResponse;
import com.bbthechange.tripplanner.dto.ShareLinkDTO;
import com.bbthechange.tripplanner.dto.SharedTripView;
import com.bbthechange.tripplanner.exception.RateLimitExceededException;
import com.bbthechange.tripplanner.exception.ShareLinkExpiredException;
import com.bbthechange.tripplanner.exception.UnauthorizedException;
import com.bbthechange.tripplanner.model.ShareLink;
import com.bbthechange.tripplanner.model.ShareSettings;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.service.JwtService;
import com.bbthechange.tripplanner.service.ShareLinkService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static com.bbthechange.tripplanner.testutil.TripTestBuilder.aTrip;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ShareController.class, excludeAutoConfiguration = {
    SecurityAutoConfiguration.class,
    SecurityFilterAutoConfiguration.class,
    UserDetailsServiceAutoConfiguration.class
})
@TestPropertySource(locations = "classpath:application-test.properties")
@ActiveProfiles("test")
@DisplayName("ShareController Tests")
class ShareControllerTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");
    private static final String TOKEN = "shareTOKEN_123";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ShareLinkService shareLinkService;

    @MockitoBean
    private JwtService jwtService;

    @Test
    void createShareLink_NeverExposesPasswordHash() throws Exception {
        // Given
        ShareSettings settings = new ShareSettings(true, false, true, "$2a$10$hashhashhash");
        ShareLink link = new ShareLink(TOKEN, "trip-1", "owner-1", settings, NOW, 1);
        when(shareLinkService.createShareLink(eq("trip-1"), any(CreateShareLinkRequest.class), eq("owner-1")))
            .thenReturn(new CreateShareLinkResponse("Share link created successfully",
                ShareLinkDTO.from(link, "https://trips.example.com/shared/" + TOKEN), false));

        // When & Then
        mockMvc.perform(post("/trips/trip-1/share")
                .requestAttr("userId", "owner-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"password_protected\":true,\"password\":\"secret\",\"expires_in_days\":1}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.share_link.url").value("https://trips.example.com/shared/" + TOKEN))
            .andExpect(jsonPath("$.share_link.access_count").value(0))
            .andExpect(jsonPath("$.share_link.settings.password_protected").value(true))
            .andExpect(jsonPath("$.share_link.settings.password_hash").doesNotExist());
    }

    @Nested
    @DisplayName("GET /shared/{token}")
    class SharedTripTests {

        @Test
        void sharedTrip_PublicReadOnlyView() throws Exception {
            Trip trip = aTrip().build();
            ShareLink link = new ShareLink(TOKEN, "trip-1", "owner-1", new ShareSettings(true, false, false, null), NOW, 30);
            when(shareLinkService.resolveSharedTrip(eq(TOKEN), isNull(), eq("198.51.100.4")))
                .thenReturn(SharedTripView.of(trip, link));

            mockMvc.perform(get("/shared/{token}", TOKEN).with(request -> {
                    request.setRemoteAddr("198.51.100.4");
                    return request;
                }))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trip.title").value("Lisbon Getaway"))
                .andExpect(jsonPath("$.trip.is_shared").value(true))
                .andExpect(jsonPath("$.trip.collaborators").doesNotExist())
                .andExpect(jsonPath("$.trip.owner_id").doesNotExist());
        }

        @Test
        void sharedTrip_WrongPassword_Returns401() throws Exception {
            when(shareLinkService.resolveSharedTrip(eq(TOKEN), eq("guess"), any()))
                .thenThrow(new UnauthorizedException("Incorrect password"));

            mockMvc.perform(get("/shared/{token}", TOKEN).param("password", "guess"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        }

        @Test
        void sharedTrip_Expired_Returns410() throws Exception {
            when(shareLinkService.resolveSharedTrip(eq(TOKEN), isNull(), any()))
                .thenThrow(new ShareLinkExpiredException("This share link has expired"));

            mockMvc.perform(get("/shared/{token}", TOKEN))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.error").value("SHARE_LINK_EXPIRED"));
        }

        @Test
        void sharedTrip_TooManyFailures_Returns429() throws Exception {
            when(shareLinkService.resolveSharedTrip(eq(TOKEN), eq("secret"), any()))
                .thenThrow(new RateLimitExceededException("Too many incorrect password attempts. Please try again later."));

            mockMvc.perform(get("/shared/{token}", TOKEN).param("password", "secret"))
                .andExpect(status().isTooManyRequests());
        }
    }
}
