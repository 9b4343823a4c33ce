package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.CreateInvitationRequest;
import com.bbthechange.tripplanner.dto.CreateInvitationResponse;
import com.bbthechange.tripplanner.dto.InvitationDTO;
import com.bbthechange.tripplanner.dto.InvitationDetailsDTO;
import com.bbthechange.tripplanner.dto.PermissionsDTO;
import com.bbthechange.tripplanner.dto.TripAccessDTO;
import com.bbthechange.tripplanner.dto.TripPreviewDTO;
import com.bbthechange.tripplanner.exception.InvitationAlreadyUsedException;
import com.bbthechange.tripplanner.exception.InvitationExpiredException;
import com.bbthechange.tripplanner.model.Invitation;
import com.bbthechange.tripplanner.model.RolePermissions;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripRole;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.service.InvitationService;
import com.bbthechange.tripplanner.service.JwtService;
import com.bbthechange.tripplanner.service.RateLimitingService;
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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = InvitationController.class, excludeAutoConfiguration = {
    SecurityAutoConfiguration.class,
    SecurityFilterAutoConfiguration.class,
    UserDetailsServiceAutoConfiguration.class
})
@TestPropertySource(locations = "classpath:application-test.properties")
@ActiveProfiles("test")
@DisplayName("InvitationController Tests")
class InvitationControllerTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");
    private static final String TOKEN = "abcDEF123_-token";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private InvitationService invitationService;

    @MockitoBean
    private RateLimitingService rateLimitingService;

    @MockitoBean
    private JwtService jwtService;

    private static Invitation editorInvitation() {
        User alice = new User("alice@example.com", "Alice", "hash", NOW);
        return new Invitation(TOKEN, "trip-1", alice, TripRole.EDITOR, NOW, 7);
    }

    @Test
    void createInvitationLink_Returns201WithUrl() throws Exception {
        // Given
        InvitationDTO dto = InvitationDTO.from(editorInvitation(), "Lisbon Getaway",
            "https://trips.example.com/invite/" + TOKEN);
        when(invitationService.createInvitationLink(eq("trip-1"), any(CreateInvitationRequest.class), eq("owner-1")))
            .thenReturn(new CreateInvitationResponse("Invitation created successfully", dto, false));

        // When & Then
        mockMvc.perform(post("/trips/trip-1/invite-link")
                .requestAttr("userId", "owner-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"role\":\"editor\",\"expires_in_days\":7}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.invitation.url").value("https://trips.example.com/invite/" + TOKEN))
            .andExpect(jsonPath("$.invitation.role").value("editor"))
            .andExpect(jsonPath("$.invitation.status").value("pending"))
            .andExpect(jsonPath("$.email_sent").value(false));
    }

    @Test
    void createInvitationLink_ExpiryOutOfRange_Returns400() throws Exception {
        mockMvc.perform(post("/trips/trip-1/invite-link")
                .requestAttr("userId", "owner-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"role\":\"editor\",\"expires_in_days\":45}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(invitationService);
    }

    @Nested
    @DisplayName("GET /invite/{token}/details")
    class DetailsTests {

        @Test
        void details_IsPublicAndShowsPermissions() throws Exception {
            // Given
            Trip trip = aTrip().build();
            InvitationDetailsDTO details = new InvitationDetailsDTO(
                InvitationDTO.from(editorInvitation(), trip.getTitle(), "https://trips.example.com/invite/" + TOKEN),
                TripPreviewDTO.from(trip, "Alice"),
                PermissionsDTO.of(RolePermissions.capabilitiesFor(TripRole.EDITOR)));
            when(rateLimitingService.isInviteDetailsLookupAllowed("203.0.113.7")).thenReturn(true);
            when(invitationService.getInvitationDetails(TOKEN)).thenReturn(details);

            // When & Then
            mockMvc.perform(get("/invite/{token}/details", TOKEN)
                    .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trip.owner_name").value("Alice"))
                .andExpect(jsonPath("$.permissions.can_edit").value(true))
                .andExpect(jsonPath("$.permissions.can_invite").value(false));
        }

        @Test
        void details_TooManyLookups_Returns429() throws Exception {
            when(rateLimitingService.isInviteDetailsLookupAllowed(anyString())).thenReturn(false);

            mockMvc.perform(get("/invite/{token}/details", TOKEN))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("RATE_LIMIT_EXCEEDED"));

            verifyNoInteractions(invitationService);
        }

        @Test
        void details_Expired_Returns400WithCode() throws Exception {
            when(rateLimitingService.isInviteDetailsLookupAllowed(anyString())).thenReturn(true);
            when(invitationService.getInvitationDetails(TOKEN))
                .thenThrow(new InvitationExpiredException("This invitation has expired"));

            mockMvc.perform(get("/invite/{token}/details", TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVITATION_EXPIRED"));
        }
    }

    @Test
    void accept_ReturnsTripAccess() throws Exception {
        when(invitationService.acceptInvitation(TOKEN, "bob-1")).thenReturn(new TripAccessDTO("trip-1", "Lisbon Getaway",
            TripRole.EDITOR, PermissionsDTO.of(RolePermissions.capabilitiesFor(TripRole.EDITOR))));

        mockMvc.perform(post("/invite/accept")
                .requestAttr("userId", "bob-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"invite_token\":\"" + TOKEN + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trip_id").value("trip-1"))
            .andExpect(jsonPath("$.role").value("editor"))
            .andExpect(jsonPath("$.permissions.can_edit").value(true));
    }

    @Test
    void accept_AlreadyUsed_Returns400WithCode() throws Exception {
        when(invitationService.acceptInvitation(TOKEN, "carol-1"))
            .thenThrow(new InvitationAlreadyUsedException("This invitation has already been used"));

        mockMvc.perform(post("/invite/accept")
                .requestAttr("userId", "carol-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"invite_token\":\"" + TOKEN + "\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVITATION_ALREADY_USED"));
    }

    @Test
    void revoke_Returns204() throws Exception {
        mockMvc.perform(delete("/invite/{token}", TOKEN).requestAttr("userId", "owner-1"))
            .andExpect(status().isNoContent());

        verify(invitationService).revokeInvitation(TOKEN, "owner-1");
    }
}
