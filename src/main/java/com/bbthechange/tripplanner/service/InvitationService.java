package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.dto.CreateInvitationRequest;
import com.bbthechange.tripplanner.dto.CreateInvitationResponse;
import com.bbthechange.tripplanner.dto.InvitationDTO;
import com.bbthechange.tripplanner.dto.InvitationDetailsDTO;
import com.bbthechange.tripplanner.dto.RegisterWithInviteRequest;
import com.bbthechange.tripplanner.dto.RegisterWithInviteResponse;
import com.bbthechange.tripplanner.dto.TripAccessDTO;

import java.util.List;

/**
 * Invitation links for co-editing a trip. Every invitation is single use:
 * once accepted or revoked it can never be consumed again.
 */
public interface InvitationService {

    CreateInvitationResponse createInvitationLink(String tripId, CreateInvitationRequest request, String userId);

    /**
     * @throws com.bbthechange.tripplanner.exception.ResourceNotFoundException if no invitation carries the token
     * @throws com.bbthechange.tripplanner.exception.InvitationAlreadyUsedException if it was accepted or revoked
     * @throws com.bbthechange.tripplanner.exception.InvitationExpiredException if it is past its expiry
     */
    InvitationDetailsDTO getInvitationDetails(String token);

    TripAccessDTO acceptInvitation(String token, String userId);

    RegisterWithInviteResponse registerWithInvite(RegisterWithInviteRequest request);

    List<InvitationDTO> getPendingInvitations(String userId);

    void revokeInvitation(String token, String userId);
}
