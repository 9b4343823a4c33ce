package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.dto.CollaboratorDTO;
import com.bbthechange.tripplanner.dto.InviteCollaboratorRequest;
import com.bbthechange.tripplanner.dto.InviteCollaboratorResponse;
import com.bbthechange.tripplanner.dto.InviteResponseResult;
import com.bbthechange.tripplanner.dto.RespondToInviteRequest;

import java.util.List;

/**
 * Direct collaborator invitations: a pending collaborator entry addressed to one email,
 * answered once with accept or decline.
 */
public interface CollaboratorService {

    InviteCollaboratorResponse inviteCollaborator(String tripId, InviteCollaboratorRequest request, String userId);

    InviteResponseResult respondToInvite(RespondToInviteRequest request, String userId);

    List<CollaboratorDTO> getCollaborators(String tripId, String userId);
}
