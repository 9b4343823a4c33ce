package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.EmailVerificationRequest;
import com.bbthechange.tripplanner.dto.EmailVerificationStatusDTO;
import com.bbthechange.tripplanner.dto.MessageResponse;
import com.bbthechange.tripplanner.service.EmailVerificationService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EmailVerificationController extends BaseController {

    private final EmailVerificationService emailVerificationService;

    @Autowired
    public EmailVerificationController(EmailVerificationService emailVerificationService) {
        this.emailVerificationService = emailVerificationService;
    }

    @PostMapping("/email/request-verification")
    public ResponseEntity<MessageResponse> requestVerification(@Valid @RequestBody EmailVerificationRequest request) {
        if (emailVerificationService.isVerified(request.getEmail())) {
            return ResponseEntity.ok(new MessageResponse("Email already verified"));
        }
        boolean sent = emailVerificationService.requestVerification(request.getEmail());
        return ResponseEntity.ok(new MessageResponse(sent
            ? "Verification email sent"
            : "Verification requested, but the email could not be sent"));
    }

    @GetMapping("/verify-email/{token}")
    public ResponseEntity<EmailVerificationStatusDTO> verify(@PathVariable String token) {
        return ResponseEntity.ok(emailVerificationService.verify(token));
    }

    @GetMapping("/email/status")
    public ResponseEntity<EmailVerificationStatusDTO> status(@RequestParam String email) {
        return ResponseEntity.ok(emailVerificationService.getStatus(email));
    }
}
