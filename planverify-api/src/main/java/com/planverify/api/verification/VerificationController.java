package com.planverify.api.verification;

import com.planverify.api.config.ClientAddresses;
import com.planverify.api.verification.VerificationService.AcceptanceView;
import com.planverify.api.verification.VerificationService.PairAggregate;
import com.planverify.api.verification.VerificationService.SubmissionResult;
import com.planverify.api.verification.VerificationService.SubmitVerificationCommand;
import com.planverify.api.verification.VerificationService.VerificationStats;
import com.planverify.api.verification.VerificationService.VerificationView;
import com.planverify.core.domain.VoteDirection;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.UUID;

/**
 * Crowd verification REST endpoints.
 */
@RestController
@RequestMapping("/api/v1/verify")
public class VerificationController {

    private final VerificationService verificationService;
    private final VoteService voteService;

    public VerificationController(VerificationService verificationService, VoteService voteService) {
        this.verificationService = verificationService;
        this.voteService = voteService;
    }

    /**
     * Submit a report that a provider does or does not accept a plan.
     */
    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(
            @Valid @RequestBody SubmitVerificationRequest request,
            HttpServletRequest httpRequest) {
        SubmissionResult result = verificationService.submitVerification(new SubmitVerificationCommand(
                request.npi(),
                request.planId(),
                request.locationId(),
                request.acceptsInsurance(),
                request.acceptsNewPatients(),
                request.phoneReached(),
                request.phoneCorrect(),
                request.scheduledAppointment(),
                request.notes(),
                request.evidenceUrl(),
                request.submittedBy(),
                ClientAddresses.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT),
                null
        ));

        return ResponseEntity.status(HttpStatus.CREATED).body(new SubmissionResponse(
                result.verification(),
                result.acceptance(),
                "Verification submitted successfully"
        ));
    }

    @PostMapping("/{verificationId}/vote")
    public ResponseEntity<VoteResponse> vote(
            @PathVariable UUID verificationId,
            @Valid @RequestBody VoteRequest request,
            HttpServletRequest httpRequest) {
        VoteDirection direction;
        try {
            direction = VoteDirection.parse(request.vote());
        } catch (IllegalArgumentException e) {
            throw new VoteService.InvalidVoteException(e.getMessage());
        }

        VoteService.VoteResult result = voteService.vote(verificationId, direction, ClientAddresses.resolve(httpRequest));
        VerificationView verification = result.verification();

        return ResponseEntity.ok(new VoteResponse(
                verification.id(),
                verification.upvotes(),
                verification.downvotes(),
                verification.netVotes(),
                result.voteChanged(),
                result.voteChanged() ? "Vote changed to " + request.vote() : "Vote recorded: " + request.vote()
        ));
    }

    @GetMapping("/stats")
    public ResponseEntity<VerificationStats> stats() {
        return ResponseEntity.ok(verificationService.getVerificationStats());
    }

    @GetMapping("/recent")
    public ResponseEntity<RecentResponse> recent(
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String npi,
            @RequestParam(required = false) String planId,
            @RequestParam(defaultValue = "false") boolean includeExpired) {
        List<VerificationView> verifications =
                verificationService.getRecentVerifications(limit, npi, planId, includeExpired);
        return ResponseEntity.ok(new RecentResponse(verifications, verifications.size()));
    }

    @GetMapping("/{npi}/{planId}")
    public ResponseEntity<PairAggregate> pair(
            @PathVariable String npi,
            @PathVariable String planId,
            @RequestParam(required = false) Long locationId,
            @RequestParam(defaultValue = "false") boolean includeExpired) {
        return ResponseEntity.ok(verificationService.getAggregateForPair(npi, planId, locationId, includeExpired));
    }

    @ExceptionHandler(VerificationService.ProviderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProviderNotFound(VerificationService.ProviderNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("VERIFY_001", e.getMessage()));
    }

    @ExceptionHandler(VerificationService.PlanNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePlanNotFound(VerificationService.PlanNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("VERIFY_002", e.getMessage()));
    }

    @ExceptionHandler(VoteService.VerificationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleVerificationNotFound(VoteService.VerificationNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("VERIFY_003", e.getMessage()));
    }

    @ExceptionHandler(SybilGuard.DuplicateSubmissionException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateSubmission(SybilGuard.DuplicateSubmissionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("VERIFY_004", e.getMessage()));
    }

    @ExceptionHandler(VoteService.DuplicateVoteException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateVote(VoteService.DuplicateVoteException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("VERIFY_005", e.getMessage()));
    }

    @ExceptionHandler(VerificationService.InvalidVerificationRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(VerificationService.InvalidVerificationRequestException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VERIFY_006", e.getMessage()));
    }

    @ExceptionHandler(VoteService.InvalidVoteException.class)
    public ResponseEntity<ErrorResponse> handleInvalidVote(VoteService.InvalidVoteException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VERIFY_007", e.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VERIFY_008", "Invalid request parameters"));
    }

    @ExceptionHandler({DataIntegrityViolationException.class, ConcurrencyFailureException.class,
            VoteService.VoteConflictException.class})
    public ResponseEntity<ErrorResponse> handleConcurrentWrite(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("VERIFY_009", "Conflicting concurrent update, please retry"));
    }

    public record SubmitVerificationRequest(
            @NotBlank @Pattern(regexp = "\\d{10}", message = "NPI must be exactly 10 digits") String npi,
            @NotBlank @Size(max = 50) String planId,
            Long locationId,
            @NotNull Boolean acceptsInsurance,
            Boolean acceptsNewPatients,
            Boolean phoneReached,
            Boolean phoneCorrect,
            Boolean scheduledAppointment,
            @Size(max = 1000) String notes,
            @Size(max = 500) String evidenceUrl,
            @Email @Size(max = 200) String submittedBy
    ) {}

    public record VoteRequest(
            @NotBlank String vote
    ) {}

    public record SubmissionResponse(
            VerificationView verification,
            AcceptanceView acceptance,
            String message
    ) {}

    public record VoteResponse(
            UUID id,
            int upvotes,
            int downvotes,
            int netVotes,
            boolean voteChanged,
            String message
    ) {}

    public record RecentResponse(
            List<VerificationView> verifications,
            int count
    ) {}

    public record ErrorResponse(
            String code,
            String message
    ) {}
}
