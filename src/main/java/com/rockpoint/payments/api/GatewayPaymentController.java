package com.rockpoint.payments.api;

import com.rockpoint.payments.core.PaymentFollowUpService;
import com.rockpoint.payments.core.PaymentOrchestrator;
import com.rockpoint.payments.core.ReversalOrchestrator;
import com.rockpoint.payments.domain.CreatePaymentRequest;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.GatewayStats;
import com.rockpoint.payments.domain.OperationResult;
import com.rockpoint.payments.domain.PaymentResult;
import com.rockpoint.payments.domain.StatusCheckResult;
import com.rockpoint.payments.domain.TransactionFilter;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.service.TransactionPersistenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * REST API used by POS terminals for wallet/QR payments. Gateway names in
 * paths are the {@link GatewayKind} constants, e.g. {@code FAST_PAY}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "QR payments", description = "Create, confirm, reverse and query wallet/QR payments")
public class GatewayPaymentController {

    private final PaymentOrchestrator orchestrator;
    private final ReversalOrchestrator reversalOrchestrator;
    private final PaymentFollowUpService followUpService;

    @PostMapping("/{gateway}")
    @Operation(
            summary = "Create payment",
            description = "Charges the scanned QR/OTP code (FAST_PAY, CLICK_PASS) or issues a QR receipt (PAYME_QR). "
                    + "Gateway declines and network failures return 200 with success=false; retryable=true means no "
                    + "gateway answer was received and the cashier may try again with a new scan.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment processed. Check body.success.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request. Body: { \"error\", \"message\" | \"details\" }"),
            @ApiResponse(responseCode = "500", description = "Gateway not configured or internal error. Body: { \"error\", \"message\" }")
    })
    public ResponseEntity<PaymentResponseDto> create(@PathVariable GatewayKind gateway,
                                                     @Valid @RequestBody CreatePaymentRequestDto dto) {
        CreatePaymentRequest request = CreatePaymentRequest.builder()
                .gateway(gateway)
                .amount(dto.getAmount())
                .otpData(dto.getOtpData())
                .employeeId(dto.getEmployeeId())
                .terminalId(dto.getTerminalId())
                .cashboxCode(dto.getCashboxCode())
                .description(dto.getDescription())
                .accountData(dto.getAccountData())
                .build();
        PaymentResult result = orchestrator.createPayment(request);
        if (result.isValidationError()) {
            return ResponseEntity.badRequest().body(PaymentResponseDto.from(result));
        }
        if (!result.isSuccess() && result.getData() == null && PaymentResult.CONFIGURATION_ERROR.equals(result.getError())) {
            return ResponseEntity.internalServerError().body(PaymentResponseDto.from(result));
        }
        return ResponseEntity.ok(PaymentResponseDto.from(result));
    }

    @PostMapping("/transactions/{transactionId}/confirmation")
    @Operation(summary = "Confirm or reject", description = "For payments approved with requiresConfirmation (CLICK_PASS). REJECT reverses the payment.")
    public ResponseEntity<OperationResult> confirm(@PathVariable String transactionId,
                                                   @Valid @RequestBody ConfirmationRequestDto dto) {
        return ResponseEntity.ok(orchestrator.confirmPayment(transactionId, dto.getAction(), dto.getEmployeeId()));
    }

    @PostMapping("/orders/{orderId}/reversal")
    @Operation(summary = "Reverse payment", description = "Full-amount cancellation of a successful payment by merchant order id.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reversal processed. Check body.success."),
            @ApiResponse(responseCode = "404", description = "Unknown order id")
    })
    public ResponseEntity<OperationResult> reverse(@PathVariable String orderId,
                                                   @Valid @RequestBody ReversalRequestDto dto) {
        return ResponseEntity.ok(reversalOrchestrator.reversePayment(orderId, dto.getReason(), dto.getRequestedBy()));
    }

    @PostMapping("/transactions/{transactionId}/fiscalization")
    @Operation(summary = "Submit fiscal receipt", description = "Sends the fiscal receipt URL for a successful payment. Not supported by CLICK_PASS.")
    public ResponseEntity<OperationResult> fiscalize(@PathVariable String transactionId,
                                                     @Valid @RequestBody FiscalizationRequestDto dto) {
        return ResponseEntity.ok(followUpService.submitFiscalization(transactionId, dto.getFiscalUrl()));
    }

    @GetMapping("/transactions/{transactionId}/gateway-status")
    @Operation(summary = "Poll gateway status", description = "Read-only. Returns the gateway's status next to the local one.")
    public ResponseEntity<StatusCheckResult> gatewayStatus(@PathVariable String transactionId) {
        return ResponseEntity.ok(followUpService.checkPaymentStatus(transactionId));
    }

    @PostMapping("/transactions/{transactionId}/sale")
    @Operation(summary = "Link to POS sale", description = "Links a successful payment to the POS sale it settles. Allowed once.")
    public ResponseEntity<OperationResult> linkToSale(@PathVariable String transactionId,
                                                      @Valid @RequestBody LinkSaleRequestDto dto) {
        return ResponseEntity.ok(orchestrator.linkToSale(transactionId, dto.getPosTransactionId()));
    }

    @GetMapping("/transactions/{transactionId}")
    @Operation(summary = "Get transaction")
    public ResponseEntity<TransactionResponseDto> getTransaction(@PathVariable String transactionId) {
        return ResponseEntity.ok(TransactionResponseDto.from(orchestrator.getTransaction(transactionId)));
    }

    @GetMapping("/transactions")
    @Operation(summary = "List transactions", description = "Newest first. size defaults to 20, capped at 100.")
    public ResponseEntity<Page<TransactionResponseDto>> listTransactions(
            @RequestParam(required = false) GatewayKind gateway,
            @RequestParam(required = false) TransactionStatus status,
            @RequestParam(required = false) String employeeId,
            @RequestParam(required = false) String terminalId,
            @RequestParam(required = false) Integer errorCode,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + TransactionPersistenceService.DEFAULT_PAGE_SIZE) int size) {
        TransactionFilter filter = TransactionFilter.builder()
                .gateway(gateway)
                .status(status)
                .employeeId(employeeId)
                .terminalId(terminalId)
                .errorCode(errorCode)
                .initiatedFrom(from)
                .initiatedTo(to)
                .build();
        return ResponseEntity.ok(orchestrator.listTransactions(filter, page, size).map(TransactionResponseDto::from));
    }

    @GetMapping("/{gateway}/stats")
    @Operation(summary = "Gateway statistics", description = "Counts, amount, average processing time and top errors for the last 24 hours.")
    public ResponseEntity<GatewayStats> stats(@PathVariable GatewayKind gateway) {
        return ResponseEntity.ok(orchestrator.gatewayStats(gateway));
    }
}
