package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.dto.AllowanceResponse;
import com.flagship.token_ledger.ledger.dto.ApproveRequest;
import com.flagship.token_ledger.ledger.dto.BalanceResponse;
import com.flagship.token_ledger.ledger.dto.BurnRequest;
import com.flagship.token_ledger.ledger.dto.CreateLedgerRequest;
import com.flagship.token_ledger.ledger.dto.IssueRequest;
import com.flagship.token_ledger.ledger.dto.LedgerResponse;
import com.flagship.token_ledger.ledger.dto.SupplyResponse;
import com.flagship.token_ledger.ledger.dto.TransferFromRequest;
import com.flagship.token_ledger.ledger.dto.TransferRequest;
import com.flagship.token_ledger.ledger.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * REST controller exposing the token ledger.
 *
 * The caller identity of every mutating call is taken verbatim from the
 * X-Caller-Account header; authenticating it is the job of whatever sits in front
 * of this service.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    public static final String CALLER_HEADER = "X-Caller-Account";

    private final LedgerService ledgerService;

    /**
     * Creates the ledger. Without a body the ledger starts empty.
     *
     * @param request Initial supply, credited entirely to the caller (optional)
     * @param caller Creating account, from header (required)
     */
    @PostMapping
    public ResponseEntity<LedgerResponse> createLedger(
            @Valid @RequestBody(required = false) CreateLedgerRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        AccountId creator = AccountId.fromHex(caller);
        log.info("Received ledger creation request: initialSupply={}",
                request != null ? request.getInitialSupply() : "default");

        LedgerState state = request != null
            ? ledgerService.createLedger(creator, request.getInitialSupply())
            : ledgerService.createDefaultLedger(creator);

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new LedgerResponse(creator, state.getTotalSupply()));
    }

    @GetMapping("/total-supply")
    public ResponseEntity<SupplyResponse> totalSupply() {
        return ResponseEntity.ok(new SupplyResponse(ledgerService.totalSupply()));
    }

    @GetMapping("/balances/{account}")
    public ResponseEntity<BalanceResponse> balanceOf(@PathVariable("account") String account) {
        AccountId id = AccountId.fromHex(account);
        return ResponseEntity.ok(new BalanceResponse(id, ledgerService.balanceOf(id)));
    }

    @GetMapping("/allowances/{owner}/{spender}")
    public ResponseEntity<AllowanceResponse> allowanceOf(@PathVariable("owner") String owner,
                                                         @PathVariable("spender") String spender) {
        AccountId ownerId = AccountId.fromHex(owner);
        AccountId spenderId = AccountId.fromHex(spender);
        return ResponseEntity.ok(
            new AllowanceResponse(ownerId, spenderId, ledgerService.allowanceOf(ownerId, spenderId)));
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> transfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        AccountId from = AccountId.fromHex(caller);
        ledgerService.transfer(from, request.getTo(), request.getValue());
        return ResponseEntity.ok(new TransferResponse(from, request.getTo(), request.getValue()));
    }

    /**
     * Moves tokens out of {@code from} to the caller. No allowance is required.
     */
    @PostMapping("/transfers-from")
    public ResponseEntity<TransferResponse> transferFrom(
            @Valid @RequestBody TransferFromRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        AccountId to = AccountId.fromHex(caller);
        ledgerService.transferFrom(to, request.getFrom(), request.getValue());
        return ResponseEntity.ok(new TransferResponse(request.getFrom(), to, request.getValue()));
    }

    @PostMapping("/burns")
    public ResponseEntity<BalanceResponse> burn(
            @Valid @RequestBody BurnRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        AccountId account = AccountId.fromHex(caller);
        return ResponseEntity.ok(new BalanceResponse(account, ledgerService.burn(account, request.getValue())));
    }

    /**
     * Credits {@code to}. Issuing is not restricted to any account; the caller header is
     * optional and only recorded in the logs.
     */
    @PostMapping("/issues")
    public ResponseEntity<BalanceResponse> issue(
            @Valid @RequestBody IssueRequest request,
            @RequestHeader(value = CALLER_HEADER, required = false) String caller) {

        AccountId issuer = caller != null ? AccountId.fromHex(caller) : null;
        BigInteger balance = ledgerService.issue(issuer, request.getTo(), request.getValue());
        return ResponseEntity.ok(new BalanceResponse(request.getTo(), balance));
    }

    @PostMapping("/approvals")
    public ResponseEntity<AllowanceResponse> approve(
            @Valid @RequestBody ApproveRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        AccountId owner = AccountId.fromHex(caller);
        ledgerService.approve(owner, request.getSpender(), request.getValue());
        return ResponseEntity.ok(new AllowanceResponse(owner, request.getSpender(), request.getValue()));
    }
}
