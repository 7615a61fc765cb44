package com.flagship.drink_ledger.web;

import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.ledger.UserKind;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import com.flagship.drink_ledger.transaction.Money;
import com.flagship.drink_ledger.web.dto.ActivationResponse;
import com.flagship.drink_ledger.web.dto.PayUpResponse;
import com.flagship.drink_ledger.web.dto.PostpaidUserResponse;
import com.flagship.drink_ledger.web.dto.PrepaidUserResponse;
import com.flagship.drink_ledger.web.dto.StatsResponse;
import com.flagship.drink_ledger.web.dto.UserMoneyRequest;
import com.flagship.drink_ledger.web.dto.UsernameRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative operations: statistics, settlements, balance corrections,
 * activation and prepaid user removal.
 *
 * Group checks happen in {@link LedgerTransactionService}; this controller
 * only translates between JSON and ledger types.
 */
@RestController
@RequiredArgsConstructor
public class AdminController {

    private final LedgerTransactionService ledgerService;

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats(LedgerPrincipal principal) {
        return ResponseEntity.ok(StatsResponse.from(ledgerService.snapshot(principal)));
    }

    @PostMapping("/payup")
    public ResponseEntity<PayUpResponse> payUp(LedgerPrincipal principal,
                                               @Valid @RequestBody UserMoneyRequest request) {
        return ResponseEntity.ok(PayUpResponse.from(
            ledgerService.payUp(principal, request.getUsername(), Money.toCents(request.getMoney()))));
    }

    @PostMapping("/set_money_postpaid")
    public ResponseEntity<PostpaidUserResponse> setMoneyPostpaid(LedgerPrincipal principal,
                                                                 @Valid @RequestBody UserMoneyRequest request) {
        return ResponseEntity.ok(PostpaidUserResponse.from(
            ledgerService.setMoneyPostpaid(principal, request.getUsername(), Money.toCents(request.getMoney()))));
    }

    @PostMapping("/set_money_prepaid")
    public ResponseEntity<PrepaidUserResponse> setMoneyPrepaid(LedgerPrincipal principal,
                                                               @Valid @RequestBody UserMoneyRequest request) {
        return ResponseEntity.ok(PrepaidUserResponse.from(
            ledgerService.setMoneyPrepaid(principal, request.getUsername(), Money.toCents(request.getMoney()))));
    }

    @PostMapping("/toggle_activated_user_postpaid")
    public ResponseEntity<ActivationResponse> togglePostpaid(LedgerPrincipal principal,
                                                             @Valid @RequestBody UsernameRequest request) {
        return toggle(principal, request.getUsername(), UserKind.POSTPAID);
    }

    @PostMapping("/toggle_activated_user_prepaid")
    public ResponseEntity<ActivationResponse> togglePrepaid(LedgerPrincipal principal,
                                                            @Valid @RequestBody UsernameRequest request) {
        return toggle(principal, request.getUsername(), UserKind.PREPAID);
    }

    @PostMapping("/del_prepaid_user")
    public ResponseEntity<Void> deletePrepaidUser(LedgerPrincipal principal,
                                                  @Valid @RequestBody UsernameRequest request) {
        ledgerService.deletePrepaidUser(principal, request.getUsername());
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<ActivationResponse> toggle(LedgerPrincipal principal, String username, UserKind kind) {
        boolean activated = ledgerService.toggleActivated(principal, username, kind);
        return ResponseEntity.ok(new ActivationResponse(username, kind, activated));
    }
}
