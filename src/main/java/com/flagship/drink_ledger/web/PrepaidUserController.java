package com.flagship.drink_ledger.web;

import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import com.flagship.drink_ledger.transaction.Money;
import com.flagship.drink_ledger.web.dto.AddPrepaidUserRequest;
import com.flagship.drink_ledger.web.dto.PrepaidUserResponse;
import com.flagship.drink_ledger.web.dto.UserMoneyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Prepaid users managed by members for their guests.
 */
@RestController
@RequiredArgsConstructor
public class PrepaidUserController {

    private final LedgerTransactionService ledgerService;

    @GetMapping("/prepaid_users")
    public ResponseEntity<List<PrepaidUserResponse>> listOwn(LedgerPrincipal principal) {
        return ResponseEntity.ok(ledgerService.listOwnPrepaidUsers(principal).stream()
            .map(PrepaidUserResponse::from)
            .toList());
    }

    @PostMapping("/add_prepaid_user")
    public ResponseEntity<PrepaidUserResponse> addPrepaidUser(LedgerPrincipal principal,
                                                              @Valid @RequestBody AddPrepaidUserRequest request) {
        PrepaidUser created = ledgerService.addPrepaidUser(
            principal, request.getUsername().trim(), Money.toCents(request.getStartMoney()));
        return ResponseEntity.status(HttpStatus.CREATED).body(PrepaidUserResponse.from(created));
    }

    @PostMapping("/add_money_prepaid_user")
    public ResponseEntity<PrepaidUserResponse> addMoney(LedgerPrincipal principal,
                                                        @Valid @RequestBody UserMoneyRequest request) {
        PrepaidUser updated = ledgerService.addMoneyPrepaid(
            principal, request.getUsername(), Money.toCents(request.getMoney()));
        return ResponseEntity.ok(PrepaidUserResponse.from(updated));
    }
}
