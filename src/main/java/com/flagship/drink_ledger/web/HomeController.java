package com.flagship.drink_ledger.web;

import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.config.LedgerProperties;
import com.flagship.drink_ledger.transaction.AccountOverview;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import com.flagship.drink_ledger.web.dto.DrinkTypeResponse;
import com.flagship.drink_ledger.web.dto.HomeResponse;
import com.flagship.drink_ledger.web.dto.PostpaidUserResponse;
import com.flagship.drink_ledger.web.dto.PrepaidUserResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Landing page. The first visit of a logged in user creates their postpaid
 * account.
 */
@RestController
@RequiredArgsConstructor
public class HomeController {

    private final LedgerTransactionService ledgerService;
    private final LedgerProperties properties;

    @GetMapping("/")
    public ResponseEntity<HomeResponse> home(LedgerPrincipal principal) {
        if (principal == null) {
            return ResponseEntity.ok(HomeResponse.builder()
                .authenticated(false)
                .loginUrl(properties.getIdentity().getLoginUrl())
                .build());
        }

        AccountOverview overview = ledgerService.accountOverview(principal);
        return ResponseEntity.ok(HomeResponse.builder()
            .authenticated(true)
            .account(PostpaidUserResponse.from(overview.getAccount()))
            .prepaidUsers(overview.getPrepaidUsers().stream().map(PrepaidUserResponse::from).toList())
            .drinkTypes(ledgerService.listDrinkTypes(principal).stream().map(DrinkTypeResponse::from).toList())
            .build());
    }
}
