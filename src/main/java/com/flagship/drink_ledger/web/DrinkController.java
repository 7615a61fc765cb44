package com.flagship.drink_ledger.web;

import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.config.LedgerProperties;
import com.flagship.drink_ledger.transaction.DrinkReceipt;
import com.flagship.drink_ledger.transaction.DrinkTarget;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import com.flagship.drink_ledger.web.dto.DrinkRequest;
import com.flagship.drink_ledger.web.dto.DrinkResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Drink purchases, either by the logged in user or at the point of sale with
 * a prepaid user key.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class DrinkController {

    private final LedgerTransactionService ledgerService;
    private final LedgerProperties properties;

    @PostMapping("/drink")
    public ResponseEntity<DrinkResponse> drink(LedgerPrincipal principal,
                                               @RequestBody(required = false) DrinkRequest request) {
        DrinkRequest body = request != null ? request : new DrinkRequest();
        DrinkTarget target = selectTarget(body);

        log.debug("Drink request: target={}, drinkTypeId={}", target.getKind(), body.getDrinkTypeId());

        DrinkReceipt receipt = ledgerService.recordDrink(
            principal, target, properties.getDrinkPriceCents(), body.getDrinkTypeId());
        return ResponseEntity.ok(DrinkResponse.from(receipt));
    }

    private DrinkTarget selectTarget(DrinkRequest request) {
        if (request.getUserKey() != null && !request.getUserKey().isBlank()) {
            return DrinkTarget.byKey(request.getUserKey().trim());
        }
        return request.isPrepaid() ? DrinkTarget.selfPrepaid() : DrinkTarget.selfPostpaid();
    }
}
