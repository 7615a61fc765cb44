package com.flagship.drink_ledger.web;

import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.ledger.DrinkType;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import com.flagship.drink_ledger.web.dto.DrinkTypeRequest;
import com.flagship.drink_ledger.web.dto.DrinkTypeResponse;
import com.flagship.drink_ledger.web.dto.QuantityRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/drink_types")
@RequiredArgsConstructor
public class DrinkTypeController {

    private final LedgerTransactionService ledgerService;

    @GetMapping
    public ResponseEntity<List<DrinkTypeResponse>> list(LedgerPrincipal principal) {
        return ResponseEntity.ok(ledgerService.listDrinkTypes(principal).stream()
            .map(DrinkTypeResponse::from)
            .toList());
    }

    @PostMapping
    public ResponseEntity<DrinkTypeResponse> add(LedgerPrincipal principal,
                                                 @Valid @RequestBody DrinkTypeRequest request) {
        DrinkType created = ledgerService.addDrinkType(
            principal, request.getName().trim(), request.getIcon(), request.getQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(DrinkTypeResponse.from(created));
    }

    @PostMapping("/{id}/quantity")
    public ResponseEntity<DrinkTypeResponse> setQuantity(LedgerPrincipal principal,
                                                         @PathVariable("id") int id,
                                                         @Valid @RequestBody QuantityRequest request) {
        return ResponseEntity.ok(DrinkTypeResponse.from(
            ledgerService.setDrinkTypeQuantity(principal, id, request.getQuantity())));
    }
}
