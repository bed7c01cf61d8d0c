package com.flagship.loan_ledger.ledger;

import com.flagship.loan_ledger.ledger.dto.AccountResponse;
import com.flagship.loan_ledger.ledger.dto.CreateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Cash accounts that loan disbursements and repayments move money through.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody CreateAccountRequest request) {
        UUID accountId = accountService.createAccount(tenantId, request.getName(), request.getAccountType(),
            request.getCreditLimit(), request.getOpeningBalance());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AccountResponse.from(accountService.getForTenant(tenantId, accountId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID accountId) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getForTenant(tenantId, accountId)));
    }
}
