package com.sparagne.budget_ledger.api;

import com.sparagne.budget_ledger.api.dto.MemberRequest;
import com.sparagne.budget_ledger.api.dto.MembershipResponse;
import com.sparagne.budget_ledger.vault.Membership;
import com.sparagne.budget_ledger.vault.MembershipRole;
import com.sparagne.budget_ledger.vault.MembershipService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.sparagne.budget_ledger.api.RequestHeaders.USER_HEADER;

/**
 * Vault-wide and cash-flow-scoped memberships. PUT grants or changes a role.
 */
@RestController
@RequestMapping("/api/vaults/{vaultId}")
@RequiredArgsConstructor
public class MembershipController {

    private final MembershipService membershipService;

    @GetMapping("/members")
    public ResponseEntity<List<MembershipResponse>> listVaultMembers(@PathVariable("vaultId") UUID vaultId,
                                                                     @RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(toResponses(membershipService.listVaultMembers(vaultId, caller)));
    }

    @PutMapping("/members/{username}")
    public ResponseEntity<MembershipResponse> putVaultMember(@PathVariable("vaultId") UUID vaultId,
                                                             @PathVariable("username") String username,
                                                             @Valid @RequestBody MemberRequest request,
                                                             @RequestHeader(USER_HEADER) String caller) {
        Membership membership = membershipService.addVaultMember(vaultId, caller, username,
            MembershipRole.parse(request.getRole()));
        return ResponseEntity.ok(MembershipResponse.from(membership));
    }

    @DeleteMapping("/members/{username}")
    public ResponseEntity<Void> removeVaultMember(@PathVariable("vaultId") UUID vaultId,
                                                  @PathVariable("username") String username,
                                                  @RequestHeader(USER_HEADER) String caller) {
        membershipService.removeVaultMember(vaultId, caller, username);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cash-flows/{cashFlowId}/members")
    public ResponseEntity<List<MembershipResponse>> listFlowMembers(@PathVariable("vaultId") UUID vaultId,
                                                                    @PathVariable("cashFlowId") UUID cashFlowId,
                                                                    @RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(toResponses(membershipService.listFlowMembers(vaultId, cashFlowId, caller)));
    }

    @PutMapping("/cash-flows/{cashFlowId}/members/{username}")
    public ResponseEntity<MembershipResponse> putFlowMember(@PathVariable("vaultId") UUID vaultId,
                                                            @PathVariable("cashFlowId") UUID cashFlowId,
                                                            @PathVariable("username") String username,
                                                            @Valid @RequestBody MemberRequest request,
                                                            @RequestHeader(USER_HEADER) String caller) {
        Membership membership = membershipService.addFlowMember(vaultId, cashFlowId, caller, username,
            MembershipRole.parse(request.getRole()));
        return ResponseEntity.ok(MembershipResponse.from(membership));
    }

    @DeleteMapping("/cash-flows/{cashFlowId}/members/{username}")
    public ResponseEntity<Void> removeFlowMember(@PathVariable("vaultId") UUID vaultId,
                                                 @PathVariable("cashFlowId") UUID cashFlowId,
                                                 @PathVariable("username") String username,
                                                 @RequestHeader(USER_HEADER) String caller) {
        membershipService.removeFlowMember(vaultId, cashFlowId, caller, username);
        return ResponseEntity.noContent().build();
    }

    private static List<MembershipResponse> toResponses(List<Membership> memberships) {
        return memberships.stream().map(MembershipResponse::from).toList();
    }
}
