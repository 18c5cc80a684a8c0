package com.flagship.wallet_ledger.account;

import com.flagship.wallet_ledger.support.AbstractIntegrationTest;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccountServiceTest extends AbstractIntegrationTest {

    @Autowired
    private WalletStore walletStore;

    @Autowired
    private AccountVerificationLookup verificationLookup;

    @Test
    @DisplayName("Provisioning creates a PENDING account with an empty wallet")
    void testProvision() {
        Account account = accountService.provision("erin-" + UUID.randomUUID() + "@example.com", "Erin");

        assertEquals(VerificationStatus.PENDING, account.getVerificationStatus());
        assertTrue(account.isActive());
        assertFalse(account.isVerified());
        Wallet wallet = walletStore.findByAccount(account.getId()).orElseThrow();
        assertEquals(0, wallet.getBalance().signum());
        assertEquals(0L, wallet.getVersion());
    }

    @Test
    @DisplayName("Emails are unique")
    void testProvision_DuplicateEmail() {
        String email = "frank-" + UUID.randomUUID() + "@example.com";
        accountService.provision(email, "Frank");

        assertThrows(DuplicateKeyException.class, () -> accountService.provision(email, "Frank again"));
    }

    @Test
    @DisplayName("Recipients resolve by id or by email, and junk resolves to nothing")
    void testResolveRecipient() {
        Account account = accountService.provision("Grace-" + UUID.randomUUID() + "@Example.com", "Grace");

        assertEquals(account.getId(), accountService.resolveRecipient(account.getId().toString()).orElseThrow().getId());
        assertEquals(account.getId(),
            accountService.resolveRecipient("  " + account.getEmail().toLowerCase() + " ").orElseThrow().getId());
        assertTrue(accountService.resolveRecipient("not-an-id").isEmpty());
        assertTrue(accountService.resolveRecipient(null).isEmpty());
    }

    @Test
    @DisplayName("The verification lookup hides deactivated accounts")
    void testVerificationLookup() {
        UUID id = verifiedAccount("heidi");

        assertEquals(VerificationStatus.VERIFIED, verificationLookup.statusOf(id).orElseThrow());
        accountService.deactivate(id);
        assertTrue(verificationLookup.statusOf(id).isEmpty());
        assertTrue(verificationLookup.statusOf(UUID.randomUUID()).isEmpty());
    }
}
