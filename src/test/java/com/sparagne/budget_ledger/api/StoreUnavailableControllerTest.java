package com.sparagne.budget_ledger.api;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.store.LedgerStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class StoreUnavailableControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LedgerStore store;

    @Test
    @DisplayName("Store outages answer 503 without leaking the cause")
    void testStoreFailureMapsTo503() throws Exception {
        when(store.inVaultTransaction(any(), any())).thenThrow(LedgerException.storeFailure("vault unit of work",
            new DataAccessResourceFailureException("jdbc:postgresql://db.internal:5432 refused")));

        mockMvc.perform(post("/api/vaults/{vaultId}/transactions/income", UUID.randomUUID())
                .header(RequestHeaders.USER_HEADER, "mona")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"wallet_id\":\"" + UUID.randomUUID() + "\",\"amount_minor\":100}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.kind").value("STORE_FAILURE"))
            .andExpect(jsonPath("$.message").value("The ledger store is unavailable"));
    }
}
