package com.flagship.finance_automation.pot;

import com.flagship.finance_automation.balance.BalanceSnapshot;
import com.flagship.finance_automation.balance.BalanceSnapshotStore;
import com.flagship.finance_automation.bank.AccountSource;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.GroupRef;
import com.flagship.finance_automation.transfer.TransferApi;
import com.flagship.finance_automation.transfer.TransferReceipt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface for on-demand pot reconciliation, including confirmation of
 * top-ups above the automatic limit.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PotControllerTest {

    private static final GroupRef POT_GROUP = GroupRef.of(BankRef.MONZO, "credit-cards");
    private static final GroupRef TARGET_GROUP = GroupRef.of(BankRef.AMEX, "no-ref");
    private static final GroupRef FUNDING_GROUP = GroupRef.of(BankRef.MONZO, "current-account");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private BalanceSnapshotStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private TransferApi transferApi;

    @MockBean
    private AccountSource accountSource;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM transfer_records");
        jdbcTemplate.update("DELETE FROM balance_snapshots");
        when(transferApi.transfer(any())).thenReturn(new TransferReceipt("ext-pot", null));
    }

    private void balances(long pot, long target, long funding) {
        Instant observed = Instant.now().minus(1, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.MICROS);
        store.save(BalanceSnapshot.fresh(POT_GROUP, pot, "GBP", observed));
        store.save(BalanceSnapshot.fresh(TARGET_GROUP, target, "GBP", observed));
        store.save(BalanceSnapshot.fresh(FUNDING_GROUP, funding, "GBP", observed));
    }

    @Test
    @DisplayName("Should execute a top-up within the automatic limit")
    void shouldExecuteTopUp() throws Exception {
        balances(10_000, 12_345, 100_000);

        mockMvc.perform(post("/api/pots/credit-cards/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pot").value("credit-cards"))
                .andExpect(jsonPath("$.outcome").value("EXECUTED"))
                .andExpect(jsonPath("$.amount_minor_units").value(2_345))
                .andExpect(jsonPath("$.transfer.status").value("COMMITTED"));
    }

    @Test
    @DisplayName("Should hold a large top-up until confirmed, then execute it")
    void shouldRequireConfirmationAboveLimit() throws Exception {
        balances(1_000, 30_000, 100_000);

        mockMvc.perform(post("/api/pots/credit-cards/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("AWAITING_CONFIRMATION"))
                .andExpect(jsonPath("$.amount_minor_units").value(29_000))
                .andExpect(jsonPath("$.transfer").doesNotExist());
        verify(transferApi, never()).transfer(any());

        mockMvc.perform(post("/api/pots/credit-cards/reconcile").param("confirmed", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("EXECUTED"))
                .andExpect(jsonPath("$.amount_minor_units").value(29_000))
                .andExpect(jsonPath("$.transfer.status").value("COMMITTED"))
                .andExpect(jsonPath("$.transfer.destination").value("pot:pot_credit_cards"));
        verify(transferApi, times(1)).transfer(any());
    }

    @Test
    @DisplayName("Should report no change when the pot already matches")
    void shouldReportNoChange() throws Exception {
        balances(12_345, 12_345, 100_000);

        mockMvc.perform(post("/api/pots/credit-cards/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("NO_CHANGE"));
        verify(transferApi, never()).transfer(any());
    }

    @Test
    @DisplayName("Should skip a pot whose balances were never polled")
    void shouldSkipWithoutBalances() throws Exception {
        mockMvc.perform(post("/api/pots/credit-cards/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SKIPPED"));
    }

    @Test
    @DisplayName("Should answer 404 for an unknown pot")
    void shouldRejectUnknownPot() throws Exception {
        mockMvc.perform(post("/api/pots/holiday/reconcile"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }
}
