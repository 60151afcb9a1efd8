package corridorlabs.settlement.controller.settlement;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import corridorlabs.settlement.dto.intent.IntentDirection;
import corridorlabs.settlement.dto.settlement.CowStats;
import corridorlabs.settlement.exception.CorridorConfigurationException;
import corridorlabs.settlement.exception.GlobalExceptionHandler;
import corridorlabs.settlement.exception.IntentStateException;
import corridorlabs.settlement.exception.SettlementErrorCode;
import corridorlabs.settlement.exception.SettlementValidationException;
import corridorlabs.settlement.service.intent.IntentLedgerService;
import corridorlabs.settlement.service.settlement.NettingEngineService;
import corridorlabs.settlement.state.IntentRecord;

@ExtendWith(MockitoExtension.class)
class SettlementControllerTest {

    private static final long NOW = 1_700_000_000L;

    @Mock
    private NettingEngineService nettingEngine;

    @Mock
    private IntentLedgerService ledger;

    @InjectMocks
    private SettlementController settlementController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(settlementController)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Nested
    @DisplayName("Settle One Endpoint Tests")
    class SettleOneTests {

        @Test
        @DisplayName("Should return the settled intent view")
        void shouldReturnSettledIntent() throws Exception {
            IntentRecord record = new IntentRecord(4L, "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa", "usdc-eurc",
                IntentDirection.ZERO_FOR_ONE, BigInteger.valueOf(100), null, BigInteger.valueOf(95), NOW + 60, NOW);
            when(nettingEngine.settleOne(4L, BigInteger.valueOf(97))).thenReturn(record);
            when(ledger.currentTime()).thenReturn(NOW);

            mockMvc.perform(post("/settlement/one")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentId\":4,\"proposedOutput\":97}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(4))
                .andExpect(jsonPath("$.direction").value("leg0_to_leg1"))
                .andExpect(jsonPath("$.status").value("pending"));
        }

        @Test
        @DisplayName("Should map MinOutputNotMet to 409")
        void shouldMapMinOutputNotMet() throws Exception {
            when(nettingEngine.settleOne(eq(4L), any()))
                .thenThrow(IntentStateException.minOutputNotMet(BigInteger.valueOf(95), BigInteger.valueOf(90)));

            mockMvc.perform(post("/settlement/one")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentId\":4,\"proposedOutput\":90}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("MinOutputNotMet"))
                .andExpect(jsonPath("$.details.minOut").value(95));
        }

        @Test
        @DisplayName("Should map NotFound to 404")
        void shouldMapNotFound() throws Exception {
            when(nettingEngine.settleOne(eq(9L), any())).thenThrow(IntentStateException.notFound(9L));

            mockMvc.perform(post("/settlement/one")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentId\":9,\"proposedOutput\":1}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NotFound"));
        }

        @Test
        @DisplayName("Should pass intent id 0 through to the engine and map NotFound to 404")
        void shouldMapZeroIdToNotFound() throws Exception {
            when(nettingEngine.settleOne(eq(0L), any())).thenThrow(IntentStateException.notFound(0L));

            mockMvc.perform(post("/settlement/one")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentId\":0,\"proposedOutput\":-5}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NotFound"));
        }

        @Test
        @DisplayName("Should reject missing fields with 400")
        void shouldRejectMissingFields() throws Exception {
            mockMvc.perform(post("/settlement/one")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentId\":4}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.proposedOutput").exists());
        }
    }

    @Nested
    @DisplayName("Settle Batch Endpoint Tests")
    class SettleBatchTests {

        @Test
        @DisplayName("Should return netting statistics")
        void shouldReturnStats() throws Exception {
            CowStats stats = new CowStats("usdc-eurc", 2, BigInteger.valueOf(100), BigInteger.valueOf(80),
                BigInteger.valueOf(80), BigInteger.valueOf(20), IntentDirection.ZERO_FOR_ONE, 100_000L, List.of(1L, 2L));
            when(nettingEngine.settleBatch(List.of(1L, 2L), List.of(BigInteger.valueOf(95), BigInteger.valueOf(75))))
                .thenReturn(stats);

            mockMvc.perform(post("/settlement/batch")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentIds\":[1,2],\"proposedOutputs\":[95,75]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validCount").value(2))
                .andExpect(jsonPath("$.matchedAmount").value(80))
                .andExpect(jsonPath("$.residualToVenue").value(20))
                .andExpect(jsonPath("$.residualDirection").value("leg0_to_leg1"))
                .andExpect(jsonPath("$.settledIds[1]").value(2));
        }

        @Test
        @DisplayName("Should map LengthMismatch to 400")
        void shouldMapLengthMismatch() throws Exception {
            when(nettingEngine.settleBatch(anyList(), anyList()))
                .thenThrow(new SettlementValidationException(SettlementErrorCode.LENGTH_MISMATCH, "ids and proposedOutputs differ in length"));

            mockMvc.perform(post("/settlement/batch")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentIds\":[1,2],\"proposedOutputs\":[95]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("LengthMismatch"));
        }

        @Test
        @DisplayName("Should map MixedCorridors to 422")
        void shouldMapMixedCorridors() throws Exception {
            when(nettingEngine.settleBatch(anyList(), anyList()))
                .thenThrow(CorridorConfigurationException.mixedCorridors("usdc-eurc", "usdc-gbpt"));

            mockMvc.perform(post("/settlement/batch")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentIds\":[1,2],\"proposedOutputs\":[95,75]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("MixedCorridors"))
                .andExpect(jsonPath("$.details.found").value("usdc-gbpt"));
        }
    }
}
