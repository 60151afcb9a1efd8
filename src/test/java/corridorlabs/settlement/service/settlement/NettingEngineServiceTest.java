package corridorlabs.settlement.service.settlement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import corridorlabs.settlement.config.SettlementProperties;
import corridorlabs.settlement.dto.intent.IntentDirection;
import corridorlabs.settlement.dto.settlement.CowStats;
import corridorlabs.settlement.event.BatchSettledEvent;
import corridorlabs.settlement.event.IntentSettledEvent;
import corridorlabs.settlement.exception.CorridorConfigurationException;
import corridorlabs.settlement.exception.IntentStateException;
import corridorlabs.settlement.exception.SettlementErrorCode;
import corridorlabs.settlement.exception.SettlementValidationException;
import corridorlabs.settlement.service.auth.AdminAuthorizationService;
import corridorlabs.settlement.service.corridor.CorridorRegistryService;
import corridorlabs.settlement.service.intent.IntentLedgerService;
import corridorlabs.settlement.state.IntentRecord;
import corridorlabs.settlement.state.SettlementStateRepository;

@ExtendWith(MockitoExtension.class)
class NettingEngineServiceTest {

    private static final long NOW = 1_700_000_000L;
    private static final long DEADLINE = NOW + 3_600;
    private static final String ADMIN = "0x1111111111111111111111111111111111111111";
    private static final String ALICE = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String BOB = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";
    private static final String CORRIDOR = "usdc-eurc";
    private static final String OTHER_CORRIDOR = "usdc-gbpt";

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SettlementStateRepository state;
    private SettlementProperties properties;
    private CorridorRegistryService corridorRegistry;
    private IntentLedgerService ledger;
    private NettingEngineService engine;

    @BeforeEach
    void setUp() {
        state = new SettlementStateRepository();
        properties = new SettlementProperties();
        properties.getAdmin().setAddresses(List.of(ADMIN));
        corridorRegistry = new CorridorRegistryService(state, new AdminAuthorizationService(properties), eventPublisher);
        corridorRegistry.setNettable(ADMIN, CORRIDOR, true);
        ledger = ledgerAt(NOW);
        engine = engineWith(ledger);
        clearInvocations(eventPublisher);
    }

    @Nested
    @DisplayName("Single Settlement Tests")
    class SettleOneTests {

        @Test
        @DisplayName("Should settle a pending intent and publish settlement event")
        void shouldSettlePendingIntent() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);

            IntentRecord settled = engine.settleOne(id, BigInteger.valueOf(97));

            assertThat(settled.isSettled()).isTrue();
            assertThat(settled.getSettledOutput()).isEqualTo(BigInteger.valueOf(97));
            assertThat(settled.getSettledAt()).isEqualTo(NOW);

            ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
            verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
            IntentSettledEvent event = (IntentSettledEvent) captor.getAllValues().stream()
                .filter(IntentSettledEvent.class::isInstance)
                .findFirst()
                .orElseThrow();
            assertThat(event.getIntentId()).isEqualTo(id);
            assertThat(event.getOwner()).isEqualTo(ALICE);
            assertThat(event.getMagnitude()).isEqualTo(BigInteger.valueOf(100));
            assertThat(event.getProposedOutput()).isEqualTo(BigInteger.valueOf(97));
        }

        @Test
        @DisplayName("Should settle when proposed output equals minOut")
        void shouldSettleAtExactMinOut() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);

            assertThat(engine.settleOne(id, BigInteger.valueOf(95)).isSettled()).isTrue();
        }

        @Test
        @DisplayName("Should fail with NotFound for unknown id")
        void shouldFailForUnknownId() {
            assertThatThrownBy(() -> engine.settleOne(42L, BigInteger.TEN))
                .isInstanceOf(IntentStateException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.NOT_FOUND);
        }

        @Test
        @DisplayName("Should fail with NotFound for id zero")
        void shouldFailForIdZero() {
            assertThatThrownBy(() -> engine.settleOne(0L, BigInteger.TEN))
                .isInstanceOf(IntentStateException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.NOT_FOUND);
        }

        @Test
        @DisplayName("Should never settle the same intent twice")
        void shouldRejectSecondSettlement() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);
            engine.settleOne(id, BigInteger.valueOf(96));

            assertThatThrownBy(() -> engine.settleOne(id, BigInteger.valueOf(200)))
                .isInstanceOf(IntentStateException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.ALREADY_SETTLED);
            assertThat(ledger.getRequired(id).getSettledOutput()).isEqualTo(BigInteger.valueOf(96));
        }

        @Test
        @DisplayName("Should fail with Expired past the deadline and leave intent pending")
        void shouldFailAfterDeadline() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);
            NettingEngineService later = engineWith(ledgerAt(DEADLINE + 1));

            assertThatThrownBy(() -> later.settleOne(id, BigInteger.valueOf(100)))
                .isInstanceOf(IntentStateException.class)
                .satisfies(ex -> {
                    IntentStateException ise = (IntentStateException) ex;
                    assertThat(ise.getCode()).isEqualTo(SettlementErrorCode.EXPIRED);
                    assertThat(ise.getDetails()).containsEntry("deadline", DEADLINE);
                });
            assertThat(ledger.getRequired(id).isSettled()).isFalse();
        }

        @Test
        @DisplayName("Should still settle exactly at the deadline")
        void shouldSettleAtDeadline() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);

            assertThat(engineWith(ledgerAt(DEADLINE)).settleOne(id, BigInteger.valueOf(95)).isSettled()).isTrue();
        }

        @Test
        @DisplayName("Should fail with MinOutputNotMet below minOut")
        void shouldFailBelowMinOut() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);

            assertThatThrownBy(() -> engine.settleOne(id, BigInteger.valueOf(94)))
                .isInstanceOf(IntentStateException.class)
                .satisfies(ex -> {
                    IntentStateException ise = (IntentStateException) ex;
                    assertThat(ise.getCode()).isEqualTo(SettlementErrorCode.MIN_OUTPUT_NOT_MET);
                    assertThat(ise.getDetails())
                        .containsEntry("minOut", BigInteger.valueOf(95))
                        .containsEntry("proposedOutput", BigInteger.valueOf(94));
                });
            verify(eventPublisher, never()).publishEvent(any(IntentSettledEvent.class));
        }

        @Test
        @DisplayName("Should settle intents on unregistered corridors individually")
        void shouldSettleOneOnUnregisteredCorridor() {
            long id = create(ALICE, OTHER_CORRIDOR, IntentDirection.ONE_FOR_ZERO, 10, 9);

            assertThat(engine.settleOne(id, BigInteger.valueOf(9)).isSettled()).isTrue();
        }

        @Test
        @DisplayName("Should report MinOutputNotMet for a negative proposed output")
        void shouldTreatNegativeOutputAsBelowMinOut() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);

            assertThatThrownBy(() -> engine.settleOne(id, BigInteger.valueOf(-1)))
                .isInstanceOf(IntentStateException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.MIN_OUTPUT_NOT_MET);
            assertThat(ledger.getRequired(id).isSettled()).isFalse();
        }

        @Test
        @DisplayName("Should report NotFound before looking at the proposed output")
        void shouldReportNotFoundFirst() {
            assertThatThrownBy(() -> engine.settleOne(42L, BigInteger.valueOf(-1)))
                .isInstanceOf(IntentStateException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.NOT_FOUND);
            assertThatThrownBy(() -> engine.settleOne(0L, null))
                .isInstanceOf(IntentStateException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.NOT_FOUND);
        }

        @Test
        @DisplayName("Should report MinOutputNotMet for a missing proposed output")
        void shouldTreatMissingOutputAsBelowMinOut() {
            long id = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 95);

            assertThatThrownBy(() -> engine.settleOne(id, null))
                .isInstanceOf(IntentStateException.class)
                .satisfies(ex -> assertThat(((IntentStateException) ex).getDetails())
                    .containsEntry("minOut", BigInteger.valueOf(95))
                    .containsKey("proposedOutput"))
                .extracting("code")
                .isEqualTo(SettlementErrorCode.MIN_OUTPUT_NOT_MET);
        }
    }

    @Nested
    @DisplayName("Batch Netting Tests")
    class SettleBatchTests {

        @Test
        @DisplayName("Should net opposing intents and route the residual in the dominant direction")
        void shouldNetOpposingIntents() {
            long a = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 90);
            long b = create(BOB, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 80, 70);

            CowStats stats = engine.settleBatch(List.of(a, b), outputs(95, 75));

            assertThat(stats.corridorId()).isEqualTo(CORRIDOR);
            assertThat(stats.validCount()).isEqualTo(2);
            assertThat(stats.totalLeg0()).isEqualTo(BigInteger.valueOf(100));
            assertThat(stats.totalLeg1()).isEqualTo(BigInteger.valueOf(80));
            assertThat(stats.matchedAmount()).isEqualTo(BigInteger.valueOf(80));
            assertThat(stats.residualToVenue()).isEqualTo(BigInteger.valueOf(20));
            assertThat(stats.residualDirection()).isEqualTo(IntentDirection.ZERO_FOR_ONE);
            assertThat(stats.costSavedEstimate()).isEqualTo(100_000L);
            assertThat(stats.settledIds()).containsExactly(a, b);
            assertThat(ledger.getRequired(a).isSettled()).isTrue();
            assertThat(ledger.getRequired(b).isSettled()).isTrue();

            verify(eventPublisher, times(2)).publishEvent(any(IntentSettledEvent.class));
            verify(eventPublisher).publishEvent(any(BatchSettledEvent.class));
        }

        @Test
        @DisplayName("Should match nothing when all intents point the same way")
        void shouldMatchNothingForSameDirection() {
            long a = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 50, 40);
            long b = create(BOB, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 50, 40);

            CowStats stats = engine.settleBatch(List.of(a, b), outputs(45, 45));

            assertThat(stats.matchedAmount()).isZero();
            assertThat(stats.residualToVenue()).isEqualTo(BigInteger.valueOf(100));
            assertThat(stats.residualDirection()).isEqualTo(IntentDirection.ZERO_FOR_ONE);
            verify(eventPublisher, never()).publishEvent(any(BatchSettledEvent.class));
        }

        @Test
        @DisplayName("Should resolve a perfect match to the leg0 direction")
        void shouldResolveTieToLeg0() {
            long a = create(ALICE, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 60, 50);
            long b = create(BOB, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 60, 50);

            CowStats stats = engine.settleBatch(List.of(a, b), outputs(55, 55));

            assertThat(stats.matchedAmount()).isEqualTo(BigInteger.valueOf(60));
            assertThat(stats.residualToVenue()).isZero();
            assertThat(stats.residualDirection()).isEqualTo(IntentDirection.ZERO_FOR_ONE);
        }

        @Test
        @DisplayName("Should skip an already settled entry without failing")
        void shouldSkipAlreadySettledEntry() {
            long first = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 90);
            long second = create(BOB, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 40, 30);
            long third = create(BOB, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 30, 20);
            engine.settleOne(second, BigInteger.valueOf(35));

            CowStats stats = engine.settleBatch(List.of(first, second, third), outputs(95, 999, 25));

            assertThat(stats.validCount()).isEqualTo(2);
            assertThat(stats.settledIds()).containsExactly(first, third);
            assertThat(stats.totalLeg0()).isEqualTo(BigInteger.valueOf(100));
            assertThat(stats.totalLeg1()).isEqualTo(BigInteger.valueOf(30));
            assertThat(ledger.getRequired(second).getSettledOutput()).isEqualTo(BigInteger.valueOf(35));
        }

        @Test
        @DisplayName("Should skip missing, expired and below-minOut entries")
        void shouldSkipInvalidEntries() {
            long shortLived = ledger.create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE,
                BigInteger.valueOf(10), null, BigInteger.ONE, NOW + 10);
            long lowBid = create(BOB, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 70, 60);
            long good = create(BOB, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 50, 40);
            NettingEngineService later = engineWith(ledgerAt(NOW + 60));

            CowStats stats = later.settleBatch(List.of(shortLived, lowBid, 999L, good), outputs(10, 59, 1, 45));

            assertThat(stats.validCount()).isEqualTo(1);
            assertThat(stats.settledIds()).containsExactly(good);
            assertThat(ledger.getRequired(shortLived).isSettled()).isFalse();
            assertThat(ledger.getRequired(lowBid).isSettled()).isFalse();
        }

        @Test
        @DisplayName("Should count a repeated id once")
        void shouldCountRepeatedIdOnce() {
            long a = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 90);
            long b = create(BOB, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 80, 70);

            CowStats stats = engine.settleBatch(List.of(a, a, b), outputs(95, 96, 75));

            assertThat(stats.validCount()).isEqualTo(2);
            assertThat(stats.totalLeg0()).isEqualTo(BigInteger.valueOf(100));
            assertThat(ledger.getRequired(a).getSettledOutput()).isEqualTo(BigInteger.valueOf(95));
            verify(eventPublisher, times(2)).publishEvent(any(IntentSettledEvent.class));
        }

        @Test
        @DisplayName("Should fail with MixedCorridors and settle nothing")
        void shouldFailOnMixedCorridors() {
            corridorRegistry.setNettable(ADMIN, OTHER_CORRIDOR, true);
            long a = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 90);
            long b = create(BOB, OTHER_CORRIDOR, IntentDirection.ONE_FOR_ZERO, 80, 70);
            clearInvocations(eventPublisher);

            assertThatThrownBy(() -> engine.settleBatch(List.of(a, b), outputs(95, 75)))
                .isInstanceOf(CorridorConfigurationException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.MIXED_CORRIDORS);

            assertThat(ledger.getRequired(a).isSettled()).isFalse();
            assertThat(ledger.getRequired(b).isSettled()).isFalse();
            verify(eventPublisher, never()).publishEvent(any(ApplicationEvent.class));
        }

        @Test
        @DisplayName("Should ignore a foreign corridor entry that is excluded anyway")
        void shouldIgnoreExcludedForeignEntry() {
            long a = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 90);
            long foreign = create(BOB, OTHER_CORRIDOR, IntentDirection.ONE_FOR_ZERO, 80, 70);

            CowStats stats = engine.settleBatch(List.of(a, foreign), outputs(95, 1));

            assertThat(stats.settledIds()).containsExactly(a);
        }

        @Test
        @DisplayName("Should fail with NotNettable for unregistered corridor")
        void shouldFailForUnregisteredCorridor() {
            long a = create(ALICE, OTHER_CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 90);

            assertThatThrownBy(() -> engine.settleBatch(List.of(a), outputs(95)))
                .isInstanceOf(CorridorConfigurationException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.NOT_NETTABLE);
            assertThat(ledger.getRequired(a).isSettled()).isFalse();
        }

        @Test
        @DisplayName("Should fail with NoValidIntents when every entry is excluded")
        void shouldFailWhenNothingIncluded() {
            long a = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 100, 90);

            assertThatThrownBy(() -> engine.settleBatch(List.of(a, 77L), outputs(1, 1)))
                .isInstanceOf(IntentStateException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.NO_VALID_INTENTS);
        }

        @Test
        @DisplayName("Should fail with LengthMismatch before touching state")
        void shouldFailOnLengthMismatch() {
            assertThatThrownBy(() -> engine.settleBatch(List.of(1L, 2L), outputs(1)))
                .isInstanceOf(SettlementValidationException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.LENGTH_MISMATCH);
        }

        @Test
        @DisplayName("Should fail with EmptyBatch for empty input")
        void shouldFailOnEmptyBatch() {
            assertThatThrownBy(() -> engine.settleBatch(List.of(), List.of()))
                .isInstanceOf(SettlementValidationException.class)
                .extracting("code")
                .isEqualTo(SettlementErrorCode.EMPTY_BATCH);
        }

        @Test
        @DisplayName("Should keep leg totals equal to twice the matched amount plus residual")
        void shouldConserveVolume() {
            int[][] batches = {
                {100, -80},
                {5, 5, 5, -20},
                {-1, -1, -1},
                {1_000_000, -999_999, 3},
                {7, -7}
            };
            for (int[] batch : batches) {
                List<Long> ids = Arrays.stream(batch)
                    .mapToObj(m -> create(ALICE, CORRIDOR, IntentDirection.of(m > 0), Math.abs(m), 1))
                    .toList();
                List<BigInteger> proposed = ids.stream().map(id -> BigInteger.ONE).toList();

                CowStats stats = engine.settleBatch(ids, proposed);

                assertThat(stats.totalLeg0().add(stats.totalLeg1()))
                    .isEqualTo(stats.matchedAmount().shiftLeft(1).add(stats.residualToVenue()));
                assertThat(stats.matchedAmount()).isEqualTo(stats.totalLeg0().min(stats.totalLeg1()));
            }
        }

        @Test
        @DisplayName("Should use the configured per-intent cost")
        void shouldUseConfiguredPerIntentCost() {
            properties.getNetting().setPerIntentCost(1_000L);
            NettingEngineService custom = engineWith(ledger);
            long a = create(ALICE, CORRIDOR, IntentDirection.ZERO_FOR_ONE, 10, 1);
            long b = create(BOB, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 10, 1);
            long c = create(BOB, CORRIDOR, IntentDirection.ONE_FOR_ZERO, 10, 1);

            assertThat(custom.settleBatch(List.of(a, b, c), outputs(1, 1, 1)).costSavedEstimate()).isEqualTo(3_000L);
        }
    }

    private long create(String owner, String corridor, IntentDirection direction, long magnitude, long minOut) {
        return ledger.create(owner, corridor, direction, BigInteger.valueOf(magnitude), null,
            BigInteger.valueOf(minOut), DEADLINE);
    }

    private static List<BigInteger> outputs(long... values) {
        return Arrays.stream(values).mapToObj(BigInteger::valueOf).toList();
    }

    private IntentLedgerService ledgerAt(long epochSeconds) {
        return new IntentLedgerService(state, eventPublisher, Clock.fixed(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC));
    }

    private NettingEngineService engineWith(IntentLedgerService ledgerService) {
        return new NettingEngineService(ledgerService, corridorRegistry, state, eventPublisher, properties);
    }
}
