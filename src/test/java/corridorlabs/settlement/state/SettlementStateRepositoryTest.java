package corridorlabs.settlement.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import corridorlabs.settlement.dto.intent.IntentDirection;

@DisplayName("SettlementStateRepository Tests")
class SettlementStateRepositoryTest {

    private static final String OWNER = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private SettlementStateRepository state;

    @BeforeEach
    void setUp() {
        state = new SettlementStateRepository();
    }

    private IntentRecord insert(String corridor) {
        long id = state.nextIntentId();
        IntentRecord record = new IntentRecord(id, OWNER, corridor, IntentDirection.ZERO_FOR_ONE,
            BigInteger.TEN, null, BigInteger.ONE, 2_000L, 1_000L);
        state.insertIntent(record);
        return record;
    }

    @Nested
    @DisplayName("Mutation Tests")
    class MutationTests {

        @Test
        @DisplayName("Should bump version on every mutation")
        void shouldBumpVersion() {
            long initial = state.version();

            IntentRecord record = insert("c1");
            state.markSettled(record, BigInteger.ONE, 1_500L);
            state.putFlow("c1", BigInteger.TEN);
            state.putFeeParams("c1", new FeeParams(1, 1, BigInteger.ONE));
            state.setNettable("c1", true);

            assertThat(state.version()).isEqualTo(initial + 5);
        }

        @Test
        @DisplayName("Should not bump version when nettable flag is unchanged")
        void shouldIgnoreNoopNettableChange() {
            assertThat(state.setNettable("c1", false)).isFalse();
            assertThat(state.version()).isZero();
        }

        @Test
        @DisplayName("Should refuse settling a record twice")
        void shouldRefuseDoubleSettle() {
            IntentRecord record = insert("c1");
            state.markSettled(record, BigInteger.ONE, 1_500L);

            assertThatThrownBy(() -> state.markSettled(record, BigInteger.TWO, 1_600L))
                .isInstanceOf(IllegalStateException.class);
            assertThat(record.getSettledOutput()).isEqualTo(BigInteger.ONE);
        }

        @Test
        @DisplayName("Should refuse reusing an intent id")
        void shouldRefuseDuplicateId() {
            IntentRecord record = insert("c1");

            assertThatThrownBy(() -> state.insertIntent(record)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Snapshot Tests")
    class SnapshotTests {

        @Test
        @DisplayName("Should restore every table from a snapshot")
        void shouldRestoreFromSnapshot() {
            IntentRecord first = insert("c1");
            insert("c2");
            state.markSettled(first, BigInteger.valueOf(9), 1_200L);
            state.putFeeParams("c1", new FeeParams(500, 2_000, BigInteger.valueOf(10_000)));
            state.putFlow("c1", BigInteger.valueOf(-42));
            state.setNettable("c1", true);

            StateSnapshot snapshot = state.snapshot();
            SettlementStateRepository restored = new SettlementStateRepository();
            restored.restore(snapshot);

            assertThat(restored.findIntent(2L)).isPresent();
            IntentRecord settled = restored.findIntent(first.getId()).orElseThrow();
            assertThat(settled.isSettled()).isTrue();
            assertThat(settled.getSettledOutput()).isEqualTo(BigInteger.valueOf(9));
            assertThat(restored.intentIdsOf(OWNER, 10)).containsExactly(1L, 2L);
            assertThat(restored.findFeeParams("c1")).contains(new FeeParams(500, 2_000, BigInteger.valueOf(10_000)));
            assertThat(restored.flowOf("c1")).isEqualTo(BigInteger.valueOf(-42));
            assertThat(restored.nettableCorridors()).containsExactly("c1");
            assertThat(restored.nextIntentId()).isEqualTo(3L);
        }

        @Test
        @DisplayName("Should never reissue an id present in a snapshot with a stale counter")
        void shouldGuardAgainstStaleCounter() {
            IntentRecord.Snapshot stored = new IntentRecord.Snapshot(7L, OWNER, "c1", IntentDirection.ONE_FOR_ZERO,
                BigInteger.TEN, null, BigInteger.ONE, 2_000L, 1_000L, false, null, null);
            StateSnapshot snapshot = new StateSnapshot(3L, List.of(stored), null, Map.of(), Map.of(), Set.of());

            state.restore(snapshot);

            assertThat(state.nextIntentId()).isEqualTo(8L);
            assertThat(state.intentIdsOf(OWNER, 10)).containsExactly(7L);
        }
    }
}
