package com.fhestream.ingestion.normalizer;

import com.fhestream.domain.BinaryOpRequested;
import com.fhestream.domain.BinaryOperator;
import com.fhestream.domain.EventKind;
import com.fhestream.domain.Handle;
import com.fhestream.domain.IndexedEvent;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.domain.TernaryOpRequested;
import com.fhestream.domain.TernaryOperator;
import com.fhestream.domain.UnaryOpRequested;
import com.fhestream.domain.UnaryOperator;
import com.fhestream.ingestion.logs.RawEventRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventNormalizerTest {

    private static final TransactionContext TX = new TransactionContext("sig-1", 120L, 1_700_000_000L, "FeePayer1111111111111111111111111111111111");
    private static final String H1 = "01".repeat(32);
    private static final String H2 = "02".repeat(32);
    private static final String H3 = "03".repeat(32);
    private static final String H4 = "04".repeat(32);

    private final EventNormalizer normalizer = new EventNormalizer();

    @Test
    @DisplayName("snake_case keys and tagged op produce a binary event")
    void binary_snakeCaseKeys_taggedOp() {
        Map<String, Object> data = Map.of(
                "caller", "Caller11111111111111111111111111111111111",
                "op", Map.of("Add", Map.of()),
                "lhs_handle", H1,
                "rhs_handle", H2,
                "result_handle", H3);

        Optional<IndexedEvent> event = normalizer.normalize(new RawEventRecord("Fhe16BinaryOpRequested", data), TX);

        assertThat(event).get().isInstanceOfSatisfying(BinaryOpRequested.class, e -> {
            assertThat(e.op()).isEqualTo(BinaryOperator.ADD);
            assertThat(e.lhsHandle()).isEqualTo(new Handle(H1));
            assertThat(e.rhsHandle()).isEqualTo(new Handle(H2));
            assertThat(e.resultHandle()).isEqualTo(new Handle(H3));
            assertThat(e.caller()).isEqualTo("Caller11111111111111111111111111111111111");
            assertThat(e.signature()).isEqualTo("sig-1");
            assertThat(e.slot()).isEqualTo(120L);
            assertThat(e.blockTime()).isEqualTo(1_700_000_000L);
        });
    }

    @Test
    @DisplayName("camelCase keys are accepted the same as snake_case")
    void camelCaseKeys_areCanonicalized() {
        Map<String, Object> data = Map.of(
                "op", "s_div",
                "lhsHandle", H1,
                "rhsHandle", H2,
                "resultHandle", H3);

        Optional<IndexedEvent> event = normalizer.normalize(new RawEventRecord("binaryOpRequested", data), TX);

        assertThat(event).get().isInstanceOfSatisfying(BinaryOpRequested.class,
                e -> assertThat(e.op()).isEqualTo(BinaryOperator.SDIV));
    }

    @Test
    @DisplayName("missing caller falls back to fee payer, then to unknown")
    void callerFallbacks() {
        Map<String, Object> data = Map.of("op", 2, "input_handle", H1, "result_handle", H2);

        Optional<IndexedEvent> withPayer = normalizer.normalize(new RawEventRecord("Fhe16UnaryOpRequested", data), TX);
        Optional<IndexedEvent> withoutPayer = normalizer.normalize(new RawEventRecord("Fhe16UnaryOpRequested", data),
                new TransactionContext("sig-2", 121L, null, null));

        assertThat(withPayer).get().isInstanceOfSatisfying(UnaryOpRequested.class, e -> {
            assertThat(e.caller()).isEqualTo(TX.feePayer());
            assertThat(e.op()).isEqualTo(UnaryOperator.NEG);
        });
        assertThat(withoutPayer).get().extracting(IndexedEvent::caller).isEqualTo(EventNormalizer.UNKNOWN_CALLER);
    }

    @Test
    @DisplayName("byte arrays and int lists are accepted as handles")
    void handleRepresentations() {
        byte[] raw = new byte[32];
        raw[5] = 42;
        List<Integer> asInts = Collections.nCopies(32, 255);
        Map<String, Object> data = Map.of("handle", raw, "client_tag", asInts);

        Optional<IndexedEvent> event = normalizer.normalize(new RawEventRecord("InputHandleRegistered", data), TX);

        assertThat(event).get().isInstanceOfSatisfying(InputHandleRegistered.class, e -> {
            assertThat(e.handle()).isEqualTo(Handle.of(raw));
            assertThat(e.clientTag()).isEqualTo("ff".repeat(32));
        });
    }

    @Test
    void ternary_withNumericOp() {
        Map<String, Object> data = Map.of(
                "op", 4,
                "a_handle", H1,
                "b_handle", H2,
                "c_handle", H3,
                "result_handle", H4);

        Optional<IndexedEvent> event = normalizer.normalize(new RawEventRecord("Fhe16TernaryOpRequested", data), TX);

        assertThat(event).get().isInstanceOfSatisfying(TernaryOpRequested.class, e -> {
            assertThat(e.op()).isEqualTo(TernaryOperator.SELECT);
            assertThat(e.inputHandles()).containsExactly(new Handle(H1), new Handle(H2), new Handle(H3));
        });
    }

    @Test
    @DisplayName("a wrong-length handle drops only that event")
    void malformedEvent_isDroppedWithoutAffectingOthers() {
        Map<String, Object> shortHandle = new HashMap<>();
        shortHandle.put("op", "add");
        shortHandle.put("lhs_handle", "01".repeat(31));
        shortHandle.put("rhs_handle", H2);
        shortHandle.put("result_handle", H3);
        Map<String, Object> valid = Map.of("op", "xor", "lhs_handle", H1, "rhs_handle", H2, "result_handle", H4);

        Optional<IndexedEvent> first = normalizer.normalize(new RawEventRecord("Fhe16BinaryOpRequested", shortHandle), TX);
        Optional<IndexedEvent> second = normalizer.normalize(new RawEventRecord("Fhe16BinaryOpRequested", valid), TX);

        assertThat(first).isEmpty();
        assertThat(second).isPresent();
    }

    @Test
    void missingField_unknownOperator_andUnknownName_areDropped() {
        Map<String, Object> missingResult = Map.of("op", "add", "lhs_handle", H1, "rhs_handle", H2);
        Map<String, Object> unknownOp = Map.of("op", "teleport", "input_handle", H1, "result_handle", H2);

        assertThat(normalizer.normalize(new RawEventRecord("Fhe16BinaryOpRequested", missingResult), TX)).isEmpty();
        assertThat(normalizer.normalize(new RawEventRecord("Fhe16UnaryOpRequested", unknownOp), TX)).isEmpty();
        assertThat(normalizer.normalize(new RawEventRecord("SomethingElse", Map.of()), TX)).isEmpty();
    }

    @Test
    void kindOf_acceptsLegacyPrefixAndSeparators() {
        assertThat(EventNormalizer.kindOf("Fhe16BinaryOpRequested")).contains(EventKind.BINARY_OP_REQUESTED);
        assertThat(EventNormalizer.kindOf("input_handle_registered")).contains(EventKind.INPUT_HANDLE_REGISTERED);
        assertThat(EventNormalizer.kindOf("")).isEmpty();
    }

    @Test
    void toSnakeCase_convertsCamelCase() {
        assertThat(EventNormalizer.toSnakeCase("resultHandle")).isEqualTo("result_handle");
        assertThat(EventNormalizer.toSnakeCase("aHandle")).isEqualTo("a_handle");
        assertThat(EventNormalizer.toSnakeCase("client_tag")).isEqualTo("client_tag");
    }
}
