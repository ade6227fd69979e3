package com.idsplit.application.split;

import com.idsplit.application.split.exception.IdentifierTooLongException;
import com.idsplit.domain.split.model.SplitResult;
import com.idsplit.domain.split.service.IdentifierSplitter;
import com.idsplit.infrastructure.splitting.SplitMetricsTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SplitAppServiceTest {

    @Mock
    private IdentifierSplitter identifierSplitter;

    private SplitMetricsTracker metrics;
    private SplitAppService service;

    @BeforeEach
    void setUp() throws Exception {
        metrics = new SplitMetricsTracker();
        service = new SplitAppService(identifierSplitter, metrics);
        setField("maxIdentifierLength", 16);
        setField("maxBatchSize", 3);
    }

    private void setField(String name, int value) throws Exception {
        Field field = SplitAppService.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(service, value);
    }

    @Test
    @DisplayName("Split delegates to the splitter and records metrics")
    void split_delegates() {
        when(identifierSplitter.split("getMAX")).thenReturn(List.of("get", "MAX"));

        SplitResult result = service.split("getMAX");

        assertThat(result.identifier()).isEqualTo("getMAX");
        assertThat(result.tokens()).containsExactly("get", "MAX");
        assertThat(service.stats().identifiersSplit()).isEqualTo(1);
        assertThat(service.stats().identifiersSubdivided()).isEqualTo(1);
        assertThat(service.stats().tokensProduced()).isEqualTo(2);
    }

    @Test
    @DisplayName("Empty identifier → no tokens, splitter not called")
    void empty_identifier() {
        SplitResult result = service.split("");

        assertThat(result.tokens()).isEmpty();
        verifyNoInteractions(identifierSplitter);
    }

    @Test
    @DisplayName("null identifier is rejected")
    void null_identifier() {
        assertThatThrownBy(() -> service.split(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Identifier over the length limit fails fast")
    void too_long() {
        assertThatThrownBy(() -> service.split("a".repeat(17)))
                .isInstanceOf(IdentifierTooLongException.class)
                .hasMessageContaining("17");
        verifyNoInteractions(identifierSplitter);
    }

    @Test
    @DisplayName("Identifier at the length limit is accepted")
    void at_limit() {
        String identifier = "a".repeat(16);
        when(identifierSplitter.split(identifier)).thenReturn(List.of(identifier));

        assertThat(service.split(identifier).wasSplit()).isFalse();
    }

    @Test
    @DisplayName("Batch keeps input order")
    void batch_order() {
        when(identifierSplitter.split("autocommit")).thenReturn(List.of("auto", "commit"));
        when(identifierSplitter.split("argv")).thenReturn(List.of("argv"));

        List<SplitResult> results = service.splitAll(List.of("autocommit", "argv"));

        assertThat(results).extracting(SplitResult::identifier).containsExactly("autocommit", "argv");
        assertThat(results.get(0).tokens()).containsExactly("auto", "commit");
        assertThat(service.stats().averageTokensPerIdentifier()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Oversized batch is rejected")
    void batch_too_large() {
        assertThatThrownBy(() -> service.splitAll(List.of("a", "b", "c", "d")))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(identifierSplitter);
    }

    @Test
    @DisplayName("Batch is validated before anything is split")
    void batch_validated_first() {
        assertThatThrownBy(() -> service.splitAll(List.of("ok", "b".repeat(20))))
                .isInstanceOf(IdentifierTooLongException.class);
        verifyNoInteractions(identifierSplitter);
    }
}
