package com.pipeline.weather.core.imp;

import com.pipeline.weather.core.WarehouseException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WriteRetrierTest {

    @Test
    void execute_TransientFailuresWithinBudget_Succeeds() {
        // Given
        WriteRetrier retrier = new WriteRetrier(3, 1);
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = retrier.execute("insert", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new WarehouseException("database is locked", null, true);
            }
            return "ok";
        });

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void execute_TransientFailuresBeyondBudget_RethrowsAfterAllRetries() {
        // Given
        WriteRetrier retrier = new WriteRetrier(2, 1);
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> retrier.execute("insert", () -> {
            attempts.incrementAndGet();
            throw new WarehouseException("database is locked", null, true);
        })).isInstanceOf(WarehouseException.class);
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void run_NonTransientFailure_NotRetried() {
        // Given
        WriteRetrier retrier = new WriteRetrier(5, 1);
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> retrier.run("commit", () -> {
            attempts.incrementAndGet();
            throw new WarehouseException("disk I/O error", null);
        })).hasMessageContaining("disk I/O");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void constructor_NegativeValues_Rejected() {
        assertThatThrownBy(() -> new WriteRetrier(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WriteRetrier(1, -10)).isInstanceOf(IllegalArgumentException.class);
    }
}
