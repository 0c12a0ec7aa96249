package com.anomalyhunter.unit.learning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.anomalyhunter.config.LearningProperties;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.StrategyPerformanceRecord;
import com.anomalyhunter.domain.model.SuccessfulPattern;
import com.anomalyhunter.exception.LearningStoreException;
import com.anomalyhunter.learning.LearningStatePersister;
import com.anomalyhunter.repository.redis.LearningStateRedisRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LearningStatePersisterTest {

    @Mock
    private LearningStateRedisRepository learningStateRedisRepository;

    private Retry retry;
    private LearningProperties learningProperties;
    private List<StrategyPerformanceRecord> records;

    @BeforeEach
    void setUp() {
        retry = Retry.of(
                "test",
                RetryConfig.custom()
                        .maxAttempts(3)
                        .waitDuration(Duration.ofMillis(1))
                        .build());
        learningProperties = new LearningProperties();
        records = List.of(StrategyPerformanceRecord.empty(StrategyId.STATISTICAL));
    }

    private LearningStatePersister persister(Executor executor) {
        return new LearningStatePersister(learningStateRedisRepository, retry, executor, learningProperties);
    }

    @Test
    @DisplayName("Writes records, count and pattern")
    void writesEverything() {
        SuccessfulPattern pattern = SuccessfulPattern.builder().verdictId("v-1").build();

        boolean written = persister(Runnable::run).persistAsync(records, 7, pattern).join();

        assertThat(written).isTrue();
        verify(learningStateRedisRepository).saveRecords(records);
        verify(learningStateRedisRepository).saveTotalDetections(7);
        verify(learningStateRedisRepository).appendPattern(pattern, 100);
    }

    @Test
    @DisplayName("No pattern means no list write")
    void skipsPatternWhenAbsent() {
        persister(Runnable::run).persistAsync(records, 1, null).join();

        verify(learningStateRedisRepository, never()).appendPattern(any(), anyInt());
    }

    @Test
    @DisplayName("Transient failure is retried")
    void retriesTransientFailure() {
        doThrow(new LearningStoreException("Redis down", new RuntimeException("connection refused")))
                .doNothing()
                .when(learningStateRedisRepository)
                .saveRecords(records);

        boolean written = persister(Runnable::run).persistAsync(records, 2, null).join();

        assertThat(written).isTrue();
        verify(learningStateRedisRepository, times(2)).saveRecords(records);
        verify(learningStateRedisRepository).saveTotalDetections(2);
    }

    @Test
    @DisplayName("Exhausted retries complete with false instead of failing")
    void exhaustedRetriesDropWrite() {
        doThrow(new LearningStoreException("Redis down", new RuntimeException("connection refused")))
                .when(learningStateRedisRepository)
                .saveRecords(records);

        boolean written = persister(Runnable::run).persistAsync(records, 3, null).join();

        assertThat(written).isFalse();
        verify(learningStateRedisRepository, times(3)).saveRecords(records);
        verify(learningStateRedisRepository, never()).saveTotalDetections(anyLong());
    }

    @Test
    @DisplayName("Rejected submission completes with false")
    void rejectedSubmission() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("executor shut down");
        };

        boolean written = persister(rejecting).persistAsync(records, 4, null).join();

        assertThat(written).isFalse();
        verifyNoInteractions(learningStateRedisRepository);
    }
}
