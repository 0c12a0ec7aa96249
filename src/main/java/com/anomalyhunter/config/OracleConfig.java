package com.anomalyhunter.config;

import com.anomalyhunter.oracle.HistoricalContextProvider;
import com.anomalyhunter.oracle.OracleGateway;
import com.anomalyhunter.oracle.TextAndSeverityOracle;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link OracleGateway}. Both collaborators are optional beans: without a
 * {@link TextAndSeverityOracle} every detector runs on its deterministic fallback.
 */
@Configuration
public class OracleConfig {

    private static final Logger log = LoggerFactory.getLogger(OracleConfig.class);

    @Bean
    public OracleGateway oracleGateway(
            ObjectProvider<TextAndSeverityOracle> oracle,
            ObjectProvider<HistoricalContextProvider> historicalContextProvider,
            CircuitBreaker oracleCircuitBreaker,
            TimeLimiter oracleTimeLimiter,
            @Qualifier("oracleExecutor") Executor oracleExecutor) {
        TextAndSeverityOracle configuredOracle = oracle.getIfAvailable();
        if (configuredOracle == null) {
            log.info("No TextAndSeverityOracle configured, detectors will use deterministic severities");
        }
        return new OracleGateway(
                configuredOracle,
                historicalContextProvider.getIfAvailable(),
                oracleCircuitBreaker,
                oracleTimeLimiter,
                oracleExecutor);
    }
}
