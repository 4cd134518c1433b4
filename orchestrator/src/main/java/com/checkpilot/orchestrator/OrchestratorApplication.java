package com.checkpilot.orchestrator;

import com.checkpilot.orchestrator.catalog.ProviderLoader;
import com.checkpilot.orchestrator.catalog.ProviderRegistry;
import com.checkpilot.orchestrator.qualifier.TestPlanSelector;
import com.checkpilot.orchestrator.session.RunOutcome;
import com.checkpilot.orchestrator.session.Session;
import com.checkpilot.orchestrator.session.SessionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.util.List;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

    /** Used when no monitoring backend contributes a registry. */
    @Bean
    @ConditionalOnMissingBean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /** Providers are scanned once at startup; sessions take private copies. */
    @Bean
    ProviderRegistry providerRegistry(ProviderLoader loader) {
        ProviderRegistry registry = loader.load();
        registry.problems().forEach(p -> log.warn("Provider problem: {}", p));
        return registry;
    }

    /**
     * Unattended mode: continue the newest incomplete session, or start one
     * for the configured test plan, and run it to the end.
     *
     * A job that was in flight when the previous process died is settled with
     * the default recovery before the run continues.
     */
    @Bean
    @ConditionalOnProperty(name = "checkpilot.auto-run.enabled", havingValue = "true")
    CommandLineRunner autoRun(SessionService sessions,
                              @Value("${checkpilot.auto-run.test-plan:}") String testPlanId) {
        return args -> {
            List<String> resumable = sessions.resumableSessions();
            Session session;
            if (!resumable.isEmpty()) {
                session = sessions.resume(resumable.get(0));
                sessions.recoverInFlight(session);
            } else if (!testPlanId.isBlank()) {
                session = sessions.create(new TestPlanSelector(testPlanId), "checkpilot", testPlanId);
            } else {
                log.warn("Auto-run enabled but nothing to resume and no test plan configured");
                return;
            }
            RunOutcome outcome = sessions.run(session);
            log.info("Session {} finished with {}", session.getId(), outcome);
        };
    }
}
