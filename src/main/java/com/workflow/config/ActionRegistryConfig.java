package com.workflow.config;

import com.workflow.action.ActionHandler;
import com.workflow.action.RetryingActionHandler;
import com.workflow.connector.AnalysisConnector;
import com.workflow.connector.ChatConnector;
import com.workflow.connector.CrmConnector;
import com.workflow.connector.DataCleaningConnector;
import com.workflow.connector.MailConnector;
import com.workflow.connector.ReportConnector;
import com.workflow.exception.TransientActionException;
import com.workflow.service.api.ActionHandlerRegistry;
import com.workflow.service.impl.ActionHandlerRegistryImpl;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.workflow.service.impl.PlanTemplates.ANALYZE;
import static com.workflow.service.impl.PlanTemplates.CLEAN_DATA;
import static com.workflow.service.impl.PlanTemplates.FETCH_CRM;
import static com.workflow.service.impl.PlanTemplates.GENERATE_REPORT;
import static com.workflow.service.impl.PlanTemplates.SEND_CHAT_MESSAGE;
import static com.workflow.service.impl.PlanTemplates.SEND_EMAIL;

/**
 * Builds the application's {@link ActionHandlerRegistry} once, at startup, by registering each
 * connector under its fixed action identifier. The registry is read-only from then on.
 */
@Configuration
public class ActionRegistryConfig {

    @Bean
    public RetryRegistry actionRetryRegistry(@Value("${workflow.retry.max-attempts:3}") int maxAttempts,
                                             @Value("${workflow.retry.initial-backoff-ms:500}") long initialBackoffMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), 2))
                .retryExceptions(TransientActionException.class)
                .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public ActionHandlerRegistry actionHandlerRegistry(CrmConnector crm,
                                                       DataCleaningConnector cleaning,
                                                       AnalysisConnector analysis,
                                                       ReportConnector reports,
                                                       MailConnector mail,
                                                       ChatConnector chat,
                                                       RetryRegistry actionRetryRegistry) {
        ActionHandlerRegistry registry = new ActionHandlerRegistryImpl();
        registry.register(FETCH_CRM, crm::fetch);
        registry.register(CLEAN_DATA, cleaning::clean);
        registry.register(ANALYZE, analysis::analyze);
        registry.register(GENERATE_REPORT, reports::generate);
        registry.register(SEND_EMAIL, retrying(SEND_EMAIL, mail::send, actionRetryRegistry));
        // HTTP-level retries for the webhook already happen in the WebClient filter.
        registry.register(SEND_CHAT_MESSAGE, chat::send);
        return registry;
    }

    private static ActionHandler retrying(String action, ActionHandler handler, RetryRegistry retryRegistry) {
        return new RetryingActionHandler(action, handler, retryRegistry.retry(action));
    }
}
