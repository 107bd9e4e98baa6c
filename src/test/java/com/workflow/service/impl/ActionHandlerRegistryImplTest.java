package com.workflow.service.impl;

import com.workflow.action.ActionHandler;
import com.workflow.exception.WorkflowException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionHandlerRegistryImplTest {

    private final ActionHandlerRegistryImpl registry = new ActionHandlerRegistryImpl();

    @Test
    void resolve_shouldReturnRegisteredHandler() {
        ActionHandler handler = p -> "done";
        registry.register("send_email", handler);

        assertThat(registry.resolve("send_email")).containsSame(handler);
    }

    @Test
    void resolve_shouldReturnEmptyForUnknownIdentifier() {
        assertThat(registry.resolve("fetch_crm")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
    }

    @Test
    void register_shouldRejectDuplicateIdentifier() {
        ActionHandler original = p -> "original";
        registry.register("analyze", original);

        assertThatThrownBy(() -> registry.register("analyze", p -> "replacement"))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("already registered");
        assertThat(registry.resolve("analyze")).containsSame(original);
    }

    @Test
    void register_shouldRejectBlankIdentifierAndNullHandler() {
        assertThatThrownBy(() -> registry.register(" ", p -> null)).isInstanceOf(WorkflowException.class);
        assertThatThrownBy(() -> registry.register("clean_data", null)).isInstanceOf(WorkflowException.class);
        assertThat(registry.identifiers()).isEmpty();
    }

    @Test
    void identifiers_shouldBeSorted() {
        registry.register("send_email", p -> null);
        registry.register("analyze", p -> null);
        registry.register("fetch_crm", p -> null);

        assertThat(registry.identifiers()).containsExactly("analyze", "fetch_crm", "send_email");
    }

    @Test
    void register_shouldAcceptExactlyOneOfManyConcurrentRegistrations() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                attempts.add(() -> {
                    try {
                        registry.register("fetch_crm", Map::size);
                        return true;
                    } catch (WorkflowException e) {
                        return false;
                    }
                });
            }
            int accepted = 0;
            for (Future<Boolean> outcome : pool.invokeAll(attempts)) {
                if (outcome.get()) {
                    accepted++;
                }
            }
            assertThat(accepted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
