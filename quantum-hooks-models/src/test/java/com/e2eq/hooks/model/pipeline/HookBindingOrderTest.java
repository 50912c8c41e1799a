package com.e2eq.hooks.model.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HookBindingOrderTest {

    private static HookBinding binding(String id, int ordinal, Instant createdAt) {
        return HookBinding.builder()
                .id(id)
                .hookName("before_signup")
                .scriptId("script-" + id)
                .ordinal(ordinal)
                .enabled(true)
                .createdAt(createdAt)
                .build();
    }

    @Test
    void ordersByOrdinalThenCreationThenId() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        List<HookBinding> bindings = new ArrayList<>(List.of(
                binding("c", 2, t0),
                binding("b", 1, t0.plusSeconds(5)),
                binding("a", 1, t0.plusSeconds(5)),
                binding("d", 1, t0)));

        bindings.sort(HookBinding.EXECUTION_ORDER);

        assertEquals(List.of("d", "a", "b", "c"), bindings.stream().map(HookBinding::getId).toList());
    }

    @Test
    void orderIsStableAcrossRepeatedSorts() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        List<HookBinding> first = new ArrayList<>(List.of(binding("x", 0, t0), binding("y", 0, t0)));
        List<HookBinding> second = new ArrayList<>(List.of(binding("y", 0, t0), binding("x", 0, t0)));
        first.sort(HookBinding.EXECUTION_ORDER);
        second.sort(HookBinding.EXECUTION_ORDER);
        assertEquals(first, second);
    }

    @Test
    void wireNamesAreLowerCase() {
        assertEquals("enrichment", ExecutionMode.ENRICHMENT.wireName());
        assertEquals("oauth_client", HookGroup.OAUTH_CLIENT.wireName());
    }
}
