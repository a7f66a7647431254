package io.github.samzhu.tokenmeter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.config.MeteringProperties.PlanSeed;
import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.repository.SubscriptionPlanRepository;

class PlanCatalogSeederTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void shouldInsertOnlyMissingPlans() {
        // Given: Free 已存在
        SubscriptionPlanRepository repository = mock(SubscriptionPlanRepository.class);
        when(repository.existsByName("Free")).thenReturn(true);
        when(repository.existsByName("Pro")).thenReturn(false);
        when(repository.existsByName("Unlimited")).thenReturn(false);

        MeteringProperties properties = new MeteringProperties(null, null, null, List.of(
            new PlanSeed("Free", "Starter", 10_000, 0, null),
            new PlanSeed("Pro", "Daily use", 200_000, 1900, null),
            new PlanSeed(" ", "No name", 1, 1, null),
            new PlanSeed("Unlimited", "No cap", SubscriptionPlan.UNLIMITED, 9900, false)), null, null);

        PlanCatalogSeeder seeder = new PlanCatalogSeeder(repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        // When
        seeder.run(new DefaultApplicationArguments());

        // Then
        ArgumentCaptor<SubscriptionPlan> captor = ArgumentCaptor.forClass(SubscriptionPlan.class);
        verify(repository, times(2)).insert(captor.capture());
        assertThat(captor.getAllValues())
            .extracting(SubscriptionPlan::name, SubscriptionPlan::active)
            .containsExactly(
                tuple("Pro", true),
                tuple("Unlimited", false));
        assertThat(captor.getAllValues().get(0).createdAt()).isEqualTo(NOW);
        verify(repository, times(0)).existsByName(" ");
        verify(repository, times(3)).existsByName(any());
    }
}
