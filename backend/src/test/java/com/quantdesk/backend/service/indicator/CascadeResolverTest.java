package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.model.Indicator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CascadeResolverTest {

    private final CascadeResolver resolver = new CascadeResolver();

    @Test
    void cascadeFollowsTheWholeChain() {
        List<Indicator> catalog = List.of(
                indicator("A", List.of(), List.of()),
                indicator("B", List.of("A"), List.of("a")),
                indicator("C", List.of("B"), List.of("b")),
                indicator("D", List.of(), List.of()));

        assertThat(resolver.cascadeDeleteSet("A", catalog)).containsExactly("A", "B", "C");
        assertThat(resolver.cascadeDeleteSet("C", catalog)).containsExactly("C");
        assertThat(resolver.dependentsOf("A", catalog)).extracting(Indicator::getId).containsExactly("B");
    }

    @Test
    void diamondAndCycleAreVisitedOnce() {
        List<Indicator> catalog = List.of(
                indicator("A", List.of("D"), List.of()),
                indicator("B", List.of("A"), List.of()),
                indicator("C", List.of("A"), List.of()),
                indicator("D", List.of("B", "C"), List.of()));

        assertThat(resolver.cascadeDeleteSet("A", catalog)).containsExactlyInAnyOrder("A", "B", "C", "D");
    }

    @Test
    void upstreamCollectsTransitiveDependencies() {
        List<Indicator> catalog = List.of(
                indicator("A", List.of(), List.of()),
                indicator("B", List.of("A", "gone"), List.of()),
                indicator("C", List.of("B"), List.of()),
                indicator("D", List.of(), List.of()));

        assertThat(resolver.upstreamOf("C", catalog)).containsExactly("B", "A");
        assertThat(resolver.upstreamOf("A", catalog)).isEmpty();
    }

    @Test
    void dependentsByColumnOnlyListsColumnsThatAreRead() {
        List<Indicator> catalog = List.of(
                indicator("B", List.of("A"), List.of("a", "MACD:signal")),
                indicator("C", List.of("A"), List.of("a")));

        Map<String, List<Indicator>> readers = resolver.dependentsByColumn(List.of("a", "MACD:signal", "unused"), catalog);

        assertThat(readers).containsOnlyKeys("a", "MACD:signal");
        assertThat(readers.get("a")).extracting(Indicator::getId).containsExactly("B", "C");
        assertThat(readers.get("MACD:signal")).extracting(Indicator::getId).containsExactly("B");
    }

    private static Indicator indicator(String id, List<String> dependencies, List<String> columns) {
        return Indicator.builder()
                .id(id)
                .name(id)
                .outputColumn(id.toLowerCase())
                .dependencies(dependencies)
                .dependencyColumns(columns)
                .build();
    }
}
