package org.Aayush.tempus.planner;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tempus.search.SearchConfig;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Planner facade configuration.
 */
@Value
@Builder(toBuilder = true)
public class PlannerConfig {
    @Builder.Default
    SearchConfig search = SearchConfig.builder().build();
    /** Encoding of domain and problem files. */
    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;

    /**
     * Builder defaults with search settings taken from {@code tempus.search.*} system properties.
     */
    public static PlannerConfig defaults() {
        return PlannerConfig.builder().search(SearchConfig.defaults()).build();
    }
}
