package com.phillippitts.truthtell.service.credibility;

import com.phillippitts.truthtell.config.properties.CredibilityProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceReliabilityPolicyTest {

    private final SourceReliabilityPolicy policy = new SourceReliabilityPolicy(List.of(
            new CredibilityProperties.Source("Wire", "https://wire.example.com", 0.9),
            new CredibilityProperties.Source("Blog", "https://blog.example.com", 0.4)), 0.7);

    @Test
    void shouldMatchSourceContainingConfiguredUrl() {
        assertThat(policy.reliabilityFor("https://wire.example.com/feeds/top.rss")).isEqualTo(0.9);
        assertThat(policy.reliabilityFor("HTTPS://BLOG.EXAMPLE.COM/post/1")).isEqualTo(0.4);
    }

    @Test
    void shouldMatchSourceByName() {
        assertThat(policy.reliabilityFor("Reported by the Wire desk")).isEqualTo(0.9);
    }

    @Test
    void shouldFallBackToDefaultReliability() {
        assertThat(policy.reliabilityFor("https://unknown.example.org")).isEqualTo(0.7);
        assertThat(policy.reliabilityFor("")).isEqualTo(0.7);
        assertThat(policy.reliabilityFor(null)).isEqualTo(0.7);
    }

    @Test
    void shouldBuildFromProperties() {
        SourceReliabilityPolicy fromDefaults = SourceReliabilityPolicy.from(new CredibilityProperties());

        assertThat(fromDefaults.reliabilityFor("https://timesofindia.indiatimes.com/rssfeedstopstories.cms"))
                .isEqualTo(0.8);
    }
}
