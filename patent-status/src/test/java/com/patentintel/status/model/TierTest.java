package com.patentintel.status.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TierTest {

    @Test
    void resolvesSubscriptionHeader() {
        assertThat(Tier.fromHeader(null)).isEqualTo(Tier.FREE);
        assertThat(Tier.fromHeader("")).isEqualTo(Tier.FREE);
        assertThat(Tier.fromHeader("platinum")).isEqualTo(Tier.FREE);
        assertThat(Tier.fromHeader("BASIC")).isEqualTo(Tier.STARTER);
        assertThat(Tier.fromHeader("pro")).isEqualTo(Tier.PRO);
        assertThat(Tier.fromHeader(" Enterprise ")).isEqualTo(Tier.ENTERPRISE);
    }

    @Test
    void onlyEnterpriseIsUnlimited() {
        assertThat(Tier.ENTERPRISE.isUnlimited()).isTrue();
        assertThat(Tier.PRO.isUnlimited()).isFalse();
    }
}
