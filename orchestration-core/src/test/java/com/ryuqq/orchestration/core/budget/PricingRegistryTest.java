package com.ryuqq.orchestration.core.budget;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PricingRegistry 테스트.
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
class PricingRegistryTest {

    @Test
    void getPricing_KnownModel_ReturnsRegisteredPrice() {
        // Given
        PricingRegistry registry = new PricingRegistry();

        // When
        ModelPricing pricing = registry.getPricing("gpt-4");

        // Then
        assertEquals(0.03, pricing.inputPricePer1k());
        assertEquals(0.06, pricing.outputPricePer1k());
        assertEquals(0.06, pricing.cost(1000, 500), 1e-9);
    }

    @Test
    void getPricing_UnknownModel_ReturnsConservativeDefault() {
        // Given
        PricingRegistry registry = new PricingRegistry();

        // When & Then
        assertSame(PricingRegistry.DEFAULT_PRICING, registry.getPricing("my-model"));
        assertSame(PricingRegistry.DEFAULT_PRICING, registry.getPricing(null));
        assertFalse(registry.isRegistered("my-model"));
    }

    @Test
    void register_OverridesExistingPrice() {
        // Given
        PricingRegistry registry = new PricingRegistry();

        // When
        registry.register(new ModelPricing("gpt-4", 0.02, 0.04, "openai"));

        // Then
        assertEquals(0.02, registry.getPricing("gpt-4").inputPricePer1k());
    }
}
