package com.gillianbc.retirement.service;

import com.gillianbc.retirement.ProjectionFixtures;
import com.gillianbc.retirement.model.ProjectionInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectionInputHasherTest {

    private final ProjectionInputHasher hasher = new ProjectionInputHasher();

    @Test
    @DisplayName("Hash is 64 lower-case hex characters")
    void hash_format() {
        String hash = hasher.hash(ProjectionFixtures.retiree().build());
        assertTrue(hash.matches("[0-9a-f]{64}"), hash);
    }

    @Test
    @DisplayName("Structurally identical inputs hash the same")
    void hash_stableForEquivalentInputs() {
        ProjectionInput a = ProjectionFixtures.retiree()
                .incomeStream(ProjectionFixtures.socialSecurity("24000", 67))
                .incomeStream(ProjectionFixtures.rental("6000", 65))
                .annualEssentialExpenses(new BigDecimal("30000"))
                .build();
        ProjectionInput b = ProjectionFixtures.retiree()
                .incomeStream(ProjectionFixtures.rental("6000.0", 65))
                .incomeStream(ProjectionFixtures.socialSecurity("24000", 67))
                .annualEssentialExpenses(new BigDecimal("30000.00"))
                .build();

        assertEquals(hasher.hash(a), hasher.hash(b));
    }

    @Test
    @DisplayName("Any material change alters the hash")
    void hash_changesWithInput() {
        ProjectionInput input = ProjectionFixtures.retiree().build();
        ProjectionInput changed = input.toBuilder().maxAge(91).build();

        assertNotEquals(hasher.hash(input), hasher.hash(changed));
    }
}
