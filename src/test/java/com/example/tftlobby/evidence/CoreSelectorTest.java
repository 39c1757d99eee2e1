package com.example.tftlobby.evidence;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class CoreSelectorTest {

    @Test
    void weakRunnerUpIsReplacedByThirdTrait() {
        Core core = CoreSelector.select(Arrays.asList(
                new Trait("A", 3, 2),
                new Trait("B", 1, 5),
                new Trait("C", 2, 1)));

        assertThat(core).isEqualTo(Core.of("A", "C"));
    }

    @Test
    void twoStrongTraitsAreKeptAsIs() {
        Core core = CoreSelector.select(Arrays.asList(new Trait("A", 3, 0), new Trait("B", 3, 0)));

        assertThat(core).isEqualTo(Core.of("A", "B"));
    }

    @Test
    void weakSecondStaysWhenThereIsNoThird() {
        Core core = CoreSelector.select(Arrays.asList(new Trait("A", 3, 4), new Trait("B", 1, 2)));

        assertThat(core).isEqualTo(Core.of("A", "B"));
    }

    @Test
    void weakSecondIsSwappedForWeakThird() {
        // ranked: A(4), B(1,6), C(1,2); B is below tier 2 and C exists
        Core core = CoreSelector.select(Arrays.asList(
                new Trait("C", 1, 2), new Trait("A", 4, 6), new Trait("B", 1, 6)));

        assertThat(core).isEqualTo(Core.of("A", "C"));
    }

    @Test
    void unitsBreakTierTies() {
        Core core = CoreSelector.select(Arrays.asList(
                new Trait("Low", 2, 2), new Trait("High", 2, 5), new Trait("Top", 3, 1)));

        assertThat(core.traits()).containsExactly("Top", "High");
    }

    @Test
    void singleTraitAndEmptyInput() {
        assertThat(CoreSelector.select(Collections.singletonList(new Trait("Solo", 2, 3))))
                .isEqualTo(Core.of("Solo"));
        assertThat(CoreSelector.select(Collections.emptyList()).isEmpty()).isTrue();
    }

    @Test
    void unrankedTraitsKeepListedOrder() {
        Core core = CoreSelector.select(Arrays.asList(
                Trait.unranked("Sniper"), Trait.unranked("Rebel"), Trait.unranked("Bruiser")));

        assertThat(core).isEqualTo(Core.of("Sniper", "Rebel"));
    }

    @Test
    void duplicateNamesCollapse() {
        Core core = CoreSelector.select(Arrays.asList(new Trait("A", 3, 1), new Trait("A", 2, 9), new Trait("B", 2, 1)));

        assertThat(core).isEqualTo(Core.of("A", "B"));
    }

    @Test
    void coreDisplayStripsSetPrefix() {
        assertThat(Core.of("TFT13_Sniper", "Set13_Rebel").displayName()).isEqualTo("Sniper + Rebel");
        assertThat(Core.of("A", "B")).isNotEqualTo(Core.of("B", "A"));
    }
}
