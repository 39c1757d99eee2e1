package com.example.tftlobby.evidence;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSearchTest {

    @Test
    void findsCandidatesAnywhereInDocumentOrder() {
        JsonElement doc = JsonParser.parseString("{"
                + "\"profile\":{\"name\":\"x\",\"recent\":[{\"traits\":[\"A\",\"B\"],\"games\":12}]},"
                + "\"stats\":{\"comps\":[{\"traits\":[{\"name\":\"C\",\"tier\":2},{\"slug\":\"D\"}],\"playRate\":0.2,\"wr\":0.5}]},"
                + "\"traits\":\"not an array\""
                + "}");

        List<CompositionCandidate> found = new CandidateSearch().find(doc);

        assertThat(found).hasSize(2);
        assertThat(found.get(0).traits).extracting(t -> t.name).containsExactly("A", "B");
        assertThat(found.get(1).traits).extracting(t -> t.name).containsExactly("C", "D");
        assertThat(found.get(1).traits.get(0).tier).isEqualTo(2);
        assertThat(found.get(1).traits.get(1).hasKnownTier()).isFalse();
    }

    @Test
    void nestedCandidatesInsideACandidateAreFound() {
        JsonElement doc = JsonParser.parseString(
                "{\"traits\":[\"Outer\"],\"variants\":[{\"traits\":[\"Inner\"]}]}");

        assertThat(new CandidateSearch().find(doc)).hasSize(2);
    }

    @Test
    void searchStopsAtMaxDepth() {
        JsonElement doc = JsonParser.parseString("{\"a\":{\"b\":{\"c\":{\"traits\":[\"Deep\"]}}}}");

        assertThat(new CandidateSearch(2).find(doc)).isEmpty();
        assertThat(new CandidateSearch(3).find(doc)).hasSize(1);
    }

    @Test
    void weightTakesMaxOfCountsAndPlayRateThenAddsWinRate() {
        CompositionCandidate c = CompositionCandidate.from(JsonParser.parseString(
                "{\"traits\":[\"A\"],\"games\":12,\"count\":30,\"playRate\":0.2,\"winRate\":0.5,\"wr\":0.1}").getAsJsonObject());

        // max(1, 12, 30, 0.2*100) = 30, then + 0.5*10 + 0.1*10
        assertThat(c.weight()).isCloseTo(36.0, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    void playRateCanDominateCounts() {
        CompositionCandidate c = CompositionCandidate.from(JsonParser.parseString(
                "{\"traits\":[\"A\"],\"matches\":5,\"pr\":0.35}").getAsJsonObject());

        assertThat(c.weight()).isCloseTo(35.0, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    void candidateWithoutStatisticsWeighsOne() {
        CompositionCandidate c = CompositionCandidate.from(JsonParser.parseString(
                "{\"traits\":[\"A\"],\"games\":\"12\",\"winRate\":null}").getAsJsonObject());

        assertThat(c.weight()).isEqualTo(1.0);
    }

    @Test
    void namelessTraitsAreDroppedButTierZeroTraitsAreKept() {
        CompositionCandidate c = CompositionCandidate.from(JsonParser.parseString(
                "{\"traits\":[{\"name\":\"Off\",\"tier_current\":0},{\"key\":\"On\",\"tier_current\":1,\"num_units\":3},{},\"\",null]}").getAsJsonObject());

        assertThat(c.traits).extracting(t -> t.name).containsExactly("Off", "On");
        assertThat(c.traits.get(0).tier).isEqualTo(0);
        assertThat(c.traits.get(1).units).isEqualTo(3);
    }

    @Test
    void tierZeroThirdTraitReplacesWeakRunnerUp() {
        CompositionCandidate c = CompositionCandidate.from(JsonParser.parseString("{\"traits\":["
                + "{\"name\":\"A\",\"tier\":3,\"num_units\":2},"
                + "{\"name\":\"B\",\"tier\":1,\"num_units\":5},"
                + "{\"name\":\"C\",\"tier\":0,\"num_units\":1}]}").getAsJsonObject());

        assertThat(CoreSelector.select(c.traits)).isEqualTo(Core.of("A", "C"));
    }

    @Test
    void candidateWithOnlyTierZeroTraitsStillCarriesEvidence() {
        CompositionCandidate c = CompositionCandidate.from(JsonParser.parseString(
                "{\"traits\":[{\"name\":\"A\",\"tier\":0},{\"name\":\"B\",\"tier\":0}],\"games\":10}").getAsJsonObject());

        assertThat(c.traits).hasSize(2);
        assertThat(c.weight()).isEqualTo(10.0);
        assertThat(CoreSelector.select(c.traits)).isEqualTo(Core.of("A", "B"));
    }
}
