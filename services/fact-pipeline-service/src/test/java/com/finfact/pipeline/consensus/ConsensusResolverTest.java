package com.finfact.pipeline.consensus;

import static org.assertj.core.api.Assertions.assertThat;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.domain.ResolutionStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ConsensusResolver")
class ConsensusResolverTest {

    private static final FactGroupKey.Defaults DEFAULTS = new FactGroupKey.Defaults("CNY", "1", "consolidated");
    private static final FactGroupKey ASSETS_2023 = key("total_assets", "CNY");

    private ConsensusResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ConsensusResolver(new PipelineProperties());
    }

    private static FactGroupKey key(String metric, String currency) {
        return FactGroupKey.normalized(metric, FactType.STOCK, LocalDate.of(2023, 12, 31), null, null,
            "consolidated", currency, "1", DEFAULTS);
    }

    private static CandidateObservation obs(String engine, String value) {
        return obs(engine, value, "期末余额", 1.0);
    }

    private static CandidateObservation obs(String engine, String value, String column, double quality) {
        return new CandidateObservation(UUID.randomUUID(), engine, ASSETS_2023,
            value == null ? null : new BigDecimal(value), column, quality, true);
    }

    @Nested
    @DisplayName("multi-engine groups")
    class MultiEngine {

        @Test
        void identicalValuesAgree() {
            List<GroupResolution> resolutions = resolver.resolve(List.of(obs("mineru", "1000"), obs("docling", "1000")));

            assertThat(resolutions).singleElement().satisfies(resolution -> {
                assertThat(resolution.status()).isEqualTo(ResolutionStatus.AUTO_AGREED);
                assertThat(resolution.value()).isEqualByComparingTo("1000");
                assertThat(resolution.engineCount()).isEqualTo(2);
                assertThat(resolution.agreeingEngineCount()).isEqualTo(2);
                assertThat(resolution.candidateCount()).isEqualTo(2);
            });
        }

        @Test
        void majorityClusterWinsOverOutlier() {
            GroupResolution resolution = resolver.resolve(List.of(
                obs("mineru", "500"), obs("docling", "500"), obs("pdftotext", "480"))).get(0);

            assertThat(resolution.status()).isEqualTo(ResolutionStatus.AUTO_AGREED);
            assertThat(resolution.value()).isEqualByComparingTo("500");
            assertThat(resolution.engineCount()).isEqualTo(3);
            assertThat(resolution.agreeingEngineCount()).isEqualTo(2);
        }

        @Test
        void disagreementStaysUnresolvedWithProvisionalBest() {
            CandidateObservation weaker = obs("mineru", "100", "期末余额", 0.9);
            CandidateObservation stronger = obs("docling", "200", "期末余额", 1.0);

            GroupResolution resolution = resolver.resolve(List.of(weaker, stronger)).get(0);

            assertThat(resolution.status()).isEqualTo(ResolutionStatus.UNRESOLVED);
            assertThat(resolution.value()).isEqualByComparingTo("200");
            assertThat(resolution.selectedCandidateId()).isEqualTo(stronger.candidateId());
            assertThat(resolution.agreeingEngineCount()).isEqualTo(1);
        }

        @Test
        void currentColumnIsPreferredAmongAgreeingCandidates() {
            CandidateObservation positional = obs("mineru", "1000.004", "col_1", 1.0);
            CandidateObservation labelled = obs("docling", "1000", "期末余额", 0.8);

            GroupResolution resolution = resolver.resolve(List.of(positional, labelled)).get(0);

            assertThat(resolution.status()).isEqualTo(ResolutionStatus.AUTO_AGREED);
            assertThat(resolution.selectedCandidateId()).isEqualTo(labelled.candidateId());
        }

        @Test
        void requiredAgreementIsConfigurable() {
            PipelineProperties properties = new PipelineProperties();
            properties.getConsensus().setMinAgreeingEngines(3);

            GroupResolution resolution = new ConsensusResolver(properties).resolve(List.of(
                obs("mineru", "500"), obs("docling", "500"), obs("pdftotext", "480"))).get(0);

            assertThat(resolution.status()).isEqualTo(ResolutionStatus.UNRESOLVED);
        }
    }

    @Test
    void singleEngineGroupIsMarkedAsSuch() {
        CandidateObservation current = obs("mineru", "700", "期末余额", 0.9);
        CandidateObservation prior = obs("mineru", "650", "期初余额", 1.0);

        GroupResolution resolution = resolver.resolve(List.of(prior, current)).get(0);

        assertThat(resolution.status()).isEqualTo(ResolutionStatus.AUTO_SINGLE_ENGINE);
        assertThat(resolution.selectedCandidateId()).isEqualTo(current.candidateId());
        assertThat(resolution.engineCount()).isEqualTo(1);
        assertThat(resolution.candidateCount()).isEqualTo(2);
    }

    @Test
    void candidatesWithoutResolvedPeriodAreNotGrouped() {
        FactGroupKey undated = FactGroupKey.normalized("revenue", FactType.FLOW, null, null, null,
            "consolidated", "CNY", "1", DEFAULTS);
        CandidateObservation current = new CandidateObservation(UUID.randomUUID(), "mineru", undated,
            new BigDecimal("500"), "本期", 1.0, true);
        CandidateObservation prior = new CandidateObservation(UUID.randomUUID(), "docling", undated,
            new BigDecimal("400"), "上期", 1.0, true);

        assertThat(undated.hasPeriod()).isFalse();
        assertThat(resolver.resolve(List.of(current, prior))).isEmpty();
        assertThat(resolver.resolve(List.of(current, prior, obs("mineru", "42"))))
            .extracting(resolution -> resolution.key().metricCode())
            .containsExactly("total_assets");
    }

    @Test
    void unmatchedAndUnparsedCandidatesAreIgnored() {
        CandidateObservation raw = new CandidateObservation(UUID.randomUUID(), "docling",
            FactGroupKey.normalized("raw_0123456789ab", FactType.STOCK, LocalDate.of(2023, 12, 31), null, null,
                null, null, null, DEFAULTS),
            BigDecimal.TEN, "期末余额", 0.3, false);

        List<GroupResolution> resolutions = resolver.resolve(List.of(raw, obs("docling", null), obs("mineru", "42")));

        assertThat(resolutions).singleElement().satisfies(resolution -> {
            assertThat(resolution.status()).isEqualTo(ResolutionStatus.AUTO_SINGLE_ENGINE);
            assertThat(resolution.value()).isEqualByComparingTo("42");
        });
    }

    @Test
    void groupsSplitOnCurrency() {
        CandidateObservation usd = new CandidateObservation(UUID.randomUUID(), "mineru", key("total_assets", "usd"),
            new BigDecimal("10"), "期末余额", 1.0, true);

        List<GroupResolution> resolutions = resolver.resolve(List.of(obs("mineru", "70"), usd));

        assertThat(resolutions).extracting(resolution -> resolution.key().currency()).containsExactly("CNY", "USD");
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        List<CandidateObservation> observations = new ArrayList<>(List.of(
            obs("mineru", "500"), obs("docling", "500.2"), obs("pdftotext", "480"),
            new CandidateObservation(UUID.randomUUID(), "docling", key("total_liabilities", "CNY"),
                new BigDecimal("300"), "期末余额", 1.0, true)
        ));
        List<GroupResolution> forward = resolver.resolve(observations);

        Collections.reverse(observations);
        List<GroupResolution> backward = resolver.resolve(observations);

        assertThat(backward).isEqualTo(forward);
    }

    @ParameterizedTest(name = "{0} vs {1} agree={2}")
    @CsvSource({
        "1000000, 1000400, true",
        "1000, 1001, false",
        "0, 0.01, true",
        "0, 0.02, false",
        "-500, -500.2, true"
    })
    void toleranceIsRelativeWithAbsoluteFloor(String a, String b, boolean expected) {
        assertThat(resolver.agrees(new BigDecimal(a), new BigDecimal(b))).isEqualTo(expected);
    }

    @Test
    void keyNormalizesCaseAndDefaults() {
        FactGroupKey explicit = FactGroupKey.normalized(" Total_Assets ", FactType.STOCK, LocalDate.of(2023, 12, 31),
            LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31), "Consolidated", "cny", "1", DEFAULTS);
        FactGroupKey defaulted = FactGroupKey.normalized("total_assets", FactType.STOCK, LocalDate.of(2023, 12, 31),
            null, null, null, null, null, DEFAULTS);

        assertThat(explicit).isEqualTo(defaulted);
        assertThat(explicit.asString()).isEqualTo("total_assets|stock|2023-12-31|consolidated|CNY|1");
    }
}
