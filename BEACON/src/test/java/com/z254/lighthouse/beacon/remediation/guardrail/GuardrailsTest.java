package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.source.InMemorySnapshotSource;
import com.z254.lighthouse.beacon.detection.source.PageHealth;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.EntityType;
import com.z254.lighthouse.beacon.remediation.EstimatedImpact;
import com.z254.lighthouse.beacon.remediation.RemediationStep;
import com.z254.lighthouse.beacon.remediation.StepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuardrailsTest {

    private static final Entity KEYWORD = Entity.builder()
            .id("kw-1").type(EntityType.KEYWORD).product("acme").build();

    private BeaconProperties properties;

    @BeforeEach
    void setUp() {
        properties = new BeaconProperties();
    }

    private static ProposedAction action(String type, Map<String, Object> params) {
        return new ProposedAction(type, params, null, KEYWORD);
    }

    @Nested
    @DisplayName("BudgetGuardrail")
    class BudgetTests {

        @Test
        void blocksBudgetIncreaseOverLimit() {
            GuardrailResult result = new BudgetGuardrail(properties)
                    .check(action("increase_budget", Map.of("amount", 150)));

            assertThat(result.passed()).isFalse();
            assertThat(result.blocker()).isTrue();
            assertThat(result.reason()).isEqualTo("Budget increase 150.00 exceeds limit 100.00");
        }

        @Test
        void allowsBudgetIncreaseWithinLimit() {
            assertThat(new BudgetGuardrail(properties)
                    .check(action("increase_budget", Map.of("amount", 80))).passed()).isTrue();
        }

        @Test
        void warnsOnLargeBidChangeInEitherDirection() {
            BudgetGuardrail guardrail = new BudgetGuardrail(properties);

            GuardrailResult cut = guardrail.check(action("reduce_bids", Map.of("change", -0.3)));

            assertThat(cut.passed()).isFalse();
            assertThat(cut.blocker()).isFalse();
            assertThat(cut.reason()).isEqualTo("Bid change 30% exceeds 20%");
            assertThat(guardrail.check(action("adjust_bids", Map.of("change", -0.1))).passed()).isTrue();
        }
    }

    @Nested
    @DisplayName("SafetyGuardrail")
    class SafetyTests {

        @ParameterizedTest
        @ValueSource(strings = {"pause_campaign", "pause_ad_group", "remove_keyword"})
        void blocksDestructiveActions(String type) {
            GuardrailResult result = new SafetyGuardrail(properties).check(action(type, Map.of()));

            assertThat(result.blocker()).isTrue();
            assertThat(result.reason()).isEqualTo("Action " + type + " requires manual review");
        }

        @Test
        void warnsOnAggressiveBidIncreaseOnly() {
            SafetyGuardrail guardrail = new SafetyGuardrail(properties);

            GuardrailResult increase = guardrail.check(action("adjust_bid", Map.of("change", 0.15)));

            assertThat(increase.passed()).isFalse();
            assertThat(increase.blocker()).isFalse();
            assertThat(increase.reason()).isEqualTo("Bid increase of 15% is aggressive");
            assertThat(guardrail.check(action("adjust_bid", Map.of("change", -0.5))).passed()).isTrue();
        }
    }

    @Nested
    @DisplayName("ComplianceGuardrail")
    class ComplianceTests {

        @Test
        void blocksProhibitedClaimsCaseInsensitively() {
            GuardrailResult result = new ComplianceGuardrail(properties)
                    .check(action("create_rsa_variants", Map.of("text", "Guaranteed results in a week")));

            assertThat(result.blocker()).isTrue();
            assertThat(result.reason()).isEqualTo("Prohibited term in ad copy: guaranteed");
        }

        @Test
        void warnsOnTrademarkInHeadline() {
            properties.getRemediation().setTrademarkTerms(List.of("Nike"));

            GuardrailResult result = new ComplianceGuardrail(properties)
                    .check(action("create_rsa_variants", Map.of("headlines", List.of("Cheap shoes", "nike runners"))));

            assertThat(result.passed()).isFalse();
            assertThat(result.blocker()).isFalse();
            assertThat(result.reason()).isEqualTo("Trademark term in headline: nike");
        }

        @Test
        void passesCleanCopy() {
            assertThat(new ComplianceGuardrail(properties)
                    .check(action("create_rsa_variants", Map.of("text", "Fast delivery"))).passed()).isTrue();
        }
    }

    @Nested
    @DisplayName("LandingPageHealthGuardrail")
    class LandingPageTests {

        private InMemorySnapshotSource source;
        private LandingPageHealthGuardrail guardrail;

        @BeforeEach
        void setUp() {
            source = new InMemorySnapshotSource();
            guardrail = new LandingPageHealthGuardrail(source);
        }

        @Test
        void blocksTrafficToBrokenPage() {
            source.recordPageHealth(KEYWORD, PageHealth.builder()
                    .url("https://acme.test/sale").statusCode(404).noindex(true).build());

            GuardrailResult result = guardrail.check(action("create_landing_page_variants",
                    Map.of("url", "https://acme.test/sale")));

            assertThat(result.blocker()).isTrue();
            assertThat(result.reason()).isEqualTo("Landing page https://acme.test/sale unhealthy: HTTP 404, noindex");
        }

        @Test
        void warnsOnRedirectChain() {
            source.recordPageHealth(KEYWORD, PageHealth.builder()
                    .url("https://acme.test/").statusCode(200).redirectChain(3).build());

            GuardrailResult result = guardrail.check(action("update_final_url",
                    Map.of("final_url", "https://acme.test/")));

            assertThat(result.passed()).isFalse();
            assertThat(result.blocker()).isFalse();
        }

        @Test
        void passesUnknownPagesAndActionsWithoutUrl() {
            assertThat(guardrail.check(action("update_final_url", Map.of("url", "https://never.crawled/")))
                    .passed()).isTrue();
            assertThat(guardrail.check(action("add_negatives", Map.of())).passed()).isTrue();
        }
    }

    @Nested
    @DisplayName("ThresholdGuardrail")
    class ThresholdTests {

        @Test
        void failsOnlyMatchingActionOverThreshold() {
            ThresholdGuardrail guardrail = new ThresholdGuardrail("cap", "reduce_bids", 100, true, null);

            assertThat(guardrail.check(new ProposedAction("reduce_bids", Map.of(), 250.0, KEYWORD)).reason())
                    .isEqualTo("Estimated cost 250.00 exceeds 100.00");
            assertThat(guardrail.check(new ProposedAction("reduce_bids", Map.of(), 50.0, KEYWORD)).passed()).isTrue();
            assertThat(guardrail.check(new ProposedAction("add_negatives", Map.of(), 250.0, KEYWORD)).passed())
                    .isTrue();
            assertThat(guardrail.check(new ProposedAction("reduce_bids", Map.of(), null, KEYWORD)).passed()).isTrue();
        }

        @Test
        void usesConfiguredMessage() {
            BeaconProperties.GuardrailDefinition definition = new BeaconProperties.GuardrailDefinition();
            definition.setName("bid_cost_ceiling");
            definition.setType("reduce_bids");
            definition.setThreshold(10);
            definition.setMessage("Bid change too expensive");

            ThresholdGuardrail guardrail = ThresholdGuardrail.from(definition);

            assertThat(guardrail.getName()).isEqualTo("bid_cost_ceiling");
            assertThat(guardrail.isCritical()).isTrue();
            assertThat(guardrail.check(new ProposedAction("reduce_bids", Map.of(), 20.0, KEYWORD)).reason())
                    .isEqualTo("Bid change too expensive");
        }
    }

    @Nested
    @DisplayName("GuardrailEvaluator")
    class EvaluatorTests {

        @Test
        void nonCriticalWarningsDoNotSkipSteps() {
            GuardrailEvaluator evaluator = new GuardrailEvaluator(List.of(new SafetyGuardrail(properties)));
            RemediationStep step = RemediationStep.of("adjust_bid", Map.of("change", 0.5), StepStatus.APPLIED);

            GuardrailVerdict verdict = evaluator.evaluate(List.of(step), EstimatedImpact.none(), KEYWORD);

            assertThat(verdict.passed()).isTrue();
            assertThat(verdict.warnings()).containsExactly("safety: Bid increase of 50% is aggressive");
            assertThat(step.getStatus()).isEqualTo(StepStatus.APPLIED);
        }

        @Test
        void blockerFromNonCriticalGuardrailSkipsStep() {
            GuardrailEvaluator evaluator = new GuardrailEvaluator(List.of(new SafetyGuardrail(properties)));
            RemediationStep pause = RemediationStep.of("pause_campaign", Map.of(), StepStatus.APPLIED);
            RemediationStep negatives = RemediationStep.of("add_negatives", Map.of(), StepStatus.APPLIED);

            GuardrailVerdict verdict = evaluator.evaluate(List.of(pause, negatives), EstimatedImpact.none(), KEYWORD);

            assertThat(verdict.passed()).isFalse();
            assertThat(verdict.blockers()).containsExactly("safety: Action pause_campaign requires manual review");
            assertThat(verdict.blockedBy()).containsExactly("safety");
            assertThat(pause.getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(pause.getReason()).isEqualTo("safety: Action pause_campaign requires manual review");
            assertThat(negatives.getStatus()).isEqualTo(StepStatus.APPLIED);
        }

        @Test
        void keepsEveryBlockerReasonOnTheStep() {
            ThresholdGuardrail cap = new ThresholdGuardrail("cost_cap", "pause_campaign", 100, true, null);
            GuardrailEvaluator evaluator = new GuardrailEvaluator(List.of(new SafetyGuardrail(properties), cap));
            RemediationStep pause = RemediationStep.of("pause_campaign", Map.of(), StepStatus.APPLIED);

            GuardrailVerdict verdict = evaluator.evaluate(List.of(pause),
                    EstimatedImpact.builder().cost(250.0).build(), KEYWORD);

            assertThat(verdict.blockedBy()).containsExactly("safety", "cost_cap");
            assertThat(pause.getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(pause.getReason()).isEqualTo("safety: Action pause_campaign requires manual review; "
                    + "cost_cap: Estimated cost 250.00 exceeds 100.00");
        }

        @Test
        void guardrailExceptionAbortsEvaluation() {
            Guardrail broken = new Guardrail() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public boolean isCritical() {
                    return true;
                }

                @Override
                public GuardrailResult check(ProposedAction action) {
                    throw new IllegalStateException("policy store offline");
                }
            };
            GuardrailEvaluator evaluator = new GuardrailEvaluator(List.of(broken));

            assertThatThrownBy(() -> evaluator.evaluate(
                    List.of(RemediationStep.of("add_negatives", Map.of(), StepStatus.PENDING)), null, KEYWORD))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("policy store offline");
        }
    }
}
