package fr.lapetina.preferences.collector.integration;

import fr.lapetina.preferences.collector.domain.model.Preference;
import fr.lapetina.preferences.collector.domain.model.QueuedRecord;
import fr.lapetina.preferences.collector.pipeline.Collector;
import fr.lapetina.preferences.collector.pipeline.RecordingClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlatformIntegrationTest {

    private static final String ANSWER_A =
            "The first answer walks through the relevant factors one by one and cites the governing rule.";
    private static final String ANSWER_B =
            "The second answer summarizes the key considerations and recommends a concrete next step.";

    private RecordingClient client;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
    }

    private Collector.Builder builder() {
        return Collector.builder().client(client).autoFlush(false);
    }

    private QueuedRecord onlyRecord() {
        assertThat(client.getReceived()).hasSize(1);
        return client.getReceived().get(0);
    }

    @Nested
    @DisplayName("defense scenes")
    class DefenseScenes {

        @Test
        @DisplayName("should record scene comparisons under the defense domain")
        void shouldRecordSceneComparison() {
            try (DefenseSceneIntegration integration = new DefenseSceneIntegration(builder())) {
                boolean accepted = integration.onSceneComparison(
                        "Reconstruct the compound from the drone pass", ANSWER_A, ANSWER_B, "A", "analyst_7");
                integration.stop();

                assertThat(accepted).isTrue();
                QueuedRecord record = onlyRecord();
                assertThat(record.domain()).isEqualTo(DefenseSceneIntegration.DOMAIN);
                assertThat(record.category()).isEqualTo(DefenseSceneIntegration.DEFAULT_SCENE_TYPE);
                assertThat(record.submission().prompt()).isEqualTo("Reconstruct the compound from the drone pass");
                assertThat(record.submission().chosen()).isEqualTo(Preference.A);
            }
        }

        @Test
        @DisplayName("should use the given scene type as category")
        void shouldUseSceneType() {
            try (DefenseSceneIntegration integration = new DefenseSceneIntegration(builder())) {
                integration.onSceneComparison(
                        "Fuse the radar and EO tracks for this scene", ANSWER_A, ANSWER_B, "B", "analyst_7",
                        "sensor_fusion");
                integration.flush();

                assertThat(onlyRecord().category()).isEqualTo("sensor_fusion");
            }
        }
    }

    @Nested
    @DisplayName("procurement")
    class Procurement {

        @Test
        @DisplayName("should prefix RFP analysis prompts")
        void shouldPrefixRfpPrompt() {
            try (ProcurementIntegration integration = new ProcurementIntegration(builder())) {
                integration.onRfpAnalysis("Section M evaluation factors", ANSWER_A, ANSWER_B, "tie", "buyer_1");
                integration.flush();

                QueuedRecord record = onlyRecord();
                assertThat(record.domain()).isEqualTo("procurement");
                assertThat(record.category()).isEqualTo(ProcurementIntegration.RFP_ANALYSIS);
                assertThat(record.submission().prompt())
                        .isEqualTo("Analyze this RFP section:\n\nSection M evaluation factors");
                assertThat(record.submission().chosen()).isEqualTo(Preference.TIE);
            }
        }

        @Test
        @DisplayName("should file proposal drafts under proposal writing")
        void shouldFileProposalDrafts() {
            try (ProcurementIntegration integration = new ProcurementIntegration(builder())) {
                integration.onProposalDraft("Past performance volume", ANSWER_A, ANSWER_B, "B", "buyer_1");
                integration.flush();

                QueuedRecord record = onlyRecord();
                assertThat(record.category()).isEqualTo(ProcurementIntegration.PROPOSAL_WRITING);
                assertThat(record.submission().prompt()).startsWith("Draft proposal section for:\n\n");
            }
        }
    }

    @Nested
    @DisplayName("halal compliance")
    class HalalCompliance {

        @Test
        @DisplayName("should record ingredient checks")
        void shouldRecordIngredientCheck() {
            try (HalalComplianceIntegration integration = new HalalComplianceIntegration(builder())) {
                integration.onIngredientCheck("E471 mono- and diglycerides", ANSWER_A, ANSWER_B, "A", "auditor_3");
                integration.flush();

                QueuedRecord record = onlyRecord();
                assertThat(record.domain()).isEqualTo("halal");
                assertThat(record.category()).isEqualTo(HalalComplianceIntegration.INGREDIENT_ANALYSIS);
                assertThat(record.submission().prompt())
                        .isEqualTo("Assess halal status of ingredient: E471 mono- and diglycerides");
            }
        }

        @Test
        @DisplayName("should reject an unknown choice label")
        void shouldRejectUnknownChoice() {
            try (HalalComplianceIntegration integration = new HalalComplianceIntegration(builder())) {
                boolean accepted = integration.onIngredientCheck("Carmine", ANSWER_A, ANSWER_B, "C", "auditor_3");

                assertThat(accepted).isFalse();
                assertThat(integration.stats().rejectedQuality()).isEqualTo(1);
            }
        }
    }

    @Test
    @DisplayName("should build its own collector from a remote client")
    void shouldBuildFromClient() {
        try (ProcurementIntegration integration = new ProcurementIntegration(client)) {
            assertThat(integration.getCollector().getDomain()).isEqualTo("procurement");
            assertThat(integration.getCollector().isAutoFlushRunning()).isTrue();
        }
    }
}
