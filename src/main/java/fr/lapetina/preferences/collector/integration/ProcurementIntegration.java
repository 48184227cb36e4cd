package fr.lapetina.preferences.collector.integration;

import fr.lapetina.preferences.collector.infrastructure.http.RemoteClient;
import fr.lapetina.preferences.collector.pipeline.Collector;

/**
 * Collects comparisons from the procurement assistant: RFP analysis and proposal drafting.
 */
public class ProcurementIntegration extends PlatformIntegration {

    public static final String DOMAIN = "procurement";
    public static final String RFP_ANALYSIS = "rfp_analysis";
    public static final String PROPOSAL_WRITING = "proposal_writing";

    static final String RFP_PROMPT_PREFIX = "Analyze this RFP section:\n\n";
    static final String PROPOSAL_PROMPT_PREFIX = "Draft proposal section for:\n\n";

    public ProcurementIntegration(RemoteClient client) {
        this(Collector.builder().client(client));
    }

    public ProcurementIntegration(Collector.Builder builder) {
        super(DOMAIN, builder);
    }

    public boolean onRfpAnalysis(String rfpSection, String analysisA, String analysisB, String selected, String userId) {
        return onRfpAnalysis(rfpSection, analysisA, analysisB, selected, userId, RFP_ANALYSIS);
    }

    public boolean onRfpAnalysis(
            String rfpSection,
            String analysisA,
            String analysisB,
            String selected,
            String userId,
            String category
    ) {
        return record(RFP_PROMPT_PREFIX + rfpSection, analysisA, analysisB, selected, userId, category);
    }

    public boolean onProposalDraft(String requirement, String draftA, String draftB, String selected, String userId) {
        return record(PROPOSAL_PROMPT_PREFIX + requirement, draftA, draftB, selected, userId, PROPOSAL_WRITING);
    }
}
