package fr.lapetina.preferences.collector.integration;

import fr.lapetina.preferences.collector.infrastructure.http.RemoteClient;
import fr.lapetina.preferences.collector.pipeline.Collector;

/**
 * Collects ingredient assessments from the halal compliance checker.
 */
public class HalalComplianceIntegration extends PlatformIntegration {

    public static final String DOMAIN = "halal";
    public static final String INGREDIENT_ANALYSIS = "ingredient_analysis";

    static final String INGREDIENT_PROMPT_PREFIX = "Assess halal status of ingredient: ";

    public HalalComplianceIntegration(RemoteClient client) {
        this(Collector.builder().client(client));
    }

    public HalalComplianceIntegration(Collector.Builder builder) {
        super(DOMAIN, builder);
    }

    public boolean onIngredientCheck(
            String ingredient,
            String assessmentA,
            String assessmentB,
            String selected,
            String userId
    ) {
        return record(INGREDIENT_PROMPT_PREFIX + ingredient, assessmentA, assessmentB, selected, userId,
                INGREDIENT_ANALYSIS);
    }
}
