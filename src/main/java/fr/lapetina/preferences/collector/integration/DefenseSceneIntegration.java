package fr.lapetina.preferences.collector.integration;

import fr.lapetina.preferences.collector.infrastructure.http.RemoteClient;
import fr.lapetina.preferences.collector.pipeline.Collector;

/**
 * Collects scene reconstruction comparisons from the defense world-model viewer.
 */
public class DefenseSceneIntegration extends PlatformIntegration {

    public static final String DOMAIN = "defense_wm";
    public static final String DEFAULT_SCENE_TYPE = "3d_reconstruction";

    public DefenseSceneIntegration(RemoteClient client) {
        this(Collector.builder().client(client));
    }

    public DefenseSceneIntegration(Collector.Builder builder) {
        super(DOMAIN, builder);
    }

    /**
     * Records which of two rendered scene descriptions the user preferred for a query.
     * The query is used as the prompt as-is.
     */
    public boolean onSceneComparison(String query, String sceneA, String sceneB, String selected, String userId) {
        return onSceneComparison(query, sceneA, sceneB, selected, userId, DEFAULT_SCENE_TYPE);
    }

    public boolean onSceneComparison(
            String query,
            String sceneA,
            String sceneB,
            String selected,
            String userId,
            String sceneType
    ) {
        return record(query, sceneA, sceneB, selected, userId, sceneType);
    }
}
