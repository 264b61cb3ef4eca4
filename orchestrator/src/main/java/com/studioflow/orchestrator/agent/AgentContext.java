package com.studioflow.orchestrator.agent;

import java.util.List;

/**
 * What the user currently has open in the editor, sent with every new turn.
 */
public record AgentContext(String projectId, String activeView, List<String> selectedAssetIds) {

    public List<String> selectedAssetIds() {
        return selectedAssetIds == null ? List.of() : selectedAssetIds;
    }
}
