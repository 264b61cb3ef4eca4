package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.studioflow.orchestrator.agent.ToolCall;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Estimates what a gated tool call will cost before the user approves it.
 *
 *   generate_assets : 6 credits per image
 *   generate_video  : 6 credits per second, billed as 5 s or 10 s
 *   anything else   : free
 */
@Component
public class CreditEstimator {

    public static final int IMAGE_CREDITS            = 6;
    public static final int VIDEO_CREDITS_PER_SECOND = 6;

    public CreditCost estimate(ToolCall call) {
        JsonNode args = call.arguments() == null ? MissingNode.getInstance() : call.arguments();
        return switch (call.name()) {
            case GenerateAssetsTool.NAME -> {
                int images = Math.max(1, args.path("assets").size());
                yield single(call, images * IMAGE_CREDITS,
                        images + " image(s) × " + IMAGE_CREDITS + " credits");
            }
            case GenerateVideoTool.NAME -> {
                int seconds = GenerateVideoTool.billedSeconds(args.path("duration").asInt(5));
                yield single(call, seconds * VIDEO_CREDITS_PER_SECOND,
                        seconds + "s video × " + VIDEO_CREDITS_PER_SECOND + " credits/s");
            }
            default -> single(call, 0, null);
        };
    }

    private static CreditCost single(ToolCall call, int credits, String details) {
        return CreditCost.of(List.of(new CreditCost.Item(call.id(), call.name(), credits, details)));
    }
}
