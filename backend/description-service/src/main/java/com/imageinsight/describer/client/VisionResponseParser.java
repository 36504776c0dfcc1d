package com.imageinsight.describer.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imageinsight.describer.dto.AssetResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns vision API response bodies into {@link VisionApiResponse} values.
 *
 * Response shapes:
 *   - {"response_uri": "..."}                          still running, poll the URI
 *   - {"status": "queued" | "processing"}              still running
 *   - {"all": {"assets": [...], "errors": [...]}}      done (assets may carry backend errors)
 *   - {"error": "..."} / {"message": "..."}            rejected
 *
 * Asset shape: {"name": "...", "descriptions": [{"description": "...", "source": "gemini"}]}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisionResponseParser {

    static final int SNIPPET_LENGTH = 200;

    private final ObjectMapper objectMapper;

    public VisionApiResponse parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            log.debug("Response is not JSON: {}", e.getMessage());
            return VisionApiResponse.unknown(snippet(body));
        }
        if (root == null || !root.isObject()) {
            return VisionApiResponse.unknown(snippet(body));
        }

        JsonNode all = root.path("all");
        List<AssetResult> assets = parseAssets(all.path("assets"));
        List<String> errors = parseErrors(all.path("errors"));
        String responseUri = textOf(root, "response_uri");
        String status = textOf(root, "status");
        String message = firstNonBlank(textOf(root, "error"), textOf(root, "message"));
        Integer credits = root.path("credits").isNumber() ? root.get("credits").asInt() : null;

        VisionApiResponse.Kind kind;
        if (!assets.isEmpty()) {
            kind = VisionApiResponse.Kind.COMPLETED;
        } else if ("processing".equalsIgnoreCase(status) || "queued".equalsIgnoreCase(status) || responseUri != null) {
            kind = VisionApiResponse.Kind.PENDING;
        } else if (message != null) {
            kind = VisionApiResponse.Kind.REMOTE_ERROR;
        } else if (!errors.isEmpty()) {
            kind = VisionApiResponse.Kind.BACKEND_ERRORS;
        } else if (all.path("assets").isArray()) {
            kind = VisionApiResponse.Kind.EMPTY;
        } else {
            kind = VisionApiResponse.Kind.UNKNOWN;
        }

        return new VisionApiResponse(kind, responseUri, status, assets, errors, message, credits, snippet(body));
    }

    /**
     * Message for a non-2xx submit response: the body's error/message when it is JSON,
     * otherwise the status code and the start of the body.
     */
    public String extractErrorMessage(int statusCode, String body) {
        try {
            JsonNode node = objectMapper.readTree(body == null ? "" : body);
            if (node != null && node.isObject()) {
                String detail = firstNonBlank(textOf(node, "error"), textOf(node, "message"));
                return detail != null ? detail : "API error (" + statusCode + ")";
            }
        } catch (Exception e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return "API error (" + statusCode + "): " + snippet(body);
    }

    private List<AssetResult> parseAssets(JsonNode assetsNode) {
        List<AssetResult> assets = new ArrayList<>();
        if (!assetsNode.isArray()) {
            return assets;
        }
        for (JsonNode asset : assetsNode) {
            String name = firstNonBlank(textOf(asset, "name"), textOf(asset, "file_name"));
            List<AssetResult.Description> descriptions = new ArrayList<>();
            JsonNode descNode = asset.path("descriptions");
            if (descNode.isArray()) {
                for (JsonNode d : descNode) {
                    descriptions.add(new AssetResult.Description(
                            firstNonNull(textOf(d, "description"), textOf(d, "text"), ""),
                            firstNonBlank(textOf(d, "source"), textOf(d, "backend"))
                    ));
                }
            }
            assets.add(new AssetResult(name, descriptions));
        }
        return assets;
    }

    private static List<String> parseErrors(JsonNode errorsNode) {
        List<String> errors = new ArrayList<>();
        if (!errorsNode.isArray()) {
            return errors;
        }
        for (JsonNode e : errorsNode) {
            errors.add(e.isTextual() ? e.asText() : e.toString());
        }
        return errors;
    }

    static String snippet(String body) {
        if (body == null) return "";
        return body.length() > SNIPPET_LENGTH ? body.substring(0, SNIPPET_LENGTH) : body;
    }

    private static String textOf(JsonNode node, String field) {
        if (node == null || node.isNull()) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (v.isTextual()) return v.asText();
        return v.toString();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.trim().isEmpty()) return v;
        }
        return null;
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null) return v;
        }
        return null;
    }
}
