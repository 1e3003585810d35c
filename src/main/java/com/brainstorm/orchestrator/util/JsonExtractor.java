package com.brainstorm.orchestrator.util;

/**
 * Pulls the JSON payload out of model output that may be wrapped in a
 * markdown fence or surrounded by prose.
 */
public final class JsonExtractor {

    private JsonExtractor() {
    }

    public static String extract(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        int fence = text.indexOf("```");
        if (fence >= 0) {
            int bodyStart = text.indexOf('\n', fence);
            int fenceEnd = text.indexOf("```", fence + 3);
            if (bodyStart >= 0 && fenceEnd > bodyStart) {
                text = text.substring(bodyStart + 1, fenceEnd).trim();
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return text;
    }
}
