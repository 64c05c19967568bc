package com.companyintel.research.provider;

public final class JsonResponses {

    private JsonResponses() {
    }

    public static String extractJson(String raw) {
        if (raw == null) {
            return "";
        }
        String text = stripFences(raw.trim());
        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        int start;
        char close;
        if (objectStart < 0 && arrayStart < 0) {
            return text;
        } else if (arrayStart < 0 || (objectStart >= 0 && objectStart < arrayStart)) {
            start = objectStart;
            close = '}';
        } else {
            start = arrayStart;
            close = ']';
        }
        int end = text.lastIndexOf(close);
        if (end <= start) {
            return text.substring(start);
        }
        return text.substring(start, end + 1);
    }

    static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        String body = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
        int closing = body.lastIndexOf("```");
        return (closing >= 0 ? body.substring(0, closing) : body).trim();
    }
}
