package uk.gegc.surveylink.features.onelink.application;

import java.util.Map;

public record LinkError(LinkErrorKind kind, String message, Map<String, Object> details) {

    public LinkError {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static LinkError of(LinkErrorKind kind, String message) {
        return new LinkError(kind, message, Map.of());
    }
}
