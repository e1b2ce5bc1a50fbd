package org.jstats.pitchlens_api.modules.dataset.model;

import java.util.Map;

public record FlagQualifier(QualifierKind kind, boolean value) implements Qualifier {

    public FlagQualifier {
        if (!kind.isFlag()) {
            throw new IllegalArgumentException(kind + " is not a flag qualifier");
        }
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of("is_" + kind.attributeName(), value);
    }
}
