package org.jstats.pitchlens_api.modules.dataset.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Map;

public record EnumQualifier(QualifierKind kind, Enum<?> value) implements Qualifier {

    public EnumQualifier {
        var type = kind.valueType();
        if (type == null || !type.isInstance(value)) {
            throw new IllegalArgumentException("%s does not accept value %s".formatted(kind, value));
        }
    }

    @JsonCreator
    static EnumQualifier fromJson(@JsonProperty("kind") QualifierKind kind, @JsonProperty("value") String value) {
        var type = kind.valueType();
        if (type == null) {
            throw new IllegalArgumentException(kind + " is a flag qualifier");
        }
        return new EnumQualifier(kind, constant(type, value));
    }

    private static Enum<?> constant(Class<? extends Enum<?>> type, String name) {
        return Arrays.stream(type.getEnumConstants())
                .filter(constant -> constant.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "No %s constant named %s".formatted(type.getSimpleName(), name)));
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of(kind.attributeName() + "_type", value.name());
    }
}
