package org.jstats.pitchlens_api.modules.dataset.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Extra information attached to an event, e.g. the body part of a shot.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FlagQualifier.class, name = "flag"),
        @JsonSubTypes.Type(value = EnumQualifier.class, name = "enum")
})
public sealed interface Qualifier permits FlagQualifier, EnumQualifier {

    QualifierKind kind();

    /**
     * Flat representation, e.g. {@code is_counter_attack=true} or {@code set_piece_type=CORNER_KICK}.
     */
    Map<String, Object> toMap();
}
