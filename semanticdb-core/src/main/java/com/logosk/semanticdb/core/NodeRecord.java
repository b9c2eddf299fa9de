package com.logosk.semanticdb.core;

import com.logosk.semanticdb.exceptions.ValidationException;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A graph vertex. The well-known attributes are typed fields; anything else a caller
 * supplies is kept verbatim in {@link #extra}.
 */
@Data
@NoArgsConstructor
public class NodeRecord {

    private String id;
    private String weightId;
    private String type = "entity";
    private String meaning = "";
    private String creator = "system";
    private String domain = "general";
    private Instant createdAt;
    private long activationCount;
    private Instant lifespan;
    private EthicalStatus status = EthicalStatus.ACTIVE;
    private Map<String, Object> extra = new LinkedHashMap<>();

    public Map<String, Object> toAttributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("weight_id", weightId);
        attrs.put("type", type);
        attrs.put("meaning", meaning);
        attrs.put("creator", creator);
        attrs.put("domain", domain);
        attrs.put("created_at", createdAt != null ? createdAt.toString() : null);
        attrs.put("activation_count", activationCount);
        attrs.put("lifespan", lifespan != null ? lifespan.toString() : null);
        attrs.put("ethical_status", status.label());
        attrs.putAll(extra);
        return attrs;
    }

    /**
     * Overlays the given attribute map onto this node. Known keys are parsed into their
     * fields, the rest lands in {@link #extra}.
     */
    void applyAttributes(Map<String, ?> attributes) {
        if (attributes == null) {
            return;
        }
        try {
            attributes.forEach((key, value) -> {
                if (value == null) {
                    return;
                }
                switch (key) {
                    case "weight_id" -> weightId = value.toString();
                    case "type" -> type = value.toString();
                    case "meaning" -> meaning = value.toString();
                    case "creator" -> creator = value.toString();
                    case "domain" -> domain = value.toString();
                    case "created_at" -> createdAt = Instant.parse(value.toString());
                    case "activation_count" -> activationCount = value instanceof Number n
                            ? n.longValue() : Long.parseLong(value.toString());
                    case "lifespan" -> lifespan = Instant.parse(value.toString());
                    case "ethical_status" -> status = EthicalStatus.fromLabel(value.toString());
                    default -> extra.put(key, value);
                }
            });
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new ValidationException("Malformed attributes for node '" + id + "': " + e.getMessage(), e);
        }
    }
}
