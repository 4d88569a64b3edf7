package org.bacteria.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TaxonPage(JsonNode results, String next, Integer count) {

    public static TaxonPage empty() {
        return new TaxonPage(null, null, 0);
    }

    public List<String> identifiers() {
        List<String> ids = new ArrayList<>();
        if (results == null || results.isNull()) {
            return ids;
        }
        if (results.isObject()) {
            results.fieldNames().forEachRemaining(ids::add);
        } else if (results.isArray()) {
            // some deployments list bare identifiers instead of an id-keyed object
            results.forEach(node -> {
                if (node.isValueNode()) {
                    ids.add(node.asText());
                }
            });
        }
        return ids;
    }

    public boolean hasNext() {
        return StringUtils.hasText(next);
    }
}
