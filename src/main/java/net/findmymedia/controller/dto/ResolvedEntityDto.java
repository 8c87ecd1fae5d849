package net.findmymedia.controller.dto;

import net.findmymedia.model.ExternalIdType;
import net.findmymedia.model.ResolvedEntity;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** DTO representing a resolved entity in API responses, using lowercase wire names. */
public record ResolvedEntityDto(String id,
                                String source,
                                String title,
                                String url,
                                String type,
                                Integer year,
                                String description,
                                String imageUrl,
                                String wikipediaUrl,
                                Map<String, String> externalIds) {

    public static ResolvedEntityDto from(ResolvedEntity entity) {
        Map<String, String> ids = new LinkedHashMap<>();
        for (Map.Entry<ExternalIdType, String> entry : entity.externalIds().entrySet()) {
            ids.put(entry.getKey().getKey(), entry.getValue());
        }
        return new ResolvedEntityDto(
            entity.id(),
            entity.source().name().toLowerCase(Locale.ROOT),
            entity.title(),
            entity.url(),
            entity.type().getWireName(),
            entity.year(),
            entity.description(),
            entity.imageUrl(),
            entity.wikipediaUrl(),
            ids
        );
    }
}
