package dev.sitepack.synthesis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidenceRecord(
    String sourceUrl, String excerpt, @Nullable String pageTitle, Instant extractedAt) {}
