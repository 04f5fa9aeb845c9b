package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A created, updated or closed issue as listed in a {@link RunSummary}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeEntry(@JsonProperty("external_id") String slug, @Nullable Integer number, @Nullable ChangeSet diff) {
}
