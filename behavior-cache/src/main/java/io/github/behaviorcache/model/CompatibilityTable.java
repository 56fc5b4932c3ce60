package io.github.behaviorcache.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Which client versions may read data written by each producing-pipeline version. Bounds are
 * [min inclusive, max exclusive).
 */
@Value.Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(as = ImmutableCompatibilityTable.class)
@JsonDeserialize(as = ImmutableCompatibilityTable.class)
public interface CompatibilityTable {

  /**
   * The data_pipeline entry of the manifest to check.
   */
  @JsonProperty("pipeline_name")
  String pipelineName();

  /**
   * The consumer whose bounds apply to this client.
   */
  @JsonProperty("consumer_name")
  String consumerName();

  /**
   * Pipeline version to consumer name to [min, max).
   */
  @JsonProperty("pipeline_versions")
  Map<String, Map<String, List<String>>> pipelineVersions();

  /**
   * Bounds registered for a pipeline version and this table's consumer.
   *
   * @param pipelineVersion the pipeline version
   * @return [min, max) if registered
   */
  default Optional<List<String>> bounds(final String pipelineVersion) {
    final Map<String, List<String>> consumers = pipelineVersions().get(pipelineVersion);
    if (consumers == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(consumers.get(consumerName()));
  }
}
