package io.github.behaviorcache.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One entry of the manifest's data_pipeline list: a tool that produced the release and its
 * version.
 */
@Value.Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(as = ImmutablePipelineVersion.class)
@JsonDeserialize(as = ImmutablePipelineVersion.class)
public interface PipelineVersion {

  /**
   * Pipeline name (e.g. "AllenSDK").
   */
  String name();

  /**
   * Version of the pipeline that wrote the data.
   */
  String version();

  /**
   * Free text, not interpreted.
   */
  Optional<String> comment();
}
