package io.github.behaviorcache.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * The row groups records of another type; its artifact is attached to one of them. An empty
 * reference list means the row has no artifact at all.
 */
@Value.Immutable
public interface IndirectArtifact extends ArtifactLocation {

  List<RecordRef> references();
}
