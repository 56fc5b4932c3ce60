package io.github.behaviorcache.model;

/**
 * Layouts of the released projects.
 */
public final class ProjectLayouts {

  public static final String BEHAVIOR_SESSION = "behavior_session";
  public static final String OPHYS_SESSION = "ophys_session";
  public static final String OPHYS_EXPERIMENT = "ophys_experiment";

  private ProjectLayouts() {
  }

  /**
   * The visual-behavior-ophys release. Sessions with imaging carry no file of their own and point
   * at their experiments; behavior-only sessions and experiments carry a file id.
   *
   * @return the project layout
   */
  public static ProjectLayout visualBehaviorOphys() {
    return ImmutableProjectLayout.builder()
        .addRecordTypes(ImmutableRecordType.builder()
            .name(BEHAVIOR_SESSION)
            .tableName("behavior_session_table")
            .primaryKeyColumn("behavior_session_id")
            .referenceColumn("ophys_experiment_id")
            .referencedRecordType(OPHYS_EXPERIMENT)
            .build())
        .addRecordTypes(ImmutableRecordType.builder()
            .name(OPHYS_SESSION)
            .tableName("ophys_session_table")
            .primaryKeyColumn("ophys_session_id")
            .referenceColumn("ophys_experiment_id")
            .referencedRecordType(OPHYS_EXPERIMENT)
            .build())
        .addRecordTypes(ImmutableRecordType.builder()
            .name(OPHYS_EXPERIMENT)
            .tableName("ophys_experiment_table")
            .primaryKeyColumn("ophys_experiment_id")
            .build())
        .addStructuredColumns("ophys_experiment_id", "ophys_container_id", "driver_line")
        .build();
  }
}
