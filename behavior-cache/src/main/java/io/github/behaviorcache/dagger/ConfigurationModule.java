package io.github.behaviorcache.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.behaviorcache.model.Configuration;
import io.github.behaviorcache.model.ProjectLayout;
import javax.inject.Singleton;

/**
 * Binds the caller's configuration into the graph.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Project layout.
   *
   * @return the project layout
   */
  @Provides
  @Singleton
  public ProjectLayout projectLayout() {
    return configuration.layout();
  }
}
