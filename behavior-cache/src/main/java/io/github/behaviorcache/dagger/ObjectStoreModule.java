package io.github.behaviorcache.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.behaviorcache.model.Configuration;
import io.github.behaviorcache.store.LocalDirectoryObjectStoreClient;
import io.github.behaviorcache.store.ObjectStoreClient;
import io.github.behaviorcache.store.S3ObjectStoreClient;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Picks the object store: an explicitly supplied client, a local mirror directory, or the public
 * S3 bucket.
 */
@Module
public class ObjectStoreModule {

  private static final Logger log = LoggerFactory.getLogger(ObjectStoreModule.class);

  private final ObjectStoreClient override;

  /**
   * Select the store from the configuration.
   */
  public ObjectStoreModule() {
    this(null);
  }

  /**
   * Use the given client regardless of configuration.
   *
   * @param override the client, or null
   */
  public ObjectStoreModule(final ObjectStoreClient override) {
    this.override = override;
  }

  /**
   * Anonymous S3 client for the configured region. The releases are public.
   *
   * @param configuration the configuration
   * @return the s3 client
   */
  @Provides
  @Singleton
  public S3Client s3Client(final Configuration configuration) {
    return S3Client.builder()
        .region(Region.of(configuration.region()))
        .credentialsProvider(AnonymousCredentialsProvider.create())
        .httpClientBuilder(UrlConnectionHttpClient.builder())
        .build();
  }

  /**
   * Object store client.
   *
   * @param configuration the configuration
   * @param s3Client      the s3 client, built only when used
   * @return the object store client
   */
  @Provides
  @Singleton
  public ObjectStoreClient objectStoreClient(final Configuration configuration,
                                             final Provider<S3Client> s3Client) {
    if (override != null) {
      return override;
    }
    if (configuration.localStoreRoot().isPresent()) {
      log.info("Reading releases from local mirror {}", configuration.localStoreRoot().get());
      return new LocalDirectoryObjectStoreClient(configuration.localStoreRoot().get());
    }
    log.info("Reading releases from s3://{} ({})", configuration.bucket(), configuration.region());
    return new S3ObjectStoreClient(s3Client.get(), configuration.bucket());
  }
}
