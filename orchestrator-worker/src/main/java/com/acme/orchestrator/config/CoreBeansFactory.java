package com.acme.orchestrator.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Factory for the framework-free configuration POJOs of the core module. Properties are bound
 * from application.yml; anything left unset keeps the POJO default.
 */
@Factory
public class CoreBeansFactory {

  /** Creates ActivitiesConfig bean populated from application.yml activities.* properties */
  @Singleton
  @ConfigurationProperties("activities")
  public ActivitiesConfig activitiesConfig() {
    return new ActivitiesConfig();
  }

  /** Creates ObservabilityConfig bean populated from application.yml observability.* properties */
  @Singleton
  @ConfigurationProperties("observability")
  public ObservabilityConfig observabilityConfig() {
    return new ObservabilityConfig();
  }

  /** Creates StorageConfig bean populated from application.yml storage.* properties */
  @Singleton
  @ConfigurationProperties("storage")
  public StorageConfig storageConfig() {
    return new StorageConfig();
  }
}
