// Copyright 2026 The Name Registry Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package nameregistry.config;

import static com.google.common.base.Suppliers.memoize;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Resources;
import dagger.Module;
import dagger.Provides;
import jakarta.inject.Qualifier;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.net.URL;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import nameregistry.persistence.StorageType;
import org.joda.time.Duration;
import org.joda.time.Period;
import org.yaml.snakeyaml.Yaml;

/**
 * Central clearing-house for all configuration.
 *
 * <p>This class does not represent the total configuration of the registry; it is only the
 * settings that are read from {@code files/default-config.yaml}, optionally overridden by the
 * {@code files/env-<environment>.yaml} file for the environment named by the {@value
 * #ENVIRONMENT_PROPERTY} system property.
 */
public final class RegistryConfig {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** System property naming the environment whose overrides are applied. */
  public static final String ENVIRONMENT_PROPERTY = "nameregistry.environment";

  private static final String YAML_CONFIG_DEFAULT = "files/default-config.yaml";
  private static final String YAML_CONFIG_ENV_TEMPLATE = "files/env-%s.yaml";

  private RegistryConfig() {}

  /** Dagger qualifier for configuration settings. */
  @Qualifier
  @Documented
  @Retention(RUNTIME)
  public @interface Config {
    String value() default "";
  }

  /** Dagger module that provides all configuration settings. */
  @Module
  public static final class ConfigModule {

    private ConfigModule() {}

    @Provides
    @Singleton
    static RegistryConfigSettings provideRegistryConfigSettings() {
      return CONFIG_SETTINGS.get();
    }

    /** Extensions (the part after the separator) that domains may be registered under. */
    @Provides
    @Config("supportedExtensions")
    public static ImmutableSet<String> provideSupportedExtensions(RegistryConfigSettings config) {
      return ImmutableSet.copyOf(config.domainPolicy.supportedExtensions);
    }

    /** Shortest allowed name, in code points. */
    @Provides
    @Config("minNameLength")
    public static int provideMinNameLength(RegistryConfigSettings config) {
      return config.domainPolicy.minNameLength;
    }

    /** Longest allowed name, in code points. */
    @Provides
    @Config("maxNameLength")
    public static int provideMaxNameLength(RegistryConfigSettings config) {
      return config.domainPolicy.maxNameLength;
    }

    /** Shortest registration period a claim may ask for. */
    @Provides
    @Config("minClaimDuration")
    public static Duration provideMinClaimDuration(RegistryConfigSettings config) {
      return parseDuration(config.domainPolicy.minClaimDuration);
    }

    /** Longest registration period a claim may ask for. */
    @Provides
    @Config("maxClaimDuration")
    public static Duration provideMaxClaimDuration(RegistryConfigSettings config) {
      return parseDuration(config.domainPolicy.maxClaimDuration);
    }

    @Provides
    @Config("storageType")
    public static StorageType provideStorageType(RegistryConfigSettings config) {
      return StorageType.valueOf(config.storage.type);
    }

    /** Directory holding the store files when {@link StorageType#JSON_FILE} is used. */
    @Provides
    @Config("storageDirectory")
    public static Path provideStorageDirectory(RegistryConfigSettings config) {
      return Path.of(config.storage.directory);
    }
  }

  /**
   * Memoizes loading of the {@link RegistryConfigSettings} POJO.
   *
   * <p>Memoizing without cache expiration is used because the process must be restarted in order
   * to change the contents of the YAML config files.
   */
  @VisibleForTesting
  public static final Supplier<RegistryConfigSettings> CONFIG_SETTINGS =
      memoize(
          () ->
              getEnvironmentConfigSettings(
                  Optional.ofNullable(System.getProperty(ENVIRONMENT_PROPERTY))));

  /** Loads the default settings, overridden by those of {@code environment} if it has any. */
  static RegistryConfigSettings getEnvironmentConfigSettings(Optional<String> environment) {
    String defaultYaml = readConfigResource(YAML_CONFIG_DEFAULT).orElseThrow();
    Optional<String> overrideYaml =
        environment.flatMap(
            env -> readConfigResource(String.format(YAML_CONFIG_ENV_TEMPLATE, env)));
    environment.ifPresent(
        env ->
            logger.atInfo().log(
                "Loading registry config for environment %s (%s).",
                env, overrideYaml.isPresent() ? "with overrides" : "no overrides found"));
    return getConfigSettings(defaultYaml, overrideYaml, RegistryConfigSettings.class);
  }

  /**
   * Deserializes {@code defaultYaml} into {@code clazz}, after recursively replacing any value
   * that {@code overrideYaml} also sets.
   */
  @VisibleForTesting
  static <T> T getConfigSettings(
      String defaultYaml, Optional<String> overrideYaml, Class<T> clazz) {
    Yaml yaml = new Yaml();
    Map<String, Object> merged = yaml.load(defaultYaml);
    if (overrideYaml.isPresent()) {
      Map<String, Object> overrides = yaml.load(overrideYaml.get());
      if (overrides != null) {
        merged = mergeMaps(merged, overrides);
      }
    }
    return yaml.loadAs(yaml.dump(merged), clazz);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mergeMaps(
      Map<String, Object> original, Map<String, Object> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>(original);
    for (Map.Entry<String, Object> override : overrides.entrySet()) {
      Object existing = merged.get(override.getKey());
      if (existing instanceof Map && override.getValue() instanceof Map) {
        merged.put(
            override.getKey(),
            mergeMaps((Map<String, Object>) existing, (Map<String, Object>) override.getValue()));
      } else {
        merged.put(override.getKey(), override.getValue());
      }
    }
    return merged;
  }

  /**
   * Parses an ISO-8601 period such as {@code PT1S} or {@code P365D} into a fixed-length duration.
   *
   * @throws IllegalArgumentException if the period is malformed or uses months or years
   */
  @VisibleForTesting
  static Duration parseDuration(String isoPeriod) {
    try {
      return Period.parse(isoPeriod).toStandardDuration();
    } catch (UnsupportedOperationException e) {
      throw new IllegalArgumentException(
          String.format("Period %s is not of a fixed length", isoPeriod), e);
    }
  }

  private static Optional<String> readConfigResource(String path) {
    URL url = RegistryConfig.class.getResource(path);
    if (url == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Resources.toString(url, UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(String.format("Could not read config file %s", path), e);
    }
  }
}
