package com.example.vrf.config;

import com.example.vrf.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis connection for the durable replay store.
 * Supports both standalone and cluster modes with connection pooling.
 * Only active when {@code app.replay.durable-enabled=true}.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "app.replay", name = "durable-enabled", havingValue = "true")
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());

    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(poolProps.timeBetweenEvictionRuns());
    config.setMinEvictableIdleDuration(Duration.ofMinutes(1));
    config.setNumTestsPerEvictionRun(3);

    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    if ("cluster".equalsIgnoreCase(redisProps.mode()) &&
        redisProps.cluster() != null &&
        redisProps.cluster().nodes() != null &&
        !redisProps.cluster().nodes().isEmpty()) {
      log.info("Durable replay store: Redis cluster {}", redisProps.cluster().nodes());
      return createClusterConnectionFactory(clientResources, poolConfig);
    }
    log.info("Durable replay store: Redis {}:{}", redisProps.host(), redisProps.port());
    return createStandaloneConnectionFactory(clientResources, poolConfig);
  }

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisTemplate template = new StringRedisTemplate();
    template.setConnectionFactory(connectionFactory);
    template.afterPropertiesSet();
    return template;
  }

  private RedisConnectionFactory createStandaloneConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      redisConfig.setPassword(redisProps.password());
    }
    redisConfig.setDatabase(0);

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(createClientOptions(redisProps));

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);

    return factory;
  }

  private RedisConnectionFactory createClusterConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();
    ApplicationProperties.RedisProperties.ClusterProperties clusterProps = redisProps.cluster();

    RedisClusterConfiguration clusterConfig = new RedisClusterConfiguration();
    for (String node : clusterProps.nodes().split(",")) {
      String[] parts = node.trim().split(":");
      clusterConfig.addClusterNode(new RedisNode(parts[0], Integer.parseInt(parts[1])));
    }
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      clusterConfig.setPassword(redisProps.password());
    }
    clusterConfig.setMaxRedirects(clusterProps.maxRedirects());

    ClusterTopologyRefreshOptions topologyRefreshOptions =
        ClusterTopologyRefreshOptions.builder()
            .enablePeriodicRefresh(Duration.ofMinutes(1))
            .enableAllAdaptiveRefreshTriggers()
            .dynamicRefreshSources(true)
            .closeStaleConnections(true)
            .build();

    ClusterClientOptions.Builder optionsBuilder = ClusterClientOptions.builder()
        .topologyRefreshOptions(topologyRefreshOptions)
        .socketOptions(createSocketOptions(redisProps.timeout()))
        .validateClusterNodeMembership(false)
        .maxRedirects(clusterProps.maxRedirects())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()));
    if (redisProps.ssl().enabled()) {
      optionsBuilder.sslOptions(createSslOptions());
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .clientOptions(optionsBuilder.build())
            .commandTimeout(redisProps.timeout());

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    return new LettuceConnectionFactory(clusterConfig, builder.build());
  }

  /**
   * Commands are rejected while disconnected, so an outage surfaces immediately
   * and the replay store falls back to memory.
   */
  private ClientOptions createClientOptions(ApplicationProperties.RedisProperties redisProps) {
    ClientOptions.Builder builder = ClientOptions.builder()
        .socketOptions(createSocketOptions(redisProps.timeout()))
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .cancelCommandsOnReconnectFailure(false)
        .pingBeforeActivateConnection(true)
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()));

    if (redisProps.ssl().enabled()) {
      builder.sslOptions(createSslOptions());
    }

    return builder.build();
  }

  private SocketOptions createSocketOptions(Duration timeout) {
    return SocketOptions.builder()
        .connectTimeout(timeout)
        .keepAlive(true)
        .tcpNoDelay(true)
        .build();
  }

  private SslOptions createSslOptions() {
    return SslOptions.builder()
        .jdkSslProvider()
        .build();
  }
}
