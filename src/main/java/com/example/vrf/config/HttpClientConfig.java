package com.example.vrf.config;

import com.example.vrf.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp client configuration
 *
 * Shared connection pool and dispatcher for every outbound collaborator. Each
 * collaborator gets its own client with a bounded call timeout, so a slow
 * dependency fails that step instead of holding the request.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

  private final ApplicationProperties properties;

  /**
   * Shared connection pool to reduce connection establishment overhead
   */
  @Bean
  public ConnectionPool sharedConnectionPool() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(),
                              TimeUnit.MINUTES);
  }

  /**
   * Shared dispatcher for concurrent request management
   */
  @Bean
  public Dispatcher sharedDispatcher() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Facilitator verify/settle/supported calls
   */
  @Bean(name = "facilitatorOkHttpClient")
  public OkHttpClient facilitatorOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    return boundedClient(connectionPool, dispatcher, properties.payment().verifyTimeout());
  }

  /**
   * TEE agent quote and key derivation calls
   */
  @Bean(name = "teeOkHttpClient")
  public OkHttpClient teeOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    return boundedClient(connectionPool, dispatcher, properties.tee().timeout());
  }

  /**
   * Proof uploads and remote quote verification
   */
  @Bean(name = "storageOkHttpClient")
  public OkHttpClient storageOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    return boundedClient(connectionPool, dispatcher, properties.commitment().uploadTimeout());
  }

  private OkHttpClient boundedClient(ConnectionPool connectionPool, Dispatcher dispatcher,
                                     Duration callTimeout) {
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(Math.min(callTimeout.toMillis(), 3000), TimeUnit.MILLISECONDS)
        .readTimeout(callTimeout)
        .writeTimeout(callTimeout)
        .callTimeout(callTimeout)
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
