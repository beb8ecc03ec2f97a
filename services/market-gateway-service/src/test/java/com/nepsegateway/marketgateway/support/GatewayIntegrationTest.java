package com.nepsegateway.marketgateway.support;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nepsegateway.marketgateway.client.UpstreamClient;
import com.nepsegateway.marketgateway.client.UpstreamPaths;
import com.nepsegateway.marketgateway.internal.ProcessRestarter;
import com.nepsegateway.marketgateway.snapshot.SnapshotUpdater;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;

/**
 * Full server on a random port with the upstream replaced. Every test gets its own client address
 * so rate-limit windows do not leak between tests sharing the cached context.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class GatewayIntegrationTest {

  @LocalServerPort protected int port;

  @Autowired protected TestRestTemplate http;

  @Autowired protected ObjectMapper objectMapper;

  @MockBean protected UpstreamClient upstream;

  @MockBean protected ProcessRestarter restarter;

  @MockBean protected SnapshotUpdater snapshotUpdater;

  protected String clientAddress;

  @BeforeEach
  void marketClosedByDefault() {
    clientAddress = "198.51.100." + UUID.randomUUID().toString().substring(0, 8);
    when(upstream.fetch(anyString()))
        .thenAnswer(
            invocation ->
                UpstreamPaths.MARKET_OPEN.equals(invocation.getArgument(0))
                    ? objectMapper.readTree("{\"isOpen\":\"CLOSE\"}")
                    : objectMapper.createArrayNode());
  }

  protected String url(String path) {
    return "http://localhost:" + port + path;
  }
}
