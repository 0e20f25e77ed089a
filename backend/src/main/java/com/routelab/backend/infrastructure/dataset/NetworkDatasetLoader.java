package com.routelab.backend.infrastructure.dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Locates the JSON document holding the airport and flight records.
 * Fails at start-up when the configured resource does not exist.
 */
@Component
public class NetworkDatasetLoader {

  private static final Logger log = LoggerFactory.getLogger(NetworkDatasetLoader.class);

  private final String location;
  private final Resource datasetResource;

  public NetworkDatasetLoader(
      @Value("${routelab.dataset.location:classpath:static/flights.json}") String location,
      ResourceLoader resourceLoader
  ) {
    this.location = location;
    this.datasetResource = resourceLoader.getResource(location);

    if (!this.datasetResource.exists()) {
      log.error("Network dataset resource does not exist at location: {}", location);
      throw new IllegalStateException("Network dataset not found at: " + location);
    }

    log.info("Using network dataset at {}", location);
  }

  public String getLocation() {
    return location;
  }

  public InputStream openDatasetStream() throws IOException {
    return datasetResource.getInputStream();
  }
}
