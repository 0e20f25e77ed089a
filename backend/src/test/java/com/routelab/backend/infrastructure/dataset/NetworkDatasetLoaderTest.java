package com.routelab.backend.infrastructure.dataset;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.lang.NonNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link NetworkDatasetLoader}.
 * Resources are simulated with small in-memory ResourceLoader implementations,
 * apart from one test that reads the bundled dataset from the classpath.
 */
class NetworkDatasetLoaderTest {

  /**
   * Happy-path test:
   * An existing resource is accepted and its content is streamed unchanged.
   */
  @Test
  void constructor_shouldSucceedWhenResourceExists_andOpenStreamReturnsContent() throws IOException {
    // given
    String location = "classpath:test/network.json";
    String expectedContent = """
        {
          "airports": [],
          "flights": []
        }
        """;

    // when
    NetworkDatasetLoader loader = new NetworkDatasetLoader(location, new ExistingResourceLoader(expectedContent));

    // then
    assertEquals(location, loader.getLocation());
    try (InputStream is = loader.openDatasetStream()) {
      assertEquals(expectedContent, new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  @Test
  void constructor_shouldResolveBundledDatasetFromClasspath() throws IOException {
    NetworkDatasetLoader loader = new NetworkDatasetLoader(
        "classpath:datasets/example-network.json", new DefaultResourceLoader());

    try (InputStream is = loader.openDatasetStream()) {
      String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      assertTrue(content.contains("\"airports\""));
    }
  }

  /**
   * Failure case:
   * A missing resource fails start-up and the message names the location.
   */
  @Test
  void constructor_shouldFailWhenResourceDoesNotExist() {
    // given
    String location = "classpath:nonexistent/network.json";

    // when / then
    IllegalStateException ex = assertThrows(
        IllegalStateException.class,
        () -> new NetworkDatasetLoader(location, new NonExistingResourceLoader())
    );
    assertTrue(ex.getMessage().contains(location), "Exception message should mention the missing location");
  }

  /**
   * Edge case:
   * Read failures of an existing resource reach the caller as IOException.
   */
  @Test
  void openDatasetStream_shouldPropagateIOExceptionFromResource() {
    NetworkDatasetLoader loader = new NetworkDatasetLoader("classpath:test/network.json", new FailingOnReadResourceLoader());

    assertThrows(IOException.class, loader::openDatasetStream);
  }

  // --------------------------------------------------------------------------
  // Test helpers
  // --------------------------------------------------------------------------

  private static class ExistingResourceLoader implements ResourceLoader {

    private final Resource resource;

    ExistingResourceLoader(String content) {
      this.resource = new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    @NonNull
    public Resource getResource(@NonNull String location) {
      return resource;
    }

    @Override
    public ClassLoader getClassLoader() {
      return getClass().getClassLoader();
    }
  }

  private static class NonExistingResourceLoader implements ResourceLoader {

    @Override
    @NonNull
    public Resource getResource(@NonNull String location) {
      return new ByteArrayResource(new byte[0]) {
        @Override
        public boolean exists() {
          return false;
        }
      };
    }

    @Override
    public ClassLoader getClassLoader() {
      return getClass().getClassLoader();
    }
  }

  private static class FailingOnReadResourceLoader implements ResourceLoader {

    @Override
    @NonNull
    public Resource getResource(@NonNull String location) {
      return new ByteArrayResource(new byte[0]) {
        @Override
        @NonNull
        public InputStream getInputStream() throws IOException {
          throw new IOException("Simulated read failure");
        }
      };
    }

    @Override
    public ClassLoader getClassLoader() {
      return getClass().getClassLoader();
    }
  }
}
