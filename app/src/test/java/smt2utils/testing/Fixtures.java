package smt2utils.testing;

import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/** Loads the sample inputs under {@code src/test/resources/fixtures}. */
public final class Fixtures {
  private static final String ROOT = "fixtures/";

  private Fixtures() {}

  public static String read(String name) {
    URL url = Resources.getResource(ROOT + name);
    try {
      return Resources.toString(url, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot read fixture " + name, ex);
    }
  }
}
