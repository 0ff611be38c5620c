package com.chatguard.utils;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.io.CharSource;

public class FileUtil {

  static final Logger log = LogManager.getLogger(FileUtil.class);

  /**
   * Looks the file up on disk first, then on the class-path. Returns null if
   * it is in neither place.
   */
  public static InputStream findResourceAsStream(String filename)
      throws IOException {
    // First, lookup the file directly.
    File f = new File(filename);
    if (f.isFile()) return new FileInputStream(f);

    // Second, lookup the file in class-path.
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    InputStream stream = classLoader.getResourceAsStream(filename);
    if (stream == null) log.debug("Could not locate: {}", filename);
    return stream;
  }

  public static CharSource inputStreamToCharSource(
      final InputStream inputStream) {
    return new CharSource() {
        @Override
        public Reader openStream() throws IOException {
            return new BufferedReader(new InputStreamReader(inputStream,
                                      StandardCharsets.UTF_8));
        }
    };
  }

  /**
   * Loads a properties file from disk or class-path. A missing file yields
   * empty properties.
   */
  public static Properties loadProperties(String filename) throws IOException {
    Properties prop = new Properties();
    InputStream stream = findResourceAsStream(filename);
    if (stream == null) {
      log.warn("Could not find '{}', using defaults.", filename);
      return prop;
    }
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      prop.load(reader);
    }
    return prop;
  }

  private FileUtil() {
  }
}
