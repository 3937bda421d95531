package com.gentoro.specops.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Fingerprints a set of documentation files as {@code <type>:<root>:<md5>}. The digest covers
 * each file's path relative to the root and its modification time, in walk order, so editing,
 * touching, adding, removing or renaming a file yields a new key.
 */
public class CacheKeyGenerator {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(CacheKeyGenerator.class);

  public static final String NO_HASH = "no_hash";

  public String generate(String analysisType, Path root, List<Path> files) {
    String prefix = analysisType + ":" + root + ":";
    try {
      StringBuilder material = new StringBuilder();
      for (Path file : files) {
        material.append(root.relativize(file).toString().replace('\\', '/'));
        material.append('=').append(mtime(file)).append(';');
      }
      MessageDigest md5 = MessageDigest.getInstance("MD5");
      byte[] digest = md5.digest(material.toString().getBytes(StandardCharsets.UTF_8));
      return prefix + HexFormat.of().formatHex(digest);
    } catch (Exception e) {
      log.warn("Could not fingerprint {}; caching disabled for this call", root, e);
      return prefix + NO_HASH;
    }
  }

  public static boolean isCacheable(String key) {
    return key != null && !key.endsWith(":" + NO_HASH);
  }

  /** Epoch seconds with a microsecond fraction; "0" when the time cannot be read. */
  static String mtime(Path file) {
    try {
      FileTime time = Files.getLastModifiedTime(file);
      long micros = time.to(TimeUnit.MICROSECONDS);
      return String.format(
          Locale.ROOT,
          "%d.%06d",
          Math.floorDiv(micros, 1_000_000L),
          Math.floorMod(micros, 1_000_000L));
    } catch (IOException | SecurityException e) {
      log.debug("Unreadable modification time for {}: {}", file, e.getMessage());
      return "0";
    }
  }
}
