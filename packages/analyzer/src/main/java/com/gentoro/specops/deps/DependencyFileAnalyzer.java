package com.gentoro.specops.deps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.specops.discovery.ContentReader;
import com.gentoro.specops.exception.SpecOpsException;
import com.gentoro.specops.exception.ValidationException;
import com.gentoro.specops.model.Dependency;
import com.gentoro.specops.model.DependencyType;
import com.gentoro.specops.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads package manifests at a repository root (Python, Node, Ruby, Rust, Go and PHP) and
 * returns the dependencies they declare. A manifest that cannot be read or parsed is logged and
 * skipped; an entry whose version cannot be normalized is dropped.
 */
public class DependencyFileAnalyzer {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(DependencyFileAnalyzer.class);

  private static final Pattern PYTHON_REQUIREMENT =
      Pattern.compile("^([A-Za-z0-9_.\\-]+)\\s*(?:\\[[^\\]]*\\])?\\s*((?:[<>=!~]=?|===).*)?$");
  private static final Pattern INSTALL_REQUIRES =
      Pattern.compile("install_requires\\s*=\\s*\\[(.*?)\\]", Pattern.DOTALL);
  private static final Pattern QUOTED = Pattern.compile("[\"']([^\"']+)[\"']");
  private static final Pattern GEM =
      Pattern.compile("^gem\\s+['\"]([^'\"]+)['\"](?:\\s*,\\s*['\"]([^'\"]+)['\"])?");

  /** Manifest file names in the order they are read. */
  public static final List<String> MANIFESTS =
      List.of(
          "requirements.txt",
          "setup.py",
          "pyproject.toml",
          "Pipfile",
          "package.json",
          "Gemfile",
          "Cargo.toml",
          "go.mod",
          "composer.json");

  @FunctionalInterface
  private interface ManifestParser {
    List<Dependency> parse(String content, String fileName) throws Exception;
  }

  private final ContentReader reader;
  private final Map<String, ManifestParser> parsers;

  public DependencyFileAnalyzer(ContentReader reader) {
    this.reader = reader;
    this.parsers =
        Map.of(
            "requirements.txt", this::parseRequirements,
            "setup.py", this::parseSetupPy,
            "pyproject.toml", this::parsePyproject,
            "Pipfile", this::parsePipfile,
            "package.json", this::parsePackageJson,
            "Gemfile", this::parseGemfile,
            "Cargo.toml", this::parseCargo,
            "go.mod", this::parseGoMod,
            "composer.json", this::parseComposer);
  }

  public List<Dependency> analyze(Path root) {
    List<Dependency> out = new ArrayList<>();
    if (root == null || !Files.isDirectory(root)) {
      return out;
    }
    for (String name : MANIFESTS) {
      Path file = root.resolve(name);
      if (!Files.isRegularFile(file)) continue;
      try {
        List<Dependency> found = parsers.get(name).parse(reader.read(file), name);
        log.debug("{} declares {} dependencies", file, found.size());
        out.addAll(found);
      } catch (SpecOpsException e) {
        log.warn("Skipping manifest {}: {}", file, e.getMessage());
      } catch (Exception e) {
        log.warn("Could not parse manifest {}", file, e);
      }
    }
    return out;
  }

  List<Dependency> parseRequirements(String content, String fileName) {
    List<Dependency> out = new ArrayList<>();
    for (String raw : content.split("\\R")) {
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith("#") || line.startsWith("-")) continue;
      addPythonRequirement(out, line, DependencyType.RUNTIME, fileName);
    }
    return out;
  }

  List<Dependency> parseSetupPy(String content, String fileName) {
    List<Dependency> out = new ArrayList<>();
    Matcher block = INSTALL_REQUIRES.matcher(content);
    if (block.find()) {
      Matcher q = QUOTED.matcher(block.group(1));
      while (q.find()) {
        addPythonRequirement(out, q.group(1), DependencyType.RUNTIME, fileName);
      }
    }
    return out;
  }

  List<Dependency> parsePyproject(String content, String fileName) throws Exception {
    JsonNode root = toml().readTree(content);
    List<Dependency> out = new ArrayList<>();
    for (JsonNode spec : root.path("project").path("dependencies")) {
      addPythonRequirement(out, spec.asText(), DependencyType.RUNTIME, fileName);
    }
    Iterator<Map.Entry<String, JsonNode>> poetry =
        root.path("tool").path("poetry").path("dependencies").fields();
    while (poetry.hasNext()) {
      Map.Entry<String, JsonNode> e = poetry.next();
      if (e.getKey().equalsIgnoreCase("python")) continue;
      JsonNode v = e.getValue();
      String version = v.isTextual() ? v.asText() : v.path("version").asText(null);
      add(out, e.getKey(), version, DependencyType.RUNTIME, "Python", fileName);
    }
    for (JsonNode spec : root.path("build-system").path("requires")) {
      addPythonRequirement(out, spec.asText(), DependencyType.BUILD, fileName);
    }
    return out;
  }

  List<Dependency> parsePipfile(String content, String fileName) throws Exception {
    JsonNode root = toml().readTree(content);
    List<Dependency> out = new ArrayList<>();
    addTable(out, root.path("packages"), DependencyType.RUNTIME, "Python", fileName);
    addTable(out, root.path("dev-packages"), DependencyType.DEV, "Python", fileName);
    return out;
  }

  List<Dependency> parsePackageJson(String content, String fileName) throws Exception {
    JsonNode root = JacksonUtility.getJsonMapper().readTree(content);
    List<Dependency> out = new ArrayList<>();
    addTable(out, root.path("dependencies"), DependencyType.RUNTIME, "JavaScript", fileName);
    addTable(out, root.path("devDependencies"), DependencyType.DEV, "JavaScript", fileName);
    addTable(out, root.path("peerDependencies"), DependencyType.PEER, "JavaScript", fileName);
    addTable(
        out, root.path("optionalDependencies"), DependencyType.OPTIONAL, "JavaScript", fileName);
    return out;
  }

  List<Dependency> parseGemfile(String content, String fileName) {
    List<Dependency> out = new ArrayList<>();
    for (String raw : content.split("\\R")) {
      Matcher m = GEM.matcher(raw.strip());
      if (m.find()) {
        add(out, m.group(1), m.group(2), DependencyType.RUNTIME, "Ruby", fileName);
      }
    }
    return out;
  }

  List<Dependency> parseCargo(String content, String fileName) throws Exception {
    JsonNode root = toml().readTree(content);
    List<Dependency> out = new ArrayList<>();
    addTable(out, root.path("dependencies"), DependencyType.RUNTIME, "Rust", fileName);
    addTable(out, root.path("dev-dependencies"), DependencyType.DEV, "Rust", fileName);
    addTable(out, root.path("build-dependencies"), DependencyType.BUILD, "Rust", fileName);
    return out;
  }

  List<Dependency> parseGoMod(String content, String fileName) {
    List<Dependency> out = new ArrayList<>();
    boolean inRequire = false;
    for (String raw : content.split("\\R")) {
      String line = raw.strip();
      int comment = line.indexOf("//");
      if (comment >= 0) line = line.substring(0, comment).strip();
      if (line.equals("require (")) {
        inRequire = true;
        continue;
      }
      if (inRequire && line.equals(")")) {
        inRequire = false;
        continue;
      }
      if (line.startsWith("require ")) {
        line = line.substring("require ".length()).strip();
      } else if (!inRequire) {
        continue;
      }
      String[] parts = line.split("\\s+");
      if (parts.length >= 2) {
        add(out, parts[0], parts[1], DependencyType.RUNTIME, "Go", fileName);
      }
    }
    return out;
  }

  List<Dependency> parseComposer(String content, String fileName) throws Exception {
    JsonNode root = JacksonUtility.getJsonMapper().readTree(content);
    List<Dependency> out = new ArrayList<>();
    addTable(out, root.path("require"), DependencyType.RUNTIME, "PHP", fileName);
    addTable(out, root.path("require-dev"), DependencyType.DEV, "PHP", fileName);
    return out;
  }

  // name -> "version" entries; "*" and non-string values carry no version
  private void addTable(
      List<Dependency> out, JsonNode table, DependencyType type, String ecosystem, String file) {
    Iterator<Map.Entry<String, JsonNode>> it = table.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String version = e.getValue().isTextual() ? e.getValue().asText() : null;
      add(out, e.getKey(), version, type, ecosystem, file);
    }
  }

  private void addPythonRequirement(
      List<Dependency> out, String spec, DependencyType type, String fileName) {
    String s = spec;
    int marker = s.indexOf(';');
    if (marker >= 0) s = s.substring(0, marker);
    Matcher m = PYTHON_REQUIREMENT.matcher(s.strip());
    if (!m.matches()) {
      log.debug("Unrecognized requirement '{}' in {}", spec, fileName);
      return;
    }
    String version = m.group(2);
    if (version != null && version.contains(",")) {
      // ">=1.0,<2.0" keeps its first clause
      version = version.substring(0, version.indexOf(','));
    }
    add(out, m.group(1), version, type, "Python", fileName);
  }

  private void add(
      List<Dependency> out,
      String name,
      String rawVersion,
      DependencyType type,
      String ecosystem,
      String fileName) {
    String version = normalizeVersion(rawVersion);
    try {
      out.add(
          new Dependency(
              name.strip(), version, type, ecosystem + " dependency from " + fileName));
    } catch (ValidationException e) {
      log.warn("Dropping dependency '{}' from {}: {}", name, fileName, e.getMessage());
    }
  }

  static String normalizeVersion(String raw) {
    if (raw == null) return null;
    String v = raw.replaceAll("[\\s\"']", "");
    return v.isEmpty() || v.equals("*") ? null : v;
  }

  private static ObjectMapper toml() {
    return JacksonUtility.getTomlMapper();
  }
}
