package com.gentoro.specops.extract;

import com.gentoro.specops.exception.ValidationException;
import com.gentoro.specops.markdown.MarkdownDocument;
import com.gentoro.specops.model.Dependency;
import com.gentoro.specops.model.DependencyType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds packages named in installer commands ({@code pip install x==1.0}, {@code npm install
 * y}, ...). Only the first package after each installer command is taken. Version comparators
 * are kept in the version string.
 */
public class DependencyExtractor implements ContentExtractor<Dependency> {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(DependencyExtractor.class);

  public record InstallerRule(String command, Pattern pattern, DependencyType type) {}

  public static final List<InstallerRule> INSTALLERS =
      List.of(
          installer("pip install", DependencyType.RUNTIME),
          installer("npm install", DependencyType.RUNTIME),
          installer("yarn add", DependencyType.RUNTIME),
          installer("gem install", DependencyType.RUNTIME),
          installer("apt-get install", DependencyType.RUNTIME),
          installer("brew install", DependencyType.RUNTIME));

  private static final List<String> COMPARATORS = List.of("==", ">=", "<=");

  private static InstallerRule installer(String command, DependencyType type) {
    String regex = Pattern.quote(command).replace(" ", "\\E\\s+\\Q") + "\\s+(\\S+)";
    return new InstallerRule(command, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), type);
  }

  @Override
  public List<Dependency> extract(MarkdownDocument document) {
    List<Dependency> out = new ArrayList<>();
    String content = document.content();
    for (InstallerRule rule : INSTALLERS) {
      Matcher m = rule.pattern().matcher(content);
      while (m.find()) {
        parse(m.group(1), rule.type(), document.path()).ifPresent(out::add);
      }
    }
    return out;
  }

  static Optional<Dependency> parse(String rawSpec, DependencyType type, String path) {
    String spec = cleanSpec(rawSpec);
    // flags such as "-r requirements.txt" or "-e ." name no package
    if (spec.isEmpty() || spec.startsWith("-")) return Optional.empty();

    int cut = spec.length();
    String version = null;
    for (String op : COMPARATORS) {
      int idx = spec.indexOf(op);
      if (idx < 0) continue;
      cut = Math.min(cut, idx);
      if (version == null) {
        // ranges such as ">=2.0,<3" keep their first clause
        String rest = spec.substring(idx + op.length()).split(",", 2)[0].strip();
        version = rest.isEmpty() ? null : op + rest;
      }
    }
    String name = spec.substring(0, cut).strip();
    try {
      return Optional.of(new Dependency(name, version, type, "Dependency found in " + path));
    } catch (ValidationException e) {
      log.debug("Ignoring package spec '{}' in {}: {}", rawSpec, path, e.getMessage());
      return Optional.empty();
    }
  }

  private static String cleanSpec(String raw) {
    String s = raw.replace("`", "").replace("\"", "").replace("'", "").strip();
    while (!s.isEmpty() && ".,;:)".indexOf(s.charAt(s.length() - 1)) >= 0) {
      s = s.substring(0, s.length() - 1);
    }
    return s;
  }
}
