package ca.gc.cra.apkrisk.infrastructure.intel;

import ca.gc.cra.apkrisk.application.port.EndpointReputation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EndpointReputation} backed by local threat-intelligence feeds.
 * <p><strong>Format:</strong> one IP address or domain per line (Maltrail or AbuseIPDB exports); blank lines
 * and lines starting with {@code #} are ignored. Entries containing a letter are treated as domains and
 * matched case-insensitively; everything else is matched as an IP literal.</p>
 * <p><strong>Thread-safety:</strong> Immutable after loading.</p>
 *
 * @since 0.1.0
 */
public final class FeedEndpointReputation implements EndpointReputation {
  private static final Logger log = LoggerFactory.getLogger(FeedEndpointReputation.class);

  private final Set<String> badIps;
  private final Set<String> badDomains;

  FeedEndpointReputation(Set<String> badIps, Set<String> badDomains) {
    this.badIps = Set.copyOf(badIps);
    this.badDomains = Set.copyOf(badDomains);
  }

  /**
   * Loads indicators from feed files. Missing files are logged and skipped.
   *
   * @param feeds feed file paths
   * @return reputation lookup over every loaded indicator
   * @throws IOException if an existing feed cannot be read
   */
  public static FeedEndpointReputation load(List<Path> feeds) throws IOException {
    Objects.requireNonNull(feeds, "feeds");
    Set<String> ips = new HashSet<>();
    Set<String> domains = new HashSet<>();
    for (Path feed : feeds) {
      if (!Files.exists(feed)) {
        log.warn("Threat intelligence feed {} not found; skipping", feed);
        continue;
      }
      int loaded = 0;
      for (String line : Files.readAllLines(feed, StandardCharsets.UTF_8)) {
        String entry = line.strip();
        if (entry.isEmpty() || entry.startsWith("#")) {
          continue;
        }
        if (entry.chars().anyMatch(Character::isLetter)) {
          domains.add(normalizeDomain(entry));
        } else {
          ips.add(entry);
        }
        loaded++;
      }
      log.info("Loaded {} indicators from {}", loaded, feed);
    }
    return new FeedEndpointReputation(ips, domains);
  }

  @Override
  public boolean isMalicious(String host) {
    if (host == null || host.isBlank()) {
      return false;
    }
    String candidate = host.strip();
    return badIps.contains(candidate) || badDomains.contains(normalizeDomain(candidate));
  }

  /**
   * Returns the number of loaded indicators.
   *
   * @return IP and domain indicator count
   */
  public int size() {
    return badIps.size() + badDomains.size();
  }

  private static String normalizeDomain(String domain) {
    String lower = domain.toLowerCase(Locale.ROOT);
    return lower.endsWith(".") ? lower.substring(0, lower.length() - 1) : lower;
  }
}
