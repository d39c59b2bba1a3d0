package ca.gc.cra.opencoffee.infrastructure.history;

import ca.gc.cra.opencoffee.application.port.ClockPort;
import ca.gc.cra.opencoffee.application.port.PairHistoryPort;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stores each invitation round as a JSON array of two-element member arrays.
 * <p><strong>Role:</strong> {@link PairHistoryPort} adapter over a local directory.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Name files {@code yyyyMMdd-HHmm-<config>[-TESTMODE].json} so names sort chronologically.</li>
 *   <li>Pick the newest file for the same configuration and mode by reverse name order.</li>
 *   <li>Reject malformed history documents with {@link IOException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run writes or reads at a time.</p>
 *
 * @implNote Names must keep the sortable timestamp prefix; {@link #loadLatest()} relies on it.
 * @since 0.1.0
 */
public final class JsonPairHistoryAdapter implements PairHistoryPort {
  private static final Logger log = LoggerFactory.getLogger(JsonPairHistoryAdapter.class);
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm");
  private static final String TEST_MODE_MARKER = "-TESTMODE";
  private static final String EXTENSION = ".json";

  private final JsonFactory factory = new JsonFactory();
  private final Path directory;
  private final String tail;
  private final Pattern namePattern;
  private final ClockPort clock;
  private final ZoneId zone;

  /**
   * Creates an adapter.
   *
   * @param directory directory holding history files; created on first save
   * @param configName file name of the configuration in use, so each configuration keeps its own history
   * @param testMode whether the run is in test mode; test-mode histories are kept apart
   * @param clock clock used for the timestamp prefix
   * @param zone time zone of the timestamp prefix
   */
  public JsonPairHistoryAdapter(
      Path directory, String configName, boolean testMode, ClockPort clock, ZoneId zone) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
    String config = Objects.requireNonNull(configName, "configName").trim();
    if (config.isEmpty() || config.contains("/") || config.contains("\\")) {
      throw new IllegalArgumentException("configName must be a plain file name: " + configName);
    }
    this.tail = config + (testMode ? TEST_MODE_MARKER : "") + EXTENSION;
    this.namePattern = Pattern.compile("^\\d{8}-\\d{4}-" + Pattern.quote(tail) + "$");
  }

  /**
   * Returns the file name that a save at the current clock time would use.
   *
   * @return history file name
   */
  public String currentFileName() {
    return TIMESTAMP.format(Instant.ofEpochMilli(clock.nowMillis()).atZone(zone)) + "-" + tail;
  }

  @Override
  public Path save(List<MemberPair> pairs) throws IOException {
    Objects.requireNonNull(pairs, "pairs");
    Files.createDirectories(directory);
    Path target = directory.resolve(currentFileName());
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        JsonGenerator generator = factory.createGenerator(writer)) {
      generator.writeStartArray();
      for (MemberPair pair : pairs) {
        generator.writeStartArray();
        generator.writeString(pair.first());
        generator.writeString(pair.second());
        generator.writeEndArray();
      }
      generator.writeEndArray();
    }
    log.info("Saved {} pairs to {}", pairs.size(), target);
    return target;
  }

  @Override
  public Optional<PairHistory> loadLatest() throws IOException {
    if (!Files.isDirectory(directory)) {
      log.debug("History directory {} does not exist", directory);
      return Optional.empty();
    }
    Optional<Path> latest;
    try (Stream<Path> files = Files.list(directory)) {
      latest = files
          .filter(Files::isRegularFile)
          .filter(path -> namePattern.matcher(path.getFileName().toString()).matches())
          .max(Comparator.comparing(path -> path.getFileName().toString()));
    }
    if (latest.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new PairHistory(latest.get(), read(latest.get())));
  }

  private List<MemberPair> read(Path file) throws IOException {
    List<MemberPair> pairs = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        JsonParser parser = factory.createParser(reader)) {
      expect(parser.nextToken(), JsonToken.START_ARRAY, file);
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        expect(token, JsonToken.START_ARRAY, file);
        String first = readMember(parser, file);
        String second = readMember(parser, file);
        expect(parser.nextToken(), JsonToken.END_ARRAY, file);
        try {
          pairs.add(new MemberPair(first, second));
        } catch (IllegalArgumentException ex) {
          throw new IOException("Invalid pair in " + file + ": " + ex.getMessage(), ex);
        }
      }
    } catch (JsonParseException ex) {
      throw new IOException("Malformed history file " + file, ex);
    }
    return pairs;
  }

  private static String readMember(JsonParser parser, Path file) throws IOException {
    expect(parser.nextToken(), JsonToken.VALUE_STRING, file);
    return parser.getText();
  }

  private static void expect(JsonToken actual, JsonToken expected, Path file) throws IOException {
    if (actual != expected) {
      throw new IOException("Malformed history file " + file + ": expected " + expected + " but found " + actual);
    }
  }
}
