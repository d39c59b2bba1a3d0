package ca.gc.cra.opencoffee.infrastructure.slack;

import ca.gc.cra.opencoffee.application.port.ClockPort;
import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link GroupCommunicationPort} backed by the Slack Web API.
 * <p><strong>Role:</strong> Infrastructure adapter; the only component talking to Slack.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Call {@code conversations.list}, {@code conversations.members}, {@code conversations.open},
 *       {@code conversations.history} and {@code chat.postMessage} with a bot token.</li>
 *   <li>Follow {@code response_metadata.next_cursor} pagination, pausing between pages.</li>
 *   <li>Translate transport errors, HTTP errors and {@code ok=false} answers into {@link CommunicationException}.</li>
 *   <li>In test mode, open conversations but never post.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for sequential use; the underlying {@link HttpClient} is thread-safe.</p>
 * <p><strong>Observability:</strong> DEBUG log per API call; the token is never logged.</p>
 *
 * @since 0.1.0
 */
public final class SlackCommunicationAdapter implements GroupCommunicationPort {
  private static final Logger log = LoggerFactory.getLogger(SlackCommunicationAdapter.class);

  /** Public Slack Web API root. */
  public static final URI DEFAULT_BASE_URI = URI.create("https://slack.com/api/");

  private static final int PAGE_LIMIT = 200;
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

  private final HttpClient http;
  private final ObjectMapper mapper = new ObjectMapper();
  private final URI baseUri;
  private final String apiToken;
  private final boolean testMode;
  private final ThrottlePort throttle;
  private final Duration pageDelay;
  private final ClockPort clock;

  /**
   * Creates an adapter.
   *
   * @param http HTTP client; must not be {@code null}
   * @param baseUri Web API root, for example {@link #DEFAULT_BASE_URI}; must not be {@code null}
   * @param apiToken bot token sent as a bearer credential; must not be blank
   * @param testMode when {@code true}, {@link #sendMessage(MemberPair, String)} does not post
   * @param throttle pacing between paginated calls; must not be {@code null}
   * @param pageDelay pause before fetching each additional page
   * @param clock clock used to compute the oldest timestamp of history searches; must not be {@code null}
   */
  public SlackCommunicationAdapter(
      HttpClient http,
      URI baseUri,
      String apiToken,
      boolean testMode,
      ThrottlePort throttle,
      Duration pageDelay,
      ClockPort clock) {
    this.http = Objects.requireNonNull(http, "http");
    this.baseUri = withTrailingSlash(Objects.requireNonNull(baseUri, "baseUri"));
    this.apiToken = Objects.requireNonNull(apiToken, "apiToken");
    if (apiToken.isBlank()) {
      throw new IllegalArgumentException("apiToken must not be blank");
    }
    this.testMode = testMode;
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.pageDelay = Objects.requireNonNullElse(pageDelay, Duration.ZERO);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<String> listPublicChannels() throws CommunicationException {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("types", "public_channel");
    params.put("exclude_archived", "true");
    List<String> channelIds = new ArrayList<>();
    for (JsonNode page : paginate("conversations.list", params)) {
      for (JsonNode channel : page.path("channels")) {
        String id = channel.path("id").asText("");
        if (!id.isEmpty()) {
          channelIds.add(id);
        }
      }
    }
    log.debug("Slack returned {} public channels", channelIds.size());
    return channelIds;
  }

  @Override
  public List<String> listChannelMembers(String channelId, Set<String> excluding) throws CommunicationException {
    Objects.requireNonNull(channelId, "channelId");
    Set<String> skip = excluding == null ? Set.of() : excluding;
    Map<String, String> params = new LinkedHashMap<>();
    params.put("channel", channelId);
    List<String> members = new ArrayList<>();
    for (JsonNode page : paginate("conversations.members", params)) {
      for (JsonNode member : page.path("members")) {
        String id = member.asText("");
        if (!id.isEmpty() && !skip.contains(id)) {
          members.add(id);
        }
      }
    }
    log.debug("Channel {} has {} members after exclusions", channelId, members.size());
    return members;
  }

  @Override
  public boolean hasRecentExchange(MemberPair pair, int withinDays, int messageCountThreshold)
      throws CommunicationException {
    Objects.requireNonNull(pair, "pair");
    if (withinDays < 0) {
      throw new IllegalArgumentException("withinDays must be >= 0");
    }
    if (messageCountThreshold < 1) {
      throw new IllegalArgumentException("messageCountThreshold must be >= 1");
    }
    String conversation = openConversation(pair);
    long oldestMillis = clock.nowMillis() - withinDays * MILLIS_PER_DAY;

    Map<String, String> params = new LinkedHashMap<>();
    params.put("channel", conversation);
    params.put("oldest", String.format(Locale.ROOT, "%.6f", oldestMillis / 1000.0));
    params.put("limit", Integer.toString(messageCountThreshold));
    JsonNode response = call("conversations.history", params);
    int found = response.path("messages").size();
    return found >= messageCountThreshold;
  }

  @Override
  public void sendMessage(MemberPair pair, String text) throws CommunicationException {
    Objects.requireNonNull(pair, "pair");
    Objects.requireNonNull(text, "text");
    String conversation = openConversation(pair);
    if (testMode) {
      log.info("Test mode: message to {} not posted", pair);
      return;
    }
    Map<String, String> params = new LinkedHashMap<>();
    params.put("channel", conversation);
    params.put("text", text);
    call("chat.postMessage", params);
  }

  private String openConversation(MemberPair pair) throws CommunicationException {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("users", pair.first() + "," + pair.second());
    JsonNode response = call("conversations.open", params);
    String id = response.path("channel").path("id").asText("");
    if (id.isEmpty()) {
      throw new CommunicationException("Slack conversations.open returned no channel id for " + pair);
    }
    return id;
  }

  private List<JsonNode> paginate(String method, Map<String, String> baseParams) throws CommunicationException {
    List<JsonNode> pages = new ArrayList<>();
    Map<String, String> params = new LinkedHashMap<>(baseParams);
    params.put("limit", Integer.toString(PAGE_LIMIT));
    while (true) {
      JsonNode page = call(method, params);
      pages.add(page);
      String cursor = page.path("response_metadata").path("next_cursor").asText("");
      if (cursor.isBlank()) {
        return pages;
      }
      pause();
      params.put("cursor", cursor);
    }
  }

  private JsonNode call(String method, Map<String, String> params) throws CommunicationException {
    HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(method))
        .timeout(REQUEST_TIMEOUT)
        .header("Authorization", "Bearer " + apiToken)
        .header("Content-Type", "application/x-www-form-urlencoded; charset=utf-8")
        .POST(HttpRequest.BodyPublishers.ofString(formEncode(params), StandardCharsets.UTF_8))
        .build();
    log.debug("Calling Slack {}", method);

    HttpResponse<String> response;
    try {
      response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new CommunicationException("Slack " + method + " request failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CommunicationException("Slack " + method + " request interrupted", ex);
    }

    int status = response.statusCode();
    if (status == 429) {
      String retryAfter = response.headers().firstValue("Retry-After").orElse("?");
      throw new CommunicationException(
          "Slack " + method + " rate limited (retry after " + retryAfter + "s)", "ratelimited", null);
    }
    if (status / 100 != 2) {
      throw new CommunicationException("Slack " + method + " returned HTTP " + status);
    }

    JsonNode root;
    try {
      root = mapper.readTree(response.body());
    } catch (IOException ex) {
      throw new CommunicationException("Slack " + method + " returned malformed JSON", ex);
    }
    if (root == null || !root.path("ok").asBoolean(false)) {
      String error = root == null ? "empty_response" : root.path("error").asText("unknown_error");
      throw new CommunicationException("Slack " + method + " failed: " + error, error, null);
    }
    return root;
  }

  private void pause() throws CommunicationException {
    try {
      throttle.pause(pageDelay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CommunicationException("Interrupted while paging Slack results", ex);
    }
  }

  private static String formEncode(Map<String, String> params) {
    StringJoiner joiner = new StringJoiner("&");
    for (Map.Entry<String, String> entry : params.entrySet()) {
      joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
          + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
    }
    return joiner.toString();
  }

  private static URI withTrailingSlash(URI uri) {
    String raw = uri.toString();
    return raw.endsWith("/") ? uri : URI.create(raw + "/");
  }
}
