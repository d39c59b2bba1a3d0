package ca.gc.cra.opencoffee.application.port;

import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Port to the chat service that hosts the group being paired.
 * <p><strong>Role:</strong> Domain port consumed by pairing strategies and the invitation/reminder use cases;
 * implemented by {@code SlackCommunicationAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate public channels and their members, hiding pagination.</li>
 *   <li>Detect a recent direct exchange between two members.</li>
 *   <li>Deliver a message to a two-member conversation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Callers invoke the port from a single thread, one call at a time.</p>
 * <p><strong>Performance:</strong> Every method is a blocking remote round trip; callers pace successive calls.</p>
 *
 * @implNote Every failure surfaces as {@link CommunicationException}; implementations never guess a result.
 * @since 0.1.0
 */
public interface GroupCommunicationPort {

  /** Message count that marks a pair as having a recent exchange during invitation runs. */
  int DEFAULT_MESSAGE_THRESHOLD = 1;

  /**
   * Lists the identifiers of every public, non-archived channel visible to the service account.
   *
   * @return channel identifiers
   * @throws CommunicationException when the remote call fails
   */
  List<String> listPublicChannels() throws CommunicationException;

  /**
   * Lists the members of a channel.
   *
   * @param channelId channel identifier; must not be {@code null}
   * @param excluding members removed from the answer; may be empty
   * @return members of the channel, in service order
   * @throws CommunicationException when the remote call fails
   */
  List<String> listChannelMembers(String channelId, Set<String> excluding) throws CommunicationException;

  /**
   * Determines whether the pair exchanged at least {@code messageCountThreshold} messages within the window.
   *
   * @param pair members to inspect; must not be {@code null}
   * @param withinDays window size in days; {@code >= 0}
   * @param messageCountThreshold minimum number of messages that counts as a recent exchange; {@code >= 1}
   * @return {@code true} when a recent exchange exists
   * @throws CommunicationException when the remote call fails
   */
  boolean hasRecentExchange(MemberPair pair, int withinDays, int messageCountThreshold)
      throws CommunicationException;

  /**
   * Determines whether the pair exchanged any message within the window.
   *
   * @param pair members to inspect
   * @param withinDays window size in days
   * @return {@code true} when at least one message exists
   * @throws CommunicationException when the remote call fails
   */
  default boolean hasRecentExchange(MemberPair pair, int withinDays) throws CommunicationException {
    return hasRecentExchange(pair, withinDays, DEFAULT_MESSAGE_THRESHOLD);
  }

  /**
   * Sends a message to the conversation shared by the pair.
   *
   * @param pair recipients; must not be {@code null}
   * @param text message body
   * @throws CommunicationException when the remote call fails
   */
  void sendMessage(MemberPair pair, String text) throws CommunicationException;
}
