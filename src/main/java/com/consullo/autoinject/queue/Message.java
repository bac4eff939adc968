package com.consullo.autoinject.queue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.Validate;

/**
 * A queued message bound to one session.
 *
 * <p>Delivery order is {@code (executeAt, sequence)} ascending; {@code sequence} only breaks ties.
 *
 * @param id unique for the lifetime of the queue
 * @param content text entered by the user
 * @param processedContent text actually typed: attachment paths followed by the content
 * @param targetSessionId session the message is for
 * @param createdAt enqueue time
 * @param executeAt earliest dispatch time
 * @param sequence strictly increasing tie-break
 * @param flags markers
 * @param attachments referenced files
 * @since 1.0
 */
public record Message(
    long id,
    String content,
    String processedContent,
    int targetSessionId,
    Instant createdAt,
    Instant executeAt,
    long sequence,
    Set<MessageFlag> flags,
    List<Attachment> attachments) {

  /** Delivery order. */
  public static final Comparator<Message> DELIVERY_ORDER =
      Comparator.comparing(Message::executeAt).thenComparingLong(Message::sequence);

  public Message {
    Validate.notNull(content, "content must not be null");
    Validate.notNull(createdAt, "createdAt must not be null");
    Validate.notNull(executeAt, "executeAt must not be null");
    flags = flags == null || flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
    attachments = attachments != null ? List.copyOf(attachments) : List.of();
    if (processedContent == null) {
      processedContent = process(content, attachments);
    }
  }

  /**
   * Builds the typed text: quoted image paths, then other files, then the content.
   *
   * @param content message text
   * @param attachments referenced files
   * @return text to type
   */
  public static String process(final String content, final List<Attachment> attachments) {
    if (attachments == null || attachments.isEmpty()) {
      return content;
    }
    final List<String> parts = new ArrayList<>(attachments.size() + 1);
    for (final Attachment a : attachments) {
      if (a.image()) {
        parts.add(a.quoted());
      }
    }
    for (final Attachment a : attachments) {
      if (!a.image()) {
        parts.add(a.quoted());
      }
    }
    parts.add(content);
    return String.join(" ", parts);
  }

  public boolean hasFlag(final MessageFlag flag) {
    return flags.contains(flag);
  }

  Message withContent(final String newContent) {
    return new Message(id, newContent, process(newContent, attachments), targetSessionId, createdAt, executeAt,
        sequence, flags, attachments);
  }

  Message withSlot(final Instant newExecuteAt, final long newSequence) {
    return new Message(id, content, processedContent, targetSessionId, createdAt, newExecuteAt, newSequence,
        flags, attachments);
  }

  /**
   * Short form for logs.
   *
   * @return preview of the content
   */
  public String preview() {
    final String oneLine = content.replace('\n', ' ').replace('\r', ' ');
    return oneLine.length() <= 40 ? oneLine : oneLine.substring(0, 37) + "...";
  }
}
