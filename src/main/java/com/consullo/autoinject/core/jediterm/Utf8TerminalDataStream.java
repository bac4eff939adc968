package com.consullo.autoinject.core.jediterm;

import com.jediterm.terminal.TerminalDataStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * A {@link TerminalDataStream} that decodes PTY bytes as UTF-8.
 *
 * <p>Box-drawing characters (the prompt box corner U+256D among them) arrive as multi-byte
 * sequences that may be split across reads; an incomplete trailing sequence is held back until
 * the next append. Malformed input is replaced with U+FFFD.
 *
 * <p>{@link #getChar()} never blocks: on an empty buffer it throws
 * {@link TerminalDataStream.EOF}, which makes the emulator's {@code hasNext()} return false so
 * the feed loop can return and wait for more bytes.
 */
public final class Utf8TerminalDataStream implements TerminalDataStream {

  private static final int COMPACT_THRESHOLD = 4096;

  private final Object lock = new Object();
  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE);

  private final StringBuilder chars = new StringBuilder();
  private int readPos;
  private ByteBuffer pendingBytes = ByteBuffer.allocate(0);

  /**
   * Append bytes to the stream.
   *
   * @param data byte array
   * @param off offset
   * @param len length
   */
  public void appendBytes(byte[] data, int off, int len) {
    if (data == null) {
      throw new IllegalArgumentException("data must not be null.");
    }
    if (off < 0 || len < 0 || off + len > data.length) {
      throw new IllegalArgumentException("Invalid off/len.");
    }
    synchronized (lock) {
      ByteBuffer in = ByteBuffer.allocate(pendingBytes.remaining() + len);
      in.put(pendingBytes);
      in.put(data, off, len);
      in.flip();

      CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
      decoder.decode(in, out, false);
      out.flip();
      chars.append(out);

      ByteBuffer rest = ByteBuffer.allocate(in.remaining());
      rest.put(in);
      rest.flip();
      pendingBytes = rest;
    }
  }

  @Override
  public char getChar() throws IOException {
    synchronized (lock) {
      if (readPos >= chars.length()) {
        compact();
        throw new TerminalDataStream.EOF();
      }
      return chars.charAt(readPos++);
    }
  }

  @Override
  public void pushChar(char c) throws IOException {
    synchronized (lock) {
      if (readPos > 0) {
        readPos--;
        chars.setCharAt(readPos, c);
      } else {
        chars.insert(0, c);
      }
    }
  }

  @Override
  public String readNonControlCharacters(int maxChars) throws IOException {
    if (maxChars <= 0) {
      return "";
    }
    synchronized (lock) {
      int start = readPos;
      int end = start;
      while (end < chars.length() && end - start < maxChars && !isControl(chars.charAt(end))) {
        end++;
      }
      readPos = end;
      return chars.substring(start, end);
    }
  }

  @Override
  public void pushBackBuffer(char[] buffer, int length) throws IOException {
    synchronized (lock) {
      String pushed = new String(buffer, 0, length);
      if (readPos >= length) {
        readPos -= length;
        chars.replace(readPos, readPos + length, pushed);
      } else {
        chars.insert(readPos, pushed);
      }
    }
  }

  @Override
  public boolean isEmpty() {
    synchronized (lock) {
      return readPos >= chars.length();
    }
  }

  private void compact() {
    if (readPos > COMPACT_THRESHOLD || readPos == chars.length()) {
      chars.delete(0, readPos);
      readPos = 0;
    }
  }

  private static boolean isControl(char c) {
    return c <= 0x1F || c == 0x7F;
  }
}
