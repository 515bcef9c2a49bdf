package com.flamingo.ai.ragpipeline.service.rag.chunking;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.PageText;
import com.flamingo.ai.ragpipeline.service.rag.model.TextChunk;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits a document's joined page text into overlapping, token-bounded chunks.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>From the current start, find the furthest word end whose span still fits the token window.
 *   <li>If a paragraph break, or failing that a sentence end, lies within the tolerance band below
 *       the window, end the chunk there instead.
 *   <li>A single word that does not fit the window is cut at a character position.
 *   <li>The next chunk starts at the earliest word whose span up to the previous end fits the
 *       overlap budget.
 * </ol>
 *
 * <p>Chunk text is always {@code text.substring(start, end)}, so it never contains leading or
 * trailing whitespace and is reproducible from the document text and offsets.
 */
@Component
@Slf4j
public class TokenWindowChunker {

  private final TokenCounter tokenCounter;
  private final int window;
  private final int overlap;
  private final int minBreakTokens;

  @Autowired
  public TokenWindowChunker(TokenCounter tokenCounter, RagConfig ragConfig) {
    this(
        tokenCounter,
        ragConfig.getChunking().getSize(),
        ragConfig.getChunking().getOverlap(),
        ragConfig.getChunking().getMaxTokens(),
        ragConfig.getChunking().getBoundaryTolerance());
  }

  @VisibleForTesting
  public TokenWindowChunker(
      TokenCounter tokenCounter, int chunkSize, int overlap, int maxTokens, double tolerance) {
    if (chunkSize <= 0 || maxTokens <= 0) {
      throw new IllegalArgumentException("Chunk size and max tokens must be positive");
    }
    if (overlap < 0 || overlap >= Math.min(chunkSize, maxTokens)) {
      throw new IllegalArgumentException(
          "Overlap must be non-negative and smaller than the chunk size: " + overlap);
    }
    this.tokenCounter = tokenCounter;
    this.window = Math.min(chunkSize, maxTokens);
    this.overlap = overlap;
    this.minBreakTokens = window - (int) Math.floor(window * tolerance);
  }

  /**
   * Chunks one extracted document.
   *
   * @param document the document whose {@code text} is split
   * @return chunks in document order; empty for blank text
   */
  public List<TextChunk> chunk(ExtractedDocument document) {
    String text = document.text();
    if (text == null || text.isBlank()) {
      log.debug("Document {} has no text, no chunks produced", document.documentId());
      return List.of();
    }

    Words words = Words.of(text);
    int[] pageStarts = pageStarts(document);
    List<TextChunk> chunks = new ArrayList<>();

    int start = words.starts[0];
    int previousEnd = -1;
    while (start < text.length()) {
      int firstWord = words.firstEndingAfter(start);
      boolean cutInsideWord = false;
      int end;
      if (fits(text, start, text.length())) {
        end = text.length();
      } else if (!fits(text, start, words.ends[firstWord])) {
        end = cutInsideWord(text, start, words.ends[firstWord]);
        cutInsideWord = true;
      } else {
        int lastWord = furthestFittingWord(text, words, start, firstWord);
        end = preferredBreak(text, words, start, firstWord, lastWord);
      }

      if (end <= previousEnd) {
        // the overlap left no room for new text; restart at the previous end
        start = words.firstStartAtOrAfter(previousEnd, text.length());
        continue;
      }

      String chunkText = text.substring(start, end);
      int ordinal = chunks.size();
      chunks.add(
          new TextChunk(
              TextChunk.chunkId(document.documentId(), ordinal),
              document.documentId(),
              document.fileName(),
              document.downloadLink(),
              ordinal,
              chunkText,
              tokenCounter.count(chunkText),
              start,
              end,
              pageOf(pageStarts, start),
              pageOf(pageStarts, end - 1)));

      if (end >= text.length()) {
        break;
      }
      previousEnd = end;
      start = cutInsideWord ? end : nextStart(text, words, start, end);
    }

    log.debug(
        "Chunked document {} into {} chunks (window={}, overlap={})",
        document.documentId(),
        chunks.size(),
        window,
        overlap);
    return chunks;
  }

  private boolean fits(String text, int start, int end) {
    return tokenCounter.count(text.substring(start, end)) <= window;
  }

  /** Largest word index in {@code [firstWord, n)} whose end still fits; firstWord must fit. */
  private int furthestFittingWord(String text, Words words, int start, int firstWord) {
    int lo = firstWord;
    int hi = words.size() - 1;
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (fits(text, start, words.ends[mid])) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return lo;
  }

  private int preferredBreak(String text, Words words, int start, int firstWord, int lastWord) {
    int lowest = lowestWordReaching(text, words, start, firstWord, lastWord);
    for (int i = lastWord; i >= lowest; i--) {
      if (words.followedByNewline(text, i)) {
        return words.ends[i];
      }
    }
    for (int i = lastWord; i >= lowest; i--) {
      if (isSentenceEnd(text.charAt(words.ends[i] - 1))) {
        return words.ends[i];
      }
    }
    return words.ends[lastWord];
  }

  /** Smallest word index whose span from {@code start} reaches the break threshold. */
  private int lowestWordReaching(
      String text, Words words, int start, int firstWord, int lastWord) {
    int lo = firstWord;
    int hi = lastWord;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (tokenCounter.count(text.substring(start, words.ends[mid])) >= minBreakTokens) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    return lo;
  }

  private int cutInsideWord(String text, int start, int wordEnd) {
    int lo = start + 1;
    int hi = wordEnd - 1;
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (fits(text, start, mid)) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    if (lo > start + 1 && lo < text.length() && Character.isLowSurrogate(text.charAt(lo))) {
      lo--;
    }
    return lo;
  }

  private int nextStart(String text, Words words, int start, int end) {
    int next = words.firstStartAtOrAfter(end, text.length());
    if (overlap == 0) {
      return next;
    }
    int lo = words.firstStartingAfter(start);
    int hi = words.lastStartingBefore(end);
    if (lo < 0 || hi < lo) {
      return next;
    }
    if (tokenCounter.count(text.substring(words.starts[hi], end)) > overlap) {
      return next;
    }
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (tokenCounter.count(text.substring(words.starts[mid], end)) <= overlap) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    return words.starts[lo];
  }

  private static boolean isSentenceEnd(char c) {
    return c == '.' || c == '!' || c == '?';
  }

  /** Start offset of each page within the stripped joined text. */
  private static int[] pageStarts(ExtractedDocument document) {
    List<PageText> pages = document.pages();
    if (pages.isEmpty()) {
      return new int[] {0};
    }
    StringBuilder joined = new StringBuilder();
    int[] rawStarts = new int[pages.size()];
    for (int i = 0; i < pages.size(); i++) {
      if (i > 0) {
        joined.append('\n');
      }
      rawStarts[i] = joined.length();
      joined.append(pages.get(i).text());
    }
    int lead = 0;
    while (lead < joined.length() && Character.isWhitespace(joined.charAt(lead))) {
      lead++;
    }
    int[] starts = new int[rawStarts.length];
    for (int i = 0; i < rawStarts.length; i++) {
      starts[i] = Math.max(0, rawStarts[i] - lead);
    }
    return starts;
  }

  private static int pageOf(int[] pageStarts, int offset) {
    int page = 0;
    for (int i = 0; i < pageStarts.length; i++) {
      if (pageStarts[i] <= offset) {
        page = i;
      } else {
        break;
      }
    }
    return page;
  }

  /** Offsets of the maximal non-whitespace runs of a text. */
  private static final class Words {
    private final int[] starts;
    private final int[] ends;

    private Words(int[] starts, int[] ends) {
      this.starts = starts;
      this.ends = ends;
    }

    static Words of(String text) {
      List<Integer> starts = new ArrayList<>();
      List<Integer> ends = new ArrayList<>();
      int i = 0;
      while (i < text.length()) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
          i++;
        }
        if (i >= text.length()) {
          break;
        }
        starts.add(i);
        while (i < text.length() && !Character.isWhitespace(text.charAt(i))) {
          i++;
        }
        ends.add(i);
      }
      return new Words(
          starts.stream().mapToInt(Integer::intValue).toArray(),
          ends.stream().mapToInt(Integer::intValue).toArray());
    }

    int size() {
      return starts.length;
    }

    int firstEndingAfter(int offset) {
      int lo = 0;
      int hi = ends.length - 1;
      while (lo < hi) {
        int mid = (lo + hi) >>> 1;
        if (ends[mid] > offset) {
          hi = mid;
        } else {
          lo = mid + 1;
        }
      }
      return lo;
    }

    /** Index of the first word starting strictly after {@code offset}, or -1. */
    int firstStartingAfter(int offset) {
      for (int i = 0; i < starts.length; i++) {
        if (starts[i] > offset) {
          return i;
        }
      }
      return -1;
    }

    /** Index of the last word starting strictly before {@code offset}, or -1. */
    int lastStartingBefore(int offset) {
      for (int i = starts.length - 1; i >= 0; i--) {
        if (starts[i] < offset) {
          return i;
        }
      }
      return -1;
    }

    int firstStartAtOrAfter(int offset, int fallback) {
      for (int start : starts) {
        if (start >= offset) {
          return start;
        }
      }
      return fallback;
    }

    boolean followedByNewline(String text, int wordIndex) {
      int limit = wordIndex + 1 < starts.length ? starts[wordIndex + 1] : text.length();
      for (int i = ends[wordIndex]; i < limit; i++) {
        if (text.charAt(i) == '\n') {
          return true;
        }
      }
      return false;
    }
  }
}
